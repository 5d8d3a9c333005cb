/**
 * The non-blocking retry driver {@link com.sailfish.retry.async.AsyncRetry}.
 */
package com.sailfish.retry.async;
