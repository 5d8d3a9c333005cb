/**
 * The blocking retry driver {@link com.sailfish.retry.sync.Retry}, its
 * {@link com.sailfish.retry.sync.RetryListener} callbacks and the map-based
 * {@link com.sailfish.retry.sync.RetryConfig}.
 */
package com.sailfish.retry.sync;
