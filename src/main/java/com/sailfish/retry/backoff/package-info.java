/**
 * Backoff policies: the {@link com.sailfish.retry.backoff.Backoff} contract, the
 * {@link com.sailfish.retry.backoff.ExponentialBackoff} leaf policy, and the
 * {@link com.sailfish.retry.backoff.FilteredBackoff} and
 * {@link com.sailfish.retry.backoff.RetryLoopLoggingBackoff} decorators.
 */
package com.sailfish.retry.backoff;
