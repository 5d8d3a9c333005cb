/**
 * Retry and backoff engine.
 *
 * Failures are retried either by the blocking {@link com.sailfish.retry.sync.Retry}
 * driver or by {@link com.sailfish.retry.async.AsyncRetry}, which waits without
 * holding a thread and delegates every decision to a
 * {@link com.sailfish.retry.backoff.Backoff}. Time is read through
 * {@link com.sailfish.retry.clock.RetryClock} so it can be simulated.
 */
package com.sailfish.retry;
