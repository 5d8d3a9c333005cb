package com.sailfish.retry.sync;

import com.sailfish.retry.model.Exhaustion;

import java.time.Duration;

/**
 * Receives lifecycle notifications from a {@link Retry} call.
 *
 * Notifications are informational: an exception thrown by a listener is logged
 * and does not change whether or how the call is retried.
 */
public interface RetryListener {

    RetryListener NO_OP = new RetryListener() {
    };

    /**
     * A retryable failure occurred and the call will be attempted again.
     *
     * @param failure The failure of the last attempt.
     * @param retry The 1-based number of the retry about to happen.
     * @param sleep The wait before that retry.
     */
    default void onRetrying(Throwable failure, int retry, Duration sleep) {
    }

    /**
     * The call succeeded after at least one failed attempt.
     *
     * @param retries Number of retries it took.
     * @param elapsed Time since the call started.
     */
    default void onRecovered(int retries, Duration elapsed) {
    }

    /**
     * A retryable failure is being propagated because a stopping condition was reached.
     */
    default void onGaveUp(Throwable failure, Exhaustion exhaustion) {
    }
}
