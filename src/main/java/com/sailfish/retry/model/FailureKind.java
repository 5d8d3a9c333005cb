package com.sailfish.retry.model;

/**
 * How a failure is treated by a retry driver.
 */
public enum FailureKind {
    /**
     * The failure may be retried, subject to the loop's stopping conditions.
     */
    RETRYABLE,
    /**
     * The failure is propagated on first occurrence without any wait.
     */
    FATAL
}
