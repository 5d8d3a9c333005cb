package com.sailfish.retry.model;

/**
 * Why a retry loop stopped retrying a retryable failure. The failure itself is
 * what the caller receives; this only names the stopping condition.
 */
public enum Exhaustion {
    /**
     * The configured number of retries has been used up.
     */
    COUNT,
    /**
     * The overall retry deadline of the call has passed.
     */
    PRIMARY_DEADLINE,
    /**
     * The window opened by the first failure of a class with its own deadline has closed.
     */
    SECONDARY_DEADLINE
}
