package com.sailfish.retry.backoff;

import java.time.Duration;

/**
 * Decides, after a failed attempt, how long to wait before the next one or that
 * retrying should stop.
 *
 * A driver brackets each retry loop with exactly one {@link #enterLoop()} and
 * exactly one {@link #exitLoop()}, whatever the outcome. Implementations keep
 * per-loop state and are not meant to be shared by concurrently running loops.
 */
public interface Backoff {

    /**
     * Returns the wait before the next attempt, or rethrows {@code failure} to stop.
     *
     * @param failure The failure of the attempt that just ran.
     * @param <E> The failure type, rethrown unchanged.
     * @return The duration to wait before trying again.
     * @throws E the given failure, when no further attempt should be made.
     */
    <E extends Throwable> Duration nextSleepOrRethrow(E failure) throws E;

    /**
     * Called once when a retry loop starts, before the first attempt.
     */
    default void enterLoop() {
    }

    /**
     * Called once when a retry loop ends, on success and on failure alike.
     */
    default void exitLoop() {
    }
}
