package com.sailfish.retry.clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Source of the current time and of the two wait primitives used by the retry drivers.
 *
 * The blocking {@link #sleep(Duration)} is used by the synchronous driver, the
 * cooperative {@link #suspend(Duration)} by the asynchronous one. Tests substitute
 * an implementation that advances simulated time instead of waiting.
 */
public interface RetryClock {

    /**
     * @return the current instant.
     */
    Instant now();

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration How long to wait. Zero or negative durations return immediately.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Waits for the given duration without occupying a thread.
     *
     * @param duration How long to wait. Zero or negative durations complete immediately.
     * @return A future completed once the duration has elapsed.
     */
    CompletableFuture<Void> suspend(Duration duration);

    /**
     * @return the shared real-time clock.
     */
    static RetryClock system() {
        return SystemClock.shared();
    }
}
