package com.sailfish.retry.backoff;

import com.sailfish.retry.clock.RetryClock;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A backoff whose waits double from {@code initialSleep} up to {@code maxSleep}.
 *
 * Stops when {@code maxRetries} waits have been handed out or when the clock has
 * reached {@code timeoutAt}. The deadline is checked before a wait is returned, so
 * a loop can end up to one wait past it; size {@code maxSleep} accordingly.
 *
 * Instances are not thread-safe. {@link #enterLoop()} and {@link #reset()} restart
 * the schedule.
 */
public class ExponentialBackoff implements Backoff {

    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoff.class);

    private final Duration initialSleep;
    private final Duration maxSleep;
    private final Integer maxRetries;
    private final Instant timeoutAt;
    private final RetryClock clock;

    private int attempts;
    private Duration currentSleep;

    /**
     * Creates an unbounded backoff: it never gives up on its own.
     *
     * @param initialSleep The first wait.
     * @param maxSleep Cap for every subsequent wait.
     */
    public ExponentialBackoff(Duration initialSleep, Duration maxSleep) {
        this(initialSleep, maxSleep, null, null, RetryClock.system());
    }

    public ExponentialBackoff(Duration initialSleep, Duration maxSleep,
                              @Nullable Integer maxRetries, @Nullable Instant timeoutAt) {
        this(initialSleep, maxSleep, maxRetries, timeoutAt, RetryClock.system());
    }

    /**
     * Creates a configurable ExponentialBackoff.
     *
     * @param initialSleep The first wait. Must be positive.
     * @param maxSleep Cap for every wait. Must not be shorter than {@code initialSleep}.
     * @param maxRetries Number of waits handed out before giving up, or null for no limit.
     * @param timeoutAt Instant from which no more waits are handed out, or null for no deadline.
     * @param clock Clock used for the deadline check.
     */
    public ExponentialBackoff(Duration initialSleep, Duration maxSleep,
                              @Nullable Integer maxRetries, @Nullable Instant timeoutAt,
                              RetryClock clock) {
        Objects.requireNonNull(initialSleep, "initialSleep cannot be null");
        Objects.requireNonNull(maxSleep, "maxSleep cannot be null");
        if (initialSleep.isNegative() || initialSleep.isZero()) {
            throw new IllegalArgumentException("initialSleep must be positive");
        }
        if (maxSleep.compareTo(initialSleep) < 0) {
            throw new IllegalArgumentException("maxSleep must not be shorter than initialSleep");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        this.initialSleep = initialSleep;
        this.maxSleep = maxSleep;
        this.maxRetries = maxRetries;
        this.timeoutAt = timeoutAt;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public <E extends Throwable> Duration nextSleepOrRethrow(E failure) throws E {
        if (maxRetries != null && attempts >= maxRetries) {
            log.debug("Giving up after {} retries: {}", attempts, failure.toString());
            throw failure;
        }
        if (timeoutAt != null && !clock.now().isBefore(timeoutAt)) {
            log.debug("Giving up, deadline {} reached after {} retries: {}", timeoutAt, attempts, failure.toString());
            throw failure;
        }

        attempts++;
        if (currentSleep == null) {
            currentSleep = initialSleep;
        } else {
            Duration doubled = currentSleep.multipliedBy(2);
            currentSleep = doubled.compareTo(maxSleep) > 0 ? maxSleep : doubled;
        }
        return currentSleep;
    }

    @Override
    public void enterLoop() {
        reset();
    }

    /**
     * Forgets the waits handed out so far; the next call returns {@code initialSleep} again.
     */
    public void reset() {
        attempts = 0;
        currentSleep = null;
    }

    // --- Getters for configuration and state ---
    public Duration getInitialSleep() { return initialSleep; }
    public Duration getMaxSleep() { return maxSleep; }
    public Integer getMaxRetries() { return maxRetries; }
    public Instant getTimeoutAt() { return timeoutAt; }
    public int getAttempts() { return attempts; }
}
