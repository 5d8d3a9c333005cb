package com.sailfish.retry.backoff;

import com.sailfish.retry.clock.RetryClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reports when a retry loop starts failing and how long it kept failing.
 *
 * {@code onLoopStart} receives the first failure seen after {@link #enterLoop()};
 * {@code onLoopEnd} receives, on {@link #exitLoop()}, the time elapsed since that
 * failure. A loop without failures triggers neither. Exceptions thrown by the
 * callbacks are logged and otherwise ignored.
 */
public class RetryLoopLoggingBackoff implements Backoff {

    private static final Logger log = LoggerFactory.getLogger(RetryLoopLoggingBackoff.class);

    private final Backoff wrapped;
    private final Consumer<? super Throwable> onLoopStart;
    private final Consumer<? super Duration> onLoopEnd;
    private final RetryClock clock;

    private Throwable firstFailure;
    private Instant firstFailureAt;

    public RetryLoopLoggingBackoff(Backoff wrapped,
                                   Consumer<? super Throwable> onLoopStart,
                                   Consumer<? super Duration> onLoopEnd) {
        this(wrapped, onLoopStart, onLoopEnd, RetryClock.system());
    }

    public RetryLoopLoggingBackoff(Backoff wrapped,
                                   Consumer<? super Throwable> onLoopStart,
                                   Consumer<? super Duration> onLoopEnd,
                                   RetryClock clock) {
        this.wrapped = Objects.requireNonNull(wrapped, "wrapped cannot be null");
        this.onLoopStart = Objects.requireNonNull(onLoopStart, "onLoopStart cannot be null");
        this.onLoopEnd = Objects.requireNonNull(onLoopEnd, "onLoopEnd cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public void enterLoop() {
        firstFailure = null;
        firstFailureAt = null;
        wrapped.enterLoop();
    }

    @Override
    public <E extends Throwable> Duration nextSleepOrRethrow(E failure) throws E {
        if (firstFailure == null) {
            firstFailure = failure;
            firstFailureAt = clock.now();
            try {
                onLoopStart.accept(failure);
            } catch (RuntimeException e) {
                log.warn("onLoopStart callback failed: {}", e.getMessage(), e);
            }
        }
        return wrapped.nextSleepOrRethrow(failure);
    }

    @Override
    public void exitLoop() {
        try {
            if (firstFailure != null) {
                Duration elapsed = Duration.between(firstFailureAt, clock.now());
                firstFailure = null;
                firstFailureAt = null;
                try {
                    onLoopEnd.accept(elapsed);
                } catch (RuntimeException e) {
                    log.warn("onLoopEnd callback failed: {}", e.getMessage(), e);
                }
            }
        } finally {
            wrapped.exitLoop();
        }
    }
}
