package com.sailfish.retry.sync;

import com.sailfish.retry.clock.RetryClock;
import com.sailfish.retry.factory.RetryWindow;
import com.sailfish.retry.failure.RetryableExceptions;
import com.sailfish.retry.model.Exhaustion;
import com.sailfish.retry.model.FailureKind;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Calls a target repeatedly until it succeeds, blocking the calling thread between attempts.
 *
 * After a failure the call is given up, and the failure rethrown, when:
 * <ul>
 *     <li>the failure is not one of the {@code retryableExceptions} (no wait at all),</li>
 *     <li>more than {@code numRetries} retries would be needed,</li>
 *     <li>more than {@code retryTimedelta} has passed since the call started,</li>
 *     <li>the {@code retryWindow} gave the failure a window and that window has closed.
 *         The window opens on the first failure that has one and is never moved.</li>
 * </ul>
 * Otherwise the thread sleeps for an exponentially growing, jittered interval and
 * the target is called again. {@link InterruptedException} is never retried; an
 * {@link Error} is retried only when it is listed in {@code retryableExceptions}.
 *
 * Configuration is immutable and all per-call state is local, so one instance can
 * be shared by concurrent callers.
 *
 * @param <T> The result type of the target.
 */
public class Retry<T> implements Callable<T> {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    public static final int UNLIMITED_RETRIES = Integer.MAX_VALUE;
    public static final Duration DEFAULT_SLEEP_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_SLEEP = Duration.ofMinutes(5);
    public static final String DEFAULT_NAME = "operation";
    public static final double MAX_JITTER = 0.25;

    private final Callable<T> target;
    private final String name;
    private final int numRetries;
    private final RetryableExceptions retryableExceptions;
    private final Duration retryTimedelta;
    private final RetryWindow retryWindow;
    private final Duration sleepBase;
    private final Duration maxSleep;
    private final boolean addJitter;
    private final RetryListener listener;
    private final RetryClock clock;

    private Retry(Builder<T> builder) {
        this.target = builder.target;
        this.name = builder.name;
        this.numRetries = builder.numRetries;
        this.retryableExceptions = builder.retryableExceptions;
        this.retryTimedelta = builder.retryTimedelta;
        this.retryWindow = builder.retryWindow;
        this.sleepBase = builder.sleepBase;
        this.maxSleep = builder.maxSleep;
        this.addJitter = builder.addJitter;
        this.listener = builder.listener;
        this.clock = builder.clock;
    }

    public static <T> Builder<T> builder(Callable<T> target) {
        return new Builder<>(target);
    }

    /**
     * Calls the target with the configured retry ceiling.
     */
    @Override
    public T call() throws Exception {
        return call(numRetries);
    }

    /**
     * Calls the target, allowing at most {@code numRetries} retries for this call only.
     *
     * @param numRetries The retry ceiling for this call.
     * @return The target's result.
     * @throws Exception the target's last failure when it is fatal or retries are exhausted,
     *                   or {@link InterruptedException} when a wait is interrupted.
     */
    public T call(int numRetries) throws Exception {
        if (numRetries < 0) {
            throw new IllegalArgumentException("numRetries must be non-negative");
        }
        Instant start = clock.now();
        Duration lastSleep = null;
        Instant secondaryDeadline = null;
        int retries = 0;

        while (true) {
            try {
                T result = target.call();
                if (retries > 0) {
                    Duration elapsed = Duration.between(start, clock.now());
                    log.info("{} resolved after {}, resuming normal operation.", name, elapsed);
                    notifyRecovered(retries, elapsed);
                }
                return result;
            } catch (InterruptedException e) {
                throw e;
            } catch (Throwable e) {
                if (retryableExceptions.classify(e) == FailureKind.FATAL) {
                    log.debug("{} failed with non-retryable {}.", name, e.toString());
                    throw e;
                }

                retries++;
                if (retries > numRetries) {
                    giveUp(e, Exhaustion.COUNT, retries);
                    throw e;
                }

                Instant now = clock.now();
                if (retryTimedelta != null && Duration.between(start, now).compareTo(retryTimedelta) > 0) {
                    giveUp(e, Exhaustion.PRIMARY_DEADLINE, retries);
                    throw e;
                }

                if (retryWindow != null) {
                    Optional<Duration> window = retryWindow.windowFor(e);
                    if (window.isPresent()) {
                        if (secondaryDeadline == null) {
                            secondaryDeadline = now.plus(window.get());
                            log.debug("{} retry window of {} opened, closes at {}.", name, window.get(), secondaryDeadline);
                        }
                        if (!now.isBefore(secondaryDeadline)) {
                            giveUp(e, Exhaustion.SECONDARY_DEADLINE, retries);
                            throw e;
                        }
                    }
                }

                lastSleep = lastSleep == null ? sleepBase : doubled(lastSleep);
                Duration sleep = jitter(lastSleep);
                if (retries == 1) {
                    log.warn("{} failed ({}), retrying in {}.", name, e.toString(), sleep);
                } else {
                    log.debug("{} failed ({}), retry {} in {}.", name, e.toString(), retries, sleep);
                }
                notifyRetrying(e, retries, sleep);

                try {
                    clock.sleep(sleep);
                } catch (InterruptedException ie) {
                    log.warn("{} interrupted while waiting to retry.", name);
                    Thread.currentThread().interrupt();
                    ie.addSuppressed(e);
                    throw ie;
                }
            }
        }
    }

    private Duration doubled(Duration sleep) {
        if (sleep.compareTo(maxSleep.dividedBy(2)) >= 0) {
            return maxSleep;
        }
        return sleep.multipliedBy(2);
    }

    private Duration jitter(Duration sleep) {
        if (!addJitter) {
            return sleep;
        }
        long jitterMillis = (long) (sleep.toMillis() * MAX_JITTER * ThreadLocalRandom.current().nextDouble());
        return sleep.plusMillis(jitterMillis);
    }

    private void giveUp(Throwable failure, Exhaustion exhaustion, int retries) {
        log.warn("{} giving up after {} attempts ({}): {}", name, retries, exhaustion, failure.toString());
        try {
            listener.onGaveUp(failure, exhaustion);
        } catch (RuntimeException e) {
            log.warn("RetryListener.onGaveUp failed for {}: {}", name, e.getMessage(), e);
        }
    }

    private void notifyRetrying(Throwable failure, int retries, Duration sleep) {
        try {
            listener.onRetrying(failure, retries, sleep);
        } catch (RuntimeException e) {
            log.warn("RetryListener.onRetrying failed for {}: {}", name, e.getMessage(), e);
        }
    }

    private void notifyRecovered(int retries, Duration elapsed) {
        try {
            listener.onRecovered(retries, elapsed);
        } catch (RuntimeException e) {
            log.warn("RetryListener.onRecovered failed for {}: {}", name, e.getMessage(), e);
        }
    }

    // --- Getters for configuration ---
    public String getName() { return name; }
    public int getNumRetries() { return numRetries; }
    public RetryableExceptions getRetryableExceptions() { return retryableExceptions; }
    public Duration getRetryTimedelta() { return retryTimedelta; }
    public Duration getSleepBase() { return sleepBase; }
    public Duration getMaxSleep() { return maxSleep; }
    public boolean isAddJitter() { return addJitter; }

    /**
     * Builder for {@link Retry}. Every setting except the target has a default:
     * unlimited retries of any {@link Exception}, no deadline, no secondary window,
     * jittered waits starting at 1 second and capped at 5 minutes.
     */
    public static final class Builder<T> {

        private final Callable<T> target;
        private String name = DEFAULT_NAME;
        private int numRetries = UNLIMITED_RETRIES;
        private RetryableExceptions retryableExceptions = RetryableExceptions.all();
        private Duration retryTimedelta;
        private RetryWindow retryWindow;
        private Duration sleepBase = DEFAULT_SLEEP_BASE;
        private Duration maxSleep = DEFAULT_MAX_SLEEP;
        private boolean addJitter = true;
        private RetryListener listener = RetryListener.NO_OP;
        private RetryClock clock;

        private Builder(Callable<T> target) {
            this.target = Objects.requireNonNull(target, "target cannot be null");
        }

        public Builder<T> name(String name) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("name cannot be blank");
            }
            this.name = name;
            return this;
        }

        public Builder<T> numRetries(int numRetries) {
            if (numRetries < 0) {
                throw new IllegalArgumentException("numRetries must be non-negative");
            }
            this.numRetries = numRetries;
            return this;
        }

        public Builder<T> retryableExceptions(RetryableExceptions retryableExceptions) {
            this.retryableExceptions = Objects.requireNonNull(retryableExceptions, "retryableExceptions cannot be null");
            return this;
        }

        @SafeVarargs
        public final Builder<T> retryableExceptions(Class<? extends Throwable>... classes) {
            return retryableExceptions(RetryableExceptions.of(classes));
        }

        public Builder<T> retryTimedelta(@Nullable Duration retryTimedelta) {
            if (retryTimedelta != null && retryTimedelta.isNegative()) {
                throw new IllegalArgumentException("retryTimedelta must not be negative");
            }
            this.retryTimedelta = retryTimedelta;
            return this;
        }

        public Builder<T> retryWindow(@Nullable RetryWindow retryWindow) {
            this.retryWindow = retryWindow;
            return this;
        }

        public Builder<T> sleepBase(Duration sleepBase) {
            this.sleepBase = Objects.requireNonNull(sleepBase, "sleepBase cannot be null");
            return this;
        }

        public Builder<T> maxSleep(Duration maxSleep) {
            this.maxSleep = Objects.requireNonNull(maxSleep, "maxSleep cannot be null");
            return this;
        }

        public Builder<T> addJitter(boolean addJitter) {
            this.addJitter = addJitter;
            return this;
        }

        public Builder<T> listener(RetryListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener cannot be null");
            return this;
        }

        public Builder<T> clock(RetryClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Retry<T> build() {
            if (sleepBase.isNegative() || sleepBase.isZero()) {
                throw new IllegalArgumentException("sleepBase must be positive");
            }
            if (maxSleep.compareTo(sleepBase) < 0) {
                throw new IllegalArgumentException("maxSleep must not be shorter than sleepBase");
            }
            if (clock == null) {
                clock = RetryClock.system();
            }
            return new Retry<>(this);
        }
    }
}
