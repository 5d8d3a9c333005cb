package com.sailfish.retry.clock;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wall-clock {@link RetryClock}.
 *
 * Suspensions are timers on a {@link ScheduledExecutorService}; the scheduler thread
 * only completes the returned future, so no thread is held for the length of a wait.
 * An injected scheduler is left to its owner, a scheduler created here is shut down
 * by {@link #close()}, which also fails the suspensions still waiting on it.
 * The shared instance returned by {@link RetryClock#system()} lives as long as the JVM.
 */
public class SystemClock implements RetryClock, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SystemClock.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5;

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static volatile SystemClock shared;

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final boolean isShared;
    private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

    /**
     * Creates a clock backed by its own single daemon timer thread.
     */
    public SystemClock() {
        this(false);
    }

    private SystemClock(boolean isShared) {
        this(newTimer(), true, isShared);
    }

    /**
     * Creates a clock that schedules suspensions on an externally managed executor.
     *
     * @param scheduler The executor used to complete suspensions. Not shut down by this clock.
     */
    public SystemClock(ScheduledExecutorService scheduler) {
        this(scheduler, false, false);
    }

    private SystemClock(ScheduledExecutorService scheduler, boolean ownsScheduler, boolean isShared) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
        this.isShared = isShared;
    }

    static SystemClock shared() {
        SystemClock clock = shared;
        if (clock == null) {
            synchronized (SystemClock.class) {
                clock = shared;
                if (clock == null) {
                    clock = new SystemClock(true);
                    shared = clock;
                    log.debug("Created shared SystemClock.");
                }
            }
        }
        return clock;
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        TimeUnit.NANOSECONDS.sleep(toNanos(duration));
    }

    @Override
    public CompletableFuture<Void> suspend(Duration duration) {
        Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isNegative() || duration.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        if (ownsScheduler) {
            pending.add(future);
            future.whenComplete((ignored, failure) -> pending.remove(future));
        }
        try {
            scheduler.schedule(() -> future.complete(null), toNanos(duration), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.error("SystemClock scheduler rejected a suspension of {}. Is it shut down?", duration, e);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Shuts down the timer thread if this clock created it. Suspensions that have
     * not elapsed yet complete exceptionally with a {@link CancellationException}.
     * Does nothing on the shared clock.
     */
    @Override
    @PreDestroy
    public void close() {
        if (isShared) {
            log.debug("Ignoring close() on the shared SystemClock.");
            return;
        }
        if (!ownsScheduler) {
            return;
        }
        log.info("Shutting down SystemClock scheduler...");
        scheduler.shutdown();
        cancelPending();
        try {
            if (!scheduler.awaitTermination(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                List<Runnable> dropped = scheduler.shutdownNow();
                log.warn("SystemClock scheduler did not terminate in {} seconds. {} pending suspensions were dropped.",
                        DEFAULT_SHUTDOWN_TIMEOUT_SECONDS, dropped.size());
            } else {
                log.info("SystemClock scheduler terminated gracefully.");
            }
        } catch (InterruptedException ie) {
            log.warn("SystemClock shutdown interrupted. Forcing shutdown now.");
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void cancelPending() {
        List<CompletableFuture<Void>> waiting = new ArrayList<>(pending);
        if (!waiting.isEmpty()) {
            log.warn("Cancelling {} pending suspensions.", waiting.size());
        }
        for (CompletableFuture<Void> future : waiting) {
            future.completeExceptionally(new CancellationException("SystemClock closed"));
        }
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static ScheduledExecutorService newTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, daemonThreadFactory());
        timer.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    private static ThreadFactory daemonThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "retry-clock-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
