package com.sailfish.retry.async;

import com.sailfish.retry.AsyncOperation;
import com.sailfish.retry.backoff.Backoff;
import com.sailfish.retry.clock.RetryClock;
import com.sailfish.retry.failure.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Retries an asynchronous operation according to a {@link Backoff}, waiting
 * between attempts with {@link RetryClock#suspend(Duration)} so that no thread is
 * blocked.
 *
 * The backoff's loop is entered once before the first attempt and exited once
 * when the returned future is about to complete. The future completes with the
 * first successful result, or with the failure the backoff rethrew.
 */
public class AsyncRetry {

    private static final Logger log = LoggerFactory.getLogger(AsyncRetry.class);

    private final RetryClock clock;

    public AsyncRetry() {
        this(RetryClock.system());
    }

    public AsyncRetry(RetryClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public static <T> CompletableFuture<T> retryAsync(Backoff backoff, AsyncOperation<T> operation) {
        return new AsyncRetry().retry(backoff, operation);
    }

    public static <A, T> CompletableFuture<T> retryAsync(Backoff backoff,
                                                         Function<? super A, ? extends CompletionStage<T>> operation,
                                                         A arg) {
        return new AsyncRetry().retry(backoff, operation, arg);
    }

    public static <A, B, T> CompletableFuture<T> retryAsync(Backoff backoff,
                                                            BiFunction<? super A, ? super B, ? extends CompletionStage<T>> operation,
                                                            A first, B second) {
        return new AsyncRetry().retry(backoff, operation, first, second);
    }

    /**
     * Calls {@code operation} with the same argument on every attempt.
     */
    public <A, T> CompletableFuture<T> retry(Backoff backoff,
                                             Function<? super A, ? extends CompletionStage<T>> operation,
                                             A arg) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return retry(backoff, () -> operation.apply(arg));
    }

    /**
     * Calls {@code operation} with the same two arguments on every attempt.
     */
    public <A, B, T> CompletableFuture<T> retry(Backoff backoff,
                                                BiFunction<? super A, ? super B, ? extends CompletionStage<T>> operation,
                                                A first, B second) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return retry(backoff, () -> operation.apply(first, second));
    }

    /**
     * Runs {@code operation} until it succeeds or {@code backoff} gives up.
     *
     * @param backoff Decides the wait after each failure. Used by this loop only until it completes.
     * @param operation The operation to attempt.
     * @param <T> The result type.
     * @return A future completed with the result or with the final failure.
     */
    public <T> CompletableFuture<T> retry(Backoff backoff, AsyncOperation<T> operation) {
        Objects.requireNonNull(backoff, "backoff cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        backoff.enterLoop();
        new Loop<>(backoff, operation, result).run(1);
        return result;
    }

    /**
     * One retry loop. Attempts and waits that are already complete are handled by
     * iterating in {@link #run(int)}; a callback is chained only onto a stage that is
     * still pending, so the stack depth does not grow with the number of attempts.
     */
    private final class Loop<T> {

        private final Backoff backoff;
        private final AsyncOperation<T> operation;
        private final CompletableFuture<T> result;
        private final AtomicBoolean exited = new AtomicBoolean();

        Loop(Backoff backoff, AsyncOperation<T> operation, CompletableFuture<T> result) {
            this.backoff = backoff;
            this.operation = operation;
            this.result = result;
        }

        void run(int firstAttempt) {
            try {
                int attempt = firstAttempt;
                while (true) {
                    CompletableFuture<T> stage = start();
                    if (!stage.isDone()) {
                        int pending = attempt;
                        stage.whenComplete((value, failure) -> resume(pending, value, failure));
                        return;
                    }
                    CompletableFuture<Void> wait = afterAttempt(attempt, stage);
                    if (wait == null || wait.isCompletedExceptionally()) {
                        return;
                    }
                    if (!wait.isDone()) {
                        continueAfter(wait, attempt + 1);
                        return;
                    }
                    attempt++;
                }
            } catch (Throwable t) {
                fail(t);
            }
        }

        private CompletableFuture<T> start() {
            try {
                CompletionStage<T> stage = Objects.requireNonNull(operation.start(), "operation returned a null stage");
                return stage.toCompletableFuture();
            } catch (Throwable t) {
                return CompletableFuture.failedFuture(t);
            }
        }

        private void resume(int attempt, T value, Throwable failure) {
            try {
                CompletableFuture<Void> wait = failure == null
                        ? afterAttempt(attempt, CompletableFuture.completedFuture(value))
                        : afterFailure(attempt, Failures.unwrap(failure));
                if (wait == null || wait.isCompletedExceptionally()) {
                    return;
                }
                if (wait.isDone()) {
                    run(attempt + 1);
                } else {
                    continueAfter(wait, attempt + 1);
                }
            } catch (Throwable t) {
                fail(t);
            }
        }

        private void continueAfter(CompletableFuture<Void> wait, int nextAttempt) {
            wait.whenComplete((ignored, waitFailure) -> {
                if (waitFailure == null) {
                    run(nextAttempt);
                }
            });
        }

        /**
         * Settles a completed attempt.
         *
         * @return The wait before the next attempt, or null once the result has been completed.
         */
        private CompletableFuture<Void> afterAttempt(int attempt, CompletableFuture<T> stage) {
            T value;
            try {
                value = stage.join();
            } catch (CancellationException | CompletionException e) {
                return afterFailure(attempt, Failures.unwrap(e));
            }
            if (attempt > 1) {
                log.debug("Operation succeeded on attempt {}.", attempt);
            }
            exit();
            result.complete(value);
            return null;
        }

        /**
         * Asks the backoff about a failed attempt and starts the wait it returns.
         * A wait that fails completes the result with {@code failure}.
         *
         * @return The wait before the next attempt, or null once the result has been completed.
         */
        private CompletableFuture<Void> afterFailure(int attempt, Throwable failure) {
            Duration sleep;
            try {
                sleep = backoff.nextSleepOrRethrow(failure);
            } catch (Throwable giveUp) {
                log.debug("Giving up after attempt {}: {}", attempt, giveUp.toString());
                exit();
                result.completeExceptionally(giveUp);
                return null;
            }
            log.debug("Attempt {} failed ({}), retrying in {}.", attempt, failure.toString(), sleep);

            CompletableFuture<Void> wait;
            try {
                Objects.requireNonNull(sleep, "backoff returned a null duration");
                wait = Objects.requireNonNull(clock.suspend(sleep), "clock returned a null suspension");
            } catch (Throwable t) {
                log.error("Could not wait before attempt {}: {}", attempt + 1, t.toString(), t);
                failWith(failure, t);
                return null;
            }
            return wait.whenComplete((ignored, waitFailure) -> {
                if (waitFailure != null) {
                    log.error("Wait before attempt {} failed: {}", attempt + 1, waitFailure.toString(), waitFailure);
                    failWith(failure, Failures.unwrap(waitFailure));
                }
            });
        }

        private void failWith(Throwable failure, Throwable cause) {
            if (cause != failure) {
                failure.addSuppressed(cause);
            }
            fail(failure);
        }

        private void fail(Throwable failure) {
            exit();
            result.completeExceptionally(failure);
        }

        private void exit() {
            if (exited.compareAndSet(false, true)) {
                try {
                    backoff.exitLoop();
                } catch (RuntimeException e) {
                    log.warn("Backoff exitLoop failed: {}", e.getMessage(), e);
                }
            }
        }
    }
}
