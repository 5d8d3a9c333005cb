package com.sailfish.retry.sync;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.sailfish.retry.clock.RetryClock;
import com.sailfish.retry.clock.VirtualClock;
import com.sailfish.retry.factory.ExceptionClassWindows;
import com.sailfish.retry.model.Exhaustion;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryTest {

    private final VirtualClock clock = new VirtualClock();
    private final AtomicInteger calls = new AtomicInteger();

    private Void alwaysFail() {
        calls.incrementAndGet();
        throw new IllegalArgumentException("always");
    }

    @Test
    void respectsNumRetries() {
        int numRetries = 7;
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(numRetries)
                .retryableExceptions(IllegalArgumentException.class)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        assertThat(calls.get(), equalTo(numRetries + 1));
    }

    @Test
    void callNumRetriesOverridesDefaultForThatCallOnly() {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(2)
                .retryableExceptions(IllegalArgumentException.class)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, () -> retrier.call(4));
        assertThat(calls.get(), equalTo(5));

        calls.set(0);
        assertThrows(IllegalArgumentException.class, retrier::call);
        assertThat(calls.get(), equalTo(3));
    }

    @Test
    void callNumRetriesWithoutConfiguredDefault() {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .retryableExceptions(IllegalArgumentException.class)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, () -> retrier.call(4));

        assertThat(calls.get(), equalTo(5));
    }

    @Test
    void respectsNumRetriesAcrossMultipleCalls() {
        int numRetries = 7;
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(numRetries)
                .retryableExceptions(IllegalArgumentException.class)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);
        assertThrows(IllegalArgumentException.class, retrier::call);

        assertThat(calls.get(), equalTo(2 * (numRetries + 1)));
    }

    @Test
    void respectsRetryableExceptions() {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(3)
                .retryableExceptions(IllegalArgumentException.class)
                .clock(clock)
                .build();
        assertThrows(IllegalArgumentException.class, retrier::call);
        assertThat(calls.get(), equalTo(4));

        calls.set(0);
        Retry<Void> other = Retry.<Void>builder(() -> {
                    calls.incrementAndGet();
                    throw new IndexOutOfBoundsException();
                })
                .retryableExceptions(IllegalArgumentException.class)
                .clock(clock)
                .build();
        assertThrows(IndexOutOfBoundsException.class, other::call);
        assertThat(calls.get(), equalTo(1));
        assertThat(clock.getSleeps().size(), equalTo(3));
    }

    @Test
    void fatalFailureConsumesNoSleep() {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .retryableExceptions(TimeoutException.class)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        assertThat(calls.get(), equalTo(1));
        assertThat(clock.getSleeps(), empty());
    }

    @Test
    void unlistedErrorIsNotRetried() {
        Retry<Void> retrier = Retry.<Void>builder(() -> {
                    calls.incrementAndGet();
                    throw new AssertionError("boom");
                })
                .clock(clock)
                .build();

        assertThrows(AssertionError.class, retrier::call);

        assertThat(calls.get(), equalTo(1));
    }

    @Test
    void listedErrorIsRetried() {
        Retry<Void> retrier = Retry.<Void>builder(() -> {
                    calls.incrementAndGet();
                    throw new AssertionError("flaky");
                })
                .numRetries(3)
                .retryableExceptions(AssertionError.class)
                .addJitter(false)
                .clock(clock)
                .build();

        assertThrows(AssertionError.class, retrier::call);

        assertThat(calls.get(), equalTo(4));
        assertThat(clock.getSleeps(), contains(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));
    }

    @Test
    void listedErrorRecovers() throws Exception {
        Retry<String> retrier = Retry.<String>builder(() -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new StackOverflowError();
                    }
                    return "ok";
                })
                .retryableExceptions(StackOverflowError.class)
                .clock(clock)
                .build();

        assertThat(retrier.call(), equalTo("ok"));
        assertThat(calls.get(), equalTo(3));
    }

    @Test
    void interruptedExceptionFromTargetIsNeverRetried() {
        Retry<Void> retrier = Retry.<Void>builder(() -> {
                    calls.incrementAndGet();
                    throw new InterruptedException();
                })
                .clock(clock)
                .build();

        assertThrows(InterruptedException.class, retrier::call);

        assertThat(calls.get(), equalTo(1));
    }

    @Test
    void respectsSecondaryTimeout() {
        Instant t0 = clock.now();
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .retryableExceptions(IllegalArgumentException.class)
                .retryWindow(e -> e instanceof IllegalArgumentException
                        ? Optional.of(Duration.ofMinutes(10))
                        : Optional.empty())
                .retryTimedelta(Duration.ofHours(7))
                .numRetries(10000)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        long minutes = Duration.between(t0, clock.now()).toSeconds() / 60;
        assertThat(minutes, greaterThanOrEqualTo(10L));
        assertThat(minutes, lessThan(20L));
    }

    @Test
    void secondaryWindowOnlyAppliesToFailuresThatHaveOne() {
        RetryListener listener = mock(RetryListener.class);
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .retryWindow(new ExceptionClassWindows().register(TimeoutException.class, Duration.ofSeconds(1)))
                .numRetries(5)
                .listener(listener)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        assertThat(calls.get(), equalTo(6));
        verify(listener).onGaveUp(any(IllegalArgumentException.class), eq(Exhaustion.COUNT));
    }

    @Test
    void respectsPrimaryTimeout() {
        RetryListener listener = mock(RetryListener.class);
        Instant t0 = clock.now();
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .retryTimedelta(Duration.ofMinutes(1))
                .addJitter(false)
                .listener(listener)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        // waits of 1, 2, 4, 8, 16 and 32 seconds; the failure at 63s is past the deadline
        assertThat(Duration.between(t0, clock.now()), equalTo(Duration.ofSeconds(63)));
        assertThat(calls.get(), equalTo(7));
        verify(listener).onGaveUp(any(IllegalArgumentException.class), eq(Exhaustion.PRIMARY_DEADLINE));
    }

    @Test
    void secondaryDeadlineIsReportedAsSuch() {
        RetryListener listener = mock(RetryListener.class);
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .retryWindow(new ExceptionClassWindows().register(IllegalArgumentException.class, Duration.ofSeconds(5)))
                .retryTimedelta(Duration.ofHours(1))
                .addJitter(false)
                .listener(listener)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        // the window opens at 0s; failures at 1s and 3s are inside it, the one at 7s is not
        assertThat(clock.getSleeps(), contains(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));
        verify(listener).onGaveUp(any(IllegalArgumentException.class), eq(Exhaustion.SECONDARY_DEADLINE));
    }

    @Test
    void sleepsGrowExponentiallyUpToMaxSleep() {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(5)
                .sleepBase(Duration.ofSeconds(1))
                .maxSleep(Duration.ofSeconds(4))
                .addJitter(false)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        assertThat(clock.getSleeps(), contains(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(4), Duration.ofSeconds(4)));
    }

    @Test
    void jitterAddsAtMostAQuarter() {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(20)
                .sleepBase(Duration.ofSeconds(10))
                .maxSleep(Duration.ofSeconds(10))
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        for (Duration sleep : clock.getSleeps()) {
            assertThat(sleep, greaterThanOrEqualTo(Duration.ofSeconds(10)));
            assertThat(sleep, lessThanOrEqualTo(Duration.ofMillis(12500)));
        }
    }

    @Test
    void returnsResultAfterRecovering() throws Exception {
        List<String> events = new ArrayList<>();
        RetryListener listener = new RetryListener() {
            @Override
            public void onRetrying(Throwable failure, int retry, Duration sleep) {
                events.add("retrying " + retry + " in " + sleep);
            }

            @Override
            public void onRecovered(int retries, Duration elapsed) {
                events.add("recovered after " + retries + " in " + elapsed);
            }
        };
        Retry<String> retrier = Retry.builder(() -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new TimeoutException("slow");
                    }
                    return "ok";
                })
                .retryableExceptions(TimeoutException.class)
                .addJitter(false)
                .listener(listener)
                .clock(clock)
                .build();

        assertThat(retrier.call(), equalTo("ok"));

        assertThat(events, contains(
                "retrying 1 in " + Duration.ofSeconds(1),
                "retrying 2 in " + Duration.ofSeconds(2),
                "recovered after 2 in " + Duration.ofSeconds(3)));
    }

    @Test
    void successOnFirstAttemptNotifiesNothing() throws Exception {
        RetryListener listener = mock(RetryListener.class);
        Retry<String> retrier = Retry.builder(() -> "ok").listener(listener).clock(clock).build();

        assertThat(retrier.call(), equalTo("ok"));

        verify(listener, never()).onRecovered(anyInt(), any(Duration.class));
        assertThat(clock.getSleeps(), empty());
    }

    @Test
    void failingListenerDoesNotAffectRetrying() {
        RetryListener listener = mock(RetryListener.class);
        doThrow(new IllegalStateException("listener")).when(listener)
                .onRetrying(any(Throwable.class), anyInt(), any(Duration.class));
        doThrow(new IllegalStateException("listener")).when(listener)
                .onGaveUp(any(Throwable.class), any(Exhaustion.class));
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(2)
                .listener(listener)
                .clock(clock)
                .build();

        assertThrows(IllegalArgumentException.class, retrier::call);

        assertThat(calls.get(), equalTo(3));
    }

    @Test
    void interruptedWaitPropagatesWithPendingFailure() {
        RetryClock interrupting = new RetryClock() {
            @Override
            public Instant now() {
                return clock.now();
            }

            @Override
            public void sleep(Duration duration) throws InterruptedException {
                throw new InterruptedException("stop");
            }

            @Override
            public CompletableFuture<Void> suspend(Duration duration) {
                return CompletableFuture.completedFuture(null);
            }
        };
        Retry<Void> retrier = Retry.builder(this::alwaysFail).clock(interrupting).build();

        try {
            InterruptedException error = assertThrows(InterruptedException.class, retrier::call);

            assertThat(error.getSuppressed().length, equalTo(1));
            assertThat(error.getSuppressed()[0] instanceof IllegalArgumentException, is(true));
            assertThat(Thread.currentThread().isInterrupted(), is(true));
            assertThat(calls.get(), equalTo(1));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void concurrentCallsKeepSeparateBudgets() throws Exception {
        Retry<Void> retrier = Retry.builder(this::alwaysFail)
                .numRetries(3)
                .clock(clock)
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> assertThrows(IllegalArgumentException.class, retrier::call)));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(calls.get(), equalTo(4 * 4));
    }

    @Test
    void propagatesOriginalFailureInstance() {
        IllegalArgumentException failure = new IllegalArgumentException("original");
        Retry<Void> retrier = Retry.<Void>builder(() -> {
                    throw failure;
                })
                .numRetries(1)
                .clock(clock)
                .build();

        assertThat(assertThrows(IllegalArgumentException.class, retrier::call), sameInstance(failure));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> Retry.builder(this::alwaysFail).numRetries(-1));
        assertThrows(IllegalArgumentException.class,
                () -> Retry.builder(this::alwaysFail).sleepBase(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> Retry.builder(this::alwaysFail).sleepBase(Duration.ofSeconds(5)).maxSleep(Duration.ofSeconds(1)).build());
        Retry<Void> retrier = Retry.builder(this::alwaysFail).clock(clock).build();
        assertThrows(IllegalArgumentException.class, () -> retrier.call(-1));
    }
}
