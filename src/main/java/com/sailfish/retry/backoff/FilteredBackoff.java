package com.sailfish.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retries only the failures accepted by a filter; everything else is rethrown
 * without consulting the wrapped backoff.
 */
public class FilteredBackoff implements Backoff {

    private final Predicate<? super Throwable> filter;
    private final Backoff wrapped;

    public FilteredBackoff(Predicate<? super Throwable> filter, Backoff wrapped) {
        this.filter = Objects.requireNonNull(filter, "filter cannot be null");
        this.wrapped = Objects.requireNonNull(wrapped, "wrapped cannot be null");
    }

    @Override
    public <E extends Throwable> Duration nextSleepOrRethrow(E failure) throws E {
        if (!filter.test(failure)) {
            throw failure;
        }
        return wrapped.nextSleepOrRethrow(failure);
    }

    @Override
    public void enterLoop() {
        wrapped.enterLoop();
    }

    @Override
    public void exitLoop() {
        wrapped.exitLoop();
    }
}
