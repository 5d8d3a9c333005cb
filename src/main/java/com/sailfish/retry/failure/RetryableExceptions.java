package com.sailfish.retry.failure;

import com.sailfish.retry.model.FailureKind;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The set of failure classes a driver retries. Subclasses of a listed class match too.
 */
public final class RetryableExceptions {

    private static final RetryableExceptions ALL = new RetryableExceptions(Set.of(Exception.class));
    private static final RetryableExceptions NONE = new RetryableExceptions(Set.of());

    private final Set<Class<? extends Throwable>> classes;

    private RetryableExceptions(Set<Class<? extends Throwable>> classes) {
        this.classes = classes;
    }

    @SafeVarargs
    public static RetryableExceptions of(Class<? extends Throwable>... classes) {
        Objects.requireNonNull(classes, "classes cannot be null");
        return of(Arrays.asList(classes));
    }

    public static RetryableExceptions of(Collection<? extends Class<? extends Throwable>> classes) {
        Objects.requireNonNull(classes, "classes cannot be null");
        Set<Class<? extends Throwable>> copy = new LinkedHashSet<>();
        for (Class<? extends Throwable> type : classes) {
            copy.add(Objects.requireNonNull(type, "failure class cannot be null"));
        }
        return new RetryableExceptions(Set.copyOf(copy));
    }

    /**
     * @return a set matching every {@link Exception}, but no {@link Error}.
     */
    public static RetryableExceptions all() {
        return ALL;
    }

    public static RetryableExceptions none() {
        return NONE;
    }

    public boolean matches(Throwable failure) {
        if (failure == null) {
            return false;
        }
        for (Class<? extends Throwable> type : classes) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    public FailureKind classify(Throwable failure) {
        return matches(failure) ? FailureKind.RETRYABLE : FailureKind.FATAL;
    }

    public Set<Class<? extends Throwable>> getClasses() {
        return classes;
    }

    @Override
    public String toString() {
        return "RetryableExceptions" + classes;
    }
}
