package com.sailfish.retry.failure;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for handling failures reported through futures.
 */
public final class Failures {

    private Failures() {
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} layers
     * futures put around a failure. Wrappers without a cause are returned as is.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
