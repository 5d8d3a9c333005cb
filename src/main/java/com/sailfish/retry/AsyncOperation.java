package com.sailfish.retry;

import java.util.concurrent.CompletionStage;

/**
 * An operation that completes asynchronously and may be attempted more than once.
 *
 * @param <T> The type of the operation's result.
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /**
     * Starts one attempt of the operation.
     *
     * @return A stage completed with the result, or exceptionally with the failure.
     * @throws Exception if the attempt fails before a stage could be returned.
     */
    CompletionStage<T> start() throws Exception;
}
