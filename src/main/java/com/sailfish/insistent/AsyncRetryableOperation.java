package com.sailfish.insistent;

import com.sailfish.insistent.model.RetryContext;

import java.util.concurrent.CompletionStage;

/**
 * An operation whose attempts complete asynchronously.
 * A stage completed exceptionally counts as a failed attempt, as does an exception thrown by {@link #execute}.
 *
 * @param <T> The type of the value produced by the operation.
 */
@FunctionalInterface
public interface AsyncRetryableOperation<T> {

    CompletionStage<T> execute(RetryContext context) throws Exception;
}
