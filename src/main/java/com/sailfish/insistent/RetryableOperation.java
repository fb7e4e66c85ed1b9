package com.sailfish.insistent;

import com.sailfish.insistent.model.RetryContext;

/**
 * Represents an operation that can be retried by a {@link com.sailfish.insistent.service.RetryDecorator}.
 * Implementations should contain the actual business logic.
 *
 * @param <T> The type of the value produced by the operation.
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * Executes the operation logic once.
     *
     * @param context The attempt number and the wait scheduled before the next attempt.
     * @return The result of the operation.
     * @throws Exception if the attempt fails. Any exception is treated as a retryable failure.
     */
    T execute(RetryContext context) throws Exception;
}
