package com.sailfish.insistent;

import com.sailfish.insistent.model.RetryContext;

/**
 * A retryable operation taking a caller supplied argument in addition to the retry context.
 *
 * @param <A> The argument type.
 * @param <T> The result type.
 */
@FunctionalInterface
public interface RetryableFunction<A, T> {

    T apply(A argument, RetryContext context) throws Exception;
}
