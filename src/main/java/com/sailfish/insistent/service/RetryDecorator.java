package com.sailfish.insistent.service;

import com.sailfish.insistent.AsyncRetryableOperation;
import com.sailfish.insistent.RetryableFunction;
import com.sailfish.insistent.RetryableOperation;
import com.sailfish.insistent.retry.RetryStrategy;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Wraps operations so that failed attempts are retried according to a {@link RetryStrategy}.
 * <p>
 * Failures of the wrapped operation never reach the caller: once the timeout sequence is exhausted the
 * decorated call completes with an empty Optional. A decorator is immutable and may be applied to any number of
 * operations and invoked concurrently.
 * <p>
 * Usage
 * <pre>
 * {@code
 * RetryDecorator retry = new RetryDecoratorBuilder()
 *         .setInitialTimeout(Duration.ofSeconds(1))
 *         .setRetries(3)
 *         .setStrategy(RetryStrategyFactory.exponential(2))
 *         .build();
 * Optional<String> greeting = retry.execute(context -> client.sayHello("John")).join();
 * }
 * </pre>
 */
public interface RetryDecorator {

    /**
     * Decorates a synchronous operation. Attempts run on the decorator's task executor.
     */
    <T> RetryingCall<T> decorate(RetryableOperation<T> operation);

    /**
     * Decorates an operation whose attempts complete asynchronously.
     */
    <T> RetryingCall<T> decorateAsync(AsyncRetryableOperation<T> operation);

    /**
     * Decorates an operation taking an argument; the argument is passed unchanged to every attempt.
     */
    <A, T> Function<A, CompletableFuture<Optional<T>>> decorateFunction(RetryableFunction<A, T> function);

    /**
     * Decorates the operation and starts a single retry cycle.
     */
    default <T> CompletableFuture<Optional<T>> execute(RetryableOperation<T> operation) {
        return decorate(operation).call();
    }

    RetryStrategy getStrategy();
}
