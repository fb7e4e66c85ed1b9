package com.sailfish.insistent.service.impl;

import com.sailfish.insistent.AsyncRetryableOperation;
import com.sailfish.insistent.RetryLogger;
import com.sailfish.insistent.RetryableFunction;
import com.sailfish.insistent.RetryableOperation;
import com.sailfish.insistent.retry.RetryStrategy;
import com.sailfish.insistent.service.RetryDecorator;
import com.sailfish.insistent.service.RetryingCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Default implementation of the RetryDecorator.
 * Holds the strategy, the progress logger and the executors; every call gets its own {@link RetryExecution}.
 *
 * Assumes the executors are managed by the caller. The shared default scheduler uses a daemon thread
 * and is never shut down.
 */
public class RetryDecoratorImpl implements RetryDecorator {

    private static final Logger log = LoggerFactory.getLogger(RetryDecoratorImpl.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ScheduledExecutorService SHARED_SCHEDULER = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "insistent-retry-scheduler-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final RetryStrategy strategy;
    private final RetryLogger retryLogger;
    private final Predicate<Throwable> retryOn;
    private final Executor taskExecutor; // Pool running the attempts
    private final ScheduledExecutorService scheduler; // Timers for the waits between attempts

    public RetryDecoratorImpl(RetryStrategy strategy,
                              RetryLogger retryLogger,
                              Predicate<Throwable> retryOn,
                              Executor taskExecutor,
                              ScheduledExecutorService scheduler) {
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
        this.retryLogger = Objects.requireNonNull(retryLogger, "retryLogger cannot be null");
        this.retryOn = Objects.requireNonNull(retryOn, "retryOn cannot be null");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        log.info("RetryDecorator initialized with strategy={}", strategy);
    }

    /**
     * @return The daemon scheduler used when none is configured.
     */
    public static ScheduledExecutorService sharedScheduler() {
        return SHARED_SCHEDULER;
    }

    @Override
    public <T> RetryingCall<T> decorate(RetryableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return decorateAsync(context -> CompletableFuture.supplyAsync(() -> {
            try {
                return operation.execute(context);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, taskExecutor));
    }

    @Override
    public <T> RetryingCall<T> decorateAsync(AsyncRetryableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return () -> {
            log.debug("Starting retry cycle for {}", operation);
            return new RetryExecution<>(operation, strategy.produceSequence(), retryLogger, retryOn, taskExecutor, scheduler)
                    .start();
        };
    }

    @Override
    public <A, T> Function<A, CompletableFuture<Optional<T>>> decorateFunction(RetryableFunction<A, T> function) {
        Objects.requireNonNull(function, "function cannot be null");
        return argument -> decorate(context -> function.apply(argument, context)).call();
    }

    @Override
    public RetryStrategy getStrategy() {
        return strategy;
    }
}
