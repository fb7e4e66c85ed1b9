package com.sailfish.insistent.service.impl;

import com.sailfish.insistent.AsyncRetryableOperation;
import com.sailfish.insistent.RetryLogger;
import com.sailfish.insistent.model.AttemptStatus;
import com.sailfish.insistent.model.RetryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Drives a single invocation of a decorated operation through its timeout sequence.
 * <p>
 * Every attempt is started either by the caller or by a task submitted to the task executor once the wait
 * scheduled on the scheduler has elapsed, so at most one attempt of an execution is in flight at any time.
 * The attempt state is handed from one attempt to the next through the executors, which publish it safely.
 */
class RetryExecution<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryExecution.class);
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final AsyncRetryableOperation<T> operation;
    private final Iterator<Optional<Duration>> timeouts;
    private final RetryLogger retryLogger;
    private final Predicate<Throwable> retryOn;
    private final Executor taskExecutor;
    private final ScheduledExecutorService scheduler;
    private final CompletableFuture<Optional<T>> result = new CompletableFuture<>();

    private volatile ScheduledFuture<?> pendingRetry;
    private volatile AttemptStatus status;
    private int tryCount = 1;
    private long startNanos;

    RetryExecution(AsyncRetryableOperation<T> operation,
                   List<Optional<Duration>> timeouts,
                   RetryLogger retryLogger,
                   Predicate<Throwable> retryOn,
                   Executor taskExecutor,
                   ScheduledExecutorService scheduler) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts cannot be null").iterator();
        this.retryLogger = Objects.requireNonNull(retryLogger, "retryLogger cannot be null");
        this.retryOn = Objects.requireNonNull(retryOn, "retryOn cannot be null");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    CompletableFuture<Optional<T>> start() {
        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                cancelPendingRetry();
            }
        });
        startNanos = System.nanoTime();
        Optional<Duration> firstTimeout = timeouts.next();
        guarded(() -> attempt(firstTimeout));
        return result;
    }

    private void attempt(Optional<Duration> nextTimeout) {
        if (result.isDone()) {
            log.debug("Retry cycle already completed, skipping attempt #{}", tryCount);
            return;
        }
        transition(AttemptStatus.ATTEMPTING);
        report("Time elapsed before executing function " + formatSeconds(Duration.ofNanos(System.nanoTime() - startNanos))
               + " seconds");

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(operation.execute(new RetryContext(tryCount, nextTimeout)),
                                           "operation returned a null stage");
        } catch (Throwable t) {
            onFailure(t, nextTimeout);
            return;
        }
        stage.whenComplete((value, failure) -> guarded(() -> {
            if (failure != null) {
                onFailure(unwrap(failure), nextTimeout);
            } else {
                onSuccess(value);
            }
        }));
    }

    private void onSuccess(T value) {
        transition(AttemptStatus.SUCCESS);
        report("Decorated function returned a value successfully.");
        result.complete(Optional.ofNullable(value));
    }

    private void onFailure(Throwable failure, Optional<Duration> nextTimeout) {
        if (result.isDone()) {
            log.debug("Ignoring failure of attempt #{} after the retry cycle completed", tryCount, failure);
            return;
        }
        report("Exception was raised: " + failure);

        if (nextTimeout.isEmpty()) {
            exhausted("Decorated function tries count: #" + tryCount + " | No retries left | Returning no result.", failure);
            return;
        }
        if (!isRetryable(failure)) {
            exhausted("Decorated function tries count: #" + tryCount + " | Exception is not retryable | Returning no result.", failure);
            return;
        }

        Duration wait = nextTimeout.get();
        transition(AttemptStatus.SCHEDULING_RETRY);
        report("Decorated function tries count: #" + tryCount + " | Retrying in " + formatSeconds(wait)
               + " seconds | Continuing with Exception handlers.");
        startNanos = System.nanoTime();
        tryCount++;
        Optional<Duration> following = timeouts.next();
        try {
            pendingRetry = scheduler.schedule(() -> dispatch(following), saturatedNanos(wait), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            abort("Scheduler rejected retry #" + tryCount, e);
            return;
        }
        if (result.isCancelled()) {
            cancelPendingRetry();
        }
    }

    private void dispatch(Optional<Duration> nextTimeout) {
        try {
            taskExecutor.execute(() -> guarded(() -> attempt(nextTimeout)));
        } catch (RejectedExecutionException e) {
            abort("Task executor rejected attempt #" + tryCount, e);
        }
    }

    private boolean isRetryable(Throwable failure) {
        try {
            return retryOn.test(failure);
        } catch (RuntimeException e) {
            log.error("Retry predicate failed for {}, treating the failure as not retryable", failure.toString(), e);
            return false;
        }
    }

    /**
     * Runs a step of the retry loop. Anything escaping it completes the result exceptionally,
     * since steps run inside executors and completion callbacks that would otherwise drop it.
     */
    private void guarded(Runnable step) {
        try {
            step.run();
        } catch (Throwable t) {
            log.error("Retry cycle failed unexpectedly at attempt #{}", tryCount, t);
            result.completeExceptionally(t);
        }
    }

    private void exhausted(String message, Throwable lastFailure) {
        transition(AttemptStatus.EXHAUSTED);
        report(message);
        log.warn("Retry cycle exhausted after {} attempt(s), last failure absorbed: {}", tryCount, lastFailure.toString());
        result.complete(Optional.empty());
    }

    private void abort(String message, RejectedExecutionException e) {
        log.error("{}. Aborting retry cycle.", message, e);
        result.completeExceptionally(e);
    }

    private void cancelPendingRetry() {
        ScheduledFuture<?> retry = pendingRetry;
        if (retry != null && retry.cancel(false)) {
            log.debug("Cancelled pending retry #{}", tryCount);
        }
    }

    private void transition(AttemptStatus next) {
        log.debug("Attempt #{}: {} -> {}", tryCount, status, next);
        status = next;
    }

    private void report(String message) {
        try {
            retryLogger.log(message);
        } catch (RuntimeException e) {
            log.warn("Retry logger failed to report '{}'", message, e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static long saturatedNanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    private static String formatSeconds(Duration duration) {
        return String.format(Locale.ROOT, "%d.%03d", duration.getSeconds(), duration.getNano() / 1_000_000);
    }
}
