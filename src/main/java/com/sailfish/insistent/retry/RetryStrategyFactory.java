package com.sailfish.insistent.retry;

import java.time.Duration;

/**
 * Creates a strategy once the initial timeout and retry count are known.
 * Typically a constructor reference such as {@code FixedRetryStrategy::new}.
 */
@FunctionalInterface
public interface RetryStrategyFactory {

    RetryStrategy create(RetryConfiguration configuration);

    static RetryStrategyFactory fixed() {
        return FixedRetryStrategy::new;
    }

    static RetryStrategyFactory exponential(double factor) {
        return configuration -> new ExponentialBackoffRetryStrategy(configuration, factor);
    }

    static RetryStrategyFactory exponential(double factor, Duration maxDelay) {
        return configuration -> new ExponentialBackoffRetryStrategy(configuration, factor, maxDelay);
    }
}
