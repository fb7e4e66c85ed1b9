package com.sailfish.insistent.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits the initial timeout before every retry.
 */
public class FixedRetryStrategy implements RetryStrategy {

    private final RetryConfiguration configuration;

    public FixedRetryStrategy(RetryConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
    }

    @Override
    public RetryConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public Duration timeoutFor(int retryIndex) {
        return configuration.getInitialTimeout();
    }

    @Override
    public String toString() {
        return "FixedRetryStrategy{" + configuration + '}';
    }
}
