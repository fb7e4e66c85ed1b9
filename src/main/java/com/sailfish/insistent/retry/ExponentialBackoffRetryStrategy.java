package com.sailfish.insistent.retry;

import com.sailfish.insistent.InvalidConfigurationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Objects;

/**
 * A retry strategy implementing exponential backoff: retry {@code i} waits {@code initialTimeout * factor^i}.
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);
    // the longest Duration; larger delays saturate to it
    private static final Duration LONGEST_DURATION = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);
    private static final BigDecimal LONGEST_DURATION_NANOS = toNanos(LONGEST_DURATION);

    private final RetryConfiguration configuration;
    private final double factor;
    private final Duration maxDelay; // Optional: cap the maximum delay

    public ExponentialBackoffRetryStrategy(RetryConfiguration configuration, double factor) {
        this(configuration, factor, null);
    }

    /**
     * Creates a configurable ExponentialBackoffRetryStrategy.
     *
     * @param configuration Initial timeout and retry count.
     * @param factor Factor by which the timeout changes for each subsequent retry. Must be positive;
     *               1 behaves like a fixed strategy, below 1 the timeouts shrink.
     * @param maxDelay Optional maximum delay cap. Set to null to disable.
     * @throws InvalidConfigurationException if the factor is not a positive number or maxDelay is not positive.
     */
    public ExponentialBackoffRetryStrategy(RetryConfiguration configuration, double factor, Duration maxDelay) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new InvalidConfigurationException("factor has to be a positive number, was " + factor);
        }
        if (maxDelay != null && (maxDelay.isNegative() || maxDelay.isZero())) {
            throw new InvalidConfigurationException("maxDelay has to be positive, was " + maxDelay);
        }
        this.factor = factor;
        this.maxDelay = maxDelay;
    }

    @Override
    public RetryConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public Duration timeoutFor(int retryIndex) {
        BigDecimal delayNanos = toNanos(configuration.getInitialTimeout())
                .multiply(BigDecimal.valueOf(factor).pow(retryIndex, MathContext.DECIMAL128));
        if (maxDelay != null) {
            delayNanos = delayNanos.min(toNanos(maxDelay));
        }
        if (delayNanos.compareTo(LONGEST_DURATION_NANOS) >= 0) {
            return LONGEST_DURATION;
        }
        BigInteger[] secondsAndNanos = delayNanos.setScale(0, RoundingMode.HALF_UP)
                .max(BigDecimal.ONE)
                .toBigInteger()
                .divideAndRemainder(NANOS_PER_SECOND.toBigInteger());
        return Duration.ofSeconds(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValueExact());
    }

    private static BigDecimal toNanos(Duration duration) {
        return BigDecimal.valueOf(duration.getSeconds()).multiply(NANOS_PER_SECOND).add(BigDecimal.valueOf(duration.getNano()));
    }

    public double getFactor() {
        return factor;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryStrategy{" +
               configuration +
               ", factor=" + factor +
               ", maxDelay=" + maxDelay +
               '}';
    }
}
