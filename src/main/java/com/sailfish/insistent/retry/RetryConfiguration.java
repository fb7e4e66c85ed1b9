package com.sailfish.insistent.retry;

import com.sailfish.insistent.InvalidConfigurationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * The immutable inputs shared by every strategy: the first timeout and how many retries follow the first attempt.
 */
public final class RetryConfiguration {

    private final Duration initialTimeout;
    private final int maxRetries;

    /**
     * @param initialTimeout Wait before the first retry. Must be positive.
     * @param maxRetries Number of retries after the first attempt. Must be positive.
     * @throws InvalidConfigurationException if either value is not positive.
     */
    public RetryConfiguration(Duration initialTimeout, int maxRetries) {
        this.initialTimeout = requirePositive(initialTimeout);
        this.maxRetries = requirePositive(maxRetries);
    }

    static Duration requirePositive(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigurationException("Timeout has to be bigger than 0, was " + timeout);
        }
        return timeout;
    }

    static int requirePositive(int retries) {
        if (retries <= 0) {
            throw new InvalidConfigurationException("Retries count has to be bigger than 0, was " + retries);
        }
        return retries;
    }

    /**
     * Parses a timeout given either as whole seconds ({@code "5"}) or as an ISO-8601 duration ({@code "PT0.5S"}).
     *
     * @throws InvalidConfigurationException if the text is neither.
     */
    public static Duration parseTimeout(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidConfigurationException("Timeout cannot be blank");
        }
        String value = text.trim();
        try {
            if (value.chars().allMatch(c -> Character.isDigit(c) || c == '-')) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidConfigurationException("Cannot parse timeout '" + value + "'", e);
        }
    }

    public Duration getInitialTimeout() {
        return initialTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryConfiguration that = (RetryConfiguration) o;
        return maxRetries == that.maxRetries && initialTimeout.equals(that.initialTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialTimeout, maxRetries);
    }

    @Override
    public String toString() {
        return "RetryConfiguration{" +
               "initialTimeout=" + initialTimeout +
               ", maxRetries=" + maxRetries +
               '}';
    }
}
