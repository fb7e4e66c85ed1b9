package com.sailfish.insistent.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-attempt information handed to the decorated operation.
 * Lets the operation make retry-aware decisions, for example logging or returning early on its last try.
 */
public final class RetryContext {

    private final int tryCount;
    private final Duration nextTimeout; // null on the last scheduled attempt

    public RetryContext(int tryCount, Optional<Duration> nextTimeout) {
        if (tryCount < 1) {
            throw new IllegalArgumentException("tryCount must be at least 1");
        }
        Objects.requireNonNull(nextTimeout, "nextTimeout cannot be null");
        this.tryCount = tryCount;
        this.nextTimeout = nextTimeout.orElse(null);
    }

    /**
     * @return The attempt number, starting at 1.
     */
    public int getTryCount() {
        return tryCount;
    }

    /**
     * @return The wait before the next attempt if this one fails, or empty when no attempt follows.
     */
    public Optional<Duration> getNextTimeout() {
        return Optional.ofNullable(nextTimeout);
    }

    public boolean isLastAttempt() {
        return nextTimeout == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryContext that = (RetryContext) o;
        return tryCount == that.tryCount && Objects.equals(nextTimeout, that.nextTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tryCount, nextTimeout);
    }

    @Override
    public String toString() {
        return "RetryContext{" +
               "tryCount=" + tryCount +
               ", nextTimeout=" + nextTimeout +
               '}';
    }
}
