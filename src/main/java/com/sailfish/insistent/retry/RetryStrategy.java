package com.sailfish.insistent.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Defines how long to wait before each retry of a failed operation.
 * Implementations are immutable and may be shared between concurrent invocations.
 */
public interface RetryStrategy {

    /**
     * @return The configuration this strategy was created from.
     */
    RetryConfiguration getConfiguration();

    /**
     * Calculates the wait before a retry.
     *
     * @param retryIndex 0-based index of the retry, lower than {@code getConfiguration().getMaxRetries()}.
     * @return A positive duration.
     */
    Duration timeoutFor(int retryIndex);

    /**
     * Produces a fresh timeout sequence of {@code maxRetries + 1} elements.
     * The first {@code maxRetries} elements hold the waits; the last one is empty and marks that no retry follows.
     *
     * @return An unmodifiable list, independent of any previously produced one.
     */
    default List<Optional<Duration>> produceSequence() {
        int maxRetries = getConfiguration().getMaxRetries();
        List<Optional<Duration>> sequence = new ArrayList<>(maxRetries + 1);
        for (int i = 0; i < maxRetries; i++) {
            sequence.add(Optional.of(timeoutFor(i)));
        }
        sequence.add(Optional.empty());
        return Collections.unmodifiableList(sequence);
    }
}
