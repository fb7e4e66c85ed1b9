package com.sailfish.insistent.service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A decorated operation. Every call starts an independent retry cycle with its own attempt counter and timeout sequence.
 *
 * @param <T> The type of the value produced by the operation.
 */
@FunctionalInterface
public interface RetryingCall<T> {

    /**
     * Starts a retry cycle and returns without waiting for it.
     *
     * @return A future completed with the operation's value (empty if the value was null), or with an empty
     * Optional once all scheduled attempts have failed. Cancelling it stops any pending retry.
     */
    CompletableFuture<Optional<T>> call();
}
