package com.sailfish.insistent.model;

/**
 * Represents the states a single invocation of a decorated operation moves through.
 */
public enum AttemptStatus {
    /**
     * The operation is currently being invoked.
     */
    ATTEMPTING,
    /**
     * The attempt failed and the next one is waiting for its timeout to elapse.
     */
    SCHEDULING_RETRY,
    /**
     * The operation returned a value. Terminal.
     */
    SUCCESS,
    /**
     * The last scheduled attempt failed, or a failure was classified as not retryable. Terminal.
     */
    EXHAUSTED
}
