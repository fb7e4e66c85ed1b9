package com.sailfish.insistent;

/**
 * Side channel receiving progress reports from the retry loop.
 * It is called before every attempt, on every failure, when a retry is scheduled, on success and on exhaustion.
 * Its outcome never changes how the retry loop proceeds.
 */
@FunctionalInterface
public interface RetryLogger {

    /**
     * Reports one progress line.
     *
     * @param values The loggable values, usually a single message string.
     */
    void log(Object... values);
}
