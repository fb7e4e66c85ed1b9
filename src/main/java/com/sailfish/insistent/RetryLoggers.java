package com.sailfish.insistent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Factory methods for the stock {@link RetryLogger} implementations.
 */
public final class RetryLoggers {

    /** Name of the SLF4J logger used by {@link #slf4j()}. */
    public static final String DEFAULT_LOGGER_NAME = "com.sailfish.insistent.RetryLogger";

    private RetryLoggers() {
    }

    /**
     * The default progress logger. Forwards every line to SLF4J at INFO level,
     * so the configured console appender prints it.
     */
    public static RetryLogger slf4j() {
        return slf4j(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
    }

    /**
     * Forwards every line to the given SLF4J logger at INFO level.
     *
     * @param logger The target logger.
     */
    public static RetryLogger slf4j(Logger logger) {
        Objects.requireNonNull(logger, "logger cannot be null");
        return values -> {
            if (logger.isInfoEnabled()) {
                logger.info(join(values));
            }
        };
    }

    /**
     * Prints every line to standard output, prefixed with the given tag (e.g. {@code [RetryLogger]}).
     */
    public static RetryLogger console(String prefix) {
        return console(System.out, prefix);
    }

    /**
     * Prints every line to the given stream, prefixed with the given tag.
     *
     * @param out The target stream.
     * @param prefix Tag put before every line; null or empty for none.
     */
    public static RetryLogger console(PrintStream out, String prefix) {
        Objects.requireNonNull(out, "out cannot be null");
        return values -> {
            String line = join(values);
            out.println(prefix == null || prefix.isEmpty() ? line : prefix + " " + line);
        };
    }

    static String join(Object... values) {
        if (values == null) {
            return "";
        }
        return Arrays.stream(values).map(String::valueOf).collect(Collectors.joining(" "));
    }
}
