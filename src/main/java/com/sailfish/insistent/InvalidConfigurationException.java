package com.sailfish.insistent;

/**
 * Thrown synchronously when a retry configuration is invalid: a non-positive timeout or retry count,
 * a strategy requested before its inputs were set, or a build without a strategy.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
