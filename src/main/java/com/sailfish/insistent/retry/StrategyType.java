package com.sailfish.insistent.retry;

import com.sailfish.insistent.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of strategy variants that can be selected by name, e.g. from a properties file.
 * Each variant turns its string parameters into a {@link RetryStrategyFactory}.
 */
public enum StrategyType {

    FIXED("fixed") {
        @Override
        public RetryStrategyFactory factory(Map<String, String> parameters) {
            checkParameters(parameters, Collections.emptySet());
            return RetryStrategyFactory.fixed();
        }
    },

    EXPONENTIAL("exponential") {
        @Override
        public RetryStrategyFactory factory(Map<String, String> parameters) {
            checkParameters(parameters, Set.of(FACTOR, MAX_DELAY));
            String factor = parameters.get(FACTOR);
            if (factor == null) {
                throw new InvalidConfigurationException("Strategy '" + getName() + "' requires parameter '" + FACTOR + "'");
            }
            double parsedFactor;
            try {
                parsedFactor = Double.parseDouble(factor.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("Cannot parse " + FACTOR + " '" + factor + "'", e);
            }
            String maxDelay = parameters.get(MAX_DELAY);
            Duration parsedMaxDelay = maxDelay == null ? null : RetryConfiguration.parseTimeout(maxDelay);
            return RetryStrategyFactory.exponential(parsedFactor, parsedMaxDelay);
        }
    };

    public static final String FACTOR = "factor";
    public static final String MAX_DELAY = "max-delay";

    private static final Logger log = LoggerFactory.getLogger(StrategyType.class);

    private final String name;

    StrategyType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Builds the factory for this variant.
     *
     * @param parameters Variant specific parameters keyed by name. Unknown keys are rejected.
     * @throws InvalidConfigurationException if a parameter is missing, unknown or malformed.
     */
    public abstract RetryStrategyFactory factory(Map<String, String> parameters);

    /**
     * Looks a variant up by its case-insensitive name.
     *
     * @return The variant, or empty if no variant has that name.
     */
    public static Optional<StrategyType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StrategyType type : values()) {
            if (type.name.equals(normalized)) {
                return Optional.of(type);
            }
        }
        log.warn("No retry strategy found for name: {}", name);
        return Optional.empty();
    }

    void checkParameters(Map<String, String> parameters, Set<String> accepted) {
        Set<String> unknown = new HashSet<>(parameters.keySet());
        unknown.removeAll(accepted);
        if (!unknown.isEmpty()) {
            throw new InvalidConfigurationException("Unknown parameters " + unknown + " for strategy '" + name + "'");
        }
    }
}
