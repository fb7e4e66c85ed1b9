package com.sailfish.insistent.factory;

import com.sailfish.insistent.InvalidConfigurationException;
import com.sailfish.insistent.RetryLogger;
import com.sailfish.insistent.RetryLoggers;
import com.sailfish.insistent.retry.RetryConfiguration;
import com.sailfish.insistent.retry.RetryStrategy;
import com.sailfish.insistent.retry.RetryStrategyFactory;
import com.sailfish.insistent.retry.StrategyType;
import com.sailfish.insistent.service.RetryDecorator;
import com.sailfish.insistent.service.impl.RetryDecoratorImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Predicate;

/**
 * Assembles a {@link RetryDecorator} step by step.
 * <p>
 * Every setter validates its input immediately and throws {@link InvalidConfigurationException} on bad values.
 * The strategy is created when it is set, so {@link #setInitialTimeout} and {@link #setRetries} must be called first.
 * Not thread-safe.
 */
public class RetryDecoratorBuilder {

    private static final Logger log = LoggerFactory.getLogger(RetryDecoratorBuilder.class);

    public static final String PROPERTY_PREFIX = "insistent.";
    public static final String INITIAL_TIMEOUT_PROPERTY = PROPERTY_PREFIX + "initial-timeout";
    public static final String RETRIES_PROPERTY = PROPERTY_PREFIX + "retries";
    public static final String STRATEGY_PROPERTY = PROPERTY_PREFIX + "strategy";

    private Duration initialTimeout;
    private Integer retries;
    private RetryStrategy strategy;
    private RetryLogger logger = RetryLoggers.slf4j();
    private Predicate<Throwable> retryOn = failure -> true;
    private Executor taskExecutor = ForkJoinPool.commonPool();
    private ScheduledExecutorService scheduler = RetryDecoratorImpl.sharedScheduler();

    /**
     * Configures a builder from properties:
     * <ul>
     *     <li>{@code insistent.initial-timeout} - seconds, or an ISO-8601 duration</li>
     *     <li>{@code insistent.retries} - retry count</li>
     *     <li>{@code insistent.strategy} - {@code fixed} or {@code exponential}</li>
     *     <li>{@code insistent.strategy.<parameter>} - strategy parameters, e.g. {@code factor}</li>
     * </ul>
     * The logger and executors keep their defaults.
     *
     * @throws InvalidConfigurationException if a key is missing or holds an invalid value.
     */
    public static RetryDecoratorBuilder fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        String timeout = require(properties, INITIAL_TIMEOUT_PROPERTY);
        String retries = require(properties, RETRIES_PROPERTY);
        String strategyName = require(properties, STRATEGY_PROPERTY);

        int parsedRetries;
        try {
            parsedRetries = Integer.parseInt(retries.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Cannot parse " + RETRIES_PROPERTY + " '" + retries + "'", e);
        }

        String parameterPrefix = STRATEGY_PROPERTY + ".";
        Map<String, String> parameters = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(parameterPrefix)) {
                parameters.put(key.substring(parameterPrefix.length()), properties.getProperty(key));
            }
        }
        log.debug("Loaded retry configuration: timeout={}, retries={}, strategy={}, parameters={}",
                  timeout, retries, strategyName, parameters);

        return new RetryDecoratorBuilder()
                .setInitialTimeout(RetryConfiguration.parseTimeout(timeout))
                .setRetries(parsedRetries)
                .setStrategy(strategyName, parameters);
    }

    private static String require(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidConfigurationException("Missing property '" + key + "'");
        }
        return value;
    }

    /**
     * Sets the wait before the first retry.
     *
     * @throws InvalidConfigurationException if the timeout is null, zero or negative.
     */
    public RetryDecoratorBuilder setInitialTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigurationException("Timeout has to be bigger than 0, was " + timeout);
        }
        this.initialTimeout = timeout;
        return this;
    }

    public RetryDecoratorBuilder setInitialTimeout(long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new InvalidConfigurationException("Timeout has to be bigger than 0, was " + timeoutSeconds);
        }
        return setInitialTimeout(Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * Sets how many times a failed operation is retried; it is invoked at most {@code retries + 1} times.
     *
     * @throws InvalidConfigurationException if retries is zero or negative.
     */
    public RetryDecoratorBuilder setRetries(int retries) {
        if (retries <= 0) {
            throw new InvalidConfigurationException("Retries count has to be bigger than 0, was " + retries);
        }
        this.retries = retries;
        return this;
    }

    /**
     * Creates the strategy from the timeout and retry count set so far.
     *
     * @param factory e.g. {@code RetryStrategyFactory.exponential(2)} or {@code FixedRetryStrategy::new}.
     * @throws InvalidConfigurationException if the timeout or retry count has not been set, or the factory rejects them.
     */
    public RetryDecoratorBuilder setStrategy(RetryStrategyFactory factory) {
        Objects.requireNonNull(factory, "factory cannot be null");
        if (initialTimeout == null || retries == null) {
            throw new InvalidConfigurationException("Initial timeout and retries have to be set before the strategy");
        }
        RetryStrategy created = factory.create(new RetryConfiguration(initialTimeout, retries));
        if (created == null) {
            throw new InvalidConfigurationException("Strategy factory returned no strategy");
        }
        this.strategy = created;
        return this;
    }

    /**
     * Creates one of the named strategies, see {@link StrategyType}.
     *
     * @throws InvalidConfigurationException if the name is unknown or the parameters are invalid.
     */
    public RetryDecoratorBuilder setStrategy(String name, Map<String, String> parameters) {
        StrategyType type = StrategyType.fromName(name)
                .orElseThrow(() -> new InvalidConfigurationException("Unknown retry strategy '" + name + "'"));
        return setStrategy(type.factory(parameters == null ? Map.of() : parameters));
    }

    /**
     * @param logger The progress logger, or null for the default one forwarding to SLF4J.
     */
    public RetryDecoratorBuilder setLogger(RetryLogger logger) {
        this.logger = logger != null ? logger : RetryLoggers.slf4j();
        return this;
    }

    /**
     * Restricts which failures are retried. A failure rejected by the predicate ends the retry cycle
     * the same way an exhausted sequence does. Defaults to retrying every failure.
     */
    public RetryDecoratorBuilder setRetryOn(Predicate<Throwable> retryOn) {
        this.retryOn = Objects.requireNonNull(retryOn, "retryOn cannot be null");
        return this;
    }

    /**
     * Executor running the attempts. Defaults to {@link ForkJoinPool#commonPool()}.
     */
    public RetryDecoratorBuilder setTaskExecutor(Executor taskExecutor) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        return this;
    }

    /**
     * Scheduler timing the waits between attempts. Defaults to a shared daemon scheduler.
     */
    public RetryDecoratorBuilder setScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        return this;
    }

    /**
     * @throws InvalidConfigurationException if no strategy was set.
     */
    public RetryDecorator build() {
        if (strategy == null) {
            throw new InvalidConfigurationException("A strategy has to be set before building the decorator");
        }
        return new RetryDecoratorImpl(strategy, logger, retryOn, taskExecutor, scheduler);
    }
}
