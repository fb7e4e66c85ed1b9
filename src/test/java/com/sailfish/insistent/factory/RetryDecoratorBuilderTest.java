package com.sailfish.insistent.factory;

import com.sailfish.insistent.InvalidConfigurationException;
import com.sailfish.insistent.retry.ExponentialBackoffRetryStrategy;
import com.sailfish.insistent.retry.FixedRetryStrategy;
import com.sailfish.insistent.retry.RetryStrategyFactory;
import com.sailfish.insistent.service.RetryDecorator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryDecoratorBuilderTest {

    @Test
    @DisplayName("Should reject zero and negative initial timeouts")
    void shouldRejectNonPositiveTimeout() {
        RetryDecoratorBuilder builder = new RetryDecoratorBuilder();

        assertThatThrownBy(() -> builder.setInitialTimeout(0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> builder.setInitialTimeout(-5)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> builder.setInitialTimeout(Duration.ZERO)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> builder.setInitialTimeout(null)).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject a zero retry count")
    void shouldRejectZeroRetries() {
        assertThatThrownBy(() -> new RetryDecoratorBuilder().setRetries(0))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("Should require timeout and retries before the strategy")
    void shouldRequireTimeoutAndRetriesBeforeStrategy() {
        assertThatThrownBy(() -> new RetryDecoratorBuilder().setStrategy(RetryStrategyFactory.fixed()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new RetryDecoratorBuilder().setInitialTimeout(1).setStrategy(RetryStrategyFactory.fixed()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new RetryDecoratorBuilder().setRetries(3).setStrategy(RetryStrategyFactory.fixed()))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("Should refuse to build without a strategy")
    void shouldRefuseToBuildWithoutStrategy() {
        RetryDecoratorBuilder builder = new RetryDecoratorBuilder().setInitialTimeout(1).setRetries(3);

        assertThatThrownBy(builder::build)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("strategy");
    }

    @Test
    void buildsDecoratorWithConfiguredStrategy() {
        // When
        RetryDecorator decorator = new RetryDecoratorBuilder()
                .setInitialTimeout(1)
                .setRetries(3)
                .setLogger(null)
                .setStrategy(RetryStrategyFactory.exponential(2))
                .build();

        // Then
        assertThat(decorator.getStrategy()).isInstanceOf(ExponentialBackoffRetryStrategy.class);
        assertThat(decorator.getStrategy().produceSequence()).containsExactly(
                Optional.of(Duration.ofSeconds(1)),
                Optional.of(Duration.ofSeconds(2)),
                Optional.of(Duration.ofSeconds(4)),
                Optional.empty());
    }

    @Test
    void acceptsConstructorReferencesAndNamedStrategies() {
        RetryDecoratorBuilder builder = new RetryDecoratorBuilder().setInitialTimeout(Duration.ofMillis(500)).setRetries(2);

        assertThat(builder.setStrategy(FixedRetryStrategy::new).build().getStrategy()).isInstanceOf(FixedRetryStrategy.class);
        assertThat(builder.setStrategy("exponential", Map.of("factor", "4")).build().getStrategy().timeoutFor(1))
                .isEqualTo(Duration.ofSeconds(2));
        assertThatThrownBy(() -> builder.setStrategy("linear", Map.of()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("linear");
    }

    @Test
    @DisplayName("Should configure the decorator from a properties file")
    void shouldConfigureFromProperties() throws IOException {
        // Given
        Properties properties = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/insistent-test.properties")) {
            properties.load(in);
        }

        // When
        RetryDecorator decorator = RetryDecoratorBuilder.fromProperties(properties).build();

        // Then
        assertThat(decorator.getStrategy().produceSequence()).containsExactly(
                Optional.of(Duration.ofSeconds(1)),
                Optional.of(Duration.ofSeconds(2)),
                Optional.of(Duration.ofSeconds(4)),
                Optional.empty());
    }

    @Test
    void rejectsIncompleteOrInvalidProperties() {
        Properties properties = new Properties();
        properties.setProperty(RetryDecoratorBuilder.INITIAL_TIMEOUT_PROPERTY, "PT0.1S");
        properties.setProperty(RetryDecoratorBuilder.STRATEGY_PROPERTY, "fixed");

        assertThatThrownBy(() -> RetryDecoratorBuilder.fromProperties(properties))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining(RetryDecoratorBuilder.RETRIES_PROPERTY);

        properties.setProperty(RetryDecoratorBuilder.RETRIES_PROPERTY, "three");
        assertThatThrownBy(() -> RetryDecoratorBuilder.fromProperties(properties))
                .isInstanceOf(InvalidConfigurationException.class);

        properties.setProperty(RetryDecoratorBuilder.RETRIES_PROPERTY, "0");
        assertThatThrownBy(() -> RetryDecoratorBuilder.fromProperties(properties))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
