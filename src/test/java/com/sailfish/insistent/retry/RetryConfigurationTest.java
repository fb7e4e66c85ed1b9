package com.sailfish.insistent.retry;

import com.sailfish.insistent.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryConfigurationTest {

    @Test
    @DisplayName("Should reject non-positive timeouts at construction")
    void shouldRejectNonPositiveTimeouts() {
        assertThatThrownBy(() -> new RetryConfiguration(Duration.ZERO, 3))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new RetryConfiguration(Duration.ofSeconds(-5), 3))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new RetryConfiguration(null, 3))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject non-positive retry counts at construction")
    void shouldRejectNonPositiveRetries() {
        assertThatThrownBy(() -> new RetryConfiguration(Duration.ofSeconds(1), 0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Retries");
        assertThatThrownBy(() -> new RetryConfiguration(Duration.ofSeconds(1), -1))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void parsesSecondsAndIsoDurations() {
        assertThat(RetryConfiguration.parseTimeout("5")).isEqualTo(Duration.ofSeconds(5));
        assertThat(RetryConfiguration.parseTimeout(" PT0.25S ")).isEqualTo(Duration.ofMillis(250));
        assertThat(RetryConfiguration.parseTimeout("-5")).isEqualTo(Duration.ofSeconds(-5));
    }

    @Test
    void rejectsUnparseableTimeouts() {
        assertThatThrownBy(() -> RetryConfiguration.parseTimeout("soon"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("soon");
        assertThatThrownBy(() -> RetryConfiguration.parseTimeout(" "))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
