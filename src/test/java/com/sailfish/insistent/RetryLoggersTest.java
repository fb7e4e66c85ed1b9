package com.sailfish.insistent;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RetryLoggersTest {

    @Test
    void consoleLoggerPrefixesAndJoinsValues() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        RetryLogger logger = RetryLoggers.console(new PrintStream(buffer, true, StandardCharsets.UTF_8), "[RetryLogger]");

        logger.log("Retrying in", 2, "seconds");

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("[RetryLogger] Retrying in 2 seconds" + System.lineSeparator());
    }

    @Test
    void slf4jLoggerAcceptsAnyValues() {
        assertThatCode(() -> RetryLoggers.slf4j().log("attempt", null, 3)).doesNotThrowAnyException();
        assertThat(RetryLoggers.join()).isEmpty();
        assertThat(RetryLoggers.join("a", null, 1)).isEqualTo("a null 1");
    }
}
