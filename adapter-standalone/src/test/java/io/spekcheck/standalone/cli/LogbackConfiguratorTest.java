package io.spekcheck.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.Encoder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LogbackConfigurator")
class LogbackConfiguratorTest {

    private final LoggerContext context = new LoggerContext();

    @Test
    @DisplayName("json format selects the JSON encoder")
    void json() {
        Encoder<ILoggingEvent> encoder = LogbackConfigurator.encoder(context, "JSON");

        assertThat(encoder).isInstanceOf(JsonEncoder.class);
        assertThat(encoder.isStarted()).isTrue();
    }

    @Test
    @DisplayName("any other format selects the text pattern")
    void text() {
        Encoder<ILoggingEvent> encoder = LogbackConfigurator.encoder(context, "text");

        assertThat(encoder).isInstanceOfSatisfying(PatternLayoutEncoder.class, p -> {
            assertThat(p.getPattern()).isEqualTo(LogbackConfigurator.TEXT_PATTERN);
            assertThat(p.isStarted()).isTrue();
        });
    }
}
