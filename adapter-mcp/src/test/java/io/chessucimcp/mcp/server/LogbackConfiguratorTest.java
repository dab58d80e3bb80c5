package io.chessucimcp.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("Logback configurator")
class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restore() {
        LogbackConfigurator.configure("text", "INFO");
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> stderrAppender() {
        Appender<ILoggingEvent> appender = root.getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        return (ConsoleAppender<ILoggingEvent>) appender;
    }

    @Test
    @DisplayName("Text format → pattern encoder on stderr, requested level")
    void textFormat() {
        LogbackConfigurator.configure("text", "DEBUG");

        ConsoleAppender<ILoggingEvent> appender = stderrAppender();
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.TEXT_PATTERN);
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @DisplayName("JSON format → JsonEncoder, still on stderr")
    void jsonFormat() {
        LogbackConfigurator.configure("JSON", "warn");

        ConsoleAppender<ILoggingEvent> appender = stderrAppender();
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(root.getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @DisplayName("Unknown level falls back to INFO; schema validator quieted")
    void unknownLevel() {
        LogbackConfigurator.configure("text", "CHATTY");

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("com.networknt").getLevel()).isEqualTo(Level.WARN);
        assertThat(root.iteratorForAppenders()).toIterable().hasSize(1);
    }
}
