package ghost.overlay.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ghost.overlay.config.LogFormat;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

    @Test
    void jsonFormatWrapsSimpleJsonLayout() {
        LoggerContext context = new LoggerContext();

        Encoder<ILoggingEvent> encoder = LoggingConfigurator.encoderFor(context, LogFormat.JSON);

        assertThat(encoder).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) encoder).getLayout()).isInstanceOf(SimpleJsonLayout.class);
        assertThat(encoder.isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPattern() {
        LoggerContext context = new LoggerContext();

        Encoder<ILoggingEvent> encoder = LoggingConfigurator.encoderFor(context, LogFormat.TEXT);

        assertThat(encoder).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) encoder).getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }

    @Test
    void reconfiguresRootAppenders() {
        assertThatCode(() -> {
            LoggingConfigurator.configure(LogFormat.JSON);
            LoggingConfigurator.configure(LogFormat.TEXT);
        }).doesNotThrowAnyException();
    }
}
