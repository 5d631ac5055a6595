package org.pipesteps.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pipesteps.cli.LogLevelHighlightConverter.AnsiColor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class LogLevelHighlightConverterTest {

    @Mock
    private ILoggingEvent event;

    private static LogLevelHighlightConverter started(String... options) {
        LogLevelHighlightConverter converter = new LogLevelHighlightConverter();
        converter.setContext(new LoggerContext());
        converter.setOptionList(List.of(options));
        converter.start();
        return converter;
    }

    @Test
    void colorsErrorRed() {
        when(event.getLevel()).thenReturn(Level.ERROR);

        assertThat(started().transform(event, "ERROR"))
            .isEqualTo(AnsiColor.RED.code + "ERROR" + LogLevelHighlightConverter.ANSI_RESET);
    }

    @Test
    void colorsDebugGrayAndLeavesTraceUncolored() {
        LogLevelHighlightConverter converter = started();

        when(event.getLevel()).thenReturn(Level.DEBUG);
        assertThat(converter.transform(event, "DEBUG")).startsWith(AnsiColor.GRAY.code);

        when(event.getLevel()).thenReturn(Level.TRACE);
        assertThat(converter.transform(event, "TRACE")).isEqualTo("TRACE");
    }

    @Test
    void patternOptionsOverrideLevelColors() {
        LogLevelHighlightConverter converter = started("warn=magenta", " INFO = none ");

        when(event.getLevel()).thenReturn(Level.WARN);
        assertThat(converter.transform(event, "WARN"))
            .isEqualTo(AnsiColor.MAGENTA.code + "WARN" + LogLevelHighlightConverter.ANSI_RESET);

        when(event.getLevel()).thenReturn(Level.INFO);
        assertThat(converter.transform(event, "INFO")).isEqualTo("INFO");
    }

    @Test
    void invalidOptionsKeepDefaults() {
        LogLevelHighlightConverter converter = started("WARN=plaid", "FATAL=red", "no-separator");

        assertThat(converter.getContext().getStatusManager().getCopyOfStatusList())
            .filteredOn(status -> status.getMessage().startsWith("Ignoring level color option"))
            .hasSize(3);
        when(event.getLevel()).thenReturn(Level.WARN);
        assertThat(converter.transform(event, "WARN")).startsWith(AnsiColor.YELLOW.code);
    }
}
