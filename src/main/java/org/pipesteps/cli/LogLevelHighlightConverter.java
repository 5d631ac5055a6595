package org.pipesteps.cli;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the level of console log lines.
 *
 * <p>Defaults: ERROR red, WARN yellow, INFO cyan, DEBUG gray, TRACE uncolored. Individual levels
 * can be recolored through pattern options, e.g. {@code %levelColor(%-5level){WARN=magenta, INFO=none}}.
 * Unknown levels or color names are reported as Logback status warnings and ignored.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";

    /** Terminal colors accepted in pattern options. */
    enum AnsiColor {
        NONE(""),
        RED("\u001B[31m"),
        GREEN("\u001B[32m"),
        YELLOW("\u001B[33m"),
        BLUE("\u001B[34m"),
        MAGENTA("\u001B[35m"),
        CYAN("\u001B[36m"),
        GRAY("\u001B[90m");

        final String code;

        AnsiColor(String code) {
            this.code = code;
        }
    }

    private enum HighlightedLevel {
        ERROR(Level.ERROR_INT, AnsiColor.RED),
        WARN(Level.WARN_INT, AnsiColor.YELLOW),
        INFO(Level.INFO_INT, AnsiColor.CYAN),
        DEBUG(Level.DEBUG_INT, AnsiColor.GRAY),
        TRACE(Level.TRACE_INT, AnsiColor.NONE);

        final int levelInt;
        final AnsiColor defaultColor;

        HighlightedLevel(int levelInt, AnsiColor defaultColor) {
            this.levelInt = levelInt;
            this.defaultColor = defaultColor;
        }
    }

    private final Map<HighlightedLevel, AnsiColor> colors = new EnumMap<>(HighlightedLevel.class);

    public LogLevelHighlightConverter() {
        for (HighlightedLevel level : HighlightedLevel.values()) {
            colors.put(level, level.defaultColor);
        }
    }

    @Override
    public void start() {
        List<String> options = getOptionList();
        if (options != null) {
            for (String option : options) {
                applyOption(option);
            }
        }
        super.start();
    }

    private void applyOption(String option) {
        String[] parts = option.split("=", 2);
        if (parts.length != 2) {
            addWarn("Ignoring level color option '" + option + "', expected LEVEL=color");
            return;
        }
        try {
            HighlightedLevel level = HighlightedLevel.valueOf(parts[0].trim().toUpperCase(Locale.ROOT));
            AnsiColor color = AnsiColor.valueOf(parts[1].trim().toUpperCase(Locale.ROOT));
            colors.put(level, color);
        } catch (IllegalArgumentException e) {
            addWarn("Ignoring level color option '" + option + "': unknown level or color");
        }
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        int levelInt = event.getLevel().toInt();
        for (HighlightedLevel level : HighlightedLevel.values()) {
            if (level.levelInt == levelInt) {
                AnsiColor color = colors.get(level);
                return color == AnsiColor.NONE ? in : color.code + in + ANSI_RESET;
            }
        }
        return in;
    }
}
