package org.pipesteps.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration block:
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels { "org.pipesteps.datapipeline.services.BatchPipeline" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (config.hasPath("logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(parseLevel(config.getString("logging.default-level"), "logging.default-level"));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                // Keys may be quoted paths; the unwrapped key is the logger name
                String loggerName = entry.getKey();
                Logger logger = context.getLogger(loggerName);
                logger.setLevel(parseLevel(String.valueOf(entry.getValue().unwrapped()), "logging.levels." + loggerName));
            }
        }
    }

    static Level parseLevel(String value, String key) {
        Level level = Level.toLevel(value, null);
        if (level == null) {
            throw new IllegalArgumentException("Invalid log level '" + value + "' for " + key);
        }
        return level;
    }
}
