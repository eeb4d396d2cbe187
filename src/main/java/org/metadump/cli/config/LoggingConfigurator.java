package org.metadump.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies logger levels from configuration on top of {@code logback.xml}.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.metadump.graph" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the application configuration; missing keys leave logback's setup untouched.
     * @throws IllegalArgumentException if a level name is not recognized.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(parse(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            // Keys are dotted logger names, so read the raw entries rather than nested paths.
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String loggerName = entry.getKey();
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(parse(level));
            }
        }
    }

    static Level parse(String level) {
        Level parsed = Level.toLevel(level, null);
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown log level: " + level);
        }
        return parsed;
    }
}
