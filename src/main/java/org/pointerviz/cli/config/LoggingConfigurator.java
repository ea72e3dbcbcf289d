package org.pointerviz.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logger levels from the {@code logging} section of the configuration to Logback.
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels { "org.pointerviz.layout" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final String DEFAULT_LEVEL_PATH = "logging.default-level";
    private static final String LEVELS_PATH = "logging.levels";

    private LoggingConfigurator() {
    }

    /**
     * @param config the resolved application configuration.
     * @throws IllegalArgumentException if a level name is not a Logback level.
     */
    public static void configure(Config config) {
        if (config.hasPath(DEFAULT_LEVEL_PATH)) {
            setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, config.getString(DEFAULT_LEVEL_PATH));
        }
        if (config.hasPath(LEVELS_PATH)) {
            // quoted keys such as "org.pointerviz.layout" stay single keys here
            for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS_PATH).entrySet()) {
                setLevel(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
    }

    static void setLevel(String loggerName, String levelName) {
        Level level = Level.toLevel(levelName, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level '" + levelName + "' for logger " + loggerName);
        }
        ((Logger) LoggerFactory.getLogger(loggerName)).setLevel(level);
    }
}
