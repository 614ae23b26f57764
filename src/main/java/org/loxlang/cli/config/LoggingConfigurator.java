package org.loxlang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging.level} and {@code logging.loggers} settings to Logback.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and any per-logger levels found in the configuration.
     * Unknown level names are read as {@code WARN}.
     *
     * @param config the application configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.level"), Level.WARN));
        }

        if (config.hasPath("logging.loggers")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.loggers").entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.WARN));
            }
        }
    }
}
