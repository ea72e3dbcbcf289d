package org.pointerviz.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class LoggingConfiguratorTest {

    private static final String LOGGER = "org.pointerviz.layout";

    @AfterEach
    void resetLevel() {
        ((Logger) LoggerFactory.getLogger(LOGGER)).setLevel(null);
    }

    @Test
    void appliesDottedLoggerNames() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging.levels { "org.pointerviz.layout" = DEBUG }
                """));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER)).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void rejectsUnknownLevel() {
        assertThatThrownBy(() -> LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging.levels { "org.pointerviz.layout" = LOUD }
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("LOUD");
    }

    @Test
    void emptyConfigChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER)).getLevel()).isNull();
    }
}
