package org.simforge.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.simforge.junit.extensions.logging.ExpectLog;
import org.simforge.junit.extensions.logging.LogLevel;
import org.simforge.junit.extensions.logging.LogWatchExtension;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String BACKEND_LOGGER = "org.simforge.compiler.backend.test";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(BACKEND_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  default-level = "WARN"
                  levels { "org.simforge.compiler.backend.test" = "DEBUG" }
                }
                """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(BACKEND_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void onlyFirstCallTakesEffect() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.simforge.compiler.backend.test\" = ERROR }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.simforge.compiler.backend.test\" = TRACE }"));

        assertThat(context.getLogger(BACKEND_LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Unknown log level 'LOUD' for logger 'org.simforge.compiler.backend.test', ignoring.")
    void unknownLevelIsIgnoredWithWarning() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.simforge.compiler.backend.test\" = LOUD }"));

        assertThat(context.getLogger(BACKEND_LOGGER).getLevel()).isNull();
    }
}
