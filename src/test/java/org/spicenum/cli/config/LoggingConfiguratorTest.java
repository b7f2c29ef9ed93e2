package org.spicenum.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.spicenum.test.alpha").setLevel(null);
        context.getLogger("org.spicenum.test.beta").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        Config config = ConfigFactory.parseString(String.join("\n",
                "logging {",
                "  default-level = ERROR",
                "  levels {",
                "    \"org.spicenum.test.alpha\" = DEBUG",
                "    \"org.spicenum.test.beta\" = \"NOT-A-LEVEL\"",
                "  }",
                "}"));

        LoggingConfigurator.configure(config);

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.spicenum.test.alpha").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.spicenum.test.beta").getLevel()).isNull();
    }

    @Test
    void configuresOnlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.spicenum.test.alpha\" = INFO }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.spicenum.test.alpha\" = TRACE }"));

        assertThat(context.getLogger("org.spicenum.test.alpha").getLevel()).isEqualTo(Level.INFO);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.spicenum.test.alpha\" = TRACE }"));

        assertThat(context.getLogger("org.spicenum.test.alpha").getLevel()).isEqualTo(Level.TRACE);
    }
}
