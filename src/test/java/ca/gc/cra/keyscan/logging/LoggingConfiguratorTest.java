package ca.gc.cra.keyscan.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final Map<String, Level> saved = new HashMap<>();

  @BeforeEach
  void saveLevels() {
    saved.put(org.slf4j.Logger.ROOT_LOGGER_NAME, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
    for (String name : LoggingConfigurator.QUIET_LOGGERS) {
      saved.put(name, context.getLogger(name).getLevel());
      context.getLogger(name).setLevel(null);
    }
  }

  @AfterEach
  void restoreLevels() {
    saved.forEach((name, level) -> context.getLogger(name).setLevel(level));
  }

  @Test
  void verboseRaisesRootButKeepsExporterTransportAtInfo() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    assertEquals(Level.DEBUG, root.getLevel());
    assertTrue(context.getLogger("ca.gc.cra.keyscan.application.pipeline").isDebugEnabled());
    assertEquals(Level.INFO, context.getLogger("io.grpc").getLevel());
    assertEquals(Level.INFO, context.getLogger("io.opentelemetry.exporter").getEffectiveLevel());
  }

  @Test
  void explicitTransportLevelsAreLeftAlone() {
    context.getLogger("okhttp3").setLevel(Level.TRACE);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.TRACE, context.getLogger("okhttp3").getLevel());
  }
}
