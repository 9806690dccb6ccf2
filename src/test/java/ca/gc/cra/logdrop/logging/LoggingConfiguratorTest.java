package ca.gc.cra.logdrop.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(originalLevel);
  }

  @Test
  void appliesLevelCaseInsensitively() {
    assertTrue(LoggingConfigurator.applyRootLevel(" error "));
    assertEquals(Level.ERROR, root.getLevel());
  }

  @Test
  void verboseLoggingSelectsDebug() {
    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void rejectsUnknownLevels() {
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.applyRootLevel("LOUD"));
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.applyRootLevel(" "));
  }
}
