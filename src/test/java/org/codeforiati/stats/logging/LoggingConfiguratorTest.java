package org.codeforiati.stats.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {
  private Level original;

  @BeforeEach
  void rememberLevel() {
    original = LoggingConfigurator.rootLevel();
  }

  @AfterEach
  void restoreLevel() {
    if (original != null) {
      LoggingConfigurator.setRootLevel(original);
    }
  }

  @Test
  void verboseLoggingLiftsRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, LoggingConfigurator.rootLevel());
  }

  @Test
  void setRootLevelIsAcceptedByLogback() {
    assertTrue(LoggingConfigurator.setRootLevel(Level.ERROR));
    assertEquals(Level.ERROR, LoggingConfigurator.rootLevel());
  }
}
