package org.codeforiati.stats.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

  @Test
  void defaultsAreValid() {
    EngineConfig config = EngineConfig.defaults();

    assertTrue(config.workers() >= 1);
    assertEquals(1024, config.queueCapacity());
    assertEquals("1.01", config.legacyVersion());
    assertEquals(Optional.empty(), config.usdClampYear());
    assertEquals(Optional.empty(), config.today());
    assertFalse(config.verbose());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void parsesOptionalSettings() {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        "workers", " 3 ",
        "usdClampYear", "2023",
        "today", "2024-03-15",
        "metricsExporter", "OTLP",
        "verbose", "true"));

    assertEquals(3, config.workers());
    assertEquals(Optional.of(2023), config.usdClampYear());
    assertEquals(Optional.of(LocalDate.of(2024, 3, 15)), config.today());
    assertEquals("otlp", config.metricsExporter());
    assertTrue(config.verbose());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    EngineConfig config = EngineConfig.fromMap(Map.of("queueCapacity", " ", "usdClampYear", ""));

    assertEquals(1024, config.queueCapacity());
    assertEquals(Optional.empty(), config.usdClampYear());
  }

  @Test
  void rejectsOutOfRangeAndMalformedValues() {
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("workers", "257")));
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("queueCapacity", "lots")));
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("legacyVersion", "1")));
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("usdClampYear", "1800")));
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("today", "15/03/2024")));
  }
}
