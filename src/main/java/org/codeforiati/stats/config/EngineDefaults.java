package org.codeforiati.stats.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened default configuration for the aggregation engine.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class EngineDefaults {
  /** YAML section read in addition to {@code common}. */
  public static final String SECTION = "engine";
  static final int MAX_WORKERS = 256;
  static final int DEFAULT_QUEUE_CAPACITY = 1024;

  private EngineDefaults() {}

  /**
   * Returns the defaults as strings keyed like the YAML file.
   *
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workers", Integer.toString(defaultWorkers()));
    map.put("queueCapacity", Integer.toString(DEFAULT_QUEUE_CAPACITY));
    map.put("legacyVersion", "1.01");
    map.put("usdClampYear", "");
    map.put("today", "");
    map.put("verbose", "false");
    map.put("metricsExporter", "none");
    return Map.copyOf(map);
  }

  static int defaultWorkers() {
    return Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
  }
}
