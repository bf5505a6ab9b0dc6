package org.codeforiati.stats.config;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.codeforiati.stats.validation.Numbers;
import org.codeforiati.stats.validation.Strings;

/**
 * <strong>What:</strong> Validated settings of one aggregation run.
 * <p><strong>Why:</strong> Converts the flat string map produced by {@link ConfigMerger} into typed values once,
 * before any worker thread starts.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param workers evaluation threads, {@code 1..256}
 * @param queueCapacity bounded evaluation queue, {@code 1..1_000_000}
 * @param legacyVersion version assumed for records declaring an unsupported one
 * @param usdClampYear optional last year converted at its own rate by the USD transaction sums
 * @param today optional pinned evaluation date
 * @param verbose whether to lift logging to DEBUG
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record EngineConfig(
    int workers,
    int queueCapacity,
    String legacyVersion,
    Optional<Integer> usdClampYear,
    Optional<LocalDate> today,
    boolean verbose,
    String metricsExporter) {

  public EngineConfig {
    Numbers.requireRange("workers", workers, 1, EngineDefaults.MAX_WORKERS);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, 1_000_000);
    legacyVersion = Strings.requireVersion("legacyVersion", legacyVersion);
    usdClampYear = Objects.requireNonNull(usdClampYear, "usdClampYear");
    today = Objects.requireNonNull(today, "today");
    metricsExporter = normalizeExporter(metricsExporter);
  }

  /** Configuration built from {@link EngineDefaults} only. */
  public static EngineConfig defaults() {
    return fromMap(EngineDefaults.asFlatMap());
  }

  /**
   * Parses a flat configuration map.
   *
   * @param options merged key/value pairs; missing keys fall back to defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static EngineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = EngineDefaults.asFlatMap();
    int workers = Numbers.parseInt("workers", valueOrDefault(options, defaults, "workers"));
    int queueCapacity = Numbers.parseInt("queueCapacity", valueOrDefault(options, defaults, "queueCapacity"));
    String legacyVersion = valueOrDefault(options, defaults, "legacyVersion");
    Optional<Integer> usdClampYear = optionalString(options.get("usdClampYear"))
        .map(raw -> (int) Numbers.requireRange("usdClampYear", Numbers.parseInt("usdClampYear", raw), 1900, 2200));
    Optional<LocalDate> today = optionalString(options.get("today")).map(EngineConfig::parseDate);
    boolean verbose = Boolean.parseBoolean(valueOrDefault(options, defaults, "verbose"));
    String exporter = valueOrDefault(options, defaults, "metricsExporter");
    return new EngineConfig(workers, queueCapacity, legacyVersion, usdClampYear, today, verbose, exporter);
  }

  private static String valueOrDefault(Map<String, String> options, Map<String, String> defaults, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? defaults.get(key) : value.trim();
  }

  private static Optional<String> optionalString(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  private static LocalDate parseDate(String raw) {
    try {
      return LocalDate.parse(raw);
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("today must be an ISO date such as 2024-01-31 (was " + raw + ")", ex);
    }
  }

  private static String normalizeExporter(String exporter) {
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("none") && !normalized.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be none or otlp (was " + exporter + ")");
    }
    return normalized;
  }
}
