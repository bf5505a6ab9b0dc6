package org.codeforiati.stats.infrastructure.metrics;

import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.codeforiati.stats.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards pipeline counters and latency histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per metric key and cached; keys are lower-cased and characters outside
 * {@code [a-z0-9._-]} are replaced with {@code _}.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the configured exporter.
   *
   * @param exporter {@code otlp} or {@code none}; {@code null} defers to the OpenTelemetry environment settings
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter).add(1);
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram).record(value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("Aggregation counter " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("Aggregation observation " + key)
        .build();
  }

  static String sanitizeName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "stats.metric";
    }
    StringBuilder out = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      out.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      out.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return out.toString();
  }
}
