package org.codeforiati.stats.infrastructure.metrics;

import org.codeforiati.stats.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when {@code metricsExporter} is {@code none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
