package org.codeforiati.stats.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the aggregation pipeline.
 * <p><strong>Why:</strong> Lets evaluation and folding record counters and latencies without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events such as evaluated or skipped records.</li>
 *   <li>Record numeric observations such as per-record evaluation latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract, e.g. {@code stats.leaf.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier, e.g. {@code stats.records.skipped}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, e.g. nanoseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
