/**
 * <strong>Purpose:</strong> {@link org.codeforiati.stats.application.port.MetricsPort} adapters.
 * <p><strong>Role:</strong> OpenTelemetry counters and histograms exported over OTLP, or a no-op sink.</p>
 * <p><strong>Concurrency:</strong> Instruments are created lazily and cached; safe for worker threads.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.infrastructure.metrics;
