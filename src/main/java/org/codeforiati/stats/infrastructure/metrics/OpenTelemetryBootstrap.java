package org.codeforiati.stats.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>The exporter is chosen from the engine configuration, then {@code otel.metrics.exporter}, then
 * {@code OTEL_METRICS_EXPORTER}. The OTLP endpoint follows {@code OTEL_EXPORTER_OTLP_ENDPOINT}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "org.codeforiati.stats";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(String configuredExporter) {
    try {
      ExporterMode mode = ExporterMode.from(firstNonBlank(
          configuredExporter,
          System.getProperty("otel.metrics.exporter"),
          System.getenv("OTEL_METRICS_EXPORTER")));
      if (mode == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = firstNonBlank(
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      log.info("OpenTelemetry metrics exporting via OTLP to {}", endpoint);
      return BootstrapResult.active(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return BootstrapResult.active(Objects.requireNonNull(reader, "reader"));
  }

  private static Resource resource() {
    Attributes attributes = Attributes.of(
        SERVICE_NAME, "iati-stats",
        SERVICE_NAMESPACE, "org.codeforiati");
    return Resource.getDefault().merge(Resource.create(attributes));
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return null;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null) {
        return NONE;
      }
      return switch (raw.toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(MetricReader reader) {
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(resource())
          .registerMetricReader(reader)
          .build();
      return new BootstrapResult(provider.get(INSTRUMENTATION_SCOPE), provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown();
      shutdown.join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
