package org.codeforiati.stats.config;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.codeforiati.stats.application.leaf.EvaluationSettings;
import org.codeforiati.stats.application.leaf.LeafEvaluator;
import org.codeforiati.stats.application.leaf.StatisticRegistry;
import org.codeforiati.stats.application.pipeline.Aggregator;
import org.codeforiati.stats.application.pipeline.CorpusAggregationUseCase;
import org.codeforiati.stats.application.port.ClockPort;
import org.codeforiati.stats.application.port.MetricsPort;
import org.codeforiati.stats.application.port.SchemaValidationPort;
import org.codeforiati.stats.domain.currency.CurrencyConverter;
import org.codeforiati.stats.domain.currency.ExchangeRateTable;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.infrastructure.metrics.NoOpMetricsAdapter;
import org.codeforiati.stats.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.codeforiati.stats.infrastructure.time.SystemClockAdapter;
import org.codeforiati.stats.infrastructure.validation.PermissiveSchemaValidator;
import org.codeforiati.stats.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires configuration, reference data and adapters into a runnable aggregation.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so application code only sees ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from {@link EngineConfig#metricsExporter()}.</li>
 *   <li>Resolve the evaluation date from the pinned setting or the clock.</li>
 *   <li>Build the registry, evaluator, aggregator and use case.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread at start-up; the built use case is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final EngineConfig config;
  private final ReferenceTables tables;
  private final CurrencyConverter converter;
  private final SchemaValidationPort validator;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final StatisticRegistry registry = StatisticRegistry.standard();

  /**
   * Creates a root with adapters chosen from {@code config}.
   *
   * @param config engine configuration; must not be {@code null}
   * @param tables reference data; must not be {@code null}
   * @param rates exchange rates; must not be {@code null}
   */
  public CompositionRoot(EngineConfig config, ReferenceTables tables, ExchangeRateTable rates) {
    this(config, tables, rates, new PermissiveSchemaValidator(tables), metricsFor(config),
        new SystemClockAdapter(Objects.requireNonNull(config, "config").today().orElse(null)));
  }

  /**
   * Creates a root with explicit adapters, mainly for tests.
   *
   * @param config engine configuration
   * @param tables reference data
   * @param rates exchange rates
   * @param validator schema validation oracle
   * @param metrics metrics sink
   * @param clock evaluation clock
   */
  public CompositionRoot(
      EngineConfig config,
      ReferenceTables tables,
      ExchangeRateTable rates,
      SchemaValidationPort validator,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.converter = new CurrencyConverter(Objects.requireNonNull(rates, "rates"));
    this.validator = Objects.requireNonNull(validator, "validator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * Loads the effective configuration from an optional YAML file and overrides.
   *
   * @param yamlPath YAML file; ignored when absent
   * @param overrides values taking precedence over YAML; may be {@code null}
   * @return validated configuration
   * @throws IOException when the YAML file cannot be read
   */
  public static EngineConfig loadConfig(Path yamlPath, Map<String, String> overrides) throws IOException {
    Optional<Map<String, String>> yaml = yamlPath == null
        ? Optional.empty()
        : YamlConfigLoader.load(yamlPath, EngineDefaults.SECTION);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        EngineDefaults.SECTION, yaml, overrides, EngineDefaults.asFlatMap(), log::warn);
    return EngineConfig.fromMap(effective);
  }

  private static MetricsPort metricsFor(EngineConfig config) {
    if ("otlp".equals(config.metricsExporter())) {
      return new OpenTelemetryMetricsAdapter(config.metricsExporter());
    }
    return new NoOpMetricsAdapter();
  }

  /** Evaluation date: the pinned date when configured, otherwise the clock's date. */
  public LocalDate today() {
    return config.today().orElseGet(clock::today);
  }

  public EvaluationSettings evaluationSettings() {
    return new EvaluationSettings(today(), config.legacyVersion(), config.usdClampYear().orElse(null));
  }

  public StatisticRegistry registry() {
    return registry;
  }

  public LeafEvaluator leafEvaluator() {
    return new LeafEvaluator(registry, tables, converter, validator, evaluationSettings(), metrics);
  }

  public Aggregator aggregator() {
    return new Aggregator(registry, metrics);
  }

  /** Builds the corpus use case with the configured pool size. */
  public CorpusAggregationUseCase corpusAggregationUseCase() {
    LocalDate today = today();
    log.info("Corpus aggregation configured with {} workers, queue {}, evaluation date {}",
        config.workers(), config.queueCapacity(), today);
    return new CorpusAggregationUseCase(
        leafEvaluator(), aggregator(), tables, converter, today, metrics, config.workers(), config.queueCapacity());
  }

  public MetricsPort metrics() {
    return metrics;
  }
}
