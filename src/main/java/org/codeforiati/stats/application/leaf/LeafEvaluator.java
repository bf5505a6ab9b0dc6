package org.codeforiati.stats.application.leaf;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.codeforiati.stats.application.port.MetricsPort;
import org.codeforiati.stats.application.port.SchemaValidationPort;
import org.codeforiati.stats.domain.currency.CurrencyConverter;
import org.codeforiati.stats.domain.record.MalformedRecordException;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.record.Record;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;
import org.codeforiati.stats.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes every declared statistic for a single record.
 * <p><strong>Why:</strong> Leaf evaluation is a pure function of the record, its document version and the shared
 * reference data, so records can be evaluated in any order on any thread.</p>
 * <p><strong>Role:</strong> Application service invoked once per record by the aggregation pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Iterate the registry's declarations for the record kind, memoizing through a fresh {@link LeafContext}.</li>
 *   <li>Isolate failing statistics: substitute the shape identity and count the failure under
 *   {@value #ANOMALIES}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs failing statistics at WARN and emits {@code stats.statistic.anomaly} and
 * {@code stats.leaf.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class LeafEvaluator {
  /** Statistic name to number of failed evaluations; present in every leaf result. */
  public static final String ANOMALIES = "_statistic_anomalies";
  private static final Logger log = LoggerFactory.getLogger(LeafEvaluator.class);

  private final StatisticRegistry registry;
  private final ReferenceTables tables;
  private final CurrencyConverter converter;
  private final SchemaValidationPort validator;
  private final EvaluationSettings settings;
  private final MetricsPort metrics;

  public LeafEvaluator(
      StatisticRegistry registry,
      ReferenceTables tables,
      CurrencyConverter converter,
      SchemaValidationPort validator,
      EvaluationSettings settings,
      MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.converter = Objects.requireNonNull(converter, "converter");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Validates and evaluates a raw element.
   *
   * @param element root element supplied by the parser
   * @param documentVersion version declared by the enclosing document, may be {@code null}
   * @return statistic name to value
   * @throws MalformedRecordException if the element is not a reporting unit
   */
  public SortedMap<String, StatResult> evaluate(Node element, String documentVersion)
      throws MalformedRecordException {
    return evaluate(Record.of(element, documentVersion));
  }

  /**
   * Evaluates every statistic declared for the record's kind.
   *
   * @param record record to evaluate
   * @return unmodifiable statistic name to value, always including {@value #ANOMALIES}
   */
  public SortedMap<String, StatResult> evaluate(Record record) {
    long started = System.nanoTime();
    LeafContext ctx = new LeafContext(record, registry, tables, converter, validator, settings);
    SortedMap<String, StatResult> out = new TreeMap<>();
    Counter1.Builder anomalies = Counter1.builder();
    for (StatisticDeclaration<LeafContext> declaration : registry.leaf(record.kind())) {
      StatResult value;
      try {
        value = ctx.statistic(declaration.name());
      } catch (RuntimeException ex) {
        log.warn("Statistic {} failed for record {}; using empty value",
            declaration.name(), Logs.identifier(record.identifier()), ex);
        metrics.increment("stats.statistic.anomaly");
        anomalies.add(declaration.name(), 1);
        value = declaration.shape().identity();
      }
      out.put(declaration.name(), value);
    }
    out.put(ANOMALIES, anomalies.build());
    metrics.observe("stats.leaf.latencyNanos", System.nanoTime() - started);
    return Collections.unmodifiableSortedMap(out);
  }

  public StatisticRegistry registry() {
    return registry;
  }
}
