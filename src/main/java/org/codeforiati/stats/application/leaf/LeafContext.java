package org.codeforiati.stats.application.leaf;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.codeforiati.stats.application.port.SchemaValidationPort;
import org.codeforiati.stats.domain.currency.CurrencyConverter;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.record.Record;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Evaluation scope for one record: the record, shared reference data and a per-record memo.
 * <p><strong>Why:</strong> Statistics that feed several others (declared version, start year, comprehensiveness
 * score) are computed once per record and discarded with the context.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the worker evaluating the record.</p>
 *
 * @since 0.1.0
 */
public final class LeafContext {
  private final Record record;
  private final StatisticRegistry registry;
  private final ReferenceTables tables;
  private final CurrencyConverter converter;
  private final SchemaValidationPort validator;
  private final EvaluationSettings settings;
  private final Map<String, StatResult> statistics = new HashMap<>();
  private final Map<String, Object> facts = new HashMap<>();

  public LeafContext(
      Record record,
      StatisticRegistry registry,
      ReferenceTables tables,
      CurrencyConverter converter,
      SchemaValidationPort validator,
      EvaluationSettings settings) {
    this.record = Objects.requireNonNull(record, "record");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.converter = Objects.requireNonNull(converter, "converter");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Returns a statistic's value for this record, evaluating it at most once.
   *
   * @param name declared statistic name
   * @return memoized value
   * @throws IllegalArgumentException if no leaf statistic has that name
   */
  public StatResult statistic(String name) {
    StatResult cached = statistics.get(name);
    if (cached != null) {
      return cached;
    }
    StatisticDeclaration<LeafContext> declaration = registry.leaf(record.kind(), name);
    if (declaration == null) {
      throw new IllegalArgumentException("unknown statistic " + name + " for " + record.kind());
    }
    // Not computeIfAbsent: evaluation may recurse into statistic().
    StatResult value = declaration.evaluate(this);
    statistics.put(name, value);
    return value;
  }

  public Counter1 counter1(String name) {
    return (Counter1) statistic(name);
  }

  public Counter3 counter3(String name) {
    return (Counter3) statistic(name);
  }

  /**
   * Returns a derived fact, computing it at most once per record.
   *
   * @param key fact name, unique per fact type
   * @param compute factory invoked on first access
   * @param <T> fact type
   * @return memoized fact
   */
  @SuppressWarnings("unchecked")
  public <T> T fact(String key, Function<LeafContext, T> compute) {
    Object cached = facts.get(key);
    if (cached == null) {
      cached = compute.apply(this);
      facts.put(key, cached);
    }
    return (T) cached;
  }

  /** Version-dependent codes and common derived values. */
  public ActivityFacts facts() {
    return fact("activity-facts", ActivityFacts::new);
  }

  public Record record() {
    return record;
  }

  public Node element() {
    return record.element();
  }

  public LocalDate today() {
    return settings.today();
  }

  public ReferenceTables tables() {
    return tables;
  }

  public CurrencyConverter converter() {
    return converter;
  }

  public SchemaValidationPort validator() {
    return validator;
  }

  public EvaluationSettings settings() {
    return settings;
  }
}
