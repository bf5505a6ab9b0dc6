package org.codeforiati.stats.domain.stats;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Statistic values for one hierarchy node plus record bookkeeping.
 * <p><strong>Why:</strong> Leaf results and every folded level share one representation, so the same merge
 * machinery applies at record, file, publisher and corpus level.</p>
 * <p><strong>Thread-safety:</strong> Immutable; every fold produces a new instance.</p>
 *
 * @param values statistic name to value
 * @param records number of records evaluated into this aggregate
 * @param skippedRecords number of records that could not be evaluated
 * @since 0.1.0
 */
public record Aggregate(SortedMap<String, StatResult> values, long records, long skippedRecords) {
  public static final Aggregate EMPTY = new Aggregate(new TreeMap<>(), 0, 0);

  public Aggregate {
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    if (records < 0 || skippedRecords < 0) {
      throw new IllegalArgumentException("record counts must be non-negative");
    }
  }

  /** Aggregate of one successfully evaluated record. */
  public static Aggregate ofRecord(Map<String, StatResult> values) {
    return new Aggregate(new TreeMap<>(values), 1, 0);
  }

  /** Aggregate standing for one record that was skipped. */
  public static Aggregate skipped() {
    return new Aggregate(new TreeMap<>(), 0, 1);
  }

  /** Returns the value for a name, or {@code null} when absent. */
  public StatResult value(String name) {
    return values.get(name);
  }

  public BigDecimal number(String name) {
    return values.get(name) instanceof NumberStat n ? n.value() : BigDecimal.ZERO;
  }

  public Counter1 counter1(String name) {
    return values.get(name) instanceof Counter1 c ? c : Counter1.EMPTY;
  }

  public Counter2 counter2(String name) {
    return values.get(name) instanceof Counter2 c ? c : Counter2.EMPTY;
  }

  public Counter3 counter3(String name) {
    return values.get(name) instanceof Counter3 c ? c : Counter3.EMPTY;
  }

  public NestedStat nested(String name) {
    return values.get(name) instanceof NestedStat n ? n : NestedStat.EMPTY;
  }

  /** Returns a copy with the given values added or replaced. */
  public Aggregate withValues(Map<String, StatResult> extra) {
    TreeMap<String, StatResult> copy = new TreeMap<>(values);
    copy.putAll(extra);
    return new Aggregate(copy, records, skippedRecords);
  }

  /** Returns a copy without the named value. */
  public Aggregate without(String name) {
    if (!values.containsKey(name)) {
      return this;
    }
    TreeMap<String, StatResult> copy = new TreeMap<>(values);
    copy.remove(name);
    return new Aggregate(copy, records, skippedRecords);
  }
}
