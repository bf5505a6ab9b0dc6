package org.codeforiati.stats.domain.stats;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Single-level counter: key to exact number.
 *
 * @param values sorted, unmodifiable entries
 * @since 0.1.0
 */
public record Counter1(SortedMap<String, BigDecimal> values) implements StatResult {
  public static final Counter1 EMPTY = new Counter1(new TreeMap<>());

  public Counter1 {
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
  }

  /** Counter holding a single entry {@code key -> count}. */
  public static Counter1 of(Object key, long count) {
    return builder().add(key, count).build();
  }

  /** Counter holding a single label counted once; used for derived classifications. */
  public static Counter1 label(Object key) {
    return of(key, 1);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value for a key, or zero when absent. */
  public BigDecimal get(String key) {
    BigDecimal value = values.get(key);
    return value == null ? BigDecimal.ZERO : value;
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  public int size() {
    return values.size();
  }

  @Override
  public Shape shape() {
    return Shape.COUNTER1;
  }

  @Override
  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Mutable accumulator; keys are normalised through {@link StatKeys#key(Object)}. */
  public static final class Builder {
    private final TreeMap<String, BigDecimal> values = new TreeMap<>();

    private Builder() {}

    public Builder add(Object key, long amount) {
      return add(key, BigDecimal.valueOf(amount));
    }

    public Builder add(Object key, BigDecimal amount) {
      Objects.requireNonNull(amount, "amount");
      values.merge(StatKeys.key(key), amount, BigDecimal::add);
      return this;
    }

    /** Sets a key, replacing any previous amount. */
    public Builder put(Object key, BigDecimal amount) {
      values.put(StatKeys.key(key), Objects.requireNonNull(amount, "amount"));
      return this;
    }

    public Builder put(Object key, long amount) {
      return put(key, BigDecimal.valueOf(amount));
    }

    public Builder addAll(Map<String, BigDecimal> entries) {
      entries.forEach((k, v) -> add(k, v));
      return this;
    }

    public Counter1 build() {
      return values.isEmpty() ? EMPTY : new Counter1(values);
    }
  }
}
