package org.codeforiati.stats.domain.stats;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Two-level counter: key to {@link Counter1}.
 *
 * @param values sorted, unmodifiable entries
 * @since 0.1.0
 */
public record Counter2(SortedMap<String, Counter1> values) implements StatResult {
  public static final Counter2 EMPTY = new Counter2(new TreeMap<>());

  public Counter2 {
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the nested counter for a key, or {@link Counter1#EMPTY}. */
  public Counter1 get(String key) {
    Counter1 value = values.get(key);
    return value == null ? Counter1.EMPTY : value;
  }

  @Override
  public Shape shape() {
    return Shape.COUNTER2;
  }

  @Override
  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Mutable accumulator. */
  public static final class Builder {
    private final TreeMap<String, Counter1.Builder> values = new TreeMap<>();

    private Builder() {}

    public Builder add(Object outer, Object inner, long amount) {
      return add(outer, inner, BigDecimal.valueOf(amount));
    }

    public Builder add(Object outer, Object inner, BigDecimal amount) {
      values.computeIfAbsent(StatKeys.key(outer), k -> Counter1.builder()).add(inner, amount);
      return this;
    }

    /** Sets an inner entry, replacing any previous amount. */
    public Builder put(Object outer, Object inner, BigDecimal amount) {
      values.computeIfAbsent(StatKeys.key(outer), k -> Counter1.builder()).put(inner, amount);
      return this;
    }

    /** Merges a whole nested counter under {@code outer}. */
    public Builder addAll(Object outer, Counter1 counter) {
      Counter1.Builder inner = values.computeIfAbsent(StatKeys.key(outer), k -> Counter1.builder());
      inner.addAll(counter.values());
      return this;
    }

    public Counter2 build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      TreeMap<String, Counter1> out = new TreeMap<>();
      values.forEach((k, v) -> out.put(k, v.build()));
      return new Counter2(out);
    }
  }
}
