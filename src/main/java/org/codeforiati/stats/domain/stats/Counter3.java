package org.codeforiati.stats.domain.stats;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Three-level counter: key to {@link Counter2}.
 *
 * @param values sorted, unmodifiable entries
 * @since 0.1.0
 */
public record Counter3(SortedMap<String, Counter2> values) implements StatResult {
  public static final Counter3 EMPTY = new Counter3(new TreeMap<>());

  public Counter3 {
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the nested counter for a key, or {@link Counter2#EMPTY}. */
  public Counter2 get(String key) {
    Counter2 value = values.get(key);
    return value == null ? Counter2.EMPTY : value;
  }

  @Override
  public Shape shape() {
    return Shape.COUNTER3;
  }

  @Override
  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Mutable accumulator. */
  public static final class Builder {
    private final TreeMap<String, Counter2.Builder> values = new TreeMap<>();

    private Builder() {}

    public Builder add(Object first, Object second, Object third, long amount) {
      return add(first, second, third, BigDecimal.valueOf(amount));
    }

    public Builder add(Object first, Object second, Object third, BigDecimal amount) {
      values.computeIfAbsent(StatKeys.key(first), k -> Counter2.builder()).add(second, third, amount);
      return this;
    }

    public Counter3 build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      TreeMap<String, Counter2> out = new TreeMap<>();
      values.forEach((k, v) -> out.put(k, v.build()));
      return new Counter3(out);
    }
  }
}
