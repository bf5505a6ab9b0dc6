package org.codeforiati.stats.domain.stats;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Named group of statistics of any shape, for statistics that report a whole sub-aggregate per key, such as
 * one set of activity statistics per hierarchy level.
 *
 * <p>Entries may themselves be {@code NestedStat}s. Merging unions the names and merges shared entries by their
 * own shape.</p>
 *
 * @param values sorted, unmodifiable entries
 * @since 0.1.0
 */
public record NestedStat(SortedMap<String, StatResult> values) implements StatResult {
  public static final NestedStat EMPTY = new NestedStat(new TreeMap<>());

  public NestedStat {
    Objects.requireNonNull(values, "values");
    TreeMap<String, StatResult> copy = new TreeMap<>();
    values.forEach((name, value) -> copy.put(Objects.requireNonNull(name, "name"),
        Objects.requireNonNull(value, "value")));
    values = Collections.unmodifiableSortedMap(copy);
  }

  /** Single-entry group. */
  public static NestedStat of(Object key, StatResult value) {
    TreeMap<String, StatResult> values = new TreeMap<>();
    values.put(StatKeys.key(key), value);
    return new NestedStat(values);
  }

  /** Returns the entry for a name, or {@code null} when absent. */
  public StatResult get(String name) {
    return values.get(name);
  }

  /** Returns the entry for a name when it is itself a group, otherwise {@link #EMPTY}. */
  public NestedStat group(String name) {
    return values.get(name) instanceof NestedStat n ? n : EMPTY;
  }

  @Override
  public Shape shape() {
    return Shape.NESTED;
  }

  @Override
  public boolean isEmpty() {
    return values.isEmpty();
  }
}
