package org.codeforiati.stats.application.merge;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BinaryOperator;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.domain.stats.NestedStat;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;

/**
 * <strong>What:</strong> Canonical merge rule for every {@link Shape}, plus sequential and tree-shaped folds.
 * <p><strong>Why:</strong> One merge function per shape serves every statistic and every hierarchy level, so no
 * statistic carries its own combination logic.</p>
 * <p><strong>Role:</strong> Aggregation primitive used by the pipeline's {@code Aggregator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sum numbers exactly with {@link BigDecimal}.</li>
 *   <li>Union counter keys, summing values present on both sides, recursively per nesting level.</li>
 *   <li>Union {@link NestedStat} names, merging shared entries by their own shape.</li>
 *   <li>Return the shape identity for empty folds and the element itself for single-element folds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; inputs and outputs are immutable.</p>
 * <p><strong>Performance:</strong> Counter merges are O((n + m) log(n + m)) in the number of keys.</p>
 *
 * @implNote Merges are associative and commutative, so {@link #fold} and {@link #treeReduce} agree for any
 *     ordering of their input.
 * @since 0.1.0
 */
public final class ShapeMerger {
  private ShapeMerger() {
    // Utility
  }

  /**
   * Merges two values of the same shape.
   *
   * @param a left value
   * @param b right value
   * @return merged value; the non-empty side when the other is empty, the shape identity when both are
   * @throws IllegalArgumentException if the shapes differ
   */
  public static StatResult merge(StatResult a, StatResult b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    if (a.shape() != b.shape()) {
      throw new IllegalArgumentException("cannot merge " + a.shape() + " with " + b.shape());
    }
    if (a.isEmpty() && b.isEmpty()) {
      // zeros of different scale, e.g. 0.00 and 0
      return a.shape().identity();
    }
    if (a.isEmpty()) {
      return b;
    }
    if (b.isEmpty()) {
      return a;
    }
    return switch (a.shape()) {
      case NUMBER -> new NumberStat(((NumberStat) a).value().add(((NumberStat) b).value()));
      case COUNTER1 -> mergeCounter1((Counter1) a, (Counter1) b);
      case COUNTER2 -> mergeCounter2((Counter2) a, (Counter2) b);
      case COUNTER3 -> mergeCounter3((Counter3) a, (Counter3) b);
      case NESTED -> mergeNested((NestedStat) a, (NestedStat) b);
    };
  }

  /**
   * Sequentially folds values of one shape.
   *
   * @param shape declared shape; every element must match it
   * @param values values to fold, in any order
   * @return the shape identity when {@code values} is empty, otherwise the merged value
   * @throws IllegalArgumentException if an element has a different shape
   */
  public static StatResult fold(Shape shape, Iterable<? extends StatResult> values) {
    Objects.requireNonNull(shape, "shape");
    Iterator<? extends StatResult> it = values.iterator();
    if (!it.hasNext()) {
      return shape.identity();
    }
    StatResult acc = requireShape(shape, it.next());
    while (it.hasNext()) {
      acc = merge(acc, requireShape(shape, it.next()));
    }
    return acc;
  }

  /**
   * Folds values by merging adjacent pairs level by level.
   *
   * @param shape declared shape
   * @param values values to fold
   * @return same result as {@link #fold(Shape, Iterable)}
   */
  public static StatResult treeReduce(Shape shape, List<? extends StatResult> values) {
    Objects.requireNonNull(shape, "shape");
    if (values.isEmpty()) {
      return shape.identity();
    }
    List<StatResult> level = new ArrayList<>(values.size());
    for (StatResult value : values) {
      level.add(requireShape(shape, value));
    }
    return pairwise(level, ShapeMerger::merge);
  }

  /** Generic pairwise reduction shared with aggregate folds. */
  public static <T> T pairwise(List<T> items, BinaryOperator<T> combiner) {
    if (items.isEmpty()) {
      throw new IllegalArgumentException("items must not be empty");
    }
    List<T> level = new ArrayList<>(items);
    while (level.size() > 1) {
      List<T> next = new ArrayList<>((level.size() + 1) / 2);
      for (int i = 0; i < level.size(); i += 2) {
        next.add(i + 1 < level.size() ? combiner.apply(level.get(i), level.get(i + 1)) : level.get(i));
      }
      level = next;
    }
    return level.get(0);
  }

  private static StatResult requireShape(Shape shape, StatResult value) {
    if (value.shape() != shape) {
      throw new IllegalArgumentException("expected " + shape + " but got " + value.shape());
    }
    return value;
  }

  private static Counter1 mergeCounter1(Counter1 a, Counter1 b) {
    SortedMap<String, BigDecimal> out = new TreeMap<>(a.values());
    b.values().forEach((k, v) -> out.merge(k, v, BigDecimal::add));
    return new Counter1(out);
  }

  private static Counter2 mergeCounter2(Counter2 a, Counter2 b) {
    SortedMap<String, Counter1> out = new TreeMap<>(a.values());
    b.values().forEach((k, v) -> out.merge(k, v, ShapeMerger::mergeCounter1));
    return new Counter2(out);
  }

  private static Counter3 mergeCounter3(Counter3 a, Counter3 b) {
    SortedMap<String, Counter2> out = new TreeMap<>(a.values());
    b.values().forEach((k, v) -> out.merge(k, v, ShapeMerger::mergeCounter2));
    return new Counter3(out);
  }

  private static NestedStat mergeNested(NestedStat a, NestedStat b) {
    SortedMap<String, StatResult> out = new TreeMap<>(a.values());
    b.values().forEach((k, v) -> out.merge(k, v, ShapeMerger::merge));
    return new NestedStat(out);
  }
}
