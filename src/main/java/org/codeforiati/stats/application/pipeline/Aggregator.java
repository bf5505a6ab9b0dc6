package org.codeforiati.stats.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.codeforiati.stats.application.group.GroupContext;
import org.codeforiati.stats.application.leaf.LeafEvaluator;
import org.codeforiati.stats.application.leaf.StatisticRegistry;
import org.codeforiati.stats.application.merge.ShapeMerger;
import org.codeforiati.stats.application.port.MetricsPort;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds aggregates of one hierarchy level into the next and closes each group.
 * <p><strong>Why:</strong> Every level uses the same shape merge, so file, publisher and corpus folds differ only
 * in which group statistics are applied afterwards.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop {@code NO_AGGREGATION} values before merging; they describe one node only.</li>
 *   <li>Sum record and skipped-record counts.</li>
 *   <li>Evaluate group declarations on a folded aggregate, isolating failures like leaf evaluation does.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Aggregator {
  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private final StatisticRegistry registry;
  private final MetricsPort metrics;

  public Aggregator(StatisticRegistry registry, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Merges two aggregates of the same level.
   *
   * @throws IllegalArgumentException if a statistic has different shapes on the two sides
   */
  public Aggregate merge(Aggregate a, Aggregate b) {
    SortedMap<String, StatResult> merged = new TreeMap<>();
    for (Map.Entry<String, StatResult> entry : a.values().entrySet()) {
      if (registry.isFoldable(entry.getKey())) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    for (Map.Entry<String, StatResult> entry : b.values().entrySet()) {
      if (registry.isFoldable(entry.getKey())) {
        merged.merge(entry.getKey(), entry.getValue(), ShapeMerger::merge);
      }
    }
    return new Aggregate(merged, a.records() + b.records(), a.skippedRecords() + b.skippedRecords());
  }

  /** Sequential left fold; {@link Aggregate#EMPTY} for no input. */
  public Aggregate fold(List<Aggregate> aggregates) {
    Aggregate acc = Aggregate.EMPTY;
    for (Aggregate aggregate : aggregates) {
      acc = merge(acc, aggregate);
    }
    return acc;
  }

  /** Pairwise fold with the same result as {@link #fold(List)}. */
  public Aggregate treeReduce(List<Aggregate> aggregates) {
    if (aggregates.isEmpty()) {
      return Aggregate.EMPTY;
    }
    List<Aggregate> seeded = new ArrayList<>(aggregates.size() + 1);
    seeded.add(Aggregate.EMPTY);
    seeded.addAll(aggregates);
    return ShapeMerger.pairwise(seeded, this::merge);
  }

  /**
   * Applies the group declarations of {@code ctx.level()} to its folded aggregate.
   *
   * @param ctx group being closed
   * @return the folded aggregate plus one value per group declaration
   */
  public Aggregate close(GroupContext ctx) {
    long started = System.nanoTime();
    SortedMap<String, StatResult> values = new TreeMap<>();
    Counter1.Builder anomalies = Counter1.builder();
    for (StatisticDeclaration<GroupContext> declaration : registry.group(ctx.level())) {
      StatResult value;
      try {
        value = declaration.evaluate(ctx);
      } catch (RuntimeException ex) {
        log.warn("Group statistic {} failed for {} {}/{}; using empty value",
            declaration.name(), ctx.level(), ctx.publisher(), ctx.file(), ex);
        metrics.increment("stats.statistic.anomaly");
        anomalies.add(declaration.name(), 1);
        value = declaration.shape().identity();
      }
      values.put(declaration.name(), value);
    }
    Counter1 failed = anomalies.build();
    if (!failed.isEmpty()) {
      values.put(LeafEvaluator.ANOMALIES,
          ShapeMerger.merge(ctx.aggregate().counter1(LeafEvaluator.ANOMALIES), failed));
    }
    metrics.observe("stats.fold.latencyNanos", System.nanoTime() - started);
    return ctx.aggregate().withValues(values);
  }
}
