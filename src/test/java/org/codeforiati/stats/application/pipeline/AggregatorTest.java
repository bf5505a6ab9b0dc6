package org.codeforiati.stats.application.pipeline;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.derived;
import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.codeforiati.stats.application.group.GroupContext;
import org.codeforiati.stats.application.leaf.LeafEvaluator;
import org.codeforiati.stats.application.leaf.StatisticRegistry;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.HierarchyLevel;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.codeforiati.stats.fixtures.RecordingMetricsPort;
import org.junit.jupiter.api.Test;

class AggregatorTest {

  @Test
  void perRecordValuesAreDroppedWhenFolding() {
    Aggregator aggregator = new Aggregator(StatisticRegistry.standard(), null);
    Aggregate a = Aggregate.ofRecord(Map.of(
        "iati_identifier", Counter1.label("A-1"),
        "iati_identifiers", Counter1.label("A-1"),
        "activities", NumberStat.ONE));
    Aggregate b = Aggregate.ofRecord(Map.of(
        "iati_identifier", Counter1.label("A-2"),
        "iati_identifiers", Counter1.label("A-2"),
        "activities", NumberStat.ONE));

    Aggregate folded = aggregator.fold(List.of(a, b, Aggregate.skipped()));

    assertFalse(folded.values().containsKey("iati_identifier"));
    assertEquals(2, folded.counter1("iati_identifiers").size());
    assertEquals(0, BigDecimal.valueOf(2).compareTo(folded.number("activities")));
    assertEquals(2, folded.records());
    assertEquals(1, folded.skippedRecords());
  }

  @Test
  void treeReduceMatchesSequentialFold() {
    Aggregator aggregator = new Aggregator(StatisticRegistry.standard(), null);
    List<Aggregate> records = new java.util.ArrayList<>();
    for (int i = 0; i < 11; i++) {
      records.add(Aggregate.ofRecord(Map.of(
          "activities", NumberStat.ONE,
          "iati_identifiers", Counter1.label("A-" + (i % 4)))));
    }

    assertEquals(aggregator.fold(records), aggregator.treeReduce(records));
    assertSame(Aggregate.EMPTY, aggregator.treeReduce(List.of()));
  }

  @Test
  void closeAddsGroupValuesAndIsolatesFailures() {
    StatisticRegistry registry = StatisticRegistry.builder()
        .group(HierarchyLevel.FILE, List.of(
            summed("files", Shape.NUMBER, ctx -> NumberStat.ONE),
            derived("label", Shape.COUNTER1, ctx -> Counter1.label(ctx.file())),
            summed("broken", Shape.NUMBER, ctx -> {
              throw new IllegalArgumentException("boom");
            })))
        .build();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    Aggregator aggregator = new Aggregator(registry, metrics);
    Aggregate folded = Aggregate.ofRecord(
        Map.of(LeafEvaluator.ANOMALIES, Counter1.label("leaf_failure")));

    Aggregate closed = aggregator.close(new GroupContext(HierarchyLevel.FILE, folded, "pub", "file.xml",
        RecordFixtures.TODAY, ReferenceTables.EMPTY, RecordFixtures.converter()));

    assertEquals(NumberStat.ONE, closed.value("files"));
    assertEquals(Counter1.label("file.xml"), closed.value("label"));
    assertSame(NumberStat.ZERO, closed.value("broken"));
    Counter1 anomalies = closed.counter1(LeafEvaluator.ANOMALIES);
    assertEquals(1, anomalies.get("leaf_failure").intValue());
    assertEquals(1, anomalies.get("broken").intValue());
    assertEquals(1, metrics.count("stats.statistic.anomaly"));
    assertTrue(metrics.hasObservation("stats.fold.latencyNanos"));

    Aggregate publisher = aggregator.fold(List.of(closed, closed));
    assertFalse(publisher.values().containsKey("label"));
    assertEquals(0, BigDecimal.valueOf(2).compareTo(publisher.number("files")));
  }

  @Test
  void closeWithoutDeclarationsKeepsAggregate() {
    Aggregator aggregator = new Aggregator(StatisticRegistry.builder().build(), null);
    Aggregate folded = Aggregate.ofRecord(Map.<String, StatResult>of("activities", NumberStat.ONE));

    Aggregate closed = aggregator.close(new GroupContext(HierarchyLevel.CORPUS, folded, null, null,
        RecordFixtures.TODAY, ReferenceTables.EMPTY, RecordFixtures.converter()));

    assertEquals(folded, closed);
  }
}
