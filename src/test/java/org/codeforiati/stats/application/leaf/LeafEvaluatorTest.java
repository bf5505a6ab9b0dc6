package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.codeforiati.stats.domain.record.MalformedRecordException;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.record.RecordKind;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.codeforiati.stats.fixtures.RecordingMetricsPort;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LeafEvaluatorTest {

  @Test
  void emptyActivityYieldsEveryStatisticInItsDeclaredShape() throws MalformedRecordException {
    LeafEvaluator evaluator = RecordFixtures.evaluator();
    StatisticRegistry registry = evaluator.registry();

    Map<String, StatResult> result = evaluator.evaluate(Node.builder("iati-activity").build(), null);

    for (StatisticDeclaration<LeafContext> declaration : registry.leaf(RecordKind.ACTIVITY)) {
      StatResult value = result.get(declaration.name());
      assertTrue(value != null, "missing " + declaration.name());
      assertEquals(declaration.shape(), value.shape(), declaration.name());
    }
    assertTrue(result.get(LeafEvaluator.ANOMALIES).isEmpty(), "no statistic should fail on an empty record");
  }

  @Test
  void organisationRecordsUseOrganisationStatistics() throws MalformedRecordException {
    Map<String, StatResult> result =
        RecordFixtures.evaluator().evaluate(RecordFixtures.organisation("GB-COH-1").build(), "2.03");

    assertEquals(NumberStat.ONE, result.get("organisations"));
    assertFalse(result.containsKey("activities"));
    assertTrue(result.containsKey("validation"));
  }

  @Test
  void failingStatisticIsIsolatedAndCounted() throws MalformedRecordException {
    StatisticRegistry registry = StatisticRegistry.builder()
        .leaf(RecordKind.ACTIVITY, List.of(
            summed("healthy", Shape.NUMBER, ctx -> NumberStat.ONE),
            summed("broken", Shape.COUNTER1, ctx -> {
              throw new IllegalStateException("boom");
            })))
        .build();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LeafEvaluator evaluator = RecordFixtures.evaluator(registry, metrics);

    Logger logger = (Logger) LoggerFactory.getLogger(LeafEvaluator.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    Map<String, StatResult> result;
    try {
      result = evaluator.evaluate(RecordFixtures.activity("GB-COH-1-A").build(), "2.03");
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(NumberStat.ONE, result.get("healthy"));
    assertSame(Counter1.EMPTY, result.get("broken"));
    Counter1 anomalies = (Counter1) result.get(LeafEvaluator.ANOMALIES);
    assertEquals(0, BigDecimal.ONE.compareTo(anomalies.get("broken")));
    assertEquals(1, metrics.count("stats.statistic.anomaly"));
    assertTrue(metrics.hasObservation("stats.leaf.latencyNanos"));

    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("broken"));
    assertTrue(event.getFormattedMessage().contains("GB-COH-1-A"));
  }

  @Test
  void dependentStatisticsAreEvaluatedOncePerRecord() throws MalformedRecordException {
    AtomicInteger calls = new AtomicInteger();
    StatisticRegistry registry = StatisticRegistry.builder()
        .leaf(RecordKind.ACTIVITY, List.of(
            summed("base", Shape.NUMBER, ctx -> NumberStat.of(calls.incrementAndGet())),
            summed("first", Shape.NUMBER, ctx -> ctx.statistic("base")),
            summed("second", Shape.NUMBER, ctx -> ctx.statistic("base"))))
        .build();

    Map<String, StatResult> result = RecordFixtures.evaluator(registry, null)
        .evaluate(RecordFixtures.activity("A").build(), "2.03");

    assertEquals(1, calls.get());
    assertEquals(result.get("base"), result.get("second"));
  }

  @Test
  void unexpectedRootIsMalformed() {
    LeafEvaluator evaluator = RecordFixtures.evaluator();
    assertThrows(MalformedRecordException.class,
        () -> evaluator.evaluate(Node.builder("iati-activities").build(), "2.03"));
  }

  @Test
  void conflictingDeclarationsAreRejected() {
    StatisticRegistry.Builder builder = StatisticRegistry.builder()
        .leaf(RecordKind.ACTIVITY, List.of(summed("x", Shape.NUMBER, ctx -> NumberStat.ONE)));
    assertThrows(IllegalArgumentException.class,
        () -> builder.leaf(RecordKind.ORGANISATION, List.of(summed("x", Shape.COUNTER1, ctx -> Counter1.EMPTY))));
  }
}
