package org.codeforiati.stats.application.pipeline;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.codeforiati.stats.application.leaf.LeafEvaluator;
import org.codeforiati.stats.application.leaf.StatisticRegistry;
import org.codeforiati.stats.application.port.MetricsPort;
import org.codeforiati.stats.domain.record.GroupingKey;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.record.RecordInput;
import org.codeforiati.stats.domain.record.RecordKind;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.codeforiati.stats.fixtures.RecordingMetricsPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class CorpusAggregationUseCaseTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void rollsRecordsUpToFilesPublishersAndCorpus() throws InterruptedException {
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    CorpusReport report = useCase(StatisticRegistry.standard(), metrics, 1).run(corpus());

    assertEquals(3, report.files().size());
    assertEquals(List.of("pub-a", "pub-b"), new ArrayList<>(report.publishers().keySet()));
    Aggregate corpus = report.corpus();
    assertEquals(5, corpus.records());
    assertEquals(1, report.skippedRecords());
    assertEquals(5, metrics.count("stats.records.evaluated"));
    assertEquals(1, metrics.count("stats.records.skipped"));

    assertEquals(0, BigDecimal.valueOf(4).compareTo(corpus.number("activities")));
    assertEquals(0, BigDecimal.valueOf(2).compareTo(corpus.number("publishers")));
    assertEquals(0, BigDecimal.valueOf(2).compareTo(corpus.number("activity_files")));
    assertEquals(0, BigDecimal.ONE.compareTo(corpus.number("organisation_files")));
    assertEquals(0, BigDecimal.valueOf(3).compareTo(corpus.number("unique_identifiers")));
    assertEquals(2, corpus.counter1("duplicate_identifiers").get("B-1").intValue());

    Aggregate pubA = report.publisher("pub-a");
    assertEquals(Counter1.label("yes"), pubA.value("publisher_has_org_file"));
    assertEquals(1, pubA.counter1("provider_activity_id_without_own").get("B-1").intValue());
    assertEquals(Counter1.label("no"), report.publisher("pub-b").value("publisher_has_org_file"));

    Counter1 traceable = corpus.counter1("traceable_activities_by_publisher_id");
    Counter1 denominator = corpus.counter1("traceable_activities_by_publisher_id_denominator");
    assertEquals(2, traceable.get("pub-b").intValue());
    assertEquals(0, traceable.get("pub-a").signum());
    assertEquals(2, denominator.get("pub-a").intValue());
    assertEquals(2, denominator.get("pub-b").intValue());

    Aggregate orgFile = report.files().get(new GroupingKey("pub-a", "pub-a-org.xml"));
    assertEquals(0, BigDecimal.ONE.compareTo(orgFile.number("organisation_files")));
    assertEquals(0, orgFile.number("activity_files").signum());
  }

  @Test
  void parallelRunMatchesSequentialRun() throws InterruptedException {
    CorpusReport sequential = useCase(StatisticRegistry.standard(), null, 1).run(corpus());
    CorpusReport parallel = useCase(StatisticRegistry.standard(), null, 4).run(corpus());

    assertEquals(sequential.corpus(), parallel.corpus());
    assertEquals(sequential.publishers(), parallel.publishers());
    assertEquals(sequential.files(), parallel.files());
  }

  @Test
  void emptyCorpusYieldsEmptyReport() throws InterruptedException {
    CorpusReport report = useCase(StatisticRegistry.standard(), null, 2).run(List.of());

    assertTrue(report.files().isEmpty());
    assertTrue(report.publishers().isEmpty());
    assertEquals(0, report.corpus().records());
    assertEquals(0, report.corpus().number("publishers").signum());
  }

  @Test
  void evaluationRunsWithGroupingKeyInMdcAndRestoresIt() {
    StatisticRegistry registry = StatisticRegistry.builder()
        .leaf(RecordKind.ACTIVITY, List.of(
            summed("mdc", Shape.COUNTER1, ctx -> Counter1.label(MDC.get("publisher") + "/" + MDC.get("file")))))
        .build();
    CorpusAggregationUseCase useCase = useCase(registry, null, 1);
    MDC.put("publisher", "outer");

    Aggregate result = useCase.evaluateOne(RecordFixtures.input("pub-x", "x.xml", RecordFixtures.activity("X").build()));

    assertEquals(Counter1.label("pub-x/x.xml"), result.value("mdc"));
    assertEquals("outer", MDC.get("publisher"));
    assertNull(MDC.get("file"));
  }

  @Test
  void malformedRecordIsSkippedWithWarning() {
    Logger logger = (Logger) LoggerFactory.getLogger(CorpusAggregationUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    Aggregate result;
    try {
      result = useCase(StatisticRegistry.standard(), null, 1)
          .evaluateOne(new RecordInput(Node.builder("iati-activities").build(), "2.03", new GroupingKey("p", "f.xml")));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(0, result.records());
    assertEquals(1, result.skippedRecords());
    assertEquals(1, appender.list.size());
    assertEquals(Level.WARN, appender.list.get(0).getLevel());
    assertTrue(appender.list.get(0).getFormattedMessage().contains("p/f.xml"));
  }

  @Test
  void pathologicallyDeepRecordIsSkippedWithoutAbortingTheRun() throws InterruptedException {
    Node deep = Node.builder("description").build();
    for (int i = 0; i < 200_000; i++) {
      deep = Node.builder("description").child(deep).build();
    }
    List<RecordInput> inputs = List.of(
        RecordFixtures.input("pub-a", "a.xml", RecordFixtures.activity("A-1").build()),
        RecordFixtures.input("pub-a", "a.xml", Node.builder("iati-activity").child(deep).build()));

    CorpusReport report = useCase(StatisticRegistry.standard(), null, 2).run(inputs);

    assertEquals(1, report.corpus().records());
    assertEquals(1, report.corpus().skippedRecords());
    assertEquals(0, BigDecimal.ONE.compareTo(report.corpus().number("activities")));
  }

  @Test
  void recordsInFlightStayWithinTheWindow() throws InterruptedException {
    AtomicInteger finished = new AtomicInteger();
    MetricsPort counting = new MetricsPort() {
      @Override
      public void increment(String key) {
        if (key.equals("stats.records.evaluated") || key.equals("stats.records.skipped")) {
          finished.incrementAndGet();
        }
      }

      @Override
      public void observe(String key, long value) {}
    };
    CorpusAggregationUseCase useCase = useCase(StatisticRegistry.standard(), counting, 2);
    List<RecordInput> records = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      records.add(RecordFixtures.input("pub-a", "a-" + (i % 3) + ".xml", RecordFixtures.activity("A-" + i).build()));
    }
    AtomicInteger widest = new AtomicInteger();
    Iterable<RecordInput> watched = () -> new Iterator<>() {
      private int yielded;

      @Override
      public boolean hasNext() {
        return yielded < records.size();
      }

      @Override
      public RecordInput next() {
        widest.accumulateAndGet(yielded - finished.get(), Math::max);
        return records.get(yielded++);
      }
    };

    CorpusReport report = useCase.run(watched);

    assertEquals(40, report.corpus().records());
    assertEquals(3, report.files().size());
    assertTrue(widest.get() < useCase.window(), "in flight: " + widest.get());
  }

  @Test
  void invalidPoolSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> useCase(StatisticRegistry.standard(), null, 0));
  }

  private static CorpusAggregationUseCase useCase(StatisticRegistry registry, MetricsPort metrics, int workers) {
    LeafEvaluator evaluator = RecordFixtures.evaluator(registry, metrics);
    return new CorpusAggregationUseCase(evaluator, new Aggregator(registry, metrics), RecordFixtures.tables(),
        RecordFixtures.converter(), RecordFixtures.TODAY, metrics, workers, 2);
  }

  private static List<RecordInput> corpus() {
    Node citing = RecordFixtures.activity("A-1")
        .child(RecordFixtures.transaction("1", "2023-05-01", "10", "USD")
            .child(Node.builder("provider-org").attribute("provider-activity-id", "B-1")))
        .build();
    return List.of(
        RecordFixtures.input("pub-a", "pub-a-1.xml", citing),
        RecordFixtures.input("pub-b", "pub-b-1.xml", RecordFixtures.activity("B-1").build()),
        RecordFixtures.input("pub-a", "pub-a-1.xml", RecordFixtures.activity("A-2").build()),
        RecordFixtures.input("pub-a", "pub-a-org.xml", RecordFixtures.organisation("pub-a-org").build()),
        RecordFixtures.input("pub-b", "pub-b-1.xml", RecordFixtures.activity("B-1").build()),
        RecordFixtures.input("pub-b", "pub-b-1.xml", Node.builder("iati-activities").build()));
  }
}
