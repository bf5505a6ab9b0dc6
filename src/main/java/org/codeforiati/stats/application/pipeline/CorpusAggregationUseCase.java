package org.codeforiati.stats.application.pipeline;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.codeforiati.stats.application.group.GroupContext;
import org.codeforiati.stats.application.leaf.LeafEvaluator;
import org.codeforiati.stats.application.port.MetricsPort;
import org.codeforiati.stats.domain.currency.CurrencyConverter;
import org.codeforiati.stats.domain.record.GroupingKey;
import org.codeforiati.stats.domain.record.MalformedRecordException;
import org.codeforiati.stats.domain.record.RecordInput;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.HierarchyLevel;
import org.codeforiati.stats.infrastructure.exec.ExecutorFactories;
import org.codeforiati.stats.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Evaluates a corpus of records and rolls the results up to file, publisher and corpus
 * level.
 * <p><strong>Why:</strong> Leaf evaluations are independent, so they run on a bounded worker pool; folds are
 * associative and commutative, so completion order does not affect the report.</p>
 * <p><strong>Role:</strong> Application-layer use case wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Submit one evaluation per record, keeping at most one worker's worth plus the queue in flight.</li>
 *   <li>Fold each finished record into its file's running aggregate, so memory grows with files, not
 *   records.</li>
 *   <li>Isolate malformed or failing records as skipped records without affecting the others.</li>
 *   <li>Fold records per file, files per publisher and publishers into the corpus, closing each group.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #run} call owns its pool; concurrent runs are independent.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code publisher} and {@code file} around each evaluation and
 * emits {@code stats.records.evaluated} and {@code stats.records.skipped}.</p>
 *
 * @since 0.1.0
 */
public final class CorpusAggregationUseCase {
  private static final Logger log = LoggerFactory.getLogger(CorpusAggregationUseCase.class);
  static final String MDC_PUBLISHER = "publisher";
  static final String MDC_FILE = "file";

  private final LeafEvaluator evaluator;
  private final Aggregator aggregator;
  private final ReferenceTables tables;
  private final CurrencyConverter converter;
  private final LocalDate today;
  private final MetricsPort metrics;
  private final int workers;
  private final int queueCapacity;

  /**
   * Creates the use case.
   *
   * @param evaluator leaf evaluator; must not be {@code null}
   * @param aggregator level folds; must not be {@code null}
   * @param tables reference data passed to group statistics; must not be {@code null}
   * @param converter USD converter passed to group statistics; must not be {@code null}
   * @param today evaluation date shared by every level; must not be {@code null}
   * @param metrics metrics sink; {@code null} disables metrics
   * @param workers evaluation threads; {@code 1} evaluates on the calling thread
   * @param queueCapacity bounded queue size in front of the workers
   */
  public CorpusAggregationUseCase(
      LeafEvaluator evaluator,
      Aggregator aggregator,
      ReferenceTables tables,
      CurrencyConverter converter,
      LocalDate today,
      MetricsPort metrics,
      int workers,
      int queueCapacity) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.converter = Objects.requireNonNull(converter, "converter");
    this.today = Objects.requireNonNull(today, "today");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.workers = workers;
    this.queueCapacity = queueCapacity;
  }

  /**
   * Evaluates and aggregates every record.
   *
   * @param inputs records in any order; each carries its file and publisher
   * @return per-file, per-publisher and corpus aggregates
   * @throws InterruptedException if interrupted while waiting for evaluations
   */
  public CorpusReport run(Iterable<RecordInput> inputs) throws InterruptedException {
    Objects.requireNonNull(inputs, "inputs");
    long started = System.nanoTime();
    Deque<InFlight> inFlight = new ArrayDeque<>();
    Map<GroupingKey, Aggregate> partials = new LinkedHashMap<>();
    ExecutorService pool = workers == 1 ? null : ExecutorFactories.newEvaluationPool(workers, queueCapacity, null);
    try {
      for (RecordInput input : inputs) {
        Future<Aggregate> result = pool == null
            ? CompletableFuture.completedFuture(evaluateOne(input))
            : pool.submit(() -> evaluateOne(input));
        inFlight.addLast(new InFlight(input.key(), result));
        while (inFlight.size() >= window()) {
          foldInto(partials, inFlight.removeFirst());
        }
      }
      while (!inFlight.isEmpty()) {
        foldInto(partials, inFlight.removeFirst());
      }
    } finally {
      if (pool != null) {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
      }
    }

    Map<GroupingKey, Aggregate> files = new LinkedHashMap<>();
    partials.forEach((key, folded) -> files.put(key, closeFile(key, folded)));
    SortedMap<String, List<Aggregate>> byPublisher = new TreeMap<>();
    files.forEach((key, aggregate) -> byPublisher.computeIfAbsent(key.publisher(), p -> new ArrayList<>()).add(aggregate));
    SortedMap<String, Aggregate> publishers = new TreeMap<>();
    byPublisher.forEach((publisher, fileAggregates) -> publishers.put(publisher,
        aggregator.close(context(HierarchyLevel.PUBLISHER, aggregator.treeReduce(fileAggregates), publisher, null))));
    Aggregate corpus = aggregator.close(
        context(HierarchyLevel.CORPUS, aggregator.treeReduce(new ArrayList<>(publishers.values())), null, null));

    log.info("Aggregated {} records ({} skipped) across {} files and {} publishers in {} ms",
        corpus.records(), corpus.skippedRecords(), files.size(), publishers.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    return new CorpusReport(files, publishers, corpus);
  }

  /** Most evaluations held at once: one per worker plus a full queue. */
  int window() {
    return workers + queueCapacity;
  }

  private Aggregate closeFile(GroupingKey key, Aggregate folded) {
    return aggregator.close(context(HierarchyLevel.FILE, folded, key.publisher(), key.file()));
  }

  private GroupContext context(HierarchyLevel level, Aggregate aggregate, String publisher, String file) {
    return new GroupContext(level, aggregate, publisher, file, today, tables, converter);
  }

  /** Waits for the oldest evaluation and merges it into its file's running aggregate. */
  private void foldInto(Map<GroupingKey, Aggregate> partials, InFlight next) throws InterruptedException {
    Aggregate result;
    try {
      result = next.result().get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Record evaluation failed outside isolation", ex.getCause());
    }
    partials.put(next.key(), aggregator.merge(partials.getOrDefault(next.key(), Aggregate.EMPTY), result));
  }

  private record InFlight(GroupingKey key, Future<Aggregate> result) {}

  /** Evaluates one record; failures become a skipped-record aggregate. */
  Aggregate evaluateOne(RecordInput input) {
    String previousPublisher = MDC.get(MDC_PUBLISHER);
    String previousFile = MDC.get(MDC_FILE);
    MDC.put(MDC_PUBLISHER, input.key().publisher());
    MDC.put(MDC_FILE, input.key().file());
    try {
      Aggregate aggregate = Aggregate.ofRecord(evaluator.evaluate(input.element(), input.documentVersion()));
      metrics.increment("stats.records.evaluated");
      return aggregate;
    } catch (MalformedRecordException ex) {
      log.warn("Skipping malformed record in {}/{}: {}",
          input.key().publisher(), input.key().file(), Logs.truncate(ex.getMessage(), 200));
      metrics.increment("stats.records.skipped");
      return Aggregate.skipped();
    } catch (RuntimeException ex) {
      log.warn("Skipping record in {}/{} after evaluation failure", input.key().publisher(), input.key().file(), ex);
      metrics.increment("stats.records.skipped");
      return Aggregate.skipped();
    } finally {
      restore(MDC_PUBLISHER, previousPublisher);
      restore(MDC_FILE, previousFile);
    }
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
