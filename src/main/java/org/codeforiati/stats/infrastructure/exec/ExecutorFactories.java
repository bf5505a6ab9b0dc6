package org.codeforiati.stats.infrastructure.exec;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the record evaluation worker pool.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool with a bounded queue for leaf evaluations.
   *
   * <p>When the queue is full the submitting thread runs the task itself, which throttles producers without
   * rejecting work.</p>
   *
   * @param workers number of worker threads
   * @param queueCapacity maximum number of queued evaluations
   * @param prefix thread-name prefix; defaults to {@code stats-eval}
   * @return configured executor service; callers own shutdown
   */
  public static ExecutorService newEvaluationPool(int workers, int queueCapacity, String prefix) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "stats-eval" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(
              (t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
          return thread;
        };

    return new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        factory,
        new ThreadPoolExecutor.CallerRunsPolicy());
  }
}
