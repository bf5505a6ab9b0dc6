package org.codeforiati.stats.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerThreadsUsePrefixAndAreDaemons() throws Exception {
    ExecutorService pool = ExecutorFactories.newEvaluationPool(2, 4, "eval-test");
    try {
      Thread worker = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertTrue(worker.getName().startsWith("eval-test-"));
      assertTrue(worker.isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void fullQueueRunsTaskOnSubmittingThread() throws InterruptedException, ExecutionException {
    ExecutorService pool = ExecutorFactories.newEvaluationPool(1, 1, null);
    CountDownLatch release = new CountDownLatch(1);
    try {
      pool.submit(() -> {
        release.await();
        return null;
      });
      pool.submit(() -> null);
      Future<String> overflow = pool.submit(() -> Thread.currentThread().getName());

      assertEquals(Thread.currentThread().getName(), overflow.get());
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsInvalidSizes() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newEvaluationPool(0, 1, null));
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newEvaluationPool(1, 0, null));
  }
}
