package ca.gc.cra.keyscan.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.keyscan.application.pipeline.ScanAbortedException;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void parallelStreamsRunOnNamedDaemonWorkers() {
    ForkJoinPool pool = ExecutorFactories.newScanPool(2, "scan-test", null);
    try {
      Set<String> names = ConcurrentHashMap.newKeySet();
      Set<Boolean> daemons = ConcurrentHashMap.newKeySet();
      int sum =
          ExecutorFactories.invoke(
              pool,
              () ->
                  IntStream.range(0, 10_000)
                      .parallel()
                      .peek(
                          i -> {
                            names.add(Thread.currentThread().getName());
                            daemons.add(Thread.currentThread().isDaemon());
                          })
                      .map(i -> i % 7)
                      .sum());

      assertEquals(IntStream.range(0, 10_000).map(i -> i % 7).sum(), sum);
      assertTrue(names.stream().allMatch(name -> name.startsWith("scan-test-")), names.toString());
      assertEquals(Set.of(true), daemons);
      assertEquals(2, pool.getParallelism());
    } finally {
      ExecutorFactories.shutdown(pool);
    }
    assertTrue(pool.isShutdown());
  }

  @Test
  void blankPrefixFallsBackToDefault() {
    ForkJoinPool pool = ExecutorFactories.newScanPool(1, " ", null);
    try {
      String name = ExecutorFactories.invoke(pool, () -> Thread.currentThread().getName());
      assertTrue(name.startsWith("keyscan-worker-"), name);
    } finally {
      ExecutorFactories.shutdown(pool);
    }
  }

  @Test
  void runtimeFailuresKeepTheirType() {
    ForkJoinPool pool = ExecutorFactories.newScanPool(1, "fail-test", null);
    try {
      ScanAbortedException ex =
          assertThrows(
              ScanAbortedException.class,
              () ->
                  ExecutorFactories.invoke(
                      pool,
                      () -> {
                        throw new ScanAbortedException(ScanAbortedException.Reason.CANCELLED, "stop");
                      }));
      assertEquals(ScanAbortedException.Reason.CANCELLED, ex.reason());
    } finally {
      ExecutorFactories.shutdown(pool);
    }
  }

  @Test
  void checkedFailuresAreWrapped() {
    ForkJoinPool pool = ExecutorFactories.newScanPool(1, "fail-test", null);
    try {
      IllegalStateException ex =
          assertThrows(
              IllegalStateException.class,
              () ->
                  ExecutorFactories.invoke(
                      pool,
                      () -> {
                        throw new IOException("disk gone");
                      }));
      assertInstanceOf(IOException.class, ex.getCause());
    } finally {
      ExecutorFactories.shutdown(pool);
    }
  }

  @Test
  void rejectsNonPositiveParallelism() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newScanPool(0, "x", null));
  }

  @Test
  void shutdownIgnoresNull() {
    ExecutorFactories.shutdown(null);
  }
}
