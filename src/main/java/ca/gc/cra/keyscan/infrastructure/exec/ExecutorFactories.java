package ca.gc.cra.keyscan.infrastructure.exec;

import ca.gc.cra.keyscan.application.pipeline.ScanAbortedException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the fork-join pools that run scan, index and match phases.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fork-join pool whose workers carry a recognizable name.
   *
   * <p>Parallel streams submitted to the returned pool run on its workers rather than on the common pool.</p>
   *
   * @param parallelism number of worker threads
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured pool; callers must {@link #shutdown(ForkJoinPool) shut it down}
   */
  public static ForkJoinPool newScanPool(int parallelism, String prefix, UncaughtExceptionHandler handler) {
    if (parallelism <= 0) {
      throw new IllegalArgumentException("parallelism must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "keyscan-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ForkJoinPool.ForkJoinWorkerThreadFactory factory =
        pool -> {
          ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };
    return new ForkJoinPool(parallelism, factory, effectiveHandler, false);
  }

  /**
   * Runs {@code task} inside {@code pool} and waits for its result.
   *
   * @param pool pool executing the task
   * @param task work to execute; parallel streams inside it use {@code pool}
   * @param <T> result type
   * @return task result
   * @throws ScanAbortedException with reason {@code CANCELLED} when the waiting thread is interrupted
   */
  public static <T> T invoke(ForkJoinPool pool, Callable<T> task) {
    try {
      return pool.submit(task).get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ScanAbortedException(ScanAbortedException.Reason.CANCELLED, "Interrupted while waiting for workers", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Worker task failed", cause);
    }
  }

  /**
   * Shuts down {@code pool}, waiting briefly for workers to exit.
   *
   * @param pool pool to stop; {@code null} is ignored
   */
  public static void shutdown(ForkJoinPool pool) {
    if (pool == null) {
      return;
    }
    pool.shutdownNow();
    try {
      pool.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
