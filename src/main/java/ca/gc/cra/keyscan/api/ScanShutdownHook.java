package ca.gc.cra.keyscan.api;

import ca.gc.cra.keyscan.application.pipeline.CancellationToken;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JVM shutdown hook that cancels a running scan and holds shutdown until the scan has unwound.
 *
 * <p>The JVM halts as soon as every hook returns, so the hook waits (bounded by {@code grace}) for
 * {@link #scanFinished()} before returning. That lets the cancelled run log its outcome.</p>
 */
final class ScanShutdownHook implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(ScanShutdownHook.class);
  static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);

  private final CancellationToken cancellation;
  private final Duration grace;
  private final CountDownLatch finished = new CountDownLatch(1);

  ScanShutdownHook(CancellationToken cancellation, Duration grace) {
    this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    this.grace = Objects.requireNonNull(grace, "grace");
    if (grace.isNegative()) {
      throw new IllegalArgumentException("grace must not be negative");
    }
  }

  @Override
  public void run() {
    if (finished.getCount() == 0) {
      return;
    }
    log.warn("Shutdown requested; cancelling scan");
    cancellation.cancel();
    try {
      if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Scan did not stop within {} ms of shutdown", grace.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the scan to stop");
    }
  }

  /** Releases a hook that is waiting for the scan to stop. */
  void scanFinished() {
    finished.countDown();
  }
}
