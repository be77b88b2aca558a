package ca.gc.cra.keyscan.infrastructure.events;

import ca.gc.cra.keyscan.application.port.MetricsPort;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.Advisory;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes scan progress and advisories to SLF4J and mirrors them into metrics.
 *
 * <p>Progress is logged at INFO each time a phase crosses another tenth of its expected work, and at DEBUG for
 * every hundredth. Advisories are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class LoggingScanObserver implements ScanObserver {
  private static final Logger log = LoggerFactory.getLogger(LoggingScanObserver.class);
  private static final int PROGRESS_STEPS = 10;
  private static final int FINE_PROGRESS_STEPS = 100;

  private final MetricsPort metrics;
  private final Map<ScanPhase, PhaseProgress> progress = new EnumMap<>(ScanPhase.class);

  /**
   * Creates an observer.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingScanObserver(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    for (ScanPhase phase : ScanPhase.values()) {
      progress.put(phase, new PhaseProgress());
    }
  }

  @Override
  public void onPhaseStarted(ScanPhase phase, long totalUnits) {
    Objects.requireNonNull(phase, "phase");
    PhaseProgress state = progress.get(phase);
    state.reset(totalUnits);
    log.info("Starting {} over {} units", phase.metricName(), totalUnits < 0 ? "?" : totalUnits);
  }

  @Override
  public void onProgress(ScanPhase phase, long completedUnits) {
    PhaseProgress state = progress.get(Objects.requireNonNull(phase, "phase"));
    long done = state.completed.addAndGet(completedUnits);
    long total = state.total;
    if (total <= 0) {
      return;
    }
    if (log.isDebugEnabled() && advance(state.lastFineStep, done, total, FINE_PROGRESS_STEPS) > 0) {
      log.debug("{} progress detail: {}/{} units", phase.metricName(), done, total);
    }
    int step = advance(state.lastStep, done, total, PROGRESS_STEPS);
    if (step > 0) {
      log.info("{} progress: {}%", phase.metricName(), step * 100 / PROGRESS_STEPS);
    }
  }

  /** Returns the newly reached step, or 0 when another caller already reported it. */
  private static int advance(AtomicInteger lastStep, long done, long total, int steps) {
    int step = (int) Math.min(steps, done * steps / total);
    int previous = lastStep.get();
    return step > previous && lastStep.compareAndSet(previous, step) ? step : 0;
  }

  @Override
  public void onAdvisory(Advisory advisory) {
    Objects.requireNonNull(advisory, "advisory");
    metrics.increment("advisory." + advisory.kind().metricName());
    log.warn("{}: {}", advisory.kind().metricName(), advisory.message());
  }

  @Override
  public void onPhaseCompleted(ScanPhase phase, Duration elapsed) {
    Objects.requireNonNull(phase, "phase");
    long millis = elapsed.toMillis();
    metrics.observe("phase." + phase.metricName() + ".durationMillis", millis);
    log.info("Completed {} in {} ms", phase.metricName(), millis);
  }

  /**
   * Returns the units reported for {@code phase} since it last started.
   *
   * @param phase phase to query
   * @return completed units
   */
  long completed(ScanPhase phase) {
    return progress.get(phase).completed.get();
  }

  private static final class PhaseProgress {
    private final AtomicLong completed = new AtomicLong();
    private final AtomicInteger lastStep = new AtomicInteger();
    private final AtomicInteger lastFineStep = new AtomicInteger();
    private volatile long total;

    void reset(long totalUnits) {
      completed.set(0);
      lastStep.set(0);
      lastFineStep.set(0);
      total = totalUnits;
    }
  }
}
