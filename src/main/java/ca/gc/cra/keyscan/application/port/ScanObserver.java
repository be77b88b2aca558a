package ca.gc.cra.keyscan.application.port;

import ca.gc.cra.keyscan.domain.scan.Advisory;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import java.time.Duration;

/**
 * <strong>What:</strong> Sink for progress and advisory signals raised while a scan runs.
 * <p><strong>Why:</strong> Keeps the scanning core free of any particular logging or progress display.</p>
 * <p><strong>Role:</strong> Port implemented by {@code LoggingScanObserver}; {@link #NO_OP} is the default.</p>
 * <p><strong>Thread-safety:</strong> {@link #onProgress} is called from worker threads and must tolerate
 * concurrent invocation. Phase callbacks arrive on the calling thread.</p>
 *
 * @since 0.1.0
 */
public interface ScanObserver {

  /**
   * Signals the start of a phase.
   *
   * @param phase phase starting
   * @param totalUnits expected number of work units (windows, pairs or bytes), or {@code -1} if unknown
   */
  void onPhaseStarted(ScanPhase phase, long totalUnits);

  /**
   * Reports units completed within a phase since the previous call.
   *
   * @param phase active phase
   * @param completedUnits units completed in this increment
   */
  void onProgress(ScanPhase phase, long completedUnits);

  /**
   * Reports a non-fatal condition.
   *
   * @param advisory advisory details
   */
  void onAdvisory(Advisory advisory);

  /**
   * Signals completion of a phase.
   *
   * @param phase phase that finished
   * @param elapsed wall-clock duration of the phase
   */
  void onPhaseCompleted(ScanPhase phase, Duration elapsed);

  /** Observer that ignores every signal. */
  ScanObserver NO_OP = new ScanObserver() {
    @Override public void onPhaseStarted(ScanPhase phase, long totalUnits) {}

    @Override public void onProgress(ScanPhase phase, long completedUnits) {}

    @Override public void onAdvisory(Advisory advisory) {}

    @Override public void onPhaseCompleted(ScanPhase phase, Duration elapsed) {}
  };
}
