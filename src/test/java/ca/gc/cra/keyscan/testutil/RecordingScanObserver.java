package ca.gc.cra.keyscan.testutil;

import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.Advisory;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Observer double that keeps every signal for later assertions. */
public final class RecordingScanObserver implements ScanObserver {
  private final List<ScanPhase> started = Collections.synchronizedList(new ArrayList<>());
  private final List<ScanPhase> completed = Collections.synchronizedList(new ArrayList<>());
  private final List<Advisory> advisories = Collections.synchronizedList(new ArrayList<>());
  private final Map<ScanPhase, Long> totals = Collections.synchronizedMap(new EnumMap<>(ScanPhase.class));
  private final Map<ScanPhase, AtomicLong> progress = new EnumMap<>(ScanPhase.class);
  private final Map<ScanPhase, Set<String>> progressThreads = new EnumMap<>(ScanPhase.class);

  public RecordingScanObserver() {
    for (ScanPhase phase : ScanPhase.values()) {
      progress.put(phase, new AtomicLong());
      progressThreads.put(phase, ConcurrentHashMap.newKeySet());
    }
  }

  @Override
  public void onPhaseStarted(ScanPhase phase, long totalUnits) {
    started.add(phase);
    totals.put(phase, totalUnits);
  }

  @Override
  public void onProgress(ScanPhase phase, long completedUnits) {
    progress.get(phase).addAndGet(completedUnits);
    progressThreads.get(phase).add(Thread.currentThread().getName());
  }

  @Override
  public void onAdvisory(Advisory advisory) {
    advisories.add(advisory);
  }

  @Override
  public void onPhaseCompleted(ScanPhase phase, Duration elapsed) {
    completed.add(phase);
  }

  public List<ScanPhase> started() {
    return List.copyOf(started);
  }

  public List<ScanPhase> completed() {
    return List.copyOf(completed);
  }

  public List<Advisory> advisories() {
    return List.copyOf(advisories);
  }

  public long total(ScanPhase phase) {
    return totals.getOrDefault(phase, -1L);
  }

  public long progress(ScanPhase phase) {
    return progress.get(phase).get();
  }

  public Set<String> progressThreads(ScanPhase phase) {
    return Set.copyOf(progressThreads.get(phase));
  }
}
