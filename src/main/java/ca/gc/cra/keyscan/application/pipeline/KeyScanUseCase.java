package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.application.port.CompositeMatcher;
import ca.gc.cra.keyscan.application.port.DumpReader;
import ca.gc.cra.keyscan.application.port.MetricsPort;
import ca.gc.cra.keyscan.application.port.PrimalityPort;
import ca.gc.cra.keyscan.application.port.ResultReporter;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.config.ScanConfig;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import ca.gc.cra.keyscan.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.keyscan.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the full key recovery pipeline over one memory dump.
 * <p><strong>Why:</strong> Ties window scanning, composite indexing and matching into a single run that either
 * reports every recovered factor pair or fails with a clear reason.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the scan ports and adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the dump through {@link DumpReader}.</li>
 *   <li>Collect confirmed primes with {@link WindowScanner}, then apply {@link PrimeVolumeGuard}.</li>
 *   <li>Build the {@link CompositeIndex} and search the dump with the configured {@link CompositeMatcher}.</li>
 *   <li>Hand the {@link ScanReport} to the {@link ResultReporter} and emit {@code scan.*} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances may be reused sequentially; each run owns its worker pool.</p>
 * <p><strong>Performance:</strong> Window scanning and index construction run on a dedicated
 * {@link ForkJoinPool} sized by {@link ScanConfig#parallelism()}.</p>
 * <p><strong>Observability:</strong> Phase timings flow to the {@link ScanObserver}; the final counters are
 * logged at INFO and recorded through {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class KeyScanUseCase {
  private static final Logger log = LoggerFactory.getLogger(KeyScanUseCase.class);
  private static final String POOL_PREFIX = "keyscan-worker";

  private final ScanConfig config;
  private final DumpReader reader;
  private final PrimalityPort primality;
  private final CompositeMatcher matcher;
  private final ScanObserver observer;
  private final MetricsPort metrics;
  private final ResultReporter reporter;

  /**
   * Creates the use case with explicit dependencies.
   *
   * @param config validated scan settings; must not be {@code null}
   * @param reader dump source; must not be {@code null}
   * @param primality big-integer capability; must not be {@code null}
   * @param matcher composite matcher selected by {@link ScanConfig#matcher()}; must not be {@code null}
   * @param observer progress and advisory sink; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param reporter output sink; must not be {@code null}
   */
  public KeyScanUseCase(
      ScanConfig config,
      DumpReader reader,
      PrimalityPort primality,
      CompositeMatcher matcher,
      ScanObserver observer,
      MetricsPort metrics,
      ResultReporter reporter) {
    this.config = Objects.requireNonNull(config, "config");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.primality = Objects.requireNonNull(primality, "primality");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.observer = Objects.requireNonNull(observer, "observer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
  }

  /**
   * Reads the configured dump, scans it and reports the outcome.
   *
   * @param cancellation token that aborts the run when cancelled
   * @return report handed to the reporter
   * @throws IOException when the dump cannot be read or the report cannot be written
   * @throws ScanAbortedException when no windows fit, the prime ceiling is exceeded, or the run is cancelled
   */
  public ScanReport run(CancellationToken cancellation) throws IOException {
    Objects.requireNonNull(cancellation, "cancellation");
    log.info("Reading dump {}", config.input());
    DumpBuffer buffer = reader.read(config.input());
    log.info(
        "Scanning {} bytes with primeSize={} nullFilterLength={} matcher={} parallelism={}",
        buffer.length(),
        config.primeSize(),
        config.nullFilterLength(),
        config.dumpPrimes() ? "none" : config.matcher().cliName(),
        config.parallelism());
    ScanReport report = scan(buffer, cancellation);
    reporter.report(report);
    return report;
  }

  /**
   * Scans an in-memory dump without touching the reader or the reporter.
   *
   * @param buffer dump contents
   * @param cancellation token that aborts the run when cancelled
   * @return primes, matches and counters of the run
   * @throws ScanAbortedException when no windows fit, the prime ceiling is exceeded, or the run is cancelled
   */
  public ScanReport scan(DumpBuffer buffer, CancellationToken cancellation) {
    Objects.requireNonNull(buffer, "buffer");
    Objects.requireNonNull(cancellation, "cancellation");
    ForkJoinPool pool =
        ExecutorFactories.newScanPool(
            config.parallelism(),
            POOL_PREFIX,
            (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      return execute(buffer, pool, cancellation);
    } finally {
      ExecutorFactories.shutdown(pool);
    }
  }

  private ScanReport execute(DumpBuffer buffer, ForkJoinPool pool, CancellationToken cancellation) {
    PrimalityFilter filter =
        new PrimalityFilter(primality, config.byteOrder(), config.stage1Rounds(), config.stage2Rounds());
    long started = System.nanoTime();
    WindowScanner.Result scanned =
        new WindowScanner(filter, observer)
            .scan(buffer, config.primeSize(), config.nullFilterLength(), pool, cancellation);
    observer.onPhaseCompleted(ScanPhase.PRIME_SCAN, Duration.ofNanos(System.nanoTime() - started));
    ScanStats stats = ScanStats.of(scanned);
    if (log.isDebugEnabled()) {
      scanned.primes().stream()
          .sorted()
          .forEach(prime -> log.debug("Confirmed prime {}", Logs.fingerprint(prime)));
    }

    if (config.dumpPrimes()) {
      ScanReport report = ScanReport.primesOnly(scanned.primes(), stats);
      record(stats);
      log.info("Prime scan complete: {}", stats.summary());
      return report;
    }

    new PrimeVolumeGuard(config.primeWarnThreshold(), config.maxPrimes(), observer)
        .check(scanned.primes().size());

    started = System.nanoTime();
    CompositeIndex index =
        new CompositeIndexBuilder(primality, observer, metrics)
            .build(scanned.primes(), config.primeSize(), pool, cancellation);
    observer.onPhaseCompleted(ScanPhase.INDEX_BUILD, Duration.ofNanos(System.nanoTime() - started));
    stats = stats.withIndex(index);

    started = System.nanoTime();
    observer.onPhaseStarted(ScanPhase.MATCH, buffer.length());
    Set<MatchResult> found = matcher.match(buffer, index, pool, cancellation);
    observer.onPhaseCompleted(ScanPhase.MATCH, Duration.ofNanos(System.nanoTime() - started));
    stats = stats.withMatches(found.size());

    ScanReport report =
        ScanReport.withMatches(scanned.primes(), found, matcher.strategy(), stats);
    for (MatchResult match : report.matches()) {
      log.debug(
          "Recovered pair P={} Q={} N={}",
          Logs.fingerprint(match.p()),
          Logs.fingerprint(match.q()),
          Logs.fingerprint(match.n()));
    }
    record(stats);
    log.info("Key scan complete: {}", stats.summary());
    return report;
  }

  private void record(ScanStats stats) {
    metrics.observe("scan.windows.visited", stats.windowsVisited());
    metrics.observe("scan.windows.nullRun", stats.windowsNullRun());
    metrics.observe("scan.primes.stage1.rejected", stats.stage1Rejected());
    metrics.observe("scan.primes.stage2.rejected", stats.stage2Rejected());
    metrics.observe("scan.primes.confirmed", stats.primesConfirmed());
    if (!config.dumpPrimes()) {
      metrics.observe("index.pairs", stats.pairs());
      metrics.observe("match.results", stats.matches());
    }
  }
}
