package ca.gc.cra.keyscan.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.keyscan.application.port.DumpReader;
import ca.gc.cra.keyscan.config.ScanConfig;
import ca.gc.cra.keyscan.domain.scan.Advisory;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import ca.gc.cra.keyscan.infrastructure.match.CompositeMatchers;
import ca.gc.cra.keyscan.infrastructure.math.JdkPrimalityAdapter;
import ca.gc.cra.keyscan.testutil.DumpFixtures;
import ca.gc.cra.keyscan.testutil.RecordingMetrics;
import ca.gc.cra.keyscan.testutil.RecordingScanObserver;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KeyScanUseCaseTest {
  private static final Path DUMP = Path.of("/dumps/core.bin");

  private final RecordingScanObserver observer = new RecordingScanObserver();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final List<ScanReport> reported = new ArrayList<>();

  @Test
  void recoversKnownPairFromZeroPaddedDump() throws IOException {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);
    KeyScanUseCase useCase = useCase(ScanConfig.of(DUMP, 4, 1).withParallelism(2), path -> DumpBuffer.wrap(dump));

    ScanReport report = useCase.run(new CancellationToken());

    BigInteger n = DumpFixtures.P32.multiply(DumpFixtures.Q32);
    assertFalse(report.primesOnly());
    assertTrue(report.primes().containsAll(List.of(DumpFixtures.Q32, DumpFixtures.P32)));
    assertTrue(report.matches().contains(new MatchResult(DumpFixtures.Q32, DumpFixtures.P32, n)));
    assertEquals(MatcherStrategy.AUTOMATON, report.strategy());
    assertEquals(1, reported.size());
    assertEquals(report, reported.get(0));
    assertEquals(List.of(ScanPhase.PRIME_SCAN, ScanPhase.INDEX_BUILD, ScanPhase.MATCH), observer.completed());
  }

  @Test
  void matchingRunsOnTheScanWorkerPool() {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);
    DumpBuffer buffer = DumpBuffer.wrap(dump);

    for (MatcherStrategy strategy : MatcherStrategy.values()) {
      ScanConfig config = ScanConfig.of(DUMP, 4, 1).withMatcher(strategy).withParallelism(3);
      useCase(config, path -> buffer).scan(buffer, new CancellationToken());
    }

    Set<String> scanThreads = observer.progressThreads(ScanPhase.PRIME_SCAN);
    Set<String> matchThreads = observer.progressThreads(ScanPhase.MATCH);
    assertFalse(matchThreads.isEmpty());
    assertTrue(scanThreads.stream().allMatch(name -> name.startsWith("keyscan-worker-")), scanThreads.toString());
    assertTrue(matchThreads.stream().allMatch(name -> name.startsWith("keyscan-worker-")), matchThreads.toString());
  }

  @Test
  void everyMatcherReportsTheSameResults() {
    Random random = new Random(23);
    BigInteger p = DumpFixtures.primeWithoutZeroBytes(5, random);
    BigInteger q = DumpFixtures.primeWithoutZeroBytes(5, random);
    byte[] dump = DumpFixtures.concat(
        DumpFixtures.pairDump(p, q, true),
        DumpFixtures.noisyBytes(3_000, 4, random),
        DumpFixtures.msf(p.multiply(p)));
    DumpBuffer buffer = DumpBuffer.wrap(dump);

    List<List<MatchResult>> results = new ArrayList<>();
    for (MatcherStrategy strategy : MatcherStrategy.values()) {
      ScanConfig config = ScanConfig.of(DUMP, 5, 1).withMatcher(strategy).withParallelism(3);
      results.add(useCase(config, path -> buffer).scan(buffer, new CancellationToken()).matches());
    }

    BigInteger low = p.min(q);
    BigInteger high = p.max(q);
    assertTrue(results.get(0).contains(new MatchResult(low, high, p.multiply(q))));
    assertTrue(results.get(0).contains(new MatchResult(p, p, p.multiply(p))));
    assertEquals(results.get(0), results.get(1));
    assertEquals(results.get(0), results.get(2));
  }

  @Test
  void dumpPrimesSkipsIndexAndMatching() {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);
    ScanConfig config = ScanConfig.of(DUMP, 4, 1).withDumpPrimes();

    ScanReport report = useCase(config, path -> DumpBuffer.wrap(dump))
        .scan(DumpBuffer.wrap(dump), new CancellationToken());

    assertTrue(report.primesOnly());
    assertTrue(report.matches().isEmpty());
    assertNull(report.strategy());
    assertTrue(report.primes().contains(DumpFixtures.P32));
    assertEquals(List.of(ScanPhase.PRIME_SCAN), observer.completed());
    assertTrue(metrics.observed("index.pairs").isEmpty());
  }

  @Test
  void recordsRunCounters() {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);

    ScanReport report = useCase(ScanConfig.of(DUMP, 4, 1), path -> DumpBuffer.wrap(dump))
        .scan(DumpBuffer.wrap(dump), new CancellationToken());

    ScanStats stats = report.stats();
    assertEquals(dump.length - 3, metrics.lastObserved("scan.windows.visited"));
    assertEquals(stats.windowsNullRun(), metrics.lastObserved("scan.windows.nullRun"));
    assertEquals(stats.primesConfirmed(), metrics.lastObserved("scan.primes.confirmed"));
    assertEquals(stats.pairs(), metrics.lastObserved("index.pairs"));
    assertEquals(report.matches().size(), metrics.lastObserved("match.results"));
    assertEquals(stats.primesConfirmed() * (stats.primesConfirmed() + 1) / 2, stats.pairs());
  }

  @Test
  void primeCeilingAbortsBeforeIndexing() {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);
    ScanConfig base = ScanConfig.of(DUMP, 4, 1);
    ScanConfig config = new ScanConfig(
        base.input(), 4, 1, false, MatcherStrategy.NAIVE, base.byteOrder(), 1, 20, 0, 1,
        2, 8, ScanConfig.OutputFormat.TEXT);

    ScanAbortedException ex = assertThrows(
        ScanAbortedException.class,
        () -> useCase(config, path -> DumpBuffer.wrap(dump)).scan(DumpBuffer.wrap(dump), new CancellationToken()));

    assertEquals(ScanAbortedException.Reason.PRIME_LIMIT_EXCEEDED, ex.reason());
    assertFalse(observer.started().contains(ScanPhase.INDEX_BUILD));
  }

  @Test
  void lowWarnThresholdRaisesAdvisoryAndContinues() {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);
    ScanConfig base = ScanConfig.of(DUMP, 4, 1);
    ScanConfig config = new ScanConfig(
        base.input(), 4, 1, false, MatcherStrategy.AUTOMATON, base.byteOrder(), 1, 20, 1, 0,
        2, 8, ScanConfig.OutputFormat.TEXT);

    ScanReport report = useCase(config, path -> DumpBuffer.wrap(dump))
        .scan(DumpBuffer.wrap(dump), new CancellationToken());

    assertFalse(report.matches().isEmpty());
    assertTrue(observer.advisories().stream().anyMatch(a -> a.kind() == Advisory.Kind.PRIME_COUNT_HIGH));
  }

  @Test
  void cancelledRunReportsNothing() {
    byte[] dump = DumpFixtures.pairDump(DumpFixtures.P32, DumpFixtures.Q32, false);
    CancellationToken token = new CancellationToken();
    token.cancel();

    ScanAbortedException ex = assertThrows(
        ScanAbortedException.class,
        () -> useCase(ScanConfig.of(DUMP, 4, 1), path -> DumpBuffer.wrap(dump)).run(token));

    assertEquals(ScanAbortedException.Reason.CANCELLED, ex.reason());
    assertTrue(reported.isEmpty());
  }

  @Test
  void readerFailurePropagates() {
    DumpReader failing = path -> {
      throw new NoSuchFileException(path.toString());
    };

    assertThrows(
        NoSuchFileException.class,
        () -> useCase(ScanConfig.of(DUMP, 4, 1), failing).run(new CancellationToken()));
    assertTrue(reported.isEmpty());
  }

  private KeyScanUseCase useCase(ScanConfig config, DumpReader reader) {
    return new KeyScanUseCase(
        config,
        reader,
        new JdkPrimalityAdapter(),
        CompositeMatchers.create(config.matcher(), config.parallelism(), config.fingerprintWidth(), observer, metrics),
        observer,
        metrics,
        reported::add);
  }
}
