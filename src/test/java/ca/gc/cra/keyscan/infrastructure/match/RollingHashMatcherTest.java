package ca.gc.cra.keyscan.infrastructure.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.keyscan.application.pipeline.CancellationToken;
import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.keyscan.testutil.RecordingMetrics;
import ca.gc.cra.keyscan.testutil.RecordingScanObserver;
import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RollingHashMatcherTest {
  // 241 * 251 = 60491 = 0xEC4B
  private static final BigInteger P = BigInteger.valueOf(241);
  private static final BigInteger Q = BigInteger.valueOf(251);

  private final RecordingMetrics metrics = new RecordingMetrics();

  private ForkJoinPool pool;

  @BeforeEach
  void startPool() {
    pool = ExecutorFactories.newScanPool(2, "matcher-test", null);
  }

  @AfterEach
  void stopPool() {
    ExecutorFactories.shutdown(pool);
  }

  @Test
  void unconfirmedSeparatorsAreCountedButNeverReported() {
    CompositeIndex index = MatcherFixtures.indexOf(List.of(P, Q));
    DumpBuffer buffer =
        DumpBuffer.wrap(new byte[] {(byte) 0xEC, 0x00, (byte) 0xEC, 0x01, (byte) 0xEC, 0x4B});
    RollingHashMatcher matcher = new RollingHashMatcher(1, 1, new RecordingScanObserver(), metrics);

    Set<MatchResult> found = matcher.match(buffer, index, pool, new CancellationToken());

    assertEquals(Set.of(new MatchResult(P, Q, P.multiply(Q))), found);
    assertEquals(2, matcher.collisions());
    assertEquals(2, metrics.count("match.rolling.collisions"));
  }

  @Test
  void collisionCountCoversOnlyTheLatestCall() {
    CompositeIndex index = MatcherFixtures.indexOf(List.of(P, Q));
    DumpBuffer buffer =
        DumpBuffer.wrap(new byte[] {(byte) 0xEC, 0x00, (byte) 0xEC, 0x01, (byte) 0xEC, 0x4B});
    RollingHashMatcher matcher = new RollingHashMatcher(1, 1, new RecordingScanObserver(), metrics);

    matcher.match(buffer, index, pool, new CancellationToken());
    matcher.match(buffer, index, pool, new CancellationToken());
    assertEquals(2, matcher.collisions());
    assertEquals(4, metrics.count("match.rolling.collisions"));

    matcher.match(buffer, MatcherFixtures.indexOf(List.of()), pool, new CancellationToken());
    assertEquals(0, matcher.collisions());
  }

  @Test
  void fingerprintWiderThanShortestKeyIsNarrowed() {
    CompositeIndex index = MatcherFixtures.indexOf(List.of(P, Q));
    DumpBuffer buffer = DumpBuffer.wrap(new byte[] {0x07, 0x4B, (byte) 0xEC, 0x07});
    RollingHashMatcher matcher = new RollingHashMatcher(2, 64, new RecordingScanObserver(), metrics);

    assertEquals(
        Set.of(new MatchResult(P, Q, P.multiply(Q))), matcher.match(buffer, index, pool, new CancellationToken()));
    assertEquals(0, matcher.collisions());
  }

  @Test
  void rejectsNonPositiveWidth() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RollingHashMatcher(1, 0, new RecordingScanObserver(), metrics));
  }
}
