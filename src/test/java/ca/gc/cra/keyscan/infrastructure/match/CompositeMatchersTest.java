package ca.gc.cra.keyscan.infrastructure.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.keyscan.application.port.CompositeMatcher;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import ca.gc.cra.keyscan.testutil.RecordingMetrics;
import ca.gc.cra.keyscan.testutil.RecordingScanObserver;
import org.junit.jupiter.api.Test;

class CompositeMatchersTest {
  private final RecordingScanObserver observer = new RecordingScanObserver();
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void createsMatcherForEachStrategy() {
    assertInstanceOf(NaiveWindowMatcher.class, create(MatcherStrategy.NAIVE));
    assertInstanceOf(AhoCorasickMatcher.class, create(MatcherStrategy.AUTOMATON));
    assertInstanceOf(RollingHashMatcher.class, create(MatcherStrategy.ROLLING_HASH));
    for (MatcherStrategy strategy : MatcherStrategy.values()) {
      assertEquals(strategy, create(strategy).strategy());
    }
  }

  @Test
  void rejectsMissingStrategy() {
    assertThrows(NullPointerException.class, () -> create(null));
  }

  private CompositeMatcher create(MatcherStrategy strategy) {
    return CompositeMatchers.create(strategy, 2, 8, observer, metrics);
  }
}
