package ca.gc.cra.keyscan.domain.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompositeCandidateTest {
  private static final BigInteger THREE = BigInteger.valueOf(3);
  private static final BigInteger FIVE = BigInteger.valueOf(5);
  private static final ByteKey FIFTEEN = ByteKey.of(new byte[] {15});

  @Test
  void pairsMustBeCanonical() {
    assertThrows(IllegalArgumentException.class,
        () -> new CompositeCandidate(FIVE, THREE, BigInteger.valueOf(15), FIFTEEN, FIFTEEN));
    assertThrows(IllegalArgumentException.class, () -> new MatchResult(FIVE, THREE, BigInteger.valueOf(15)));
  }

  @Test
  void encodingSelectsByOrderAndConvertsToMatch() {
    ByteKey lsf = ByteKey.of(new byte[] {0x01, 0x02});
    ByteKey msf = ByteKey.of(new byte[] {0x02, 0x01});
    CompositeCandidate candidate = new CompositeCandidate(THREE, THREE, BigInteger.valueOf(513), lsf, msf);

    assertEquals(lsf, candidate.encoding(DigitOrder.LSF));
    assertEquals(msf, candidate.encoding(DigitOrder.MSF));
    assertEquals(new MatchResult(THREE, THREE, BigInteger.valueOf(513)), candidate.toMatch());
  }

  @Test
  void matchesSortByPThenQ() {
    MatchResult a = new MatchResult(THREE, FIVE, BigInteger.valueOf(15));
    MatchResult b = new MatchResult(THREE, THREE, BigInteger.valueOf(9));
    MatchResult c = new MatchResult(BigInteger.TWO, FIVE, BigInteger.TEN);
    List<MatchResult> results = new ArrayList<>(List.of(a, b, c));

    results.sort(MatchResult.BY_PAIR);

    assertEquals(List.of(c, b, a), results);
  }
}
