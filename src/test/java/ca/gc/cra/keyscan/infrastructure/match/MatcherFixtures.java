package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.CompositeCandidate;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.testutil.DumpFixtures;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class MatcherFixtures {

  private MatcherFixtures() {}

  /** Indexes every canonical pair of {@code primes}, self pairs included. */
  static CompositeIndex indexOf(List<BigInteger> primes) {
    List<CompositeCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < primes.size(); i++) {
      for (int j = i; j < primes.size(); j++) {
        BigInteger a = primes.get(i);
        BigInteger b = primes.get(j);
        BigInteger p = a.min(b);
        BigInteger q = a.max(b);
        BigInteger n = p.multiply(q);
        candidates.add(
            new CompositeCandidate(p, q, n, ByteKey.of(DumpFixtures.lsf(n)), ByteKey.of(DumpFixtures.msf(n))));
      }
    }
    return CompositeIndex.of(candidates, 0);
  }

  /** Reference answer: tries every key at every offset. */
  static Set<MatchResult> bruteForce(DumpBuffer buffer, CompositeIndex index) {
    Set<MatchResult> results = new HashSet<>();
    for (ByteKey key : index.keys()) {
      for (int offset = 0; offset + key.length() <= buffer.length(); offset++) {
        if (key.matchesAt(buffer, offset)) {
          index.lookup(key).forEach(candidate -> results.add(candidate.toMatch()));
        }
      }
    }
    return results;
  }
}
