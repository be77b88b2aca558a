package ca.gc.cra.keyscan.domain.scan;

import java.util.Locale;

/**
 * <strong>What:</strong> Interchangeable algorithms used to find composite encodings in a dump.
 * <p><strong>Why:</strong> The strategies trade memory for throughput differently; the choice is a deployment
 * decision and never changes the reported matches.</p>
 * <p><strong>Role:</strong> Configuration value resolved by the composition root into a matcher adapter.</p>
 *
 * @since 0.1.0
 */
public enum MatcherStrategy {
  /** Direct index lookups over sliding windows of every key length. */
  NAIVE("naive"),
  /** Multi-pattern Aho-Corasick automaton streamed once over the buffer. */
  AUTOMATON("automaton"),
  /** Rabin fingerprint prefilter with exact confirmation against the index. */
  ROLLING_HASH("rolling-hash");

  private final String cliName;

  MatcherStrategy(String cliName) {
    this.cliName = cliName;
  }

  /**
   * Returns the name accepted on the command line.
   *
   * @return lowercase CLI name
   */
  public String cliName() {
    return cliName;
  }

  /**
   * Parses a CLI value.
   *
   * @param raw value such as {@code naive}, {@code automaton} or {@code rolling-hash}
   * @return matching strategy
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static MatcherStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("matcher must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (MatcherStrategy strategy : values()) {
      if (strategy.cliName.equals(normalized)) {
        return strategy;
      }
    }
    if (normalized.equals("rolling") || normalized.equals("rabin")) {
      return ROLLING_HASH;
    }
    if (normalized.equals("aho-corasick")) {
      return AUTOMATON;
    }
    throw new IllegalArgumentException(
        "matcher must be one of naive, automaton, rolling-hash (was " + raw + ")");
  }
}
