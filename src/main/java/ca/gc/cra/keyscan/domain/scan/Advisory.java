package ca.gc.cra.keyscan.domain.scan;

import java.util.Objects;

/**
 * Non-fatal signal raised while a scan continues.
 *
 * @param kind advisory category
 * @param message operator-facing description
 * @param value numeric value that triggered the advisory (for example the prime count)
 * @since 0.1.0
 */
public record Advisory(Kind kind, String message, long value) {

  /**
   * Validates required fields.
   */
  public Advisory {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /** Advisory categories. */
  public enum Kind {
    /** Confirmed prime count is high enough that quadratic pair construction may exhaust memory. */
    PRIME_COUNT_HIGH("primeCountHigh"),
    /** A composite encoding was wider than two prime windows and was left out of the index. */
    OVERSIZED_COMPOSITE("oversizedComposite");

    private final String metricName;

    Kind(String metricName) {
      this.metricName = metricName;
    }

    /**
     * Returns the camel-case name used in metric keys.
     *
     * @return metric segment
     */
    public String metricName() {
      return metricName;
    }
  }
}
