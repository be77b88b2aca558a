package ca.gc.cra.keyscan.application.pipeline;

import java.util.Objects;

/**
 * Raised when a scan cannot produce a valid result.
 *
 * <p>Anomalies within a single window never raise this exception; they only exclude the window.</p>
 *
 * @since 0.1.0
 */
public final class ScanAbortedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Typed cause of the abort. */
  public enum Reason {
    /** The prime size exceeds the dump length so no window exists. */
    NO_WINDOWS,
    /** The confirmed prime count exceeded the configured ceiling. */
    PRIME_LIMIT_EXCEEDED,
    /** The run was cancelled or interrupted. */
    CANCELLED
  }

  private final Reason reason;

  /**
   * Creates an exception with a reason and message.
   *
   * @param reason typed cause
   * @param message operator-facing detail
   */
  public ScanAbortedException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Creates an exception with a reason, message and underlying cause.
   *
   * @param reason typed cause
   * @param message operator-facing detail
   * @param cause underlying failure
   */
  public ScanAbortedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Returns the typed cause.
   *
   * @return abort reason
   */
  public Reason reason() {
    return reason;
  }
}
