package ca.gc.cra.keyscan.application.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by scan workers at block and partition boundaries.
 *
 * <p>Once cancelled a token stays cancelled. Any primes or matches gathered before cancellation are discarded.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * Requests cancellation.
   *
   * @return {@code true} if this call transitioned the token to cancelled
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  /**
   * Indicates whether cancellation was requested.
   *
   * @return {@code true} once {@link #cancel()} has been called
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throws when cancellation was requested.
   *
   * @throws ScanAbortedException with reason {@link ScanAbortedException.Reason#CANCELLED}
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new ScanAbortedException(ScanAbortedException.Reason.CANCELLED, "Scan cancelled");
    }
  }
}
