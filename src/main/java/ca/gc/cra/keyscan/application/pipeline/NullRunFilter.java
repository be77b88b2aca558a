package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.Window;

/**
 * <strong>What:</strong> Excludes windows that contain a run of zero bytes at least {@code nullRunLength} long.
 * <p><strong>Why:</strong> Long zero runs are padding, not key material, and would otherwise dominate the candidate
 * count before any big-integer arithmetic happens.</p>
 * <p><strong>Role:</strong> Structural pre-filter used by {@link WindowScanner}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; each scan block owns its own filter.</p>
 * <p><strong>Performance:</strong> Windows must be visited in increasing offset order; every dump byte is inspected
 * once per block, giving amortized O(1) work per window.</p>
 *
 * @since 0.1.0
 */
final class NullRunFilter {
  private final DumpBuffer buffer;
  private final int windowLength;
  private final int nullRunLength;
  private final boolean active;
  private int nextByte;
  private int run;
  private int lastRunEnd = -1;
  private int lastOffset = -1;

  /**
   * Creates a filter for windows starting at or after {@code firstOffset}.
   *
   * @param buffer dump being scanned
   * @param windowLength width of each window in bytes
   * @param nullRunLength zero-run length that disqualifies a window
   * @param firstOffset offset of the first window this filter will see
   */
  NullRunFilter(DumpBuffer buffer, int windowLength, int nullRunLength, int firstOffset) {
    if (windowLength <= 0 || nullRunLength <= 0) {
      throw new IllegalArgumentException("windowLength and nullRunLength must be positive");
    }
    this.buffer = buffer;
    this.windowLength = windowLength;
    this.nullRunLength = nullRunLength;
    this.active = nullRunLength <= windowLength;
    this.nextByte = firstOffset;
  }

  /**
   * Tests whether the window starting at {@code offset} contains a disqualifying zero run.
   *
   * @param offset window start; must be greater than the previous offset passed to this filter
   * @return {@code true} when the window must be excluded
   */
  boolean excludes(int offset) {
    if (offset <= lastOffset) {
      throw new IllegalStateException("windows must be visited in increasing order");
    }
    lastOffset = offset;
    if (!active) {
      return false;
    }
    int windowEnd = offset + windowLength - 1;
    while (nextByte <= windowEnd) {
      if (buffer.byteAt(nextByte) == 0) {
        run++;
        if (run >= nullRunLength) {
          lastRunEnd = nextByte;
        }
      } else {
        run = 0;
      }
      nextByte++;
    }
    return lastRunEnd >= offset + nullRunLength - 1;
  }

  /**
   * Reference check that scans every sub-window of {@code window}.
   *
   * @param window window to inspect
   * @param nullRunLength zero-run length that disqualifies a window
   * @return {@code true} if some run of {@code nullRunLength} consecutive bytes is all zero
   */
  static boolean containsNullRun(Window window, int nullRunLength) {
    if (nullRunLength <= 0) {
      throw new IllegalArgumentException("nullRunLength must be positive");
    }
    int length = window.length();
    for (int start = 0; start + nullRunLength <= length; start++) {
      boolean allZero = true;
      for (int i = 0; i < nullRunLength; i++) {
        if (window.byteAt(start + i) != 0) {
          allZero = false;
          break;
        }
      }
      if (allZero) {
        return true;
      }
    }
    return false;
  }
}
