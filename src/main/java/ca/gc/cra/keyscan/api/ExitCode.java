package ca.gc.cra.keyscan.api;

/**
 * <strong>What:</strong> Process exit codes returned by the keyscan command-line tools.
 * <p><strong>Why:</strong> Lets scripts tell a bad invocation apart from an unreadable dump or a scan that could
 * not start.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or YAML configuration were invalid. */
  INVALID_ARGS(2),
  /** The dump or the configuration file could not be read, or results could not be written. */
  IO_ERROR(3),
  /** Wiring rejected the configuration after it had been parsed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The scan could not proceed: no window fits the dump, or the prime ceiling was exceeded. */
  PRECONDITION_FAILED(6),
  /** The run was cancelled (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
