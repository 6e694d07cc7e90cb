package ca.gc.cra.logkit.api;

/**
 * <strong>What:</strong> Exit codes returned by the {@code logkit} command-line tool.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The log sink or configuration file could not be opened. */
  IO_ERROR(3),
  /** Configuration was malformed. */
  CONFIG_ERROR(4);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
