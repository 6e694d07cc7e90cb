package ca.gc.cra.logkit.logging;

/**
 * Raised when the log file sink cannot be opened. Logging is expected to exist before anything else starts, so
 * callers treat this as fatal.
 *
 * @since 0.1.0
 */
public final class LogSinkException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String location;

  /**
   * Creates a new exception naming the path and the underlying cause.
   *
   * @param location file path that could not be opened, as configured
   * @param cause underlying failure
   */
  public LogSinkException(String location, Throwable cause) {
    super("error opening log file " + location + ": " + cause, cause);
    this.location = location;
  }

  /**
   * Returns the configured path that could not be opened.
   *
   * @return sink location
   */
  public String location() {
    return location;
  }
}
