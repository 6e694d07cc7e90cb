package ca.gc.cra.logkit.logging;

import ch.qos.logback.classic.Level;

/**
 * Severity floors accepted by {@link StructuredLoggers#initLogger(LogLevel, String)}, ordered from most to least
 * verbose.
 *
 * @since 0.1.0
 */
public enum LogLevel {
  /** Everything, rendered for humans. */
  DEBUG(Level.DEBUG),
  /** Informational records and above. */
  INFO(Level.INFO),
  /** Warnings and errors only. */
  WARN(Level.WARN),
  /** Errors only. */
  ERROR(Level.ERROR);

  private final Level logbackLevel;

  LogLevel(Level logbackLevel) {
    this.logbackLevel = logbackLevel;
  }

  /**
   * Returns the Logback level used as the logger floor.
   *
   * @return matching Logback level
   */
  public Level toLogback() {
    return logbackLevel;
  }

  /**
   * Returns the SLF4J event level used when emitting at this severity.
   *
   * @return matching SLF4J level
   */
  public org.slf4j.event.Level toSlf4j() {
    return switch (this) {
      case DEBUG -> org.slf4j.event.Level.DEBUG;
      case INFO -> org.slf4j.event.Level.INFO;
      case WARN -> org.slf4j.event.Level.WARN;
      case ERROR -> org.slf4j.event.Level.ERROR;
    };
  }
}
