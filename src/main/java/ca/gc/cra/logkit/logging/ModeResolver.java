package ca.gc.cra.logkit.logging;

/**
 * <strong>What:</strong> Maps configuration text to a {@link Mode} and a mode to its {@link LogLevel}.
 * <p><strong>Why:</strong> Keeps the permissive mode policy in one place: unrecognised input yields production
 * behaviour instead of a startup failure.</p>
 * <p><strong>Role:</strong> Configuration helper used by {@link LoggingConfigurator} and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ModeResolver {

  private ModeResolver() {
    // Utility
  }

  /**
   * Parses a raw mode string.
   *
   * @param raw configuration value; matched exactly against {@code "dev"} and {@code "prod"}
   * @return {@link Mode#DEVELOPMENT} for {@code "dev"}; {@link Mode#PRODUCTION} for everything else,
   *     including {@code null} and empty input
   */
  public static Mode parseMode(String raw) {
    if (Mode.DEVELOPMENT.value().equals(raw)) {
      return Mode.DEVELOPMENT;
    }
    // "prod" and unrecognised input share the same answer.
    return Mode.PRODUCTION;
  }

  /**
   * Returns the verbosity floor for a mode.
   *
   * @param mode resolved mode; {@code null} is treated as production
   * @return {@link LogLevel#DEBUG} for development, {@link LogLevel#INFO} otherwise
   */
  public static LogLevel resolveVerbosity(Mode mode) {
    if (mode == null) {
      return LogLevel.INFO;
    }
    return switch (mode) {
      case DEVELOPMENT -> LogLevel.DEBUG;
      case PRODUCTION -> LogLevel.INFO;
    };
  }
}
