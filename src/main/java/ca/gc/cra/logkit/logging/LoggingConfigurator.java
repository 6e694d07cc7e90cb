package ca.gc.cra.logkit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns operator-facing settings (mode and output) into a ready {@link StructuredLogger}.
 * <p><strong>Why:</strong> Callers configure a profile, not a level; this class applies
 * {@link ModeResolver} before delegating to {@link StructuredLoggers}.</p>
 * <p><strong>Role:</strong> Startup helper used by the CLI and by embedding applications.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Observability:</strong> Logs the resolved profile at DEBUG through the process-wide SLF4J backend.</p>
 *
 * @since 0.1.0
 * @see ModeResolver
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Parses {@code rawMode} and builds a logger for the resulting verbosity.
   *
   * @param rawMode mode text; anything other than {@code "dev"} means production
   * @param output {@code "stdout"}, {@code "stderr"} or a file path
   * @return configured logger
   * @throws LogSinkException when a file sink cannot be opened
   */
  public static StructuredLogger configure(String rawMode, String output) {
    return configure(ModeResolver.parseMode(rawMode), output);
  }

  /**
   * Builds a logger for an already-resolved mode.
   *
   * @param mode operating mode
   * @param output {@code "stdout"}, {@code "stderr"} or a file path
   * @return configured logger
   * @throws LogSinkException when a file sink cannot be opened
   */
  public static StructuredLogger configure(Mode mode, String output) {
    Objects.requireNonNull(output, "output");
    LogLevel level = ModeResolver.resolveVerbosity(mode);
    log.debug("Initialising structured logger mode={} level={} output={}", mode, level, output);
    return StructuredLoggers.initLogger(level, output);
  }

  /**
   * Elevates the process-wide root logger to DEBUG so the diagnostics of this library become visible. Loggers built
   * by {@link StructuredLoggers} are unaffected.
   *
   * <p><strong>Concurrency:</strong> Intended for single-threaded CLI startup.</p>
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
