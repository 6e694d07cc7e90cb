package ca.gc.cra.logkit.logging;

import ca.gc.cra.logkit.logging.encoder.JsonRecordEncoder;
import ca.gc.cra.logkit.logging.encoder.PrettyRecordEncoder;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.LogbackMDCAdapter;
import ch.qos.logback.core.encoder.Encoder;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Builds {@link StructuredLogger} instances from a verbosity level and an output setting.
 * <p><strong>Why:</strong> Logging must be available before any other subsystem starts, so construction is a single
 * call with no external configuration files.</p>
 * <p><strong>Role:</strong> Composition point between the facade and Logback. Each call owns a private
 * {@link LoggerContext} holding one logger and one appender, so several loggers in the same JVM never share floors or
 * sinks and the process-wide {@code logback.xml} does not affect them.</p>
 * <p><strong>Renderer selection:</strong>
 * <ul>
 *   <li>{@link LogLevel#DEBUG} (and {@code null}): {@link PrettyRecordEncoder}, floor DEBUG.</li>
 *   <li>{@link LogLevel#INFO}, {@link LogLevel#WARN}, {@link LogLevel#ERROR}: {@link JsonRecordEncoder}, floor equal to
 *       the level.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to call concurrently; each call builds independent state.</p>
 *
 * @since 0.1.0
 * @see LogSink
 */
public final class StructuredLoggers {
  static final String LOGGER_NAME = "logkit";

  private static final AtomicInteger CONTEXT_IDS = new AtomicInteger();

  private StructuredLoggers() {
    // Utility
  }

  /**
   * Creates a logger writing to {@code output} with the renderer and floor implied by {@code level}.
   *
   * @param level verbosity floor; {@code null} selects the pretty renderer at DEBUG
   * @param output {@code "stdout"}, {@code "stderr"} or a file path opened for append
   * @return logger carrying the permanent {@code program_info} group
   * @throws LogSinkException when the file cannot be opened
   * @throws NullPointerException if {@code output} is {@code null}
   */
  public static StructuredLogger initLogger(LogLevel level, String output) {
    return initLogger(level, output, ProgramInfo.detect());
  }

  static StructuredLogger initLogger(LogLevel level, String output, ProgramInfo programInfo) {
    LogSink sink = LogSink.resolve(output);

    LoggerContext context = new LoggerContext();
    context.setName(LOGGER_NAME + "-" + CONTEXT_IDS.incrementAndGet());
    // Appenders copy the MDC on every event; without an adapter each append fails.
    context.setMDCAdapter(new LogbackMDCAdapter());
    context.start();

    Logger logger = context.getLogger(LOGGER_NAME);
    logger.setAdditive(false);
    logger.setLevel(floor(level));
    try {
      logger.addAppender(sink.createAppender(context, encoderFor(level, context)));
    } catch (LogSinkException ex) {
      context.stop();
      throw ex;
    }

    return new LogbackStructuredLogger(logger, List.of(programInfo.toAttribute()));
  }

  /**
   * Indicates whether {@code level} renders through the human-oriented encoder.
   *
   * @param level verbosity floor; may be {@code null}
   * @return {@code true} for DEBUG and {@code null}
   */
  public static boolean usesPrettyRenderer(LogLevel level) {
    return level == null || level == LogLevel.DEBUG;
  }

  private static Level floor(LogLevel level) {
    return level == null ? Level.DEBUG : level.toLogback();
  }

  private static Encoder<ILoggingEvent> encoderFor(LogLevel level, LoggerContext context) {
    Encoder<ILoggingEvent> encoder =
        usesPrettyRenderer(level) ? new PrettyRecordEncoder() : new JsonRecordEncoder();
    encoder.setContext(context);
    encoder.start();
    return encoder;
  }
}
