package ca.gc.cra.logkit.logging;

import ch.qos.logback.classic.Logger;
import java.util.List;
import java.util.Objects;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * {@link StructuredLogger} backed by a Logback logger that owns a single appender.
 *
 * <p>Fixed attributes travel as SLF4J key/value pairs ahead of the per-call ones; derivations copy the fixed list and
 * share the underlying logger, so the floor, encoder and sink are common to a logger and everything derived from
 * it.</p>
 *
 * @since 0.1.0
 */
final class LogbackStructuredLogger implements StructuredLogger {
  static final String ERROR_KEY = "error";
  static final String OPERATION_KEY = "operation";
  static final String NIL = "nil";

  private final Logger logger;
  private final List<Attribute> attributes;

  LogbackStructuredLogger(Logger logger, List<Attribute> attributes) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.attributes = List.copyOf(attributes);
  }

  @Override
  public void debug(String message, Object... attributes) {
    emit(LogLevel.DEBUG, message, attributes, null);
  }

  @Override
  public void info(String message, Object... attributes) {
    emit(LogLevel.INFO, message, attributes, null);
  }

  @Override
  public void warn(String message, Object... attributes) {
    emit(LogLevel.WARN, message, attributes, null);
  }

  @Override
  public void error(String message, Throwable error, Object... attributes) {
    emit(LogLevel.ERROR, message, attributes, Attribute.string(ERROR_KEY, describe(error)));
  }

  @Override
  public <T extends Throwable> T logAndReturnError(String message, T error, Object... attributes) {
    error(message, error, attributes);
    return error;
  }

  @Override
  public StructuredLogger withOperation(String operation) {
    return new LogbackStructuredLogger(
        logger, Attributes.concat(attributes, List.of(Attribute.string(OPERATION_KEY, operation))));
  }

  @Override
  public StructuredLogger with(Object... attributes) {
    return new LogbackStructuredLogger(
        logger, Attributes.concat(this.attributes, Attributes.normalize(attributes)));
  }

  @Override
  public Attribute stringAttr(String key, String value) {
    return Attribute.string(key, value);
  }

  @Override
  public Attribute anyAttr(String key, Object value) {
    return Attribute.of(key, value);
  }

  List<Attribute> attributes() {
    return attributes;
  }

  Logger logger() {
    return logger;
  }

  private void emit(LogLevel level, String message, Object[] callArgs, Attribute trailing) {
    org.slf4j.event.Level slf4jLevel = level.toSlf4j();
    if (!logger.isEnabledForLevel(slf4jLevel)) {
      return;
    }
    LoggingEventBuilder builder = logger.atLevel(slf4jLevel);
    for (Attribute attribute : attributes) {
      builder.addKeyValue(attribute.key(), attribute.value());
    }
    for (Attribute attribute : Attributes.normalize(callArgs)) {
      builder.addKeyValue(attribute.key(), attribute.value());
    }
    if (trailing != null) {
      builder.addKeyValue(trailing.key(), trailing.value());
    }
    builder.log(message);
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return NIL;
    }
    String text = error.getMessage();
    return text != null ? text : error.toString();
  }
}
