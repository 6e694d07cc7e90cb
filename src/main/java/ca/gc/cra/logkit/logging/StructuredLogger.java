package ca.gc.cra.logkit.logging;

/**
 * <strong>What:</strong> Leveled, attribute-carrying logging surface handed to application components.
 * <p><strong>Why:</strong> Components depend on this small interface instead of the logging backend, so the
 * renderer, sink and floor are decided once at startup.</p>
 * <p><strong>Role:</strong> Port implemented by {@link LogbackStructuredLogger}; obtained from
 * {@link StructuredLoggers#initLogger(LogLevel, String)}.</p>
 * <p><strong>Attribute arguments:</strong> each {@code attributes} array accepts {@link Attribute} values and/or
 * alternating {@code String} keys and values; see {@link Attributes#normalize(Object...)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable; emission and derivation may be called from any
 * thread without coordination.</p>
 *
 * @since 0.1.0
 */
public interface StructuredLogger {

  /**
   * Emits a record at debug severity.
   *
   * @param message record message
   * @param attributes per-call attributes
   */
  void debug(String message, Object... attributes);

  /**
   * Emits a record at info severity.
   *
   * @param message record message
   * @param attributes per-call attributes
   */
  void info(String message, Object... attributes);

  /**
   * Emits a record at warn severity.
   *
   * @param message record message
   * @param attributes per-call attributes
   */
  void warn(String message, Object... attributes);

  /**
   * Emits a record at error severity with a trailing {@code error} attribute.
   *
   * @param message record message
   * @param error failure being reported; {@code null} is recorded as {@code "nil"}
   * @param attributes per-call attributes
   */
  void error(String message, Throwable error, Object... attributes);

  /**
   * Emits exactly as {@link #error(String, Throwable, Object...)} and hands the error back to the caller.
   *
   * @param message record message
   * @param error failure being reported; may be {@code null}
   * @param attributes per-call attributes
   * @param <T> throwable type
   * @return {@code error}, unchanged
   */
  <T extends Throwable> T logAndReturnError(String message, T error, Object... attributes);

  /**
   * Returns a logger that tags every record with {@code operation=<name>}.
   *
   * @param operation logical operation name
   * @return new logger; this instance is unchanged
   */
  StructuredLogger withOperation(String operation);

  /**
   * Returns a logger that adds {@code attributes} to every record.
   *
   * @param attributes attributes to attach permanently
   * @return new logger; this instance is unchanged
   */
  StructuredLogger with(Object... attributes);

  /**
   * Builds a string attribute.
   *
   * @param key attribute name
   * @param value attribute value
   * @return attribute suitable for the emission calls
   */
  Attribute stringAttr(String key, String value);

  /**
   * Builds an attribute holding any value.
   *
   * @param key attribute name
   * @param value attribute value
   * @return attribute suitable for the emission calls
   */
  Attribute anyAttr(String key, Object value);
}
