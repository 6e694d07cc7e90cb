package ca.gc.cra.logkit.config;

import ca.gc.cra.logkit.logging.LogSink;
import ca.gc.cra.logkit.logging.Mode;
import ca.gc.cra.logkit.logging.ModeResolver;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable logging settings: operating mode and output destination.
 * <p><strong>Role:</strong> Configuration record built from merged key/value maps and consumed by
 * {@link ca.gc.cra.logkit.logging.LoggingConfigurator}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 *
 * @param mode operating mode
 * @param output {@code "stdout"}, {@code "stderr"} or a file path
 * @since 0.1.0
 */
public record LoggingConfig(Mode mode, String output) {
  /** Key holding the mode literal. */
  public static final String MODE_KEY = "mode";
  /** Key holding the output destination. */
  public static final String OUTPUT_KEY = "output";

  public LoggingConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(output, "output");
  }

  /**
   * Returns production logging to standard output.
   *
   * @return default configuration
   */
  public static LoggingConfig defaults() {
    return new LoggingConfig(Mode.PRODUCTION, LogSink.STDOUT);
  }

  /**
   * Returns the defaults as a flat map suitable for {@link ConfigMerger}.
   *
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> defaultsAsMap() {
    LoggingConfig defaults = defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(MODE_KEY, defaults.mode().value());
    map.put(OUTPUT_KEY, defaults.output());
    return Map.copyOf(map);
  }

  /**
   * Builds a configuration from a flat map. Unknown modes resolve to production; a missing or blank output falls
   * back to standard output.
   *
   * @param map configuration values; {@code null} yields the defaults
   * @return configuration record
   */
  public static LoggingConfig fromMap(Map<String, String> map) {
    if (map == null) {
      return defaults();
    }
    Mode mode = ModeResolver.parseMode(map.get(MODE_KEY));
    String output = map.get(OUTPUT_KEY);
    if (output == null || output.isBlank()) {
      output = defaults().output();
    }
    return new LoggingConfig(mode, output.trim());
  }
}
