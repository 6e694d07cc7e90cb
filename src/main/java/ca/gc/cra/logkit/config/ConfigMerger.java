package ca.gc.cra.logkit.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges logging settings from defaults, YAML, the process environment and CLI arguments.
 *
 * <p>Precedence is CLI &gt; environment &gt; YAML &gt; defaults. Environment variables are read through
 * {@link #ENVIRONMENT_KEYS}; other variables are ignored.</p>
 */
public final class ConfigMerger {
  /** Environment variable names mapped to configuration keys. */
  public static final Map<String, String> ENVIRONMENT_KEYS = Map.of(
      "LOGKIT_MODE", LoggingConfig.MODE_KEY,
      "LOGKIT_OUTPUT", LoggingConfig.OUTPUT_KEY);

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param yaml optional YAML-derived settings
   * @param environment process environment (typically {@link System#getenv()}); may be {@code null}
   * @param cli CLI key/value overrides; may be {@code null}
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged output is blank
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    merged.putAll(fromEnvironment(environment));

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  static Map<String, String> fromEnvironment(Map<String, String> environment) {
    if (environment == null || environment.isEmpty()) {
      return Map.of();
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<String, String> mapping : ENVIRONMENT_KEYS.entrySet()) {
      String value = environment.get(mapping.getKey());
      if (value != null && !value.isBlank()) {
        values.put(mapping.getValue(), value.trim());
      }
    }
    return values;
  }

  private static void validate(Map<String, String> effective) {
    String output = effective.get(LoggingConfig.OUTPUT_KEY);
    if (output != null && output.isBlank()) {
      throw new IllegalArgumentException(LoggingConfig.OUTPUT_KEY + " must not be blank");
    }
  }
}
