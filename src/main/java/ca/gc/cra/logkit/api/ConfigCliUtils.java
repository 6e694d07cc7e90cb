package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.config.ConfigMerger;
import ca.gc.cra.logkit.config.LoggingConfig;
import ca.gc.cra.logkit.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Resolves {@link LoggingConfig} for CLI commands from {@code config=}, the environment and remaining arguments.
 */
final class ConfigCliUtils {
  private static final Set<String> CONFIG_KEYS =
      Set.of("config", LoggingConfig.MODE_KEY, LoggingConfig.OUTPUT_KEY);

  private ConfigCliUtils() {}

  /**
   * Builds the effective logging configuration. Consumes the {@code config} key from {@code args}.
   *
   * @param args parsed CLI arguments; only {@code mode} and {@code output} should remain besides {@code config}
   * @param environment process environment
   * @param warn receives override warnings
   * @return effective configuration
   * @throws IOException when the YAML file exists but cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or the merged output is blank
   */
  static LoggingConfig resolve(
      Map<String, String> args, Map<String, String> environment, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml =
        configPath == null ? Optional.empty() : YamlConfigLoader.load(Path.of(configPath));
    if (configPath != null && yaml.isEmpty()) {
      warn.accept("Config file not found: " + configPath);
    }
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        yaml, environment, args, LoggingConfig.defaultsAsMap(), warn);
    return LoggingConfig.fromMap(merged);
  }

  /**
   * Rejects keys that neither configure logging nor appear in {@code commandKeys}.
   *
   * @param args parsed CLI arguments
   * @param commandKeys keys owned by the calling command
   * @throws IllegalArgumentException naming the first unknown key
   */
  static void requireKnownKeys(Map<String, String> args, Set<String> commandKeys) {
    for (String key : args.keySet()) {
      if (!CONFIG_KEYS.contains(key) && !commandKeys.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }
}
