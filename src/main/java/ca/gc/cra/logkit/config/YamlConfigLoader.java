package ca.gc.cra.logkit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the {@code logging} section of a YAML document as scalar key/value pairs. Other top-level sections are
 * ignored; nested mappings and lists inside {@code logging} are rejected.
 *
 * <pre>
 * logging:
 *   mode: dev
 *   output: /var/log/app.log
 * </pre>
 */
public final class YamlConfigLoader {
  /** Top-level section read by {@link #load(Path)}. */
  public static final String SECTION = "logging";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and returns the settings in its {@code logging} section.
   *
   * @param path location of the YAML configuration
   * @return empty when the file does not exist; otherwise the section's settings (empty when absent)
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping");
    }
    return Optional.of(readSection(root.get(sectionKey(root))));
  }

  private static Object sectionKey(Map<?, ?> root) {
    return root.keySet().stream()
        .filter(key -> key instanceof String name && name.trim().equalsIgnoreCase(SECTION))
        .findFirst()
        .orElse(null);
  }

  private static Map<String, String> readSection(Object section) {
    if (section == null) {
      return Map.of();
    }
    if (!(section instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException(SECTION + " section must be a mapping");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    entries.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(SECTION + " section contains a blank or non-string key");
      }
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(SECTION + "." + name + " must be a scalar value");
      }
      settings.put(name.trim(), value == null ? "" : value.toString());
    });
    return Map.copyOf(settings);
  }
}
