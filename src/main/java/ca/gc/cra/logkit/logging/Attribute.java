package ca.gc.cra.logkit.logging;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable key/value pair attached to a structured log record.
 * <p><strong>Role:</strong> Value type passed to {@link StructuredLogger} emission and derivation calls and carried
 * through Logback as an SLF4J key/value pair.</p>
 * <p><strong>Thread-safety:</strong> Immutable when the wrapped value is immutable.</p>
 *
 * @param key attribute name; never {@code null}
 * @param value attribute value; may be {@code null}. A {@link Group} nests further attributes under {@code key}.
 * @since 0.1.0
 */
public record Attribute(String key, Object value) {

  public Attribute {
    Objects.requireNonNull(key, "key");
  }

  /**
   * Creates a string attribute.
   *
   * @param key attribute name
   * @param value string value; may be {@code null}
   * @return new attribute
   */
  public static Attribute string(String key, String value) {
    return new Attribute(key, value);
  }

  /**
   * Creates an attribute holding an arbitrary value.
   *
   * @param key attribute name
   * @param value any value; rendered according to its runtime type
   * @return new attribute
   */
  public static Attribute of(String key, Object value) {
    return new Attribute(key, value);
  }

  /**
   * Creates a group attribute nesting {@code members} under {@code key}.
   *
   * @param key group name; a blank name inlines the members into the enclosing record
   * @param members nested attributes
   * @return new group attribute
   */
  public static Attribute group(String key, Attribute... members) {
    return new Attribute(key, new Group(Arrays.asList(members)));
  }

  /**
   * Indicates whether this attribute nests other attributes.
   *
   * @return {@code true} when the value is a {@link Group}
   */
  public boolean isGroup() {
    return value instanceof Group;
  }

  /**
   * Ordered, immutable list of attributes nested under a group key.
   *
   * @param members nested attributes; copied on construction
   */
  public record Group(List<Attribute> members) {
    public Group {
      members = List.copyOf(members);
    }
  }
}
