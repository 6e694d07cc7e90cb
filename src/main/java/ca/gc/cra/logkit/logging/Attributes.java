package ca.gc.cra.logkit.logging;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes variadic logging arguments into {@link Attribute} lists.
 *
 * <p>Arguments are consumed left to right: an {@link Attribute} is taken as-is, a {@link String} followed by
 * another argument forms a key/value pair, and anything else (including a trailing lone string) is recorded under
 * {@link #BAD_KEY}.</p>
 *
 * @since 0.1.0
 */
public final class Attributes {
  /** Key used for arguments that cannot be paired with a key. */
  public static final String BAD_KEY = "!BADKEY";

  private Attributes() {
    // Utility
  }

  /**
   * Converts raw arguments into attributes.
   *
   * @param args attribute arguments; {@code null} yields an empty list
   * @return immutable list of attributes in argument order
   */
  public static List<Attribute> normalize(Object... args) {
    if (args == null || args.length == 0) {
      return List.of();
    }
    List<Attribute> attributes = new ArrayList<>(args.length);
    int i = 0;
    while (i < args.length) {
      Object arg = args[i];
      if (arg instanceof Attribute attribute) {
        attributes.add(attribute);
        i++;
      } else if (arg instanceof String key && i + 1 < args.length) {
        attributes.add(new Attribute(key, args[i + 1]));
        i += 2;
      } else {
        attributes.add(new Attribute(BAD_KEY, arg));
        i++;
      }
    }
    return List.copyOf(attributes);
  }

  /**
   * Returns a new list holding {@code base} followed by {@code extra}.
   *
   * @param base existing attributes
   * @param extra attributes to append
   * @return immutable concatenation
   */
  static List<Attribute> concat(List<Attribute> base, List<Attribute> extra) {
    if (extra.isEmpty()) {
      return base;
    }
    List<Attribute> merged = new ArrayList<>(base.size() + extra.size());
    merged.addAll(base);
    merged.addAll(extra);
    return List.copyOf(merged);
  }
}
