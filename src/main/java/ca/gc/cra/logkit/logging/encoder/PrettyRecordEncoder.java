package ca.gc.cra.logkit.logging.encoder;

import ca.gc.cra.logkit.logging.Attribute;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.EncoderBase;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.event.KeyValuePair;

/**
 * Logback encoder producing colorized single-line records for terminals, e.g.
 * {@code 3:04PM INF started port=8080}.
 *
 * <p>Group members are flattened to {@code group.key=value}. Values that are empty or contain spaces, quotes,
 * {@code '='} or control characters are quoted.</p>
 *
 * @since 0.1.0
 */
public final class PrettyRecordEncoder extends EncoderBase<ILoggingEvent> {
  static final String TIME_PATTERN = "h:mma";
  static final String ERROR_KEY = "error";

  private static final String FAINT = ANSIConstants.ESC_START + "2" + ANSIConstants.ESC_END;
  private static final String RESET = ANSIConstants.ESC_START + "0" + ANSIConstants.ESC_END;
  private static final String RED = ANSIConstants.ESC_START + ANSIConstants.RED_FG + ANSIConstants.ESC_END;
  private static final String GREEN = ANSIConstants.ESC_START + ANSIConstants.GREEN_FG + ANSIConstants.ESC_END;
  private static final String YELLOW = ANSIConstants.ESC_START + ANSIConstants.YELLOW_FG + ANSIConstants.ESC_END;
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern(TIME_PATTERN, Locale.US);

  private ZoneId zone = ZoneId.systemDefault();

  /**
   * Overrides the zone used for the timestamp.
   *
   * @param zone zone applied to event instants; defaults to the system zone
   */
  public void setZone(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public byte[] headerBytes() {
    return null;
  }

  @Override
  public byte[] encode(ILoggingEvent event) {
    StringBuilder line = new StringBuilder(128);
    line.append(FAINT).append(TIME_FORMAT.format(event.getInstant().atZone(zone))).append(RESET);
    line.append(' ').append(levelTag(event.getLevel()));
    String message = event.getFormattedMessage();
    if (message != null && !message.isEmpty()) {
      line.append(' ').append(message);
    }
    List<KeyValuePair> pairs = event.getKeyValuePairs();
    if (pairs != null) {
      for (KeyValuePair pair : pairs) {
        appendAttribute(line, "", pair.key, pair.value);
      }
    }
    line.append('\n');
    return line.toString().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public byte[] footerBytes() {
    return null;
  }

  private static String levelTag(Level level) {
    return switch (level.toInt()) {
      case Level.ERROR_INT -> RED + "ERR" + RESET;
      case Level.WARN_INT -> YELLOW + "WRN" + RESET;
      case Level.INFO_INT -> GREEN + "INF" + RESET;
      case Level.DEBUG_INT -> "DBG";
      default -> level.toString();
    };
  }

  private static void appendAttribute(StringBuilder line, String prefix, String key, Object value) {
    String name = key == null ? "" : key;
    if (value instanceof Attribute.Group group) {
      String nested = name.isBlank() ? prefix : prefix + name + '.';
      for (Attribute member : group.members()) {
        appendAttribute(line, nested, member.key(), member.value());
      }
      return;
    }
    line.append(' ').append(FAINT).append(prefix).append(name).append('=').append(RESET);
    String text = quoteIfNeeded(render(value));
    if (ERROR_KEY.equals(name)) {
      line.append(RED).append(text).append(RESET);
    } else {
      line.append(text);
    }
  }

  private static String render(Object value) {
    if (value == null) {
      return "<nil>";
    }
    if (value instanceof Throwable error) {
      return error.getMessage() != null ? error.getMessage() : error.toString();
    }
    return String.valueOf(value);
  }

  static String quoteIfNeeded(String value) {
    if (!needsQuoting(value)) {
      return value;
    }
    StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> quoted.append("\\\"");
        case '\\' -> quoted.append("\\\\");
        case '\n' -> quoted.append("\\n");
        case '\r' -> quoted.append("\\r");
        case '\t' -> quoted.append("\\t");
        default -> {
          if (Character.isISOControl(c)) {
            quoted.append(String.format("\\u%04x", (int) c));
          } else {
            quoted.append(c);
          }
        }
      }
    }
    return quoted.append('"').toString();
  }

  private static boolean needsQuoting(String value) {
    if (value.isEmpty()) {
      return true;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == ' ' || c == '=' || c == '"' || Character.isISOControl(c)) {
        return true;
      }
    }
    return false;
  }
}
