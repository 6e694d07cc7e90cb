package ca.gc.cra.logkit.logging.encoder;

import ca.gc.cra.logkit.logging.Attribute;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.EncoderBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.event.KeyValuePair;

/**
 * <strong>What:</strong> Logback encoder that renders each event as one JSON object per line.
 * <p><strong>Record shape:</strong> {@code time}, {@code level}, {@code msg}, then every SLF4J key/value pair as a
 * top-level field in emission order. {@link Attribute.Group} values become nested objects; empty groups are
 * dropped and groups with a blank key are inlined. Only collections and arrays become JSON arrays; other
 * iterables such as {@link java.nio.file.Path} are written with {@code toString()}.</p>
 * <p><strong>Thread-safety:</strong> {@link #encode(ILoggingEvent)} keeps no shared mutable state and may be called
 * concurrently; appenders serialize the resulting writes.</p>
 *
 * @since 0.1.0
 */
public final class JsonRecordEncoder extends EncoderBase<ILoggingEvent> {
  static final String TIME_FIELD = "time";
  static final String LEVEL_FIELD = "level";
  static final String MESSAGE_FIELD = "msg";

  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");
  private static final byte[] EMPTY = new byte[0];

  private final JsonFactory factory = new JsonFactory();
  private ZoneId zone = ZoneId.systemDefault();

  /**
   * Overrides the zone used for the {@code time} field.
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
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField(TIME_FIELD, TIME_FORMAT.format(event.getInstant().atZone(zone)));
      gen.writeStringField(LEVEL_FIELD, event.getLevel().toString());
      gen.writeStringField(MESSAGE_FIELD, event.getFormattedMessage());
      List<KeyValuePair> pairs = event.getKeyValuePairs();
      if (pairs != null) {
        for (KeyValuePair pair : pairs) {
          writeAttribute(gen, pair.key, pair.value);
        }
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      addError("Failed to encode log record as JSON", ex);
      return EMPTY;
    }
    out.write('\n');
    return out.toByteArray();
  }

  @Override
  public byte[] footerBytes() {
    return null;
  }

  private void writeAttribute(JsonGenerator gen, String key, Object value) throws IOException {
    if (value instanceof Attribute.Group group) {
      if (group.members().isEmpty()) {
        return;
      }
      boolean inline = key == null || key.isBlank();
      if (!inline) {
        gen.writeObjectFieldStart(key);
      }
      for (Attribute member : group.members()) {
        writeAttribute(gen, member.key(), member.value());
      }
      if (!inline) {
        gen.writeEndObject();
      }
      return;
    }
    gen.writeFieldName(String.valueOf(key));
    writeValue(gen, value);
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof CharSequence text) {
      gen.writeString(text.toString());
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      gen.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (value instanceof Throwable error) {
      gen.writeString(error.getMessage() != null ? error.getMessage() : error.toString());
    } else if (value instanceof Attribute attribute) {
      gen.writeStartObject();
      writeAttribute(gen, attribute.key(), attribute.value());
      gen.writeEndObject();
    } else if (value instanceof Attribute.Group group) {
      gen.writeStartObject();
      for (Attribute member : group.members()) {
        writeAttribute(gen, member.key(), member.value());
      }
      gen.writeEndObject();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(String.valueOf(value));
    }
  }
}
