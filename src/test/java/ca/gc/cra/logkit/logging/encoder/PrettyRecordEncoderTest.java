package ca.gc.cra.logkit.logging.encoder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logkit.logging.Attribute;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.KeyValuePair;

class PrettyRecordEncoderTest {
  private static final String ANSI = "\u001b\\[[0-9;]*m";

  private PrettyRecordEncoder encoder;

  @BeforeEach
  void setUp() {
    encoder = new PrettyRecordEncoder();
    encoder.setZone(ZoneOffset.UTC);
    encoder.start();
  }

  @Test
  void rendersKitchenTimeLevelMessageAndAttributes() {
    String line = encode(event(Level.INFO, "started", new KeyValuePair("port", 8080)));

    assertEquals("3:04PM INF started port=8080\n", strip(line));
    assertTrue(line.contains("\u001b[32mINF"));
  }

  @Test
  void usesShortLevelTags() {
    assertTrue(strip(encode(event(Level.DEBUG, "m"))).contains(" DBG m"));
    assertTrue(strip(encode(event(Level.WARN, "m"))).contains(" WRN m"));
    assertTrue(strip(encode(event(Level.ERROR, "m"))).contains(" ERR m"));
  }

  @Test
  void flattensGroupsWithDottedKeys() {
    Object group = Attribute.group("program_info",
        Attribute.string("java_version", "17"), Attribute.string("version", "unknown")).value();

    String line = strip(encode(event(Level.DEBUG, "boot", new KeyValuePair("program_info", group))));

    assertEquals("3:04PM DBG boot program_info.java_version=17 program_info.version=unknown\n", line);
  }

  @Test
  void highlightsErrorValues() {
    String line = encode(event(Level.ERROR, "failed", new KeyValuePair("error", "disk full")));

    assertTrue(line.contains("\u001b[31m\"disk full\""));
  }

  @Test
  void quotesValuesThatNeedIt() {
    assertEquals("plain", PrettyRecordEncoder.quoteIfNeeded("plain"));
    assertEquals("\"\"", PrettyRecordEncoder.quoteIfNeeded(""));
    assertEquals("\"two words\"", PrettyRecordEncoder.quoteIfNeeded("two words"));
    assertEquals("\"a=b\"", PrettyRecordEncoder.quoteIfNeeded("a=b"));
    assertEquals("\"say \\\"hi\\\"\"", PrettyRecordEncoder.quoteIfNeeded("say \"hi\""));
    assertEquals("\"line\\nbreak\"", PrettyRecordEncoder.quoteIfNeeded("line\nbreak"));
  }

  @Test
  void rendersNullValuesAsNil() {
    String line = strip(encode(event(Level.INFO, "m", new KeyValuePair("user", null))));

    assertTrue(line.endsWith(" user=<nil>\n"));
  }

  private String encode(LoggingEvent event) {
    return new String(encoder.encode(event), StandardCharsets.UTF_8);
  }

  private static String strip(String line) {
    return line.replaceAll(ANSI, "");
  }

  private static LoggingEvent event(Level level, String message, KeyValuePair... pairs) {
    LoggingEvent event = new LoggingEvent();
    event.setLoggerName("test");
    event.setLevel(level);
    event.setMessage(message);
    event.setInstant(Instant.parse("2024-01-01T15:04:05Z"));
    if (pairs.length > 0) {
      event.setKeyValuePairs(new ArrayList<>(List.of(pairs)));
    }
    return event;
  }
}
