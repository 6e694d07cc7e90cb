package ca.gc.cra.logkit.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logkit.testutil.JsonRecords;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private static final Pattern KITCHEN_TIME = Pattern.compile("\\d{1,2}:\\d{2}(AM|PM)");

  @Test
  void developmentStdoutEmitsOneColorizedLine() {
    String out = captureStdout(() -> LoggingConfigurator.configure("dev", "stdout").info("started"));

    String[] lines = out.split("\n");
    assertEquals(1, lines.length);
    assertTrue(lines[0].contains("started"));
    assertTrue(lines[0].contains("\u001b["));
    assertTrue(KITCHEN_TIME.matcher(lines[0]).find(), lines[0]);
  }

  @Test
  void productionStdoutEmitsOneJsonRecord() {
    String out = captureStdout(() -> LoggingConfigurator.configure("prod", "stdout").info("started"));

    List<Map<String, Object>> records = JsonRecords.parseLines(out);
    assertEquals(1, records.size());
    assertEquals("INFO", records.get(0).get("level"));
    assertEquals("started", records.get(0).get("msg"));
  }

  @Test
  void unknownModeBehavesLikeProduction() {
    String out = captureStdout(() -> {
      StructuredLogger logger = LoggingConfigurator.configure("staging", "stdout");
      logger.debug("hidden");
      logger.info("shown");
    });

    List<Map<String, Object>> records = JsonRecords.parseLines(out);
    assertEquals(1, records.size());
    assertEquals("shown", records.get(0).get("msg"));
  }

  @Test
  void stderrOutputWritesToStandardError() {
    PrintStream original = System.err;
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
    try {
      LoggingConfigurator.configure(Mode.PRODUCTION, "stderr").warn("careful");
    } finally {
      System.setErr(original);
    }

    List<Map<String, Object>> records = JsonRecords.parseLines(captured.toString(StandardCharsets.UTF_8));
    assertEquals(1, records.size());
    assertEquals("WARN", records.get(0).get("level"));
  }

  @Test
  void configureLogsResolvedProfileAtDebug() {
    Logger logger = (Logger) LoggerFactory.getLogger(LoggingConfigurator.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setLevel(Level.DEBUG);
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      captureStdout(() -> LoggingConfigurator.configure("dev", "stdout"));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    assertEquals(1, appender.list.size());
    String message = appender.list.get(0).getFormattedMessage();
    assertTrue(message.contains("mode=dev"));
    assertTrue(message.contains("level=DEBUG"));
    assertTrue(message.contains("output=stdout"));
  }

  private static String captureStdout(Runnable action) {
    PrintStream original = System.out;
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    try {
      action.run();
    } finally {
      System.setOut(original);
    }
    return captured.toString(StandardCharsets.UTF_8);
  }
}
