package ca.gc.cra.logkit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logkit.testutil.JsonRecords;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmitCliTest {
  @TempDir Path tempDir;

  private StringWriter printed;

  @BeforeEach
  void captureCliOutput() {
    printed = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(printed, true));
  }

  @AfterEach
  void restoreCliOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void emitsJsonRecordWithAttributesAndOperation() throws IOException {
    Path log = tempDir.resolve("emit.log");

    ExitCode exit = EmitCli.run(new String[] {
        "message=user synced", "output=" + log, "operation=sync", "attr.user=alice", "attr.batch=7"}, Map.of());

    assertEquals(ExitCode.SUCCESS, exit);
    Map<String, Object> record = single(log);
    assertEquals("INFO", record.get("level"));
    assertEquals("user synced", record.get("msg"));
    assertEquals("sync", record.get("operation"));
    assertEquals("alice", record.get("user"));
    assertEquals("7", record.get("batch"));
  }

  @Test
  void errorTextSwitchesToErrorLevel() throws IOException {
    Path log = tempDir.resolve("error.log");

    ExitCode exit = EmitCli.run(
        new String[] {"message=upload failed", "error=quota exceeded", "output=" + log}, Map.of());

    assertEquals(ExitCode.SUCCESS, exit);
    Map<String, Object> record = single(log);
    assertEquals("ERROR", record.get("level"));
    assertEquals("quota exceeded", record.get("error"));
  }

  @Test
  void errorLevelWithoutErrorTextRecordsNil() throws IOException {
    Path log = tempDir.resolve("nil.log");

    EmitCli.run(new String[] {"message=failed", "level=error", "output=" + log}, Map.of());

    assertEquals("nil", single(log).get("error"));
  }

  @Test
  void errorTextIsKeptBelowErrorLevel() throws IOException {
    Path log = tempDir.resolve("warn.log");

    ExitCode exit = EmitCli.run(
        new String[] {"message=m", "level=warn", "error=quota exceeded", "output=" + log}, Map.of());

    assertEquals(ExitCode.SUCCESS, exit);
    Map<String, Object> record = single(log);
    assertEquals("WARN", record.get("level"));
    assertEquals("quota exceeded", record.get("error"));
  }

  @Test
  void debugRecordIsDroppedInProduction() throws IOException {
    Path log = tempDir.resolve("debug.log");

    ExitCode exit = EmitCli.run(new String[] {"message=hidden", "level=debug", "output=" + log}, Map.of());

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("", Files.readString(log));
  }

  @Test
  void yamlAndEnvironmentSupplyConfiguration() throws IOException {
    Path log = tempDir.resolve("dev.log");
    Path yaml = tempDir.resolve("logkit.yaml");
    Files.writeString(yaml, "logging:\n  mode: dev\n  output: stderr\n");

    ExitCode exit = EmitCli.run(
        new String[] {"message=from yaml", "level=debug", "config=" + yaml},
        Map.of("LOGKIT_OUTPUT", log.toString()));

    assertEquals(ExitCode.SUCCESS, exit);
    String content = Files.readString(log);
    assertTrue(content.contains("DBG"));
    assertTrue(content.contains("from yaml"));
  }

  @Test
  void invalidArgumentsReturnInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, EmitCli.run(new String[] {"output=stdout"}, Map.of()));
    assertEquals(ExitCode.INVALID_ARGS, EmitCli.run(new String[] {"message=x", "colour=red"}, Map.of()));
    assertEquals(ExitCode.INVALID_ARGS, EmitCli.run(new String[] {"message=x", "level=trace"}, Map.of()));
    assertTrue(printed.toString().contains("usage: logkit emit"));
  }

  @Test
  void malformedYamlReturnsConfigError() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "- not\n- a mapping\n");

    ExitCode exit = EmitCli.run(new String[] {"message=x", "config=" + yaml}, Map.of());

    assertEquals(ExitCode.CONFIG_ERROR, exit);
  }

  @Test
  void unopenableOutputReturnsIoError() {
    String output = tempDir.resolve("missing").resolve("app.log").toString();

    ExitCode exit = EmitCli.run(new String[] {"message=x", "output=" + output}, Map.of());

    assertEquals(ExitCode.IO_ERROR, exit);
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, EmitCli.run(new String[] {"--help"}, Map.of()));
    assertTrue(printed.toString().contains("attr.<key>=<value>"));
  }

  private static Map<String, Object> single(Path log) throws IOException {
    List<Map<String, Object>> records = JsonRecords.parseLines(Files.readString(log));
    assertEquals(1, records.size());
    return records.get(0);
  }
}
