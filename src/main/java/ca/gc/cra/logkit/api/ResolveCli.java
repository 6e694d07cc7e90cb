package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.config.LoggingConfig;
import ca.gc.cra.logkit.logging.LogLevel;
import ca.gc.cra.logkit.logging.LogSink;
import ca.gc.cra.logkit.logging.ModeResolver;
import ca.gc.cra.logkit.logging.StructuredLoggers;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code logkit resolve}: prints the effective mode, level, renderer and sink without opening the sink.
 *
 * @since 0.1.0
 */
final class ResolveCli {
  private static final Logger log = LoggerFactory.getLogger(ResolveCli.class);
  private static final String SUMMARY_USAGE =
      "usage: logkit resolve [mode=dev|prod] [output=<sink>] [config=<path>]";

  private ResolveCli() {}

  static ExitCode run(String[] args) {
    return run(args, System.getenv());
  }

  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      ConfigCliUtils.requireKnownKeys(kv, Set.of());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    LoggingConfig config;
    try {
      config = ConfigCliUtils.resolve(kv, environment, log::warn);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    LogLevel level = ModeResolver.resolveVerbosity(config.mode());
    CliPrinter.println(describe(config, level));
    return ExitCode.SUCCESS;
  }

  static String describe(LoggingConfig config, LogLevel level) {
    LogSink sink = LogSink.resolve(config.output());
    return "mode=" + config.mode().value()
        + " level=" + level
        + " renderer=" + (StructuredLoggers.usesPrettyRenderer(level) ? "pretty" : "json")
        + " output=" + config.output()
        + " sink=" + sink.kind();
  }
}
