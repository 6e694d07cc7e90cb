package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.config.LoggingConfig;
import ca.gc.cra.logkit.logging.Attribute;
import ca.gc.cra.logkit.logging.LogLevel;
import ca.gc.cra.logkit.logging.LogSinkException;
import ca.gc.cra.logkit.logging.LoggingConfigurator;
import ca.gc.cra.logkit.logging.StructuredLogger;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code logkit emit}: writes one record through a logger built from the effective configuration.
 *
 * @since 0.1.0
 */
final class EmitCli {
  private static final Logger log = LoggerFactory.getLogger(EmitCli.class);
  private static final String ATTRIBUTE_PREFIX = "attr.";
  private static final String ERROR_KEY = "error";
  private static final String SUMMARY_USAGE =
      "usage: logkit emit message=<text> [level=debug|info|warn|error] [mode=dev|prod] [output=<sink>]";
  private static final String HELP_TEXT = """
      Write a single structured record.

      Usage:
        logkit emit message=<text> [options]

      Options:
        message=<text>        Record message (required)
        level=<level>         debug|info|warn|error (default info, or error when error= is set)
        operation=<name>      Tag the record with operation=<name>
        error=<text>          Error message recorded under the "error" key at any level
        attr.<key>=<value>    Additional attribute (repeatable)
        mode=<dev|prod>       Operating mode (default prod; env LOGKIT_MODE)
        output=<sink>         stdout|stderr|<file path> (default stdout; env LOGKIT_OUTPUT)
        config=<path>         YAML file with a "logging" section
      """;

  private EmitCli() {}

  static ExitCode run(String[] args) {
    return run(args, System.getenv());
  }

  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> kv;
    EmitRequest request;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      request = EmitRequest.extract(kv);
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

    StructuredLogger logger;
    try {
      logger = LoggingConfigurator.configure(config.mode(), config.output());
    } catch (LogSinkException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }
    request.emit(logger);
    return ExitCode.SUCCESS;
  }

  /**
   * Record described by the command line.
   *
   * @param message record message
   * @param level emission severity
   * @param operation optional operation tag
   * @param error optional error text
   * @param attributes extra attributes in argument order
   */
  record EmitRequest(
      String message, LogLevel level, String operation, String error, List<Attribute> attributes) {

    /**
     * Removes the emit-specific keys from {@code kv} and builds a request.
     *
     * @param kv parsed arguments; mutated
     * @return request
     * @throws IllegalArgumentException when {@code message} is missing or {@code level} is unknown
     */
    static EmitRequest extract(Map<String, String> kv) {
      String message = kv.remove("message");
      if (message == null) {
        throw new IllegalArgumentException("message is required");
      }
      String error = kv.remove("error");
      String operation = kv.remove("operation");
      String rawLevel = kv.remove("level");
      LogLevel level = rawLevel == null
          ? (error != null ? LogLevel.ERROR : LogLevel.INFO)
          : parseLevel(rawLevel);

      List<Attribute> attributes = new ArrayList<>();
      Iterator<Map.Entry<String, String>> it = kv.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<String, String> entry = it.next();
        if (entry.getKey().startsWith(ATTRIBUTE_PREFIX)
            && entry.getKey().length() > ATTRIBUTE_PREFIX.length()) {
          attributes.add(Attribute.string(
              entry.getKey().substring(ATTRIBUTE_PREFIX.length()), entry.getValue()));
          it.remove();
        }
      }
      return new EmitRequest(message, level, operation, error, List.copyOf(attributes));
    }

    void emit(StructuredLogger logger) {
      StructuredLogger target = operation == null ? logger : logger.withOperation(operation);
      List<Attribute> recorded = new ArrayList<>(attributes);
      if (error != null && level != LogLevel.ERROR) {
        recorded.add(Attribute.string(ERROR_KEY, error));
      }
      Object[] args = recorded.toArray();
      switch (level) {
        case DEBUG -> target.debug(message, args);
        case INFO -> target.info(message, args);
        case WARN -> target.warn(message, args);
        case ERROR -> target.error(message, error == null ? null : new ReportedError(error), args);
      }
    }

    private static LogLevel parseLevel(String raw) {
      try {
        return LogLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("Unknown level: " + raw, ex);
      }
    }
  }

  /** Error supplied as text on the command line. */
  static final class ReportedError extends Exception {
    private static final long serialVersionUID = 1L;

    ReportedError(String message) {
      super(message, null, false, false);
    }
  }
}
