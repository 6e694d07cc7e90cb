package ca.gc.cra.logkit.api;

import ca.gc.cra.logkit.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code logkit} CLI. The first non-flag token names a {@link Command}; the remaining tokens are
 * handed to it unchanged. {@code --help} after a command is forwarded to that command.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: logkit <emit|resolve> [options]";

  /** Subcommands known to the dispatcher. */
  enum Command {
    EMIT("Write one structured record (emit --help for details)", EmitCli::run),
    RESOLVE("Print the effective mode, level, renderer and sink", ResolveCli::run);

    private final String summary;
    private final Function<String[], ExitCode> runner;

    Command(String summary, Function<String[], ExitCode> runner) {
      this.summary = summary;
      this.runner = runner;
    }

    String token() {
      return name().toLowerCase(Locale.ROOT);
    }

    static Command lookup(String token) {
      for (Command command : values()) {
        if (command.token().equals(token.toLowerCase(Locale.ROOT))) {
          return command;
        }
      }
      return null;
    }
  }

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the CLI without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code of the selected command, or {@link ExitCode#INVALID_ARGS} when none matches
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] tokens = input.keyValueArgs();
    if (tokens.length == 0 && input.help()) {
      CliPrinter.println(helpText());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose diagnostics enabled");
    }

    if (tokens.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Command command = Command.lookup(tokens[0]);
    if (command == null) {
      log.error("Unknown command: {}", tokens[0]);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] commandArgs = Arrays.copyOfRange(tokens, 1, tokens.length + (input.help() ? 1 : 0));
    if (input.help()) {
      commandArgs[commandArgs.length - 1] = "--help";
    }
    return command.runner.apply(commandArgs);
  }

  static String helpText() {
    StringBuilder help = new StringBuilder("Usage:\n  logkit <command> [options]\n\nCommands:\n");
    for (Command command : Command.values()) {
      help.append(String.format(Locale.ROOT, "  %-10s %s\n", command.token(), command.summary));
    }
    help.append("\nFlags:\n")
        .append("  --help     Show this message, or the command's options when given after a command\n")
        .append("  --verbose  Print DEBUG diagnostics on standard error");
    return help.toString();
  }
}
