/**
 * Command-line front end: the {@code logkit} dispatcher with its {@code emit} and {@code resolve} commands.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, merges configuration and builds structured loggers.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 * <p><strong>Observability:</strong> Diagnostics go to stderr through the process-wide Logback configuration; command
 * output goes to stdout through {@link ca.gc.cra.logkit.api.CliPrinter}.</p>
 */
package ca.gc.cra.logkit.api;
