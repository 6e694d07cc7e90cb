/**
 * <strong>Purpose:</strong> Logging configuration sources (defaults, YAML, environment, CLI) and their merge.
 * <p><strong>Concurrency:</strong> Stateless loaders and immutable records.
 * <p><strong>Observability:</strong> Override warnings are handed to the caller for logging.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.config;
