/**
 * <strong>Purpose:</strong> Structured logging facade: mode resolution, sink selection and the leveled,
 * attribute-carrying {@link ca.gc.cra.logkit.logging.StructuredLogger} surface.
 * <p><strong>Concurrency:</strong> Loggers are immutable; derivations copy their attribute lists and Logback
 * appenders serialize writes.
 * <p><strong>Resources:</strong> A file sink stays open for the life of the process.
 * <p><strong>Observability:</strong> Backed by SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.logging;
