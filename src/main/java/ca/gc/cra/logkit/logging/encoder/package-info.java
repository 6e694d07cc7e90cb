/**
 * Logback encoders rendering facade records as colorized terminal lines or JSON lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.logging.encoder;
