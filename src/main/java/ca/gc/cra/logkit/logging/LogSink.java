package ca.gc.cra.logkit.logging;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Destination a structured logger writes to: standard output, standard error or a file.
 * <p><strong>Role:</strong> Resolved once by {@link StructuredLoggers}; turns into the Logback appender that owns the
 * stream.</p>
 * <p><strong>Resources:</strong> a file sink is opened for append (created with {@code rwxr-xr-x} on POSIX file
 * systems) and stays open for the life of the process.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; appenders serialize writes internally.</p>
 *
 * @param kind sink category
 * @param location configured output value; the file path for {@link Kind#FILE}
 * @since 0.1.0
 */
public record LogSink(Kind kind, String location) {
  /** Output literal selecting standard output. */
  public static final String STDOUT = "stdout";
  /** Output literal selecting standard error. */
  public static final String STDERR = "stderr";

  private static final Set<PosixFilePermission> OWNER_PERMISSIVE = PosixFilePermissions.fromString("rwxr-xr-x");
  private static final Set<OpenOption> APPEND_OPTIONS =
      Set.of(StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);

  /** Sink categories. */
  public enum Kind {
    /** Process standard output. */
    STDOUT,
    /** Process standard error. */
    STDERR,
    /** File opened for append. */
    FILE
  }

  public LogSink {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(location, "location");
  }

  /**
   * Resolves an output setting. Does not touch the file system.
   *
   * @param output {@code "stdout"}, {@code "stderr"} or a file path
   * @return resolved sink
   */
  public static LogSink resolve(String output) {
    Objects.requireNonNull(output, "output");
    return switch (output) {
      case STDOUT -> new LogSink(Kind.STDOUT, output);
      case STDERR -> new LogSink(Kind.STDERR, output);
      default -> new LogSink(Kind.FILE, output);
    };
  }

  /**
   * Builds and starts the appender writing to this sink.
   *
   * @param context owning Logback context
   * @param encoder started encoder that renders records
   * @return started appender
   * @throws LogSinkException when a file sink cannot be opened
   */
  OutputStreamAppender<ILoggingEvent> createAppender(LoggerContext context, Encoder<ILoggingEvent> encoder) {
    OutputStreamAppender<ILoggingEvent> appender;
    if (kind == Kind.FILE) {
      appender = new OutputStreamAppender<>();
      appender.setContext(context);
      appender.setEncoder(encoder);
      appender.setOutputStream(openAppend(location));
    } else {
      ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
      console.setContext(context);
      console.setTarget(kind == Kind.STDOUT ? "System.out" : "System.err");
      console.setEncoder(encoder);
      appender = console;
    }
    appender.setName(kind.name());
    appender.start();
    return appender;
  }

  static OutputStream openAppend(String location) {
    try {
      Path path = Path.of(location);
      SeekableByteChannel channel = path.getFileSystem().supportedFileAttributeViews().contains("posix")
          ? Files.newByteChannel(path, APPEND_OPTIONS, ownerPermissive())
          : Files.newByteChannel(path, APPEND_OPTIONS);
      return Channels.newOutputStream(channel);
    } catch (IOException | InvalidPathException | UnsupportedOperationException ex) {
      throw new LogSinkException(location, ex);
    }
  }

  private static FileAttribute<Set<PosixFilePermission>> ownerPermissive() {
    return PosixFilePermissions.asFileAttribute(OWNER_PERMISSIVE);
  }
}
