package org.auditfile.util.source;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Readable byte stream of an audit file plus the container it came from.
 *
 * <p>{@link #close()} is idempotent and always releases the container, even when the
 * stream has been only partially consumed.
 */
public class SourceHandle implements Closeable {

  /** Container kinds recognized by {@link SourceReader}. */
  public enum Format {
    XML, ZIP, GZIP
  }

  private final InputStream stream;
  private final Closeable container;
  private final Format format;
  private final String description;
  private boolean closed;

  SourceHandle(InputStream stream, Closeable container, Format format, String description) {
    this.stream = stream;
    this.container = container;
    this.format = format;
    this.description = description;
  }

  public InputStream stream() {
    return stream;
  }

  public Format getFormat() {
    return format;
  }

  /**
   * Human readable origin, such as the archive member name.
   * @return description
   */
  public String getDescription() {
    return description;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      try {
        stream.close();
      } finally {
        if (container != null) {
          container.close();
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
