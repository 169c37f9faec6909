package org.auditfile.util.readstream;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import javax.xml.stream.XMLStreamReader;

/**
 * Blocking pull cursor over XML parse events.
 *
 * <p>Reads the input stream into one reusable chunk and feeds it to an
 * {@link XmlEventFeeder}. A new chunk is read only after the feeder has consumed the
 * previous one, so nothing but that chunk and the tokenizer state is held and documents
 * of any size can be walked in constant memory.
 */
public class XmlEventCursor {
  static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

  private final InputStream in;
  private final XmlEventFeeder feeder;
  private final byte[] chunk;
  private long bytesRead;

  public XmlEventCursor(InputStream in) {
    this(in, new XmlEventFeeder(), DEFAULT_CHUNK_SIZE);
  }

  /**
   * Create cursor.
   * @param in byte stream of the document
   * @param feeder tokenizer; not fed before
   * @param chunkSize number of bytes read and fed at a time
   */
  public XmlEventCursor(InputStream in, XmlEventFeeder feeder, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    this.in = in;
    this.feeder = feeder;
    this.chunk = new byte[chunkSize];
  }

  /**
   * Advance to the next parse event.
   * @return reader positioned at the event; null when the document is exhausted
   * @throws XmlFormatException for malformed or truncated XML
   * @throws UncheckedIOException when the underlying stream fails
   */
  public XMLStreamReader next() {
    while (true) {
      XMLStreamReader reader = feeder.nextEvent();
      if (reader != null) {
        return reader;
      }
      if (feeder.isEnded()) {
        return null;
      }
      int n;
      try {
        n = in.read(chunk);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      if (n == -1) {
        feeder.endOfInput();
      } else if (n > 0) {
        bytesRead += n;
        feeder.feed(chunk, 0, n);
      }
    }
  }

  public long getBytesRead() {
    return bytesRead;
  }
}
