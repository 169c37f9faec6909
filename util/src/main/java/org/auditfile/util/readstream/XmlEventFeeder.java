package org.auditfile.util.readstream;

import com.fasterxml.aalto.AsyncByteArrayFeeder;
import com.fasterxml.aalto.AsyncXMLInputFactory;
import com.fasterxml.aalto.AsyncXMLStreamReader;
import com.fasterxml.aalto.stax.InputFactoryImpl;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Non-blocking XML tokenizer based on <a href="https://github.com/FasterXML/aalto-xml">Aalto XML</a>.
 *
 * <p>The caller hands over byte ranges as they arrive and asks for events until
 * {@link #nextEvent()} reports that more input is needed. The array passed to
 * {@link #feed} is read in place, so it must not be overwritten before that point.
 */
public class XmlEventFeeder {
  private final AsyncXMLStreamReader<AsyncByteArrayFeeder> parser;
  private boolean ended;

  /**
   * Create feeder with external entities and DTD processing turned off.
   */
  public XmlEventFeeder() {
    AsyncXMLInputFactory factory = new InputFactoryImpl();
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    parser = factory.createAsyncForByteArray();
  }

  /**
   * Hand over the next bytes of the document.
   * @param bytes buffer holding the bytes
   * @param offset first byte
   * @param length number of bytes
   * @throws XmlFormatException when called after {@link #endOfInput()} or while earlier
   *     input is still unread
   */
  public void feed(byte[] bytes, int offset, int length) {
    try {
      parser.getInputFeeder().feedInput(bytes, offset, length);
    } catch (XMLStreamException e) {
      throw new XmlFormatException(e);
    }
  }

  /**
   * Signal that the document has no more bytes.
   */
  public void endOfInput() {
    ended = true;
    parser.getInputFeeder().endOfInput();
  }

  /**
   * Advance to the next complete event.
   * @return reader positioned at the event; null if more input is needed or, after
   *     {@link #endOfInput()}, the document is exhausted
   * @throws XmlFormatException for malformed XML or a document cut short
   */
  public XMLStreamReader nextEvent() {
    try {
      if (parser.hasNext() && parser.next() != AsyncXMLStreamReader.EVENT_INCOMPLETE) {
        return parser;
      }
      // Aalto reports an incomplete event rather than an error for truncated input
      if (ended && parser.getEventType() == AsyncXMLStreamReader.EVENT_INCOMPLETE) {
        throw new XMLStreamException("Incomplete input", parser.getLocation());
      }
      return null;
    } catch (XMLStreamException e) {
      throw new XmlFormatException(e);
    }
  }

  public boolean isEnded() {
    return ended;
  }
}
