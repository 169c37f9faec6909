package org.auditfile.util.readstream;

import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamException;

/**
 * The byte stream is not a well-formed XML document.
 */
public class XmlFormatException extends RuntimeException {
  private final int line;
  private final int column;

  /**
   * Wrap a parser error, keeping where it happened.
   * @param e error from the tokenizer
   */
  public XmlFormatException(XMLStreamException e) {
    super(e.getMessage(), e);
    Location location = e.getLocation();
    this.line = location == null ? -1 : location.getLineNumber();
    this.column = location == null ? -1 : location.getColumnNumber();
  }

  /**
   * Line of the error.
   * @return line number; -1 if unknown
   */
  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
