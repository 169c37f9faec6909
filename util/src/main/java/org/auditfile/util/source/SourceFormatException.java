package org.auditfile.util.source;

/**
 * Source cannot be opened as an audit file: missing, unreadable or an archive
 * without an XML member.
 */
public class SourceFormatException extends RuntimeException {

  public SourceFormatException(String msg) {
    super(msg);
  }

  public SourceFormatException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
