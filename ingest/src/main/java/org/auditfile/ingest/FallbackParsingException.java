package org.auditfile.ingest;

/**
 * Failure of the fallback parser, after the streaming parser has failed too.
 */
public class FallbackParsingException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public FallbackParsingException(String message, Throwable cause) {
    super(message, cause);
  }
}
