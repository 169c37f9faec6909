package org.auditfile.ingest;

/**
 * Failure of the streaming parser. Never reaches the caller of
 * {@link IngestEngine#ingest}; it makes the engine switch to the fallback parser.
 */
public class StreamingTraversalException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public StreamingTraversalException(String message) {
    super(message);
  }

  public StreamingTraversalException(String message, Throwable cause) {
    super(message, cause);
  }
}
