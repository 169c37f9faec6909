package org.auditfile.ingest;

import org.auditfile.ingest.emit.RecordEmitter;

/**
 * Result of one streaming attempt: completed, cancelled, or failed with the reason.
 */
public final class IngestAttempt {
  private final RecordEmitter emitter;
  private final boolean cancelled;
  private final StreamingTraversalException failure;

  private IngestAttempt(RecordEmitter emitter, boolean cancelled,
      StreamingTraversalException failure) {
    this.emitter = emitter;
    this.cancelled = cancelled;
    this.failure = failure;
  }

  public static IngestAttempt completed(RecordEmitter emitter) {
    return new IngestAttempt(emitter, false, null);
  }

  public static IngestAttempt cancelled(RecordEmitter emitter) {
    return new IngestAttempt(emitter, true, null);
  }

  public static IngestAttempt failed(StreamingTraversalException failure) {
    return new IngestAttempt(null, false, failure);
  }

  public boolean isFailed() {
    return failure != null;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Why the attempt failed.
   * @return failure; null unless {@link #isFailed()}
   */
  public StreamingTraversalException getFailure() {
    return failure;
  }

  /**
   * Emitter holding the run's aggregates.
   * @return emitter; null if the attempt failed
   */
  public RecordEmitter getEmitter() {
    return emitter;
  }
}
