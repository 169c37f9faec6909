package org.auditfile.ingest.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counts processed elements and, every interval, offers a snapshot to the listener and
 * checks for a stop request.
 */
public class ProgressChannel {
  private static final Logger log = LogManager.getLogger(ProgressChannel.class);

  private final IngestStats stats;
  private final ProgressListener listener;
  private final CancellationToken token;
  private final long interval;
  private long ticks;

  /**
   * Create channel.
   * @param stats counters of the run
   * @param listener listener; may be null
   * @param token stop flag; may be null
   * @param interval elements between ticks
   */
  public ProgressChannel(IngestStats stats, ProgressListener listener,
      CancellationToken token, long interval) {
    if (interval <= 0) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.stats = stats;
    this.listener = listener;
    this.token = token == null ? new CancellationToken() : token;
    this.interval = interval;
  }

  /**
   * Count one processed element.
   * @return true if the run should stop now
   */
  public boolean element() {
    if (stats.incrementEvents() % interval != 0) {
      return false;
    }
    ticks++;
    ProgressSnapshot snapshot = stats.snapshot();
    log.debug("Progress tick {}: {} events, {} events/s", ticks, snapshot.getEvents(),
        Math.round(snapshot.getEventsPerSecond()));
    if (listener != null) {
      boolean proceed;
      try {
        proceed = listener.onProgress(snapshot);
      } catch (RuntimeException e) {
        log.warn("Progress listener failed at tick {}: {}", ticks, e.getMessage(), e);
        proceed = true;
      }
      if (!proceed) {
        token.cancel();
      }
    }
    return token.isCancelled();
  }

  public long getTicks() {
    return ticks;
  }

  public CancellationToken getToken() {
    return token;
  }
}
