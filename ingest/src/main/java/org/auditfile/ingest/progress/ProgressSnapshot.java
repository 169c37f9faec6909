package org.auditfile.ingest.progress;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a run's progress.
 */
public final class ProgressSnapshot {
  /** Number of phases listed by {@link #getSlowestPhases()}. */
  public static final int SLOWEST = 6;

  private final double elapsedSeconds;
  private final long events;
  private final Map<String, Long> rows;
  private final Map<String, PhaseTiming> phases;
  private final List<String> slowestPhases;
  private final long peakRetainedNodes;

  ProgressSnapshot(double elapsedSeconds, long events, Map<String, Long> rows,
      Map<String, PhaseTiming> phases, List<String> slowestPhases, long peakRetainedNodes) {
    this.elapsedSeconds = elapsedSeconds;
    this.events = events;
    this.rows = Collections.unmodifiableMap(rows);
    this.phases = Collections.unmodifiableMap(phases);
    this.slowestPhases = Collections.unmodifiableList(slowestPhases);
    this.peakRetainedNodes = peakRetainedNodes;
  }

  public double getElapsedSeconds() {
    return elapsedSeconds;
  }

  public long getEvents() {
    return events;
  }

  /**
   * Throughput.
   * @return events per second; 0 before any time has passed
   */
  public double getEventsPerSecond() {
    return elapsedSeconds > 0 ? events / elapsedSeconds : 0;
  }

  /**
   * Rows written so far.
   * @return row count by table name
   */
  public Map<String, Long> getRows() {
    return rows;
  }

  public long getRows(String table) {
    return rows.getOrDefault(table, 0L);
  }

  public Map<String, PhaseTiming> getPhases() {
    return phases;
  }

  /**
   * Phases by cumulative time, slowest first.
   * @return at most {@link #SLOWEST} phase names
   */
  public List<String> getSlowestPhases() {
    return slowestPhases;
  }

  /**
   * Largest number of element nodes held in memory at once.
   * @return peak node count
   */
  public long getPeakRetainedNodes() {
    return peakRetainedNodes;
  }

  /**
   * Return JSON representation.
   * @return json representation
   */
  public JsonObject toJson() {
    JsonObject rowsJson = new JsonObject();
    rows.forEach(rowsJson::put);
    JsonObject phasesJson = new JsonObject();
    phases.forEach((name, timing) -> phasesJson.put(name, new JsonObject()
        .put("seconds", timing.getSeconds())
        .put("calls", timing.getCalls())));
    return new JsonObject()
        .put("elapsedSeconds", elapsedSeconds)
        .put("events", events)
        .put("eventsPerSecond", getEventsPerSecond())
        .put("rows", rowsJson)
        .put("phases", phasesJson)
        .put("slowestPhases", new JsonArray(slowestPhases))
        .put("peakRetainedNodes", peakRetainedNodes);
  }

  /** Cumulative time and invocation count of one phase. */
  public static final class PhaseTiming {
    private final long nanos;
    private final long calls;

    PhaseTiming(long nanos, long calls) {
      this.nanos = nanos;
      this.calls = calls;
    }

    public long getNanos() {
      return nanos;
    }

    public double getSeconds() {
      return nanos / 1e9;
    }

    public long getCalls() {
      return calls;
    }
  }
}
