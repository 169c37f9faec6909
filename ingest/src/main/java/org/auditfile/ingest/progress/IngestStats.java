package org.auditfile.ingest.progress;

import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.auditfile.ingest.sink.EntityKind;

/**
 * Counters of one ingest run.
 */
public class IngestStats {
  private final String fileName;
  private final long started = System.nanoTime();
  private final AtomicLong events = new AtomicLong();
  private final AtomicLong peakRetainedNodes = new AtomicLong();
  private final Map<EntityKind, AtomicLong> rows = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong[]> phases = new ConcurrentHashMap<>();

  public String getFileName() {
    return fileName;
  }

  /**
   * Create new stats for a given source file.
   * @param fileName source file name
   */
  public IngestStats(String fileName) {
    if (fileName == null) {
      throw new IllegalArgumentException("fileName cannot be null");
    }
    this.fileName = fileName;
  }

  public long incrementEvents() {
    return events.incrementAndGet();
  }

  public long events() {
    return events.get();
  }

  public long incrementRows(EntityKind kind) {
    return rows.computeIfAbsent(kind, k -> new AtomicLong()).incrementAndGet();
  }

  public long rows(EntityKind kind) {
    AtomicLong n = rows.get(kind);
    return n == null ? 0 : n.get();
  }

  /**
   * Account time spent in a phase.
   * @param phase phase name
   * @param nanos time spent
   */
  public void addPhase(String phase, long nanos) {
    AtomicLong[] p = phases.computeIfAbsent(phase,
        k -> new AtomicLong[] {new AtomicLong(), new AtomicLong()});
    p[0].addAndGet(nanos);
    p[1].incrementAndGet();
  }

  /**
   * Record the number of retained nodes, keeping the maximum.
   * @param retained current count
   */
  public void retained(long retained) {
    peakRetainedNodes.accumulateAndGet(retained, Math::max);
  }

  public long peakRetainedNodes() {
    return peakRetainedNodes.get();
  }

  /**
   * Take a snapshot.
   * @return snapshot of the counters now
   */
  public ProgressSnapshot snapshot() {
    double elapsed = (System.nanoTime() - started) / 1e9;
    Map<String, Long> rowMap = new LinkedHashMap<>();
    for (EntityKind kind : EntityKind.values()) {
      AtomicLong n = rows.get(kind);
      if (n != null) {
        rowMap.put(kind.getTableName(), n.get());
      }
    }
    Map<String, ProgressSnapshot.PhaseTiming> phaseMap = new LinkedHashMap<>();
    phases.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> phaseMap.put(e.getKey(),
            new ProgressSnapshot.PhaseTiming(e.getValue()[0].get(), e.getValue()[1].get())));
    List<String> slowest = phaseMap.entrySet().stream()
        .sorted(Comparator.comparingLong(
            (Map.Entry<String, ProgressSnapshot.PhaseTiming> e) -> e.getValue().getNanos())
            .reversed())
        .limit(ProgressSnapshot.SLOWEST)
        .map(Map.Entry::getKey)
        .collect(Collectors.toCollection(ArrayList::new));
    return new ProgressSnapshot(elapsed, events.get(), rowMap, phaseMap, slowest,
        peakRetainedNodes.get());
  }

  /**
   * Return JSON representation.
   * @return json representation
   */
  public JsonObject toJson() {
    return snapshot().toJson().put("fileName", fileName);
  }
}
