package org.auditfile.ingest;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.List;
import org.auditfile.ingest.integrity.IntegrityFindings;
import org.auditfile.ingest.progress.ProgressSnapshot;
import org.auditfile.ingest.sink.EntityKind;

/**
 * What a run did: parser used, whether it was cancelled, the integrity findings and the
 * final progress.
 */
public final class RunOutcome {
  private final ParsePath path;
  private final boolean cancelled;
  private final boolean writeRaw;
  private final IntegrityFindings findings;
  private final ProgressSnapshot progress;
  private final List<String> tables;
  private final String streamingFailure;

  RunOutcome(ParsePath path, boolean cancelled, boolean writeRaw, IntegrityFindings findings,
      ProgressSnapshot progress, List<String> tables, String streamingFailure) {
    this.path = path;
    this.cancelled = cancelled;
    this.writeRaw = writeRaw;
    this.findings = findings;
    this.progress = progress;
    this.tables = Collections.unmodifiableList(tables);
    this.streamingFailure = streamingFailure;
  }

  public ParsePath getPath() {
    return path;
  }

  public boolean isStreamingUsed() {
    return path == ParsePath.STREAMING;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Findings of the integrity checks.
   * @return findings; empty when the run was cancelled
   */
  public IntegrityFindings getFindings() {
    return findings;
  }

  public ProgressSnapshot getProgress() {
    return progress;
  }

  /**
   * Tables written by the run, diagnostics included.
   * @return table names
   */
  public List<String> getTables() {
    return tables;
  }

  /**
   * Message of the streaming failure that led to the fallback.
   * @return message; null if streaming did not fail
   */
  public String getStreamingFailure() {
    return streamingFailure;
  }

  /**
   * Return JSON representation, used as the run summary.
   * @return json representation
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject()
        .put("parserPath", path.name())
        .put("engineVersion", IngestEngine.VERSION)
        .put("schemaVersion", EntityKind.SCHEMA_VERSION)
        .put("cancelled", cancelled)
        .put("writeRaw", writeRaw)
        .put("progress", progress.toJson())
        .put("tables", new JsonArray(tables))
        .put("findings", findings.toJson());
    if (streamingFailure != null) {
      json.put("streamingFailure", streamingFailure);
    }
    return json;
  }
}
