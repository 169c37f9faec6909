package org.auditfile.ingest.sink;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.util.List;

/**
 * Destination of one run's tables.
 */
public interface SinkTarget {

  /**
   * Open the table of a kind. The header row, if the format has one, is written at once.
   * @param kind table
   * @return sink private to the caller
   * @throws IOException on failure to create the table
   */
  RowSink open(EntityKind kind) throws IOException;

  /**
   * Remove every table written so far. Sinks must have been closed.
   * @throws IOException on failure to remove
   */
  void discard() throws IOException;

  /**
   * Store the run summary.
   * @param summary summary document
   * @throws IOException on write failure
   */
  void writeSummary(JsonObject summary) throws IOException;

  /**
   * Tables opened since creation or the last {@link #discard()}.
   * @return table names in opening order
   */
  List<String> tables();

  String describe();
}
