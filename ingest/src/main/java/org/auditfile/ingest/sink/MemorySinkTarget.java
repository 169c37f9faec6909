package org.auditfile.ingest.sink;

import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keeps tables in memory. Used by callers that consume rows directly, and by tests.
 */
public class MemorySinkTarget implements SinkTarget {
  private final Map<EntityKind, List<List<String>>> tables = new EnumMap<>(EntityKind.class);
  private final List<EntityKind> order = new ArrayList<>();
  private JsonObject summary;

  @Override
  public RowSink open(EntityKind kind) {
    List<List<String>> rows = new ArrayList<>();
    tables.put(kind, rows);
    order.add(kind);
    return new RowSink() {
      @Override
      public void write(List<String> values) {
        rows.add(Collections.unmodifiableList(new ArrayList<>(values)));
      }

      @Override
      public long count() {
        return rows.size();
      }

      @Override
      public void close() {
        // nothing to release
      }
    };
  }

  @Override
  public void discard() {
    tables.clear();
    order.clear();
    summary = null;
  }

  @Override
  public void writeSummary(JsonObject summary) {
    this.summary = summary;
  }

  /**
   * Rows of a table.
   * @param kind table
   * @return rows; null if the table was never opened
   */
  public List<List<String>> rows(EntityKind kind) {
    return tables.get(kind);
  }

  /**
   * Values of one column.
   * @param kind table
   * @param column column name
   * @return values in row order; empty if the table was never opened
   */
  public List<String> column(EntityKind kind, String column) {
    List<List<String>> rows = tables.get(kind);
    if (rows == null) {
      return Collections.emptyList();
    }
    int i = kind.columnIndex(column);
    return rows.stream().map(r -> r.get(i)).collect(Collectors.toList());
  }

  public boolean has(EntityKind kind) {
    return tables.containsKey(kind);
  }

  public JsonObject getSummary() {
    return summary;
  }

  @Override
  public List<String> tables() {
    return order.stream().map(EntityKind::getTableName).collect(Collectors.toList());
  }

  @Override
  public String describe() {
    return "memory";
  }
}
