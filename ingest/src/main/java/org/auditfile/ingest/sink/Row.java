package org.auditfile.ingest.sink;

import java.util.Arrays;
import java.util.List;

/**
 * One row under construction. Columns not set are written as empty strings.
 */
public final class Row {
  private final EntityKind kind;
  private final String[] values;

  /**
   * Create empty row.
   * @param kind table the row belongs to
   */
  public Row(EntityKind kind) {
    this.kind = kind;
    this.values = new String[kind.getColumns().size()];
    Arrays.fill(values, "");
  }

  /**
   * Set a column.
   * @param column column name
   * @param value value; null is written as empty
   * @return this
   */
  public Row set(String column, Object value) {
    values[kind.columnIndex(column)] = value == null ? "" : value.toString();
    return this;
  }

  public String get(String column) {
    return values[kind.columnIndex(column)];
  }

  public EntityKind getKind() {
    return kind;
  }

  public List<String> values() {
    return Arrays.asList(values.clone());
  }
}
