package org.auditfile.ingest.field;

/**
 * Record elements the traversal reacts to. Which tags map to which kind is vocabulary
 * data.
 */
public enum RecordKind {
  HEADER,
  ACCOUNT,
  TAX_TABLE_ENTRY,
  CUSTOMER,
  SUPPLIER,
  JOURNAL,
  TRANSACTION,
  LINE,
  ANALYSIS,
  INVOICE
}
