package org.auditfile.ingest.stream;

import org.auditfile.ingest.StreamingTraversalException;
import org.auditfile.ingest.field.RecordKind;

/**
 * Where the streaming walk is. Every state but {@link #IDLE} captures the elements below
 * it as payload of the record being read.
 */
public enum TraversalState {
  IDLE,
  IN_HEADER,
  IN_ACCOUNT,
  IN_TAX_TABLE,
  IN_PARTY,
  IN_JOURNAL,
  IN_VOUCHER,
  IN_LINE,
  IN_ANALYSIS,
  IN_INVOICE;

  public boolean isCapturing() {
    return this != IDLE;
  }

  /**
   * State inside an element that opens while in this state.
   * @param kind record kind of the element; null if it is not a record element
   * @param tag local name, for messages
   * @return new state
   * @throws StreamingTraversalException when the nesting breaks the voucher/line structure
   */
  public TraversalState enter(RecordKind kind, String tag) {
    if (kind == null) {
      return this;
    }
    switch (this) {
      case IDLE:
        switch (kind) {
          case HEADER:
            return IN_HEADER;
          case ACCOUNT:
            return IN_ACCOUNT;
          case TAX_TABLE_ENTRY:
            return IN_TAX_TABLE;
          case CUSTOMER:
          case SUPPLIER:
            return IN_PARTY;
          case JOURNAL:
            return IN_JOURNAL;
          case TRANSACTION:
            return IN_VOUCHER;
          case INVOICE:
            return IN_INVOICE;
          case LINE:
            throw new StreamingTraversalException("<" + tag + "> outside of a transaction");
          default:
            return IDLE;
        }
      case IN_JOURNAL:
        switch (kind) {
          case TRANSACTION:
            return IN_VOUCHER;
          case JOURNAL:
            throw new StreamingTraversalException("<" + tag + "> nested in a journal");
          case LINE:
            throw new StreamingTraversalException("<" + tag + "> outside of a transaction");
          default:
            return this;
        }
      case IN_VOUCHER:
        switch (kind) {
          case LINE:
            return IN_LINE;
          case TRANSACTION:
            throw new StreamingTraversalException("<" + tag + "> nested in a transaction");
          default:
            return this;
        }
      case IN_LINE:
      case IN_ANALYSIS:
        switch (kind) {
          case ANALYSIS:
            return IN_ANALYSIS;
          case LINE:
          case TRANSACTION:
            throw new StreamingTraversalException("<" + tag + "> nested in a line");
          default:
            return this;
        }
      default:
        return this;
    }
  }
}
