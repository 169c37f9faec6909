package org.auditfile.ingest.integrity;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.auditfile.ingest.sink.EntityKind;
import org.auditfile.ingest.sink.Row;
import org.auditfile.ingest.sink.RowSink;
import org.auditfile.ingest.sink.SinkTarget;

/**
 * Post-run findings. None of them is an error; an empty list means nothing was found.
 */
public final class IntegrityFindings {
  private final List<String> missingAccounts;
  private final List<UnbalancedVoucher> unbalancedVouchers;
  private final List<ElementCount> unknownElements;
  private final List<RejectedRecord> rejectedRecords;

  IntegrityFindings(List<String> missingAccounts, List<UnbalancedVoucher> unbalancedVouchers,
      List<ElementCount> unknownElements, List<RejectedRecord> rejectedRecords) {
    this.missingAccounts = Collections.unmodifiableList(missingAccounts);
    this.unbalancedVouchers = Collections.unmodifiableList(unbalancedVouchers);
    this.unknownElements = Collections.unmodifiableList(unknownElements);
    this.rejectedRecords = Collections.unmodifiableList(rejectedRecords);
  }

  /**
   * Findings of a run that was not checked.
   * @return empty findings
   */
  public static IntegrityFindings none() {
    return new IntegrityFindings(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
        new ArrayList<>());
  }

  public List<String> getMissingAccounts() {
    return missingAccounts;
  }

  public List<UnbalancedVoucher> getUnbalancedVouchers() {
    return unbalancedVouchers;
  }

  public List<ElementCount> getUnknownElements() {
    return unknownElements;
  }

  public List<RejectedRecord> getRejectedRecords() {
    return rejectedRecords;
  }

  /**
   * Write the non-empty diagnostics tables.
   * @param target where to write
   * @return names of the tables written
   * @throws IOException on write failure
   */
  public List<String> writeTo(SinkTarget target) throws IOException {
    List<String> written = new ArrayList<>();
    if (!missingAccounts.isEmpty()) {
      try (RowSink sink = target.open(EntityKind.MISSING_ACCOUNT)) {
        for (String id : missingAccounts) {
          sink.write(new Row(EntityKind.MISSING_ACCOUNT).set("AccountID", id).values());
        }
      }
      written.add(EntityKind.MISSING_ACCOUNT.getTableName());
    }
    if (!unbalancedVouchers.isEmpty()) {
      try (RowSink sink = target.open(EntityKind.UNBALANCED_VOUCHER)) {
        for (UnbalancedVoucher v : unbalancedVouchers) {
          sink.write(new Row(EntityKind.UNBALANCED_VOUCHER)
              .set("VoucherID", v.getVoucherId())
              .set("VoucherNo", v.getVoucherNo())
              .set("JournalID", v.getJournalId())
              .set("DebitTotal", v.getDebitTotal().toPlainString())
              .set("CreditTotal", v.getCreditTotal().toPlainString())
              .set("Difference", v.getDifference().toPlainString())
              .values());
        }
      }
      written.add(EntityKind.UNBALANCED_VOUCHER.getTableName());
    }
    if (!unknownElements.isEmpty()) {
      try (RowSink sink = target.open(EntityKind.UNKNOWN_ELEMENT)) {
        for (ElementCount c : unknownElements) {
          sink.write(new Row(EntityKind.UNKNOWN_ELEMENT)
              .set("Section", c.getSection())
              .set("Tag", c.getTag())
              .set("Count", c.getCount())
              .values());
        }
      }
      written.add(EntityKind.UNKNOWN_ELEMENT.getTableName());
    }
    if (!rejectedRecords.isEmpty()) {
      try (RowSink sink = target.open(EntityKind.REJECTED_RECORD)) {
        for (RejectedRecord r : rejectedRecords) {
          sink.write(new Row(EntityKind.REJECTED_RECORD)
              .set("Entity", r.getEntity().getTableName())
              .set("VoucherID", r.getVoucherId())
              .set("RecordID", r.getRecordId())
              .set("Reason", r.getReason())
              .values());
        }
      }
      written.add(EntityKind.REJECTED_RECORD.getTableName());
    }
    return written;
  }

  /**
   * Return JSON representation of the finding counts.
   * @return json representation
   */
  public JsonObject toJson() {
    return new JsonObject()
        .put("missingAccounts", missingAccounts.size())
        .put("unbalancedVouchers", unbalancedVouchers.size())
        .put("unknownElements", unknownElements.size())
        .put("rejectedRecords", rejectedRecords.size());
  }
}
