package org.auditfile.ingest.emit;

import java.math.BigDecimal;

/**
 * Open voucher: header fields and the running totals of its lines.
 */
public class VoucherAccumulator {
  /** Largest difference between debit and credit totals still considered balanced. */
  public static final BigDecimal TOLERANCE = new BigDecimal("0.005");

  final JournalAccumulator journal;
  String voucherId = "";
  String voucherNo = "";
  String journalId = "";
  String transactionDate = "";
  String postingDate = "";
  String period = "";
  String year = "";
  String sourceDocumentId = "";
  String currencyCode = "";
  String voucherType = "";
  String description = "";
  String modificationDate = "";
  String systemId = "";
  String batchId = "";
  boolean described;
  BigDecimal debit = BigDecimal.ZERO;
  BigDecimal credit = BigDecimal.ZERO;
  int lineCount;

  VoucherAccumulator(JournalAccumulator journal) {
    this.journal = journal;
  }

  void add(BigDecimal lineDebit, BigDecimal lineCredit) {
    debit = debit.add(lineDebit);
    credit = credit.add(lineCredit);
    lineCount++;
    if (journal != null) {
      journal.add(lineDebit, lineCredit);
    }
  }

  /**
   * Whether the totals balance.
   * @return true if |debit - credit| is within {@link #TOLERANCE}
   */
  public boolean isBalanced() {
    return debit.subtract(credit).abs().compareTo(TOLERANCE) <= 0;
  }

  public String getVoucherId() {
    return voucherId;
  }

  public boolean isDescribed() {
    return described;
  }

  public BigDecimal getDebit() {
    return debit;
  }

  public BigDecimal getCredit() {
    return credit;
  }

  public int getLineCount() {
    return lineCount;
  }
}
