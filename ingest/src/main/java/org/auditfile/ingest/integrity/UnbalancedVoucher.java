package org.auditfile.ingest.integrity;

import java.math.BigDecimal;

/**
 * A voucher whose line debits and credits differ by more than the tolerance.
 */
public final class UnbalancedVoucher {
  private final String voucherId;
  private final String voucherNo;
  private final String journalId;
  private final BigDecimal debitTotal;
  private final BigDecimal creditTotal;

  /**
   * Create finding.
   * @param voucherId voucher id
   * @param voucherNo voucher number
   * @param journalId journal id
   * @param debitTotal sum of line debits
   * @param creditTotal sum of line credits
   */
  public UnbalancedVoucher(String voucherId, String voucherNo, String journalId,
      BigDecimal debitTotal, BigDecimal creditTotal) {
    this.voucherId = voucherId;
    this.voucherNo = voucherNo;
    this.journalId = journalId;
    this.debitTotal = debitTotal;
    this.creditTotal = creditTotal;
  }

  public String getVoucherId() {
    return voucherId;
  }

  public String getVoucherNo() {
    return voucherNo;
  }

  public String getJournalId() {
    return journalId;
  }

  public BigDecimal getDebitTotal() {
    return debitTotal;
  }

  public BigDecimal getCreditTotal() {
    return creditTotal;
  }

  public BigDecimal getDifference() {
    return debitTotal.subtract(creditTotal);
  }
}
