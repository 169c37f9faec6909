package org.auditfile.ingest.emit;

import java.math.BigDecimal;

/**
 * Open journal: its identity and the running line totals of the vouchers it holds.
 */
public class JournalAccumulator {
  String journalId = "";
  String description = "";
  String type = "";
  boolean described;
  BigDecimal debit = BigDecimal.ZERO;
  BigDecimal credit = BigDecimal.ZERO;

  void add(BigDecimal lineDebit, BigDecimal lineCredit) {
    debit = debit.add(lineDebit);
    credit = credit.add(lineCredit);
  }

  public String getJournalId() {
    return journalId;
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
}
