package org.auditfile.util.amount;

/**
 * How a line states its monetary amount. Chosen per line, in declaration order.
 */
public enum AmountEncoding {
  /** Separate debit and credit elements; amount = debit - credit. */
  DEBIT_CREDIT_PAIR,
  /** One magnitude plus a debit/credit indicator. */
  INDICATOR,
  /** One signed amount; negative is credit side. */
  SIGNED
}
