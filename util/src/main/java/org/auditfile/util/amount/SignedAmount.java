package org.auditfile.util.amount;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Debit, credit and signed amount of one line, derived from whichever encoding the
 * line uses.
 */
public final class SignedAmount {
  private final BigDecimal debit;
  private final BigDecimal credit;
  private final BigDecimal amount;
  private final AmountEncoding encoding;

  private SignedAmount(BigDecimal debit, BigDecimal credit, BigDecimal amount,
      AmountEncoding encoding) {
    this.debit = debit;
    this.credit = credit;
    this.amount = amount;
    this.encoding = encoding;
  }

  /**
   * Amount from a debit/credit pair. A missing side counts as zero.
   * @param debit debit side or null
   * @param credit credit side or null
   * @return signed amount
   */
  public static SignedAmount fromPair(BigDecimal debit, BigDecimal credit) {
    BigDecimal d = debit == null ? BigDecimal.ZERO : debit;
    BigDecimal c = credit == null ? BigDecimal.ZERO : credit;
    return new SignedAmount(d, c, d.subtract(c), AmountEncoding.DEBIT_CREDIT_PAIR);
  }

  /**
   * Amount from magnitude and indicator.
   * @param magnitude amount, sign ignored
   * @param debitSide true for debit
   * @return signed amount
   */
  public static SignedAmount fromIndicator(BigDecimal magnitude, boolean debitSide) {
    BigDecimal abs = magnitude.abs();
    return debitSide
        ? new SignedAmount(abs, BigDecimal.ZERO, abs, AmountEncoding.INDICATOR)
        : new SignedAmount(BigDecimal.ZERO, abs, abs.negate(), AmountEncoding.INDICATOR);
  }

  /**
   * Amount used as-is.
   * @param amount signed amount
   * @return signed amount with debit/credit split by sign
   */
  public static SignedAmount fromSigned(BigDecimal amount) {
    return amount.signum() >= 0
        ? new SignedAmount(amount, BigDecimal.ZERO, amount, AmountEncoding.SIGNED)
        : new SignedAmount(BigDecimal.ZERO, amount.negate(), amount, AmountEncoding.SIGNED);
  }

  /**
   * Pick the encoding from the populated fields: pair first, then indicator, then signed.
   * @param debit resolved debit amount or null
   * @param credit resolved credit amount or null
   * @param amount resolved single amount or null
   * @param indicator debit/credit indicator text or null
   * @return derived amount, empty when nothing usable is present
   */
  public static Optional<SignedAmount> derive(BigDecimal debit, BigDecimal credit,
      BigDecimal amount, String indicator) {
    if (debit != null || credit != null) {
      return Optional.of(fromPair(debit, credit));
    }
    if (amount == null) {
      return Optional.empty();
    }
    Boolean side = parseIndicator(indicator);
    if (side != null) {
      return Optional.of(fromIndicator(amount, side));
    }
    return Optional.of(fromSigned(amount));
  }

  /**
   * Interpret a debit/credit indicator.
   * @param indicator text such as D, C, Debit, Credit, K (kredit), + or -
   * @return TRUE for debit, FALSE for credit, null if absent or unrecognized
   */
  public static Boolean parseIndicator(String indicator) {
    if (indicator == null) {
      return null;
    }
    String s = indicator.trim().toUpperCase(Locale.ROOT);
    if (s.isEmpty()) {
      return null;
    }
    switch (s.charAt(0)) {
      case 'D':
      case '+':
        return Boolean.TRUE;
      case 'C':
      case 'K':
      case '-':
        return Boolean.FALSE;
      default:
        return null;
    }
  }

  public BigDecimal getDebit() {
    return debit;
  }

  public BigDecimal getCredit() {
    return credit;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public AmountEncoding getEncoding() {
    return encoding;
  }
}
