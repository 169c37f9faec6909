package org.auditfile.util.amount;

import java.math.BigDecimal;
import java.util.Optional;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class SignedAmountTest {

  static BigDecimal dec(String s) {
    return new BigDecimal(s);
  }

  @Test
  public void pair() {
    SignedAmount a = SignedAmount.derive(dec("100.00"), null, dec("999"), "C").orElseThrow();
    assertThat(a.getEncoding(), is(AmountEncoding.DEBIT_CREDIT_PAIR));
    assertThat(a.getAmount(), is(dec("100.00")));
    assertThat(a.getDebit(), is(dec("100.00")));
    assertThat(a.getCredit(), is(BigDecimal.ZERO));

    a = SignedAmount.fromPair(dec("10.00"), dec("2.50"));
    assertThat(a.getAmount(), is(dec("7.50")));
  }

  @Test
  public void indicator() {
    SignedAmount a = SignedAmount.derive(null, null, dec("500.00"), "C").orElseThrow();
    assertThat(a.getEncoding(), is(AmountEncoding.INDICATOR));
    assertThat(a.getAmount(), is(dec("-500.00")));
    assertThat(a.getCredit(), is(dec("500.00")));
    assertThat(a.getDebit(), is(BigDecimal.ZERO));

    a = SignedAmount.derive(null, null, dec("-500.00"), "debit").orElseThrow();
    assertThat(a.getAmount(), is(dec("500.00")));
  }

  @Test
  public void signedOnly() {
    SignedAmount a = SignedAmount.derive(null, null, dec("-500.00"), null).orElseThrow();
    assertThat(a.getEncoding(), is(AmountEncoding.SIGNED));
    assertThat(a.getAmount(), is(dec("-500.00")));
    assertThat(a.getCredit(), is(dec("500.00")));

    a = SignedAmount.derive(null, null, dec("3"), "?").orElseThrow();
    assertThat(a.getEncoding(), is(AmountEncoding.SIGNED));
  }

  @Test
  public void encodingsAgreeOnSameFact() {
    BigDecimal fromPair = SignedAmount.derive(null, dec("250.40"), null, null)
        .orElseThrow().getAmount();
    BigDecimal fromIndicator = SignedAmount.derive(null, null, dec("250.40"), "K")
        .orElseThrow().getAmount();
    BigDecimal fromSigned = SignedAmount.derive(null, null, dec("-250.40"), null)
        .orElseThrow().getAmount();
    assertThat(fromPair, is(dec("-250.40")));
    assertThat(fromIndicator, is(fromPair));
    assertThat(fromSigned, is(fromPair));
  }

  @Test
  public void nothing() {
    assertThat(SignedAmount.derive(null, null, null, "D"), is(Optional.empty()));
  }

  @Test
  public void indicators() {
    assertThat(SignedAmount.parseIndicator("D"), is(true));
    assertThat(SignedAmount.parseIndicator(" Debet "), is(true));
    assertThat(SignedAmount.parseIndicator("+"), is(true));
    assertThat(SignedAmount.parseIndicator("c"), is(false));
    assertThat(SignedAmount.parseIndicator("Kredit"), is(false));
    assertThat(SignedAmount.parseIndicator("-"), is(false));
    assertThat(SignedAmount.parseIndicator(""), nullValue());
    assertThat(SignedAmount.parseIndicator(null), nullValue());
    assertThat(SignedAmount.parseIndicator("X"), nullValue());
  }
}
