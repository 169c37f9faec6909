package org.auditfile.util.amount;

import java.math.BigDecimal;
import org.junit.Assert;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class AmountNormalizerTest {

  static void parsesTo(String text, String expected) {
    assertThat(text, AmountNormalizer.parse(text), is(new BigDecimal(expected)));
  }

  @Test
  public void plain() {
    parsesTo("100", "100");
    parsesTo("100.00", "100.00");
    parsesTo("-500,00", "-500.00");
    parsesTo("0,5", "0.5");
    parsesTo(",5", "0.5");
    parsesTo("12.", "12");
  }

  @Test
  public void bothSeparators() {
    parsesTo("1.234,56", "1234.56");
    parsesTo("1,234.56", "1234.56");
    parsesTo("1.234.567,89", "1234567.89");
    parsesTo("1,234,567.89", "1234567.89");
  }

  @Test
  public void repeatedSeparator() {
    parsesTo("1.234.567", "1234.567");
    parsesTo("1,234,567", "1234.567");
  }

  @Test
  public void spaces() {
    parsesTo("1 234 567,00", "1234567.00");
    parsesTo("1\u00a0234,50", "1234.50");
    parsesTo("1\u202f234,50", "1234.50");
    parsesTo("  42  ", "42");
    parsesTo("1'234.50", "1234.50");
  }

  @Test
  public void signs() {
    parsesTo("+12,00", "12.00");
    parsesTo("12,00-", "-12.00");
    parsesTo("(12,00)", "-12.00");
    parsesTo("\u221212", "-12");
    parsesTo("NOK -1 000,00", "-1000.00");
  }

  @Test
  public void currencyAroundNumber() {
    parsesTo("12,50 kr", "12.50");
    parsesTo("\u20ac-5", "-5");
    parsesTo("-\u20ac5", "-5");
    parsesTo("(USD 7.25)", "-7.25");
  }

  @Test
  public void strayCharactersRejected() {
    for (String text : new String[] {"1-2", "1e5", "12-3,00", "1.5E3 USD", "1 2a3", "--5",
        "-5-", "(12", "12)", "+-1", "5 # 6"}) {
      AmountFormatException e = Assert.assertThrows(text, AmountFormatException.class,
          () -> AmountNormalizer.parse(text));
      assertThat(text, e.getMessage(), containsString("Malformed"));
      assertThat(AmountNormalizer.parseOrNull(text), nullValue());
    }
  }

  @Test
  public void exactSums() {
    BigDecimal sum = BigDecimal.ZERO;
    for (int i = 0; i < 10; i++) {
      sum = sum.add(AmountNormalizer.parse("0,10"));
    }
    assertThat(sum, is(new BigDecimal("1.00")));
  }

  @Test
  public void noDigits() {
    AmountFormatException e = Assert.assertThrows(AmountFormatException.class,
        () -> AmountNormalizer.parse("abc"));
    assertThat(e.getMessage(), containsString("No digits"));
    assertThat(e.getText(), is("abc"));
    Assert.assertThrows(AmountFormatException.class, () -> AmountNormalizer.parse(""));
    Assert.assertThrows(AmountFormatException.class, () -> AmountNormalizer.parse(null));
    Assert.assertThrows(AmountFormatException.class, () -> AmountNormalizer.parse(" ,. "));
  }

  @Test
  public void optional() {
    assertThat(AmountNormalizer.parseOrZero(null), is(BigDecimal.ZERO));
    assertThat(AmountNormalizer.parseOrZero("x"), is(BigDecimal.ZERO));
    assertThat(AmountNormalizer.parseOrZero("7,5"), is(new BigDecimal("7.5")));
    assertThat(AmountNormalizer.parseOrNull(" "), nullValue());
    assertThat(AmountNormalizer.parseOrNull("--"), nullValue());
  }
}
