package org.auditfile.util.amount;

import java.math.BigDecimal;

/**
 * Parses monetary text written with either period or comma as decimal separator into
 * an exact {@link BigDecimal}.
 *
 * <p>Spaces, non-breaking spaces and apostrophes are dropped. When both separators occur the
 * right-most one is the decimal separator and the other is grouping. A lone separator kind
 * occurring more than once is grouping except for its last occurrence. One sign may lead or
 * trail the number, and an amount in parentheses is negative. Letters and currency symbols
 * are accepted before and after the number only.
 */
public final class AmountNormalizer {

  private AmountNormalizer() {
    throw new UnsupportedOperationException("AmountNormalizer");
  }

  /**
   * Parse amount.
   * @param text raw amount text
   * @return exact value, scale as written
   * @throws AmountFormatException when no number remains after stripping, or when the text
   *     has characters other than digits and separators inside the number or more than one sign
   */
  public static BigDecimal parse(String text) {
    if (text == null) {
      throw new AmountFormatException("No amount", "");
    }
    StringBuilder compact = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (!isGrouping(c)) {
        compact.append(c);
      }
    }
    String s = compact.toString();
    int first = -1;
    int last = -1;
    boolean seenDigit = false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (isDigit(c) || isSeparator(c)) {
        if (first < 0) {
          first = i;
        }
        last = i;
        seenDigit |= isDigit(c);
      }
    }
    if (!seenDigit) {
      throw new AmountFormatException("No digits in amount", text);
    }
    for (int i = first; i <= last; i++) {
      char c = s.charAt(i);
      if (!isDigit(c) && !isSeparator(c)) {
        throw new AmountFormatException("Malformed amount", text);
      }
    }
    int signs = 0;
    boolean negative = false;
    boolean open = false;
    boolean close = false;
    for (int i = 0; i < s.length(); i++) {
      if (i == first) {
        i = last;
        continue;
      }
      char c = s.charAt(i);
      if (c == '-' || c == '\u2212') {
        signs++;
        negative = true;
      } else if (c == '+') {
        signs++;
      } else if (c == '(' && i < first) {
        signs++;
        open = true;
        negative = true;
      } else if (c == ')' && i > last) {
        close = true;
      } else if (!isAffix(c)) {
        throw new AmountFormatException("Malformed amount", text);
      }
    }
    if (signs > 1 || open != close) {
      throw new AmountFormatException("Malformed amount", text);
    }
    String number = normalizeSeparators(s.substring(first, last + 1));
    try {
      BigDecimal value = new BigDecimal(number);
      return negative ? value.negate() : value;
    } catch (NumberFormatException e) {
      throw new AmountFormatException("Malformed amount", text, e);
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isSeparator(char c) {
    return c == '.' || c == ',';
  }

  private static boolean isGrouping(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\'';
  }

  // currency codes and symbols such as "NOK" or "kr"
  private static boolean isAffix(char c) {
    return Character.isLetter(c) || Character.getType(c) == Character.CURRENCY_SYMBOL;
  }

  /**
   * Parse optional amount.
   * @param text raw amount text, possibly null or blank
   * @return value, or zero when absent or malformed
   */
  public static BigDecimal parseOrZero(String text) {
    BigDecimal value = parseOrNull(text);
    return value == null ? BigDecimal.ZERO : value;
  }

  /**
   * Parse optional amount.
   * @param text raw amount text, possibly null or blank
   * @return value, or null when absent or malformed
   */
  public static BigDecimal parseOrNull(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return parse(text);
    } catch (AmountFormatException e) {
      return null;
    }
  }

  static String normalizeSeparators(String s) {
    int lastDot = s.lastIndexOf('.');
    int lastComma = s.lastIndexOf(',');
    int decimalAt = Math.max(lastDot, lastComma);
    if (decimalAt < 0) {
      return s;
    }
    StringBuilder out = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '.' || c == ',') {
        if (i == decimalAt) {
          out.append('.');
        }
      } else {
        out.append(c);
      }
    }
    if (out.charAt(out.length() - 1) == '.') {
      out.setLength(out.length() - 1);
    }
    if (out.length() > 0 && out.charAt(0) == '.') {
      out.insert(0, '0');
    }
    return out.toString();
  }
}
