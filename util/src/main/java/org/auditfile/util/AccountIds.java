package org.auditfile.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical form of general-ledger account identifiers.
 */
public final class AccountIds {

  /** Account used for lines that resolve to no account at all. */
  public static final String SENTINEL = "UNDEFINED";

  private static final Pattern ZERO_FRACTION = Pattern.compile("^(\\d+)\\.0+$");

  private AccountIds() {
    throw new UnsupportedOperationException("AccountIds");
  }

  /**
   * Canonicalize account identifier: digits only, leading zeros stripped.
   *
   * <p>A trailing zero fraction ({@code 1500.0}) is dropped first. Identifiers without
   * any digit are returned trimmed, unchanged otherwise. Applying the function twice gives
   * the same result as applying it once.
   * @param raw identifier as written, possibly null
   * @return canonical identifier; empty string for null or blank input
   */
  public static String canonical(String raw) {
    if (raw == null) {
      return "";
    }
    String s = raw.trim();
    Matcher m = ZERO_FRACTION.matcher(s);
    if (m.matches()) {
      s = m.group(1);
    }
    StringBuilder digits = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c >= '0' && c <= '9') {
        digits.append(c);
      }
    }
    if (digits.length() == 0) {
      return s;
    }
    int start = 0;
    while (start < digits.length() - 1 && digits.charAt(start) == '0') {
      start++;
    }
    return digits.substring(start);
  }
}
