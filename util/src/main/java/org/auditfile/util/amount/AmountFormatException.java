package org.auditfile.util.amount;

/**
 * Amount text without digits, or with digits that do not form a number.
 */
public class AmountFormatException extends RuntimeException {

  private final String text;

  public AmountFormatException(String msg, String text) {
    super(msg + ": '" + text + "'");
    this.text = text;
  }

  public AmountFormatException(String msg, String text, Throwable cause) {
    super(msg + ": '" + text + "'", cause);
    this.text = text;
  }

  public String getText() {
    return text;
  }
}
