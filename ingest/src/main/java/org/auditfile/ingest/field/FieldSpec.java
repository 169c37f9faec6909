package org.auditfile.ingest.field;

import java.util.Collections;
import java.util.List;

/**
 * One canonical field: its accepted spellings in priority order and whether it holds
 * a monetary amount.
 */
public final class FieldSpec {
  private final String name;
  private final List<String> aliases;
  private final boolean amount;

  /**
   * Create field spec.
   * @param name canonical name
   * @param aliases tag/attribute spellings, first wins
   * @param amount true for amount-shaped fields
   */
  public FieldSpec(String name, List<String> aliases, boolean amount) {
    if (aliases.isEmpty()) {
      throw new IllegalArgumentException("Field " + name + " has no aliases");
    }
    this.name = name;
    this.aliases = Collections.unmodifiableList(aliases);
    this.amount = amount;
  }

  public String getName() {
    return name;
  }

  public List<String> getAliases() {
    return aliases;
  }

  public boolean isAmount() {
    return amount;
  }
}
