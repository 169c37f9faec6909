package org.auditfile.ingest.integrity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.auditfile.ingest.emit.RecordEmitter;
import org.auditfile.util.AccountIds;

/**
 * Derives the post-run findings from the aggregates an emitter collected.
 */
public final class IntegrityChecker {

  /** Digit-only ids in numeric order, before any other ids in text order. */
  static final Comparator<String> ACCOUNT_ORDER = (a, b) -> {
    boolean da = isDigits(a);
    boolean db = isDigits(b);
    if (da && db) {
      int c = Integer.compare(a.length(), b.length());
      return c != 0 ? c : a.compareTo(b);
    }
    if (da != db) {
      return da ? -1 : 1;
    }
    return a.compareTo(b);
  };

  static final Comparator<ElementCount> CENSUS_ORDER =
      Comparator.comparingLong(ElementCount::getCount).reversed()
          .thenComparing(ElementCount::getSection)
          .thenComparing(ElementCount::getTag);

  private IntegrityChecker() { }

  /**
   * Check a completed run.
   * @param emitter emitter of the run
   * @return findings
   */
  public static IntegrityFindings check(RecordEmitter emitter) {
    List<String> missing = new ArrayList<>();
    for (String id : emitter.getLineAccounts()) {
      if (!AccountIds.SENTINEL.equals(id) && !emitter.getDeclaredAccounts().contains(id)) {
        missing.add(id);
      }
    }
    missing.sort(ACCOUNT_ORDER);

    List<ElementCount> unknown = new ArrayList<>();
    for (Map.Entry<String, Map<String, Long>> section : emitter.getCensus().entrySet()) {
      for (Map.Entry<String, Long> tag : section.getValue().entrySet()) {
        unknown.add(new ElementCount(section.getKey(), tag.getKey(), tag.getValue()));
      }
    }
    unknown.sort(CENSUS_ORDER);

    return new IntegrityFindings(missing, new ArrayList<>(emitter.getUnbalancedVouchers()),
        unknown, new ArrayList<>(emitter.getRejectedRecords()));
  }

  private static boolean isDigits(String s) {
    if (s.isEmpty()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
