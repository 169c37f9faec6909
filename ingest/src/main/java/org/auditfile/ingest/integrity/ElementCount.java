package org.auditfile.ingest.integrity;

/**
 * Occurrences of one unexpected tag under one section.
 */
public final class ElementCount {
  private final String section;
  private final String tag;
  private final long count;

  ElementCount(String section, String tag, long count) {
    this.section = section;
    this.tag = tag;
    this.count = count;
  }

  public String getSection() {
    return section;
  }

  public String getTag() {
    return tag;
  }

  public long getCount() {
    return count;
  }
}
