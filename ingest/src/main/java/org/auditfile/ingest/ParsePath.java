package org.auditfile.ingest;

/**
 * Which parser produced a run's tables.
 */
public enum ParsePath {
  STREAMING,
  FALLBACK
}
