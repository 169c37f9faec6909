package org.auditfile.ingest.progress;

/**
 * Receives periodic progress of a streaming run.
 */
@FunctionalInterface
public interface ProgressListener {

  /**
   * Called every configured number of processed elements.
   * @param snapshot progress so far
   * @return true to continue; false to stop the run cleanly
   */
  boolean onProgress(ProgressSnapshot snapshot);
}
