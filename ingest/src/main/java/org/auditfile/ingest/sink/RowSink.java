package org.auditfile.ingest.sink;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Append-only output channel of one table. A row passed to {@link #write(List)} is
 * complete in the output once the call returns.
 */
public interface RowSink extends Closeable {

  void write(List<String> values) throws IOException;

  long count();
}
