package org.auditfile.ingest.sink;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes each table as {@code <table>.csv} in a directory, UTF-8, with a header row.
 * Every row is flushed as it is written.
 */
public class CsvSinkTarget implements SinkTarget {
  private static final Logger log = LogManager.getLogger(CsvSinkTarget.class);
  public static final String SUMMARY_FILE = "run_summary.json";

  private final Path directory;
  private final List<String> tables = new ArrayList<>();
  private final List<Path> files = new ArrayList<>();

  public CsvSinkTarget(Path directory) {
    this.directory = directory;
  }

  public Path getDirectory() {
    return directory;
  }

  /**
   * File of a table.
   * @param kind table
   * @return path, whether or not it has been written
   */
  public Path path(EntityKind kind) {
    return directory.resolve(kind.getTableName() + ".csv");
  }

  @Override
  public RowSink open(EntityKind kind) throws IOException {
    Files.createDirectories(directory);
    Path file = path(kind);
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader(kind.getColumns().toArray(new String[0]))
        .setRecordSeparator('\n')
        .build();
    Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    CSVPrinter printer;
    try {
      printer = new CSVPrinter(writer, format);
      printer.flush();
    } catch (IOException e) {
      writer.close();
      throw e;
    }
    tables.add(kind.getTableName());
    files.add(file);
    return new CsvRowSink(printer);
  }

  @Override
  public void discard() throws IOException {
    for (Path file : files) {
      Files.deleteIfExists(file);
    }
    Files.deleteIfExists(directory.resolve(SUMMARY_FILE));
    log.info("Discarded {} tables in {}", files.size(), directory);
    files.clear();
    tables.clear();
  }

  @Override
  public void writeSummary(JsonObject summary) throws IOException {
    Files.createDirectories(directory);
    Files.writeString(directory.resolve(SUMMARY_FILE), summary.encodePrettily(),
        StandardCharsets.UTF_8);
  }

  @Override
  public List<String> tables() {
    return Collections.unmodifiableList(tables);
  }

  @Override
  public String describe() {
    return directory.toString();
  }

  private static class CsvRowSink implements RowSink {
    private final CSVPrinter printer;
    private long count;

    CsvRowSink(CSVPrinter printer) {
      this.printer = printer;
    }

    @Override
    public void write(List<String> values) throws IOException {
      printer.printRecord(values);
      printer.flush();
      count++;
    }

    @Override
    public long count() {
      return count;
    }

    @Override
    public void close() throws IOException {
      printer.close();
    }
  }
}
