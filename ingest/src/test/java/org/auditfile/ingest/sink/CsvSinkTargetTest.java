package org.auditfile.ingest.sink;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class CsvSinkTargetTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  static List<CSVRecord> read(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
         CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
      return parser.getRecords();
    }
  }

  @Test
  public void headerAndRows() throws IOException {
    CsvSinkTarget target = new CsvSinkTarget(folder.getRoot().toPath().resolve("out"));
    try (RowSink sink = target.open(EntityKind.JOURNAL)) {
      sink.write(new Row(EntityKind.JOURNAL).set("JournalID", "GL")
          .set("Description", "Main, \"general\"\nledger").values());
      assertThat(sink.count(), is(1L));
      // rows are complete on disk before the sink is closed
      List<CSVRecord> records = read(target.path(EntityKind.JOURNAL));
      assertThat(records.size(), is(2));
    }
    List<CSVRecord> records = read(target.path(EntityKind.JOURNAL));
    assertThat(records.get(0).toList(), contains("JournalID", "Description", "Type",
        "TotalDebit", "TotalCredit"));
    assertThat(records.get(1).toList(), contains("GL", "Main, \"general\"\nledger", "", "",
        ""));
    assertThat(target.tables(), contains("journal"));
    assertThat(target.path(EntityKind.JOURNAL).getFileName().toString(), is("journal.csv"));
  }

  @Test
  public void emptyTableHasHeader() throws IOException {
    CsvSinkTarget target = new CsvSinkTarget(folder.getRoot().toPath());
    target.open(EntityKind.MISSING_ACCOUNT).close();
    assertThat(Files.readString(target.path(EntityKind.MISSING_ACCOUNT)), is("AccountID\n"));
  }

  @Test
  public void discard() throws IOException {
    Path dir = folder.getRoot().toPath();
    Files.writeString(dir.resolve("other.txt"), "keep");
    CsvSinkTarget target = new CsvSinkTarget(dir);
    target.open(EntityKind.VOUCHER).close();
    target.open(EntityKind.TRANSACTION_LINE).close();
    target.writeSummary(new JsonObject().put("a", 1));
    target.discard();
    assertThat(Files.exists(target.path(EntityKind.VOUCHER)), is(false));
    assertThat(Files.exists(target.path(EntityKind.TRANSACTION_LINE)), is(false));
    assertThat(Files.exists(dir.resolve(CsvSinkTarget.SUMMARY_FILE)), is(false));
    assertThat(Files.exists(dir.resolve("other.txt")), is(true));
    assertThat(target.tables(), is(empty()));
  }

  @Test
  public void summary() throws IOException {
    CsvSinkTarget target = new CsvSinkTarget(folder.getRoot().toPath().resolve("s"));
    target.writeSummary(new JsonObject().put("parserPath", "STREAMING"));
    JsonObject read = new JsonObject(Files.readString(
        target.getDirectory().resolve(CsvSinkTarget.SUMMARY_FILE)));
    assertThat(read.getString("parserPath"), is("STREAMING"));
  }
}
