package org.auditfile.ingest;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.auditfile.ingest.emit.RecordEmitter;
import org.auditfile.ingest.field.Vocabulary;
import org.auditfile.ingest.integrity.IntegrityChecker;
import org.auditfile.ingest.progress.CancellationToken;
import org.auditfile.ingest.progress.IngestStats;
import org.auditfile.ingest.sink.CsvSinkTarget;
import org.auditfile.ingest.sink.EntityKind;
import org.auditfile.ingest.sink.MemorySinkTarget;
import org.auditfile.util.source.SourceFormatException;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;

public class IngestEngineTest {
  static final Vocabulary VOCABULARY = Vocabulary.load();

  static final String BALANCED = "<Transaction><TransactionID>1</TransactionID>"
      + "<Line><AccountID>1500</AccountID><DebitAmount>100.00</DebitAmount></Line>"
      + "<Line><AccountID>1920</AccountID><CreditAmount>100.00</CreditAmount></Line>"
      + "</Transaction>";

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  Path dir;

  @Before
  public void setUp() {
    dir = folder.getRoot().toPath();
  }

  static IngestEngine engine(boolean raw, int progressEvents) {
    return new IngestEngine(new IngestConfig(progressEvents, raw, 2000, 4), VOCABULARY);
  }

  static List<CSVRecord> read(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
         CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
      return parser.getRecords();
    }
  }

  @Test
  public void balancedVoucher() throws IOException {
    Path file = Docs.write(dir, "a.xml", Docs.auditFile(Docs.account("1500"), BALANCED));
    MemorySinkTarget target = new MemorySinkTarget();
    RunOutcome outcome = engine(false, 1000).ingest(file, target);
    assertThat(outcome.getPath(), is(ParsePath.STREAMING));
    assertThat(outcome.isStreamingUsed(), is(true));
    assertThat(outcome.isCancelled(), is(false));
    assertThat(target.column(EntityKind.VOUCHER, "Balanced"), contains("true"));
    assertThat(target.rows(EntityKind.TRANSACTION_LINE).size(), is(2));
    assertThat(outcome.getFindings().getMissingAccounts(), contains("1920"));
    assertThat(outcome.getFindings().getUnbalancedVouchers(), is(empty()));
    assertThat(target.column(EntityKind.MISSING_ACCOUNT, "AccountID"), contains("1920"));
    assertThat(target.has(EntityKind.UNBALANCED_VOUCHER), is(false));
    assertThat(outcome.getTables(), hasItem("missing_account"));
    assertThat(outcome.getTables(), not(hasItem("unbalanced_voucher")));
    assertThat(target.getSummary().getString("parserPath"), is("STREAMING"));
    assertThat(target.getSummary().getString("engineVersion"), is(IngestEngine.VERSION));
  }

  @Test
  public void signedCreditAmount() throws IOException {
    Path file = Docs.write(dir, "a.xml", Docs.auditFile("", "<Transaction>"
        + "<TransactionID>2</TransactionID><Line><AccountID>2410</AccountID>"
        + "<Amount>-500,00</Amount></Line></Transaction>"));
    MemorySinkTarget target = new MemorySinkTarget();
    engine(false, 1000).ingest(file, target);
    assertThat(target.column(EntityKind.TRANSACTION_LINE, "Amount"), contains("-500.00"));
    assertThat(target.column(EntityKind.TRANSACTION_LINE, "Credit"), contains("500.00"));
    assertThat(target.column(EntityKind.TRANSACTION_LINE, "Debit"), contains("0"));
    assertThat(target.column(EntityKind.TRANSACTION_LINE, "AmountEncoding"),
        contains("SIGNED"));
  }

  @Test
  public void smallFileToCsv() throws IOException {
    Path file = Docs.writeSmall(dir);
    CsvSinkTarget target = new CsvSinkTarget(dir.resolve("out"));
    RunOutcome outcome = engine(false, 1000).ingest(file, target);

    List<CSVRecord> lines = read(target.path(EntityKind.TRANSACTION_LINE));
    assertThat(lines.size(), is(6));
    assertThat(lines.get(0).toList(), is(EntityKind.TRANSACTION_LINE.getColumns()));
    List<CSVRecord> missing = read(target.path(EntityKind.MISSING_ACCOUNT));
    assertThat(missing.get(1).get(0), is("2400"));
    assertThat(missing.get(2).get(0), is("6800"));
    assertThat(Files.exists(target.path(EntityKind.UNBALANCED_VOUCHER)), is(false));
    assertThat(Files.exists(target.path(EntityKind.RAW_ELEMENT)), is(false));
    List<CSVRecord> unknown = read(target.path(EntityKind.UNKNOWN_ELEMENT));
    assertThat(unknown.size(), is(3));
    assertThat(read(target.path(EntityKind.TAX_TABLE)).size(), is(3));
    assertThat(read(target.path(EntityKind.CONTROL_ACCOUNT_LINK)).size(), is(3));

    JsonObject summary = new JsonObject(Files.readString(
        dir.resolve("out").resolve(CsvSinkTarget.SUMMARY_FILE)));
    assertThat(summary.getString("parserPath"), is("STREAMING"));
    assertThat(summary.getBoolean("cancelled"), is(false));
    assertThat(summary.getInteger("schemaVersion"), is(EntityKind.SCHEMA_VERSION));
    assertThat(summary.getJsonObject("findings").getInteger("missingAccounts"), is(2));
    assertThat(summary.getJsonObject("findings").getInteger("unbalancedVouchers"), is(0));
    assertThat(summary.getJsonObject("progress").getJsonObject("rows")
        .getInteger("transaction_line"), is(5));
    assertThat(outcome.getProgress().getRows("voucher"), is(2L));
  }

  @Test
  public void fallbackGivesSameTables() throws IOException {
    Path file = Docs.writeSmall(dir);
    IngestEngine engine = engine(true, 1000);
    MemorySinkTarget streamed = new MemorySinkTarget();
    RunOutcome outcome = engine.ingest(file, streamed);
    assertThat(outcome.getPath(), is(ParsePath.STREAMING));

    MemorySinkTarget fallback = new MemorySinkTarget();
    RecordEmitter emitter = engine.fallback(file, fallback, new IngestStats(file.toString()));
    for (EntityKind kind : EntityKind.values()) {
      if (!kind.isDiagnostic()) {
        assertThat(kind.getTableName(), fallback.rows(kind), is(streamed.rows(kind)));
      }
    }
    assertThat(streamed.rows(EntityKind.RAW_ELEMENT).size(), is(fallback.rows(
        EntityKind.RAW_ELEMENT).size()));
    assertThat(IntegrityChecker.check(emitter).getMissingAccounts(),
        is(outcome.getFindings().getMissingAccounts()));
    assertThat(IntegrityChecker.check(emitter).getUnknownElements().size(),
        is(outcome.getFindings().getUnknownElements().size()));
  }

  @Test
  public void malformedNestingFallsBack() throws IOException {
    Path file = Docs.write(dir, "a.xml", Docs.auditFile(Docs.account("1500"),
        BALANCED + "<Line><RecordID>9</RecordID><AccountID>1500</AccountID>"
            + "<Amount>5</Amount></Line>"));
    CsvSinkTarget target = new CsvSinkTarget(dir.resolve("out"));
    RunOutcome outcome = engine(false, 1000).ingest(file, target);
    assertThat(outcome.getPath(), is(ParsePath.FALLBACK));
    assertThat(outcome.isStreamingUsed(), is(false));
    assertThat(outcome.getStreamingFailure(), containsString("outside of a transaction"));
    // streaming output was discarded before the fallback wrote its own
    assertThat(read(target.path(EntityKind.VOUCHER)).size(), is(2));
    List<CSVRecord> lines = read(target.path(EntityKind.TRANSACTION_LINE));
    assertThat(lines.size(), is(4));
    int isGl = EntityKind.TRANSACTION_LINE.columnIndex("IsGL");
    assertThat(lines.get(3).get(isGl), is("false"));
    JsonObject summary = new JsonObject(Files.readString(
        dir.resolve("out").resolve(CsvSinkTarget.SUMMARY_FILE)));
    assertThat(summary.getString("parserPath"), is("FALLBACK"));
    assertThat(summary.getString("streamingFailure"), containsString("<Line>"));
  }

  @Test
  public void bothParsersFail() throws IOException {
    Path file = Docs.write(dir, "a.xml", "<AuditFile><Header></AuditFile>");
    FallbackParsingException e = Assert.assertThrows(FallbackParsingException.class,
        () -> engine(false, 1000).ingest(file, new MemorySinkTarget()));
    assertThat(e.getMessage(), containsString("Fallback parser failed"));
  }

  @Test
  public void fallbackTooDeep() throws IOException {
    int depth = 200_000;
    Path file = Docs.write(dir, "deep.xml", "<AuditFile>" + "<Note>".repeat(depth)
        + "</Note>".repeat(depth) + "</AuditFile>");
    FallbackParsingException e = Assert.assertThrows(FallbackParsingException.class,
        () -> engine(false, 1000).fallback(file, new MemorySinkTarget(),
            new IngestStats(file.toString())));
    assertThat(e.getMessage(), containsString("nested too deeply"));
  }

  @Test
  public void cancelledByListener() throws IOException {
    Path file = Docs.writeSmall(dir);
    CsvSinkTarget target = new CsvSinkTarget(dir.resolve("out"));
    RunOutcome outcome = engine(false, 40).ingest(file, target, s -> s.getEvents() < 80);
    assertThat(outcome.isCancelled(), is(true));
    assertThat(outcome.isStreamingUsed(), is(true));
    assertThat(outcome.getProgress().getEvents(), is(80L));
    assertThat(outcome.getFindings().getMissingAccounts(), is(empty()));
    assertThat(Files.exists(target.path(EntityKind.MISSING_ACCOUNT)), is(false));
    // every table that was opened parses to complete rows
    for (EntityKind kind : EntityKind.values()) {
      Path table = target.path(kind);
      if (Files.exists(table)) {
        for (CSVRecord record : read(table)) {
          assertThat(record.size(), is(kind.getColumns().size()));
        }
      }
    }
    assertThat(read(target.path(EntityKind.TRANSACTION_LINE)).size(), lessThan(6));
    assertThat(read(target.path(EntityKind.HEADER)).size(), is(2));
    JsonObject summary = new JsonObject(Files.readString(
        dir.resolve("out").resolve(CsvSinkTarget.SUMMARY_FILE)));
    assertThat(summary.getBoolean("cancelled"), is(true));
  }

  @Test
  public void cancelledByToken() throws IOException {
    Path file = Docs.writeSmall(dir);
    CancellationToken token = new CancellationToken();
    token.cancel();
    MemorySinkTarget target = new MemorySinkTarget();
    RunOutcome outcome = engine(false, 10).ingest(file, target, null, token);
    assertThat(outcome.isCancelled(), is(true));
    assertThat(outcome.getProgress().getEvents(), is(10L));
    assertThat(target.has(EntityKind.MISSING_ACCOUNT), is(false));
    assertThat(target.getSummary().getBoolean("cancelled"), is(true));
  }

  @Test
  public void gzipSource() throws IOException {
    Path file = dir.resolve("small.xml.gz");
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
      Docs.small().transferTo(out);
    }
    MemorySinkTarget target = new MemorySinkTarget();
    RunOutcome outcome = engine(false, 1000).ingest(file, target);
    assertThat(outcome.getPath(), is(ParsePath.STREAMING));
    assertThat(target.rows(EntityKind.TRANSACTION_LINE).size(), is(5));
  }

  @Test
  public void zipSource() throws IOException {
    Path file = dir.resolve("small.zip");
    try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(file))) {
      out.putNextEntry(new ZipEntry("readme.txt"));
      out.write("audit".getBytes(StandardCharsets.UTF_8));
      out.closeEntry();
      out.putNextEntry(new ZipEntry("SAF-T/saft.XML"));
      Docs.small().transferTo(out);
      out.closeEntry();
    }
    MemorySinkTarget target = new MemorySinkTarget();
    engine(false, 1000).ingest(file, target);
    assertThat(target.rows(EntityKind.VOUCHER).size(), is(2));
  }

  @Test
  public void zipWithoutXml() throws IOException {
    Path file = dir.resolve("empty.zip");
    try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(file))) {
      out.putNextEntry(new ZipEntry("readme.txt"));
      out.write("audit".getBytes(StandardCharsets.UTF_8));
      out.closeEntry();
    }
    MemorySinkTarget target = new MemorySinkTarget();
    Assert.assertThrows(SourceFormatException.class,
        () -> engine(false, 1000).ingest(file, target));
    assertThat(target.tables(), is(empty()));
  }

  @Test
  public void missingSource() {
    Assert.assertThrows(SourceFormatException.class,
        () -> engine(false, 1000).ingest(dir.resolve("none.xml"), new MemorySinkTarget()));
  }
}
