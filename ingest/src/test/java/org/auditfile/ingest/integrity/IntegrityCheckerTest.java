package org.auditfile.ingest.integrity;

import java.io.IOException;
import java.util.List;
import org.auditfile.ingest.Docs;
import org.auditfile.ingest.emit.RecordEmitter;
import org.auditfile.ingest.emit.VoucherAccumulator;
import org.auditfile.ingest.field.FieldResolver;
import org.auditfile.ingest.field.Vocabulary;
import org.auditfile.ingest.progress.IngestStats;
import org.auditfile.ingest.sink.EntityKind;
import org.auditfile.ingest.sink.MemorySinkTarget;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class IntegrityCheckerTest {
  static final Vocabulary VOCABULARY = Vocabulary.load();

  static RecordEmitter emitter(MemorySinkTarget target) throws IOException {
    RecordEmitter emitter = new RecordEmitter(target, VOCABULARY,
        new FieldResolver(VOCABULARY.getAliases(), 4), new IngestStats("t"), false, 10);
    emitter.open();
    return emitter;
  }

  @Test
  public void missingAccounts() throws IOException {
    RecordEmitter emitter = emitter(new MemorySinkTarget());
    emitter.account(Docs.node("<Account><AccountID>1500</AccountID></Account>"));
    VoucherAccumulator v = emitter.openVoucher(null);
    for (String account : new String[] {"1920", "1500", "ABC", "300", "", "1920"}) {
      emitter.line(Docs.node("<Line><AccountID>" + account + "</AccountID>"
          + "<Amount>0</Amount></Line>"), v);
    }
    IntegrityFindings findings = IntegrityChecker.check(emitter);
    assertThat(findings.getMissingAccounts(), contains("300", "1920", "ABC"));
  }

  @Test
  public void census() throws IOException {
    RecordEmitter emitter = emitter(new MemorySinkTarget());
    emitter.unknownElement("Line", "ProjectCode");
    emitter.unknownElement("Header", "Extension");
    emitter.unknownElement("Line", "ProjectCode");
    emitter.unknownElement(null, "Stray");
    emitter.unknownElement("Customer", "Extension");
    List<ElementCount> unknown = IntegrityChecker.check(emitter).getUnknownElements();
    assertThat(unknown.size(), is(4));
    assertThat(unknown.get(0).getTag(), is("ProjectCode"));
    assertThat(unknown.get(0).getCount(), is(2L));
    assertThat(unknown.get(1).getSection(), is("(root)"));
    assertThat(unknown.get(2).getSection(), is("Customer"));
    assertThat(unknown.get(3).getSection(), is("Header"));
  }

  @Test
  public void diagnosticsWrittenOnlyWhenNonEmpty() throws IOException {
    MemorySinkTarget target = new MemorySinkTarget();
    RecordEmitter emitter = emitter(target);
    VoucherAccumulator v = emitter.openVoucher(null);
    emitter.describeVoucher(v, Docs.node("<Transaction><TransactionID>9</TransactionID>"
        + "</Transaction>"));
    emitter.line(Docs.node("<Line><AccountID>1</AccountID><Amount>5</Amount></Line>"), v);
    emitter.line(Docs.node("<Line><AccountID>1</AccountID></Line>"), v);
    emitter.closeVoucher(v);
    emitter.close();
    IntegrityFindings findings = IntegrityChecker.check(emitter);
    List<String> written = findings.writeTo(target);
    assertThat(written, contains("missing_account", "unbalanced_voucher", "rejected_record"));
    assertThat(target.rows(EntityKind.UNBALANCED_VOUCHER).get(0),
        contains("9", "9", "", "5", "0", "5"));
    assertThat(target.column(EntityKind.REJECTED_RECORD, "Entity"),
        contains("transaction_line"));
    assertThat(target.has(EntityKind.UNKNOWN_ELEMENT), is(false));
    assertThat(findings.toJson().getInteger("missingAccounts"), is(1));
  }

  @Test
  public void none() throws IOException {
    MemorySinkTarget target = new MemorySinkTarget();
    assertThat(IntegrityFindings.none().writeTo(target), is(empty()));
    assertThat(target.tables(), is(empty()));
  }
}
