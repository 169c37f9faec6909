package org.auditfile.ingest.fallback;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.auditfile.ingest.emit.JournalAccumulator;
import org.auditfile.ingest.emit.RecordEmitter;
import org.auditfile.ingest.emit.VoucherAccumulator;
import org.auditfile.ingest.field.RecordKind;
import org.auditfile.ingest.field.Vocabulary;
import org.auditfile.ingest.progress.IngestStats;
import org.auditfile.ingest.xml.DomTrees;
import org.auditfile.ingest.xml.XmlNode;
import org.xml.sax.SAXException;

/**
 * Parser over the fully materialized document.
 *
 * <p>Produces the same tables as {@link org.auditfile.ingest.stream.StreamingIngester}
 * for well-formed audit files, and keeps going where the streaming parser gives up:
 * a line outside any transaction is emitted without a voucher, and nested journals,
 * transactions or lines are read as records of their own.
 */
public class FallbackIngester {
  private static final Logger log = LogManager.getLogger(FallbackIngester.class);

  private final Vocabulary vocabulary;
  private final RecordEmitter emitter;
  private final IngestStats stats;
  private final Predicate<XmlNode> isLine;
  private final Predicate<XmlNode> isLineOrTransaction;
  private final Predicate<XmlNode> isTransaction;
  private final Deque<String> ancestors = new ArrayDeque<>();

  /**
   * Create ingester for one run.
   * @param vocabulary tag vocabulary
   * @param emitter emitter, sinks open
   * @param stats counters of the run
   */
  public FallbackIngester(Vocabulary vocabulary, RecordEmitter emitter, IngestStats stats) {
    this.vocabulary = vocabulary;
    this.emitter = emitter;
    this.stats = stats;
    Set<String> lineTags = vocabulary.tags(RecordKind.LINE);
    Set<String> transactionTags = vocabulary.tags(RecordKind.TRANSACTION);
    this.isLine = n -> lineTags.contains(n.getName());
    this.isTransaction = n -> transactionTags.contains(n.getName());
    this.isLineOrTransaction = isLine.or(isTransaction);
  }

  /**
   * Parse and emit the whole document.
   * @param in document bytes
   * @throws IOException on read failure
   * @throws SAXException when the document is not well-formed XML
   */
  public void run(InputStream in) throws IOException, SAXException {
    long t0 = System.nanoTime();
    XmlNode root = DomTrees.parse(in);
    int size = root.size();
    stats.retained(size);
    stats.addPhase("materialize", System.nanoTime() - t0);
    log.info("Materialized {} elements", size);
    walk(root, false, false, null, null);
  }

  /**
   * Visit a node in document order and emit records on the way back up, as the
   * streaming parser does on close events.
   * @param node current node
   * @param gl true inside a journal, transaction or line
   * @param captured true inside any other record
   * @param journal open journal or null
   * @param voucher open voucher or null
   */
  private void walk(XmlNode node, boolean gl, boolean captured, JournalAccumulator journal,
      VoucherAccumulator voucher) {
    String tag = node.getName();
    RecordKind kind = recordKind(tag, gl, captured, voucher);
    boolean childGl = gl;
    boolean childCaptured = captured;
    JournalAccumulator childJournal = journal;
    VoucherAccumulator childVoucher = voucher;
    if (kind == RecordKind.JOURNAL) {
      childGl = true;
      childJournal = emitter.openJournal();
      emitter.describeJournal(childJournal, node.copyExcluding(isTransaction));
    } else if (kind == RecordKind.TRANSACTION) {
      childGl = true;
      childVoucher = emitter.openVoucher(journal);
      emitter.describeVoucher(childVoucher, node.copyExcluding(isLineOrTransaction));
    } else if (kind == RecordKind.LINE) {
      childGl = true;
    } else if (kind != null) {
      childCaptured = true;
    }

    ancestors.push(tag);
    for (XmlNode child : node.getChildren()) {
      walk(child, childGl, childCaptured, childJournal, childVoucher);
    }
    ancestors.pop();

    stats.incrementEvents();
    if (!vocabulary.isKnown(tag)) {
      emitter.unknownElement(nearestSection(), tag);
    }
    if (emitter.isWriteRaw()) {
      emitter.raw(path(tag), node);
    }
    if (kind != null) {
      emit(kind, node, voucher, childJournal, childVoucher);
    }
  }

  /**
   * Record kind of an element in its context; null where it is payload.
   */
  private RecordKind recordKind(String tag, boolean gl, boolean captured,
      VoucherAccumulator voucher) {
    if (captured) {
      return null;
    }
    RecordKind kind = vocabulary.recordKind(tag);
    if (kind == null || kind == RecordKind.ANALYSIS) {
      return null;
    }
    if (!gl) {
      return kind;
    }
    switch (kind) {
      case TRANSACTION:
      case LINE:
        return kind;
      case JOURNAL:
        return voucher == null ? kind : null;
      default:
        return null;
    }
  }

  private void emit(RecordKind kind, XmlNode node, VoucherAccumulator voucher,
      JournalAccumulator ownJournal, VoucherAccumulator ownVoucher) {
    switch (kind) {
      case HEADER:
        emitter.header(node);
        break;
      case ACCOUNT:
        emitter.account(node);
        break;
      case TAX_TABLE_ENTRY:
        emitter.taxEntry(node);
        break;
      case CUSTOMER:
      case SUPPLIER:
        emitter.party(kind, node);
        break;
      case INVOICE:
        emitter.invoice(node, invoiceSection());
        break;
      case LINE:
        emitter.line(node.copyExcluding(isLine), voucher);
        break;
      case TRANSACTION:
        emitter.closeVoucher(ownVoucher);
        break;
      case JOURNAL:
        emitter.closeJournal(ownJournal);
        break;
      default:
        break;
    }
  }

  private String nearestSection() {
    for (String name : ancestors) {
      if (vocabulary.isSection(name)) {
        return name;
      }
    }
    return null;
  }

  private Boolean invoiceSection() {
    for (String name : ancestors) {
      if (vocabulary.isSalesInvoiceParent(name)) {
        return Boolean.TRUE;
      }
      if (vocabulary.isPurchaseInvoiceParent(name)) {
        return Boolean.FALSE;
      }
    }
    return null;
  }

  private String path(String tag) {
    StringBuilder sb = new StringBuilder();
    Iterator<String> it = ancestors.descendingIterator();
    while (it.hasNext()) {
      sb.append(it.next()).append('/');
    }
    return sb.append(tag).toString();
  }
}
