package org.auditfile.ingest.stream;

import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Predicate;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.auditfile.ingest.StreamingTraversalException;
import org.auditfile.ingest.emit.JournalAccumulator;
import org.auditfile.ingest.emit.RecordEmitter;
import org.auditfile.ingest.emit.VoucherAccumulator;
import org.auditfile.ingest.field.RecordKind;
import org.auditfile.ingest.field.Vocabulary;
import org.auditfile.ingest.progress.IngestStats;
import org.auditfile.ingest.progress.ProgressChannel;
import org.auditfile.ingest.xml.XmlNode;
import org.auditfile.util.readstream.XmlEventCursor;

/**
 * Single pass over the parse events of a document.
 *
 * <p>Only the chain of open elements is kept, plus the payload below the record being
 * read. A line is dropped from its voucher as soon as it has been emitted, and a
 * voucher from its journal, so memory follows nesting depth and record size rather
 * than document size.
 */
public class StreamingIngester {
  private static final Logger log = LogManager.getLogger(StreamingIngester.class);

  private final Vocabulary vocabulary;
  private final RecordEmitter emitter;
  private final ProgressChannel progress;
  private final IngestStats stats;
  private final Predicate<XmlNode> isLine;
  private final Predicate<XmlNode> isTransaction;
  private final Deque<Frame> stack = new ArrayDeque<>();

  private JournalAccumulator journal;
  private XmlNode journalNode;
  private VoucherAccumulator voucher;
  private XmlNode voucherNode;
  private long liveNodes;

  private static final class Frame {
    final XmlNode node;
    final TraversalState state;
    final RecordKind record;
    final boolean attached;

    Frame(XmlNode node, TraversalState state, RecordKind record, boolean attached) {
      this.node = node;
      this.state = state;
      this.record = record;
      this.attached = attached;
    }
  }

  /**
   * Create ingester for one run.
   * @param vocabulary tag vocabulary
   * @param emitter emitter, sinks open
   * @param progress progress channel of the run
   * @param stats counters of the run
   */
  public StreamingIngester(Vocabulary vocabulary, RecordEmitter emitter,
      ProgressChannel progress, IngestStats stats) {
    this.vocabulary = vocabulary;
    this.emitter = emitter;
    this.progress = progress;
    this.stats = stats;
    Set<String> lineTags = vocabulary.tags(RecordKind.LINE);
    Set<String> transactionTags = vocabulary.tags(RecordKind.TRANSACTION);
    this.isLine = n -> lineTags.contains(n.getName());
    this.isTransaction = n -> transactionTags.contains(n.getName());
  }

  /**
   * Walk the document.
   * @param in document bytes
   * @return true if the run was stopped by the progress channel; false if it completed
   * @throws StreamingTraversalException on any failure
   */
  public boolean run(InputStream in) {
    XmlEventCursor cursor = new XmlEventCursor(in);
    try {
      XMLStreamReader reader;
      while ((reader = cursor.next()) != null) {
        switch (reader.getEventType()) {
          case XMLStreamConstants.START_ELEMENT:
            open(XmlNode.fromStartElement(reader));
            break;
          case XMLStreamConstants.CHARACTERS:
          case XMLStreamConstants.CDATA:
          case XMLStreamConstants.SPACE:
            if (!stack.isEmpty()) {
              stack.peek().node.appendText(reader.getText());
            }
            break;
          case XMLStreamConstants.END_ELEMENT:
            close();
            if (progress.element()) {
              log.warn("Stopped after {} elements ({} bytes read)", stats.events(),
                  cursor.getBytesRead());
              return true;
            }
            break;
          default:
            break;
        }
      }
    } catch (StreamingTraversalException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StreamingTraversalException("Failed after " + stats.events() + " elements: "
          + e.getMessage(), e);
    }
    if (!stack.isEmpty()) {
      throw new StreamingTraversalException("Document ended inside <"
          + stack.peek().node.getName() + ">");
    }
    log.debug("Read {} bytes, peak {} retained nodes", cursor.getBytesRead(),
        stats.peakRetainedNodes());
    return false;
  }

  private void open(XmlNode node) {
    Frame parent = stack.peek();
    TraversalState parentState = parent == null ? TraversalState.IDLE : parent.state;
    String tag = node.getName();
    RecordKind kind = vocabulary.recordKind(tag);
    TraversalState state = parentState.enter(kind, tag);
    RecordKind record = state != parentState ? kind : null;
    boolean attached = parent != null && parentState.isCapturing();
    if (attached) {
      parent.node.addChild(node);
    }
    if (record == RecordKind.JOURNAL) {
      journal = emitter.openJournal();
      journalNode = node;
    } else if (record == RecordKind.TRANSACTION) {
      if (journal != null && !journal.isDescribed()) {
        emitter.describeJournal(journal, journalNode.copyExcluding(isTransaction));
      }
      voucher = emitter.openVoucher(journal);
      voucherNode = node;
    }
    stack.push(new Frame(node, state, record, attached));
    liveNodes++;
    stats.retained(liveNodes);
  }

  private void close() {
    Frame frame = stack.pop();
    XmlNode node = frame.node;
    String tag = node.getName();
    if (!vocabulary.isKnown(tag)) {
      emitter.unknownElement(nearestSection(), tag);
    }
    if (emitter.isWriteRaw()) {
      emitter.raw(path(tag), node);
    }
    if (frame.record != null) {
      closeRecord(frame);
    }
    Frame parent = stack.peek();
    boolean consumed = frame.record != null && frame.record != RecordKind.ANALYSIS;
    if (frame.attached && consumed) {
      parent.node.removeLastChild();
    }
    if (!frame.attached || consumed) {
      liveNodes -= node.size();
    }
  }

  private void closeRecord(Frame frame) {
    XmlNode node = frame.node;
    switch (frame.record) {
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
        emitter.party(frame.record, node);
        break;
      case INVOICE:
        emitter.invoice(node, invoiceSection());
        break;
      case LINE:
        if (!voucher.isDescribed()) {
          emitter.describeVoucher(voucher, voucherNode.copyExcluding(isLine));
        }
        emitter.line(node, voucher);
        break;
      case TRANSACTION:
        emitter.describeVoucher(voucher, node.copyExcluding(isLine));
        emitter.closeVoucher(voucher);
        voucher = null;
        voucherNode = null;
        break;
      case JOURNAL:
        emitter.describeJournal(journal, node.copyExcluding(isTransaction));
        emitter.closeJournal(journal);
        journal = null;
        journalNode = null;
        break;
      default:
        break;
    }
  }

  private String nearestSection() {
    for (Frame f : stack) {
      if (vocabulary.isSection(f.node.getName())) {
        return f.node.getName();
      }
    }
    return null;
  }

  private Boolean invoiceSection() {
    for (Frame f : stack) {
      String name = f.node.getName();
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
    Iterator<Frame> it = stack.descendingIterator();
    while (it.hasNext()) {
      sb.append(it.next().node.getName()).append('/');
    }
    return sb.append(tag).toString();
  }

  /**
   * Nodes currently held.
   * @return node count
   */
  long getLiveNodes() {
    return liveNodes;
  }
}
