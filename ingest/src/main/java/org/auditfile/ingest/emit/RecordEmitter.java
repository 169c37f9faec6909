package org.auditfile.ingest.emit;

import io.vertx.core.json.JsonObject;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.auditfile.ingest.field.FieldResolver;
import org.auditfile.ingest.field.RecordKind;
import org.auditfile.ingest.field.Vocabulary;
import org.auditfile.ingest.integrity.RejectedRecord;
import org.auditfile.ingest.integrity.UnbalancedVoucher;
import org.auditfile.ingest.progress.IngestStats;
import org.auditfile.ingest.sink.EntityKind;
import org.auditfile.ingest.sink.Row;
import org.auditfile.ingest.sink.RowSink;
import org.auditfile.ingest.sink.SinkTarget;
import org.auditfile.ingest.xml.XmlNode;
import org.auditfile.util.AccountIds;
import org.auditfile.util.amount.AmountNormalizer;
import org.auditfile.util.amount.SignedAmount;

/**
 * Turns resolved record elements into table rows.
 *
 * <p>Both parsing paths drive the same emitter, which owns the run-scoped lookups
 * (accounts, customers, suppliers) used for back-filling and the aggregates the
 * integrity checks read once the run is over. One emitter serves exactly one run.
 */
public class RecordEmitter implements Closeable {
  private static final Logger log = LogManager.getLogger(RecordEmitter.class);

  public static final String SOURCE_GL = "GL";
  public static final String SOURCE_ORPHAN = "ORPHAN";
  static final String NO_SECTION = "(root)";

  private final SinkTarget target;
  private final Vocabulary vocabulary;
  private final FieldResolver resolver;
  private final IngestStats stats;
  private final boolean writeRaw;
  private final int rawTextMax;
  private final Map<EntityKind, RowSink> sinks = new EnumMap<>(EntityKind.class);

  private final Map<String, String> accountDescriptions = new HashMap<>();
  private final Map<String, PartyInfo> customers = new HashMap<>();
  private final Map<String, PartyInfo> suppliers = new HashMap<>();
  private String headerCurrency = "";

  private final Set<String> lineAccounts = new LinkedHashSet<>();
  private final Set<String> declaredAccounts = new LinkedHashSet<>();
  private final List<UnbalancedVoucher> unbalanced = new ArrayList<>();
  private final List<RejectedRecord> rejected = new ArrayList<>();
  private final Map<String, Map<String, Long>> census = new TreeMap<>();

  /**
   * Create emitter.
   * @param target where the tables go
   * @param vocabulary tag vocabulary
   * @param resolver field resolver
   * @param stats counters of the run
   * @param writeRaw whether to write the raw element table
   * @param rawTextMax maximum characters of element text in the raw element table
   */
  public RecordEmitter(SinkTarget target, Vocabulary vocabulary, FieldResolver resolver,
      IngestStats stats, boolean writeRaw, int rawTextMax) {
    this.target = target;
    this.vocabulary = vocabulary;
    this.resolver = resolver;
    this.stats = stats;
    this.writeRaw = writeRaw;
    this.rawTextMax = rawTextMax;
  }

  /**
   * Open every entity table so that each exists, possibly empty, once the run is over.
   * @throws IOException on failure to create a table
   */
  public void open() throws IOException {
    for (EntityKind kind : EntityKind.values()) {
      if (kind.isDiagnostic() || (kind == EntityKind.RAW_ELEMENT && !writeRaw)) {
        continue;
      }
      sinks.put(kind, target.open(kind));
    }
  }

  @Override
  public void close() throws IOException {
    IOException first = null;
    for (RowSink sink : sinks.values()) {
      try {
        sink.close();
      } catch (IOException e) {
        if (first == null) {
          first = e;
        }
      }
    }
    sinks.clear();
    if (first != null) {
      throw first;
    }
  }

  private void write(Row row) {
    RowSink sink = sinks.get(row.getKind());
    if (sink == null) {
      throw new IllegalStateException("Table not open: " + row.getKind().getTableName());
    }
    try {
      sink.write(row.values());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    stats.incrementRows(row.getKind());
  }

  private void timed(String phase, long start) {
    stats.addPhase(phase, System.nanoTime() - start);
  }

  private String text(XmlNode node, String field) {
    return resolver.textOrEmpty(node, field);
  }

  private static String plain(BigDecimal value) {
    return value == null ? "" : value.toPlainString();
  }

  private String amountText(XmlNode node, String field) {
    return resolver.amountOrZero(node, field).toPlainString();
  }

  private static String firstNonEmpty(String... values) {
    for (String v : values) {
      if (v != null && !v.isEmpty()) {
        return v;
      }
    }
    return "";
  }

  /**
   * Emit the header row.
   * @param header header element
   */
  public void header(XmlNode header) {
    long t0 = System.nanoTime();
    Row row = new Row(EntityKind.HEADER);
    for (String column : EntityKind.HEADER.getColumns()) {
      row.set(column, text(header, column));
    }
    headerCurrency = firstNonEmpty(row.get("DefaultCurrencyCode"), row.get("FunctionalCurrency"));
    write(row);
    timed("header", t0);
  }

  /**
   * Emit an account row and register the account for look-ups.
   * @param account account element
   */
  public void account(XmlNode account) {
    long t0 = System.nanoTime();
    String id = AccountIds.canonical(resolver.text(account, "AccountID"));
    if (id.isEmpty()) {
      reject(EntityKind.ACCOUNT, "", "", "no AccountID");
      timed("account", t0);
      return;
    }
    String description = text(account, "AccountDescription");
    declaredAccounts.add(id);
    accountDescriptions.put(id, description);
    write(new Row(EntityKind.ACCOUNT)
        .set("AccountID", id)
        .set("AccountDescription", description)
        .set("AccountType", text(account, "AccountType"))
        .set("ParentAccountID", AccountIds.canonical(resolver.text(account, "ParentAccountID")))
        .set("StandardAccountID", text(account, "StandardAccountID"))
        .set("GroupingCategory", text(account, "GroupingCategory"))
        .set("GroupingCode", text(account, "GroupingCode"))
        .set("OpeningDebit", amountText(account, "OpeningDebitBalance"))
        .set("OpeningCredit", amountText(account, "OpeningCreditBalance"))
        .set("ClosingDebit", amountText(account, "ClosingDebitBalance"))
        .set("ClosingCredit", amountText(account, "ClosingCreditBalance"))
        .set("TaxCode", text(account, "TaxCode"))
        .set("TaxType", text(account, "TaxType")));
    timed("account", t0);
  }

  /**
   * Emit tax table rows: one per code detail, or one for the entry when it has none.
   * @param entry tax table entry element
   */
  public void taxEntry(XmlNode entry) {
    long t0 = System.nanoTime();
    String taxType = text(entry, "TaxType");
    String entryDescription = text(entry, "TaxDescription");
    String entryRegion = text(entry, "TaxCountryRegion");
    List<XmlNode> details = FieldResolver.findAll(entry, vocabulary.getTaxCodeDetailsTags());
    if (details.isEmpty()) {
      details = Collections.singletonList(entry);
    }
    for (XmlNode detail : details) {
      write(new Row(EntityKind.TAX_TABLE)
          .set("TaxType", taxType)
          .set("TaxCode", text(detail, "TaxCode"))
          .set("StandardTaxCode", text(detail, "StandardTaxCode"))
          .set("TaxPercentage", text(detail, "TaxPercentage"))
          .set("TaxCountryRegion", firstNonEmpty(text(detail, "TaxCountryRegion"), entryRegion))
          .set("Description", firstNonEmpty(text(detail, "TaxDescription"), entryDescription)));
    }
    timed("tax", t0);
  }

  /**
   * Emit a customer or supplier row with its control account links.
   * @param kind {@link RecordKind#CUSTOMER} or {@link RecordKind#SUPPLIER}
   * @param party party element
   */
  public void party(RecordKind kind, XmlNode party) {
    long t0 = System.nanoTime();
    boolean customer = kind == RecordKind.CUSTOMER;
    EntityKind entity = customer ? EntityKind.CUSTOMER : EntityKind.SUPPLIER;
    String id = text(party, customer ? "PartyCustomerID" : "PartySupplierID");
    if (id.isEmpty()) {
      reject(entity, "", "", "no party ID");
      timed("party", t0);
      return;
    }
    String name = text(party, "PartyName");
    String vat = text(party, "VATNumber");
    String partyType = customer ? "Customer" : "Supplier";

    String control = "";
    for (XmlNode link : balanceAccounts(party)) {
      String accountId = AccountIds.canonical(resolver.text(link, "AccountID"));
      if (accountId.isEmpty()) {
        continue;
      }
      if (control.isEmpty()) {
        control = accountId;
      }
      write(new Row(EntityKind.CONTROL_ACCOUNT_LINK)
          .set("PartyType", partyType)
          .set("PartyID", id)
          .set("AccountID", accountId)
          .set("OpeningDebit", amountText(link, "OpeningDebitBalance"))
          .set("OpeningCredit", amountText(link, "OpeningCreditBalance"))
          .set("ClosingDebit", amountText(link, "ClosingDebitBalance"))
          .set("ClosingCredit", amountText(link, "ClosingCreditBalance")));
    }
    if (control.isEmpty()) {
      control = AccountIds.canonical(resolver.text(party, "AccountID"));
      if (!control.isEmpty()) {
        write(new Row(EntityKind.CONTROL_ACCOUNT_LINK)
            .set("PartyType", partyType)
            .set("PartyID", id)
            .set("AccountID", control)
            .set("OpeningDebit", amountText(party, "OpeningDebitBalance"))
            .set("OpeningCredit", amountText(party, "OpeningCreditBalance"))
            .set("ClosingDebit", amountText(party, "ClosingDebitBalance"))
            .set("ClosingCredit", amountText(party, "ClosingCreditBalance")));
      }
    }
    (customer ? customers : suppliers).put(id, new PartyInfo(name, vat, control));
    write(new Row(entity)
        .set(customer ? "CustomerID" : "SupplierID", id)
        .set("Name", name)
        .set("RegistrationNumber", text(party, "RegistrationNumber"))
        .set("VATNumber", vat)
        .set("Country", text(party, "Country"))
        .set("City", text(party, "City"))
        .set("PostalCode", text(party, "PostalCode"))
        .set("Email", text(party, "Email"))
        .set("Telephone", text(party, "Telephone"))
        .set("ControlAccountID", control));
    timed("party", t0);
  }

  /**
   * Innermost balance account structures of a party, in document order.
   */
  private List<XmlNode> balanceAccounts(XmlNode party) {
    List<XmlNode> result = new ArrayList<>();
    for (XmlNode match : FieldResolver.findAll(party, vocabulary.getBalanceAccountTags())) {
      List<XmlNode> inner = balanceAccounts(match);
      if (inner.isEmpty()) {
        result.add(match);
      } else {
        result.addAll(inner);
      }
    }
    return result;
  }

  /**
   * Emit a sales or purchase invoice row followed by the analysis lines found in it.
   * @param invoice invoice element
   * @param sales TRUE below a sales invoice section, FALSE below a purchase invoice section,
   *     null when the section is not known
   */
  public void invoice(XmlNode invoice, Boolean sales) {
    long t0 = System.nanoTime();
    String customerId = text(invoice, "CustomerID");
    String supplierId = text(invoice, "SupplierID");
    boolean isSales = sales != null ? sales : !customerId.isEmpty() || supplierId.isEmpty();
    EntityKind entity = isSales ? EntityKind.SALES_INVOICE : EntityKind.PURCHASE_INVOICE;
    String partyId = isSales ? customerId : supplierId;
    PartyInfo info = (isSales ? customers : suppliers).get(partyId);
    String prefix = isSales ? "Customer" : "Supplier";
    write(new Row(entity)
        .set("InvoiceNo", text(invoice, "InvoiceNo"))
        .set("InvoiceDate", text(invoice, "InvoiceDate"))
        .set("TaxPointDate", text(invoice, "TaxPointDate"))
        .set("GLPostingDate", text(invoice, "GLPostingDate"))
        .set(prefix + "ID", partyId)
        .set(prefix + "Name", firstNonEmpty(info == null ? null : info.name,
            text(invoice, "InvoicePartyName")))
        .set(prefix + "VATNumber", firstNonEmpty(info == null ? null : info.vatNumber,
            text(invoice, "VATNumber")))
        .set("CurrencyCode", firstNonEmpty(text(invoice, "CurrencyCode"), headerCurrency))
        .set("NetTotal", plain(resolver.amount(invoice, "NetTotal")))
        .set("TaxPayable", plain(resolver.amount(invoice, "TaxPayable")))
        .set("GrossTotal", plain(resolver.amount(invoice, "GrossTotal")))
        .set("SourceID", text(invoice, "SourceID"))
        .set("DocumentNumber", text(invoice, "DocumentNumber"))
        .set("DueDate", text(invoice, "DueDate")));
    timed("invoice", t0);

    // analysis rows of an invoice carry the invoice number in the VoucherID column
    String invoiceNo = text(invoice, "InvoiceNo");
    Set<String> lineTags = vocabulary.tags(RecordKind.LINE);
    Set<String> analysisTags = vocabulary.tags(RecordKind.ANALYSIS);
    for (XmlNode line : FieldResolver.findAll(invoice, lineTags)) {
      String lineNo = text(line.copyExcluding(n -> analysisTags.contains(n.getName())),
          "RecordID");
      for (XmlNode analysis : FieldResolver.findAll(line, analysisTags)) {
        analysis(analysis, lineNo, invoiceNo);
      }
    }
    XmlNode outsideLines = invoice.copyExcluding(n -> lineTags.contains(n.getName()));
    for (XmlNode analysis : FieldResolver.findAll(outsideLines, analysisTags)) {
      analysis(analysis, "", invoiceNo);
    }
  }

  public JournalAccumulator openJournal() {
    return new JournalAccumulator();
  }

  /**
   * Resolve the journal's own fields.
   * @param journal open journal
   * @param header journal element without its transactions
   */
  public void describeJournal(JournalAccumulator journal, XmlNode header) {
    journal.journalId = text(header, "JournalID");
    journal.description = text(header, "JournalDescription");
    journal.type = text(header, "JournalType");
    journal.described = true;
  }

  /**
   * Emit the journal row.
   * @param journal journal whose element closed
   */
  public void closeJournal(JournalAccumulator journal) {
    long t0 = System.nanoTime();
    write(new Row(EntityKind.JOURNAL)
        .set("JournalID", journal.journalId)
        .set("Description", journal.description)
        .set("Type", journal.type)
        .set("TotalDebit", journal.debit.toPlainString())
        .set("TotalCredit", journal.credit.toPlainString()));
    timed("journal", t0);
  }

  /**
   * Start a voucher.
   * @param journal enclosing journal; null if the voucher is not inside one
   * @return accumulator with zero totals
   */
  public VoucherAccumulator openVoucher(JournalAccumulator journal) {
    return new VoucherAccumulator(journal);
  }

  /**
   * Resolve the voucher's own fields.
   * @param voucher open voucher
   * @param header transaction element without its lines
   */
  public void describeVoucher(VoucherAccumulator voucher, XmlNode header) {
    voucher.voucherId = text(header, "VoucherID");
    voucher.voucherNo = firstNonEmpty(text(header, "VoucherNo"), voucher.voucherId);
    voucher.journalId = firstNonEmpty(text(header, "VoucherJournalID"),
        voucher.journal == null ? null : voucher.journal.journalId);
    voucher.transactionDate = text(header, "TransactionDate");
    voucher.postingDate = text(header, "PostingDate");
    voucher.period = text(header, "Period");
    voucher.year = text(header, "Year");
    voucher.sourceDocumentId = text(header, "SourceDocumentID");
    voucher.currencyCode = text(header, "CurrencyCode");
    voucher.voucherType = text(header, "VoucherType");
    voucher.description = text(header, "VoucherDescription");
    voucher.modificationDate = text(header, "ModificationDate");
    voucher.systemId = text(header, "SystemID");
    voucher.batchId = text(header, "BatchID");
    voucher.described = true;
  }

  /**
   * Emit the voucher row and note it if it does not balance.
   * @param voucher voucher whose element closed
   */
  public void closeVoucher(VoucherAccumulator voucher) {
    long t0 = System.nanoTime();
    boolean balanced = voucher.isBalanced();
    write(new Row(EntityKind.VOUCHER)
        .set("VoucherID", voucher.voucherId)
        .set("VoucherNo", voucher.voucherNo)
        .set("JournalID", voucher.journalId)
        .set("TransactionDate", voucher.transactionDate)
        .set("PostingDate", voucher.postingDate)
        .set("Period", voucher.period)
        .set("Year", voucher.year)
        .set("SourceDocumentID", voucher.sourceDocumentId)
        .set("CurrencyCode", voucher.currencyCode)
        .set("VoucherType", voucher.voucherType)
        .set("VoucherDescription", voucher.description)
        .set("ModificationDate", voucher.modificationDate)
        .set("LineCount", voucher.lineCount)
        .set("DebitTotal", voucher.debit.toPlainString())
        .set("CreditTotal", voucher.credit.toPlainString())
        .set("Balanced", balanced));
    if (!balanced) {
      unbalanced.add(new UnbalancedVoucher(voucher.voucherId, voucher.voucherNo,
          voucher.journalId, voucher.debit, voucher.credit));
    }
    timed("voucher", t0);
  }

  /**
   * Emit a transaction line followed by its analysis lines.
   * @param line line element, analysis children included
   * @param voucher owning voucher; null for a line found outside any voucher
   */
  public void line(XmlNode line, VoucherAccumulator voucher) {
    long t0 = System.nanoTime();
    Set<String> analysisTags = vocabulary.tags(RecordKind.ANALYSIS);
    List<XmlNode> analyses = FieldResolver.findAll(line, analysisTags);
    XmlNode scope = analyses.isEmpty()
        ? line : line.copyExcluding(n -> analysisTags.contains(n.getName()));
    String voucherId = voucher == null ? "" : voucher.voucherId;
    String recordId = text(scope, "RecordID");

    String debitText = resolver.ownText(scope, "DebitAmount");
    String creditText = resolver.ownText(scope, "CreditAmount");
    String amountText = resolver.ownText(scope, "LineAmount");
    Optional<SignedAmount> derived = SignedAmount.derive(
        AmountNormalizer.parseOrNull(debitText),
        AmountNormalizer.parseOrNull(creditText),
        AmountNormalizer.parseOrNull(amountText),
        resolver.ownText(scope, "DebitCreditIndicator"));
    if (derived.isEmpty()) {
      reject(EntityKind.TRANSACTION_LINE, voucherId, recordId,
          debitText == null && creditText == null && amountText == null
              ? "no amount" : "malformed amount");
      timed("line", t0);
      return;
    }
    SignedAmount signed = derived.get();

    String customerId = text(scope, "CustomerID");
    String supplierId = text(scope, "SupplierID");
    PartyInfo customer = customers.get(customerId);
    PartyInfo supplier = suppliers.get(supplierId);
    String accountId = AccountIds.canonical(resolver.text(scope, "AccountID"));
    if (accountId.isEmpty()) {
      accountId = firstNonEmpty(customer == null ? null : customer.controlAccount,
          supplier == null ? null : supplier.controlAccount, AccountIds.SENTINEL);
    }
    if (!AccountIds.SENTINEL.equals(accountId)) {
      lineAccounts.add(accountId);
    }
    if (voucher != null) {
      voucher.add(signed.getDebit(), signed.getCredit());
    }
    VoucherAccumulator v = voucher == null ? new VoucherAccumulator(null) : voucher;

    write(new Row(EntityKind.TRANSACTION_LINE)
        .set("RecordID", recordId)
        .set("VoucherID", v.voucherId)
        .set("VoucherNo", v.voucherNo)
        .set("JournalID", v.journalId)
        .set("TransactionDate", v.transactionDate)
        .set("PostingDate", v.postingDate)
        .set("Period", v.period)
        .set("Year", v.year)
        .set("SystemID", firstNonEmpty(text(scope, "SystemID"), v.systemId))
        .set("BatchID", firstNonEmpty(text(scope, "BatchID"), v.batchId))
        .set("DocumentNumber", text(scope, "DocumentNumber"))
        .set("SourceDocumentID", firstNonEmpty(text(scope, "LineSourceDocumentID"),
            v.sourceDocumentId))
        .set("AccountID", accountId)
        .set("AccountDescription", accountDescriptions.getOrDefault(accountId, ""))
        .set("CustomerID", customerId)
        .set("CustomerName", customer == null ? "" : customer.name)
        .set("CustomerVATNumber", customer == null ? "" : customer.vatNumber)
        .set("SupplierID", supplierId)
        .set("SupplierName", supplier == null ? "" : supplier.name)
        .set("SupplierVATNumber", supplier == null ? "" : supplier.vatNumber)
        .set("Description", firstNonEmpty(text(scope, "LineDescription"), v.description))
        .set("Debit", signed.getDebit().toPlainString())
        .set("Credit", signed.getCredit().toPlainString())
        .set("Amount", signed.getAmount().toPlainString())
        .set("AmountEncoding", signed.getEncoding())
        .set("CurrencyCode", firstNonEmpty(text(scope, "CurrencyCode"), v.currencyCode,
            headerCurrency))
        .set("AmountCurrency", text(scope, "AmountCurrency"))
        .set("ExchangeRate", text(scope, "ExchangeRate"))
        .set("TaxType", text(scope, "TaxType"))
        .set("TaxCountryRegion", text(scope, "TaxCountryRegion"))
        .set("TaxCode", text(scope, "TaxCode"))
        .set("TaxPercentage", text(scope, "TaxPercentage"))
        .set("DebitTaxAmount", plain(resolver.amount(scope, "DebitTaxAmount")))
        .set("CreditTaxAmount", plain(resolver.amount(scope, "CreditTaxAmount")))
        .set("TaxAmount", plain(resolver.amount(scope, "TaxAmount")))
        .set("IsGL", voucher != null)
        .set("SourceType", voucher != null ? SOURCE_GL : SOURCE_ORPHAN));
    timed("line", t0);

    for (XmlNode analysis : analyses) {
      analysis(analysis, recordId, voucherId);
    }
  }

  private void analysis(XmlNode analysis, String recordId, String voucherId) {
    long t0 = System.nanoTime();
    BigDecimal amount = resolver.amount(analysis, "AnalysisAmount");
    if (amount == null) {
      BigDecimal debit = resolver.amount(analysis, "DebitAnalysisAmount");
      BigDecimal credit = resolver.amount(analysis, "CreditAnalysisAmount");
      if (debit != null || credit != null) {
        amount = SignedAmount.fromPair(debit, credit).getAmount();
      }
    }
    write(new Row(EntityKind.ANALYSIS_LINE)
        .set("RecordID", recordId)
        .set("VoucherID", voucherId)
        .set("AnalysisType", text(analysis, "AnalysisType"))
        .set("AnalysisID", text(analysis, "AnalysisID"))
        .set("Amount", plain(amount)));
    timed("analysis", t0);
  }

  /**
   * Count an element that is not in the vocabulary.
   * @param section nearest enclosing section tag; null if none
   * @param tag local name of the element
   */
  public void unknownElement(String section, String tag) {
    census.computeIfAbsent(section == null ? NO_SECTION : section, k -> new TreeMap<>())
        .merge(tag, 1L, Long::sum);
  }

  /**
   * Write one raw element row, when the raw table is enabled.
   * @param path slash-joined names from the root down to the element
   * @param node the element
   */
  public void raw(String path, XmlNode node) {
    if (!writeRaw) {
      return;
    }
    long t0 = System.nanoTime();
    String text = node.getText();
    if (text.length() > rawTextMax) {
      text = text.substring(0, rawTextMax);
    }
    JsonObject attributes = new JsonObject();
    node.getAttributes().forEach(attributes::put);
    write(new Row(EntityKind.RAW_ELEMENT)
        .set("Path", path)
        .set("Tag", node.getName())
        .set("Text", text)
        .set("Attributes", attributes.encode()));
    timed("raw", t0);
  }

  private void reject(EntityKind entity, String voucherId, String recordId, String reason) {
    log.warn("Rejected {} record (voucher '{}', record '{}'): {}", entity.getTableName(),
        voucherId, recordId, reason);
    rejected.add(new RejectedRecord(entity, voucherId, recordId, reason));
  }

  public boolean isWriteRaw() {
    return writeRaw;
  }

  public Set<String> getLineAccounts() {
    return Collections.unmodifiableSet(lineAccounts);
  }

  public Set<String> getDeclaredAccounts() {
    return Collections.unmodifiableSet(declaredAccounts);
  }

  public List<UnbalancedVoucher> getUnbalancedVouchers() {
    return Collections.unmodifiableList(unbalanced);
  }

  public List<RejectedRecord> getRejectedRecords() {
    return Collections.unmodifiableList(rejected);
  }

  /**
   * Unknown element counts.
   * @return section to tag to count
   */
  public Map<String, Map<String, Long>> getCensus() {
    return Collections.unmodifiableMap(census);
  }

  static final class PartyInfo {
    final String name;
    final String vatNumber;
    final String controlAccount;

    PartyInfo(String name, String vatNumber, String controlAccount) {
      this.name = name;
      this.vatNumber = vatNumber;
      this.controlAccount = controlAccount;
    }
  }
}
