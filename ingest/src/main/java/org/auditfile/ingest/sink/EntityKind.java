package org.auditfile.ingest.sink;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Output tables with their fixed column order. Consumers find a table by
 * {@link #getTableName()}.
 */
public enum EntityKind {
  HEADER("header", "CompanyName", "CompanyID", "FunctionalCurrency", "DefaultCurrencyCode",
      "FileCreationDate", "AuditFileVersion", "SelectionStart", "SelectionEnd", "PeriodStart",
      "PeriodStartYear", "PeriodEnd", "PeriodEndYear", "SoftwareCompanyName", "SoftwareID",
      "SoftwareVersion", "SoftwareCertificateNumber", "TaxAccountingBasis"),
  ACCOUNT("account", "AccountID", "AccountDescription", "AccountType", "ParentAccountID",
      "StandardAccountID", "GroupingCategory", "GroupingCode", "OpeningDebit", "OpeningCredit",
      "ClosingDebit", "ClosingCredit", "TaxCode", "TaxType"),
  TAX_TABLE("tax_table", "TaxType", "TaxCode", "StandardTaxCode", "TaxPercentage",
      "TaxCountryRegion", "Description"),
  CUSTOMER("customer", "CustomerID", "Name", "RegistrationNumber", "VATNumber", "Country",
      "City", "PostalCode", "Email", "Telephone", "ControlAccountID"),
  SUPPLIER("supplier", "SupplierID", "Name", "RegistrationNumber", "VATNumber", "Country",
      "City", "PostalCode", "Email", "Telephone", "ControlAccountID"),
  CONTROL_ACCOUNT_LINK("control_account_link", "PartyType", "PartyID", "AccountID",
      "OpeningDebit", "OpeningCredit", "ClosingDebit", "ClosingCredit"),
  JOURNAL("journal", "JournalID", "Description", "Type", "TotalDebit", "TotalCredit"),
  VOUCHER("voucher", "VoucherID", "VoucherNo", "JournalID", "TransactionDate", "PostingDate",
      "Period", "Year", "SourceDocumentID", "CurrencyCode", "VoucherType", "VoucherDescription",
      "ModificationDate", "LineCount", "DebitTotal", "CreditTotal", "Balanced"),
  TRANSACTION_LINE("transaction_line", "RecordID", "VoucherID", "VoucherNo", "JournalID",
      "TransactionDate", "PostingDate", "Period", "Year", "SystemID", "BatchID",
      "DocumentNumber", "SourceDocumentID", "AccountID", "AccountDescription", "CustomerID",
      "CustomerName", "CustomerVATNumber", "SupplierID", "SupplierName", "SupplierVATNumber",
      "Description", "Debit", "Credit", "Amount", "AmountEncoding", "CurrencyCode",
      "AmountCurrency", "ExchangeRate", "TaxType", "TaxCountryRegion", "TaxCode",
      "TaxPercentage", "DebitTaxAmount", "CreditTaxAmount", "TaxAmount", "IsGL", "SourceType"),
  ANALYSIS_LINE("analysis_line", "RecordID", "VoucherID", "AnalysisType", "AnalysisID",
      "Amount"),
  SALES_INVOICE("sales_invoice", "InvoiceNo", "InvoiceDate", "TaxPointDate", "GLPostingDate",
      "CustomerID", "CustomerName", "CustomerVATNumber", "CurrencyCode", "NetTotal",
      "TaxPayable", "GrossTotal", "SourceID", "DocumentNumber", "DueDate"),
  PURCHASE_INVOICE("purchase_invoice", "InvoiceNo", "InvoiceDate", "TaxPointDate",
      "GLPostingDate", "SupplierID", "SupplierName", "SupplierVATNumber", "CurrencyCode",
      "NetTotal", "TaxPayable", "GrossTotal", "SourceID", "DocumentNumber", "DueDate"),
  RAW_ELEMENT("raw_element", "Path", "Tag", "Text", "Attributes"),
  MISSING_ACCOUNT("missing_account", "AccountID"),
  UNBALANCED_VOUCHER("unbalanced_voucher", "VoucherID", "VoucherNo", "JournalID",
      "DebitTotal", "CreditTotal", "Difference"),
  UNKNOWN_ELEMENT("unknown_element", "Section", "Tag", "Count"),
  REJECTED_RECORD("rejected_record", "Entity", "VoucherID", "RecordID", "Reason");

  /** Bumped whenever a column is added, removed or reordered. */
  public static final int SCHEMA_VERSION = 1;

  private final String tableName;
  private final List<String> columns;
  private final Map<String, Integer> index = new HashMap<>();

  EntityKind(String tableName, String... columns) {
    this.tableName = tableName;
    this.columns = Collections.unmodifiableList(Arrays.asList(columns));
    for (int i = 0; i < columns.length; i++) {
      index.put(columns[i], i);
    }
  }

  public String getTableName() {
    return tableName;
  }

  public List<String> getColumns() {
    return columns;
  }

  /**
   * Position of a column.
   * @param column column name
   * @return zero-based position
   * @throws IllegalArgumentException if the table has no such column
   */
  public int columnIndex(String column) {
    Integer i = index.get(column);
    if (i == null) {
      throw new IllegalArgumentException(tableName + " has no column " + column);
    }
    return i;
  }

  /**
   * Whether this table is a diagnostics listing, written only when non-empty.
   * @return true for diagnostics
   */
  public boolean isDiagnostic() {
    return this == MISSING_ACCOUNT || this == UNBALANCED_VOUCHER
        || this == UNKNOWN_ELEMENT || this == REJECTED_RECORD;
  }
}
