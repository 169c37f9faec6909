package org.auditfile.ingest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.auditfile.ingest.xml.DomTrees;
import org.auditfile.ingest.xml.XmlNode;
import org.xml.sax.SAXException;

/**
 * Audit file snippets shared by the tests.
 */
public final class Docs {
  public static final String SMALL_RESOURCE = "saft-small.xml";

  private Docs() { }

  /**
   * Wrap general ledger content in a minimal audit file.
   * @param masterFiles content of MasterFiles
   * @param journalContent content of the single Journal
   * @return document
   */
  public static String auditFile(String masterFiles, String journalContent) {
    return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
        + "<AuditFile xmlns=\"urn:StandardAuditFile-Taxation-Financial:NO\">\n"
        + "<Header><DefaultCurrencyCode>NOK</DefaultCurrencyCode></Header>\n"
        + "<MasterFiles><GeneralLedgerAccounts>" + masterFiles
        + "</GeneralLedgerAccounts></MasterFiles>\n"
        + "<GeneralLedgerEntries><Journal><JournalID>GL</JournalID>"
        + journalContent + "</Journal></GeneralLedgerEntries>\n"
        + "</AuditFile>\n";
  }

  public static String account(String id) {
    return "<Account><AccountID>" + id + "</AccountID></Account>";
  }

  public static InputStream stream(String xml) {
    return new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
  }

  public static InputStream small() {
    InputStream in = Docs.class.getClassLoader().getResourceAsStream(SMALL_RESOURCE);
    if (in == null) {
      throw new IllegalStateException(SMALL_RESOURCE + " not on classpath");
    }
    return in;
  }

  /**
   * Copy the small audit file to a directory.
   * @param dir target directory
   * @return file written
   */
  public static Path writeSmall(Path dir) {
    try (InputStream in = small()) {
      Path file = dir.resolve(SMALL_RESOURCE);
      Files.copy(in, file);
      return file;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Path write(Path dir, String name, String xml) throws IOException {
    return Files.writeString(dir.resolve(name), xml, StandardCharsets.UTF_8);
  }

  /**
   * Parse a snippet into a tree.
   * @param xml well-formed snippet
   * @return root node
   */
  public static XmlNode node(String xml) {
    try {
      return DomTrees.parse(stream(xml));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (SAXException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }
}
