package org.auditfile.ingest.field;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Everything the engine knows about tag names: the alias table, which tags are records,
 * which are structural sections and which are expected at all.
 */
public final class Vocabulary {
  public static final String RESOURCE = "audit-file-vocabulary.json";

  private final AliasTable aliases;
  private final Map<String, RecordKind> records;
  private final Set<String> sections;
  private final Set<String> known;
  private final Set<String> taxCodeDetails;
  private final Set<String> balanceAccounts;
  private final Set<String> salesInvoiceParents;
  private final Set<String> purchaseInvoiceParents;
  private final Map<RecordKind, Set<String>> tagsByKind = new EnumMap<>(RecordKind.class);

  /**
   * Build vocabulary from its JSON form.
   * @param json vocabulary with "fields", "records", "structures", "sections" and
   *     "knownElements"
   */
  public Vocabulary(JsonObject json) {
    aliases = AliasTable.fromJson(json.getJsonObject("fields", new JsonObject()));
    Map<String, RecordKind> recordMap = new HashMap<>();
    JsonObject recordsJson = json.getJsonObject("records", new JsonObject());
    for (String kindName : recordsJson.fieldNames()) {
      RecordKind kind = RecordKind.valueOf(kindName);
      Set<String> tags = toSet(recordsJson.getJsonArray(kindName));
      tagsByKind.put(kind, tags);
      for (String tag : tags) {
        recordMap.put(tag, kind);
      }
    }
    records = Collections.unmodifiableMap(recordMap);
    JsonObject structures = json.getJsonObject("structures", new JsonObject());
    taxCodeDetails = toSet(structures.getJsonArray("taxCodeDetails"));
    balanceAccounts = toSet(structures.getJsonArray("balanceAccount"));
    salesInvoiceParents = toSet(structures.getJsonArray("salesInvoices"));
    purchaseInvoiceParents = toSet(structures.getJsonArray("purchaseInvoices"));
    sections = toSet(json.getJsonArray("sections"));

    Set<String> knownSet = new HashSet<>(toSet(json.getJsonArray("knownElements")));
    knownSet.addAll(aliases.allAliases());
    knownSet.addAll(records.keySet());
    knownSet.addAll(sections);
    knownSet.addAll(taxCodeDetails);
    knownSet.addAll(balanceAccounts);
    knownSet.addAll(salesInvoiceParents);
    knownSet.addAll(purchaseInvoiceParents);
    known = Collections.unmodifiableSet(knownSet);
  }

  /**
   * Load the vocabulary bundled on the classpath.
   * @return vocabulary
   */
  public static Vocabulary load() {
    try (InputStream in = Vocabulary.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + RESOURCE);
      }
      return new Vocabulary(new JsonObject(new String(in.readAllBytes(),
          StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static Set<String> toSet(JsonArray array) {
    if (array == null) {
      return Collections.emptySet();
    }
    Set<String> set = new HashSet<>();
    for (int i = 0; i < array.size(); i++) {
      set.add(array.getString(i));
    }
    return Collections.unmodifiableSet(set);
  }

  public AliasTable getAliases() {
    return aliases;
  }

  /**
   * Record kind of a tag.
   * @param tag local name
   * @return kind or null if the tag is not a record element
   */
  public RecordKind recordKind(String tag) {
    return records.get(tag);
  }

  public boolean is(RecordKind kind, String tag) {
    return kind == records.get(tag);
  }

  public Set<String> tags(RecordKind kind) {
    return tagsByKind.getOrDefault(kind, Collections.emptySet());
  }

  public boolean isSection(String tag) {
    return sections.contains(tag);
  }

  public boolean isKnown(String tag) {
    return known.contains(tag);
  }

  public Set<String> getTaxCodeDetailsTags() {
    return taxCodeDetails;
  }

  public Set<String> getBalanceAccountTags() {
    return balanceAccounts;
  }

  public boolean isSalesInvoiceParent(String tag) {
    return salesInvoiceParents.contains(tag);
  }

  public boolean isPurchaseInvoiceParent(String tag) {
    return purchaseInvoiceParents.contains(tag);
  }
}
