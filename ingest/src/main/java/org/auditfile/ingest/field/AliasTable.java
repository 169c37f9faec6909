package org.auditfile.ingest.field;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical field name to accepted spellings. Read-only once built, so one table may
 * be shared by concurrent runs.
 */
public final class AliasTable {
  private final Map<String, FieldSpec> fields;

  private AliasTable(Map<String, FieldSpec> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Build from the "fields" object of a vocabulary.
   * @param json canonical name to {"aliases": [...], "amount": bool}
   * @return table
   */
  public static AliasTable fromJson(JsonObject json) {
    Map<String, FieldSpec> fields = new LinkedHashMap<>();
    for (String name : json.fieldNames()) {
      JsonObject entry = json.getJsonObject(name);
      JsonArray aliases = entry.getJsonArray("aliases", new JsonArray());
      List<String> list = new ArrayList<>(aliases.size());
      for (int i = 0; i < aliases.size(); i++) {
        list.add(aliases.getString(i));
      }
      fields.put(name, new FieldSpec(name, list, entry.getBoolean("amount", false)));
    }
    return new AliasTable(fields);
  }

  /**
   * Look up a field.
   * @param name canonical name
   * @return field spec
   * @throws IllegalArgumentException if the name is not in the table
   */
  public FieldSpec get(String name) {
    FieldSpec spec = fields.get(name);
    if (spec == null) {
      throw new IllegalArgumentException("Unknown canonical field: " + name);
    }
    return spec;
  }

  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  /**
   * All spellings of all fields.
   * @return aliases
   */
  public Set<String> allAliases() {
    Set<String> all = new LinkedHashSet<>();
    for (FieldSpec spec : fields.values()) {
      all.addAll(spec.getAliases());
    }
    return all;
  }

  public int size() {
    return fields.size();
  }
}
