package org.auditfile.ingest.field;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import org.auditfile.ingest.xml.XmlNode;
import org.auditfile.util.amount.AmountNormalizer;

/**
 * Finds the value of a canonical field under a subtree.
 *
 * <p>Descendants are searched breadth-first, level by level, down to a fixed depth. Within
 * one node the aliases are tried in priority order and, for each alias, the matching
 * children in document order. A match yields its trimmed text; for amount fields an
 * empty match falls back to its {@code Amount} child and then its {@code Amount}
 * attribute. Failing that, the node's own attribute with the alias name is used.
 */
public class FieldResolver {
  static final String AMOUNT = "Amount";

  private final AliasTable aliases;
  private final int maxDepth;

  /**
   * Create resolver.
   * @param aliases alias table
   * @param maxDepth how many levels below the root to search; at least 1
   */
  public FieldResolver(AliasTable aliases, int maxDepth) {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be at least 1");
    }
    this.aliases = aliases;
    this.maxDepth = maxDepth;
  }

  public AliasTable getAliases() {
    return aliases;
  }

  /**
   * Resolve text of a field.
   * @param root subtree root
   * @param field canonical field name
   * @return trimmed non-empty value; null if not found
   */
  public String text(XmlNode root, String field) {
    return text(root, field, maxDepth);
  }

  /**
   * Resolve text of a field on the root and its direct children only. Values nested in
   * wrappers such as tax information or currency amounts are not candidates.
   * @param root subtree root
   * @param field canonical field name
   * @return trimmed non-empty value; null if not found
   */
  public String ownText(XmlNode root, String field) {
    return text(root, field, 1);
  }

  private String text(XmlNode root, String field, int depthLimit) {
    if (root == null) {
      return null;
    }
    FieldSpec spec = aliases.get(field);
    Deque<XmlNode> queue = new ArrayDeque<>();
    Deque<Integer> depths = new ArrayDeque<>();
    queue.add(root);
    depths.add(0);
    while (!queue.isEmpty()) {
      XmlNode node = queue.poll();
      int depth = depths.poll();
      String value = match(node, spec);
      if (value != null) {
        return value;
      }
      if (depth + 1 < depthLimit) {
        for (XmlNode child : node.getChildren()) {
          queue.add(child);
          depths.add(depth + 1);
        }
      }
    }
    return null;
  }

  /**
   * Resolve text of a field.
   * @param root subtree root
   * @param field canonical field name
   * @return value; empty string if not found
   */
  public String textOrEmpty(XmlNode root, String field) {
    String value = text(root, field);
    return value == null ? "" : value;
  }

  /**
   * Resolve an amount field as an optional value.
   * @param root subtree root
   * @param field canonical field name
   * @return amount; null if absent or unparsable
   */
  public BigDecimal amount(XmlNode root, String field) {
    return AmountNormalizer.parseOrNull(text(root, field));
  }

  /**
   * Resolve an amount field, absent or unparsable counting as zero.
   * @param root subtree root
   * @param field canonical field name
   * @return amount
   */
  public BigDecimal amountOrZero(XmlNode root, String field) {
    BigDecimal value = amount(root, field);
    return value == null ? BigDecimal.ZERO : value;
  }

  /**
   * Find descendants with one of the given names. Matches are not searched further.
   * @param root subtree root, not itself a candidate
   * @param tags local names
   * @return matches in document order
   */
  public static List<XmlNode> findAll(XmlNode root, Collection<String> tags) {
    List<XmlNode> result = new ArrayList<>();
    collect(root, tags, result);
    return result;
  }

  private static void collect(XmlNode node, Collection<String> tags, List<XmlNode> result) {
    for (XmlNode child : node.getChildren()) {
      if (tags.contains(child.getName())) {
        result.add(child);
      } else {
        collect(child, tags, result);
      }
    }
  }

  private static String match(XmlNode node, FieldSpec spec) {
    for (String alias : spec.getAliases()) {
      for (XmlNode child : node.getChildren()) {
        if (!alias.equals(child.getName())) {
          continue;
        }
        String value = child.getText();
        if (!value.isEmpty()) {
          return value;
        }
        if (spec.isAmount()) {
          value = amountOf(child);
          if (value != null) {
            return value;
          }
        }
      }
      String attribute = node.getAttribute(alias);
      if (attribute != null && !attribute.isBlank()) {
        return attribute.trim();
      }
    }
    return null;
  }

  private static String amountOf(XmlNode node) {
    for (XmlNode child : node.getChildren()) {
      if (AMOUNT.equals(child.getName()) && !child.getText().isEmpty()) {
        return child.getText();
      }
    }
    String attribute = node.getAttribute(AMOUNT);
    if (attribute != null && !attribute.isBlank()) {
      return attribute.trim();
    }
    return null;
  }
}
