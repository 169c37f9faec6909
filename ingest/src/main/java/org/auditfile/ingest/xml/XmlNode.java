package org.auditfile.ingest.xml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import javax.xml.stream.XMLStreamReader;

/**
 * Minimal element tree used by both parsing paths.
 *
 * <p>Names are local (namespace stripped). Whitespace-only text that arrives before any
 * real content is not kept, so container elements do not grow with the number of
 * children they have seen.
 */
public class XmlNode {
  private final String name;
  private final Map<String, String> attributes;
  private StringBuilder text;
  private List<XmlNode> children;

  /**
   * Create node.
   * @param name local element name
   * @param attributes attributes by local name; may be empty
   */
  public XmlNode(String name, Map<String, String> attributes) {
    this.name = name;
    this.attributes = attributes.isEmpty() ? Collections.emptyMap() : attributes;
  }

  public XmlNode(String name) {
    this(name, Collections.emptyMap());
  }

  /**
   * Create node from the start element the reader is positioned at.
   * @param reader reader at START_ELEMENT
   * @return node without children
   */
  public static XmlNode fromStartElement(XMLStreamReader reader) {
    int n = reader.getAttributeCount();
    if (n == 0) {
      return new XmlNode(reader.getLocalName());
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
    }
    return new XmlNode(reader.getLocalName(), attributes);
  }

  public String getName() {
    return name;
  }

  public Map<String, String> getAttributes() {
    return attributes;
  }

  public String getAttribute(String attributeName) {
    return attributes.get(attributeName);
  }

  /**
   * Append character data.
   * @param chars text
   */
  public void appendText(CharSequence chars) {
    if (text == null) {
      if (isBlank(chars)) {
        return;
      }
      text = new StringBuilder();
    }
    text.append(chars);
  }

  /**
   * Own text, trimmed.
   * @return text; empty string when there is none
   */
  public String getText() {
    return text == null ? "" : text.toString().trim();
  }

  public void addChild(XmlNode child) {
    if (children == null) {
      children = new ArrayList<>();
    }
    children.add(child);
  }

  /**
   * Remove the last child. Used to drop a subtree once it has been processed.
   */
  public void removeLastChild() {
    if (children != null && !children.isEmpty()) {
      children.remove(children.size() - 1);
    }
  }

  public List<XmlNode> getChildren() {
    return children == null ? Collections.emptyList() : children;
  }

  /**
   * Number of nodes in this subtree, including this one.
   * @return node count
   */
  public int size() {
    int n = 0;
    Deque<XmlNode> pending = new ArrayDeque<>();
    pending.push(this);
    while (!pending.isEmpty()) {
      XmlNode node = pending.pop();
      n++;
      for (XmlNode child : node.getChildren()) {
        pending.push(child);
      }
    }
    return n;
  }

  /**
   * Deep copy without the descendants matched by the predicate (and their subtrees).
   * @param exclude matches nodes to leave out
   * @return copy
   */
  public XmlNode copyExcluding(Predicate<XmlNode> exclude) {
    XmlNode copy = new XmlNode(name, attributes);
    copy.text = text == null ? null : new StringBuilder(text);
    for (XmlNode child : getChildren()) {
      if (!exclude.test(child)) {
        copy.addChild(child.copyExcluding(exclude));
      }
    }
    return copy;
  }

  private static boolean isBlank(CharSequence chars) {
    for (int i = 0; i < chars.length(); i++) {
      if (!Character.isWhitespace(chars.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "<" + name + ">";
  }
}
