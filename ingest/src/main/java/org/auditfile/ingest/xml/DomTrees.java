package org.auditfile.ingest.xml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Full materialization of a document into an {@link XmlNode} tree.
 */
public final class DomTrees {

  private DomTrees() { }

  /**
   * Parse the whole stream.
   * @param in document bytes
   * @return root node
   * @throws IOException on read failure
   * @throws SAXException on malformed XML
   */
  public static XmlNode parse(InputStream in) throws IOException, SAXException {
    DocumentBuilder builder;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setExpandEntityReferences(false);
      builder = factory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
    Document document = builder.parse(in);
    return toXmlNode(document.getDocumentElement());
  }

  /**
   * Convert a DOM element to an {@link XmlNode} tree. The walk keeps its own stack, so the
   * nesting depth is bounded by the heap rather than the thread stack.
   * @param element DOM element
   * @return node
   */
  public static XmlNode toXmlNode(Element element) {
    XmlNode root = shallowCopy(element);
    Deque<Element> elements = new ArrayDeque<>();
    Deque<XmlNode> nodes = new ArrayDeque<>();
    elements.push(element);
    nodes.push(root);
    while (!elements.isEmpty()) {
      Element current = elements.pop();
      XmlNode node = nodes.pop();
      NodeList list = current.getChildNodes();
      for (int i = 0; i < list.getLength(); i++) {
        Node child = list.item(i);
        switch (child.getNodeType()) {
          case Node.ELEMENT_NODE:
            XmlNode copy = shallowCopy((Element) child);
            node.addChild(copy);
            elements.push((Element) child);
            nodes.push(copy);
            break;
          case Node.TEXT_NODE:
          case Node.CDATA_SECTION_NODE:
            node.appendText(child.getNodeValue());
            break;
          default:
            break;
        }
      }
    }
    return root;
  }

  private static XmlNode shallowCopy(Element element) {
    NamedNodeMap attrs = element.getAttributes();
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < attrs.getLength(); i++) {
      Attr attr = (Attr) attrs.item(i);
      if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
        continue;
      }
      attributes.put(localName(attr), attr.getValue());
    }
    return new XmlNode(localName(element), attributes);
  }

  private static String localName(Node node) {
    String name = node.getLocalName();
    return name != null ? name : node.getNodeName();
  }
}
