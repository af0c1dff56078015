package com.github.llfsm.codec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;

/**
 * Reads and writes XML property lists. Values map to {@code Map<String, Object>} (dict),
 * {@code List<Object>} (array), {@link String}, {@link Double} (real), {@link Long} (integer),
 * {@link Boolean} and {@code byte[]} (data). Dictionaries are written with sorted keys.
 */
public final class PropertyList {
  private static final String header = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
      + "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\" "
      + "\"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">\n" + "<plist version=\"1.0\">\n";
  private static final String footer = "</plist>\n";

  private PropertyList() {}

  public static byte[] write(final Object value) {
    final StringBuilder xml = new StringBuilder(header);
    append(xml, value, "");
    xml.append(footer);
    return xml.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static void append(final StringBuilder xml, final Object value, final String indent) {
    if (value instanceof Map) {
      final Map<String, Object> sorted = new TreeMap<>();
      for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        sorted.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      if (sorted.isEmpty()) {
        xml.append(indent).append("<dict/>\n");
        return;
      }
      xml.append(indent).append("<dict>\n");
      for (final Map.Entry<String, Object> entry : sorted.entrySet()) {
        xml.append(indent).append('\t').append("<key>").append(xmlEscape(entry.getKey()))
            .append("</key>\n");
        append(xml, entry.getValue(), indent + '\t');
      }
      xml.append(indent).append("</dict>\n");
    } else if (value instanceof List) {
      final List<?> list = (List<?>) value;
      if (list.isEmpty()) {
        xml.append(indent).append("<array/>\n");
        return;
      }
      xml.append(indent).append("<array>\n");
      for (final Object element : list) {
        append(xml, element, indent + '\t');
      }
      xml.append(indent).append("</array>\n");
    } else if (value instanceof Boolean) {
      xml.append(indent).append((Boolean) value ? "<true/>\n" : "<false/>\n");
    } else if (value instanceof Double || value instanceof Float) {
      xml.append(indent).append("<real>").append(real(((Number) value).doubleValue()))
          .append("</real>\n");
    } else if (value instanceof Number) {
      xml.append(indent).append("<integer>").append(((Number) value).longValue())
          .append("</integer>\n");
    } else if (value instanceof byte[]) {
      xml.append(indent).append("<data>").append(Base64.getEncoder().encodeToString((byte[]) value))
          .append("</data>\n");
    } else if (value != null) {
      xml.append(indent).append("<string>").append(xmlEscape(value.toString()))
          .append("</string>\n");
    } else {
      throw new IllegalArgumentException("Property lists cannot hold null");
    }
  }

  static String real(final double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.isNaN(value) ? "nan" : value > 0 ? "+infinity" : "-infinity";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  static String xmlEscape(final String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }

  /**
   * Parses an XML property list without resolving its DTD.
   *
   * @throws LLFSMException with {@link Code#MALFORMED_LAYOUT} if the bytes are not a property list
   */
  public static Object read(final byte[] contents) throws LLFSMException {
    final Document document;
    try {
      final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setValidating(false);
      factory.setNamespaceAware(false);
      factory.setExpandEntityReferences(false);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      final DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(null);
      document = builder.parse(new ByteArrayInputStream(contents));
    } catch (ParserConfigurationException | SAXException | IOException parseFailure) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT,
          "Cannot parse property list: " + parseFailure.getMessage(), parseFailure);
    }
    final Element root = document.getDocumentElement();
    if (!"plist".equals(root.getTagName())) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT,
          "Expected a plist element but found " + root.getTagName());
    }
    final List<Element> values = childElements(root);
    if (values.size() != 1) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT,
          "Expected exactly one top level value but found " + values.size());
    }
    return value(values.get(0));
  }

  private static Object value(final Element element) throws LLFSMException {
    final String text = element.getTextContent().trim();
    try {
      switch (element.getTagName()) {
        case "dict":
          return dictionary(element);
        case "array":
          final List<Object> array = new ArrayList<>();
          for (final Element child : childElements(element)) {
            array.add(value(child));
          }
          return array;
        case "string":
        case "date":
          return element.getTextContent();
        case "real":
          return parseReal(text);
        case "integer":
          return Long.valueOf(text);
        case "true":
          return Boolean.TRUE;
        case "false":
          return Boolean.FALSE;
        case "data":
          return Base64.getMimeDecoder().decode(text);
        default:
          throw new LLFSMException(Code.MALFORMED_LAYOUT,
              "Unknown property list element " + element.getTagName());
      }
    } catch (IllegalArgumentException badValue) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT,
          "Bad " + element.getTagName() + " value '" + text + "'", badValue);
    }
  }

  private static Map<String, Object> dictionary(final Element element) throws LLFSMException {
    final Map<String, Object> dictionary = new LinkedHashMap<>();
    final List<Element> children = childElements(element);
    if (children.size() % 2 != 0) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT, "Dictionary key without a value");
    }
    for (int i = 0; i < children.size(); i += 2) {
      final Element key = children.get(i);
      if (!"key".equals(key.getTagName())) {
        throw new LLFSMException(Code.MALFORMED_LAYOUT,
            "Expected a key but found " + key.getTagName());
      }
      dictionary.put(key.getTextContent(), value(children.get(i + 1)));
    }
    return dictionary;
  }

  private static Double parseReal(final String text) {
    switch (text.toLowerCase(Locale.ROOT)) {
      case "nan":
        return Double.NaN;
      case "+infinity":
      case "infinity":
      case "inf":
        return Double.POSITIVE_INFINITY;
      case "-infinity":
      case "-inf":
        return Double.NEGATIVE_INFINITY;
      default:
        return Double.valueOf(text);
    }
  }

  private static List<Element> childElements(final Element parent) {
    final List<Element> elements = new ArrayList<>();
    final NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      final Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        elements.add((Element) node);
      }
    }
    return elements;
  }

}
