package com.twbconvert.extract;

import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** Read-only helpers over the DOM. Nothing here modifies the document. */
final class XmlElements {

    private XmlElements() {}

    static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static Element child(Element parent, String tagName) {
        List<Element> matches = children(parent, tagName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /** Follows a path of direct child tag names, returning {@code null} as soon as a step is missing. */
    static Element path(Element parent, String... tagNames) {
        Element current = parent;
        for (String tagName : tagNames) {
            current = child(current, tagName);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /** All descendants with the given tag, in document order. */
    static List<Element> descendants(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getElementsByTagName(tagName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /** Attribute value, or {@code null} when the attribute is absent or blank. */
    static String attr(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name);
        return value.isBlank() ? null : value;
    }

    static String text(Element element) {
        return element == null ? null : element.getTextContent().trim();
    }

    /** Concatenated {@code <run>} text of a {@code <formatted-text>} child, or {@code null}. */
    static String formattedText(Element element) {
        Element formatted = child(element, "formatted-text");
        if (formatted == null) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Element run : children(formatted, "run")) {
            text.append(run.getTextContent());
        }
        String result = text.toString().trim();
        return result.isEmpty() ? null : result;
    }

    /** Strips one pair of surrounding brackets and undoubles escaped closing brackets. */
    static String unbracket(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("]]", "]");
        }
        return trimmed;
    }

    /** The last bracketed part of a dotted name such as {@code [Extract].[Orders$]}. */
    static String lastPart(String qualified) {
        if (qualified == null) {
            return null;
        }
        String trimmed = qualified.trim();
        int split = trimmed.lastIndexOf("].[");
        return unbracket(split >= 0 ? trimmed.substring(split + 2) : trimmed);
    }
}
