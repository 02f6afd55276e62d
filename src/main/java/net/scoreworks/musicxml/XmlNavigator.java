/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Access to the parsed MusicXML tree. Simple lookups walk the DOM directly, path queries go through XPath. Compiled
 * expressions are cached, an instance is therefore bound to one import and not shared between threads
 */
class XmlNavigator {

    private final XPath xpath = XPathFactory.newInstance().newXPath();
    private final Map<String, XPathExpression> expressions = new HashMap<>();

    /**
     * @return the first element matching the path, evaluated relative to the context node, or null
     */
    @Nullable Element select(@Nullable Node context, String path) {
        if (context == null)
            return null;
        try {
            Object found = compile(path).evaluate(context, XPathConstants.NODE);
            return found instanceof Element ? (Element) found : null;
        } catch (XPathExpressionException e) {
            throw new MusicXmlImportException("Can't evaluate path " + path, e);
        }
    }

    /**
     * @return all elements matching the path in document order
     */
    List<Element> selectAll(@Nullable Node context, String path) {
        List<Element> elements = new ArrayList<>();
        if (context == null)
            return elements;
        try {
            NodeList nodes = (NodeList) compile(path).evaluate(context, XPathConstants.NODESET);
            for (int i = 0; i < nodes.getLength(); i++) {
                if (nodes.item(i) instanceof Element)
                    elements.add((Element) nodes.item(i));
            }
        } catch (XPathExpressionException e) {
            throw new MusicXmlImportException("Can't evaluate path " + path, e);
        }
        return elements;
    }

    boolean exists(@Nullable Node context, String path) {
        return select(context, path) != null;
    }

    private XPathExpression compile(String path) throws XPathExpressionException {
        XPathExpression expression = expressions.get(path);
        if (expression == null) {
            expression = xpath.compile(path);
            expressions.put(path, expression);
        }
        return expression;
    }


    //==========DOM HELPERS====================================================

    /**
     * @return the first child element with the given name or null
     */
    static @Nullable Element child(@Nullable Node parent, String name) {
        if (parent == null)
            return null;
        for (Node it = parent.getFirstChild(); it != null; it = it.getNextSibling()) {
            if (it instanceof Element && name.equals(it.getNodeName()))
                return (Element) it;
        }
        return null;
    }

    /**
     * @return all child elements with the given name
     */
    static List<Element> children(@Nullable Node parent, String name) {
        List<Element> found = new ArrayList<>();
        for (Element element : childElements(parent)) {
            if (name.equals(element.getNodeName()))
                found.add(element);
        }
        return found;
    }

    static List<Element> childElements(@Nullable Node parent) {
        List<Element> found = new ArrayList<>();
        if (parent == null)
            return found;
        for (Node it = parent.getFirstChild(); it != null; it = it.getNextSibling()) {
            if (it instanceof Element)
                found.add((Element) it);
        }
        return found;
    }

    static @Nullable Element firstChildElement(@Nullable Node parent) {
        if (parent == null)
            return null;
        for (Node it = parent.getFirstChild(); it != null; it = it.getNextSibling()) {
            if (it instanceof Element)
                return (Element) it;
        }
        return null;
    }

    /**
     * @return the next sibling element with the given name, skipping siblings of other names, or null
     */
    static @Nullable Element nextSibling(Node node, String name) {
        for (Node it = node.getNextSibling(); it != null; it = it.getNextSibling()) {
            if (it instanceof Element && name.equals(it.getNodeName()))
                return (Element) it;
        }
        return null;
    }

    /**
     * @return the previous sibling element with the given name, skipping siblings of other names, or null
     */
    static @Nullable Element previousSibling(Node node, String name) {
        for (Node it = node.getPreviousSibling(); it != null; it = it.getPreviousSibling()) {
            if (it instanceof Element && name.equals(it.getNodeName()))
                return (Element) it;
        }
        return null;
    }

    /**
     * @return the attribute value or an empty string if the attribute is missing
     */
    static @NotNull String attribute(@Nullable Element element, String name) {
        if (element == null)
            return "";
        return element.getAttribute(name);
    }

    static boolean hasAttributeValue(@Nullable Element element, String name, String value) {
        return element != null && element.hasAttribute(name) && value.equals(element.getAttribute(name));
    }

    /**
     * @return the text content of the node or an empty string for a missing node
     */
    static @NotNull String content(@Nullable Node node) {
        if (node == null)
            return "";
        return StringUtils.defaultString(node.getTextContent());
    }

    /**
     * Get the text content of a descendant, given by a path of element names separated by {@code /}
     */
    static @NotNull String childContent(@Nullable Node parent, String path) {
        Node it = parent;
        for (String name : StringUtils.split(path, '/')) {
            it = child(it, name);
            if (it == null)
                return "";
        }
        return content(it);
    }

    /**
     * Parse the leading integer of a value, ignoring surrounding whitespace and trailing garbage.
     * @return the parsed value or 0 if the value doesn't start with a number
     */
    static int toInt(@Nullable String value) {
        String trimmed = StringUtils.trimToEmpty(value);
        int end = 0;
        if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+'))
            end++;
        int digitsStart = end;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end)))
            end++;
        if (end == digitsStart)
            return 0;
        try {
            return Integer.parseInt(trimmed.substring(0, end));
        } catch (NumberFormatException e) {
            // out of int range
            return trimmed.charAt(0) == '-' ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }

    /**
     * Parse a decimal value.
     * @return the parsed value or 0 if the value is not a number
     */
    static double toDouble(@Nullable String value) {
        return NumberUtils.toDouble(StringUtils.trimToEmpty(value), 0);
    }
}
