package com.probnet.xdsl.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Generic attributed tree node produced by {@link XdslDocumentLoader}.
 *
 * <p>
 * Carries no domain semantics: element name, attributes in document order,
 * trimmed text content and child elements in document order.
 */
@Getter
public final class XmlElement {
    private final String name;
    private final Map<String, String> attributes;
    private final String text;
    private final List<XmlElement> children;

    public XmlElement(String name, Map<String, String> attributes, String text, List<XmlElement> children) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text = text == null ? "" : text;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    /** Returns the attribute value, or {@code null} when absent. */
    public String attribute(String key) {
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    /** First direct child with the given name, or {@code null}. */
    public XmlElement child(String childName) {
        for (XmlElement c : children) {
            if (c.name.equals(childName))
                return c;
        }
        return null;
    }

    /** All direct children with the given name, in document order. */
    public List<XmlElement> children(String childName) {
        List<XmlElement> out = new ArrayList<>();
        for (XmlElement c : children) {
            if (c.name.equals(childName))
                out.add(c);
        }
        return out;
    }

    /** Whitespace-separated tokens of this element's text. */
    public List<String> tokens() {
        if (text.isEmpty())
            return List.of();
        return List.of(text.trim().split("\\s+"));
    }

    @Override
    public String toString() {
        return "<" + name + (attributes.isEmpty() ? "" : " " + attributes) + "> (" + children.size() + " children)";
    }
}
