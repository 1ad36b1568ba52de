package com.probnet.xdsl.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import lombok.extern.log4j.Log4j2;

/**
 * Parses raw XDSL markup into an {@link XmlElement} tree.
 *
 * <p>
 * Only well-formedness is checked here. Element names are not interpreted, so
 * an unknown node type or a missing section passes through untouched and is
 * left for the extractor to report.
 *
 * <p>
 * External DTDs and entities are never fetched.
 */
@Log4j2
public final class XdslDocumentLoader {
    private XdslDocumentLoader() {
        // Utility class
    }

    /** Reads and parses an XDSL file. */
    public static XmlElement loadFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /** Parses XDSL text. */
    public static XmlElement load(String xdsl) {
        if (xdsl == null || xdsl.isBlank())
            throw new MalformedDocumentException("Empty XDSL document");
        return parse(new InputSource(new StringReader(xdsl)));
    }

    /** Parses XDSL bytes; the encoding is taken from the XML declaration. */
    public static XmlElement load(InputStream in) {
        return parse(new InputSource(in));
    }

    private static XmlElement parse(InputSource source) {
        Document doc;
        try {
            doc = newBuilder().parse(source);
        } catch (SAXParseException e) {
            throw new MalformedDocumentException("Malformed XDSL at line " + e.getLineNumber()
                    + ", column " + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException("Malformed XDSL: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (root == null)
            throw new MalformedDocumentException("XDSL document has no root element");
        XmlElement tree = toTree(root);
        log.debug("Loaded XDSL tree rooted at <{}> with {} children", tree.getName(), tree.getChildren().size());
        return tree;
    }

    private static DocumentBuilder newBuilder() {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(false);
        f.setValidating(false);
        f.setIgnoringComments(true);
        f.setCoalescing(true);
        f.setXIncludeAware(false);
        f.setExpandEntityReferences(false);
        try {
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DocumentBuilder b = f.newDocumentBuilder();
            b.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            b.setErrorHandler(new ThrowingErrorHandler());
            return b;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
    }

    private static XmlElement toTree(Element el) {
        Map<String, String> attrs = new LinkedHashMap<>();
        NamedNodeMap nm = el.getAttributes();
        for (int i = 0; i < nm.getLength(); i++) {
            Node a = nm.item(i);
            attrs.put(a.getNodeName(), a.getNodeValue());
        }

        List<XmlElement> children = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        NodeList nodes = el.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            switch (n.getNodeType()) {
                case Node.ELEMENT_NODE -> children.add(toTree((Element) n));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(n.getNodeValue());
                default -> {
                    // comments and processing instructions carry nothing
                }
            }
        }
        return new XmlElement(el.getTagName(), attrs, text.toString().trim(), children);
    }

    /** Turns every parser error into an exception instead of a stderr line. */
    private static final class ThrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.warn("XDSL parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
