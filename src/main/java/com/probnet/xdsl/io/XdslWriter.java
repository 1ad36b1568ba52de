package com.probnet.xdsl.io;

import java.io.StringWriter;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.probnet.xdsl.graph.DisplayInfo;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.graph.TableRecord;

/**
 * Serializes a {@link NetworkGraph} back to XDSL markup.
 *
 * <p>
 * Nodes are written in declaration order with their tables in XDSL layout.
 * Deterministic nodes come out as plain {@code cpt} nodes since their
 * resulting states were expanded into a one-hot table on the way in. A GeNIe
 * extension section is written only when some node carries display data.
 */
public final class XdslWriter {
    private XdslWriter() {
        // Utility class
    }

    public static String write(NetworkGraph graph) {
        Document doc = newDocument();
        Element smile = doc.createElement("smile");
        smile.setAttribute("version", "1.0");
        smile.setAttribute("id", graph.name() != null ? graph.name() : "Network");
        smile.setAttribute("numsamples", "10000");
        smile.setAttribute("discsamples", "10000");
        doc.appendChild(smile);

        Element nodes = doc.createElement("nodes");
        smile.appendChild(nodes);
        boolean anyDisplay = false;
        for (String id : graph.ids()) {
            NodeRecord n = graph.node(id);
            nodes.appendChild(nodeElement(doc, n, graph.table(id)));
            anyDisplay |= n.display() != null;
        }

        if (anyDisplay) {
            Element ext = doc.createElement("extensions");
            Element genie = doc.createElement("genie");
            genie.setAttribute("version", "1.0");
            genie.setAttribute("app", "xdsl-converter");
            genie.setAttribute("name", smile.getAttribute("id"));
            for (String id : graph.ids()) {
                DisplayInfo d = graph.node(id).display();
                if (d != null)
                    genie.appendChild(displayElement(doc, id, d));
            }
            ext.appendChild(genie);
            smile.appendChild(ext);
        }
        return serialize(doc);
    }

    private static Element nodeElement(Document doc, NodeRecord n, TableRecord table) {
        Element el = doc.createElement(switch (n.kind()) {
            case CHANCE -> "cpt";
            case DECISION -> "decision";
            case UTILITY -> "utility";
        });
        el.setAttribute("id", n.id());
        for (String s : n.states()) {
            Element st = doc.createElement("state");
            st.setAttribute("id", s);
            el.appendChild(st);
        }
        if (!n.parents().isEmpty())
            el.appendChild(textElement(doc, "parents", String.join(" ", n.parents())));
        if (table != null) {
            StringBuilder sb = new StringBuilder(table.size() * 6);
            for (int i = 0; i < table.size(); i++) {
                if (i > 0)
                    sb.append(' ');
                sb.append(table.valueAt(i));
            }
            el.appendChild(textElement(doc, switch (n.kind()) {
                case CHANCE -> "probabilities";
                case UTILITY -> "utilities";
                case DECISION -> throw new IllegalStateException("Decision node " + n.id() + " has a table");
            }, sb.toString()));
        }
        return el;
    }

    private static Element displayElement(Document doc, String id, DisplayInfo d) {
        Element node = doc.createElement("node");
        node.setAttribute("id", id);
        node.appendChild(textElement(doc, "name", d.getName() != null ? d.getName() : id));
        if (d.getInteriorColor() != null)
            node.appendChild(colorElement(doc, "interior", d.getInteriorColor()));
        if (d.getOutlineColor() != null)
            node.appendChild(colorElement(doc, "outline", d.getOutlineColor()));
        if (d.hasPosition()) {
            int[] p = d.getPosition();
            node.appendChild(textElement(doc, "position", p[0] + " " + p[1] + " " + p[2] + " " + p[3]));
        }
        if (d.getComment() != null)
            node.appendChild(textElement(doc, "comment", d.getComment()));
        return node;
    }

    private static Element colorElement(Document doc, String name, String color) {
        Element el = doc.createElement(name);
        el.setAttribute("color", color);
        return el;
    }

    private static Element textElement(Document doc, String name, String text) {
        Element el = doc.createElement(name);
        el.setTextContent(text);
        return el;
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder unavailable", e);
        }
    }

    private static String serialize(Document doc) {
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Transformer t = tf.newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            t.setOutputProperty(OutputKeys.INDENT, "yes");
            t.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            StringWriter out = new StringWriter();
            t.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("XDSL document cannot be serialized", e);
        }
    }
}
