package com.probnet.xdsl.extract;

import com.probnet.xdsl.graph.NodeKind;

/**
 * Node-defining elements recognized under {@code <nodes>}, with the kind they
 * map to and the element holding their table.
 */
public enum XdslElementType {
    CPT("cpt", NodeKind.CHANCE, "probabilities"),
    DETERMINISTIC("deterministic", NodeKind.CHANCE, "resultingstates"),
    DECISION("decision", NodeKind.DECISION, null),
    UTILITY("utility", NodeKind.UTILITY, "utilities"),
    // Multi-attribute utility: weights its parent utilities, never becomes a node.
    MAU("mau", null, "weights");

    private final String tag;
    private final NodeKind kind;
    private final String tableElement;

    XdslElementType(String tag, NodeKind kind, String tableElement) {
        this.tag = tag;
        this.kind = kind;
        this.tableElement = tableElement;
    }

    /** Node kind, {@code null} for elements that do not define a node. */
    public NodeKind kind() {
        return kind;
    }

    public String tableElement() {
        return tableElement;
    }

    public boolean definesNode() {
        return kind != null;
    }

    /** Returns the element type for {@code tag}, or {@code null} if unknown. */
    public static XdslElementType fromTag(String tag) {
        for (XdslElementType t : values()) {
            if (t.tag.equals(tag))
                return t;
        }
        return null;
    }
}
