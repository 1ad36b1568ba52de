package com.probnet.xdsl.emit;

import java.util.List;

import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;

/**
 * Renders a standalone pyAgrum script.
 *
 * <p>
 * Nodes are referred to by name, so node ids never need to be valid Python
 * identifiers. Numbers use {@link Double#toString(double)}, which round-trips
 * exactly and gives byte-identical output for identical input.
 */
public final class PyAgrumScriptSink implements DiagramSink<String> {
    private final String diagram;
    private final boolean comments;
    private final StringBuilder sb = new StringBuilder(4096);

    public PyAgrumScriptSink() {
        this("diag", true);
    }

    /**
     * @param diagramVariable Python variable holding the diagram
     * @param includeComments emit a comment line above each node
     */
    public PyAgrumScriptSink(String diagramVariable, boolean includeComments) {
        if (diagramVariable == null || !diagramVariable.matches("[A-Za-z_][A-Za-z0-9_]*"))
            throw new IllegalArgumentException("Not a Python identifier: " + diagramVariable);
        this.diagram = diagramVariable;
        this.comments = includeComments;
    }

    @Override
    public void begin(NetworkGraph graph) {
        sb.setLength(0);
        if (comments) {
            sb.append("# Generated from XDSL network");
            if (graph.name() != null)
                sb.append(' ').append(quote(graph.name()));
            sb.append('\n');
        }
        sb.append("import pyAgrum as gum\n\n");
        sb.append(diagram).append(" = gum.InfluenceDiagram()\n");
    }

    @Override
    public void addNode(NodeRecord node) {
        sb.append('\n');
        if (comments) {
            sb.append("# ").append(kindLabel(node)).append(" node ").append(node.id());
            if (!node.label().equals(node.id()))
                sb.append(" (").append(node.label().replace('\n', ' ')).append(')');
            sb.append('\n');
        }
        sb.append(diagram);
        switch (node.kind()) {
            case CHANCE -> sb.append(".addChanceNode(");
            case DECISION -> sb.append(".addDecisionNode(");
            case UTILITY -> sb.append(".addUtilityNode(");
        }
        sb.append("gum.LabelizedVariable(").append(quote(node.id())).append(", ").append(quote(node.label()))
                .append(", ");
        if (node.kind().hasStates())
            appendLabels(node.states());
        else
            sb.append('1');
        sb.append("))\n");
    }

    @Override
    public void addArc(ArcRecord arc) {
        sb.append(diagram).append(".addArc(").append(quote(arc.parentId())).append(", ")
                .append(quote(arc.childId())).append(")\n");
    }

    @Override
    public void fillTable(NodeRecord node, double[] values) {
        sb.append(diagram);
        switch (node.kind()) {
            case CHANCE -> sb.append(".cpt(");
            case UTILITY -> sb.append(".utility(");
            case DECISION -> throw new IllegalStateException("Decision node " + node.id() + " has no table");
        }
        sb.append(quote(node.id())).append(").fillWith([");
        for (int i = 0; i < values.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(values[i]);
        }
        sb.append("])\n");
    }

    @Override
    public String finish() {
        return sb.toString();
    }

    private void appendLabels(List<String> labels) {
        sb.append('[');
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(quote(labels.get(i)));
        }
        sb.append(']');
    }

    private static String kindLabel(NodeRecord node) {
        return switch (node.kind()) {
            case CHANCE -> "Chance";
            case DECISION -> "Decision";
            case UTILITY -> "Utility";
        };
    }

    /** Double-quoted Python string literal. */
    static String quote(String s) {
        StringBuilder q = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> q.append("\\\"");
                case '\\' -> q.append("\\\\");
                case '\n' -> q.append("\\n");
                case '\r' -> q.append("\\r");
                case '\t' -> q.append("\\t");
                default -> q.append(c);
            }
        }
        return q.append('"').toString();
    }
}
