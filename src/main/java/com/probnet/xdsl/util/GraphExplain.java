package com.probnet.xdsl.util;

import com.probnet.xdsl.engine.TopologicalOrder;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.graph.TableRecord;

/**
 * Diagnostic utility for inspecting a converted graph.
 *
 * <p>
 * Generates human-readable text dumps of the emission order and Mermaid
 * diagrams of the network structure.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, the command line
 * {@code --explain} flag, or documentation.
 */
public final class GraphExplain {
    private final NetworkGraph graph;
    private final TopologicalOrder topology;

    public GraphExplain(NetworkGraph graph) {
        this(graph, TopologicalOrder.of(graph));
    }

    public GraphExplain(NetworkGraph graph, TopologicalOrder topology) {
        this.graph = graph;
        this.topology = topology;
    }

    /**
     * Dumps kind, states, parents, children and table size of a single node.
     */
    public String explainNode(String id) {
        int idx = topology.topoIndex(id);
        NodeRecord node = topology.node(idx);
        TableRecord table = graph.table(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n')
                .append("  States: ").append(node.states()).append('\n')
                .append("  Table size: ").append(table != null ? table.size() : 0).append('\n');
        int pc = topology.parentCount(idx);
        sb.append("  Parents (").append(pc).append("): ");
        for (int i = 0; i < pc; i++) {
            sb.append(topology.node(topology.parent(idx, i)).id());
            if (i < pc - 1)
                sb.append(", ");
        }
        sb.append('\n');
        int cc = topology.childCount(idx);
        sb.append("  Children (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.node(topology.child(idx, i)).id());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the emission order in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Network ").append(graph.name()).append(" (").append(topology.nodeCount()).append(" nodes):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            NodeRecord node = topology.node(i);
            sb.append("  [").append(i).append("] ").append(node.id())
                    .append(" (").append(node.kind()).append(')');
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).id());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram using influence diagram shapes:
     * ellipses for chance nodes, rectangles for decisions, diamonds for
     * utilities. Mermaid ids are {@code n<topo index>}; node names only
     * appear in labels.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in document order
        for (String id : graph.ids()) {
            NodeRecord node = graph.node(id);
            String label = node.label().replace("\"", "'");
            sb.append("  n").append(topology.topoIndex(id));
            switch (node.kind()) {
                case CHANCE -> sb.append("([\"").append(label).append("\"])");
                case DECISION -> sb.append("[\"").append(label).append("\"]");
                case UTILITY -> sb.append("{\"").append(label).append("\"}");
            }
            sb.append(";\n");
        }

        // 2. Declare all edges afterwards, in emission order
        for (int i = 0; i < topology.nodeCount(); i++) {
            for (int j = 0; j < topology.childCount(i); j++)
                sb.append("  n").append(i).append(" --> n").append(topology.child(i, j)).append(";\n");
        }
        return sb.toString();
    }
}
