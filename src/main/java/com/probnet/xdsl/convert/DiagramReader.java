package com.probnet.xdsl.convert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.probnet.xdsl.graph.DisplayInfo;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeKind;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.graph.TableRecord;
import com.probnet.xdsl.model.InfluenceDiagram;
import com.probnet.xdsl.model.LabelizedVariable;
import com.probnet.xdsl.model.Potential;
import com.probnet.xdsl.table.TableLayout;

/**
 * Maps an {@link InfluenceDiagram} back into a {@link NetworkGraph} with
 * tables in XDSL order. Together with
 * {@link com.probnet.xdsl.io.XdslWriter} this closes the loop from a model
 * back to a document.
 */
public final class DiagramReader {
    private DiagramReader() {
        // Utility class
    }

    public static NetworkGraph read(InfluenceDiagram diagram) {
        Map<String, NodeRecord> records = new LinkedHashMap<>();
        for (String name : diagram.names()) {
            NodeKind kind = diagram.kind(name);
            LabelizedVariable v = diagram.variable(name);
            DisplayInfo display = v.description().equals(name) ? null : DisplayInfo.named(v.description());
            records.put(name, new NodeRecord(name, kind, kind.hasStates() ? v.labels() : List.of(),
                    diagram.parents(name), display));
        }

        NetworkGraph.Builder graph = NetworkGraph.builder(diagram.name());
        for (NodeRecord node : records.values()) {
            graph.addNode(node);
            if (!node.kind().hasTable())
                continue;
            List<NodeRecord> parents = new ArrayList<>(node.parents().size());
            for (String p : node.parents())
                parents.add(records.get(p));
            Potential table = node.kind() == NodeKind.CHANCE ? diagram.cpt(node.id()) : diagram.utility(node.id());
            List<String> expected = new ArrayList<>(parents.size() + 1);
            expected.add(node.id());
            expected.addAll(node.parents());
            if (!table.names().equals(expected))
                throw new IllegalStateException("Potential of " + node.id() + " spans " + table.names()
                        + ", expected " + expected);
            graph.putTable(new TableRecord(node.id(), TableLayout.toXdsl(node, parents, table.toArray())));
        }
        return graph.build();
    }
}
