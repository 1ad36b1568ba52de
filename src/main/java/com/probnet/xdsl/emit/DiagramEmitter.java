package com.probnet.xdsl.emit;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.probnet.xdsl.engine.TopologicalOrder;
import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.graph.TableRecord;
import com.probnet.xdsl.table.TableLayout;

import lombok.extern.log4j.Log4j2;

/**
 * Walks a validated graph in topological order and feeds a sink: for each
 * node the node itself, then one arc per declared parent, then its table
 * reindexed into the target layout. Both output modes share this traversal.
 */
@Log4j2
public final class DiagramEmitter {

    public <R> R emit(NetworkGraph graph, DiagramSink<R> sink) {
        return emit(graph, TopologicalOrder.of(graph), sink);
    }

    public <R> R emit(NetworkGraph graph, TopologicalOrder order, DiagramSink<R> sink) {
        Set<String> emitted = new HashSet<>(order.nodeCount() * 2);
        Set<ArcRecord> arcs = new HashSet<>();
        sink.begin(graph);

        for (int ti = 0; ti < order.nodeCount(); ti++) {
            NodeRecord node = order.node(ti);
            sink.addNode(node);
            emitted.add(node.id());

            for (String p : node.parents()) {
                if (!emitted.contains(p))
                    throw new IllegalStateException("Arc " + p + " -> " + node.id() + " references a node not yet emitted");
                ArcRecord arc = new ArcRecord(p, node.id());
                if (arcs.add(arc))
                    sink.addArc(arc);
            }

            if (node.kind().hasTable()) {
                TableRecord table = graph.table(node.id());
                if (table == null)
                    throw new IllegalStateException("Node " + node.id() + " reached emission without a table");
                List<NodeRecord> parents = graph.parentsOf(node.id());
                sink.fillTable(node, TableLayout.toTarget(node, parents, table.values()));
            }
        }
        log.debug("Emitted {} nodes and {} arcs of {}", emitted.size(), arcs.size(), graph.name());
        return sink.finish();
    }
}
