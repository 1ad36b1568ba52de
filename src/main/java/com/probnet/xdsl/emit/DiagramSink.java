package com.probnet.xdsl.emit;

import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;

/**
 * Receives construction directives from {@link DiagramEmitter}.
 *
 * <p>
 * Directives arrive append-only: a node before any arc or table that names
 * it, and a node's arcs before its table.
 *
 * @param <R> artifact produced once the traversal ends
 */
public interface DiagramSink<R> {

    void begin(NetworkGraph graph);

    /** Adds a chance, decision or utility node. */
    void addNode(NodeRecord node);

    /** Adds an arc whose endpoints have both been added. */
    void addArc(ArcRecord arc);

    /**
     * Assigns the node's table.
     *
     * @param values flat values in the target potential layout
     */
    void fillTable(NodeRecord node, double[] values);

    R finish();
}
