package com.probnet.xdsl.emit;

import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.model.InfluenceDiagram;
import com.probnet.xdsl.model.LabelizedVariable;

/**
 * Builds a populated {@link InfluenceDiagram}.
 */
public final class DiagramModelSink implements DiagramSink<InfluenceDiagram> {
    private InfluenceDiagram diagram;

    @Override
    public void begin(NetworkGraph graph) {
        diagram = new InfluenceDiagram(graph.name());
    }

    @Override
    public void addNode(NodeRecord node) {
        switch (node.kind()) {
            case CHANCE -> diagram.addChanceNode(new LabelizedVariable(node.id(), node.label(), node.states()));
            case DECISION -> diagram.addDecisionNode(new LabelizedVariable(node.id(), node.label(), node.states()));
            case UTILITY -> diagram.addUtilityNode(LabelizedVariable.ofSize(node.id(), node.label(), 1));
        }
    }

    @Override
    public void addArc(ArcRecord arc) {
        diagram.addArc(arc.parentId(), arc.childId());
    }

    @Override
    public void fillTable(NodeRecord node, double[] values) {
        switch (node.kind()) {
            case CHANCE -> diagram.cpt(node.id()).fillWith(values);
            case UTILITY -> diagram.utility(node.id()).fillWith(values);
            case DECISION -> throw new IllegalStateException("Decision node " + node.id() + " has no table");
        }
    }

    @Override
    public InfluenceDiagram finish() {
        InfluenceDiagram out = diagram;
        diagram = null;
        return out;
    }
}
