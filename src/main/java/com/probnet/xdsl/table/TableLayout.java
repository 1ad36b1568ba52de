package com.probnet.xdsl.table;

import java.util.ArrayList;
import java.util.List;

import com.probnet.xdsl.graph.NodeKind;
import com.probnet.xdsl.graph.NodeRecord;

/**
 * The two table storage conventions a conversion reconciles.
 *
 * <ul>
 * <li>XDSL: parent axes outermost in the node's declared parent order, own
 * state innermost.</li>
 * <li>Target potentials: variable sequence {@code [own, p1 .. pn]} with the
 * first variable varying fastest, so outermost first the order is
 * {@code [pn .. p1, own]}.</li>
 * </ul>
 * Utility tables have no own axis; the dummy single-label variable of a
 * target utility node has size 1 and is left out.
 */
public final class TableLayout {
    private TableLayout() {
        // Utility class
    }

    /** Shape of the node's table as stored in XDSL. */
    public static TableShape xdsl(NodeRecord node, List<NodeRecord> parents) {
        requireTable(node);
        List<TableShape.Axis> axes = new ArrayList<>(parents.size() + 1);
        for (NodeRecord p : parents)
            axes.add(new TableShape.Axis(p.id(), p.stateCount()));
        if (node.kind() == NodeKind.CHANCE)
            axes.add(new TableShape.Axis(node.id(), node.stateCount()));
        return new TableShape(axes);
    }

    /** Axis names, outermost first, of the target potential layout. */
    public static List<String> targetOrder(NodeRecord node, List<NodeRecord> parents) {
        requireTable(node);
        List<String> order = new ArrayList<>(parents.size() + 1);
        for (int i = parents.size() - 1; i >= 0; i--)
            order.add(parents.get(i).id());
        if (node.kind() == NodeKind.CHANCE)
            order.add(node.id());
        return order;
    }

    /** Axis names, outermost first, of the XDSL layout. */
    public static List<String> xdslOrder(NodeRecord node, List<NodeRecord> parents) {
        return xdsl(node, parents).axisNames();
    }

    /** Reorders XDSL values into the target potential layout. */
    public static double[] toTarget(NodeRecord node, List<NodeRecord> parents, double[] xdslValues) {
        return TableReindexer.permute(xdslValues, xdsl(node, parents), targetOrder(node, parents));
    }

    /** Reorders target potential values back into the XDSL layout. */
    public static double[] toXdsl(NodeRecord node, List<NodeRecord> parents, double[] targetValues) {
        TableShape target = xdsl(node, parents).reorder(targetOrder(node, parents));
        return TableReindexer.permute(targetValues, target, xdslOrder(node, parents));
    }

    private static void requireTable(NodeRecord node) {
        if (!node.kind().hasTable())
            throw new IllegalArgumentException(node.kind() + " node " + node.id() + " has no table");
    }
}
