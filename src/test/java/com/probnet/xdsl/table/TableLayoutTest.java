package com.probnet.xdsl.table;

import com.probnet.xdsl.graph.NodeKind;
import com.probnet.xdsl.graph.NodeRecord;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TableLayoutTest {

    private static final NodeRecord X = new NodeRecord("X", NodeKind.CHANCE, List.of("x0", "x1"), List.of(), null);
    private static final NodeRecord Y = new NodeRecord("Y", NodeKind.DECISION, List.of("y0", "y1", "y2"), List.of(),
            null);
    private static final NodeRecord Z = new NodeRecord("Z", NodeKind.CHANCE, List.of("z0", "z1"), List.of("X", "Y"),
            null);
    private static final NodeRecord U = new NodeRecord("U", NodeKind.UTILITY, List.of(), List.of("X", "Y"), null);

    @Test
    public void testOrders() {
        assertEquals(List.of("X", "Y", "Z"), TableLayout.xdslOrder(Z, List.of(X, Y)));
        assertEquals(List.of("Y", "X", "Z"), TableLayout.targetOrder(Z, List.of(X, Y)));
        assertEquals(List.of("X", "Y"), TableLayout.xdslOrder(U, List.of(X, Y)));
        assertEquals(List.of("Y", "X"), TableLayout.targetOrder(U, List.of(X, Y)));
    }

    @Test
    public void testChanceToTarget() {
        double[] xdsl = { 0.1, 0.9, 0.2, 0.8, 0.3, 0.7, 0.4, 0.6, 0.5, 0.5, 0.6, 0.4 };
        double[] target = TableLayout.toTarget(Z, List.of(X, Y), xdsl);

        // own state fastest, then X, then Y
        assertArrayEquals(new double[] { 0.1, 0.9, 0.4, 0.6, 0.2, 0.8, 0.5, 0.5, 0.3, 0.7, 0.6, 0.4 }, target, 0.0);
        assertArrayEquals(xdsl, TableLayout.toXdsl(Z, List.of(X, Y), target), 0.0);
    }

    @Test
    public void testUtilityToTarget() {
        // X outer, Y inner
        double[] xdsl = { 1, 2, 3, 4, 5, 6 };
        double[] target = TableLayout.toTarget(U, List.of(X, Y), xdsl);

        assertArrayEquals(new double[] { 1, 4, 2, 5, 3, 6 }, target, 0.0);
        assertArrayEquals(xdsl, TableLayout.toXdsl(U, List.of(X, Y), target), 0.0);
    }

    @Test
    public void testSingleParentNeedsNoReordering() {
        NodeRecord b = new NodeRecord("B", NodeKind.CHANCE, List.of("t", "f"), List.of("X"), null);
        double[] xdsl = { 0.9, 0.1, 0.2, 0.8 };
        assertArrayEquals(xdsl, TableLayout.toTarget(b, List.of(X), xdsl), 0.0);
    }

    @Test
    public void testShape() {
        TableShape shape = TableLayout.xdsl(Z, List.of(X, Y));
        assertEquals(12, shape.size());
        assertEquals(3, shape.rank());
        assertEquals(1, TableLayout.xdsl(new NodeRecord("V", NodeKind.UTILITY, List.of(), List.of(), null),
                List.of()).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDecisionHasNoTable() {
        TableLayout.xdsl(Y, List.of());
    }
}
