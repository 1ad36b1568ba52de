package com.probnet.xdsl.graph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Flat numeric table of one node, in XDSL storage order: parent axes
 * outermost in the node's declared parent order, own state innermost.
 */
public final class TableRecord {
    private final String nodeId;
    private final double[] values;

    public TableRecord(String nodeId, double[] values) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.values = values.clone();
    }

    public String nodeId() {
        return nodeId;
    }

    /** Returns a copy of the values. */
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double valueAt(int i) {
        return values[i];
    }

    /** Returns a new record with every value multiplied by {@code factor}. */
    public TableRecord scaled(double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++)
            out[i] = values[i] * factor;
        return new TableRecord(nodeId, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TableRecord other))
            return false;
        return nodeId.equals(other.nodeId) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * nodeId.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TableRecord[" + nodeId + ", " + Arrays.toString(values) + "]";
    }
}
