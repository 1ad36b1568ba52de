package com.probnet.xdsl.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Named axes of a flat table, outermost first. The innermost (last) axis
 * varies fastest; strides are row-major.
 */
public final class TableShape {
    private final List<Axis> axes;
    private final int[] strides;
    private final Map<String, Integer> positions;
    private final int size;

    /** One table dimension. */
    public record Axis(String name, int size) {
        public Axis {
            if (size <= 0)
                throw new IllegalArgumentException("Axis " + name + " needs a positive size, got " + size);
        }
    }

    public TableShape(List<Axis> axes) {
        this.axes = Collections.unmodifiableList(new ArrayList<>(axes));
        this.positions = new HashMap<>(axes.size() * 2);
        this.strides = new int[axes.size()];
        long total = 1;
        for (int i = axes.size() - 1; i >= 0; i--) {
            Axis a = axes.get(i);
            if (positions.put(a.name(), i) != null)
                throw new IllegalArgumentException("Duplicate axis: " + a.name());
            strides[i] = (int) total;
            total *= a.size();
            if (total > Integer.MAX_VALUE)
                throw new IllegalArgumentException("Table too large: " + axes);
        }
        this.size = (int) total;
    }

    public static TableShape of(Axis... axes) {
        return new TableShape(List.of(axes));
    }

    public List<Axis> axes() {
        return axes;
    }

    public int rank() {
        return axes.size();
    }

    /** Number of cells; 1 for a shape without axes. */
    public int size() {
        return size;
    }

    public int stride(int axis) {
        return strides[axis];
    }

    /** Position of the named axis, or -1. */
    public int indexOf(String name) {
        Integer p = positions.get(name);
        return p == null ? -1 : p;
    }

    public List<String> axisNames() {
        List<String> names = new ArrayList<>(axes.size());
        for (Axis a : axes)
            names.add(a.name());
        return names;
    }

    /** Same axes arranged in {@code order}, which must be a permutation of them. */
    public TableShape reorder(List<String> order) {
        if (order.size() != axes.size())
            throw new IllegalArgumentException("Axis order " + order + " does not match " + axisNames());
        List<Axis> out = new ArrayList<>(order.size());
        for (String name : order) {
            int p = indexOf(name);
            if (p < 0)
                throw new IllegalArgumentException("Unknown axis " + name + " in order " + order);
            out.add(axes.get(p));
        }
        return new TableShape(out);
    }

    @Override
    public String toString() {
        return axes.toString();
    }
}
