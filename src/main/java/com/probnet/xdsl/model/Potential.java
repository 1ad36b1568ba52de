package com.probnet.xdsl.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Multi-dimensional table over a sequence of variables. The first variable
 * of the sequence varies fastest in the flat storage.
 *
 * <p>
 * Adding a variable resets every value to zero, so a table is filled once its
 * node's arcs are all in place.
 */
public final class Potential {
    private final List<LabelizedVariable> variables = new ArrayList<>();
    private double[] values;

    Potential(LabelizedVariable owner) {
        variables.add(owner);
        values = new double[owner.domainSize()];
    }

    void add(LabelizedVariable v) {
        for (LabelizedVariable existing : variables) {
            if (existing.name().equals(v.name()))
                throw new IllegalArgumentException("Variable " + v.name() + " already in potential");
        }
        variables.add(v);
        values = new double[Math.multiplyExact(values.length, v.domainSize())];
    }

    /** Variables in storage order, fastest first. */
    public List<LabelizedVariable> variableSequence() {
        return Collections.unmodifiableList(variables);
    }

    public int domainSize() {
        return values.length;
    }

    /** Replaces every value; {@code data} must match the domain size exactly. */
    public Potential fillWith(double[] data) {
        if (data.length != values.length)
            throw new IllegalArgumentException("Potential over " + names() + " needs " + values.length
                    + " values, got " + data.length);
        values = data.clone();
        return this;
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Value at the given instantiation. Every variable of the sequence must be
     * bound, except single-label variables which default to their only label.
     */
    public double get(Map<String, String> instantiation) {
        int offset = 0, stride = 1;
        for (LabelizedVariable v : variables) {
            String label = instantiation.get(v.name());
            int idx;
            if (label != null)
                idx = v.index(label);
            else if (v.domainSize() == 1)
                idx = 0;
            else
                throw new IllegalArgumentException("Variable " + v.name() + " is not instantiated");
            offset += idx * stride;
            stride *= v.domainSize();
        }
        return values[offset];
    }

    public List<String> names() {
        List<String> out = new ArrayList<>(variables.size());
        for (LabelizedVariable v : variables)
            out.add(v.name());
        return out;
    }

    @Override
    public String toString() {
        return "Potential" + names() + Arrays.toString(values);
    }
}
