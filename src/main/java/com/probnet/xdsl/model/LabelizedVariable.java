package com.probnet.xdsl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Discrete variable with named labels.
 *
 * @param name        unique variable name
 * @param description free text, typically the display name
 * @param labels      labels in index order
 */
public record LabelizedVariable(String name, String description, List<String> labels) {
    public LabelizedVariable {
        Objects.requireNonNull(name, "name");
        description = description == null ? name : description;
        labels = List.copyOf(labels);
        if (labels.isEmpty())
            throw new IllegalArgumentException("Variable " + name + " needs at least one label");
    }

    /** Variable with {@code count} labels named "0", "1", ... */
    public static LabelizedVariable ofSize(String name, String description, int count) {
        List<String> labels = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
            labels.add(Integer.toString(i));
        return new LabelizedVariable(name, description, labels);
    }

    public int domainSize() {
        return labels.size();
    }

    public int index(String label) {
        int i = labels.indexOf(label);
        if (i < 0)
            throw new IllegalArgumentException("Variable " + name + " has no label '" + label + "'");
        return i;
    }
}
