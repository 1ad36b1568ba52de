package com.probnet.xdsl.graph;

import java.util.List;
import java.util.Objects;

/**
 * One node of the intermediate graph.
 *
 * @param id      unique identifier
 * @param kind    chance, decision or utility
 * @param states  state labels in declaration order, empty for utility nodes
 * @param parents parent ids in the order the node lists them
 * @param display presentation metadata, may be {@code null}
 */
public record NodeRecord(String id, NodeKind kind, List<String> states, List<String> parents, DisplayInfo display) {
    public NodeRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        states = List.copyOf(states);
        parents = List.copyOf(parents);
    }

    public int stateCount() {
        return states.size();
    }

    /** Display name when present, the id otherwise. */
    public String label() {
        return display != null && display.getName() != null && !display.getName().isEmpty()
                ? display.getName()
                : id;
    }
}
