package com.probnet.xdsl.graph;

import java.util.Objects;

/**
 * Directed arc {@code parentId -> childId}.
 */
public record ArcRecord(String parentId, String childId) {
    public ArcRecord {
        Objects.requireNonNull(parentId, "parentId");
        Objects.requireNonNull(childId, "childId");
    }

    @Override
    public String toString() {
        return parentId + " -> " + childId;
    }
}
