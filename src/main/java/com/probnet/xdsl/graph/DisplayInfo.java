package com.probnet.xdsl.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Presentation metadata of a node, taken from the GeNIe extension section.
 * Conversion logic never reads it; it is only carried through to outputs.
 */
@Value
public class DisplayInfo {
    String name;
    String comment;
    String interiorColor;
    String outlineColor;
    /** left, top, right, bottom; {@code null} when the document has none. */
    int[] position;

    @Builder
    private DisplayInfo(String name, String comment, String interiorColor, String outlineColor, int[] position) {
        this.name = name;
        this.comment = comment;
        this.interiorColor = interiorColor;
        this.outlineColor = outlineColor;
        this.position = position == null ? null : position.clone();
    }

    public static DisplayInfo named(String name) {
        return builder().name(name).build();
    }

    /** Returns a copy, or {@code null}. */
    public int[] getPosition() {
        return position == null ? null : position.clone();
    }

    public boolean hasPosition() {
        return position != null && position.length == 4;
    }
}
