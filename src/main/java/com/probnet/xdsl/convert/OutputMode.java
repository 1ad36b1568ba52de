package com.probnet.xdsl.convert;

/** Sink selected by the caller; both share the same traversal. */
public enum OutputMode {
    /** Standalone pyAgrum construction script. */
    SCRIPT,
    /** Populated in-memory {@link com.probnet.xdsl.model.InfluenceDiagram}. */
    MODEL;

    public static OutputMode fromString(String text) {
        for (OutputMode m : values()) {
            if (m.name().equalsIgnoreCase(text))
                return m;
        }
        throw new IllegalArgumentException("Unknown OutputMode: " + text);
    }
}
