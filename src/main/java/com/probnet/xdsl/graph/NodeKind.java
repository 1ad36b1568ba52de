package com.probnet.xdsl.graph;

/**
 * Closed set of node kinds an influence diagram can hold.
 */
public enum NodeKind {
    /** Random variable with a CPT indexed by its parents' states. */
    CHANCE,
    /** Controllable choice among discrete options, no table. */
    DECISION,
    /** Real-valued payoff table over the parents' states, no own states. */
    UTILITY;

    /** Whether a node of this kind owns a discrete state space. */
    public boolean hasStates() {
        return switch (this) {
            case CHANCE, DECISION -> true;
            case UTILITY -> false;
        };
    }

    /** Whether a node of this kind must carry a table. */
    public boolean hasTable() {
        return switch (this) {
            case CHANCE, UTILITY -> true;
            case DECISION -> false;
        };
    }
}
