package com.probnet.xdsl.validate;

/**
 * Failure kinds a conversion can report. All of them are collected into one
 * {@link ValidationReport}; none stops the checks that follow it.
 */
public enum IssueKind {
    MISSING_NODES_SECTION,
    MISSING_NODE_ID,
    UNKNOWN_NODE_KIND,
    UNSUPPORTED_TEMPORAL_CONSTRUCT,
    INVALID_TABLE_VALUE,
    DUPLICATE_NODE_ID,
    EMPTY_STATE_SPACE,
    DUPLICATE_STATE,
    DANGLING_ARC,
    INVALID_ARC,
    CYCLIC_GRAPH,
    MISSING_TABLE,
    TABLE_SIZE_MISMATCH
}
