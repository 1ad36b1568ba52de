package com.probnet.xdsl.validate;

import java.util.Objects;

/**
 * A single problem found in a document.
 *
 * @param kind    failure kind
 * @param nodeId  offending node or element id, {@code null} for document-level problems
 * @param message human-readable detail
 */
public record ValidationIssue(IssueKind kind, String nodeId, String message) {
    public ValidationIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationIssue of(IssueKind kind, String nodeId, String message) {
        return new ValidationIssue(kind, nodeId, message);
    }

    @Override
    public String toString() {
        return kind + (nodeId != null ? " [" + nodeId + "]" : "") + ": " + message;
    }
}
