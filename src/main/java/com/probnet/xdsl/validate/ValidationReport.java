package com.probnet.xdsl.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Accumulated result of validating one document. Empty means the graph may be
 * ordered and emitted.
 */
public final class ValidationReport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String document;
    private final List<ValidationIssue> issues;

    public ValidationReport(String document, List<ValidationIssue> issues) {
        this.document = document;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public static ValidationReport empty(String document) {
        return new ValidationReport(document, List.of());
    }

    public String document() {
        return document;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public int size() {
        return issues.size();
    }

    public List<ValidationIssue> issuesOf(IssueKind kind) {
        List<ValidationIssue> out = new ArrayList<>();
        for (ValidationIssue i : issues) {
            if (i.kind() == kind)
                out.add(i);
        }
        return out;
    }

    public boolean has(IssueKind kind) {
        for (ValidationIssue i : issues) {
            if (i.kind() == kind)
                return true;
        }
        return false;
    }

    /** Throws {@link XdslValidationException} unless the report is empty. */
    public void throwIfInvalid() {
        if (!isEmpty())
            throw new XdslValidationException(this);
    }

    /** One issue per line. */
    public String summary() {
        StringBuilder sb = new StringBuilder(64 * (issues.size() + 1));
        for (ValidationIssue i : issues)
            sb.append("  ").append(i).append('\n');
        return sb.toString();
    }

    /** JSON rendering for UI collaborators. */
    public String toJson() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("document", document);
        body.put("valid", isEmpty());
        body.put("issueCount", issues.size());
        body.put("issues", issues);
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Validation report cannot be serialized", e);
        }
    }

    @Override
    public String toString() {
        return isEmpty() ? "ValidationReport[valid]" : "ValidationReport[" + issues.size() + " issues]";
    }
}
