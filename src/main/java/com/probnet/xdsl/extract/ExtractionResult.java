package com.probnet.xdsl.extract;

import java.util.List;

import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.validate.ValidationIssue;

/**
 * Graph built by {@link GraphExtractor} plus the problems found while
 * building it. The validator appends to these issues.
 */
public record ExtractionResult(NetworkGraph graph, List<ValidationIssue> issues) {
    public ExtractionResult {
        issues = List.copyOf(issues);
    }
}
