package com.probnet.xdsl.validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.probnet.xdsl.extract.ExtractionResult;
import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeKind;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.graph.TableRecord;

import lombok.extern.log4j.Log4j2;

/**
 * Structural checks run between extraction and emission.
 *
 * <p>
 * Every check runs to completion and adds to a single report; nothing is
 * fail-fast. Conversion may continue only when the returned report is empty.
 */
@Log4j2
public final class GraphValidator {

    private static final byte WHITE = 0, ON_STACK = 1, DONE = 2;

    public ValidationReport validate(ExtractionResult extraction) {
        NetworkGraph graph = extraction.graph();
        List<ValidationIssue> issues = new ArrayList<>(extraction.issues());

        checkDuplicateIds(graph, issues);
        checkStates(graph, issues);
        checkArcs(graph, issues);
        checkCycles(graph, issues);
        checkTables(graph, issues);

        ValidationReport report = new ValidationReport(graph.name(), issues);
        if (report.isEmpty())
            log.debug("Graph {} passed validation", graph.name());
        else
            log.debug("Graph {} failed validation:\n{}", graph.name(), report.summary());
        return report;
    }

    private static void checkDuplicateIds(NetworkGraph graph, List<ValidationIssue> issues) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < graph.nodes().size(); i++) {
            NodeRecord n = graph.nodes().get(i);
            if (!seen.add(n.id())) {
                issues.add(ValidationIssue.of(IssueKind.DUPLICATE_NODE_ID, n.id(),
                        "Node id declared again at position " + i + " (first at "
                                + graph.declarationIndex(n.id()) + ")"));
            }
        }
    }

    private static void checkStates(NetworkGraph graph, List<ValidationIssue> issues) {
        for (String id : graph.ids()) {
            NodeRecord n = graph.node(id);
            if (!n.kind().hasStates())
                continue;
            if (n.states().isEmpty()) {
                issues.add(ValidationIssue.of(IssueKind.EMPTY_STATE_SPACE, id,
                        n.kind() + " node declares no states"));
                continue;
            }
            Set<String> labels = new HashSet<>();
            for (String s : n.states()) {
                if (!labels.add(s))
                    issues.add(ValidationIssue.of(IssueKind.DUPLICATE_STATE, id, "State '" + s + "' declared twice"));
            }
        }
    }

    private static void checkArcs(NetworkGraph graph, List<ValidationIssue> issues) {
        for (ArcRecord arc : graph.arcs()) {
            NodeRecord parent = graph.node(arc.parentId());
            if (parent == null) {
                issues.add(ValidationIssue.of(IssueKind.DANGLING_ARC, arc.childId(),
                        "Parent " + arc.parentId() + " is not declared"));
            } else if (parent.kind() == NodeKind.UTILITY) {
                issues.add(ValidationIssue.of(IssueKind.INVALID_ARC, arc.childId(),
                        "Utility node " + arc.parentId() + " cannot be a parent"));
            }
        }
    }

    /**
     * Iterative depth-first search with an on-stack marker. Each back edge is
     * one cycle; a self-loop is a back edge to the node itself.
     */
    private static void checkCycles(NetworkGraph graph, List<ValidationIssue> issues) {
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (String id : graph.ids())
            children.put(id, new ArrayList<>());
        for (ArcRecord arc : graph.arcs()) {
            if (graph.contains(arc.parentId()) && graph.contains(arc.childId()))
                children.get(arc.parentId()).add(arc.childId());
        }

        Map<String, Byte> color = new HashMap<>(children.size() * 2);
        for (String start : children.keySet()) {
            if (color.getOrDefault(start, WHITE) != WHITE)
                continue;
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(start));
            path.add(start);
            color.put(start, ON_STACK);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                List<String> out = children.get(top.node);
                if (top.next < out.size()) {
                    String child = out.get(top.next++);
                    byte c = color.getOrDefault(child, WHITE);
                    if (c == ON_STACK) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
                        cycle.add(child);
                        issues.add(ValidationIssue.of(IssueKind.CYCLIC_GRAPH, child,
                                "Cycle: " + String.join(" -> ", cycle)));
                    } else if (c == WHITE) {
                        color.put(child, ON_STACK);
                        stack.push(new Frame(child));
                        path.add(child);
                    }
                } else {
                    color.put(top.node, DONE);
                    stack.pop();
                    path.remove(path.size() - 1);
                }
            }
        }
    }

    private static void checkTables(NetworkGraph graph, List<ValidationIssue> issues) {
        Set<String> rejectedTables = new HashSet<>();
        for (ValidationIssue i : issues) {
            if (i.kind() == IssueKind.INVALID_TABLE_VALUE && i.nodeId() != null)
                rejectedTables.add(i.nodeId());
        }
        for (String id : graph.ids()) {
            NodeRecord n = graph.node(id);
            if (!n.kind().hasTable())
                continue;
            TableRecord table = graph.table(id);
            if (table == null && rejectedTables.contains(id))
                continue;
            if (table == null) {
                issues.add(ValidationIssue.of(IssueKind.MISSING_TABLE, id,
                        n.kind() + " node has no " + (n.kind() == NodeKind.CHANCE ? "probability" : "utility")
                                + " table"));
                continue;
            }

            long expected = 1;
            StringBuilder axes = new StringBuilder();
            boolean resolvable = true;
            for (String p : n.parents()) {
                NodeRecord pr = graph.node(p);
                if (pr == null || !pr.kind().hasStates() || pr.stateCount() == 0) {
                    resolvable = false; // already reported as an arc or state issue
                    break;
                }
                expected *= pr.stateCount();
                axes.append(p).append(':').append(pr.stateCount()).append(" x ");
            }
            if (!resolvable || (n.kind() == NodeKind.CHANCE && n.stateCount() == 0))
                continue;
            if (n.kind() == NodeKind.CHANCE) {
                expected *= n.stateCount();
                axes.append(id).append(':').append(n.stateCount());
            } else if (axes.length() > 0) {
                axes.setLength(axes.length() - 3);
            } else {
                axes.append("no parents");
            }

            if (table.size() != expected) {
                issues.add(ValidationIssue.of(IssueKind.TABLE_SIZE_MISMATCH, id,
                        "Table has " + table.size() + " value(s), expected " + expected + " (" + axes + ")"));
            }
        }
    }

    private static final class Frame {
        final String node;
        int next;

        Frame(String node) {
            this.node = node;
        }
    }
}
