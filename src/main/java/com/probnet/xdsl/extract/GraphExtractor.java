package com.probnet.xdsl.extract;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.probnet.xdsl.graph.DisplayInfo;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeKind;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.graph.TableRecord;
import com.probnet.xdsl.io.XmlElement;
import com.probnet.xdsl.validate.IssueKind;
import com.probnet.xdsl.validate.ValidationIssue;

import lombok.extern.log4j.Log4j2;

/**
 * Walks an XDSL tree once and flattens it into a {@link NetworkGraph}.
 *
 * <p>
 * Tables are captured exactly as the document lists them; no reordering
 * happens here. Problems are collected as {@link ValidationIssue}s instead of
 * thrown, so the validator can report them together with its own findings.
 */
@Log4j2
public final class GraphExtractor {
    private static final String DYNAMIC = "dynamic";
    private static final String ORDER = "order";

    private final boolean applyMauWeights;

    public GraphExtractor() {
        this(true);
    }

    /**
     * @param applyMauWeights multiply utility tables by the weights of the
     *                        {@code mau} nodes that reference them
     */
    public GraphExtractor(boolean applyMauWeights) {
        this.applyMauWeights = applyMauWeights;
    }

    public ExtractionResult extract(XmlElement root) {
        List<ValidationIssue> issues = new ArrayList<>();
        NetworkGraph.Builder graph = NetworkGraph.builder(root.attribute("id"));

        findTemporalSections(root, issues);

        XmlElement nodesEl = root.child("nodes");
        if (nodesEl == null) {
            issues.add(ValidationIssue.of(IssueKind.MISSING_NODES_SECTION, null,
                    "Document root <" + root.getName() + "> has no <nodes> section"));
            return new ExtractionResult(graph.build(), issues);
        }

        Map<String, DisplayInfo> display = readDisplayInfo(root);
        Map<String, NodeRecord> firstById = new HashMap<>();
        List<XmlElement> mauElements = new ArrayList<>();

        for (XmlElement el : nodesEl.getChildren()) {
            String id = el.attribute("id");
            XdslElementType type = XdslElementType.fromTag(el.getName());
            if (type == null) {
                issues.add(ValidationIssue.of(IssueKind.UNKNOWN_NODE_KIND, id,
                        "Element <" + el.getName() + "> is not a chance, decision or utility node"));
                continue;
            }
            if (id == null || id.isBlank()) {
                issues.add(ValidationIssue.of(IssueKind.MISSING_NODE_ID, null,
                        "<" + el.getName() + "> element without an id attribute"));
                continue;
            }
            String temporal = temporalMarker(el);
            if (temporal != null) {
                issues.add(ValidationIssue.of(IssueKind.UNSUPPORTED_TEMPORAL_CONSTRUCT, id, temporal));
                continue;
            }
            if (!type.definesNode()) {
                mauElements.add(el);
                continue;
            }

            NodeRecord node = readNode(el, id, type.kind(), display.get(id));
            graph.addNode(node);
            firstById.putIfAbsent(id, node);

            TableRecord table = readTable(el, node, type, issues);
            if (table != null)
                graph.putTable(table);
        }

        applyMaus(mauElements, graph, firstById, issues);

        NetworkGraph result = graph.build();
        log.debug("Extracted {} with {} issue(s)", result, issues.size());
        return new ExtractionResult(result, issues);
    }

    private NodeRecord readNode(XmlElement el, String id, NodeKind kind, DisplayInfo display) {
        List<String> states = new ArrayList<>();
        for (XmlElement s : el.children("state")) {
            String sid = s.attribute("id");
            if (sid == null) {
                log.warn("Ignoring <state> without id on node {}", id);
                continue;
            }
            states.add(sid);
        }
        if (kind == NodeKind.UTILITY && !states.isEmpty()) {
            log.warn("Utility node {} declares {} state(s); utility nodes have none, ignoring them", id,
                    states.size());
            states.clear();
        }

        Set<String> parents = new LinkedHashSet<>();
        XmlElement parentsEl = el.child("parents");
        if (parentsEl != null) {
            for (String p : parentsEl.tokens()) {
                if (!parents.add(p))
                    log.debug("Node {} lists parent {} more than once", id, p);
            }
        }
        return new NodeRecord(id, kind, states, new ArrayList<>(parents), display);
    }

    private TableRecord readTable(XmlElement el, NodeRecord node, XdslElementType type,
            List<ValidationIssue> issues) {
        if (type.tableElement() == null)
            return null;
        XmlElement tableEl = el.child(type.tableElement());
        if (tableEl == null)
            return null;

        if (type == XdslElementType.DETERMINISTIC)
            return expandDeterministic(node, tableEl.tokens(), issues);

        double[] values = parseNumbers(node.id(), tableEl.tokens(), issues);
        return values == null ? null : new TableRecord(node.id(), values);
    }

    /** One one-hot block per listed resulting state, in document order. */
    private static TableRecord expandDeterministic(NodeRecord node, List<String> labels,
            List<ValidationIssue> issues) {
        int k = node.stateCount();
        double[] values = new double[labels.size() * k];
        for (int i = 0; i < labels.size(); i++) {
            int s = node.states().indexOf(labels.get(i));
            if (s < 0) {
                issues.add(ValidationIssue.of(IssueKind.INVALID_TABLE_VALUE, node.id(),
                        "Resulting state '" + labels.get(i) + "' at position " + i + " is not a state of the node"));
                return null;
            }
            values[i * k + s] = 1.0;
        }
        return new TableRecord(node.id(), values);
    }

    private static double[] parseNumbers(String owner, List<String> tokens, List<ValidationIssue> issues) {
        double[] values = new double[tokens.size()];
        for (int i = 0; i < values.length; i++) {
            String tok = tokens.get(i);
            double v;
            try {
                v = Double.parseDouble(tok);
            } catch (NumberFormatException e) {
                v = Double.NaN;
            }
            if (!Double.isFinite(v)) {
                issues.add(ValidationIssue.of(IssueKind.INVALID_TABLE_VALUE, owner,
                        "Value '" + tok + "' at position " + i + " is not a finite number"));
                return null;
            }
            values[i] = v;
        }
        return values;
    }

    /**
     * Pairs each MAU's weights with its parents and scales the utility tables
     * underneath. A MAU may weight other MAUs; a leaf utility then receives
     * the product of the weights along each path from a top-level MAU, summed
     * over paths.
     */
    private void applyMaus(List<XmlElement> mauElements, NetworkGraph.Builder graph, Map<String, NodeRecord> nodes,
            List<ValidationIssue> issues) {
        Set<String> mauIds = new HashSet<>();
        for (XmlElement mau : mauElements) {
            String id = mau.attribute("id");
            if (nodes.containsKey(id) || !mauIds.add(id))
                issues.add(ValidationIssue.of(IssueKind.DUPLICATE_NODE_ID, id, "MAU node id declared again"));
        }

        Map<String, Map<String, Double>> weighted = new LinkedHashMap<>();
        Set<String> referenced = new HashSet<>();
        for (XmlElement mau : mauElements) {
            String id = mau.attribute("id");
            Map<String, Double> edges = readMau(mau, nodes, mauIds, issues);
            if (edges == null || weighted.containsKey(id))
                continue;
            weighted.put(id, edges);
            for (String target : edges.keySet()) {
                if (mauIds.contains(target))
                    referenced.add(target);
            }
        }

        Map<String, Double> leafWeights = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Set<String> cyclic = new HashSet<>();
        for (String id : weighted.keySet()) {
            if (!referenced.contains(id))
                propagate(id, 1.0, weighted, new LinkedHashSet<>(), visited, cyclic, leafWeights, issues);
        }
        for (String id : weighted.keySet()) {
            if (!visited.contains(id) && cyclic.add(id))
                issues.add(ValidationIssue.of(IssueKind.CYCLIC_GRAPH, id, "MAU node is only reachable through a cycle"));
        }

        if (!applyMauWeights)
            return;
        for (Map.Entry<String, Double> e : leafWeights.entrySet()) {
            TableRecord table = graph.table(e.getKey());
            if (table != null) {
                graph.replaceTable(table.scaled(e.getValue()));
                log.debug("Scaled utility table of {} by MAU weight {}", e.getKey(), e.getValue());
            }
        }
    }

    /** Weight per parent id of one MAU element, or {@code null} when its weights are unusable. */
    private static Map<String, Double> readMau(XmlElement mau, Map<String, NodeRecord> nodes, Set<String> mauIds,
            List<ValidationIssue> issues) {
        String id = mau.attribute("id");
        XmlElement parentsEl = mau.child("parents");
        XmlElement weightsEl = mau.child("weights");
        List<String> parents = parentsEl != null ? parentsEl.tokens() : List.of();
        double[] weights = parseNumbers(id, weightsEl != null ? weightsEl.tokens() : List.of(), issues);
        if (weights == null)
            return null;
        if (weights.length != parents.size()) {
            issues.add(ValidationIssue.of(IssueKind.INVALID_TABLE_VALUE, id,
                    "MAU node lists " + parents.size() + " parent(s) but " + weights.length + " weight(s)"));
            return null;
        }

        Map<String, Double> edges = new LinkedHashMap<>();
        for (int i = 0; i < weights.length; i++) {
            String target = parents.get(i);
            NodeRecord node = nodes.get(target);
            if (node == null && !mauIds.contains(target)) {
                issues.add(ValidationIssue.of(IssueKind.DANGLING_ARC, id,
                        "MAU node references unknown node " + target));
            } else if (node != null && node.kind() != NodeKind.UTILITY) {
                issues.add(ValidationIssue.of(IssueKind.INVALID_ARC, id,
                        "MAU node weights " + node.kind() + " node " + target + "; only utility and MAU nodes can be weighted"));
            } else {
                edges.merge(target, weights[i], Double::sum);
            }
        }
        return edges;
    }

    private static void propagate(String mau, double factor, Map<String, Map<String, Double>> weighted,
            Set<String> path, Set<String> visited, Set<String> cyclic, Map<String, Double> leafWeights,
            List<ValidationIssue> issues) {
        if (!path.add(mau)) {
            if (cyclic.add(mau))
                issues.add(ValidationIssue.of(IssueKind.CYCLIC_GRAPH, mau,
                        "MAU cycle: " + String.join(" -> ", path) + " -> " + mau));
            return;
        }
        visited.add(mau);
        for (Map.Entry<String, Double> e : weighted.get(mau).entrySet()) {
            double w = factor * e.getValue();
            if (weighted.containsKey(e.getKey()))
                propagate(e.getKey(), w, weighted, path, visited, cyclic, leafWeights, issues);
            else
                leafWeights.merge(e.getKey(), w, Double::sum);
        }
        path.remove(mau);
    }

    /** Describes a time-slice marker on a node element, or returns {@code null}. */
    private static String temporalMarker(XmlElement el) {
        if (el.hasAttribute(DYNAMIC))
            return "Node is marked dynamic=\"" + el.attribute(DYNAMIC) + "\"";
        if (el.hasAttribute(ORDER))
            return "Node carries time-slice order=\"" + el.attribute(ORDER) + "\"";
        XmlElement parents = el.child("parents");
        if (parents != null && parents.hasAttribute(ORDER))
            return "Parents carry time-slice order=\"" + parents.attribute(ORDER) + "\"";
        return null;
    }

    /** Reports every {@code <dynamic>} section outside the presentation extensions. */
    private static void findTemporalSections(XmlElement el, List<ValidationIssue> issues) {
        for (XmlElement c : el.getChildren()) {
            if (c.getName().equals("extensions"))
                continue;
            if (c.getName().equals(DYNAMIC)) {
                List<String> ids = new ArrayList<>();
                for (XmlElement n : c.getChildren()) {
                    if (n.attribute("id") != null)
                        ids.add(n.attribute("id"));
                }
                issues.add(ValidationIssue.of(IssueKind.UNSUPPORTED_TEMPORAL_CONSTRUCT, null,
                        "Time-sliced <dynamic> section" + (c.attribute("numslices") != null
                                ? " with " + c.attribute("numslices") + " slices"
                                : "") + (ids.isEmpty() ? "" : " covering " + String.join(", ", ids))));
                continue;
            }
            findTemporalSections(c, issues);
        }
    }

    private static Map<String, DisplayInfo> readDisplayInfo(XmlElement root) {
        Map<String, DisplayInfo> out = new HashMap<>();
        XmlElement ext = root.child("extensions");
        XmlElement genie = ext != null ? ext.child("genie") : null;
        if (genie != null)
            collectDisplayNodes(genie, out);
        return out;
    }

    // GeNIe nests nodes inside <submodel> elements.
    private static void collectDisplayNodes(XmlElement parent, Map<String, DisplayInfo> out) {
        for (XmlElement c : parent.getChildren()) {
            if (c.getName().equals("node") && c.attribute("id") != null) {
                out.putIfAbsent(c.attribute("id"), readDisplay(c));
            } else if (c.getName().equals("submodel")) {
                collectDisplayNodes(c, out);
            }
        }
    }

    private static DisplayInfo readDisplay(XmlElement node) {
        DisplayInfo.DisplayInfoBuilder d = DisplayInfo.builder();
        XmlElement name = node.child("name");
        if (name != null)
            d.name(name.getText());
        XmlElement comment = node.child("comment");
        if (comment != null)
            d.comment(comment.getText());
        XmlElement interior = node.child("interior");
        if (interior != null)
            d.interiorColor(interior.attribute("color"));
        XmlElement outline = node.child("outline");
        if (outline != null)
            d.outlineColor(outline.attribute("color"));
        XmlElement position = node.child("position");
        if (position != null) {
            List<String> t = position.tokens();
            if (t.size() == 4) {
                try {
                    d.position(new int[] { Integer.parseInt(t.get(0)), Integer.parseInt(t.get(1)),
                            Integer.parseInt(t.get(2)), Integer.parseInt(t.get(3)) });
                } catch (NumberFormatException e) {
                    log.debug("Ignoring unreadable position of node {}: {}", node.attribute("id"), position.getText());
                }
            }
        }
        return d.build();
    }
}
