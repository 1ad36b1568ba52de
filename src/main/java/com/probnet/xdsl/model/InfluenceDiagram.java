package com.probnet.xdsl.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NodeKind;

/**
 * In-memory influence diagram mirroring the pyAgrum construction API.
 *
 * <p>
 * Chance nodes own a CPT, utility nodes own a utility table and decision
 * nodes own nothing. Adding an arc appends the parent's variable to the
 * child's table, so tables are filled after all arcs of a node are added.
 * Not thread-safe; one instance belongs to one conversion.
 */
public final class InfluenceDiagram {
    private final String name;
    private final Map<String, Entry> nodes = new LinkedHashMap<>();
    private final List<ArcRecord> arcs = new ArrayList<>();

    private static final class Entry {
        final NodeKind kind;
        final LabelizedVariable variable;
        final Potential table;
        final Set<String> parents = new LinkedHashSet<>();

        Entry(NodeKind kind, LabelizedVariable variable) {
            this.kind = kind;
            this.variable = variable;
            this.table = kind.hasTable() ? new Potential(variable) : null;
        }
    }

    public InfluenceDiagram() {
        this(null);
    }

    public InfluenceDiagram(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public InfluenceDiagram addChanceNode(LabelizedVariable v) {
        return add(NodeKind.CHANCE, v);
    }

    public InfluenceDiagram addDecisionNode(LabelizedVariable v) {
        return add(NodeKind.DECISION, v);
    }

    /** The variable of a utility node must have exactly one label. */
    public InfluenceDiagram addUtilityNode(LabelizedVariable v) {
        if (v.domainSize() != 1)
            throw new IllegalArgumentException("Utility variable " + v.name() + " must have exactly one label, has "
                    + v.domainSize());
        return add(NodeKind.UTILITY, v);
    }

    private InfluenceDiagram add(NodeKind kind, LabelizedVariable v) {
        if (nodes.containsKey(v.name()))
            throw new IllegalArgumentException("Node " + v.name() + " already exists");
        nodes.put(v.name(), new Entry(kind, v));
        return this;
    }

    /**
     * Adds {@code parent -> child}.
     *
     * @return {@code false} if the arc already existed
     * @throws IllegalArgumentException for unknown nodes, a utility parent, or
     *                                  an arc that would close a cycle
     */
    public boolean addArc(String parent, String child) {
        Entry p = require(parent), c = require(child);
        if (p.kind == NodeKind.UTILITY)
            throw new IllegalArgumentException("Utility node " + parent + " cannot be a parent");
        if (c.parents.contains(parent))
            return false;
        if (parent.equals(child) || isAncestor(child, parent))
            throw new IllegalArgumentException("Arc " + parent + " -> " + child + " would create a cycle");
        c.parents.add(parent);
        if (c.table != null)
            c.table.add(p.variable);
        arcs.add(new ArcRecord(parent, child));
        return true;
    }

    private boolean isAncestor(String candidate, String of) {
        Deque<String> todo = new ArrayDeque<>(nodes.get(of).parents);
        Set<String> seen = new HashSet<>();
        while (!todo.isEmpty()) {
            String n = todo.pop();
            if (n.equals(candidate))
                return true;
            if (seen.add(n))
                todo.addAll(nodes.get(n).parents);
        }
        return false;
    }

    public Potential cpt(String node) {
        Entry e = require(node);
        if (e.kind != NodeKind.CHANCE)
            throw new IllegalArgumentException(node + " is a " + e.kind + " node, not a chance node");
        return e.table;
    }

    public Potential utility(String node) {
        Entry e = require(node);
        if (e.kind != NodeKind.UTILITY)
            throw new IllegalArgumentException(node + " is a " + e.kind + " node, not a utility node");
        return e.table;
    }

    public NodeKind kind(String node) {
        return require(node).kind;
    }

    public LabelizedVariable variable(String node) {
        return require(node).variable;
    }

    /** Parents in the order their arcs were added. */
    public List<String> parents(String node) {
        return List.copyOf(require(node).parents);
    }

    public boolean contains(String node) {
        return nodes.containsKey(node);
    }

    /** Node names in insertion order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /** Arcs in insertion order. */
    public List<ArcRecord> arcs() {
        return Collections.unmodifiableList(arcs);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isChanceNode(String node) {
        return kind(node) == NodeKind.CHANCE;
    }

    public boolean isDecisionNode(String node) {
        return kind(node) == NodeKind.DECISION;
    }

    public boolean isUtilityNode(String node) {
        return kind(node) == NodeKind.UTILITY;
    }

    private Entry require(String node) {
        Entry e = nodes.get(node);
        if (e == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return e;
    }

    @Override
    public String toString() {
        return "InfluenceDiagram[" + name + ", nodes=" + nodes.size() + ", arcs=" + arcs.size() + "]";
    }
}
