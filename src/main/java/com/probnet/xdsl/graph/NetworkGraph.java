package com.probnet.xdsl.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Intermediate graph shared by every conversion stage.
 *
 * <p>
 * Nodes and arcs keep document declaration order. The node list may hold
 * several records with the same id until the validator has run; lookups by id
 * always resolve to the first declaration. Instances are immutable once built
 * and belong to a single conversion call.
 */
public final class NetworkGraph {
    private final String name;
    private final List<NodeRecord> nodes;
    private final List<ArcRecord> arcs;
    private final Map<String, TableRecord> tables;
    private final Map<String, NodeRecord> byId;
    private final Map<String, Integer> declarationIndex;

    private NetworkGraph(String name, List<NodeRecord> nodes, List<ArcRecord> arcs,
            Map<String, TableRecord> tables) {
        this.name = name;
        this.nodes = Collections.unmodifiableList(nodes);
        this.arcs = Collections.unmodifiableList(arcs);
        this.tables = Collections.unmodifiableMap(tables);
        Map<String, NodeRecord> ids = new LinkedHashMap<>(nodes.size() * 2);
        Map<String, Integer> order = new HashMap<>(nodes.size() * 2);
        for (int i = 0; i < nodes.size(); i++) {
            NodeRecord n = nodes.get(i);
            if (ids.putIfAbsent(n.id(), n) == null)
                order.put(n.id(), i);
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.declarationIndex = Collections.unmodifiableMap(order);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Network id from the document root, may be {@code null}. */
    public String name() {
        return name;
    }

    /** Every node record in declaration order, duplicates included. */
    public List<NodeRecord> nodes() {
        return nodes;
    }

    public List<ArcRecord> arcs() {
        return arcs;
    }

    public Map<String, TableRecord> tables() {
        return tables;
    }

    public int nodeCount() {
        return byId.size();
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /** First node declared with {@code id}, or {@code null}. */
    public NodeRecord node(String id) {
        return byId.get(id);
    }

    /** Distinct node ids in declaration order. */
    public Set<String> ids() {
        return byId.keySet();
    }

    /** Position of the first declaration of {@code id} in the document. */
    public int declarationIndex(String id) {
        Integer idx = declarationIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public TableRecord table(String id) {
        return tables.get(id);
    }

    /** Parent records of {@code id} in declared order; unknown parents are skipped. */
    public List<NodeRecord> parentsOf(String id) {
        NodeRecord n = byId.get(id);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        List<NodeRecord> out = new ArrayList<>(n.parents().size());
        for (String p : n.parents()) {
            NodeRecord pr = byId.get(p);
            if (pr != null)
                out.add(pr);
        }
        return out;
    }

    @Override
    public String toString() {
        return "NetworkGraph[" + name + ", nodes=" + nodes.size() + ", arcs=" + arcs.size()
                + ", tables=" + tables.size() + "]";
    }

    /**
     * Collects records in declaration order. Arcs are derived from each node's
     * parent list, so they always agree with it.
     */
    public static final class Builder {
        private final String name;
        private final List<NodeRecord> nodes = new ArrayList<>();
        private final Set<ArcRecord> arcs = new LinkedHashSet<>();
        private final Map<String, TableRecord> tables = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder addNode(NodeRecord node) {
            nodes.add(node);
            for (String p : node.parents())
                arcs.add(new ArcRecord(p, node.id()));
            return this;
        }

        /** Keeps the first table registered for a node id. */
        public Builder putTable(TableRecord table) {
            tables.putIfAbsent(table.nodeId(), table);
            return this;
        }

        public Builder replaceTable(TableRecord table) {
            tables.put(table.nodeId(), table);
            return this;
        }

        public TableRecord table(String id) {
            return tables.get(id);
        }

        public NetworkGraph build() {
            return new NetworkGraph(name, new ArrayList<>(nodes), new ArrayList<>(arcs),
                    new LinkedHashMap<>(tables));
        }
    }
}
