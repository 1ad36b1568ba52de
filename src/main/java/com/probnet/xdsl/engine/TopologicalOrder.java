package com.probnet.xdsl.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeRecord;

import lombok.extern.log4j.Log4j2;

/**
 * Emission order of a validated graph, CSR-encoded.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>topoOrder: nodes sorted so every parent precedes its children.</li>
 * <li>parentList / parentOffset: parents of node i, as topological indices,
 * in the order node i declares them, stored from
 * {@code parentList[parentOffset[i]]} inclusive to
 * {@code parentList[parentOffset[i+1]]} exclusive.</li>
 * <li>childrenList / childrenOffset: same encoding for children, in arc
 * declaration order.</li>
 * </ul>
 *
 * <p>
 * Among nodes that are ready at the same time the one declared first in the
 * document goes first, so the order is stable across runs.
 */
@Log4j2
public final class TopologicalOrder {
    private final NodeRecord[] topoOrder;
    private final int[] parentOffset;
    private final int[] parentList;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(NodeRecord[] topoOrder, int[] parentOffset, int[] parentList,
            int[] childrenOffset, int[] childrenList, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.nameToIndex = nameToIndex;
    }

    /**
     * Orders a graph that already passed validation. Nodes are added in
     * declaration order and arcs in each child's declared parent order.
     */
    public static TopologicalOrder of(NetworkGraph graph) {
        Builder b = builder();
        for (String id : graph.ids())
            b.addNode(graph.node(id));
        for (String id : graph.ids()) {
            for (String p : graph.node(id).parents())
                b.addEdge(p, id);
        }
        return b.build();
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public NodeRecord node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node id to its topological index. */
    public int topoIndex(String id) {
        Integer idx = nameToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    /** Node ids in emission order. */
    public List<String> ids() {
        List<String> out = new ArrayList<>(topoOrder.length);
        for (NodeRecord n : topoOrder)
            out.add(n.id());
        return out;
    }

    public int parentCount(int ti) {
        return parentOffset[ti + 1] - parentOffset[ti];
    }

    /** Topological index of the i-th declared parent of node ti. */
    public int parent(int ti, int i) {
        return parentList[parentOffset[ti] + i];
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * A cycle reaching {@link #build()} is a programming error: validation
     * rejects cyclic documents before ordering starts.
     */
    public static final class Builder {
        private final List<NodeRecord> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Set<Integer>> parents = new ArrayList<>();
        private final List<Set<Integer>> children = new ArrayList<>();

        public Builder addNode(NodeRecord node) {
            if (nameToIdx.containsKey(node.id()))
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            nameToIdx.put(node.id(), nodes.size());
            nodes.add(node);
            parents.add(new LinkedHashSet<>());
            children.add(new LinkedHashSet<>());
            return this;
        }

        /** Adds {@code from -> to}; adding the same arc twice has no effect. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new IllegalArgumentException("Self-edge not allowed: " + from);
            int f = requireIndex(from), t = requireIndex(to);
            if (children.get(f).add(t))
                parents.get(t).add(f);
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = nameToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        /**
         * Kahn's algorithm; the ready queue is keyed by declaration index.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];
            for (int i = 0; i < n; i++)
                inDegree[i] = parents.get(i).size();

            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : children.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (topoIdx != n)
                throw new IllegalStateException("Cycle survived validation! Ordered " + topoIdx + " of " + n
                        + " nodes");

            NodeRecord[] ordered = new NodeRecord[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(ordered[ti].id(), ti);
            }

            int[] pOffsets = new int[n + 1];
            int[] cOffsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++) {
                pOffsets[ti + 1] = pOffsets[ti] + parents.get(reverseMap[ti]).size();
                cOffsets[ti + 1] = cOffsets[ti] + children.get(reverseMap[ti]).size();
            }
            int[] pList = new int[pOffsets[n]];
            int[] cList = new int[cOffsets[n]];
            for (int ti = 0; ti < n; ti++) {
                int base = pOffsets[ti];
                for (int p : parents.get(reverseMap[ti]))
                    pList[base++] = topoMap[p];
                base = cOffsets[ti];
                for (int c : children.get(reverseMap[ti]))
                    cList[base++] = topoMap[c];
            }
            log.debug("Ordered {} nodes", n);
            return new TopologicalOrder(ordered, pOffsets, pList, cOffsets, cList, newNameToIndex);
        }
    }
}
