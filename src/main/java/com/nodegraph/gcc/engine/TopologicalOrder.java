package com.nodegraph.gcc.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import com.nodegraph.gcc.core.Node;

/**
 * Dependency order of a set of nodes.
 *
 * <p>
 * Kahn's algorithm with a stable tie-break: among nodes that are ready at
 * the same time the one added first comes first, so the order is a pure
 * function of insertion order and edges.
 */
public final class TopologicalOrder {
    private final List<Node> ordered;
    private final Map<String, Integer> rankById;
    private final Map<String, List<String>> dependents;

    private TopologicalOrder(List<Node> ordered, Map<String, Integer> rankById, Map<String, List<String>> dependents) {
        this.ordered = ordered;
        this.rankById = rankById;
        this.dependents = dependents;
    }

    public int nodeCount() {
        return ordered.size();
    }

    public Node node(int rank) {
        return ordered.get(rank);
    }

    /** Position of {@code id} in the order. */
    public int topoIndex(String id) {
        Integer rank = rankById.get(id);
        if (rank == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return rank;
    }

    public boolean contains(String id) {
        return rankById.containsKey(id);
    }

    /** Nodes that must come after {@code id}, in the order their edges were added. */
    public List<String> dependents(String id) {
        topoIndex(id);
        return dependents.get(id);
    }

    public List<String> ids() {
        List<String> out = new ArrayList<>(ordered.size());
        for (Node n : ordered)
            out.add(n.getId());
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Collects nodes and edges, then sorts once in {@link #build()}. */
    public static final class Builder {
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Map<String, Set<String>> after = new LinkedHashMap<>();

        public Builder addNode(Node node) {
            if (nodes.putIfAbsent(node.getId(), node) != null)
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            after.put(node.getId(), new LinkedHashSet<>());
            return this;
        }

        /** {@code from} must come before {@code to}. Repeated edges are kept once. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new IllegalArgumentException("Self-edge not allowed: " + from);
            require(to);
            require(from).add(to);
            return this;
        }

        private Set<String> require(String id) {
            Set<String> out = after.get(id);
            if (out == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return out;
        }

        /** Sorts the collected nodes; fails when the edges contain a cycle. */
        public TopologicalOrder build() {
            List<String> insertion = new ArrayList<>(nodes.keySet());
            Map<String, Integer> insertionIndex = new LinkedHashMap<>();
            for (int i = 0; i < insertion.size(); i++)
                insertionIndex.put(insertion.get(i), i);

            Map<String, Integer> pending = new LinkedHashMap<>();
            insertion.forEach(id -> pending.put(id, 0));
            after.values().forEach(targets -> targets.forEach(t -> pending.merge(t, 1, Integer::sum)));

            PriorityQueue<Integer> ready = new PriorityQueue<>();
            pending.forEach((id, count) -> {
                if (count == 0)
                    ready.add(insertionIndex.get(id));
            });

            List<Node> ordered = new ArrayList<>(insertion.size());
            Map<String, Integer> rankById = new LinkedHashMap<>();
            while (!ready.isEmpty()) {
                String id = insertion.get(ready.poll());
                rankById.put(id, ordered.size());
                ordered.add(nodes.get(id));
                for (String next : after.get(id))
                    if (pending.merge(next, -1, Integer::sum) == 0)
                        ready.add(insertionIndex.get(next));
            }
            if (ordered.size() != insertion.size()) {
                List<String> stuck = new ArrayList<>();
                pending.forEach((id, count) -> {
                    if (count > 0)
                        stuck.add(id);
                });
                throw new IllegalStateException("Cycle through " + stuck);
            }

            Map<String, List<String>> dependents = new LinkedHashMap<>();
            after.forEach((id, targets) -> dependents.put(id, Collections.unmodifiableList(new ArrayList<>(targets))));
            return new TopologicalOrder(Collections.unmodifiableList(ordered), rankById, dependents);
        }
    }
}
