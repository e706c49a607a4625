package com.nodegraph.gcc.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.Edge;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.Node;

/**
 * Decides which nodes go into which generated method, and in what order
 * data-only nodes are written.
 *
 * <p>
 * Data order is a stable topological sort over data edges: ties keep node
 * creation order. A handler owns every node reachable from its event over
 * flow edges plus their transitive data dependencies.
 */
public final class EmissionScheduler {
    private final GraphModel graph;
    private final TopologicalOrder dataOrder;

    public EmissionScheduler(GraphModel graph) {
        this.graph = graph;
        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (Node n : graph.nodes())
            b.addNode(n);
        for (Edge e : graph.dataEdges())
            if (!e.srcNode().equals(e.dstNode()))
                b.addEdge(e.srcNode(), e.dstNode());
        try {
            this.dataOrder = b.build();
        } catch (IllegalStateException e) {
            throw new GenerationException("Data edges form a cycle: " + e.getMessage());
        }
    }

    /** Position of a node in data order. */
    public int rank(String nodeId) {
        return dataOrder.topoIndex(nodeId);
    }

    public List<Node> eventNodes() {
        List<Node> out = new ArrayList<>();
        for (Node n : graph.nodes())
            if (ControlNodes.isEvent(n))
                out.add(n);
        return out;
    }

    /** Nodes reachable from {@code start} over flow edges, start included. */
    public Set<String> flowReachable(String start) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.add(start);
        while (!work.isEmpty()) {
            String id = work.poll();
            if (!seen.add(id))
                continue;
            for (Edge e : graph.outgoing(id))
                if (isFlow(e))
                    work.add(e.dstNode());
        }
        return seen;
    }

    /** {@code ids} plus everything they read from over data edges. */
    public Set<String> withDataDependencies(Collection<String> ids) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(ids);
        while (!work.isEmpty()) {
            String id = work.poll();
            if (!seen.add(id))
                continue;
            for (Edge e : graph.incoming(id))
                if (!isFlow(e))
                    work.add(e.srcNode());
        }
        return seen;
    }

    /** Event node id to the nodes its handler emits. */
    public Map<String, Set<String>> groupByEvent() {
        Map<String, Set<String>> groups = new LinkedHashMap<>();
        for (Node event : eventNodes())
            groups.put(event.getId(), withDataDependencies(flowReachable(event.getId())));
        return groups;
    }

    /** Nodes no handler reaches, in creation order. */
    public List<String> unreached(Collection<Set<String>> groups) {
        Set<String> covered = new LinkedHashSet<>();
        groups.forEach(covered::addAll);
        List<String> out = new ArrayList<>();
        for (Node n : graph.nodes())
            if (!covered.contains(n.getId()))
                out.add(n.getId());
        return out;
    }

    private boolean isFlow(Edge e) {
        return FlowPorts.isFlowEdge(graph, e);
    }
}
