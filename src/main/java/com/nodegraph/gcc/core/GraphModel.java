package com.nodegraph.gcc.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/**
 * The graph intermediate representation: nodes, edges, layout groupings and
 * declared graph variables.
 *
 * <p>
 * Mutators keep one invariant: every edge references existing nodes and
 * existing ports on them, with the source being an output and the target an
 * input. Nodes iterate in creation order, which the emitter uses as its
 * stable tie-break.
 *
 * <p>
 * A model built by one parse call belongs to the caller; there is no shared
 * graph state.
 */
public final class GraphModel {
    @Getter
    @Setter
    private String graphId, graphName, graphType, description;

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final List<BasicBlock> basicBlocks = new ArrayList<>();
    private final List<GraphVariable> graphVariables = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private int edgeSeq;

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<Edge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public List<BasicBlock> basicBlocks() {
        return Collections.unmodifiableList(basicBlocks);
    }

    public List<GraphVariable> graphVariables() {
        return graphVariables;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Node findNode(String id) {
        return nodes.get(id);
    }

    public Node node(String id) {
        Node n = nodes.get(id);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return n;
    }

    public Edge findEdge(String id) {
        return edges.get(id);
    }

    public GraphModel addNode(Node node) {
        if (nodes.containsKey(node.getId()))
            throw new IllegalArgumentException("Duplicate node id: " + node.getId());
        nodes.put(node.getId(), node);
        return this;
    }

    /** Connects two ports with a generated edge id. */
    public Edge connect(String srcNode, String srcPort, String dstNode, String dstPort) {
        String id;
        do {
            id = "edge_" + (++edgeSeq);
        } while (edges.containsKey(id));
        return addEdge(new Edge(id, srcNode, srcPort, dstNode, dstPort));
    }

    public Edge addEdge(Edge edge) {
        if (edges.containsKey(edge.id()))
            throw new IllegalArgumentException("Duplicate edge id: " + edge.id());
        Node src = node(edge.srcNode());
        Node dst = node(edge.dstNode());
        if (!src.hasOutput(edge.srcPort()))
            throw new IllegalArgumentException("Unknown output port '" + edge.srcPort() + "' on " + src);
        if (!dst.hasInput(edge.dstPort()))
            throw new IllegalArgumentException("Unknown input port '" + edge.dstPort() + "' on " + dst);
        if (edge.srcNode().equals(edge.dstNode()) && !FlowPorts.isFlowOutput(src, edge.srcPort()))
            throw new IllegalArgumentException("Self-edge not allowed: " + edge.srcNode());
        edges.put(edge.id(), edge);
        return edge;
    }

    public void removeEdge(String id) {
        edges.remove(id);
    }

    /** Removes a node together with every edge touching it. */
    public void removeNode(String id) {
        if (nodes.remove(id) == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        edges.values().removeIf(e -> e.srcNode().equals(id) || e.dstNode().equals(id));
    }

    public List<Edge> incoming(String nodeId) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges.values())
            if (e.dstNode().equals(nodeId))
                out.add(e);
        return out;
    }

    public List<Edge> outgoing(String nodeId) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges.values())
            if (e.srcNode().equals(nodeId))
                out.add(e);
        return out;
    }

    /** Edges leaving {@code (nodeId, port)}, in insertion order. */
    public List<Edge> outgoing(String nodeId, String port) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges.values())
            if (e.srcNode().equals(nodeId) && e.srcPort().equals(port))
                out.add(e);
        return out;
    }

    /** The edge feeding an input port, or null. */
    public Edge incomingEdge(String nodeId, String port) {
        for (Edge e : edges.values())
            if (e.dstNode().equals(nodeId) && e.dstPort().equals(port))
                return e;
        return null;
    }

    public List<Edge> incomingFlow(String nodeId) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges.values())
            if (e.dstNode().equals(nodeId) && FlowPorts.isFlowEdge(this, e))
                out.add(e);
        return out;
    }

    public List<Edge> flowEdges() {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges.values())
            if (FlowPorts.isFlowEdge(this, e))
                out.add(e);
        return out;
    }

    public List<Edge> dataEdges() {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges.values())
            if (!FlowPorts.isFlowEdge(this, e))
                out.add(e);
        return out;
    }

    /** Stores node positions and block groupings produced by a layout pass. */
    public void applyLayout(Map<String, Node.Position> positions, List<BasicBlock> blocks) {
        positions.forEach((id, pos) -> {
            Node n = nodes.get(id);
            if (n != null)
                n.setPosition(pos);
        });
        basicBlocks.clear();
        if (blocks != null)
            basicBlocks.addAll(blocks);
    }

    /**
     * Copies every node and edge of {@code other} into this model. Colliding
     * node ids receive a {@code _N} suffix.
     *
     * @return old id to new id, for every copied node
     */
    public Map<String, String> merge(GraphModel other) {
        Map<String, String> remap = new LinkedHashMap<>();
        for (Node n : other.nodes()) {
            String id = n.getId();
            int suffix = 1;
            while (nodes.containsKey(id))
                id = n.getId() + "_" + (suffix++);
            remap.put(n.getId(), id);
            addNode(id.equals(n.getId()) ? n : n.copyAs(id));
        }
        for (Edge e : other.edges())
            connect(remap.get(e.srcNode()), e.srcPort(), remap.get(e.dstNode()), e.dstPort());
        return remap;
    }
}
