package com.nodegraph.gcc.util;

import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.Edge;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.core.Port;

/**
 * Diagnostic utility for inspecting a graph model.
 *
 * <p>
 * Generates human-readable dumps of nodes, edges and constants. Intended for
 * debug logging and round-trip failure details; output format is not stable.
 */
public final class GraphExplain {
    private final GraphModel graph;

    public GraphExplain(GraphModel graph) {
        this.graph = graph;
    }

    /**
     * One-line summary: id, node and edge counts.
     */
    public String summary() {
        return "Graph " + graph.getGraphId() + " (" + graph.nodeCount() + " nodes, " + graph.flowEdges().size()
                + " flow edges, " + graph.dataEdges().size() + " data edges)";
    }

    /**
     * Dumps ports, constants and connections of a single node.
     */
    public String explainNode(String nodeId) {
        Node node = graph.node(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Title: ").append(node.getTitle()).append('\n')
                .append("  Category: ").append(node.getCategory()).append('\n');
        if (node.getSourceLine() > 0)
            sb.append("  Line: ").append(node.getSourceLine()).append('\n');
        sb.append("  Inputs: ");
        appendPorts(sb, node, node.inputs(), false);
        sb.append("  Outputs: ");
        appendPorts(sb, node, node.outputs(), true);
        for (Map.Entry<String, String> c : node.inputConstants().entrySet())
            sb.append("  Constant ").append(c.getKey()).append(" = ").append(c.getValue()).append('\n');
        List<Edge> in = graph.incoming(nodeId);
        sb.append("  Incoming (").append(in.size()).append("): ");
        for (int i = 0; i < in.size(); i++) {
            sb.append(in.get(i).source()).append(" -> ").append(in.get(i).dstPort());
            if (i < in.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the whole graph, one line per node followed by its outgoing edges.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(summary()).append(":\n");
        for (Node node : graph.nodes()) {
            sb.append("  [").append(node.getId()).append("] ").append(node.getTitle());
            if (FlowPorts.isFlowNode(node))
                sb.append(" (FLOW)");
            List<Edge> out = graph.outgoing(node.getId());
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    Edge e = out.get(j);
                    sb.append(e.srcPort()).append(':').append(e.target());
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph diagram; flow edges are drawn thick.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (Node node : graph.nodes())
            sb.append("  ").append(sanitize(node.getId())).append("[\"").append(node.getTitle().replace("\"", "'"))
                    .append("\"];\n");
        for (Edge e : graph.edges()) {
            String arrow = FlowPorts.isFlowEdge(graph, e) ? " ==> " : " -- \"" + e.srcPort() + "\" --> ";
            sb.append("  ").append(sanitize(e.srcNode())).append(arrow).append(sanitize(e.dstNode())).append(";\n");
        }
        return sb.toString();
    }

    private static void appendPorts(StringBuilder sb, Node node, List<Port> ports, boolean output) {
        for (int i = 0; i < ports.size(); i++) {
            String name = ports.get(i).name();
            sb.append(name);
            if (FlowPorts.isFlowPort(node, name, output))
                sb.append("*");
            if (i < ports.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
