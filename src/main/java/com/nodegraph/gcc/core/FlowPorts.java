package com.nodegraph.gcc.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reserved flow-port vocabulary and port classification.
 *
 * <p>
 * Classification is a pure name lookup: a port is a flow port when its name
 * is reserved for its direction, or when the node lists it as a dynamic-branch
 * alias.
 */
public final class FlowPorts {
    private FlowPorts() {
        // Utility class
    }

    public static final String FLOW_IN = "FlowIn";
    public static final String BREAK_LOOP = "BreakLoop";
    public static final String FLOW_OUT = "FlowOut";
    public static final String YES = "Yes";
    public static final String NO = "No";
    public static final String DEFAULT = "Default";
    public static final String LOOP_BODY = "LoopBody";
    public static final String LOOP_COMPLETE = "LoopComplete";

    /** Declared type of a flow pin. */
    public static final String FLOW_TYPE = "Flow";

    public static final Set<String> FLOW_INPUTS = Set.of(FLOW_IN, BREAK_LOOP);
    public static final Set<String> FLOW_OUTPUTS = Set.of(FLOW_OUT, YES, NO, DEFAULT, LOOP_BODY, LOOP_COMPLETE);

    public static boolean isFlowInput(Node node, String port) {
        return FLOW_INPUTS.contains(port) || node.flowAliases().contains(port);
    }

    public static boolean isFlowOutput(Node node, String port) {
        return FLOW_OUTPUTS.contains(port) || node.flowAliases().contains(port);
    }

    public static boolean isFlowPort(Node node, String port, boolean output) {
        return output ? isFlowOutput(node, port) : isFlowInput(node, port);
    }

    /** An edge is a flow edge when it leaves a flow output. */
    public static boolean isFlowEdge(GraphModel model, Edge edge) {
        Node src = model.findNode(edge.srcNode());
        return src != null && isFlowOutput(src, edge.srcPort());
    }

    /** True when the node can be sequenced, i.e. it accepts a {@code FlowIn}. */
    public static boolean acceptsFlow(Node node) {
        return node.hasInput(FLOW_IN);
    }

    public static List<String> flowOutputs(Node node) {
        List<String> out = new ArrayList<>();
        for (Port p : node.outputs())
            if (isFlowOutput(node, p.name()))
                out.add(p.name());
        return out;
    }

    public static boolean hasFlowOutputs(Node node) {
        for (Port p : node.outputs())
            if (isFlowOutput(node, p.name()))
                return true;
        return false;
    }

    public static boolean isFlowNode(Node node) {
        return acceptsFlow(node) || hasFlowOutputs(node);
    }

    public static List<String> dataInputs(Node node) {
        List<String> in = new ArrayList<>();
        for (Port p : node.inputs())
            if (!isFlowInput(node, p.name()))
                in.add(p.name());
        return in;
    }

    public static List<String> dataOutputs(Node node) {
        List<String> out = new ArrayList<>();
        for (Port p : node.outputs())
            if (!isFlowOutput(node, p.name()))
                out.add(p.name());
        return out;
    }
}
