package com.nodegraph.gcc.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.core.Port;
import com.nodegraph.gcc.core.VirtualPin;
import com.nodegraph.gcc.io.NodeDefinition;
import com.nodegraph.gcc.io.NodeRegistry;
import com.nodegraph.gcc.syntax.Ast.Constant;
import com.nodegraph.gcc.syntax.Ast.Expr;
import com.nodegraph.gcc.syntax.Ast.Name;

import lombok.extern.log4j.Log4j2;

/**
 * Attaches the public pins of a composite to ports of its sub-graph.
 *
 * <ul>
 * <li>flow inputs: first node, in creation order, accepting flow with no incoming flow edge</li>
 * <li>flow outputs: dangling flow exits, the latest node's exit for a single pin</li>
 * <li>data inputs: every port the parameter reached, in any method, conditions included</li>
 * <li>data outputs: the producer of the returned or declared variable</li>
 * </ul>
 *
 * Unmapped pins are legal.
 */
@Log4j2
final class PinInterfaceBuilder {
    private static final String ANY = "Any";

    private final NodeRegistry registry;
    private final String file;

    PinInterfaceBuilder(NodeRegistry registry, String file) {
        this.registry = registry;
        this.file = file;
    }

    void build(CompositeNodeConfig composite, List<MethodBuild> methods, GraphModel merged) {
        int inIndex = 0;
        int outIndex = 0;
        Map<String, Integer> flowNames = new LinkedHashMap<>();
        for (MethodBuild m : methods)
            for (PinSpec p : m.pins().inputs())
                if (p.isFlow())
                    flowNames.merge(p.name(), 1, Integer::sum);
        for (MethodBuild m : methods)
            for (PinSpec p : m.pins().outputs())
                if (p.isFlow())
                    flowNames.merge("out:" + p.name(), 1, Integer::sum);

        for (MethodBuild m : methods) {
            for (PinSpec spec : m.pins().inputs()) {
                if (spec.isFlow()) {
                    String name = flowNames.get(spec.name()) > 1 ? spec.name() + "_" + m.name() : spec.name();
                    VirtualPin pin = new VirtualPin(inIndex++, name, FlowPorts.FLOW_TYPE, true, true);
                    MappedPort entry = flowEntry(m.graph());
                    if (entry != null)
                        pin.map(m.toMerged(entry));
                    composite.addPin(pin);
                } else if (addDataPin(composite, spec, true, inIndex)) {
                    inIndex++;
                }
            }
            List<MappedPort> exits = danglingExits(m.graph());
            List<PinSpec> flowOuts = m.pins().outputs().stream().filter(PinSpec::isFlow).toList();
            int dataOrdinal = 0;
            for (PinSpec spec : m.pins().outputs()) {
                if (spec.isFlow()) {
                    String name = flowNames.get("out:" + spec.name()) > 1 ? spec.name() + "_" + m.name()
                            : spec.name();
                    VirtualPin pin = new VirtualPin(outIndex++, name, FlowPorts.FLOW_TYPE, false, true);
                    MappedPort exit = exitFor(exits, flowOuts.indexOf(spec), flowOuts.size());
                    if (exit != null)
                        pin.map(m.toMerged(exit));
                    composite.addPin(pin);
                    continue;
                }
                boolean created = addDataPin(composite, spec, false, outIndex);
                if (created)
                    outIndex++;
                VirtualPin pin = composite.findPin(spec.name(), false);
                String variable = outputVariable(m, spec, dataOrdinal++);
                int construct = m.env().pathDependentLine(variable);
                if (construct > 0)
                    throw new GraphParseException("Variable '" + variable + "' assigned in a branch is read after it"
                            + " (branch at line " + construct + ")", file, m.def().line());
                MappedPort producer = m.env().resolve(variable);
                if (producer != null && !pin.getMappedPorts().contains(m.toMerged(producer)))
                    pin.map(m.toMerged(producer));
            }
        }

        for (VirtualPin pin : composite.inputPins()) {
            if (pin.isFlow())
                continue;
            List<MappedPort> direct = new ArrayList<>();
            for (MethodBuild m : methods) {
                for (MappedPort p : m.usage().usageOf(pin.getName()))
                    direct.add(m.toMerged(p));
                for (MappedPort p : m.usage().allUsageOf(pin.getName())) {
                    MappedPort mp = m.toMerged(p);
                    if (!pin.getMappedPorts().contains(mp))
                        pin.map(mp);
                }
            }
            checkTypes(pin, direct, merged);
            if (PinSpec.GENERIC.equals(pin.getType()))
                pin.setType(inferType(pin, merged));
        }
        for (VirtualPin pin : composite.outputPins())
            if (!pin.isFlow() && PinSpec.GENERIC.equals(pin.getType()))
                pin.setType(inferType(pin, merged));

        for (VirtualPin pin : composite.getVirtualPins())
            if (!pin.isMapped())
                log.debug("{}: pin '{}' of {} is not mapped", file, pin.getName(), composite.getNodeName());
    }

    /** @return true when a new pin was created, false when merged into an existing one */
    private boolean addDataPin(CompositeNodeConfig composite, PinSpec spec, boolean input, int index) {
        VirtualPin existing = composite.findPin(spec.name(), input);
        if (existing == null) {
            composite.addPin(new VirtualPin(index, spec.name(), spec.type(), input, false));
            return true;
        }
        if (existing.isFlow())
            throw new GraphParseException("Pin '" + spec.name() + "' is declared as both flow and data", file, 0);
        if (PinSpec.GENERIC.equals(existing.getType())) {
            existing.setType(spec.type());
        } else if (!PinSpec.GENERIC.equals(spec.type()) && !existing.getType().equals(spec.type())) {
            throw new GraphParseException("Pin '" + spec.name() + "' declared with conflicting types "
                    + existing.getType() + " and " + spec.type(), file, 0);
        }
        return false;
    }

    private String outputVariable(MethodBuild m, PinSpec spec, int ordinal) {
        String declared = m.markers().dataOutputVariables().get(spec.name());
        if (declared != null)
            return declared;
        List<Expr> values = m.returnValues();
        if (ordinal < values.size()) {
            Expr v = values.get(ordinal);
            if (v instanceof Name n)
                return n.id();
            if (v instanceof Constant)
                return spec.name();
        }
        return spec.name();
    }

    // --- Flow pins ---

    private static MappedPort flowEntry(GraphModel graph) {
        for (Node n : graph.nodes())
            if (FlowPorts.acceptsFlow(n) && graph.incomingEdge(n.getId(), FlowPorts.FLOW_IN) == null)
                return new MappedPort(n.getId(), FlowPorts.FLOW_IN);
        return null;
    }

    /** Flow outputs with no outgoing edge, in creation order. */
    private static List<MappedPort> danglingExits(GraphModel graph) {
        List<MappedPort> out = new ArrayList<>();
        for (Node n : graph.nodes()) {
            for (Port p : n.outputs()) {
                if (!FlowPorts.isFlowOutput(n, p.name()))
                    continue;
                if (graph.outgoing(n.getId(), p.name()).isEmpty())
                    out.add(new MappedPort(n.getId(), p.name()));
            }
        }
        return out;
    }

    /** A lone pin takes the exit of the latest node; several pins take exits in order. */
    private static MappedPort exitFor(List<MappedPort> exits, int ordinal, int pinCount) {
        if (exits.isEmpty())
            return null;
        if (pinCount == 1) {
            String last = exits.get(exits.size() - 1).nodeId();
            for (MappedPort e : exits)
                if (e.nodeId().equals(last))
                    return e;
        }
        return ordinal < exits.size() ? exits.get(ordinal) : null;
    }

    // --- Types ---

    private void checkTypes(VirtualPin pin, List<MappedPort> direct, GraphModel graph) {
        String seen = null;
        MappedPort seenAt = null;
        for (MappedPort p : direct) {
            String t = portType(graph, p, true);
            if (t == null || PinSpec.GENERIC.equals(t) || ANY.equals(t))
                continue;
            if (seen == null) {
                seen = t;
                seenAt = p;
            } else if (!seen.equals(t)) {
                Node n = graph.node(p.nodeId());
                throw new GraphParseException("Pin '" + pin.getName() + "' feeds incompatible ports " + seenAt
                        + " (" + seen + ") and " + p + " (" + t + ")", file,
                        n.getSourceLine());
            }
        }
    }

    private String inferType(VirtualPin pin, GraphModel graph) {
        for (MappedPort p : pin.getMappedPorts()) {
            String t = portType(graph, p, pin.isInput());
            if (t != null && !ANY.equals(t))
                return t;
        }
        return PinSpec.GENERIC;
    }

    private String portType(GraphModel graph, MappedPort p, boolean input) {
        Node n = graph.findNode(p.nodeId());
        if (n == null)
            return null;
        NodeDefinition def = registry.find(n.getTitle());
        if (def == null)
            return null;
        return input ? def.inputType(p.portName()) : def.outputType(p.portName());
    }
}
