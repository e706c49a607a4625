package com.nodegraph.gcc.io;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.VirtualPin;

import lombok.extern.log4j.Log4j2;

/**
 * Lookup table from node titles to {@link NodeDefinition}s.
 *
 * <p>
 * Built-in control nodes are always present. Titles may be reached through
 * declared aliases and through the synonym formed by dropping {@code '/'}
 * from the title. Read-only while a parse runs.
 */
@Log4j2
public final class NodeRegistry {

    private final Map<String, NodeDefinition> byName = new LinkedHashMap<>();
    private final Map<String, String> synonyms = new LinkedHashMap<>();

    public NodeRegistry() {
        registerBuiltIns();
    }

    public NodeRegistry register(NodeDefinition def) {
        if (def.getName() == null || def.getName().isBlank())
            throw new IllegalArgumentException("Node definition without a name");
        NodeDefinition previous = byName.put(def.getName(), def);
        if (previous != null)
            log.warn("Node definition '{}' redefined", def.getName());
        for (String key : synonymKeys(def))
            synonyms.putIfAbsent(key, def.getName());
        return this;
    }

    public NodeRegistry registerAll(Collection<NodeDefinition> defs) {
        for (NodeDefinition d : defs)
            register(d);
        return this;
    }

    /** Registers a composite as an ordinary node whose ports are its pins. */
    public NodeDefinition registerComposite(CompositeNodeConfig composite) {
        NodeDefinition def = compositeDefinition(composite);
        register(def);
        return def;
    }

    public static NodeDefinition compositeDefinition(CompositeNodeConfig composite) {
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        NodeDefinition def = NodeDefinition.of(composite.getNodeName(), "composite", inputs, outputs);
        for (VirtualPin pin : composite.inputPins()) {
            def.getInputs().add(pin.getName());
            if (pin.isFlow())
                def.getFlowPorts().add(pin.getName());
            else
                def.getInputTypes().put(pin.getName(), pin.getType());
        }
        for (VirtualPin pin : composite.outputPins()) {
            def.getOutputs().add(pin.getName());
            if (pin.isFlow())
                def.getFlowPorts().add(pin.getName());
            else
                def.getOutputTypes().put(pin.getName(), pin.getType());
        }
        def.setCompositeId(composite.getCompositeId());
        def.setDescription(composite.getDescription());
        return def;
    }

    /** Resolves a title, alias or synonym; null when unknown. */
    public NodeDefinition find(String title) {
        NodeDefinition d = byName.get(title);
        if (d != null)
            return d;
        String canonical = synonyms.get(title);
        if (canonical == null)
            canonical = synonyms.get(title.replace("/", ""));
        return canonical == null ? null : byName.get(canonical);
    }

    /** Like {@link #find(String)} but also requires a matching category when one is given. */
    public NodeDefinition find(String category, String title) {
        NodeDefinition d = find(title);
        if (d == null || category == null || category.isEmpty())
            return d;
        return category.equals(d.getCategory()) ? d : null;
    }

    public boolean contains(String title) {
        return find(title) != null;
    }

    public Collection<NodeDefinition> definitions() {
        return Collections.unmodifiableCollection(byName.values());
    }

    /** Every key under which the given definition is reachable, canonical title first. */
    public static List<String> synonymKeys(NodeDefinition def) {
        List<String> keys = new ArrayList<>();
        keys.add(def.getName());
        String slashless = def.getName().replace("/", "");
        if (!slashless.equals(def.getName()))
            keys.add(slashless);
        if (def.getAliases() != null)
            keys.addAll(def.getAliases());
        return keys;
    }

    // --- Built-in Control Nodes ---

    private void registerBuiltIns() {
        control(ControlNodes.BRANCH,
                List.of(FlowPorts.FLOW_IN, ControlNodes.CONDITION),
                List.of(FlowPorts.YES, FlowPorts.NO))
                .getInputTypes().put(ControlNodes.CONDITION, "Boolean");
        control(ControlNodes.MULTI_BRANCH,
                List.of(FlowPorts.FLOW_IN, ControlNodes.CONTROL_EXPRESSION),
                List.of(FlowPorts.DEFAULT));
        NodeDefinition finite = control(ControlNodes.FINITE_LOOP,
                List.of(FlowPorts.FLOW_IN, FlowPorts.BREAK_LOOP, ControlNodes.START, ControlNodes.END),
                List.of(FlowPorts.LOOP_BODY, FlowPorts.LOOP_COMPLETE, ControlNodes.CURRENT_VALUE));
        finite.getInputTypes().put(ControlNodes.START, "Integer");
        finite.getInputTypes().put(ControlNodes.END, "Integer");
        finite.getOutputTypes().put(ControlNodes.CURRENT_VALUE, "Integer");
        control(ControlNodes.LIST_ITERATION,
                List.of(FlowPorts.FLOW_IN, FlowPorts.BREAK_LOOP, ControlNodes.LIST),
                List.of(FlowPorts.LOOP_BODY, FlowPorts.LOOP_COMPLETE, ControlNodes.CURRENT_ELEMENT));
    }

    private NodeDefinition control(String name, List<String> inputs, List<String> outputs) {
        NodeDefinition d = NodeDefinition.of(name, ControlNodes.CONTROL_CATEGORY, inputs, outputs);
        register(d);
        return d;
    }
}
