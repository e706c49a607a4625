package com.nodegraph.gcc.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;
import lombok.Setter;

/**
 * A single vertex of the graph model.
 *
 * <p>
 * A node is an instance of a registry entry: its {@code title} names the
 * entry, and its ordered input and output ports are copied from it when the
 * node is created. Port names are authoritative for everything downstream;
 * positions only ever matter for the order in which ports are declared.
 *
 * <p>
 * <b>Constants:</b> inputs that are not fed by an edge may carry a literal
 * value, stored as source text in {@link #inputConstants()}.
 *
 * <p>
 * <b>Dynamic branches:</b> ports listed in {@link #flowAliases()} are flow
 * ports even though their names are outside the reserved vocabulary. Case
 * outputs of a multi-branch node and flow pins of a composite node are
 * recorded here.
 *
 * <p>
 * <b>Position:</b> owned by the layout engine, opaque to the compiler.
 */
public final class Node {
    /** Canvas coordinates assigned by the layout engine. */
    public record Position(double x, double y) {
    }

    @Getter
    private final String id;
    @Getter
    private final String title;
    @Getter
    private final String category;
    private final List<Port> inputs = new ArrayList<>();
    private final List<Port> outputs = new ArrayList<>();
    private final Map<String, String> inputConstants = new LinkedHashMap<>();
    private final Set<String> flowAliases = new LinkedHashSet<>();
    private final Map<String, String> outputLabels = new LinkedHashMap<>();
    @Getter
    @Setter
    private Position position;
    @Getter
    @Setter
    private int sourceLine;

    public Node(String id, String title, String category) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        this.category = category == null ? "" : category;
    }

    public List<Port> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Port> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public Map<String, String> inputConstants() {
        return Collections.unmodifiableMap(inputConstants);
    }

    public Set<String> flowAliases() {
        return Collections.unmodifiableSet(flowAliases);
    }

    /** User-supplied variable labels keyed by output port. */
    public Map<String, String> outputLabels() {
        return Collections.unmodifiableMap(outputLabels);
    }

    public Node addInput(String name) {
        if (hasInput(name))
            throw new IllegalArgumentException("Duplicate input port '" + name + "' on node " + id);
        inputs.add(new Port(name));
        return this;
    }

    public Node addOutput(String name) {
        if (hasOutput(name))
            throw new IllegalArgumentException("Duplicate output port '" + name + "' on node " + id);
        outputs.add(new Port(name));
        return this;
    }

    public Node addFlowAlias(String portName) {
        flowAliases.add(portName);
        return this;
    }

    public boolean hasInput(String name) {
        for (Port p : inputs)
            if (p.name().equals(name))
                return true;
        return false;
    }

    public boolean hasOutput(String name) {
        for (Port p : outputs)
            if (p.name().equals(name))
                return true;
        return false;
    }

    public void setInputConstant(String port, String literalText) {
        if (!hasInput(port))
            throw new IllegalArgumentException("Unknown input port '" + port + "' on node " + id);
        inputConstants.put(port, literalText);
    }

    public void removeInputConstant(String port) {
        inputConstants.remove(port);
    }

    public void setOutputLabel(String port, String label) {
        if (!hasOutput(port))
            throw new IllegalArgumentException("Unknown output port '" + port + "' on node " + id);
        outputLabels.put(port, label);
    }

    /** Copy under a new id, used when merging graphs. */
    public Node copyAs(String newId) {
        Node n = new Node(newId, title, category);
        n.inputs.addAll(inputs);
        n.outputs.addAll(outputs);
        n.inputConstants.putAll(inputConstants);
        n.flowAliases.addAll(flowAliases);
        n.outputLabels.putAll(outputLabels);
        n.position = position;
        n.sourceLine = sourceLine;
        return n;
    }

    @Override
    public String toString() {
        return title + "#" + id;
    }
}
