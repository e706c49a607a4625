package com.nodegraph.gcc.core;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * Public port of a composite node, standing for one or more internal ports.
 * An unmapped pin is legal and emits as a placeholder.
 */
@Getter
@Setter
public final class VirtualPin {
    private int index;
    private String name;
    private String type;
    private boolean input;
    private boolean flow;
    private final List<MappedPort> mappedPorts = new ArrayList<>();

    public VirtualPin(int index, String name, String type, boolean input, boolean flow) {
        this.index = index;
        this.name = name;
        this.type = type;
        this.input = input;
        this.flow = flow;
    }

    public boolean isMapped() {
        return !mappedPorts.isEmpty();
    }

    public void map(MappedPort port) {
        if (!mappedPorts.contains(port))
            mappedPorts.add(port);
    }

    @Override
    public String toString() {
        return (input ? "in " : "out ") + (flow ? "flow " : "") + name + ":" + type + " -> " + mappedPorts;
    }
}
