package com.nodegraph.gcc.ir;

import com.nodegraph.gcc.core.FlowPorts;

/** A declared pin before it is mapped into the sub-graph. */
public record PinSpec(String name, String type) {
    public static final String GENERIC = "Generic";

    public boolean isFlow() {
        return FlowPorts.FLOW_TYPE.equals(type);
    }

    public static PinSpec flow(String name) {
        return new PinSpec(name, FlowPorts.FLOW_TYPE);
    }
}
