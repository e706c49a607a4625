package com.nodegraph.gcc.core;

import java.util.Objects;

/**
 * A named input or output slot on a {@link Node}. Whether it carries control
 * flow or data is decided from its name, see {@link FlowPorts}.
 */
public record Port(String name) {
    public Port {
        Objects.requireNonNull(name, "name");
    }
}
