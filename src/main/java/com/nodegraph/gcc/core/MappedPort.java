package com.nodegraph.gcc.core;

import java.util.Objects;

/** A {@code (nodeId, portName)} pair. */
public record MappedPort(String nodeId, String portName) {
    public MappedPort {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(portName, "portName");
    }

    @Override
    public String toString() {
        return nodeId + "." + portName;
    }
}
