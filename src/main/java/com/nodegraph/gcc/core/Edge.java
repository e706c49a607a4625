package com.nodegraph.gcc.core;

import java.util.Objects;

/** Directed connection from an output port to an input port. */
public record Edge(String id, String srcNode, String srcPort, String dstNode, String dstPort) {
    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(srcNode, "srcNode");
        Objects.requireNonNull(srcPort, "srcPort");
        Objects.requireNonNull(dstNode, "dstNode");
        Objects.requireNonNull(dstPort, "dstPort");
    }

    public MappedPort source() {
        return new MappedPort(srcNode, srcPort);
    }

    public MappedPort target() {
        return new MappedPort(dstNode, dstPort);
    }
}
