package com.nodegraph.gcc.core;

import java.util.List;
import java.util.Objects;

/** Ordered node grouping assigned by the layout engine. Never read by the compiler. */
public record BasicBlock(String id, List<String> nodeIds) {
    public BasicBlock {
        Objects.requireNonNull(id, "id");
        nodeIds = List.copyOf(nodeIds);
    }
}
