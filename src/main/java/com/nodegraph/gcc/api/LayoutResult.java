package com.nodegraph.gcc.api;

import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.BasicBlock;
import com.nodegraph.gcc.core.Node;

public record LayoutResult(Map<String, Node.Position> positions, List<BasicBlock> blocks) {
    public LayoutResult {
        positions = Map.copyOf(positions);
        blocks = List.copyOf(blocks);
    }
}
