package com.nodegraph.gcc.api;

import com.nodegraph.gcc.core.GraphModel;

/**
 * Positions nodes and groups them into basic blocks. The compiler stores
 * the result on the model and never reads it back.
 */
@FunctionalInterface
public interface LayoutEngine {
    LayoutResult layout(GraphModel graph);
}
