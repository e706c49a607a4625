package com.nodegraph.gcc.ir;

import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.GraphModel;

/**
 * Result of a successful forward parse. For a composite definition
 * {@code composite} is set and {@code graph} is its sub-graph; for an
 * ordinary graph {@code composite} is null.
 */
public record ParsedGraphCode(GraphModel graph, CompositeNodeConfig composite, SourceMetadata metadata) {

    public boolean isComposite() {
        return composite != null;
    }
}
