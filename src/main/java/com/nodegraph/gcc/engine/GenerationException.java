package com.nodegraph.gcc.engine;

import lombok.Getter;

/** The emitter cannot express a graph as Graph Code. */
@Getter
public class GenerationException extends RuntimeException {
    /** Offending node, when one is known. */
    private final String nodeId;

    public GenerationException(String message) {
        this(message, null);
    }

    public GenerationException(String message, String nodeId) {
        super(nodeId == null ? message : message + " [" + nodeId + "]");
        this.nodeId = nodeId;
    }
}
