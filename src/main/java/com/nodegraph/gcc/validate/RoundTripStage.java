package com.nodegraph.gcc.validate;

/**
 * Stages of a round-trip run, in execution order. The first stage that fails
 * ends the run; {@link #errorType()} names the failure kind reported to
 * callers.
 */
public enum RoundTripStage {
    GENERATE("GenerationError"),
    SYNTAX_CHECK("SyntaxError"),
    EXECUTION("ExecutionError"),
    STRUCTURAL("StructuralError");

    private final String errorType;

    RoundTripStage(String errorType) {
        this.errorType = errorType;
    }

    public String errorType() {
        return errorType;
    }
}
