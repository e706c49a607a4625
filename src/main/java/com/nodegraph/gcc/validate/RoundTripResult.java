package com.nodegraph.gcc.validate;

import com.nodegraph.gcc.ir.ParsedGraphCode;

/**
 * Verdict of one round-trip run.
 *
 * @param stage       the failing stage, null when the run succeeded
 * @param lineNumber  line in {@code generatedCode} the failure points at, or 0
 * @param reparsed    the model rebuilt from the generated text, null unless the
 *                    reparse stage completed
 */
public record RoundTripResult(boolean success, RoundTripStage stage, String message, String details, int lineNumber,
        String generatedCode, ParsedGraphCode reparsed) {

    static RoundTripResult passed(String generatedCode, ParsedGraphCode reparsed, String details) {
        return new RoundTripResult(true, null, "Round-trip succeeded", details, 0, generatedCode, reparsed);
    }

    static RoundTripResult failed(RoundTripStage stage, String message, String details, int lineNumber,
            String generatedCode) {
        return new RoundTripResult(false, stage, message, details, lineNumber, generatedCode, null);
    }

    /** Failure kind such as {@code SyntaxError}, or null on success. */
    public String errorType() {
        return stage == null ? null : stage.errorType();
    }

    @Override
    public String toString() {
        if (success)
            return "RoundTripResult[OK]";
        return "RoundTripResult[" + stage.errorType() + (lineNumber > 0 ? " at line " + lineNumber : "") + ": "
                + message + "]";
    }
}
