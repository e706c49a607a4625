package com.nodegraph.gcc.api;

/** One finding of a {@link GraphRule}; {@code nodeId} may be null. */
public record RuleIssue(Severity severity, String rule, String message, String nodeId) {

    public enum Severity {
        ERROR, WARNING
    }

    public static RuleIssue error(String rule, String message, String nodeId) {
        return new RuleIssue(Severity.ERROR, rule, message, nodeId);
    }

    public static RuleIssue warning(String rule, String message, String nodeId) {
        return new RuleIssue(Severity.WARNING, rule, message, nodeId);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " [" + rule + "] " + message + (nodeId == null ? "" : " (" + nodeId + ")");
    }
}
