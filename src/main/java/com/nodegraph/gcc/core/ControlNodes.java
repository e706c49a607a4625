package com.nodegraph.gcc.core;

/**
 * Titles, categories and port names of the built-in control-flow nodes that
 * the compiler creates for {@code if}, {@code match} and {@code for}.
 */
public final class ControlNodes {
    private ControlNodes() {
        // Constants
    }

    public static final String CONTROL_CATEGORY = "control";
    public static final String EVENT_CATEGORY = "event";

    public static final String BRANCH = "Branch";
    public static final String MULTI_BRANCH = "MultiBranch";
    public static final String FINITE_LOOP = "FiniteLoop";
    public static final String LIST_ITERATION = "ListIteration";

    public static final String CONDITION = "Condition";
    public static final String CONTROL_EXPRESSION = "ControlExpression";
    public static final String START = "Start";
    public static final String END = "End";
    public static final String CURRENT_VALUE = "CurrentValue";
    public static final String LIST = "List";
    public static final String CURRENT_ELEMENT = "CurrentElement";

    public static boolean isBranch(Node node) {
        return BRANCH.equals(node.getTitle()) && CONTROL_CATEGORY.equals(node.getCategory());
    }

    public static boolean isMultiBranch(Node node) {
        return MULTI_BRANCH.equals(node.getTitle()) && CONTROL_CATEGORY.equals(node.getCategory());
    }

    public static boolean isLoop(Node node) {
        return (FINITE_LOOP.equals(node.getTitle()) || LIST_ITERATION.equals(node.getTitle()))
                && CONTROL_CATEGORY.equals(node.getCategory());
    }

    public static boolean isEvent(Node node) {
        return EVENT_CATEGORY.equals(node.getCategory());
    }

    /** Output port carrying the loop variable of a loop node. */
    public static String loopValuePort(Node loop) {
        return FINITE_LOOP.equals(loop.getTitle()) ? CURRENT_VALUE : CURRENT_ELEMENT;
    }
}
