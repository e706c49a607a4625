package com.nodegraph.gcc.api;

import java.util.List;

import com.nodegraph.gcc.core.GraphModel;

/**
 * A domain check run on a graph after it round-trips. Errors block a save,
 * warnings are reported only.
 */
public interface GraphRule {
    String name();

    List<RuleIssue> check(GraphModel graph);
}
