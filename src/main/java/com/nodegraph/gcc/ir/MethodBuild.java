package com.nodegraph.gcc.ir;

import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.syntax.Ast.Expr;
import com.nodegraph.gcc.syntax.Ast.FunctionDef;

/**
 * One role-marked method after its sub-graph was built. {@code remap} maps
 * the sub-graph's node ids to their ids in the merged file graph.
 */
record MethodBuild(FunctionDef def, MethodRole role, GraphModel graph, VarEnv env, UsageTracker.Result usage,
        List<Expr> returnValues, PinMarkers markers, MethodRole.PinSet pins, Map<String, String> remap) {

    String name() {
        return def.name();
    }

    MappedPort toMerged(MappedPort port) {
        return new MappedPort(remap.getOrDefault(port.nodeId(), port.nodeId()), port.portName());
    }
}
