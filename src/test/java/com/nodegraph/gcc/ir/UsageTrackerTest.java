package com.nodegraph.gcc.ir;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

import com.nodegraph.gcc.TestNodes;
import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.syntax.Ast.FunctionDef;
import com.nodegraph.gcc.syntax.Ast.Module;
import com.nodegraph.gcc.syntax.Ast.Stmt;
import com.nodegraph.gcc.syntax.Parser;

public class UsageTrackerTest {

    /** Builds the body of the only method in {@code source} and tracks {@code params} through it. */
    private static UsageTracker.Result track(GraphModel graph, Set<String> params, String... lines) {
        StringBuilder sb = new StringBuilder("def method(self, ").append(String.join(", ", params)).append("):\n");
        for (String l : lines)
            sb.append("    ").append(l).append('\n');
        Module module = Parser.parse(sb.toString());
        List<Stmt> body = ((FunctionDef) module.body().get(0)).body();

        NodeFactory factory = new NodeFactory(TestNodes.registry(), Map.of(), List.of("game"), "test.py");
        FlowBuilder flow = new FlowBuilder(graph, new VarEnv(), factory, params, Map.of(), null, null, true);
        flow.block(body, FlowBuilder.Cursor.entry());
        return new UsageTracker(factory, graph.nodes(), params, Map.of(), null).track(body);
    }

    private static String idOf(GraphModel graph, String title) {
        return TestNodes.nodeTitled(graph, title).getId();
    }

    @Test
    public void testDirectArgumentUsage() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("count"), "Print(value=count)");
        assertEquals(List.of(new MappedPort(idOf(graph, "Print"), "value")), r.usageOf("count"));
        assertTrue(r.controlFlowUsage().isEmpty());
    }

    @Test
    public void testCompoundConditionRecordedSeparately() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("count"),
                "if count > 0:",
                "    Print(value=count)");

        String branch = idOf(graph, ControlNodes.BRANCH);
        String print = idOf(graph, "Print");
        assertEquals(List.of(new MappedPort(print, "value")), r.usageOf("count"));
        assertEquals(List.of(new MappedPort(branch, ControlNodes.CONDITION)), r.conditionUsage().get("count"));
        assertEquals(List.of(new MappedPort(print, "value"), new MappedPort(branch, ControlNodes.CONDITION)),
                r.allUsageOf("count"));
        assertTrue(r.controlFlowUsage().contains("count"));
        assertNull(graph.incomingEdge(branch, ControlNodes.CONDITION));
    }

    @Test
    public void testPlainConditionIsDirectUsage() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("flag"),
                "if flag:",
                "    Print(value=1)");
        String branch = idOf(graph, ControlNodes.BRANCH);
        assertEquals(List.of(new MappedPort(branch, ControlNodes.CONDITION)), r.usageOf("flag"));
        assertFalse(r.conditionUsage().containsKey("flag"));
    }

    @Test
    public void testAliasFollowsParameter() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("count"),
                "n = count",
                "Print(value=n)");
        assertEquals("count", r.aliasOf().get("n"));
        assertEquals(List.of(new MappedPort(idOf(graph, "Print"), "value")), r.usageOf("count"));
    }

    @Test
    public void testReassignmentStopsAliasing() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("count"),
                "n = count",
                "n = MakeValue()",
                "Print(value=n)");
        assertTrue(r.usageOf("count").isEmpty());
    }

    @Test
    public void testLoopIterableIsControlFlowUsage() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("limit"),
                "for i in range(limit):",
                "    Print(value=i)");
        String loop = idOf(graph, ControlNodes.FINITE_LOOP);
        assertTrue(r.controlFlowUsage().contains("limit"));
        assertEquals(List.of(new MappedPort(loop, ControlNodes.END)), r.usageOf("limit"));
    }

    @Test
    public void testLiteralConstantsTracked() {
        GraphModel graph = new GraphModel();
        UsageTracker.Result r = track(graph, Set.of("count"),
                "greeting = \"hi\"",
                "Print(value=greeting)");
        assertEquals("\"hi\"", r.constantOf().get("greeting"));
    }
}
