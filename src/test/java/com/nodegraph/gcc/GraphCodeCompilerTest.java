package com.nodegraph.gcc;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.nodegraph.gcc.api.LayoutResult;
import com.nodegraph.gcc.core.BasicBlock;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.io.GraphDataCache;
import com.nodegraph.gcc.io.RegistryHandle;
import com.nodegraph.gcc.ir.ParsedGraphCode;
import com.nodegraph.gcc.validate.GraphCodeSaver;
import com.nodegraph.gcc.validate.RoundTripResult;

public class GraphCodeCompilerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static GraphCodeCompiler compiler() {
        return GraphCodeCompiler.open(TestNodes.resource("/workspace"));
    }

    @Test
    public void testOpenReadsWorkspaceConfig() {
        GraphCodeCompiler compiler = compiler();
        assertEquals(40, compiler.config().getMinGeneratedLength());
        assertTrue(compiler.registryHandle().registry().contains("CheckRange"));
    }

    @Test
    public void testParseGenerateSave() throws IOException {
        GraphCodeCompiler compiler = compiler();
        GraphModel graph = compiler.parseFile(TestNodes.resource("/samples/demo_graph.py")).graph();
        assertEquals(6, graph.nodeCount());

        String code = compiler.generate(graph);
        assertTrue(code.contains("EntityDestroy(target=source_entity)"));

        RoundTripResult check = compiler.validate(graph);
        assertTrue(check.toString(), check.success());

        Path target = tmp.getRoot().toPath().resolve("demo.py");
        GraphCodeSaver.SaveResult saved = compiler.save(graph, target);
        assertTrue(saved.saved());
        assertEquals(code, Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    public void testParseTextAppliesLayout() {
        GraphCodeCompiler compiler = compiler().withLayout(g -> new LayoutResult(
                Map.of("event_1", new Node.Position(0, 0)),
                List.of(new BasicBlock("block_1", List.of("event_1")))));
        ParsedGraphCode parsed = compiler.parseText(TestNodes.graph("OnCreated", "", "Print(value=1)"), "inline.py");

        assertEquals(new Node.Position(0, 0), parsed.graph().node("event_1").getPosition());
        assertEquals(1, parsed.graph().basicBlocks().size());
    }

    @Test
    public void testParseCachedHitsCache() throws IOException {
        GraphDataCache cache = new GraphDataCache();
        GraphCodeCompiler compiler = new GraphCodeCompiler(RegistryHandle.of(TestNodes.registry()),
                CompilerConfig.defaults(), cache);
        Path file = tmp.newFile("cached.py").toPath();
        Files.writeString(file, TestNodes.graph("OnCreated", "", "Print(value=1)"), StandardCharsets.UTF_8);

        GraphModel first = compiler.parseCached("root", file);
        assertEquals(1, cache.size());

        // a cache hit ignores the changed file
        Files.writeString(file, TestNodes.graph("OnCreated", "", "Print(value=1)", "Print(value=2)"),
                StandardCharsets.UTF_8);
        GraphModel second = compiler.parseCached("root", file);
        assertNotSame(first, second);
        assertEquals(first.nodeCount(), second.nodeCount());

        compiler.evictCached("root", file);
        assertEquals(3, compiler.parseCached("root", file).nodeCount());
    }

    @Test
    public void testRegisteredCompositeIsCallable() throws IOException {
        GraphCodeCompiler compiler = new GraphCodeCompiler(RegistryHandle.of(TestNodes.registry()),
                CompilerConfig.defaults(), new GraphDataCache());
        String source = String.join("\n",
                "\"\"\"",
                "composite_id: composite_relay",
                "node_name: Relay",
                "\"\"\"",
                "class Relay:",
                "    @flow_entry(inputs=[(\"FlowIn\", \"Flow\"), (\"value\", \"Integer\")],"
                        + " outputs=[(\"FlowOut\", \"Flow\")])",
                "    def run(self, value):",
                "        Print(value=value)",
                "");
        CompositeNodeConfig relay = compiler.parseText(source, "relay.py").composite();
        assertTrue(compiler.validate(relay).success());
        compiler.registerComposite(relay);

        GraphModel user = compiler.parseText(TestNodes.graph("OnCreated", "", "Relay(value=5)"), "user.py").graph();
        assertEquals("composite", TestNodes.nodeTitled(user, "Relay").getCategory());
        assertTrue(compiler.generate(user).contains("Relay(value=5)"));
    }
}
