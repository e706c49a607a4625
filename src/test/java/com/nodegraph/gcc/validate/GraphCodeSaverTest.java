package com.nodegraph.gcc.validate;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.TestNodes;
import com.nodegraph.gcc.api.GraphRule;
import com.nodegraph.gcc.api.RuleIssue;
import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.Node;

public class GraphCodeSaverTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private RoundTripValidator validator;
    private GraphModel demo;

    @Before
    public void setUp() throws IOException {
        validator = new RoundTripValidator(TestNodes.parser(), CompilerConfig.defaults());
        demo = TestNodes.parser().parseFile(TestNodes.resource("/samples/demo_graph.py")).graph();
    }

    private static GraphRule rule(String name, RuleIssue issue) {
        return new GraphRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<RuleIssue> check(GraphModel graph) {
                return List.of(issue);
            }
        };
    }

    private static GraphModel fanOut() {
        GraphModel g = new GraphModel();
        g.setGraphId("fan_out");
        g.addNode(new Node("event_1", "OnTick", ControlNodes.EVENT_CATEGORY).addOutput("FlowOut"));
        for (String id : new String[] { "node_2", "node_3" }) {
            g.addNode(new Node(id, "Print", "execution").addInput("FlowIn").addInput("value").addOutput("FlowOut"));
            g.connect("event_1", "FlowOut", id, "FlowIn");
        }
        return g;
    }

    @Test
    public void testSuccessfulSaveWritesGeneratedCode() throws IOException {
        Path target = tmp.getRoot().toPath().resolve("graphs/demo.py");
        GraphCodeSaver.SaveResult r = new GraphCodeSaver(validator, List.of()).save(demo, target);

        assertTrue(r.saved());
        assertTrue(r.roundTrip().success());
        assertEquals(r.roundTrip().generatedCode(), Files.readString(target, StandardCharsets.UTF_8));
        assertEquals(1, target.getParent().toFile().listFiles().length);
    }

    @Test
    public void testFailedRoundTripLeavesFileUntouched() throws IOException {
        Path target = tmp.newFile("fan_out.py").toPath();
        Files.writeString(target, "original", StandardCharsets.UTF_8);

        GraphCodeSaver.SaveResult r = new GraphCodeSaver(validator, List.of()).save(fanOut(), target);

        assertFalse(r.saved());
        assertEquals(RoundTripStage.GENERATE, r.roundTrip().stage());
        assertEquals("original", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    public void testRuleErrorBlocksSave() throws IOException {
        Path target = tmp.getRoot().toPath().resolve("demo.py");
        GraphRule blocking = rule("no-destroy", RuleIssue.error("no-destroy", "Destroy is not allowed here", "node_6"));

        GraphCodeSaver.SaveResult r = new GraphCodeSaver(validator, List.of(blocking)).save(demo, target);

        assertFalse(r.saved());
        assertTrue(r.roundTrip().success());
        assertEquals(1, r.errors().size());
        assertEquals("node_6", r.errors().get(0).nodeId());
        assertFalse(Files.exists(target));
    }

    @Test
    public void testRuleWarningsDoNotBlock() throws IOException {
        Path target = tmp.getRoot().toPath().resolve("demo.py");
        GraphRule advisory = rule("naming", RuleIssue.warning("naming", "Graph name is short", null));

        GraphCodeSaver.SaveResult r = new GraphCodeSaver(validator, List.of(advisory)).save(demo, target);

        assertTrue(r.saved());
        assertEquals(1, r.issues().size());
        assertTrue(r.errors().isEmpty());
        assertTrue(Files.exists(target));
    }

    @Test
    public void testAtomicWriteReplacesExistingFile() throws IOException {
        File dir = tmp.newFolder("out");
        Path target = dir.toPath().resolve("g.py");
        GraphCodeSaver.writeAtomically(target, "first");
        GraphCodeSaver.writeAtomically(target, "second");

        assertEquals("second", Files.readString(target, StandardCharsets.UTF_8));
        assertEquals(1, dir.listFiles().length);
    }
}
