package com.nodegraph.gcc.ir;

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.TestNodes;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.Edge;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.GraphVariable;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.core.VirtualPin;
import com.nodegraph.gcc.engine.GraphCodeEmitter;
import com.nodegraph.gcc.io.NodeRegistry;

public class GraphCodeParserTest {

    /** First handler body line produced by {@link TestNodes#graph}. */
    private static final int BODY = 9;

    private static GraphParseException parseFailure(String source) {
        try {
            TestNodes.parse(source);
            fail("Expected GraphParseException");
            return null;
        } catch (GraphParseException e) {
            return e;
        }
    }

    private static Edge edgeInto(GraphModel g, Node dst, String port) {
        Edge e = g.incomingEdge(dst.getId(), port);
        assertNotNull("no edge into " + dst.getId() + "." + port, e);
        return e;
    }

    // --- Basic forward parse ---

    @Test
    public void testValueFeedsPrint() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "source_entity",
                "value = MakeValue()",
                "Print(value=value)")).graph();

        assertEquals(3, g.nodeCount());
        Node event = TestNodes.nodeTitled(g, "OnCreated");
        Node make = TestNodes.nodeTitled(g, "MakeValue");
        Node print = TestNodes.nodeTitled(g, "Print");
        assertEquals("event_1", event.getId());
        assertEquals(ControlNodes.EVENT_CATEGORY, event.getCategory());
        assertTrue(event.hasOutput("source_entity"));
        assertEquals(new MappedPort(make.getId(), "value"), edgeInto(g, print, "value").source());
        assertEquals(new MappedPort(event.getId(), FlowPorts.FLOW_OUT), edgeInto(g, print, FlowPorts.FLOW_IN).source());
        assertEquals(1, g.flowEdges().size());
        assertEquals(1, g.dataEdges().size());
        assertEquals(BODY + 1, print.getSourceLine());
    }

    @Test
    public void testLiteralArgumentsBecomeConstants() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "greeting = \"hi\"",
                "Print(value=greeting)",
                "Print(value=42)")).graph();
        List<Node> prints = g.nodes().stream().filter(n -> n.getTitle().equals("Print")).toList();
        assertEquals("\"hi\"", prints.get(0).inputConstants().get("value"));
        assertEquals("42", prints.get(1).inputConstants().get("value"));
        assertEquals(2, g.flowEdges().size());
    }

    @Test
    public void testEventParameterThroughStateField() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "source_entity",
                "self.target = source_entity",
                "Destroy(target=self.target)")).graph();
        Node destroy = TestNodes.nodeTitled(g, "Entity/Destroy");
        assertEquals(new MappedPort("event_1", "source_entity"), edgeInto(g, destroy, "target").source());
    }

    @Test
    public void testSlashlessCalleeResolves() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "source_entity",
                "EntityDestroy(target=source_entity)")).graph();
        assertEquals("execution", TestNodes.nodeTitled(g, "Entity/Destroy").getCategory());
    }

    @Test
    public void testContextArgumentIsSkipped() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "Print(self.game, value=1)")).graph();
        assertEquals("1", TestNodes.nodeTitled(g, "Print").inputConstants().get("value"));
    }

    @Test
    public void testVariadicAndKeyValueArguments() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "text = Concat(\"a\", \"b\")",
                "d = MakeDict(\"hp\", 10)",
                "Print(value=text)")).graph();
        Node concat = TestNodes.nodeTitled(g, "Concat");
        assertEquals("\"a\"", concat.inputConstants().get("0"));
        assertEquals("\"b\"", concat.inputConstants().get("1"));
        Node dict = TestNodes.nodeTitled(g, "MakeDict");
        assertEquals("\"hp\"", dict.inputConstants().get("key_0"));
        assertEquals("10", dict.inputConstants().get("value_0"));
    }

    // --- Metadata ---

    @Test
    public void testDocumentationBlockMetadata() throws IOException {
        ParsedGraphCode parsed = TestNodes.parser().parseFile(TestNodes.resource("/samples/demo_graph.py"));
        GraphModel g = parsed.graph();

        assertFalse(parsed.isComposite());
        assertEquals("server_demo", g.getGraphId());
        assertEquals("Demo", g.getGraphName());
        assertEquals("server", g.getGraphType());
        assertEquals("Prints a value when the owner is created", g.getDescription());
        assertEquals(List.of(new GraphVariable("counter", "Integer", "0")), g.graphVariables());
    }

    @Test
    public void testMissingMetadataFallsBackToClassName() {
        GraphModel g = TestNodes.parse(String.join("\n",
                "class Plain:",
                "    @event_handler(event=\"OnTick\")",
                "    def on_tick(self):",
                "        Print(value=1)",
                "")).graph();
        assertEquals("Plain", g.getGraphId());
        assertEquals("Plain", g.getGraphName());
        assertEquals("server", g.getGraphType());
    }

    // --- Control flow ---

    @Test
    public void testIfElseJoinsBeforeNextStatement() throws IOException {
        GraphModel g = TestNodes.parser().parseFile(TestNodes.resource("/samples/demo_graph.py")).graph();
        Node branch = TestNodes.nodeTitled(g, ControlNodes.BRANCH);
        Node make = TestNodes.nodeTitled(g, "MakeValue");
        Node destroy = TestNodes.nodeTitled(g, "Entity/Destroy");

        assertEquals(new MappedPort(make.getId(), "value"), edgeInto(g, branch, ControlNodes.CONDITION).source());
        assertEquals(1, g.outgoing(branch.getId(), FlowPorts.YES).size());
        assertEquals(1, g.outgoing(branch.getId(), FlowPorts.NO).size());
        assertEquals(2, g.incomingFlow(destroy.getId()).size());
    }

    @Test
    public void testComparisonConditionConnectsLeftOperand() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "value = MakeValue()",
                "if value > 3:",
                "    Print(value=value)")).graph();
        Node branch = TestNodes.nodeTitled(g, ControlNodes.BRANCH);
        Node make = TestNodes.nodeTitled(g, "MakeValue");
        assertEquals(new MappedPort(make.getId(), "value"), edgeInto(g, branch, ControlNodes.CONDITION).source());

        String regenerated = new GraphCodeEmitter().generate(g);
        assertFalse(regenerated, regenerated.contains("if None:"));
        assertTrue(regenerated, regenerated.contains("        if value:\n            Print(value=value)\n"));
    }

    @Test
    public void testNotConditionConnectsOperand() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "flag",
                "if not flag:",
                "    Print(value=1)")).graph();
        Node branch = TestNodes.nodeTitled(g, ControlNodes.BRANCH);
        Node event = TestNodes.nodeTitled(g, "OnCreated");
        assertEquals(new MappedPort(event.getId(), "flag"), edgeInto(g, branch, ControlNodes.CONDITION).source());
    }

    @Test
    public void testConditionWithoutVariableRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "flag, other",
                "if flag and other:",
                "    Print(value=1)"));
        assertEquals(BODY, e.getLine());
        assertTrue(e.getMessage(), e.getMessage().contains("has no graph form"));
    }

    @Test
    public void testCompositeConditionWithoutVariableMapsPins() {
        CompositeNodeConfig c = TestNodes.parse(TestNodes.composite(
                "@flow_entry(inputs=[(\"FlowIn\", \"Flow\"), (\"count\", \"Integer\")],"
                        + " outputs=[(\"FlowOut\", \"Flow\")])",
                "def run(self, count):",
                "    if count > 0 and count < 9:",
                "        Print(value=1)")).composite();
        Node branch = TestNodes.nodeTitled(c.getSubGraph(), ControlNodes.BRANCH);
        assertNull(c.getSubGraph().incomingEdge(branch.getId(), ControlNodes.CONDITION));
        assertEquals(List.of(new MappedPort(branch.getId(), ControlNodes.CONDITION)),
                c.findPin("count", true).getMappedPorts());
    }

    // --- Bindings across branches ---

    @Test
    public void testBothArmsAssigningReadAfterRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "flag",
                "if flag:",
                "    e = Spawn(template=1)",
                "else:",
                "    e = Spawn(template=2)",
                "Print(value=e)"));
        assertEquals(BODY + 4, e.getLine());
        assertTrue(e.getMessage(), e.getMessage().contains("'e' assigned in a branch is read after it"));
        assertTrue(e.getMessage(), e.getMessage().contains("line " + BODY));
    }

    @Test
    public void testOneArmAssignmentReadAfterRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "flag",
                "if flag:",
                "    e = Spawn(template=1)",
                "Print(value=e)"));
        assertEquals(BODY + 2, e.getLine());
        assertTrue(e.getMessage(), e.getMessage().contains("'e' assigned in a branch"));
    }

    @Test
    public void testArmBindingStaysInsideArm() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "flag",
                "if flag:",
                "    e = Spawn(template=1)",
                "    Print(value=e)",
                "else:",
                "    e = Spawn(template=2)",
                "    Print(value=e)")).graph();
        List<Node> spawns = g.nodes().stream().filter(n -> n.getTitle().equals("Spawn")).toList();
        List<Node> prints = g.nodes().stream().filter(n -> n.getTitle().equals("Print")).toList();
        assertEquals(new MappedPort(spawns.get(0).getId(), "entity"), edgeInto(g, prints.get(0), "value").source());
        assertEquals(new MappedPort(spawns.get(1).getId(), "entity"), edgeInto(g, prints.get(1), "value").source());
    }

    @Test
    public void testBindingOfOnlyLiveArmSurvives() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "flag",
                "if flag:",
                "    e = Spawn(template=1)",
                "else:",
                "    return",
                "Print(value=e)")).graph();
        Node spawn = TestNodes.nodeTitled(g, "Spawn");
        assertEquals(new MappedPort(spawn.getId(), "entity"),
                edgeInto(g, TestNodes.nodeTitled(g, "Print"), "value").source());
    }

    @Test
    public void testArmsAgreeingOnConstant() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "flag",
                "if flag:",
                "    x = 7",
                "else:",
                "    x = 7",
                "Print(value=x)")).graph();
        List<Node> prints = g.nodes().stream().filter(n -> n.getTitle().equals("Print")).toList();
        assertEquals(1, prints.size());
        assertEquals("7", prints.get(0).inputConstants().get("value"));
    }

    @Test
    public void testReassignmentAfterBranchIsReadable() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "flag",
                "if flag:",
                "    e = Spawn(template=1)",
                "e = MakeValue()",
                "Print(value=e)")).graph();
        Node make = TestNodes.nodeTitled(g, "MakeValue");
        assertEquals(new MappedPort(make.getId(), "value"),
                edgeInto(g, TestNodes.nodeTitled(g, "Print"), "value").source());
    }

    @Test
    public void testRangeLoop() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "for i in range(3):",
                "    Print(value=i)",
                "Print(value=\"done\")")).graph();
        Node loop = TestNodes.nodeTitled(g, ControlNodes.FINITE_LOOP);
        assertEquals("0", loop.inputConstants().get(ControlNodes.START));
        assertEquals("3", loop.inputConstants().get(ControlNodes.END));

        List<Node> prints = g.nodes().stream().filter(n -> n.getTitle().equals("Print")).toList();
        assertEquals(new MappedPort(loop.getId(), ControlNodes.CURRENT_VALUE),
                edgeInto(g, prints.get(0), "value").source());
        assertEquals(new MappedPort(loop.getId(), FlowPorts.LOOP_BODY),
                edgeInto(g, prints.get(0), FlowPorts.FLOW_IN).source());
        assertEquals(new MappedPort(loop.getId(), FlowPorts.LOOP_COMPLETE),
                edgeInto(g, prints.get(1), FlowPorts.FLOW_IN).source());
    }

    @Test
    public void testBreakConnectsToLoop() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "items = GetList()",
                "for item in items:",
                "    Print(value=item)",
                "    break")).graph();
        Node loop = TestNodes.nodeTitled(g, ControlNodes.LIST_ITERATION);
        Node print = TestNodes.nodeTitled(g, "Print");
        assertEquals(new MappedPort(print.getId(), FlowPorts.FLOW_OUT),
                edgeInto(g, loop, FlowPorts.BREAK_LOOP).source());
        assertEquals(new MappedPort(TestNodes.nodeTitled(g, "GetList").getId(), "items"),
                edgeInto(g, loop, ControlNodes.LIST).source());
    }

    @Test
    public void testMatchBuildsMultiBranch() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "mode = MakeValue()",
                "match mode:",
                "    case 1:",
                "        Print(value=1)",
                "    case \"x\":",
                "        Print(value=2)",
                "    case _:",
                "        Print(value=3)")).graph();
        Node mb = TestNodes.nodeTitled(g, ControlNodes.MULTI_BRANCH);
        assertTrue(mb.hasOutput("1"));
        assertTrue(mb.hasOutput("x"));
        assertTrue(mb.flowAliases().contains("1"));
        assertEquals(1, g.outgoing(mb.getId(), "1").size());
        assertEquals(1, g.outgoing(mb.getId(), "x").size());
        assertEquals(1, g.outgoing(mb.getId(), FlowPorts.DEFAULT).size());
        assertEquals(4, g.flowEdges().size());
    }

    @Test
    public void testMatchOnMultiExitNodeDispatches() {
        String source = TestNodes.graph("OnCreated", "",
                "match CheckRange(value=5):",
                "    case \"InRange\":",
                "        Print(value=1)");
        GraphModel g = TestNodes.parse(source).graph();
        Node check = TestNodes.nodeTitled(g, "CheckRange");
        assertTrue(g.nodes().stream().noneMatch(n -> n.getTitle().equals(ControlNodes.MULTI_BRANCH)));
        assertEquals("5", check.inputConstants().get("value"));
        assertEquals(1, g.outgoing(check.getId(), "InRange").size());
        assertTrue(g.outgoing(check.getId(), "OutOfRange").isEmpty());

        String regenerated = new GraphCodeEmitter().generate(g);
        assertTrue(regenerated.contains("match CheckRange(value=5):"));
        assertTrue(regenerated.contains("case \"InRange\":"));
    }

    @Test
    public void testUnknownCaseOfMultiExitNodeRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "",
                "match CheckRange(value=5):",
                "    case \"Elsewhere\":",
                "        Print(value=1)"));
        assertEquals(BODY + 1, e.getLine());
        assertTrue(e.getMessage().contains("Elsewhere"));
    }

    // --- Dynamic events and annotations ---

    @Test
    public void testKwargsLookupBecomesEventOutput() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnHit", "**kwargs",
                "damage = kwargs.get(\"damage\")",
                "Print(value=damage)")).graph();
        Node event = TestNodes.nodeTitled(g, "OnHit");
        assertTrue(event.hasOutput("damage"));
        assertEquals(new MappedPort(event.getId(), "damage"),
                edgeInto(g, TestNodes.nodeTitled(g, "Print"), "value").source());
        assertEquals(Map.of(event.getId(), List.of("damage")), g.metadata().get(GraphCodeParser.CONTEXT_LOOKUPS));

        String regenerated = new GraphCodeEmitter().generate(g);
        assertTrue(regenerated.contains("def on_OnHit(self, **kwargs):"));
        assertTrue(regenerated.contains("damage = kwargs.get(\"damage\")"));
    }

    @Test
    public void testAnnotatedAssignmentRecordsTypeOverride() {
        GraphModel g = TestNodes.parse(TestNodes.graph("OnCreated", "",
                "hp: Health = MakeValue()",
                "Print(value=hp)")).graph();
        String id = TestNodes.nodeTitled(g, "MakeValue").getId();
        assertEquals(Map.of(id + ".value", "Health"), g.metadata().get(GraphCodeParser.PORT_TYPE_OVERRIDES));
        assertTrue(new GraphCodeEmitter().generate(g).contains("value: Health = MakeValue()"));
    }

    // --- Composites ---

    @Test
    public void testCompositeSample() throws IOException {
        ParsedGraphCode parsed = TestNodes.parser().parseFile(TestNodes.resource("/samples/counter_composite.py"));
        assertTrue(parsed.isComposite());
        CompositeNodeConfig c = parsed.composite();
        assertEquals("composite_counter", c.getCompositeId());
        assertEquals("Counter Gate", c.getNodeName());
        assertEquals("Prints the count when it is positive", c.getDescription());
        assertEquals("composite", parsed.graph().getGraphType());

        GraphModel sub = c.getSubGraph();
        Node branch = TestNodes.nodeTitled(sub, ControlNodes.BRANCH);
        Node print = TestNodes.nodeTitled(sub, "Print");
        assertEquals(List.of(new MappedPort(branch.getId(), FlowPorts.FLOW_IN)),
                c.findPin(FlowPorts.FLOW_IN, true).getMappedPorts());
        VirtualPin count = c.findPin("count", true);
        assertEquals("Integer", count.getType());
        assertEquals(List.of(new MappedPort(print.getId(), "value"), new MappedPort(branch.getId(), ControlNodes.CONDITION)),
                count.getMappedPorts());
        assertEquals(List.of(new MappedPort(print.getId(), FlowPorts.FLOW_OUT)),
                c.findPin(FlowPorts.FLOW_OUT, false).getMappedPorts());
        assertEquals(0, sub.flowEdges().stream().filter(e -> e.srcNode().startsWith("event")).count());
    }

    @Test
    public void testDataMethodOutputPin() {
        CompositeNodeConfig c = TestNodes.parse(TestNodes.composite(
                "@data_method(inputs=[(\"a\", \"Integer\")], outputs=[(\"total\", \"Integer\")])",
                "def compute(self, a):",
                "    total = Add(a=a, b=1)",
                "    return total")).composite();
        Node add = TestNodes.nodeTitled(c.getSubGraph(), "Add");
        assertEquals(List.of(new MappedPort(add.getId(), "result")), c.findPin("total", false).getMappedPorts());
        assertEquals(List.of(new MappedPort(add.getId(), "a")), c.findPin("a", true).getMappedPorts());
        assertEquals("1", add.inputConstants().get("b"));
    }

    @Test
    public void testCompositeCalledThroughInstanceField() {
        CompositeNodeConfig gate = new CompositeNodeConfig("composite_gate", "Gate");
        gate.addPin(new VirtualPin(0, FlowPorts.FLOW_IN, FlowPorts.FLOW_TYPE, true, true));
        gate.addPin(new VirtualPin(1, "count", "Integer", true, false));
        gate.addPin(new VirtualPin(0, FlowPorts.FLOW_OUT, FlowPorts.FLOW_TYPE, false, true));
        NodeRegistry registry = TestNodes.registry();
        registry.registerComposite(gate);

        String source = String.join("\n",
                "\"\"\"",
                "graph_id: uses_gate",
                "\"\"\"",
                "class UsesGate:",
                "    def __init__(self, game, owner_entity):",
                "        self.game = game",
                "        self.gate = Gate(game, owner_entity)",
                "",
                "    @event_handler(event=\"OnCreated\")",
                "    def on_created(self):",
                "        self.gate.run(count=3)",
                "        Print(value=1)",
                "");
        GraphModel g = new GraphCodeParser(registry, CompilerConfig.defaults()).parse(source, "uses_gate.py").graph();
        Node node = TestNodes.nodeTitled(g, "Gate");
        assertEquals("composite", node.getCategory());
        assertEquals("3", node.inputConstants().get("count"));
        assertEquals(new MappedPort(node.getId(), FlowPorts.FLOW_OUT),
                edgeInto(g, TestNodes.nodeTitled(g, "Print"), FlowPorts.FLOW_IN).source());
    }

    // --- Rejections ---

    @Test
    public void testLegacyFreeFunctionRejected() throws IOException {
        try {
            TestNodes.parser().parseFile(TestNodes.resource("/samples/legacy_function.py"));
            fail("Expected GraphParseException");
        } catch (GraphParseException e) {
            assertEquals(6, e.getLine());
            assertTrue(e.getMessage().contains("legacy"));
        }
    }

    @Test
    public void testUnknownNodeCarriesLine() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "",
                "Print(value=1)",
                "Frobnicate()"));
        assertEquals(BODY + 1, e.getLine());
        assertEquals("test.py", e.getFile());
        assertTrue(e.getMessage().contains("Unknown node 'Frobnicate'"));
    }

    @Test
    public void testWhileLoopRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "",
                "while True:",
                "    Print(value=1)"));
        assertEquals(BODY, e.getLine());
        assertTrue(e.getMessage().contains("'while'"));
    }

    @Test
    public void testFlowEntryOutsideCompositeRejected() {
        String source = String.join("\n",
                "\"\"\"",
                "graph_id: g",
                "\"\"\"",
                "class G:",
                "    @flow_entry()",
                "    def run(self):",
                "        Print(value=1)",
                "");
        GraphParseException e = parseFailure(source);
        assertEquals(6, e.getLine());
        assertTrue(e.getMessage().contains("composite_id"));
    }

    @Test
    public void testUnknownKeywordArgumentRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "",
                "Print(colour=1)"));
        assertEquals(BODY, e.getLine());
        assertTrue(e.getMessage().contains("colour"));
    }

    @Test
    public void testSyntaxErrorsSurfaceAsParseErrors() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "",
                "Print(value=1"));
        assertTrue(e.getLine() >= BODY);
    }

    @Test
    public void testFlowNodeAsValueRejected() {
        GraphParseException e = parseFailure(TestNodes.graph("OnCreated", "",
                "Print(value=Spawn(template=1))"));
        assertTrue(e.getMessage().contains("cannot be used as a value"));
    }
}
