package com.nodegraph.gcc.util;

import static org.junit.Assert.*;

import org.junit.Test;

import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.Node;

public class GraphExplainTest {

    private static GraphModel sample() {
        GraphModel g = new GraphModel();
        g.setGraphId("g1");
        g.addNode(new Node("event_1", "OnTick", "event").addOutput("FlowOut").addOutput("dt"));
        Node print = new Node("node_2", "Print", "execution").addInput("FlowIn").addInput("value").addOutput("FlowOut");
        g.addNode(print);
        g.addNode(new Node("node_3", "Entity/Destroy", "execution").addInput("FlowIn").addOutput("FlowOut"));
        g.connect("event_1", "FlowOut", "node_2", "FlowIn");
        g.connect("event_1", "dt", "node_2", "value");
        return g;
    }

    @Test
    public void testSummary() {
        assertEquals("Graph g1 (3 nodes, 1 flow edges, 1 data edges)", new GraphExplain(sample()).summary());
    }

    @Test
    public void testExplainNodeMarksFlowPorts() {
        GraphModel g = sample();
        g.node("node_2").setSourceLine(12);
        String text = new GraphExplain(g).explainNode("node_2");
        assertTrue(text.contains("  Title: Print\n"));
        assertTrue(text.contains("  Line: 12\n"));
        assertTrue(text.contains("  Inputs: FlowIn*, value\n"));
        assertTrue(text.contains("  Incoming (2): "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownNode() {
        new GraphExplain(sample()).explainNode("node_99");
    }

    @Test
    public void testDumpTopology() {
        String dump = new GraphExplain(sample()).dumpTopology();
        assertTrue(dump.startsWith("Graph g1 (3 nodes"));
        assertTrue(dump.contains("[node_2] Print (FLOW)"));
        assertTrue(dump.contains("[event_1] OnTick (FLOW) -> FlowOut:"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(sample()).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  node_3[\"Entity/Destroy\"];\n"));
        assertTrue(mermaid.contains("  event_1 ==> node_2;\n"));
        assertTrue(mermaid.contains("  event_1 -- \"dt\" --> node_2;\n"));
    }
}
