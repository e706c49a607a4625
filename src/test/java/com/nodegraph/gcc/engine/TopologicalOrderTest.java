package com.nodegraph.gcc.engine;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.nodegraph.gcc.core.Node;

public class TopologicalOrderTest {

    private Node node(String id) {
        return new Node(id, "Op", "math");
    }

    @Test
    public void testEmptyOrder() {
        assertEquals(0, TopologicalOrder.builder().build().nodeCount());
    }

    @Test
    public void testEdgesOverrideInsertionOrder() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(node("read")).addNode(node("add")).addNode(node("const"))
                .addEdge("const", "add")
                .addEdge("add", "read")
                .build();

        assertEquals(List.of("const", "add", "read"), order.ids());
        assertEquals("const", order.node(0).getId());
        assertEquals(2, order.topoIndex("read"));
        assertEquals(List.of("add"), order.dependents("const"));
        assertTrue(order.dependents("read").isEmpty());
    }

    @Test
    public void testDiamondKeepsInsertionOrderAmongReadyNodes() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(node("node_1")).addNode(node("node_3")).addNode(node("node_2")).addNode(node("node_4"))
                .addEdge("node_1", "node_2")
                .addEdge("node_1", "node_3")
                .addEdge("node_2", "node_4")
                .addEdge("node_3", "node_4")
                .build();

        // node_3 was added before node_2, both become ready together
        assertEquals(List.of("node_1", "node_3", "node_2", "node_4"), order.ids());
    }

    @Test
    public void testNoEdgesIsInsertionOrder() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(node("node_3")).addNode(node("node_1")).addNode(node("node_2"))
                .build();
        assertEquals(List.of("node_3", "node_1", "node_2"), order.ids());
        assertTrue(order.contains("node_1"));
        assertFalse(order.contains("node_9"));
    }

    @Test
    public void testRepeatedEdgeKeptOnce() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(node("A")).addNode(node("B"))
                .addEdge("A", "B")
                .addEdge("A", "B")
                .build();
        assertEquals(List.of("B"), order.dependents("A"));
        assertEquals(List.of("A", "B"), order.ids());
    }

    @Test
    public void testCycleReportsStuckNodes() {
        try {
            TopologicalOrder.builder()
                    .addNode(node("A")).addNode(node("B")).addNode(node("C")).addNode(node("D"))
                    .addEdge("A", "B")
                    .addEdge("B", "C")
                    .addEdge("C", "B")
                    .build();
            fail("cycle not detected");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("B"));
            assertTrue(e.getMessage(), e.getMessage().contains("C"));
            assertFalse(e.getMessage(), e.getMessage().contains("D"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfLoopRejected() {
        TopologicalOrder.builder().addNode(node("A")).addEdge("A", "A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeRejected() {
        TopologicalOrder.builder().addNode(node("A")).addNode(node("A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeEndpointRejected() {
        TopologicalOrder.builder().addNode(node("A")).addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLookupRejected() {
        TopologicalOrder.builder().addNode(node("A")).build().topoIndex("UNKNOWN");
    }
}
