package com.nodegraph.gcc.io;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.nodegraph.gcc.TestNodes;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.VirtualPin;

public class NodeRegistryTest {

    @Test
    public void testBuiltInControlNodesAlwaysPresent() {
        NodeRegistry registry = new NodeRegistry();
        assertTrue(registry.contains(ControlNodes.BRANCH));
        assertTrue(registry.contains(ControlNodes.MULTI_BRANCH));
        assertTrue(registry.contains(ControlNodes.FINITE_LOOP));
        assertTrue(registry.contains(ControlNodes.LIST_ITERATION));

        NodeDefinition branch = registry.find(ControlNodes.BRANCH);
        assertEquals(List.of(FlowPorts.YES, FlowPorts.NO), branch.getOutputs());
        assertEquals("Boolean", branch.inputType(ControlNodes.CONDITION));
        assertEquals(List.of(ControlNodes.CONDITION), branch.dataInputs());
    }

    @Test
    public void testSlashlessSynonymAndAlias() {
        NodeRegistry registry = TestNodes.registry();
        NodeDefinition canonical = registry.find("Entity/Destroy");
        assertNotNull(canonical);
        assertSame(canonical, registry.find("EntityDestroy"));
        assertSame(canonical, registry.find("Destroy"));
        assertEquals(List.of("Entity/Destroy", "EntityDestroy", "Destroy"), NodeRegistry.synonymKeys(canonical));
    }

    @Test
    public void testUnknownTitleIsNull() {
        NodeRegistry registry = TestNodes.registry();
        assertNull(registry.find("NoSuchNode"));
        assertFalse(registry.contains("NoSuchNode"));
    }

    @Test
    public void testFindWithCategory() {
        NodeRegistry registry = TestNodes.registry();
        assertNotNull(registry.find("math", "Add"));
        assertNotNull(registry.find(null, "Add"));
        assertNull(registry.find("execution", "Add"));
    }

    @Test
    public void testDeclaredFlowPorts() {
        NodeDefinition check = TestNodes.registry().find("CheckRange");
        assertTrue(check.acceptsFlow());
        assertEquals(List.of("InRange", "OutOfRange"), check.flowOutputs());
        assertEquals(List.of("value"), check.dataInputs());
        assertTrue(check.dataOutputs().isEmpty());
    }

    @Test
    public void testDynamicPortFamilyLoaded() {
        NodeRegistry registry = TestNodes.registry();
        assertEquals(DynamicPortFamily.VARIADIC, registry.find("Concat").getDynamicPorts());
        assertEquals(1, registry.find("Concat").getMinArgs());
        assertEquals(DynamicPortFamily.KEY_VALUE, registry.find("MakeDict").getDynamicPorts());
        assertEquals(DynamicPortFamily.NONE, registry.find("Add").getDynamicPorts());
    }

    @Test
    public void testCompositeDefinition() {
        CompositeNodeConfig composite = new CompositeNodeConfig("composite_gate", "Gate");
        composite.addPin(new VirtualPin(0, FlowPorts.FLOW_IN, "Flow", true, true));
        composite.addPin(new VirtualPin(1, "count", "Integer", true, false));
        VirtualPin out = new VirtualPin(0, "Passed", "Flow", false, true);
        out.map(new MappedPort("node_1", FlowPorts.FLOW_OUT));
        composite.addPin(out);
        composite.addPin(new VirtualPin(1, "total", "Integer", false, false));

        NodeRegistry registry = TestNodes.registry();
        NodeDefinition def = registry.registerComposite(composite);

        assertSame(def, registry.find("Gate"));
        assertEquals("composite_gate", def.getCompositeId());
        assertEquals("composite", def.getCategory());
        assertEquals(List.of(FlowPorts.FLOW_IN, "count"), def.getInputs());
        assertEquals(List.of("Passed", "total"), def.getOutputs());
        assertEquals(List.of("Passed"), def.flowOutputs());
        assertEquals(List.of("total"), def.dataOutputs());
        assertEquals("Integer", def.inputType("count"));
        assertTrue(def.acceptsFlow());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegisterWithoutNameRejected() {
        new NodeRegistry().register(new NodeDefinition());
    }
}
