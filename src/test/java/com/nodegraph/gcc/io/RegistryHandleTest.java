package com.nodegraph.gcc.io;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.VirtualPin;

public class RegistryHandleTest {

    private static final String ONE_NODE = "{\"nodes\":[{\"name\":\"Alpha\",\"category\":\"query\","
            + "\"inputs\":[],\"outputs\":[\"value\"]}]}";
    private static final String TWO_NODES = "{\"nodes\":[{\"name\":\"Alpha\",\"category\":\"query\","
            + "\"inputs\":[],\"outputs\":[\"value\"]},{\"name\":\"Beta\",\"category\":\"query\","
            + "\"inputs\":[],\"outputs\":[\"value\"]}]}";

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path root;
    private Path defs;

    @Before
    public void setUp() throws IOException {
        root = tmp.newFolder("workspace").toPath();
        defs = Files.createDirectories(root.resolve("node_defs"));
        Files.writeString(defs.resolve("lib.json"), ONE_NODE, StandardCharsets.UTF_8);
    }

    @Test
    public void testLoadsDefinitionsLazily() {
        RegistryHandle handle = RegistryHandle.open(root, CompilerConfig.defaults());
        NodeRegistry registry = handle.registry();
        assertTrue(registry.contains("Alpha"));
        assertTrue(registry.contains("Branch"));
        assertSame(registry, handle.registry());
    }

    @Test
    public void testReloadsWhenFileChanges() throws IOException {
        RegistryHandle handle = RegistryHandle.open(root, CompilerConfig.defaults());
        NodeRegistry first = handle.registry();
        assertFalse(first.contains("Beta"));

        Path lib = defs.resolve("lib.json");
        Files.writeString(lib, TWO_NODES, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(lib, FileTime.fromMillis(System.currentTimeMillis() + 5_000));

        NodeRegistry second = handle.registry();
        assertNotSame(first, second);
        assertTrue(second.contains("Beta"));
    }

    @Test
    public void testInvalidateForcesReload() {
        RegistryHandle handle = RegistryHandle.open(root, CompilerConfig.defaults());
        NodeRegistry first = handle.registry();
        handle.invalidate();
        assertNotSame(first, handle.registry());
    }

    @Test
    public void testCompositeSurvivesReload() {
        RegistryHandle handle = RegistryHandle.open(root, CompilerConfig.defaults());
        handle.registry();
        CompositeNodeConfig composite = new CompositeNodeConfig("composite_relay", "Relay");
        composite.addPin(new VirtualPin(0, FlowPorts.FLOW_IN, "Flow", true, true));
        handle.registerComposite(composite);
        assertTrue(handle.registry().contains("Relay"));

        handle.invalidate();
        NodeRegistry reloaded = handle.registry();
        assertTrue(reloaded.contains("Relay"));
        assertEquals("composite_relay", reloaded.find("Relay").getCompositeId());
    }

    @Test
    public void testMissingDefinitionsDirectoryGivesBuiltInsOnly() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setNodeDefsDir("absent");
        NodeRegistry registry = RegistryHandle.open(root, config).registry();
        assertFalse(registry.contains("Alpha"));
        assertTrue(registry.contains("FiniteLoop"));
    }

    @Test
    public void testInMemoryHandleNeverReloads() {
        NodeRegistry registry = new NodeRegistry();
        RegistryHandle handle = RegistryHandle.of(registry);
        handle.invalidate();
        assertSame(registry, handle.registry());
        assertNull(handle.workspaceRoot());
    }

    @Test
    public void testUnreadableDefinitionsFail() throws IOException {
        Files.writeString(defs.resolve("broken.json"), "{ not json", StandardCharsets.UTF_8);
        try {
            RegistryHandle.open(root, CompilerConfig.defaults()).registry();
            fail("Expected a read failure");
        } catch (java.io.UncheckedIOException e) {
            assertTrue(e.getMessage().contains("broken.json"));
        }
    }
}
