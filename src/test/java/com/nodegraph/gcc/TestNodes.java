package com.nodegraph.gcc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.io.NodeLibraryFile;
import com.nodegraph.gcc.io.NodeRegistry;
import com.nodegraph.gcc.ir.GraphCodeParser;
import com.nodegraph.gcc.ir.ParsedGraphCode;

/** Shared fixtures: the test workspace registry and small parse helpers. */
public final class TestNodes {
    private TestNodes() {
        // Utility class
    }

    public static NodeRegistry registry() {
        NodeRegistry registry = new NodeRegistry();
        ObjectMapper mapper = new ObjectMapper();
        for (String lib : new String[] { "basic", "flow" }) {
            try (InputStream in = TestNodes.class.getResourceAsStream("/workspace/node_defs/" + lib + ".json")) {
                registry.registerAll(mapper.readValue(in, NodeLibraryFile.class).getNodes());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return registry;
    }

    public static GraphCodeParser parser() {
        return new GraphCodeParser(registry(), CompilerConfig.defaults());
    }

    public static ParsedGraphCode parse(String source) {
        return parser().parse(source, "test.py");
    }

    public static Path resource(String name) {
        try {
            return Paths.get(TestNodes.class.getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Wraps handler bodies into a graph class with one event handler. */
    public static String graph(String event, String params, String... body) {
        StringBuilder sb = new StringBuilder();
        sb.append("\"\"\"\ngraph_id: test_graph\ngraph_name: Test\n\"\"\"\n\n");
        sb.append("class TestGraph:\n");
        sb.append("    @event_handler(event=\"").append(event).append("\")\n");
        sb.append("    def on_").append(event).append("(self").append(params.isEmpty() ? "" : ", " + params)
                .append("):\n");
        for (String line : body)
            sb.append("        ").append(line).append('\n');
        return sb.toString();
    }

    /** Wraps a method into a composite class. */
    public static String composite(String... lines) {
        StringBuilder sb = new StringBuilder();
        sb.append("\"\"\"\ncomposite_id: test_composite\nnode_name: Test Composite\n\"\"\"\n\n");
        sb.append("class TestComposite:\n");
        for (String line : lines)
            sb.append("    ").append(line).append('\n');
        return sb.toString();
    }

    public static Node nodeTitled(GraphModel graph, String title) {
        for (Node n : graph.nodes())
            if (n.getTitle().equals(title))
                return n;
        throw new AssertionError("No node titled " + title + " in " + graph.nodes());
    }
}
