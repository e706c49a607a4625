package com.nodegraph.gcc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.nodegraph.gcc.api.GraphRule;
import com.nodegraph.gcc.api.LayoutEngine;
import com.nodegraph.gcc.api.LayoutResult;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.engine.CompositeCodeEmitter;
import com.nodegraph.gcc.engine.GraphCodeEmitter;
import com.nodegraph.gcc.io.GraphDataCache;
import com.nodegraph.gcc.io.GraphJson;
import com.nodegraph.gcc.io.NodeDefinition;
import com.nodegraph.gcc.io.RegistryHandle;
import com.nodegraph.gcc.ir.GraphCodeParser;
import com.nodegraph.gcc.ir.ParsedGraphCode;
import com.nodegraph.gcc.validate.GraphCodeSaver;
import com.nodegraph.gcc.validate.RoundTripResult;
import com.nodegraph.gcc.validate.RoundTripValidator;

/**
 * Entry point tying the registry, parser, emitters, round-trip validator and
 * saver together for one workspace.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading compiler settings and the node registry of a workspace</li>
 * <li>Parsing Graph Code files and text into graph models</li>
 * <li>Generating Graph Code from graphs and composites</li>
 * <li>Gating saves on the round-trip and the supplied {@link GraphRule}s</li>
 * </ul>
 * A fresh parser is built per call against the registry current at that
 * moment, so definition files edited between calls are picked up.
 */
public class GraphCodeCompiler {
    private static final Logger log = LogManager.getLogger(GraphCodeCompiler.class);

    private final RegistryHandle registry;
    private final CompilerConfig config;
    private final List<GraphRule> rules = new ArrayList<>();
    private final GraphDataCache cache;
    private LayoutEngine layoutEngine;

    public GraphCodeCompiler(RegistryHandle registry, CompilerConfig config) {
        this(registry, config, GraphDataCache.shared());
    }

    public GraphCodeCompiler(RegistryHandle registry, CompilerConfig config, GraphDataCache cache) {
        this.registry = registry;
        this.config = config;
        this.cache = cache;
    }

    /**
     * Opens a workspace: reads {@code graph-code-compiler.json} from the root
     * when present and binds the registry under its node-definition directory.
     */
    public static GraphCodeCompiler open(Path workspaceRoot) {
        CompilerConfig config = CompilerConfig.load(workspaceRoot);
        log.info("Opening workspace {} (node definitions in {})", workspaceRoot, config.getNodeDefsDir());
        return new GraphCodeCompiler(RegistryHandle.open(workspaceRoot, config), config);
    }

    public GraphCodeCompiler withLayout(LayoutEngine engine) {
        this.layoutEngine = engine;
        return this;
    }

    public GraphCodeCompiler addRule(GraphRule rule) {
        rules.add(rule);
        return this;
    }

    public RegistryHandle registryHandle() {
        return registry;
    }

    public CompilerConfig config() {
        return config;
    }

    // --- Forward ---

    public ParsedGraphCode parseFile(Path file) throws IOException {
        return layout(parser().parseFile(file));
    }

    public ParsedGraphCode parseText(String source, String fileName) {
        return layout(parser().parse(source, fileName));
    }

    /**
     * Parses a file through the process-wide cache, keyed by
     * {@code (graphRootId, file name)}. A hit returns a fresh copy of the
     * cached graph data; composite interfaces are not cached.
     */
    public GraphModel parseCached(String graphRootId, Path file) throws IOException {
        String graphId = file.getFileName().toString();
        Map<String, Object> data = cache.get(graphRootId, graphId);
        if (data != null) {
            log.debug("Cache hit for {}/{}", graphRootId, graphId);
            return GraphJson.fromData(data);
        }
        GraphModel graph = parseFile(file).graph();
        cache.put(graphRootId, graphId, GraphJson.toData(graph));
        return graph;
    }

    public void evictCached(String graphRootId, Path file) {
        cache.evict(graphRootId, file.getFileName().toString());
    }

    // --- Reverse ---

    public String generate(GraphModel graph) {
        return new GraphCodeEmitter(config.getContextHandles()).generate(graph);
    }

    public String generate(CompositeNodeConfig composite) {
        return new CompositeCodeEmitter(config.getContextHandles()).generate(composite);
    }

    // --- Round-trip and save ---

    public RoundTripResult validate(GraphModel graph) {
        return validator().validate(graph);
    }

    public RoundTripResult validate(CompositeNodeConfig composite) {
        return validator().validate(composite);
    }

    public GraphCodeSaver.SaveResult save(GraphModel graph, Path target) throws IOException {
        return new GraphCodeSaver(validator(), rules).save(graph, target);
    }

    public GraphCodeSaver.SaveResult save(CompositeNodeConfig composite, Path target) throws IOException {
        return new GraphCodeSaver(validator(), rules).save(composite, target);
    }

    /** Makes a parsed composite callable by title from later parses. */
    public NodeDefinition registerComposite(CompositeNodeConfig composite) {
        NodeDefinition def = registry.registerComposite(composite);
        log.info("Registered composite {} as node '{}'", composite.getCompositeId(), def.getName());
        return def;
    }

    private GraphCodeParser parser() {
        return new GraphCodeParser(registry.registry(), config);
    }

    private RoundTripValidator validator() {
        return new RoundTripValidator(parser(), config);
    }

    private ParsedGraphCode layout(ParsedGraphCode parsed) {
        if (layoutEngine != null) {
            LayoutResult result = layoutEngine.layout(parsed.graph());
            parsed.graph().applyLayout(result.positions(), result.blocks());
        }
        return parsed;
    }
}
