package com.nodegraph.gcc.ir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.io.NodeDefinition;
import com.nodegraph.gcc.io.NodeRegistry;
import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.*;
import com.nodegraph.gcc.syntax.Ast.Module;
import com.nodegraph.gcc.syntax.GraphSyntaxException;
import com.nodegraph.gcc.syntax.Parser;

import lombok.extern.log4j.Log4j2;

/**
 * Forward pipeline: Graph Code text to a {@link GraphModel}.
 *
 * <p>
 * Each role-marked method is built into its own sub-graph by
 * {@link FlowBuilder}, its parameter usage is recorded by
 * {@link UsageTracker}, and the sub-graphs are merged into one model. For
 * composite definitions {@link PinInterfaceBuilder} then attaches the public
 * pins.
 *
 * <p>
 * Any failure throws {@link GraphParseException}; no partial graph is
 * returned. Instances are stateless and may be shared between threads as
 * long as the registry is not modified during a parse.
 */
@Log4j2
public final class GraphCodeParser {
    public static final String PORT_TYPE_OVERRIDES = "port_type_overrides";
    public static final String CONTEXT_LOOKUPS = "context_lookups";
    private static final String SELF = "self";
    private static final String INIT = "__init__";

    private final NodeRegistry registry;
    private final CompilerConfig config;

    public GraphCodeParser(NodeRegistry registry, CompilerConfig config) {
        this.registry = registry;
        this.config = config;
    }

    public ParsedGraphCode parseFile(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    public ParsedGraphCode parse(String source, String file) {
        Module module;
        try {
            module = Parser.parse(source);
        } catch (GraphSyntaxException e) {
            throw new GraphParseException(e.getMessage(), file, e.getLine());
        }
        ClassDef cls = graphClass(module, file);
        SourceMetadata metadata = SourceMetadata.parse(
                module.docstring() != null ? module.docstring() : cls.docstring(), file);
        boolean composite = metadata.isComposite();

        List<FunctionDef> methods = new ArrayList<>();
        for (Stmt s : cls.body())
            if (s instanceof FunctionDef fd)
                methods.add(fd);

        Map<FunctionDef, MethodRole> roles = new LinkedHashMap<>();
        for (FunctionDef fd : methods) {
            MethodRole role = MethodRole.of(fd, file);
            if (role == null)
                continue;
            if (!composite && role.kind() != MethodRole.Kind.EVENT_HANDLER)
                throw new GraphParseException("Method '" + fd.name() + "': only event handlers are allowed in a graph;"
                        + " add composite_id to the documentation block for a composite", file, fd.line());
            roles.put(fd, role);
        }

        Map<String, String> stateFields = stateFields(roles.keySet());
        Map<String, String> compositeAliases = compositeAliases(methods);
        NodeFactory factory = new NodeFactory(registry, compositeAliases, config.getContextHandles(), file);

        GraphModel merged = new GraphModel();
        List<MethodBuild> builds = new ArrayList<>();
        Map<String, String> typeOverrides = new LinkedHashMap<>();
        Map<String, List<String>> contextLookups = new LinkedHashMap<>();
        for (Map.Entry<FunctionDef, MethodRole> e : roles.entrySet()) {
            MethodBuild partial = buildMethod(e.getKey(), e.getValue(), factory, stateFields, composite, file);
            Map<String, String> remap = merged.merge(partial.graph());
            MethodBuild build = new MethodBuild(partial.def(), partial.role(), partial.graph(), partial.env(),
                    partial.usage(), partial.returnValues(), partial.markers(), partial.pins(), remap);
            builds.add(build);
            @SuppressWarnings("unchecked")
            Map<String, String> overrides = (Map<String, String>) partial.graph().metadata().get(PORT_TYPE_OVERRIDES);
            if (overrides != null)
                overrides.forEach((k, v) -> typeOverrides.put(remapKey(k, remap), v));
            @SuppressWarnings("unchecked")
            Map<String, List<String>> lookups = (Map<String, List<String>>) partial.graph().metadata()
                    .get(CONTEXT_LOOKUPS);
            if (lookups != null)
                lookups.forEach((k, v) -> contextLookups.put(remap.getOrDefault(k, k), v));
            log.debug("{}: method {} built as {} with {} nodes", file, build.name(), build.role().kind(),
                    build.graph().nodeCount());
        }
        if (!typeOverrides.isEmpty())
            merged.metadata().put(PORT_TYPE_OVERRIDES, typeOverrides);
        if (!contextLookups.isEmpty())
            merged.metadata().put(CONTEXT_LOOKUPS, contextLookups);
        merged.graphVariables().addAll(metadata.graphVariables());

        CompositeNodeConfig definition = null;
        if (composite) {
            definition = new CompositeNodeConfig(metadata.get(SourceMetadata.COMPOSITE_ID),
                    metadata.get(SourceMetadata.NODE_NAME, cls.name()));
            definition.setDescription(metadata.get(SourceMetadata.NODE_DESCRIPTION,
                    metadata.get(SourceMetadata.DESCRIPTION, "")));
            definition.setScope(metadata.get(SourceMetadata.SCOPE, definition.getScope()));
            definition.setCategory(metadata.get(SourceMetadata.CATEGORY, ""));
            copyExtraMetadata(metadata, definition.getMetadata());
            new PinInterfaceBuilder(registry, file).build(definition, builds, merged);
            merged.setGraphId(definition.getCompositeId());
            merged.setGraphName(definition.getNodeName());
            merged.setGraphType("composite");
            merged.setDescription(definition.getDescription());
            definition.setSubGraph(merged);
        } else {
            merged.setGraphId(metadata.get(SourceMetadata.GRAPH_ID, cls.name()));
            merged.setGraphName(metadata.get(SourceMetadata.GRAPH_NAME, cls.name()));
            merged.setGraphType(metadata.get(SourceMetadata.GRAPH_TYPE, "server"));
            merged.setDescription(metadata.get(SourceMetadata.DESCRIPTION, ""));
            Map<String, String> extra = new LinkedHashMap<>();
            copyExtraMetadata(metadata, extra);
            merged.metadata().putAll(extra);
        }
        log.info("Parsed {} ({}): {} nodes, {} edges, {} methods", file, composite ? "composite" : "graph",
                merged.nodeCount(), merged.edgeCount(), builds.size());
        return new ParsedGraphCode(merged, definition, metadata);
    }

    private static ClassDef graphClass(Module module, String file) {
        ClassDef found = null;
        for (Stmt s : module.body()) {
            if (s instanceof FunctionDef fd)
                throw new GraphParseException("Top-level function '" + fd.name()
                        + "' uses the legacy free-function format; define the graph as a class", file, fd.line());
            if (s instanceof ClassDef cd) {
                if (found != null)
                    throw new GraphParseException("Only one class per file is supported, found '" + found.name()
                            + "' and '" + cd.name() + "'", file, cd.line());
                found = cd;
            } else if (!(s instanceof Import || s instanceof Pass || s instanceof ExprStmt es
                    && es.value() instanceof Constant)) {
                throw new GraphParseException("Unsupported top-level statement", file, s.line());
            }
        }
        if (found == null)
            throw new GraphParseException("No graph class found", file, 1);
        return found;
    }

    private MethodBuild buildMethod(FunctionDef fd, MethodRole role, NodeFactory factory,
            Map<String, String> stateFields, boolean composite, String file) {
        List<PinSpec> signature = new ArrayList<>();
        String kwargsName = null;
        for (Param p : fd.params()) {
            if (p.name().equals(SELF))
                continue;
            switch (p.kind()) {
                case VAR_KEYWORD -> {
                    if (role.kind() != MethodRole.Kind.EVENT_HANDLER)
                        throw new GraphParseException("'**" + p.name() + "' is only allowed on event handlers", file,
                                fd.line());
                    kwargsName = p.name();
                }
                case VAR_POSITIONAL -> throw new GraphParseException("'*" + p.name() + "' is not supported", file,
                        fd.line());
                default -> signature.add(new PinSpec(p.name(), annotationType(p.annotation())));
            }
        }
        PinMarkers markers = PinMarkers.collect(fd.body(), file);
        if (!composite && !markers.isEmpty())
            throw new GraphParseException("Pin declarations are only allowed in composites", file, fd.line());

        GraphModel graph = new GraphModel();
        VarEnv env = new VarEnv();
        Set<String> pinParams = new LinkedHashSet<>();
        FlowBuilder.Cursor start;
        String eventNodeId = null;
        if (role instanceof MethodRole.EventHandler handler) {
            List<String> names = signature.stream().map(PinSpec::name).toList();
            Node event = factory.createEvent(handler.event(), names, fd.line());
            graph.addNode(event);
            eventNodeId = event.getId();
            for (String n : names)
                env.bind(n, new MappedPort(event.getId(), n));
            start = FlowBuilder.Cursor.at(event.getId(), FlowPorts.FLOW_OUT);
        } else {
            for (PinSpec p : signature)
                pinParams.add(p.name());
            for (PinSpec p : markers.dataInputs())
                pinParams.add(p.name());
            start = FlowBuilder.Cursor.entry();
        }

        FlowBuilder flow = new FlowBuilder(graph, env, factory, pinParams, stateFields, kwargsName, eventNodeId,
                composite);
        flow.block(fd.body(), start);
        if (!flow.typeOverrides().isEmpty())
            graph.metadata().put(PORT_TYPE_OVERRIDES, new LinkedHashMap<>(flow.typeOverrides()));
        if (!flow.contextPorts().isEmpty())
            graph.metadata().put(CONTEXT_LOOKUPS, Map.of(eventNodeId, List.copyOf(flow.contextPorts())));

        UsageTracker.Result usage = new UsageTracker(factory, graph.nodes(), pinParams, stateFields, kwargsName)
                .track(fd.body());

        List<String> returnNames = new ArrayList<>();
        List<Expr> returns = flow.returnValues();
        for (int i = 0; i < returns.size(); i++)
            returnNames.add(returns.get(i) instanceof Name n ? n.id() : "output_" + i);
        MethodRole.PinSet pins = role.derivePins(new MethodRole.MethodShape(signature, markers, returnNames));
        return new MethodBuild(fd, role, graph, env, usage, returns, markers, pins, Map.of());
    }

    private static String annotationType(Expr annotation) {
        if (annotation == null)
            return PinSpec.GENERIC;
        if (annotation instanceof Constant c && c.kind() == ConstKind.STRING)
            return c.value();
        String dotted = Ast.dottedName(annotation);
        return dotted == null ? PinSpec.GENERIC : dotted;
    }

    /**
     * {@code self.field = param} assignments of graph methods. The first
     * binding of a field wins, whichever method it appears in.
     */
    static Map<String, String> stateFields(Iterable<FunctionDef> methods) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FunctionDef fd : methods) {
            Set<String> params = new LinkedHashSet<>();
            for (Param p : fd.params())
                if (!p.name().equals(SELF))
                    params.add(p.name());
            collectStateFields(fd.body(), params, fields);
        }
        return fields;
    }

    private static void collectStateFields(List<Stmt> body, Set<String> params, Map<String, String> fields) {
        for (Stmt s : body) {
            if (s instanceof Assign a && a.value() instanceof Name value && params.contains(value.id())) {
                for (Expr t : a.targets())
                    if (t instanceof Attribute at && at.value() instanceof Name self && self.id().equals(SELF))
                        fields.putIfAbsent(at.attr(), value.id());
            } else if (s instanceof If i) {
                collectStateFields(i.body(), params, fields);
                collectStateFields(i.orelse(), params, fields);
            } else if (s instanceof For f) {
                collectStateFields(f.body(), params, fields);
            } else if (s instanceof Match m) {
                for (MatchCase mc : m.cases())
                    collectStateFields(mc.body(), params, fields);
            } else if (s instanceof Try t) {
                collectStateFields(t.body(), params, fields);
                collectStateFields(t.orelse(), params, fields);
                collectStateFields(t.finalbody(), params, fields);
            }
        }
    }

    /** {@code self.alias = CompositeTitle(...)} in {@code __init__}. */
    private Map<String, String> compositeAliases(List<FunctionDef> methods) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (FunctionDef fd : methods) {
            if (!fd.name().equals(INIT))
                continue;
            for (Stmt s : fd.body()) {
                if (!(s instanceof Assign a) || !(a.value() instanceof Call call) || !(call.func() instanceof Name fn))
                    continue;
                NodeDefinition def = registry.find(fn.id());
                if (def == null)
                    continue;
                for (Expr t : a.targets())
                    if (t instanceof Attribute at && at.value() instanceof Name self && self.id().equals(SELF))
                        aliases.put(at.attr(), def.getName());
            }
        }
        return aliases;
    }

    private static String remapKey(String key, Map<String, String> remap) {
        int dot = key.indexOf('.');
        String node = key.substring(0, dot);
        return remap.getOrDefault(node, node) + key.substring(dot);
    }

    private static final Set<String> KNOWN_KEYS = Set.of(SourceMetadata.GRAPH_ID, SourceMetadata.GRAPH_NAME,
            SourceMetadata.GRAPH_TYPE, SourceMetadata.DESCRIPTION, SourceMetadata.COMPOSITE_ID,
            SourceMetadata.NODE_NAME, SourceMetadata.NODE_DESCRIPTION, SourceMetadata.SCOPE,
            SourceMetadata.CATEGORY);

    private static void copyExtraMetadata(SourceMetadata metadata, Map<String, ? super String> target) {
        metadata.values().forEach((k, v) -> {
            if (!KNOWN_KEYS.contains(k))
                target.put(k, v);
        });
    }
}
