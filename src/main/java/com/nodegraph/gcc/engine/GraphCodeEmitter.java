package com.nodegraph.gcc.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.api.CodeGenerator;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.ir.GraphCodeParser;
import com.nodegraph.gcc.ir.MethodRole;
import com.nodegraph.gcc.ir.SourceMetadata;
import com.nodegraph.gcc.syntax.SourcePrinter;
import com.nodegraph.gcc.util.Identifiers;

import lombok.extern.log4j.Log4j2;

/**
 * Writes a graph as a Graph Code class: one event-handler method per event
 * node plus the {@code __init__}/{@code register_handlers} boilerplate.
 *
 * <p>
 * Output is a pure function of the model: node creation order decides
 * statement order and variable names, so the same graph always produces the
 * same text.
 */
@Log4j2
public final class GraphCodeEmitter implements CodeGenerator<GraphModel> {
    static final String KWARGS = "kwargs";

    private final Set<String> reserved;

    public GraphCodeEmitter() {
        this(CompilerConfig.defaults().getContextHandles());
    }

    /**
     * @param contextHandles names the parser drops as a leading context
     *                       argument; they are never allocated as variables
     */
    public GraphCodeEmitter(Collection<String> contextHandles) {
        this.reserved = reservedNames(contextHandles);
    }

    /** Names no generated variable may take. */
    static Set<String> reservedNames(Collection<String> contextHandles) {
        Set<String> names = new HashSet<>(contextHandles);
        names.add("self");
        names.add(KWARGS);
        return Set.copyOf(names);
    }

    @Override
    public String generate(GraphModel graph) {
        EmissionScheduler scheduler = new EmissionScheduler(graph);
        Map<String, Set<String>> groups = scheduler.groupByEvent();
        List<String> unreached = scheduler.unreached(groups.values());
        if (!unreached.isEmpty())
            log.debug("{}: {} nodes not reachable from any event are not written: {}", graph.getGraphId(),
                    unreached.size(), unreached);

        CodeWriter w = new CodeWriter();
        Map<String, String> values = new LinkedHashMap<>();
        values.put(SourceMetadata.GRAPH_ID, graph.getGraphId());
        values.put(SourceMetadata.GRAPH_NAME, graph.getGraphName());
        values.put(SourceMetadata.GRAPH_TYPE, graph.getGraphType());
        if (graph.getDescription() != null && !graph.getDescription().isEmpty())
            values.put(SourceMetadata.DESCRIPTION, graph.getDescription());
        extraMetadata(graph.metadata(), values);
        docstring(w, SourceMetadata.render(values, graph.graphVariables()));
        w.blank().blank();

        w.line("class " + className(graph.getGraphName(), "Graph") + ":").indent();
        init(w);
        Set<String> methodNames = new HashSet<>();
        List<String[]> registrations = new ArrayList<>();
        for (Node event : scheduler.eventNodes()) {
            String method = uniqueName("on_" + Identifiers.sanitize(event.getTitle()), methodNames);
            w.blank();
            eventHandler(w, graph, scheduler, event, method, null, Map.of(), Set.of(), reserved);
            registrations.add(new String[] { event.getTitle(), method });
        }
        w.blank();
        w.line("def register_handlers(self):").indent();
        if (registrations.isEmpty())
            w.line("pass");
        for (String[] r : registrations)
            w.line("self.game.register_event_handler(" + SourcePrinter.quote(r[0]) + ", self." + r[1]
                    + ", owner=self.owner_entity)");
        w.dedent().dedent();
        return w.toString();
    }

    /**
     * Writes {@code @event_handler(...)} and the handler body.
     *
     * @param outputsClause rendered {@code outputs=[...]} argument, or null
     * @param reserved      names the variables of the body must not take
     * @return the emitter that wrote the body, for inspecting what it covered
     */
    static FlowEmitter eventHandler(CodeWriter w, GraphModel graph, EmissionScheduler scheduler, Node event,
            String method, String outputsClause, Map<MappedPort, String> pinRefs, Set<MappedPort> required,
            Set<String> reserved) {
        List<String> lookups = contextLookups(graph, event.getId());
        List<String> params = new ArrayList<>();
        for (String port : FlowPorts.dataOutputs(event)) {
            if (lookups.contains(port))
                continue;
            if (!Identifiers.isSafeName(port) || port.equals("self"))
                throw new GenerationException("Event parameter '" + port + "' is not a legal parameter name",
                        event.getId());
            params.add(port);
        }
        Set<String> taken = new HashSet<>(reserved);
        taken.addAll(params);
        VarNameAllocator names = new VarNameAllocator(taken);
        for (String p : params)
            names.bind(new MappedPort(event.getId(), p), p);

        w.line("@" + MethodRole.EVENT_HANDLER + "(event=" + SourcePrinter.quote(event.getTitle())
                + (outputsClause == null ? "" : ", " + outputsClause) + ")");
        StringBuilder sig = new StringBuilder("def ").append(method).append("(self");
        for (String p : params)
            sig.append(", ").append(p);
        if (!lookups.isEmpty())
            sig.append(", **").append(KWARGS);
        w.line(sig.append("):").toString());

        CodeWriter body = new CodeWriter();
        for (String port : lookups) {
            String var = names.allocate(new MappedPort(event.getId(), port), port);
            body.line(var + " = " + KWARGS + ".get(" + SourcePrinter.quote(port) + ")");
        }
        FlowEmitter flow = new FlowEmitter(graph, scheduler, names, pinRefs, required, typeOverrides(graph));
        flow.markEmitted(event.getId());
        if (event.hasOutput(FlowPorts.FLOW_OUT))
            flow.emitFrom(new MappedPort(event.getId(), FlowPorts.FLOW_OUT), body);
        if (body.isEmpty())
            body.line("pass");
        w.block(body);
        return flow;
    }

    static void init(CodeWriter w) {
        w.line("def __init__(self, game, owner_entity):").indent()
                .line("self.game = game")
                .line("self.owner_entity = owner_entity")
                .dedent();
    }

    /** Triple-quoted documentation block; backslashes and quote runs are escaped. */
    static void docstring(CodeWriter w, String content) {
        w.line("\"\"\"");
        for (String l : content.split("\n")) {
            if (!l.isEmpty())
                w.line(l.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\""));
        }
        w.line("\"\"\"");
    }

    /** String-valued metadata other than the compiler's own bookkeeping keys. */
    static void extraMetadata(Map<String, ?> metadata, Map<String, String> into) {
        metadata.forEach((k, v) -> {
            if (v instanceof String s && !k.equals(GraphCodeParser.PORT_TYPE_OVERRIDES)
                    && !k.equals(GraphCodeParser.CONTEXT_LOOKUPS) && !into.containsKey(k)
                    && k.matches("[A-Za-z_][\\w]*"))
                into.put(k, s);
        });
    }

    /** CamelCase class name from a display name. */
    static String className(String displayName, String fallback) {
        if (displayName == null)
            return fallback;
        StringBuilder sb = new StringBuilder();
        for (String part : displayName.split("[^\\p{L}\\p{N}_]+")) {
            if (part.isEmpty())
                continue;
            sb.appendCodePoint(Character.toUpperCase(part.codePointAt(0)));
            sb.append(part.substring(Character.charCount(part.codePointAt(0))));
        }
        String name = sb.toString();
        if (name.isEmpty())
            return fallback;
        return Identifiers.isSafeName(name) ? name : fallback + name;
    }

    static String uniqueName(String base, Set<String> used) {
        String name = base;
        for (int i = 2; !used.add(name); i++)
            name = base + "_" + i;
        return name;
    }

    @SuppressWarnings("unchecked")
    static Map<String, String> typeOverrides(GraphModel graph) {
        Object o = graph.metadata().get(GraphCodeParser.PORT_TYPE_OVERRIDES);
        return o instanceof Map<?, ?> m ? (Map<String, String>) m : Map.of();
    }

    @SuppressWarnings("unchecked")
    private static List<String> contextLookups(GraphModel graph, String eventId) {
        Object o = graph.metadata().get(GraphCodeParser.CONTEXT_LOOKUPS);
        if (!(o instanceof Map<?, ?> m))
            return List.of();
        Object ports = ((Map<String, Object>) m).get(eventId);
        return ports instanceof List<?> l ? (List<String>) l : List.of();
    }
}
