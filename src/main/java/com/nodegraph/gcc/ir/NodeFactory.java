package com.nodegraph.gcc.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.io.DynamicPortFamily;
import com.nodegraph.gcc.io.NodeDefinition;
import com.nodegraph.gcc.io.NodeRegistry;
import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.*;

/**
 * Creates nodes from registry entries and maps call arguments onto ports.
 *
 * <p>
 * Node ids come from one counter per source file, so parsing the same text
 * twice yields the same ids in the same order.
 */
public final class NodeFactory {

    /** One call argument assigned to an input port. */
    public record ArgBinding(String port, Expr value) {
    }

    public static final String RANGE = "range";

    private final NodeRegistry registry;
    private final Map<String, String> compositeAliases;
    private final Set<String> contextHandles;
    private final String file;
    private int seq;

    public NodeFactory(NodeRegistry registry, Map<String, String> compositeAliases,
            Collection<String> contextHandles, String file) {
        this.registry = registry;
        this.compositeAliases = compositeAliases;
        this.contextHandles = new HashSet<>(contextHandles);
        this.file = file;
    }

    public NodeRegistry registry() {
        return registry;
    }

    public String file() {
        return file;
    }

    private String nextId(String prefix) {
        return prefix + "_" + (++seq);
    }

    /** Instantiates a registry entry with its declared ports. */
    public Node create(NodeDefinition def, int line) {
        Node n = new Node(nextId("node"), def.getName(), def.getCategory());
        for (String in : def.getInputs())
            n.addInput(in);
        for (String out : def.getOutputs())
            n.addOutput(out);
        for (String flow : def.getFlowPorts())
            n.addFlowAlias(flow);
        n.setSourceLine(line);
        return n;
    }

    public Node createControl(String title, int line) {
        return create(require(title, line), line);
    }

    /** Event-origin node: a {@code FlowOut} plus one output per parameter. */
    public Node createEvent(String event, List<String> params, int line) {
        Node n = new Node(nextId("event"), event, ControlNodes.EVENT_CATEGORY);
        n.addOutput(FlowPorts.FLOW_OUT);
        for (String p : params)
            n.addOutput(p);
        n.setSourceLine(line);
        return n;
    }

    public NodeDefinition require(String title, int line) {
        NodeDefinition def = registry.find(title);
        if (def == null)
            throw new GraphParseException("Unknown node '" + title + "'", file, line);
        return def;
    }

    /**
     * Title of the node a call creates, or null for pin markers. Calls through
     * a composite instance field resolve to the composite's title.
     */
    public String calleeTitle(Call call) {
        if (call.func() instanceof Name n)
            return PinMarkers.NAMES.contains(n.id()) ? null : n.id();
        String dotted = Ast.dottedName(call.func());
        if (dotted != null) {
            String[] parts = dotted.split("\\.");
            if (parts.length == 3 && parts[0].equals("self") && compositeAliases.containsKey(parts[1]))
                return compositeAliases.get(parts[1]);
        }
        throw new GraphParseException("Unsupported call target '" + (dotted == null ? "<expression>" : dotted) + "'",
                file, call.line());
    }

    /** True for a leading {@code game} / {@code self.game} runtime-context argument. */
    public boolean isContextArg(Expr e) {
        if (e instanceof Name n)
            return contextHandles.contains(n.id());
        return e instanceof Attribute a && a.value() instanceof Name s && s.id().equals("self")
                && contextHandles.contains(a.attr());
    }

    /**
     * Maps positional and keyword arguments of {@code call} to input ports of
     * {@code def}. When {@code node} is given, dynamic ports created by
     * variadic or key/value arguments are added to it.
     */
    public List<ArgBinding> bindArguments(NodeDefinition def, Node node, Call call) {
        List<Expr> args = new ArrayList<>(call.args());
        if (!args.isEmpty() && isContextArg(args.get(0)))
            args.remove(0);
        List<String> named = def.dataInputs();
        List<ArgBinding> out = new ArrayList<>();
        Set<String> used = new HashSet<>();
        DynamicPortFamily family = def.getDynamicPorts() == null ? DynamicPortFamily.NONE : def.getDynamicPorts();
        switch (family) {
            case VARIADIC -> {
                if (args.size() < def.getMinArgs())
                    throw new GraphParseException("'" + def.getName() + "' needs at least " + def.getMinArgs()
                            + " arguments, got " + args.size(), file, call.line());
                for (int i = 0; i < args.size(); i++)
                    out.add(bind(node, String.valueOf(i), args.get(i), used, call));
            }
            case KEY_VALUE -> {
                if (args.size() % 2 != 0)
                    throw new GraphParseException("'" + def.getName() + "' takes key/value argument pairs", file,
                            call.line());
                if (args.size() / 2 < def.getMinArgs())
                    throw new GraphParseException("'" + def.getName() + "' needs at least " + def.getMinArgs()
                            + " key/value pairs", file, call.line());
                for (int i = 0; i < args.size(); i += 2) {
                    out.add(bind(node, "key_" + (i / 2), args.get(i), used, call));
                    out.add(bind(node, "value_" + (i / 2), args.get(i + 1), used, call));
                }
            }
            default -> {
                if (args.size() > named.size())
                    throw new GraphParseException("'" + def.getName() + "' takes " + named.size()
                            + " positional arguments, got " + args.size(), file, call.line());
                for (int i = 0; i < args.size(); i++)
                    out.add(bind(null, named.get(i), args.get(i), used, call));
            }
        }
        for (Keyword k : call.keywords()) {
            boolean known = named.contains(k.name()) || (node != null && node.hasInput(k.name())
                    && !FlowPorts.isFlowInput(node, k.name()));
            if (!known)
                throw new GraphParseException("Unknown port '" + k.name() + "' on node '" + def.getName() + "'", file,
                        call.line());
            out.add(bind(null, k.name(), k.value(), used, call));
        }
        if (family == DynamicPortFamily.NONE && out.size() < def.getMinArgs())
            throw new GraphParseException("'" + def.getName() + "' needs at least " + def.getMinArgs()
                    + " arguments", file, call.line());
        return out;
    }

    private ArgBinding bind(Node node, String port, Expr value, Set<String> used, Call call) {
        if (!used.add(port))
            throw new GraphParseException("Port '" + port + "' given more than once", file, call.line());
        if (node != null && !node.hasInput(port))
            node.addInput(port);
        return new ArgBinding(port, value);
    }
}
