package com.nodegraph.gcc.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.io.NodeDefinition;
import com.nodegraph.gcc.io.NodeRegistry;
import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.*;
import com.nodegraph.gcc.syntax.SourcePrinter;

/**
 * Records where the parameters of a method end up.
 *
 * <p>
 * Walks the same statements {@link FlowBuilder} turned into nodes, in the
 * same order, and attributes each call back to the node it created through a
 * FIFO queue per node title: the n-th {@code Print(...)} in the text is the
 * n-th {@code Print} node created. Nodes are enqueued under every key they
 * can be called by and claiming one removes it from all of them.
 */
final class UsageTracker {

    /** Immutable outcome of one walk. */
    record Result(Map<String, String> aliasOf, Map<String, String> constantOf,
            Map<String, List<MappedPort>> paramUsage, Set<String> controlFlowUsage,
            Map<String, List<MappedPort>> conditionUsage) {

        public List<MappedPort> usageOf(String param) {
            return paramUsage.getOrDefault(param, List.of());
        }

        /** Direct usage followed by condition inputs reading the parameter. */
        public List<MappedPort> allUsageOf(String param) {
            List<MappedPort> all = new ArrayList<>(usageOf(param));
            for (MappedPort p : conditionUsage.getOrDefault(param, List.of()))
                if (!all.contains(p))
                    all.add(p);
            return all;
        }
    }

    private final NodeFactory factory;
    private final Set<String> params;
    private final Map<String, String> stateFields;
    private final String kwargsName;
    private final Map<String, Deque<Node>> queues = new HashMap<>();

    private final Map<String, String> aliasOf = new LinkedHashMap<>();
    private final Map<String, String> constantOf = new LinkedHashMap<>();
    private final Set<String> assigned = new HashSet<>();
    private final Set<String> shadowed = new HashSet<>();
    private final Map<String, List<MappedPort>> paramUsage = new LinkedHashMap<>();
    private final Set<String> controlFlowUsage = new LinkedHashSet<>();
    private final Map<String, List<MappedPort>> conditionUsage = new LinkedHashMap<>();

    /**
     * @param created     nodes of the method graph in creation order
     * @param params      tracked parameter names
     * @param stateFields instance field to parameter, from {@code self.x = param}
     */
    UsageTracker(NodeFactory factory, Collection<Node> created, Set<String> params, Map<String, String> stateFields,
            String kwargsName) {
        this.factory = factory;
        this.params = params;
        this.stateFields = stateFields;
        this.kwargsName = kwargsName;
        NodeRegistry registry = factory.registry();
        for (Node n : created) {
            if (ControlNodes.isEvent(n))
                continue;
            NodeDefinition def = registry.find(n.getTitle());
            List<String> keys = def == null ? List.of(n.getTitle()) : NodeRegistry.synonymKeys(def);
            for (String k : keys)
                queues.computeIfAbsent(k, x -> new ArrayDeque<>()).add(n);
        }
    }

    Result track(List<Stmt> body) {
        block(body);
        Map<String, List<MappedPort>> usage = new LinkedHashMap<>();
        paramUsage.forEach((k, v) -> usage.put(k, List.copyOf(v)));
        Map<String, List<MappedPort>> conditions = new LinkedHashMap<>();
        conditionUsage.forEach((k, v) -> conditions.put(k, List.copyOf(v)));
        return new Result(Collections.unmodifiableMap(new LinkedHashMap<>(aliasOf)),
                Collections.unmodifiableMap(new LinkedHashMap<>(constantOf)),
                Collections.unmodifiableMap(usage),
                Collections.unmodifiableSet(new LinkedHashSet<>(controlFlowUsage)),
                Collections.unmodifiableMap(conditions));
    }

    /** Claims the oldest unclaimed node callable as {@code key}. */
    private Node pop(String key) {
        Deque<Node> q = queues.get(key);
        if (q == null || q.isEmpty())
            return null;
        Node n = q.poll();
        for (Deque<Node> other : queues.values())
            other.remove(n);
        return n;
    }

    // --- Statements ---

    /** @return false when control cannot fall off the end of the block */
    private boolean block(List<Stmt> body) {
        for (Stmt s : body)
            if (!statement(s))
                return false;
        return true;
    }

    private boolean statement(Stmt s) {
        if (s instanceof ExprStmt es) {
            if (es.value() instanceof Call call && !PinMarkers.isMarker(call))
                return !endsFlow(call(call));
            return true;
        }
        if (s instanceof Assign a) {
            assign(a.targets(), a.value());
            return true;
        }
        if (s instanceof AnnAssign a) {
            if (a.value() != null)
                assign(List.of(a.target()), a.value());
            return true;
        }
        if (s instanceof If i) {
            condition(i.test(), pop(ControlNodes.BRANCH), ControlNodes.CONDITION);
            boolean yes = block(i.body());
            boolean no = i.orelse().isEmpty() || block(i.orelse());
            return yes || no;
        }
        if (s instanceof Match m)
            return match(m);
        if (s instanceof For f) {
            forLoop(f);
            return true;
        }
        if (s instanceof Try t) {
            boolean live = block(t.body()) && block(t.orelse()) && block(t.finalbody());
            for (Handler h : t.handlers())
                scanOnly(h.body());
            return live;
        }
        return !(s instanceof Return || s instanceof Break || s instanceof Continue);
    }

    private boolean match(Match m) {
        Set<String> cases = new HashSet<>();
        boolean wildcard = false;
        for (MatchCase mc : m.cases()) {
            if (mc.isWildcard())
                wildcard = true;
            else
                cases.add(FlowBuilder.caseValue(mc.pattern()));
        }
        boolean live;
        if (FlowBuilder.isMultiExit(factory, m.subject())) {
            Call call = (Call) m.subject();
            controlFlowUsage.addAll(referencedParams(call));
            Node node = call(call);
            live = false;
            if (node != null) {
                NodeDefinition def = factory.registry().find(node.getTitle());
                for (String exit : def.flowOutputs())
                    if (!cases.contains(exit) && !(wildcard && exit.equals(FlowPorts.DEFAULT)))
                        live = true;
            }
        } else {
            condition(m.subject(), pop(ControlNodes.MULTI_BRANCH), ControlNodes.CONTROL_EXPRESSION);
            live = !wildcard;
        }
        for (MatchCase mc : m.cases())
            live |= block(mc.body());
        return live;
    }

    private void forLoop(For f) {
        controlFlowUsage.addAll(referencedParams(f.iter()));
        if (f.iter() instanceof Call call && call.func() instanceof Name fn && fn.id().equals(NodeFactory.RANGE)) {
            Node loop = pop(ControlNodes.FINITE_LOOP);
            if (call.args().size() == 1) {
                argument(loop, ControlNodes.END, call.args().get(0));
            } else if (call.args().size() == 2) {
                argument(loop, ControlNodes.START, call.args().get(0));
                argument(loop, ControlNodes.END, call.args().get(1));
            }
        } else {
            argument(pop(ControlNodes.LIST_ITERATION), ControlNodes.LIST, f.iter());
        }
        String target = Ast.dottedName(f.target());
        if (target != null)
            rebind(target);
        block(f.body());
    }

    private void condition(Expr test, Node node, String port) {
        Set<String> used = referencedParams(test);
        controlFlowUsage.addAll(used);
        if (!FlowBuilder.isCompoundCondition(test)) {
            argument(node, port, test);
            return;
        }
        if (node == null)
            return;
        for (String p : used)
            add(conditionUsage, p, new MappedPort(node.getId(), port));
    }

    private void assign(List<Expr> targets, Expr value) {
        for (Expr t : targets) {
            if (t instanceof TupleExpr tt && value instanceof TupleExpr tv && tt.elts().size() == tv.elts().size()) {
                for (int i = 0; i < tt.elts().size(); i++)
                    assignOne(tt.elts().get(i), tv.elts().get(i));
            }
        }
        if (value instanceof Call call) {
            if (!isContextLookup(call) && !PinMarkers.isMarker(call))
                call(call);
            for (Expr t : targets)
                for (String name : targetNames(t))
                    rebind(name);
            return;
        }
        for (Expr t : targets)
            if (!(t instanceof TupleExpr))
                assignOne(t, value);
    }

    private void assignOne(Expr target, Expr value) {
        String name = Ast.dottedName(target);
        if (name == null)
            return;
        String source = Ast.dottedName(value);
        String param = source == null ? null : paramOf(source);
        String constant = Ast.isLiteral(value) ? SourcePrinter.print(value)
                : source == null ? null : constantOf.get(source);
        boolean first = !assigned.contains(name);
        rebind(name);
        if (param != null)
            aliasOf.put(name, param);
        else if (constant != null && first)
            constantOf.put(name, constant);
    }

    /** Forgets what {@code name} stood for; a second assignment also ends its constant status. */
    private void rebind(String name) {
        aliasOf.remove(name);
        constantOf.remove(name);
        assigned.add(name);
        shadowed.add(name);
    }

    private List<String> targetNames(Expr t) {
        List<String> names = new ArrayList<>();
        if (t instanceof TupleExpr tu) {
            for (Expr e : tu.elts())
                names.addAll(targetNames(e));
        } else {
            String n = Ast.dottedName(t);
            if (n != null)
                names.add(n);
        }
        return names;
    }

    // --- Calls and arguments ---

    /** Claims the node created for {@code call} and attributes its arguments. */
    private Node call(Call call) {
        String title = factory.calleeTitle(call);
        if (title == null)
            return null;
        Node node = pop(title);
        NodeDefinition def = factory.registry().find(title);
        if (def == null)
            return node;
        for (NodeFactory.ArgBinding b : factory.bindArguments(def, node, call))
            argument(node, b.port(), b.value());
        return node;
    }

    private boolean endsFlow(Node node) {
        return node != null && FlowPorts.acceptsFlow(node)
                && !FlowPorts.hasFlowOutputs(node);
    }

    private void argument(Node node, String port, Expr value) {
        if (value instanceof Call call) {
            call(call);
            return;
        }
        String name = Ast.dottedName(value);
        if (name == null || node == null)
            return;
        String param = paramOf(name);
        if (param != null)
            add(paramUsage, param, new MappedPort(node.getId(), port));
    }

    /** Parameter a name stands for: directly, through an alias, or through an instance field. */
    private String paramOf(String name) {
        String aliased = aliasOf.get(name);
        if (aliased != null)
            return aliased;
        if (shadowed.contains(name))
            return null;
        if (params.contains(name))
            return name;
        if (name.startsWith("self.")) {
            String field = name.substring(5);
            return stateFields.get(field);
        }
        return null;
    }

    private Set<String> referencedParams(Expr e) {
        Set<String> out = new LinkedHashSet<>();
        collect(e, out);
        return out;
    }

    private void collect(Expr e, Set<String> out) {
        if (e == null)
            return;
        String dotted = Ast.dottedName(e);
        if (dotted != null) {
            String p = paramOf(dotted);
            if (p != null)
                out.add(p);
            return;
        }
        if (e instanceof Call c) {
            for (Expr a : c.args())
                collect(a, out);
            for (Keyword k : c.keywords())
                collect(k.value(), out);
        } else if (e instanceof Attribute a) {
            collect(a.value(), out);
        } else if (e instanceof UnaryOp u) {
            collect(u.operand(), out);
        } else if (e instanceof BinOp b) {
            collect(b.left(), out);
            collect(b.right(), out);
        } else if (e instanceof BoolOp b) {
            for (Expr v : b.values())
                collect(v, out);
        } else if (e instanceof Compare c) {
            collect(c.left(), out);
            for (Expr v : c.comparators())
                collect(v, out);
        } else if (e instanceof Subscript s) {
            collect(s.value(), out);
            collect(s.index(), out);
        } else if (e instanceof ListExpr l) {
            for (Expr v : l.elts())
                collect(v, out);
        } else if (e instanceof TupleExpr t) {
            for (Expr v : t.elts())
                collect(v, out);
        }
    }

    /** Exception handlers have no nodes; only conditions inside them count. */
    private void scanOnly(List<Stmt> body) {
        for (Stmt s : body) {
            if (s instanceof If i) {
                controlFlowUsage.addAll(referencedParams(i.test()));
                scanOnly(i.body());
                scanOnly(i.orelse());
            } else if (s instanceof For f) {
                controlFlowUsage.addAll(referencedParams(f.iter()));
                scanOnly(f.body());
            } else if (s instanceof Match m) {
                controlFlowUsage.addAll(referencedParams(m.subject()));
                for (MatchCase mc : m.cases())
                    scanOnly(mc.body());
            }
        }
    }

    private boolean isContextLookup(Call call) {
        return kwargsName != null && call.func() instanceof Attribute a && a.attr().equals("get")
                && a.value() instanceof Name n && n.id().equals(kwargsName);
    }

    private static void add(Map<String, List<MappedPort>> map, String key, MappedPort port) {
        List<MappedPort> list = map.computeIfAbsent(key, k -> new ArrayList<>());
        if (!list.contains(port))
            list.add(port);
    }
}
