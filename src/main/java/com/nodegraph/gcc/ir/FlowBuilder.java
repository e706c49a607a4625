package com.nodegraph.gcc.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.io.NodeDefinition;
import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.*;
import com.nodegraph.gcc.syntax.SourcePrinter;

import lombok.extern.log4j.Log4j2;

/**
 * Turns the statements of one method into nodes and edges.
 *
 * <p>
 * Walks the body with a flow {@link Cursor}: the set of pending flow exits
 * the next flow-capable node connects from. Calls become nodes, identifier
 * arguments become data edges through the {@link VarEnv}, literals become
 * input constants, and {@code if}/{@code match}/{@code for} become control
 * nodes whose arms are built recursively from the matching flow output.
 *
 * <p>
 * Any statement or argument that cannot be represented fails the whole
 * parse with a {@link GraphParseException}.
 */
@Log4j2
final class FlowBuilder {

    /**
     * Pending flow exits. A live cursor without exits is the method entry: the
     * next flow node becomes the start of the chain. A dead cursor follows
     * {@code return}, {@code break} and {@code continue}.
     */
    record Cursor(List<MappedPort> exits, boolean live) {
        static Cursor entry() {
            return new Cursor(List.of(), true);
        }

        static Cursor dead() {
            return new Cursor(List.of(), false);
        }

        static Cursor at(String nodeId, String port) {
            return new Cursor(List.of(new MappedPort(nodeId, port)), true);
        }

        Cursor join(Cursor other) {
            if (!live)
                return other;
            if (!other.live)
                return this;
            List<MappedPort> all = new ArrayList<>(exits);
            all.addAll(other.exits);
            return new Cursor(List.copyOf(all), true);
        }
    }

    private final GraphModel graph;
    private final VarEnv env;
    private final NodeFactory factory;
    private final Set<String> pinParams;
    private final Map<String, String> stateFields;
    private final String file;
    private final String kwargsName;
    private final String eventNodeId;
    private final boolean composite;

    private final Map<String, String> constants = new LinkedHashMap<>();
    private final Map<String, String> typeOverrides = new LinkedHashMap<>();
    private final List<String> contextPorts = new ArrayList<>();
    private List<Expr> returnValues = List.of();

    /**
     * @param pinParams   parameters standing for composite input pins; they resolve without an edge
     * @param stateFields instance field to parameter, from {@code self.x = param}
     * @param kwargsName  name of the {@code **kwargs} parameter of a dynamically-shaped event, or null
     * @param eventNodeId event node of the method, or null
     * @param composite   true inside a composite, where conditions over pins map to pin ports
     */
    FlowBuilder(GraphModel graph, VarEnv env, NodeFactory factory, Set<String> pinParams,
            Map<String, String> stateFields, String kwargsName, String eventNodeId, boolean composite) {
        this.graph = graph;
        this.env = env;
        this.factory = factory;
        this.pinParams = pinParams;
        this.stateFields = stateFields;
        this.file = factory.file();
        this.kwargsName = kwargsName;
        this.eventNodeId = eventNodeId;
        this.composite = composite;
    }

    /** Values of the last {@code return} carrying values. */
    List<Expr> returnValues() {
        return returnValues;
    }

    /** {@code nodeId.port -> type} from annotated assignments. */
    Map<String, String> typeOverrides() {
        return typeOverrides;
    }

    /** Event outputs read through {@code kwargs.get(...)}, in order of first use. */
    List<String> contextPorts() {
        return contextPorts;
    }

    Cursor block(List<Stmt> body, Cursor cursor) {
        for (int i = 0; i < body.size(); i++) {
            Stmt s = body.get(i);
            if (!cursor.live()) {
                log.warn("{}:{}: unreachable statements skipped", file, s.line());
                break;
            }
            cursor = statement(s, cursor);
        }
        return cursor;
    }

    private Cursor statement(Stmt s, Cursor cursor) {
        if (s instanceof ExprStmt es)
            return expressionStatement(es, cursor);
        if (s instanceof Assign a)
            return assign(a.targets(), a.value(), null, a.line(), cursor);
        if (s instanceof AnnAssign a) {
            if (a.value() == null)
                return cursor;
            String type = a.annotation() instanceof Constant c ? c.value() : Ast.dottedName(a.annotation());
            return assign(List.of(a.target()), a.value(), type, a.line(), cursor);
        }
        if (s instanceof If i)
            return ifStatement(i, cursor);
        if (s instanceof Match m)
            return match(m, cursor);
        if (s instanceof For f)
            return forLoop(f, cursor);
        if (s instanceof Break b) {
            String loop = env.currentLoop();
            if (loop == null)
                throw fail("'break' outside a loop", b.line());
            connectFlow(cursor, loop, FlowPorts.BREAK_LOOP);
            return Cursor.dead();
        }
        if (s instanceof Continue c) {
            if (env.currentLoop() == null)
                throw fail("'continue' outside a loop", c.line());
            return Cursor.dead();
        }
        if (s instanceof Return r) {
            for (Expr v : r.values()) {
                if (!(v instanceof Name) && !(v instanceof Constant k && k.kind() == ConstKind.NONE))
                    throw fail("Return values must be variable names or None", r.line());
                if (v instanceof Name n)
                    requireSettled(n.id(), r.line());
            }
            if (!r.values().isEmpty())
                returnValues = r.values();
            return Cursor.dead();
        }
        if (s instanceof Try t) {
            Cursor c = block(t.body(), cursor);
            c = block(t.orelse(), c);
            if (!t.handlers().isEmpty())
                log.debug("{}:{}: exception handlers are not part of the flow", file, t.line());
            return block(t.finalbody(), c);
        }
        if (s instanceof Pass || s instanceof Import)
            return cursor;
        if (s instanceof While w)
            throw fail("'while' loops cannot be represented as a graph; use 'for'", w.line());
        if (s instanceof AugAssign a)
            throw fail("Augmented assignment cannot be represented as a graph", a.line());
        if (s instanceof FunctionDef || s instanceof ClassDef)
            throw fail("Nested definitions are not supported", s.line());
        throw fail("Unsupported statement", s.line());
    }

    private Cursor expressionStatement(ExprStmt es, Cursor cursor) {
        if (es.value() instanceof Constant c && c.kind() == ConstKind.STRING)
            return cursor;
        if (!(es.value() instanceof Call call))
            throw fail("Expression statement has no effect on the graph", es.line());
        if (PinMarkers.isMarker(call))
            return cursor;
        Node node = createCallNode(call);
        return sequence(node, cursor);
    }

    // --- Assignments ---

    private Cursor assign(List<Expr> targets, Expr value, String annotation, int line, Cursor cursor) {
        for (Expr t : targets)
            if (t instanceof Subscript)
                throw fail("Subscript assignment cannot be represented as a graph", line);
        if (value instanceof Call call && isContextLookup(call)) {
            bindContextLookup(targets, call, line);
            return cursor;
        }
        if (value instanceof Call call) {
            Node node = createCallNode(call);
            List<String> outs = FlowPorts.dataOutputs(node);
            for (Expr t : targets)
                bindTargets(t, node, outs, line);
            if (annotation != null && !outs.isEmpty())
                typeOverrides.put(node.getId() + "." + outs.get(0), annotation);
            return sequence(node, cursor);
        }
        if (Ast.isLiteral(value)) {
            String literal = SourcePrinter.print(value);
            for (Expr t : targets) {
                String name = targetName(t, line);
                env.unbind(name);
                constants.put(name, literal);
            }
            return cursor;
        }
        String source = Ast.dottedName(value);
        if (source != null && (value instanceof Name || source.startsWith("self."))) {
            requireSettled(source, line);
            if (!isResolvable(source))
                throw fail("Unresolved name '" + source + "'", line);
            for (Expr t : targets) {
                String name = targetName(t, line);
                String root = env.rootName(source);
                if (constants.containsKey(root)) {
                    env.unbind(name);
                    constants.put(name, constants.get(root));
                } else {
                    constants.remove(name);
                    env.alias(name, source);
                }
            }
            return cursor;
        }
        throw fail("Assigned expression cannot be represented as a graph", line);
    }

    private void bindTargets(Expr target, Node node, List<String> outs, int line) {
        if (target instanceof TupleExpr tu) {
            if (tu.elts().size() != outs.size())
                throw fail("'" + node.getTitle() + "' produces " + outs.size() + " values, "
                        + tu.elts().size() + " targets given", line);
            for (int i = 0; i < outs.size(); i++)
                bindName(targetName(tu.elts().get(i), line), new MappedPort(node.getId(), outs.get(i)));
            return;
        }
        if (outs.isEmpty())
            throw fail("'" + node.getTitle() + "' produces no value to assign", line);
        bindName(targetName(target, line), new MappedPort(node.getId(), outs.get(0)));
    }

    private void bindName(String name, MappedPort producer) {
        constants.remove(name);
        env.bind(name, producer);
    }

    private String targetName(Expr t, int line) {
        String name = Ast.dottedName(t);
        if (name == null || !(t instanceof Name || name.startsWith("self.") && name.split("\\.").length == 2))
            throw fail("Unsupported assignment target", line);
        return name;
    }

    private boolean isContextLookup(Call call) {
        return kwargsName != null && call.func() instanceof Attribute a && a.attr().equals("get")
                && a.value() instanceof Name n && n.id().equals(kwargsName);
    }

    /** {@code x = kwargs.get("param")} exposes {@code param} as an event output. */
    private void bindContextLookup(List<Expr> targets, Call call, int line) {
        if (call.args().isEmpty() || !(call.args().get(0) instanceof Constant c) || c.kind() != ConstKind.STRING)
            throw fail("Context lookup needs a string key", line);
        Node event = graph.node(eventNodeId);
        if (!event.hasOutput(c.value()))
            event.addOutput(c.value());
        if (!contextPorts.contains(c.value()))
            contextPorts.add(c.value());
        for (Expr t : targets)
            bindName(targetName(t, line), new MappedPort(eventNodeId, c.value()));
    }

    // --- Control flow ---

    private Cursor ifStatement(If stmt, Cursor cursor) {
        Node branch = factory.createControl(ControlNodes.BRANCH, stmt.line());
        graph.addNode(branch);
        connectFlow(cursor, branch.getId(), FlowPorts.FLOW_IN);
        resolveCondition(branch, ControlNodes.CONDITION, stmt.test());
        Scope before = saveScope();
        List<Scope> live = new ArrayList<>();
        Cursor yes = arm(stmt.body(), Cursor.at(branch.getId(), FlowPorts.YES), before, live);
        Cursor no = arm(stmt.orelse(), Cursor.at(branch.getId(), FlowPorts.NO), before, live);
        mergeArms(before, live, stmt.line());
        return yes.join(no);
    }

    private Cursor match(Match stmt, Cursor cursor) {
        Node dispatch;
        if (isMultiExit(factory, stmt.subject())) {
            Call call = (Call) stmt.subject();
            dispatch = createCallNode(call);
            connectFlow(cursor, dispatch.getId(), FlowPorts.FLOW_IN);
        } else {
            dispatch = factory.createControl(ControlNodes.MULTI_BRANCH, stmt.line());
            graph.addNode(dispatch);
            connectFlow(cursor, dispatch.getId(), FlowPorts.FLOW_IN);
            resolveCondition(dispatch, ControlNodes.CONTROL_EXPRESSION, stmt.subject());
            for (MatchCase mc : stmt.cases()) {
                if (mc.isWildcard())
                    continue;
                String port = caseValue(mc.pattern());
                if (dispatch.hasOutput(port))
                    throw fail("Duplicate case '" + port + "'", mc.line());
                dispatch.addOutput(port).addFlowAlias(port);
            }
        }
        boolean multiBranch = ControlNodes.isMultiBranch(dispatch);
        Set<String> covered = new HashSet<>();
        Scope before = saveScope();
        List<Scope> live = new ArrayList<>();
        Cursor result = Cursor.dead();
        for (MatchCase mc : stmt.cases()) {
            String port;
            if (mc.isWildcard()) {
                port = FlowPorts.DEFAULT;
                if (!dispatch.hasOutput(port))
                    throw fail("'" + dispatch.getTitle() + "' has no default exit", mc.line());
            } else {
                port = caseValue(mc.pattern());
                if (!multiBranch && (!dispatch.hasOutput(port) || !FlowPorts.isFlowOutput(dispatch, port)))
                    throw fail("'" + dispatch.getTitle() + "' has no flow exit '" + port + "'", mc.line());
            }
            if (!covered.add(port))
                throw fail("Duplicate case '" + port + "'", mc.line());
            result = result.join(arm(mc.body(), Cursor.at(dispatch.getId(), port), before, live));
        }
        for (String exit : FlowPorts.flowOutputs(dispatch))
            if (!covered.contains(exit))
                result = result.join(arm(List.of(), Cursor.at(dispatch.getId(), exit), before, live));
        mergeArms(before, live, stmt.line());
        return result;
    }

    // --- Arm scopes ---

    /** Bindings and constants at one point of the walk. */
    private record Scope(VarEnv env, Map<String, String> constants) {
    }

    /** What a name stands for in one scope; exactly one component is set. */
    private record Binding(MappedPort producer, String constant, String aliasOf, int pathDependentLine) {
    }

    private Scope saveScope() {
        return new Scope(env.copy(), new LinkedHashMap<>(constants));
    }

    private void restoreScope(Scope scope) {
        env.restore(scope.env());
        constants.clear();
        constants.putAll(scope.constants());
    }

    /** Builds one arm from the bindings in effect before the construct. */
    private Cursor arm(List<Stmt> body, Cursor start, Scope before, List<Scope> live) {
        restoreScope(before);
        Cursor end = block(body, start);
        if (end.live())
            live.add(saveScope());
        return end;
    }

    /**
     * Restores the bindings from before the construct, then applies what the
     * live arms agree on. A name the live arms leave with different values
     * becomes path-dependent.
     */
    private void mergeArms(Scope before, List<Scope> live, int line) {
        restoreScope(before);
        if (live.isEmpty())
            return;
        Set<String> names = new LinkedHashSet<>();
        for (Scope s : live) {
            names.addAll(s.env().names());
            names.addAll(s.constants().keySet());
        }
        names.addAll(before.env().names());
        names.addAll(before.constants().keySet());
        for (String name : names) {
            Binding was = bindingIn(before, name);
            Binding first = bindingIn(live.get(0), name);
            boolean changed = false;
            boolean agreed = true;
            for (Scope s : live) {
                Binding b = bindingIn(s, name);
                changed |= !Objects.equals(b, was);
                agreed &= Objects.equals(b, first);
            }
            if (!changed)
                continue;
            if (agreed) {
                adopt(name, first);
            } else {
                constants.remove(name);
                env.markPathDependent(name, line);
            }
        }
    }

    private static Binding bindingIn(Scope scope, String name) {
        int dependent = scope.env().pathDependentLine(name);
        if (dependent > 0)
            return new Binding(null, null, null, dependent);
        MappedPort producer = scope.env().resolve(name);
        if (producer != null)
            return new Binding(producer, null, null, 0);
        String root = scope.env().rootName(name);
        if (scope.constants().containsKey(root))
            return new Binding(null, scope.constants().get(root), null, 0);
        return root.equals(name) ? null : new Binding(null, null, root, 0);
    }

    private void adopt(String name, Binding b) {
        if (b == null) {
            env.unbind(name);
            constants.remove(name);
        } else if (b.pathDependentLine() > 0) {
            constants.remove(name);
            env.markPathDependent(name, b.pathDependentLine());
        } else if (b.producer() != null) {
            bindName(name, b.producer());
        } else if (b.constant() != null) {
            env.unbind(name);
            constants.put(name, b.constant());
        } else {
            constants.remove(name);
            env.alias(name, b.aliasOf());
        }
    }

    private void requireSettled(String name, int line) {
        int construct = env.pathDependentLine(name);
        if (construct > 0)
            throw fail("Variable '" + name + "' assigned in a branch is read after it (branch at line " + construct
                    + ")", line);
    }

    /** True when a match subject is a call whose node has several flow exits to dispatch on. */
    static boolean isMultiExit(NodeFactory factory, Expr subject) {
        if (!(subject instanceof Call call))
            return false;
        String title = factory.calleeTitle(call);
        if (title == null)
            return false;
        NodeDefinition def = factory.registry().find(title);
        return def != null && def.flowOutputs().size() > 1;
    }

    /** Port name for a case pattern: the literal's value or the dotted name. */
    static String caseValue(Expr pattern) {
        if (pattern instanceof Constant c)
            return c.value();
        String dotted = Ast.dottedName(pattern);
        return dotted != null ? dotted : SourcePrinter.print(pattern);
    }

    private Cursor forLoop(For stmt, Cursor cursor) {
        if (!stmt.orelse().isEmpty())
            throw fail("'for ... else' cannot be represented as a graph", stmt.line());
        if (!(stmt.target() instanceof Name target))
            throw fail("Loop target must be a single name", stmt.line());
        Node loop;
        if (stmt.iter() instanceof Call call && call.func() instanceof Name fn && fn.id().equals(NodeFactory.RANGE)) {
            if (call.args().isEmpty() || call.args().size() > 2 || !call.keywords().isEmpty())
                throw fail("range() takes one or two positional arguments", stmt.line());
            loop = factory.createControl(ControlNodes.FINITE_LOOP, stmt.line());
            graph.addNode(loop);
            if (call.args().size() == 1) {
                loop.setInputConstant(ControlNodes.START, "0");
                resolveArgument(loop, ControlNodes.END, call.args().get(0), stmt.line());
            } else {
                resolveArgument(loop, ControlNodes.START, call.args().get(0), stmt.line());
                resolveArgument(loop, ControlNodes.END, call.args().get(1), stmt.line());
            }
        } else {
            loop = factory.createControl(ControlNodes.LIST_ITERATION, stmt.line());
            graph.addNode(loop);
            resolveArgument(loop, ControlNodes.LIST, stmt.iter(), stmt.line());
        }
        connectFlow(cursor, loop.getId(), FlowPorts.FLOW_IN);
        bindName(target.id(), new MappedPort(loop.getId(), ControlNodes.loopValuePort(loop)));
        env.pushLoop(loop.getId());
        block(stmt.body(), Cursor.at(loop.getId(), FlowPorts.LOOP_BODY));
        env.popLoop();
        return Cursor.at(loop.getId(), FlowPorts.LOOP_COMPLETE);
    }

    // --- Nodes and arguments ---

    private Node createCallNode(Call call) {
        String title = factory.calleeTitle(call);
        if (title == null)
            throw fail("Pin markers cannot be used as values", call.line());
        if (title.equals(NodeFactory.RANGE))
            throw fail("range() is only supported as a 'for' iterable", call.line());
        NodeDefinition def = factory.require(title, call.line());
        Node node = factory.create(def, call.line());
        graph.addNode(node);
        for (NodeFactory.ArgBinding b : factory.bindArguments(def, node, call))
            resolveArgument(node, b.port(), b.value(), call.line());
        return node;
    }

    /** Connects a flow-capable node after the cursor and advances past it. */
    private Cursor sequence(Node node, Cursor cursor) {
        if (!FlowPorts.acceptsFlow(node))
            return cursor;
        connectFlow(cursor, node.getId(), FlowPorts.FLOW_IN);
        List<String> exits = FlowPorts.flowOutputs(node);
        if (exits.isEmpty())
            return Cursor.dead();
        if (exits.contains(FlowPorts.FLOW_OUT))
            return Cursor.at(node.getId(), FlowPorts.FLOW_OUT);
        List<MappedPort> all = new ArrayList<>();
        for (String e : exits)
            all.add(new MappedPort(node.getId(), e));
        return new Cursor(List.copyOf(all), true);
    }

    private void connectFlow(Cursor cursor, String nodeId, String port) {
        for (MappedPort exit : cursor.exits())
            graph.connect(exit.nodeId(), exit.portName(), nodeId, port);
    }

    /**
     * Conditions that are plain values connect like arguments. A comparison
     * connects its left-hand variable and {@code not x} connects {@code x}.
     * Other compound conditions have no graph form: inside a composite the
     * port stays open and the pins read in the condition map to it, anywhere
     * else the parse fails.
     */
    private void resolveCondition(Node node, String port, Expr test) {
        if (!isCompoundCondition(test)) {
            resolveArgument(node, port, test, test.line());
            return;
        }
        Expr variable = conditionVariable(test);
        if (variable != null) {
            log.debug("{}:{}: condition '{}' connected through '{}'", file, test.line(), SourcePrinter.print(test),
                    SourcePrinter.print(variable));
            resolveArgument(node, port, variable, test.line());
            return;
        }
        if (!composite)
            throw fail("Condition '" + SourcePrinter.print(test) + "' has no graph form; use a variable, a"
                    + " comparison on a variable or 'not' of a variable", test.line());
        log.warn("{}:{}: condition '{}' has no graph form; '{}' left unconnected", file, test.line(),
                SourcePrinter.print(test), port);
    }

    /** The variable a condition tests, or null when it has none. */
    static Expr conditionVariable(Expr test) {
        if (test instanceof Name || isStateField(test))
            return test;
        if (test instanceof UnaryOp u && u.op().equals("not"))
            return conditionVariable(u.operand());
        if (test instanceof Compare c && (c.left() instanceof Name || isStateField(c.left())))
            return c.left();
        return null;
    }

    private static boolean isStateField(Expr e) {
        String dotted = Ast.dottedName(e);
        return e instanceof Attribute && dotted != null && dotted.startsWith("self.");
    }

    /** Conditions built from operators; they have no node form. */
    static boolean isCompoundCondition(Expr test) {
        return test instanceof Compare || test instanceof BoolOp || test instanceof BinOp
                || test instanceof UnaryOp u && !Ast.isLiteral(u);
    }

    private void resolveArgument(Node node, String port, Expr value, int line) {
        if (Ast.isLiteral(value)) {
            node.setInputConstant(port, SourcePrinter.print(value));
            return;
        }
        if (value instanceof Call call) {
            Node producer = createCallNode(call);
            if (FlowPorts.acceptsFlow(producer))
                throw fail("Flow node '" + producer.getTitle() + "' cannot be used as a value", line);
            List<String> outs = FlowPorts.dataOutputs(producer);
            if (outs.isEmpty())
                throw fail("'" + producer.getTitle() + "' produces no value", line);
            graph.connect(producer.getId(), outs.get(0), node.getId(), port);
            return;
        }
        String name = Ast.dottedName(value);
        if (name == null || !(value instanceof Name || name.startsWith("self.")))
            throw fail("Cannot resolve argument '" + SourcePrinter.print(value) + "' for port '" + port + "'", line);
        requireSettled(name, line);
        MappedPort producer = env.resolve(name);
        if (producer != null) {
            graph.connect(producer.nodeId(), producer.portName(), node.getId(), port);
            return;
        }
        String root = env.rootName(name);
        if (constants.containsKey(root)) {
            node.setInputConstant(port, constants.get(root));
            return;
        }
        if (!isPinReference(root))
            throw fail("Unresolved name '" + name + "'", line);
    }

    private boolean isResolvable(String name) {
        String root = env.rootName(name);
        return env.resolve(name) != null || constants.containsKey(root) || isPinReference(root);
    }

    private boolean isPinReference(String root) {
        if (pinParams.contains(root))
            return true;
        return root.startsWith("self.") && stateFields.containsKey(root.substring(5));
    }

    private GraphParseException fail(String message, int line) {
        return new GraphParseException(message, file, line);
    }
}
