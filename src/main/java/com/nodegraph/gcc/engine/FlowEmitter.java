package com.nodegraph.gcc.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.nodegraph.gcc.core.ControlNodes;
import com.nodegraph.gcc.core.Edge;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.syntax.SourcePrinter;

/**
 * Writes the statements of one generated method by walking flow edges.
 *
 * <p>
 * Nodes on a flow chain are written in flow order. {@code Branch},
 * {@code MultiBranch} and loop nodes open blocks whose arms are walked
 * recursively; nodes with several flow exits become a {@code match} over the
 * call. A node entered by more than one flow edge is a merge point: the
 * construct whose arms produced every one of those edges continues with it,
 * any other construct hands it up to its parent.
 *
 * <p>
 * Data-only nodes are written just before their first reader, in
 * {@link EmissionScheduler} data order. Arms that stop without reaching the
 * merge point of their construct end with {@code return}, or
 * {@code continue} inside a loop body.
 */
final class FlowEmitter {
    private static final Pattern DOTTED = Pattern.compile("[A-Za-z_]\\w*(\\.[A-Za-z_]\\w*)*");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final String NONE = "None";

    private enum EndKind {
        /** Chain stopped at a dangling exit. */
        OPEN,
        /** Chain ended in {@code break} or a node without flow exits. */
        DEAD,
        /** Chain reached a merge point. */
        LIVE
    }

    private record End(EndKind kind, String merge, Set<MappedPort> walked) {
        static final End OPEN = new End(EndKind.OPEN, null, Set.of());
        static final End DEAD = new End(EndKind.DEAD, null, Set.of());

        static End live(String merge, Set<MappedPort> walked) {
            return new End(EndKind.LIVE, merge, walked);
        }
    }

    private record Arm(String port, CodeWriter body, End end) {
    }

    private record Join(String merge, Set<MappedPort> walked, boolean allDead) {
    }

    private final GraphModel graph;
    private final EmissionScheduler scheduler;
    private final VarNameAllocator names;
    private final Map<MappedPort, String> pinRefs;
    private final Set<MappedPort> requiredOutputs;
    private final Map<String, String> typeOverrides;
    private final Set<String> emitted = new LinkedHashSet<>();

    /**
     * @param pinRefs         internal input ports fed by a composite input pin, to the pin's parameter name
     * @param requiredOutputs outputs that must be bound to a variable even without a reader
     * @param typeOverrides   {@code nodeId.port -> annotation} for annotated assignments
     */
    FlowEmitter(GraphModel graph, EmissionScheduler scheduler, VarNameAllocator names,
            Map<MappedPort, String> pinRefs, Set<MappedPort> requiredOutputs, Map<String, String> typeOverrides) {
        this.graph = graph;
        this.scheduler = scheduler;
        this.names = names;
        this.pinRefs = pinRefs;
        this.requiredOutputs = requiredOutputs;
        this.typeOverrides = typeOverrides;
    }

    Set<String> emitted() {
        return Collections.unmodifiableSet(emitted);
    }

    void markEmitted(String nodeId) {
        emitted.add(nodeId);
    }

    /** Writes the chain leaving {@code exit}. */
    void emitFrom(MappedPort exit, CodeWriter out) {
        topLevel(walk(exit, out, null));
    }

    /** Writes the chain starting at {@code nodeId} itself. */
    void emitEntry(String nodeId, CodeWriter out) {
        topLevel(statement(nodeId, out, null));
    }

    /** Writes whatever is still missing for {@code port} to have a variable; returns that variable. */
    String ensureValue(MappedPort port, CodeWriter out) {
        if (!emitted.contains(port.nodeId()))
            emitData(List.of(port.nodeId()), out);
        String name = names.nameOf(port);
        if (name == null)
            throw new GenerationException("Output '" + port + "' is not bound to a variable", port.nodeId());
        return name;
    }

    /** True when every flow node {@code nodeId} depends on was written by this emitter. */
    boolean canCompute(String nodeId) {
        for (String dep : scheduler.withDataDependencies(List.of(nodeId))) {
            Node n = graph.node(dep);
            if ((FlowPorts.isFlowNode(n) || ControlNodes.isEvent(n)) && !emitted.contains(dep))
                return false;
        }
        return true;
    }

    private void topLevel(End end) {
        if (end.kind() == EndKind.LIVE)
            throw new GenerationException("Flow paths rejoin at '" + graph.node(end.merge()).getTitle()
                    + "' outside of any branch", end.merge());
    }

    // --- Flow chains ---

    private End walk(MappedPort from, CodeWriter out, String loop) {
        List<Edge> next = graph.outgoing(from.nodeId(), from.portName());
        if (next.isEmpty())
            return End.OPEN;
        if (next.size() > 1)
            throw new GenerationException("Flow output '" + from + "' fans out to " + next.size() + " nodes",
                    from.nodeId());
        Edge e = next.get(0);
        if (FlowPorts.BREAK_LOOP.equals(e.dstPort())) {
            if (!e.dstNode().equals(loop))
                throw new GenerationException("Flow from '" + from + "' breaks a loop it is not inside of",
                        from.nodeId());
            out.line("break");
            return End.DEAD;
        }
        if (!FlowPorts.FLOW_IN.equals(e.dstPort()))
            throw new GenerationException("Flow enters '" + e.target() + "' through a port other than "
                    + FlowPorts.FLOW_IN, e.dstNode());
        if (flowSources(e.dstNode()).size() > 1)
            return End.live(e.dstNode(), Set.of(from));
        return statement(e.dstNode(), out, loop);
    }

    private End statement(String id, CodeWriter out, String loop) {
        if (!emitted.add(id))
            throw new GenerationException("Flow reaches a node twice", id);
        Node n = graph.node(id);
        if (ControlNodes.isBranch(n))
            return branch(n, out, loop);
        if (ControlNodes.isMultiBranch(n))
            return multiBranch(n, out, loop);
        if (ControlNodes.isLoop(n))
            return loop(n, out, loop);
        if (ControlNodes.isEvent(n))
            throw new GenerationException("Event node inside a flow chain", id);
        List<String> exits = FlowPorts.flowOutputs(n);
        if (exits.size() > 1)
            return dispatch(n, out, loop);
        emitDependencies(n, out);
        out.line(callStatement(n));
        if (exits.isEmpty())
            return End.DEAD;
        return walk(new MappedPort(id, exits.get(0)), out, loop);
    }

    private End branch(Node n, CodeWriter out, String loop) {
        emitDependencies(n, out);
        hoistShared(n, out);
        String condition = orNone(valueOf(n.getId(), ControlNodes.CONDITION));
        Arm yes = arm(n, FlowPorts.YES, loop);
        Arm no = arm(n, FlowPorts.NO, loop);
        Join join = join(n, List.of(yes, no));
        boolean terminate = join.merge() != null;

        out.line("if " + condition + ":");
        CodeWriter yesBody = armBody(yes, terminate, loop);
        if (yesBody.isEmpty())
            yesBody.line("pass");
        out.block(yesBody);
        CodeWriter noBody = armBody(no, terminate, loop);
        if (!noBody.isEmpty()) {
            out.line("else:");
            out.block(noBody);
        }
        return after(join, out, loop);
    }

    private End multiBranch(Node n, CodeWriter out, String loop) {
        emitDependencies(n, out);
        hoistShared(n, out);
        String subject = orNone(valueOf(n.getId(), ControlNodes.CONTROL_EXPRESSION));
        List<Arm> arms = new ArrayList<>();
        Arm fallback = null;
        for (String port : FlowPorts.flowOutputs(n)) {
            Arm a = arm(n, port, loop);
            if (port.equals(FlowPorts.DEFAULT))
                fallback = a;
            else
                arms.add(a);
        }
        List<Arm> all = new ArrayList<>(arms);
        if (fallback != null)
            all.add(fallback);
        Join join = join(n, all);
        boolean terminate = join.merge() != null;

        CodeWriter cases = new CodeWriter();
        for (Arm a : arms) {
            CodeWriter body = armBody(a, terminate, loop);
            if (body.isEmpty())
                body.line("pass");
            cases.line("case " + caseLiteral(a.port()) + ":").block(body);
        }
        if (fallback != null) {
            CodeWriter body = armBody(fallback, terminate, loop);
            if (!body.isEmpty())
                cases.line("case _:").block(body);
        }
        if (cases.isEmpty())
            cases.line("case _:").block(new CodeWriter().line("pass"));
        out.line("match " + subject + ":");
        out.block(cases);
        return after(join, out, loop);
    }

    /** A node with several flow exits: {@code match Call(...)} with one case per exit taken. */
    private End dispatch(Node n, CodeWriter out, String loop) {
        for (String port : FlowPorts.dataOutputs(n))
            if (isUsed(n, port))
                throw new GenerationException("Output '" + port + "' of '" + n.getTitle()
                        + "' cannot be read: the node has several flow exits", n.getId());
        emitDependencies(n, out);
        hoistShared(n, out);
        String call = CallRenderer.render(n, port -> valueOf(n.getId(), port));
        List<Arm> arms = new ArrayList<>();
        for (String port : FlowPorts.flowOutputs(n))
            arms.add(arm(n, port, loop));
        Join join = join(n, arms);
        boolean terminate = join.merge() != null;

        CodeWriter cases = new CodeWriter();
        for (Arm a : arms) {
            CodeWriter body = armBody(a, terminate, loop);
            if (!body.isEmpty())
                cases.line("case " + SourcePrinter.quote(a.port()) + ":").block(body);
        }
        if (cases.isEmpty())
            cases.line("case " + SourcePrinter.quote(arms.get(0).port()) + ":").block(new CodeWriter().line("pass"));
        out.line("match " + call + ":");
        out.block(cases);
        return after(join, out, loop);
    }

    private End loop(Node n, CodeWriter out, String enclosing) {
        emitDependencies(n, out);
        String valuePort = ControlNodes.loopValuePort(n);
        String var = names.allocate(new MappedPort(n.getId(), valuePort), n.outputLabels().get(valuePort));
        String header;
        if (ControlNodes.FINITE_LOOP.equals(n.getTitle())) {
            String start = valueOf(n.getId(), ControlNodes.START);
            String end = orNone(valueOf(n.getId(), ControlNodes.END));
            header = "0".equals(start) ? "range(" + end + ")" : "range(" + orNone(start) + ", " + end + ")";
        } else {
            header = orNone(valueOf(n.getId(), ControlNodes.LIST));
        }
        Arm body = arm(n, FlowPorts.LOOP_BODY, n.getId());
        if (body.end().kind() == EndKind.LIVE)
            throw new GenerationException("Flow leaves the body of '" + n.getTitle() + "' without completing it",
                    n.getId());
        CodeWriter b = body.body();
        if (b.isEmpty())
            b.line("pass");
        out.line("for " + var + " in " + header + ":");
        out.block(b);
        return walk(new MappedPort(n.getId(), FlowPorts.LOOP_COMPLETE), out, enclosing);
    }

    private Arm arm(Node n, String port, String loop) {
        CodeWriter body = new CodeWriter();
        End end = walk(new MappedPort(n.getId(), port), body, loop);
        return new Arm(port, body, end);
    }

    /** Body of an arm, closed with {@code return}/{@code continue} when it must not fall through. */
    private static CodeWriter armBody(Arm arm, boolean terminate, String loop) {
        CodeWriter body = arm.body();
        if (terminate && arm.end().kind() == EndKind.OPEN)
            body.line(loop != null ? "continue" : "return");
        return body;
    }

    private Join join(Node construct, List<Arm> arms) {
        Set<String> targets = new LinkedHashSet<>();
        Set<MappedPort> walked = new HashSet<>();
        boolean allDead = true;
        for (Arm a : arms) {
            if (a.end().kind() == EndKind.LIVE) {
                targets.add(a.end().merge());
                walked.addAll(a.end().walked());
            }
            if (a.end().kind() != EndKind.DEAD)
                allDead = false;
        }
        if (targets.size() > 1)
            throw new GenerationException("Flow paths of '" + construct.getTitle() + "' rejoin at different nodes "
                    + targets, construct.getId());
        return new Join(targets.isEmpty() ? null : targets.iterator().next(), walked, allDead);
    }

    /** Continues at the merge point when this construct produced all of its incoming flow. */
    private End after(Join join, CodeWriter out, String loop) {
        if (join.merge() == null)
            return join.allDead() ? End.DEAD : End.OPEN;
        if (join.walked().containsAll(flowSources(join.merge())))
            return statement(join.merge(), out, loop);
        return End.live(join.merge(), join.walked());
    }

    private Set<MappedPort> flowSources(String nodeId) {
        Set<MappedPort> out = new LinkedHashSet<>();
        for (Edge e : graph.incoming(nodeId))
            if (FlowPorts.FLOW_IN.equals(e.dstPort()) && FlowPorts.isFlowEdge(graph, e))
                out.add(e.source());
        return out;
    }

    // --- Statements and values ---

    /** Writes the data-only nodes {@code n} reads from that are not written yet. */
    private void emitDependencies(Node n, CodeWriter out) {
        Set<String> missing = new LinkedHashSet<>();
        collectMissing(n, missing);
        writeData(missing, out);
    }

    /**
     * Writes, ahead of a construct, the data-only nodes read on more than one
     * of its exit paths. A variable bound inside one arm is not visible to
     * the other arms or after the construct.
     */
    private void hoistShared(Node construct, CodeWriter out) {
        Map<String, Integer> paths = new LinkedHashMap<>();
        for (String port : FlowPorts.flowOutputs(construct)) {
            Set<String> needed = new LinkedHashSet<>();
            for (Edge e : graph.outgoing(construct.getId(), port))
                for (String id : scheduler.flowReachable(e.dstNode()))
                    for (String dep : scheduler.withDataDependencies(List.of(id)))
                        if (isPendingData(dep))
                            needed.add(dep);
            for (String id : needed)
                paths.merge(id, 1, Integer::sum);
        }
        List<String> shared = new ArrayList<>();
        paths.forEach((id, count) -> {
            if (count > 1 && canCompute(id))
                shared.add(id);
        });
        if (!shared.isEmpty())
            emitData(shared, out);
    }

    private boolean isPendingData(String id) {
        Node n = graph.node(id);
        return !emitted.contains(id) && !FlowPorts.isFlowNode(n) && !ControlNodes.isEvent(n);
    }

    private void emitData(Collection<String> ids, CodeWriter out) {
        Set<String> missing = new LinkedHashSet<>();
        for (String id : ids) {
            Node n = graph.node(id);
            if (FlowPorts.isFlowNode(n) || ControlNodes.isEvent(n))
                throw new GenerationException("'" + n.getTitle() + "' is not on this method's flow", id);
            if (missing.add(id))
                collectMissing(n, missing);
        }
        writeData(missing, out);
    }

    private void collectMissing(Node n, Set<String> missing) {
        for (Edge e : graph.incoming(n.getId())) {
            if (FlowPorts.isFlowEdge(graph, e) || emitted.contains(e.srcNode()) || missing.contains(e.srcNode()))
                continue;
            Node src = graph.node(e.srcNode());
            if (FlowPorts.isFlowNode(src) || ControlNodes.isEvent(src))
                throw new GenerationException("'" + n.getTitle() + "' reads '" + e.source()
                        + "' before that node runs", n.getId());
            missing.add(src.getId());
            collectMissing(src, missing);
        }
    }

    private void writeData(Set<String> ids, CodeWriter out) {
        List<String> ordered = new ArrayList<>(ids);
        ordered.sort(Comparator.comparingInt(scheduler::rank));
        for (String id : ordered) {
            emitted.add(id);
            out.line(callStatement(graph.node(id)));
        }
    }

    /** {@code Call(...)}, {@code v = Call(...)} or {@code a, b = Call(...)}. */
    private String callStatement(Node n) {
        String call = CallRenderer.render(n, port -> valueOf(n.getId(), port));
        List<String> outs = FlowPorts.dataOutputs(n);
        List<String> used = new ArrayList<>();
        for (String port : outs)
            if (isUsed(n, port))
                used.add(port);
        if (used.isEmpty())
            return call;
        if (outs.size() == 1 || used.size() == 1 && used.get(0).equals(outs.get(0))) {
            String first = outs.get(0);
            String var = names.allocate(new MappedPort(n.getId(), first), n.outputLabels().get(first));
            String type = typeOverrides.get(n.getId() + "." + first);
            if (type == null)
                return var + " = " + call;
            return var + ": " + (DOTTED.matcher(type).matches() ? type : SourcePrinter.quote(type)) + " = " + call;
        }
        List<String> vars = new ArrayList<>();
        for (String port : outs)
            vars.add(names.allocate(new MappedPort(n.getId(), port), n.outputLabels().get(port)));
        return String.join(", ", vars) + " = " + call;
    }

    private boolean isUsed(Node n, String port) {
        return !graph.outgoing(n.getId(), port).isEmpty() || requiredOutputs.contains(new MappedPort(n.getId(), port));
    }

    /** Source text feeding an input port, or null when it has no value. */
    String valueOf(String nodeId, String port) {
        Edge e = graph.incomingEdge(nodeId, port);
        if (e != null) {
            String var = names.nameOf(e.source());
            if (var == null)
                throw new GenerationException("Value '" + e.source() + "' is not available where '" + nodeId + "."
                        + port + "' reads it", nodeId);
            return var;
        }
        String pin = pinRefs.get(new MappedPort(nodeId, port));
        if (pin != null)
            return pin;
        return CallRenderer.literal(graph.node(nodeId).inputConstants().get(port));
    }

    /** Case label of a {@code MultiBranch} output port. */
    static String caseLiteral(String port) {
        if (NUMBER.matcher(port).matches() || port.equals("True") || port.equals("False") || port.equals("None"))
            return port;
        if (port.contains(".") && DOTTED.matcher(port).matches())
            return port;
        return SourcePrinter.quote(port);
    }

    private static String orNone(String v) {
        return v == null ? NONE : v;
    }
}
