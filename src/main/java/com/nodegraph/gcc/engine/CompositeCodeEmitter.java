package com.nodegraph.gcc.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.api.CodeGenerator;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.core.VirtualPin;
import com.nodegraph.gcc.ir.MethodRole;
import com.nodegraph.gcc.ir.PinMarkers;
import com.nodegraph.gcc.ir.SourceMetadata;
import com.nodegraph.gcc.syntax.SourcePrinter;
import com.nodegraph.gcc.util.Identifiers;

import lombok.extern.log4j.Log4j2;

/**
 * Writes a composite definition as a self-contained Graph Code file.
 *
 * <p>
 * Every mapped flow-input pin becomes a {@code @flow_entry} method starting
 * at the pin's node, every event node an {@code @event_handler}. Data pins
 * are declared on the method that uses them; pins and data nodes no method
 * claims end up in a {@code compute} data method. Output pins without a
 * mapping are returned as {@code None} with an {@code # unmapped} comment.
 */
@Log4j2
public final class CompositeCodeEmitter implements CodeGenerator<CompositeNodeConfig> {
    static final String PROLOGUE = "from graph_runtime import " + MethodRole.FLOW_ENTRY + ", "
            + MethodRole.EVENT_HANDLER + ", " + MethodRole.DATA_METHOD;
    static final String COMPUTE = "compute";

    private final Set<String> reserved;

    public CompositeCodeEmitter() {
        this(CompilerConfig.defaults().getContextHandles());
    }

    public CompositeCodeEmitter(Collection<String> contextHandles) {
        this.reserved = GraphCodeEmitter.reservedNames(contextHandles);
    }

    @Override
    public String generate(CompositeNodeConfig composite) {
        GraphModel graph = composite.getSubGraph();
        EmissionScheduler scheduler = new EmissionScheduler(graph);

        Map<MappedPort, String> pinRefs = new LinkedHashMap<>();
        Set<MappedPort> required = new LinkedHashSet<>();
        for (VirtualPin pin : composite.inputPins()) {
            if (pin.isFlow())
                continue;
            if (!Identifiers.isSafeName(pin.getName()) || pin.getName().equals("self"))
                throw new GenerationException("Input pin '" + pin.getName() + "' is not a legal parameter name");
            for (MappedPort p : pin.getMappedPorts())
                pinRefs.putIfAbsent(p, pin.getName());
        }
        for (VirtualPin pin : composite.outputPins())
            if (!pin.isFlow() && pin.isMapped())
                required.add(pin.getMappedPorts().get(0));

        CodeWriter w = new CodeWriter();
        Map<String, String> values = new LinkedHashMap<>();
        values.put(SourceMetadata.COMPOSITE_ID, composite.getCompositeId());
        values.put(SourceMetadata.NODE_NAME, composite.getNodeName());
        if (!composite.getDescription().isEmpty())
            values.put(SourceMetadata.NODE_DESCRIPTION, composite.getDescription());
        values.put(SourceMetadata.SCOPE, composite.getScope());
        if (!composite.getCategory().isEmpty())
            values.put(SourceMetadata.CATEGORY, composite.getCategory());
        GraphCodeEmitter.extraMetadata(composite.getMetadata(), values);
        GraphCodeEmitter.docstring(w, SourceMetadata.render(values, graph.graphVariables()));
        w.line(PROLOGUE);
        w.blank().blank();
        w.line("class " + GraphCodeEmitter.className(composite.getNodeName(), "Composite") + ":").indent();
        GraphCodeEmitter.init(w);

        Set<String> methodNames = new HashSet<>(Set.of("__init__", "register_handlers", COMPUTE));
        methodNames.addAll(PinMarkers.NAMES);
        Set<VirtualPin> claimed = new HashSet<>();

        for (VirtualPin entry : composite.inputPins()) {
            if (!entry.isFlow())
                continue;
            String method = GraphCodeEmitter.uniqueName(entry.getName().equals(FlowPorts.FLOW_IN) ? "run"
                    : Identifiers.sanitize(VarNameAllocator.snakeCase(entry.getName())), methodNames);
            w.blank();
            flowEntry(w, composite, scheduler, entry, method, pinRefs, required, claimed);
            claimed.add(entry);
        }
        for (Node event : scheduler.eventNodes()) {
            String method = GraphCodeEmitter.uniqueName("on_" + Identifiers.sanitize(event.getTitle()), methodNames);
            CodeWriter handler = new CodeWriter();
            FlowEmitter flow = GraphCodeEmitter.eventHandler(handler, graph, scheduler, event, method, null, pinRefs,
                    required, reserved(composite));
            List<VirtualPin> outs = new ArrayList<>();
            for (VirtualPin pin : composite.outputPins())
                if (pin.isFlow() && !claimed.contains(pin) && mappedInto(pin, flow.emitted()))
                    outs.add(pin);
            claimed.addAll(outs);
            w.blank();
            // re-render with the pins this handler owns
            GraphCodeEmitter.eventHandler(w, graph, scheduler, event, method, "outputs=" + pinList(outs), pinRefs,
                    required, reserved(composite));
        }
        compute(w, composite, scheduler, pinRefs, required, claimed);
        w.dedent();
        return w.toString();
    }

    private void flowEntry(CodeWriter w, CompositeNodeConfig composite, EmissionScheduler scheduler,
            VirtualPin entry, String method, Map<MappedPort, String> pinRefs, Set<MappedPort> required,
            Set<VirtualPin> claimed) {
        GraphModel graph = composite.getSubGraph();
        VarNameAllocator names = new VarNameAllocator(reserved(composite));
        FlowEmitter flow = new FlowEmitter(graph, scheduler, names, pinRefs, required,
                GraphCodeEmitter.typeOverrides(graph));
        CodeWriter body = new CodeWriter();
        if (entry.isMapped())
            flow.emitEntry(entry.getMappedPorts().get(0).nodeId(), body);

        List<VirtualPin> outputs = new ArrayList<>();
        for (VirtualPin pin : composite.outputPins())
            if (pin.isFlow() && !claimed.contains(pin) && mappedInto(pin, flow.emitted()))
                outputs.add(pin);
        List<String> returned = new ArrayList<>();
        for (VirtualPin pin : composite.outputPins()) {
            if (pin.isFlow() || claimed.contains(pin) || !pin.isMapped())
                continue;
            MappedPort producer = pin.getMappedPorts().get(0);
            boolean here = flow.emitted().contains(producer.nodeId())
                    || !isFlowNode(graph, producer.nodeId()) && flow.canCompute(producer.nodeId())
                            && dependsOnFlow(graph, scheduler, producer.nodeId());
            if (!here)
                continue;
            returned.add(flow.ensureValue(producer, body));
            outputs.add(pin);
        }
        claimed.addAll(outputs);
        if (!returned.isEmpty())
            body.line("return " + String.join(", ", returned));

        List<VirtualPin> inputs = new ArrayList<>();
        inputs.add(entry);
        for (VirtualPin pin : composite.inputPins())
            if (!pin.isFlow() && mappedInto(pin, flow.emitted()))
                inputs.add(pin);
        claimed.addAll(inputs);

        w.line("@" + MethodRole.FLOW_ENTRY + "(inputs=" + pinList(inputs) + ", outputs=" + pinList(outputs) + ")");
        w.line(signature(method, inputs));
        if (body.isEmpty())
            body.line("pass");
        w.block(body);
        log.debug("{}: flow entry {} writes {} nodes", composite.getNodeName(), method, flow.emitted().size());
    }

    /** Data method holding every pin no other method declared. */
    private void compute(CodeWriter w, CompositeNodeConfig composite, EmissionScheduler scheduler,
            Map<MappedPort, String> pinRefs, Set<MappedPort> required, Set<VirtualPin> claimed) {
        GraphModel graph = composite.getSubGraph();
        List<VirtualPin> outputs = new ArrayList<>();
        for (VirtualPin pin : composite.outputPins())
            if (!pin.isFlow() && !claimed.contains(pin))
                outputs.add(pin);
        List<VirtualPin> inputs = new ArrayList<>();
        for (VirtualPin pin : composite.inputPins())
            if (!pin.isFlow() && !claimed.contains(pin))
                inputs.add(pin);
        if (outputs.isEmpty() && inputs.isEmpty())
            return;

        VarNameAllocator names = new VarNameAllocator(reserved(composite));
        FlowEmitter flow = new FlowEmitter(graph, scheduler, names, pinRefs, required,
                GraphCodeEmitter.typeOverrides(graph));
        CodeWriter body = new CodeWriter();
        List<String> returned = new ArrayList<>();
        List<String> unmapped = new ArrayList<>();
        for (VirtualPin pin : outputs) {
            MappedPort producer = pin.isMapped() ? pin.getMappedPorts().get(0) : null;
            if (producer != null && !isFlowNode(graph, producer.nodeId()) && flow.canCompute(producer.nodeId())) {
                returned.add(flow.ensureValue(producer, body));
            } else {
                if (producer != null)
                    log.warn("{}: output pin '{}' reads '{}' which no flow entry runs; written as unmapped",
                            composite.getNodeName(), pin.getName(), producer);
                returned.add("None");
                unmapped.add(pin.getName());
            }
        }
        for (VirtualPin pin : composite.inputPins())
            if (!pin.isFlow() && !inputs.contains(pin) && mappedInto(pin, flow.emitted()))
                inputs.add(pin);
        if (!returned.isEmpty())
            body.line("return " + String.join(", ", returned)
                    + (unmapped.isEmpty() ? "" : "  # unmapped: " + String.join(", ", unmapped)));
        if (body.isEmpty())
            body.line("pass");

        w.blank();
        w.line("@" + MethodRole.DATA_METHOD + "(inputs=" + pinList(inputs) + ", outputs=" + pinList(outputs) + ")");
        w.line(signature(COMPUTE, inputs));
        w.block(body);
    }

    private Set<String> reserved(CompositeNodeConfig composite) {
        Set<String> names = new HashSet<>(reserved);
        for (VirtualPin pin : composite.inputPins())
            if (!pin.isFlow())
                names.add(pin.getName());
        return names;
    }

    private static String signature(String method, List<VirtualPin> inputs) {
        StringBuilder sb = new StringBuilder("def ").append(method).append("(self");
        for (VirtualPin pin : inputs)
            if (!pin.isFlow())
                sb.append(", ").append(pin.getName());
        return sb.append("):").toString();
    }

    /** {@code [("name", "Type"), ...]} */
    static String pinList(List<VirtualPin> pins) {
        List<String> items = new ArrayList<>();
        for (VirtualPin pin : pins)
            items.add("(" + SourcePrinter.quote(pin.getName()) + ", " + SourcePrinter.quote(pin.getType()) + ")");
        return "[" + String.join(", ", items) + "]";
    }

    private static boolean mappedInto(VirtualPin pin, Set<String> nodeIds) {
        for (MappedPort p : pin.getMappedPorts())
            if (nodeIds.contains(p.nodeId()))
                return true;
        return false;
    }

    private static boolean isFlowNode(GraphModel graph, String nodeId) {
        return FlowPorts.isFlowNode(graph.node(nodeId));
    }

    private static boolean dependsOnFlow(GraphModel graph, EmissionScheduler scheduler, String nodeId) {
        for (String dep : scheduler.withDataDependencies(List.of(nodeId)))
            if (FlowPorts.isFlowNode(graph.node(dep)))
                return true;
        return false;
    }
}
