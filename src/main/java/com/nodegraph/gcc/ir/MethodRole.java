package com.nodegraph.gcc.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.*;

/**
 * Role of a graph method, decided from its decorator at parse time.
 *
 * <p>
 * Each role owns its pin-derivation strategy: explicit pin lists from the
 * decorator are used verbatim, otherwise pins are derived from the method
 * signature and the in-body {@link PinMarkers}.
 */
public sealed interface MethodRole permits MethodRole.FlowEntry, MethodRole.EventHandler, MethodRole.DataMethod {

    String FLOW_ENTRY = "flow_entry";
    String EVENT_HANDLER = "event_handler";
    String DATA_METHOD = "data_method";
    String EVENT_PREFIX = "on_";

    enum Kind {
        FLOW_ENTRY, EVENT_HANDLER, DATA_METHOD
    }

    /** What a method offers for pin derivation. */
    record MethodShape(List<PinSpec> signature, PinMarkers markers, List<String> returnNames) {
    }

    record PinSet(List<PinSpec> inputs, List<PinSpec> outputs) {
    }

    Kind kind();

    PinSet derivePins(MethodShape shape);

    /** Entry point of a composite, sequenced from its flow-in pin. */
    record FlowEntry(List<PinSpec> explicitInputs, List<PinSpec> explicitOutputs, boolean internal)
            implements MethodRole {
        @Override
        public Kind kind() {
            return Kind.FLOW_ENTRY;
        }

        @Override
        public PinSet derivePins(MethodShape shape) {
            List<PinSpec> in = explicitInputs;
            if (in == null) {
                in = new ArrayList<>(shape.markers().flowInputs().isEmpty()
                        ? List.of(PinSpec.flow(FlowPorts.FLOW_IN))
                        : shape.markers().flowInputs());
                in.addAll(mergeInputs(shape));
            }
            List<PinSpec> out = explicitOutputs;
            if (out == null) {
                out = new ArrayList<>(shape.markers().flowOutputs().isEmpty()
                        ? List.of(PinSpec.flow(FlowPorts.FLOW_OUT))
                        : shape.markers().flowOutputs());
                out.addAll(dataOutputs(shape));
            }
            return new PinSet(List.copyOf(in), List.copyOf(out));
        }
    }

    /** Handler started by a named event; its parameters are the event's outputs. */
    record EventHandler(String event, List<PinSpec> explicitOutputs, boolean exposeEventParams)
            implements MethodRole {
        @Override
        public Kind kind() {
            return Kind.EVENT_HANDLER;
        }

        @Override
        public PinSet derivePins(MethodShape shape) {
            List<PinSpec> out = explicitOutputs;
            if (out == null) {
                out = new ArrayList<>(shape.markers().flowOutputs().isEmpty()
                        ? List.of(PinSpec.flow(FlowPorts.FLOW_OUT))
                        : shape.markers().flowOutputs());
                out.addAll(shape.markers().dataOutputs());
                if (exposeEventParams)
                    out.addAll(shape.signature());
            }
            return new PinSet(List.of(), List.copyOf(out));
        }
    }

    /** Pure data computation: no flow pins. */
    record DataMethod(List<PinSpec> explicitInputs, List<PinSpec> explicitOutputs) implements MethodRole {
        @Override
        public Kind kind() {
            return Kind.DATA_METHOD;
        }

        @Override
        public PinSet derivePins(MethodShape shape) {
            List<PinSpec> in = explicitInputs != null ? explicitInputs : mergeInputs(shape);
            List<PinSpec> out = explicitOutputs != null ? explicitOutputs : dataOutputs(shape);
            return new PinSet(List.copyOf(in), List.copyOf(out));
        }
    }

    /** Signature parameters merged with {@code data_in} markers; marker types win. */
    private static List<PinSpec> mergeInputs(MethodShape shape) {
        Map<String, PinSpec> merged = new LinkedHashMap<>();
        for (PinSpec p : shape.signature())
            merged.put(p.name(), p);
        for (PinSpec p : shape.markers().dataInputs())
            merged.put(p.name(), p);
        return new ArrayList<>(merged.values());
    }

    private static List<PinSpec> dataOutputs(MethodShape shape) {
        if (!shape.markers().dataOutputs().isEmpty())
            return shape.markers().dataOutputs();
        List<PinSpec> out = new ArrayList<>();
        for (String n : shape.returnNames())
            out.add(new PinSpec(n, PinSpec.GENERIC));
        return out;
    }

    /**
     * Reads the role of a method from its decorators. Undecorated
     * {@code on_<Event>} methods are event handlers; other undecorated methods
     * have no role and yield null.
     */
    static MethodRole of(FunctionDef fd, String file) {
        MethodRole role = null;
        for (Expr d : fd.decorators()) {
            String name = d instanceof Call c ? Ast.dottedName(c.func()) : Ast.dottedName(d);
            if (name == null || !(name.equals(FLOW_ENTRY) || name.equals(EVENT_HANDLER) || name.equals(DATA_METHOD)))
                continue;
            if (role != null)
                throw new GraphParseException("Method '" + fd.name() + "' has more than one role marker", file,
                        fd.line());
            Call call = d instanceof Call c ? c : null;
            if (call != null && !call.args().isEmpty() && !name.equals(EVENT_HANDLER))
                throw new GraphParseException("@" + name + " accepts keyword arguments only", file, d.line());
            role = switch (name) {
                case FLOW_ENTRY -> {
                    checkKeywords(call, file, "inputs", "outputs", "internal");
                    yield new FlowEntry(pinList(call, "inputs", file), pinList(call, "outputs", file),
                            boolArg(call, "internal", file));
                }
                case EVENT_HANDLER -> {
                    checkKeywords(call, file, "event", "outputs", "expose_event_params");
                    String event = eventName(call, fd, file);
                    yield new EventHandler(event, pinList(call, "outputs", file),
                            boolArg(call, "expose_event_params", file));
                }
                default -> {
                    checkKeywords(call, file, "inputs", "outputs");
                    yield new DataMethod(pinList(call, "inputs", file), pinList(call, "outputs", file));
                }
            };
        }
        if (role == null && fd.name().startsWith(EVENT_PREFIX) && fd.name().length() > EVENT_PREFIX.length())
            role = new EventHandler(fd.name().substring(EVENT_PREFIX.length()), null, false);
        return role;
    }

    private static void checkKeywords(Call call, String file, String... allowed) {
        if (call == null)
            return;
        for (Keyword k : call.keywords())
            if (!List.of(allowed).contains(k.name()))
                throw new GraphParseException("Unknown role marker argument '" + k.name() + "'", file, call.line());
    }

    private static String eventName(Call call, FunctionDef fd, String file) {
        Expr e = call == null ? null : call.keyword("event");
        if (e == null && call != null && !call.args().isEmpty())
            e = call.args().get(0);
        if (e == null) {
            if (fd.name().startsWith(EVENT_PREFIX) && fd.name().length() > EVENT_PREFIX.length())
                return fd.name().substring(EVENT_PREFIX.length());
            throw new GraphParseException("@event_handler on '" + fd.name() + "' needs event=...", file, fd.line());
        }
        if (e instanceof Constant c && c.kind() == ConstKind.STRING && !c.value().isBlank())
            return c.value();
        throw new GraphParseException("Event name must be a non-empty string literal", file, fd.line());
    }

    private static boolean boolArg(Call call, String key, String file) {
        Expr e = call == null ? null : call.keyword(key);
        if (e == null)
            return false;
        if (e instanceof Constant c && c.kind() == ConstKind.BOOL)
            return c.value().equals("True");
        throw new GraphParseException("'" + key + "' must be True or False", file, call.line());
    }

    /** {@code [("name", "Type"), "name", ...]}; null when the keyword is absent. */
    private static List<PinSpec> pinList(Call call, String key, String file) {
        Expr e = call == null ? null : call.keyword(key);
        if (e == null)
            return null;
        List<Expr> items;
        if (e instanceof ListExpr l)
            items = l.elts();
        else if (e instanceof TupleExpr t)
            items = t.elts();
        else
            throw new GraphParseException("'" + key + "' must be a list of pins", file, call.line());
        List<PinSpec> pins = new ArrayList<>();
        for (Expr item : items) {
            if (item instanceof Constant c && c.kind() == ConstKind.STRING) {
                pins.add(new PinSpec(c.value(), PinSpec.GENERIC));
            } else if (item instanceof TupleExpr t && t.elts().size() == 2
                    && t.elts().get(0) instanceof Constant n && n.kind() == ConstKind.STRING
                    && t.elts().get(1) instanceof Constant ty && ty.kind() == ConstKind.STRING) {
                pins.add(new PinSpec(n.value(), ty.value()));
            } else {
                throw new GraphParseException("Malformed pin in '" + key + "': expected (\"name\", \"Type\")", file,
                        item.line());
            }
        }
        return pins;
    }
}
