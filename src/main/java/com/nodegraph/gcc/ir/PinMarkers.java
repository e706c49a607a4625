package com.nodegraph.gcc.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.*;

/**
 * In-body pin declarations of a composite method.
 *
 * <p>
 * {@code flow_in(name)}, {@code flow_out(name)}, {@code data_in(name, type)}
 * and {@code data_out(name, type, variable=...)} declare pins; they never
 * become nodes. Name and type may be given positionally or as keywords.
 */
public record PinMarkers(List<PinSpec> flowInputs, List<PinSpec> flowOutputs, List<PinSpec> dataInputs,
        List<PinSpec> dataOutputs, Map<String, String> dataOutputVariables) {

    public static final String FLOW_IN = "flow_in";
    public static final String FLOW_OUT = "flow_out";
    public static final String DATA_IN = "data_in";
    public static final String DATA_OUT = "data_out";
    public static final Set<String> NAMES = Set.of(FLOW_IN, FLOW_OUT, DATA_IN, DATA_OUT);

    public static boolean isMarker(Call call) {
        return call.func() instanceof Name n && NAMES.contains(n.id());
    }

    public boolean isEmpty() {
        return flowInputs.isEmpty() && flowOutputs.isEmpty() && dataInputs.isEmpty() && dataOutputs.isEmpty();
    }

    /** Collects markers from a method body, descending into nested blocks. */
    public static PinMarkers collect(List<Stmt> body, String file) {
        PinMarkers m = new PinMarkers(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new LinkedHashMap<>());
        m.walk(body, file);
        return m;
    }

    private void walk(List<Stmt> body, String file) {
        for (Stmt s : body) {
            if (s instanceof ExprStmt es && es.value() instanceof Call c && isMarker(c))
                add(c, file);
            else if (s instanceof If i) {
                walk(i.body(), file);
                walk(i.orelse(), file);
            } else if (s instanceof For f) {
                walk(f.body(), file);
                walk(f.orelse(), file);
            } else if (s instanceof While w) {
                walk(w.body(), file);
            } else if (s instanceof Match mt) {
                for (MatchCase mc : mt.cases())
                    walk(mc.body(), file);
            } else if (s instanceof Try t) {
                walk(t.body(), file);
                for (Handler h : t.handlers())
                    walk(h.body(), file);
                walk(t.orelse(), file);
                walk(t.finalbody(), file);
            }
        }
    }

    private void add(Call c, String file) {
        String kind = ((Name) c.func()).id();
        String name = stringArg(c, 0, "name", file);
        if (name == null)
            throw new GraphParseException(kind + "() requires a pin name", file, c.line());
        switch (kind) {
            case FLOW_IN -> flowInputs.add(PinSpec.flow(name));
            case FLOW_OUT -> flowOutputs.add(PinSpec.flow(name));
            case DATA_IN -> dataInputs.add(new PinSpec(name, typeArg(c, file)));
            case DATA_OUT -> {
                dataOutputs.add(new PinSpec(name, typeArg(c, file)));
                Expr variable = c.keyword("variable");
                if (variable == null && c.args().size() > 2)
                    variable = c.args().get(2);
                if (variable != null) {
                    String var = variable instanceof Constant k && k.kind() == ConstKind.STRING ? k.value()
                            : Ast.dottedName(variable);
                    if (var == null)
                        throw new GraphParseException("data_out variable must be a name", file, c.line());
                    dataOutputVariables.put(name, var);
                }
            }
            default -> throw new IllegalStateException(kind);
        }
    }

    private static String typeArg(Call c, String file) {
        String t = stringArg(c, 1, "type", file);
        return t == null ? PinSpec.GENERIC : t;
    }

    private static String stringArg(Call c, int index, String keyword, String file) {
        Expr e = c.keyword(keyword);
        if (e == null && c.args().size() > index)
            e = c.args().get(index);
        if (e == null)
            return null;
        if (e instanceof Constant k && k.kind() == ConstKind.STRING)
            return k.value();
        throw new GraphParseException("Pin marker argument '" + keyword + "' must be a string literal", file,
                c.line());
    }
}
