package com.nodegraph.gcc.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.nodegraph.gcc.core.FlowPorts;
import com.nodegraph.gcc.core.Node;
import com.nodegraph.gcc.syntax.Ast;
import com.nodegraph.gcc.syntax.Ast.Expr;
import com.nodegraph.gcc.syntax.GraphSyntaxException;
import com.nodegraph.gcc.syntax.Parser;
import com.nodegraph.gcc.syntax.SourcePrinter;
import com.nodegraph.gcc.util.Identifiers;

/**
 * Renders a node as a call expression.
 *
 * <p>
 * Indexed ports ({@code 0, 1, ...}) and key/value pairs
 * ({@code key_0, value_0, ...}) come first, positionally, in ascending index
 * order. Named ports follow as keyword arguments when every named port is a
 * legal identifier; otherwise all named ports are passed positionally, with
 * {@code None} for ports without a value.
 */
public final class CallRenderer {
    private static final Pattern INDEXED = Pattern.compile("\\d+");
    private static final Pattern KEY_VALUE = Pattern.compile("(key|value)_(\\d+)");
    private static final String NONE = "None";

    private CallRenderer() {
        // Utility class
    }

    /**
     * @param values port name to rendered value, null when the port has none
     */
    public static String render(Node node, Function<String, String> values) {
        TreeMap<Integer, String> indexed = new TreeMap<>();
        TreeMap<Integer, String[]> pairs = new TreeMap<>();
        List<String> named = new ArrayList<>();
        for (String port : FlowPorts.dataInputs(node)) {
            Matcher kv = KEY_VALUE.matcher(port);
            if (INDEXED.matcher(port).matches()) {
                indexed.put(Integer.parseInt(port), port);
            } else if (kv.matches()) {
                String[] pair = pairs.computeIfAbsent(Integer.parseInt(kv.group(2)), k -> new String[2]);
                pair[kv.group(1).equals("key") ? 0 : 1] = port;
            } else {
                named.add(port);
            }
        }

        List<String> args = new ArrayList<>();
        for (String port : indexed.values())
            args.add(orNone(values.apply(port)));
        for (String[] pair : pairs.values()) {
            args.add(pair[0] == null ? NONE : orNone(values.apply(pair[0])));
            args.add(pair[1] == null ? NONE : orNone(values.apply(pair[1])));
        }

        boolean keywordForm = named.stream().allMatch(Identifiers::isSafeName);
        if (keywordForm) {
            for (String port : named) {
                String v = values.apply(port);
                if (v != null)
                    args.add(port + "=" + v);
            }
        } else {
            List<String> positional = new ArrayList<>();
            for (String port : named)
                positional.add(values.apply(port));
            while (!positional.isEmpty() && positional.get(positional.size() - 1) == null)
                positional.remove(positional.size() - 1);
            if (!positional.isEmpty() && (!indexed.isEmpty() || !pairs.isEmpty()))
                throw new GenerationException("'" + node.getTitle() + "' mixes indexed ports with port names"
                        + " that are not identifiers " + named, node.getId());
            for (String v : positional)
                args.add(orNone(v));
        }
        return callee(node) + "(" + String.join(", ", args) + ")";
    }

    /** Callable name of a node title. */
    public static String callee(Node node) {
        String title = node.getTitle();
        if (Identifiers.isSafeName(title))
            return title;
        String slashless = title.replace("/", "");
        if (Identifiers.isSafeName(slashless))
            return slashless;
        throw new GenerationException("Node title '" + title + "' cannot be written as a call", node.getId());
    }

    /**
     * Source text of a stored constant. Text that is not a literal, such as
     * a bare word typed into an editor, is written as a string.
     */
    public static String literal(String constant) {
        if (constant == null)
            return null;
        try {
            Expr e = Parser.parseExpression(constant);
            return Ast.isLiteral(e) ? SourcePrinter.print(e) : SourcePrinter.quote(constant);
        } catch (GraphSyntaxException e) {
            return SourcePrinter.quote(constant);
        }
    }

    private static String orNone(String v) {
        return v == null ? NONE : v;
    }
}
