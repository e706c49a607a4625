package com.nodegraph.gcc.syntax;

import java.util.List;
import java.util.stream.Collectors;

import com.nodegraph.gcc.syntax.Ast.*;

/**
 * Renders expressions back to canonical Graph Code text. Strings always use
 * double quotes, so equal literals print identically.
 */
public final class SourcePrinter {
    private SourcePrinter() {
        // Utility class
    }

    public static String print(Expr e) {
        return print(e, 0);
    }

    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static int precedence(Expr e) {
        if (e instanceof BoolOp b)
            return b.op().equals("or") ? 1 : 2;
        if (e instanceof UnaryOp u && u.op().equals("not"))
            return 3;
        if (e instanceof Compare)
            return 4;
        if (e instanceof BinOp b) {
            return switch (b.op()) {
                case "|", "&", "^" -> 5;
                case "+", "-" -> 6;
                case "**" -> 9;
                default -> 7;
            };
        }
        if (e instanceof UnaryOp)
            return 8;
        return 10;
    }

    private static String print(Expr e, int minPrec) {
        String text = render(e);
        return precedence(e) < minPrec ? "(" + text + ")" : text;
    }

    private static String render(Expr e) {
        if (e instanceof Name n)
            return n.id();
        if (e instanceof Constant c)
            return c.kind() == ConstKind.STRING ? quote(c.value()) : c.value();
        if (e instanceof Attribute a)
            return print(a.value(), 10) + "." + a.attr();
        if (e instanceof Call c) {
            StringBuilder sb = new StringBuilder(print(c.func(), 10)).append('(');
            String args = c.args().stream().map(SourcePrinter::print).collect(Collectors.joining(", "));
            sb.append(args);
            for (Keyword k : c.keywords()) {
                if (sb.charAt(sb.length() - 1) != '(')
                    sb.append(", ");
                sb.append(k.name()).append('=').append(print(k.value()));
            }
            return sb.append(')').toString();
        }
        if (e instanceof ListExpr l)
            return "[" + join(l.elts()) + "]";
        if (e instanceof TupleExpr t)
            return t.elts().size() == 1 ? "(" + print(t.elts().get(0)) + ",)" : "(" + join(t.elts()) + ")";
        if (e instanceof UnaryOp u) {
            int p = precedence(u);
            return u.op().equals("not") ? "not " + print(u.operand(), p) : u.op() + print(u.operand(), p);
        }
        if (e instanceof BinOp b) {
            int p = precedence(b);
            return print(b.left(), p) + " " + b.op() + " " + print(b.right(), p + 1);
        }
        if (e instanceof BoolOp b) {
            int p = precedence(b);
            return b.values().stream().map(v -> print(v, p + 1)).collect(Collectors.joining(" " + b.op() + " "));
        }
        if (e instanceof Compare c) {
            StringBuilder sb = new StringBuilder(print(c.left(), 5));
            for (int i = 0; i < c.ops().size(); i++)
                sb.append(' ').append(c.ops().get(i)).append(' ').append(print(c.comparators().get(i), 5));
            return sb.toString();
        }
        if (e instanceof Subscript s)
            return print(s.value(), 10) + "[" + print(s.index()) + "]";
        throw new IllegalArgumentException("Unsupported expression: " + e);
    }

    private static String join(List<Expr> elts) {
        return elts.stream().map(SourcePrinter::print).collect(Collectors.joining(", "));
    }
}
