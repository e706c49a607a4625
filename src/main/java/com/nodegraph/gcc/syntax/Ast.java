package com.nodegraph.gcc.syntax;

import java.util.List;

/**
 * Syntax tree of Graph Code. Every node carries its 1-based source line.
 */
public final class Ast {
    private Ast() {
        // Namespace
    }

    // --- Expressions ---

    public interface Expr {
        int line();
    }

    public enum ConstKind {
        STRING, INT, FLOAT, BOOL, NONE
    }

    public record Name(String id, int line) implements Expr {
    }

    public record Attribute(Expr value, String attr, int line) implements Expr {
    }

    public record Keyword(String name, Expr value) {
    }

    public record Call(Expr func, List<Expr> args, List<Keyword> keywords, int line) implements Expr {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        public Expr keyword(String name) {
            for (Keyword k : keywords)
                if (k.name().equals(name))
                    return k.value();
            return null;
        }
    }

    /** Literal; {@code value} is the decoded string, the number text, or True/False/None. */
    public record Constant(ConstKind kind, String value, int line) implements Expr {
    }

    public record ListExpr(List<Expr> elts, int line) implements Expr {
        public ListExpr {
            elts = List.copyOf(elts);
        }
    }

    public record TupleExpr(List<Expr> elts, int line) implements Expr {
        public TupleExpr {
            elts = List.copyOf(elts);
        }
    }

    public record UnaryOp(String op, Expr operand, int line) implements Expr {
    }

    public record BinOp(Expr left, String op, Expr right, int line) implements Expr {
    }

    public record BoolOp(String op, List<Expr> values, int line) implements Expr {
        public BoolOp {
            values = List.copyOf(values);
        }
    }

    public record Compare(Expr left, List<String> ops, List<Expr> comparators, int line) implements Expr {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }
    }

    public record Subscript(Expr value, Expr index, int line) implements Expr {
    }

    // --- Statements ---

    public interface Stmt {
        int line();
    }

    public record Module(String docstring, List<Stmt> body) {
        public Module {
            body = List.copyOf(body);
        }
    }

    public record ClassDef(String name, List<Expr> bases, List<Expr> decorators, String docstring,
            List<Stmt> body, int line) implements Stmt {
        public ClassDef {
            bases = List.copyOf(bases);
            decorators = List.copyOf(decorators);
            body = List.copyOf(body);
        }
    }

    public enum ParamKind {
        NORMAL, VAR_POSITIONAL, VAR_KEYWORD
    }

    public record Param(String name, Expr annotation, Expr defaultValue, ParamKind kind) {
    }

    public record FunctionDef(String name, List<Param> params, Expr returns, List<Expr> decorators,
            String docstring, List<Stmt> body, int line) implements Stmt {
        public FunctionDef {
            params = List.copyOf(params);
            decorators = List.copyOf(decorators);
            body = List.copyOf(body);
        }
    }

    /** {@code t1 = t2 = value}; a tuple target is a {@link TupleExpr}. */
    public record Assign(List<Expr> targets, Expr value, int line) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }
    }

    public record AnnAssign(Expr target, Expr annotation, Expr value, int line) implements Stmt {
    }

    public record AugAssign(Expr target, String op, Expr value, int line) implements Stmt {
    }

    public record ExprStmt(Expr value, int line) implements Stmt {
    }

    public record If(Expr test, List<Stmt> body, List<Stmt> orelse, int line) implements Stmt {
        public If {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }
    }

    public record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, int line) implements Stmt {
        public For {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }
    }

    public record While(Expr test, List<Stmt> body, List<Stmt> orelse, int line) implements Stmt {
        public While {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }
    }

    /** A case pattern is a literal, a dotted name, or {@code _}. */
    public record MatchCase(Expr pattern, List<Stmt> body, int line) {
        public MatchCase {
            body = List.copyOf(body);
        }

        public boolean isWildcard() {
            return pattern instanceof Name n && n.id().equals("_");
        }
    }

    public record Match(Expr subject, List<MatchCase> cases, int line) implements Stmt {
        public Match {
            cases = List.copyOf(cases);
        }
    }

    public record Handler(Expr type, String name, List<Stmt> body, int line) {
        public Handler {
            body = List.copyOf(body);
        }
    }

    public record Try(List<Stmt> body, List<Handler> handlers, List<Stmt> orelse, List<Stmt> finalbody,
            int line) implements Stmt {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orelse = List.copyOf(orelse);
            finalbody = List.copyOf(finalbody);
        }
    }

    /** Bare {@code return} has no values. */
    public record Return(List<Expr> values, int line) implements Stmt {
        public Return {
            values = List.copyOf(values);
        }
    }

    public record Pass(int line) implements Stmt {
    }

    public record Break(int line) implements Stmt {
    }

    public record Continue(int line) implements Stmt {
    }

    public record Import(int line) implements Stmt {
    }

    // --- Helpers ---

    /** Dotted name of a Name/Attribute chain, or null for anything else. */
    public static String dottedName(Expr e) {
        if (e instanceof Name n)
            return n.id();
        if (e instanceof Attribute a) {
            String base = dottedName(a.value());
            return base == null ? null : base + "." + a.attr();
        }
        return null;
    }

    /** True for literals and lists/tuples of literals, optionally negated. */
    public static boolean isLiteral(Expr e) {
        if (e instanceof Constant)
            return true;
        if (e instanceof UnaryOp u && (u.op().equals("-") || u.op().equals("+")))
            return u.operand() instanceof Constant c && (c.kind() == ConstKind.INT || c.kind() == ConstKind.FLOAT);
        if (e instanceof ListExpr l)
            return l.elts().stream().allMatch(Ast::isLiteral);
        if (e instanceof TupleExpr t)
            return t.elts().stream().allMatch(Ast::isLiteral);
        return false;
    }
}
