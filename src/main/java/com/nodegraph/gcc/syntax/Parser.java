package com.nodegraph.gcc.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.nodegraph.gcc.syntax.Ast.*;
import com.nodegraph.gcc.syntax.Ast.Module;

/**
 * Recursive-descent parser producing an {@link Ast.Module}.
 *
 * <p>
 * Covers the statement and expression subset Graph Code is written in.
 * Constructs outside it (dictionary and set literals, {@code with},
 * {@code lambda}, starred call arguments) are reported as syntax errors so
 * that nothing is silently dropped.
 */
public final class Parser {
    private static final Set<String> COMPARE_OPS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> AUG_OPS = Set.of("+=", "-=", "*=", "/=", "//=", "%=", "**=", "<<=", ">>=");
    private static final Set<String> UNSUPPORTED = Set.of(
            "with", "lambda", "global", "nonlocal", "del", "assert", "raise", "yield", "async", "await");

    private final List<Token> tokens;
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Module parse(String source) {
        return new Parser(Lexer.tokenize(source)).parseModule();
    }

    /** Parses a single expression, e.g. a stored constant. */
    public static Expr parseExpression(String source) {
        Parser p = new Parser(Lexer.tokenize(source));
        Expr e = p.expression();
        p.skipNewlines();
        if (p.peek().type() != TokenType.EOF)
            throw p.err("Unexpected " + p.peek());
        return e;
    }

    private Module parseModule() {
        List<Stmt> body = new ArrayList<>();
        skipNewlines();
        while (peek().type() != TokenType.EOF) {
            body.addAll(statement());
            skipNewlines();
        }
        String doc = docstringOf(body);
        return new Module(doc, doc == null ? body : body.subList(1, body.size()));
    }

    // --- Statements ---

    private List<Stmt> statement() {
        Token t = peek();
        if (t.isOp("@"))
            return List.of(decorated());
        if (t.type() == TokenType.NAME) {
            switch (t.text()) {
                case "def":
                    return List.of(functionDef(List.of()));
                case "class":
                    return List.of(classDef(List.of()));
                case "if":
                    return List.of(ifStmt());
                case "for":
                    return List.of(forStmt());
                case "while":
                    return List.of(whileStmt());
                case "try":
                    return List.of(tryStmt());
                default:
                    if (UNSUPPORTED.contains(t.text()))
                        throw err("Unsupported statement '" + t.text() + "'");
                    if (isSoftKeywordBlock("match"))
                        return List.of(matchStmt());
            }
        }
        return simpleStatements();
    }

    private Stmt decorated() {
        List<Expr> decorators = new ArrayList<>();
        while (peek().isOp("@")) {
            next();
            decorators.add(expression());
            expect(TokenType.NEWLINE);
            skipNewlines();
        }
        if (peek().isName("def"))
            return functionDef(decorators);
        if (peek().isName("class"))
            return classDef(decorators);
        throw err("Expected 'def' or 'class' after decorator");
    }

    private FunctionDef functionDef(List<Expr> decorators) {
        int line = expectName("def").line();
        String name = expect(TokenType.NAME).text();
        expectOp("(");
        List<Param> params = new ArrayList<>();
        while (!peek().isOp(")")) {
            params.add(param());
            if (!peek().isOp(")"))
                expectOp(",");
        }
        expectOp(")");
        Expr returns = null;
        if (peek().isOp("->")) {
            next();
            returns = expression();
        }
        List<Stmt> body = suite();
        String doc = docstringOf(body);
        return new FunctionDef(name, params, returns, decorators, doc,
                doc == null ? body : body.subList(1, body.size()), line);
    }

    private Param param() {
        ParamKind kind = ParamKind.NORMAL;
        if (peek().isOp("**")) {
            next();
            kind = ParamKind.VAR_KEYWORD;
        } else if (peek().isOp("*")) {
            next();
            if (peek().isOp(",") || peek().isOp(")"))
                return new Param("*", null, null, ParamKind.VAR_POSITIONAL);
            kind = ParamKind.VAR_POSITIONAL;
        } else if (peek().isOp("/")) {
            next();
            return new Param("/", null, null, ParamKind.NORMAL);
        }
        String name = expect(TokenType.NAME).text();
        Expr annotation = null, defaultValue = null;
        if (peek().isOp(":")) {
            next();
            annotation = expression();
        }
        if (peek().isOp("=")) {
            next();
            defaultValue = expression();
        }
        return new Param(name, annotation, defaultValue, kind);
    }

    private ClassDef classDef(List<Expr> decorators) {
        int line = expectName("class").line();
        String name = expect(TokenType.NAME).text();
        List<Expr> bases = new ArrayList<>();
        if (peek().isOp("(")) {
            next();
            while (!peek().isOp(")")) {
                bases.add(expression());
                if (!peek().isOp(")"))
                    expectOp(",");
            }
            expectOp(")");
        }
        List<Stmt> body = suite();
        String doc = docstringOf(body);
        return new ClassDef(name, bases, decorators, doc, doc == null ? body : body.subList(1, body.size()), line);
    }

    private If ifStmt() {
        int line = next().line(); // 'if' or 'elif'
        Expr test = expression();
        List<Stmt> body = suite();
        List<Stmt> orelse = List.of();
        if (peek().isName("elif")) {
            orelse = List.of(ifStmt());
        } else if (peek().isName("else")) {
            next();
            orelse = suite();
        }
        return new If(test, body, orelse, line);
    }

    private For forStmt() {
        int line = expectName("for").line();
        Expr target = targetList();
        expectName("in");
        Expr iter = expressionList();
        List<Stmt> body = suite();
        List<Stmt> orelse = List.of();
        if (peek().isName("else")) {
            next();
            orelse = suite();
        }
        return new For(target, iter, body, orelse, line);
    }

    private While whileStmt() {
        int line = expectName("while").line();
        Expr test = expression();
        List<Stmt> body = suite();
        List<Stmt> orelse = List.of();
        if (peek().isName("else")) {
            next();
            orelse = suite();
        }
        return new While(test, body, orelse, line);
    }

    private Try tryStmt() {
        int line = expectName("try").line();
        List<Stmt> body = suite();
        List<Handler> handlers = new ArrayList<>();
        while (peek().isName("except")) {
            int hl = next().line();
            Expr type = null;
            String name = null;
            if (!peek().isOp(":")) {
                type = expression();
                if (peek().isName("as")) {
                    next();
                    name = expect(TokenType.NAME).text();
                }
            }
            handlers.add(new Handler(type, name, suite(), hl));
        }
        List<Stmt> orelse = List.of(), finalbody = List.of();
        if (peek().isName("else")) {
            next();
            orelse = suite();
        }
        if (peek().isName("finally")) {
            next();
            finalbody = suite();
        }
        if (handlers.isEmpty() && finalbody.isEmpty())
            throw err("Expected 'except' or 'finally'");
        return new Try(body, handlers, orelse, finalbody, line);
    }

    private Match matchStmt() {
        int line = expectName("match").line();
        Expr subject = expressionList();
        expectOp(":");
        expect(TokenType.NEWLINE);
        skipNewlines();
        expect(TokenType.INDENT);
        List<MatchCase> cases = new ArrayList<>();
        while (!peek().is(TokenType.DEDENT, "") && peek().type() != TokenType.EOF) {
            Token c = expectName("case");
            Expr pattern = casePattern();
            if (peek().isName("if"))
                throw err("Case guards are not supported");
            cases.add(new MatchCase(pattern, suite(), c.line()));
            skipNewlines();
        }
        expect(TokenType.DEDENT);
        if (cases.isEmpty())
            throw err("Match statement without cases");
        return new Match(subject, cases, line);
    }

    private Expr casePattern() {
        Expr p = unary();
        if (peek().isOp("|"))
            throw err("Alternative case patterns are not supported");
        if (p instanceof Constant || Ast.isLiteral(p) || Ast.dottedName(p) != null)
            return p;
        throw new GraphSyntaxException("Unsupported case pattern", p.line(), 1);
    }

    private List<Stmt> suite() {
        expectOp(":");
        if (peek().type() != TokenType.NEWLINE) {
            List<Stmt> inline = simpleStatements();
            return inline;
        }
        next();
        skipNewlines();
        expect(TokenType.INDENT);
        List<Stmt> body = new ArrayList<>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.EOF) {
            body.addAll(statement());
            skipNewlines();
        }
        expect(TokenType.DEDENT);
        return body;
    }

    /** One or more {@code ;}-separated simple statements ending the logical line. */
    private List<Stmt> simpleStatements() {
        List<Stmt> out = new ArrayList<>();
        out.add(simpleStatement());
        while (peek().isOp(";")) {
            next();
            if (peek().type() == TokenType.NEWLINE)
                break;
            out.add(simpleStatement());
        }
        expect(TokenType.NEWLINE);
        return out;
    }

    private Stmt simpleStatement() {
        Token t = peek();
        if (t.type() == TokenType.NAME) {
            switch (t.text()) {
                case "pass":
                    next();
                    return new Pass(t.line());
                case "break":
                    next();
                    return new Break(t.line());
                case "continue":
                    next();
                    return new Continue(t.line());
                case "return": {
                    next();
                    if (peek().type() == TokenType.NEWLINE || peek().isOp(";"))
                        return new Return(List.of(), t.line());
                    Expr v = expressionList();
                    return new Return(v instanceof TupleExpr tu ? tu.elts() : List.of(v), t.line());
                }
                case "import":
                case "from":
                    while (peek().type() != TokenType.NEWLINE && !peek().isOp(";"))
                        next();
                    return new Import(t.line());
                default:
                    if (UNSUPPORTED.contains(t.text()))
                        throw err("Unsupported statement '" + t.text() + "'");
            }
        }
        Expr first = expressionList();
        if (peek().isOp(":")) {
            next();
            Expr annotation = expression();
            Expr value = null;
            if (peek().isOp("=")) {
                next();
                value = expressionList();
            }
            checkTarget(first);
            return new AnnAssign(first, annotation, value, t.line());
        }
        if (peek().type() == TokenType.OP && AUG_OPS.contains(peek().text())) {
            String op = next().text();
            checkTarget(first);
            return new AugAssign(first, op, expressionList(), t.line());
        }
        if (peek().isOp("=")) {
            List<Expr> targets = new ArrayList<>();
            Expr value = first;
            while (peek().isOp("=")) {
                next();
                checkTarget(value);
                targets.add(value);
                value = expressionList();
            }
            return new Assign(targets, value, t.line());
        }
        return new ExprStmt(first, t.line());
    }

    private void checkTarget(Expr e) {
        if (e instanceof Name || e instanceof Attribute || e instanceof Subscript)
            return;
        if (e instanceof TupleExpr tu) {
            tu.elts().forEach(this::checkTarget);
            return;
        }
        throw new GraphSyntaxException("Cannot assign to expression", e.line(), 1);
    }

    private Expr targetList() {
        int line = peek().line();
        List<Expr> elts = new ArrayList<>();
        elts.add(bitOr());
        while (peek().isOp(",")) {
            next();
            if (peek().isName("in"))
                break;
            elts.add(bitOr());
        }
        Expr target = elts.size() == 1 ? elts.get(0) : new TupleExpr(elts, line);
        checkTarget(target);
        return target;
    }

    // --- Expressions ---

    /** Comma-separated expressions; more than one (or a trailing comma) forms a tuple. */
    private Expr expressionList() {
        int line = peek().line();
        Expr first = expression();
        if (!peek().isOp(","))
            return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (peek().isOp(",")) {
            next();
            if (atExpressionEnd())
                break;
            elts.add(expression());
        }
        return new TupleExpr(elts, line);
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        return t.type() == TokenType.NEWLINE || t.type() == TokenType.EOF
                || t.isOp("=") || t.isOp(")") || t.isOp("]") || t.isOp(":") || t.isOp(";");
    }

    private Expr expression() {
        Token t = peek();
        if (t.isName("lambda"))
            throw err("Unsupported expression 'lambda'");
        Expr e = orTest();
        if (peek().isName("if"))
            throw err("Conditional expressions are not supported");
        return e;
    }

    private Expr orTest() {
        Expr left = andTest();
        if (!peek().isName("or"))
            return left;
        List<Expr> values = new ArrayList<>();
        values.add(left);
        while (peek().isName("or")) {
            next();
            values.add(andTest());
        }
        return new BoolOp("or", values, left.line());
    }

    private Expr andTest() {
        Expr left = notTest();
        if (!peek().isName("and"))
            return left;
        List<Expr> values = new ArrayList<>();
        values.add(left);
        while (peek().isName("and")) {
            next();
            values.add(notTest());
        }
        return new BoolOp("and", values, left.line());
    }

    private Expr notTest() {
        if (peek().isName("not")) {
            int line = next().line();
            return new UnaryOp("not", notTest(), line);
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = bitOr();
        List<String> ops = new ArrayList<>();
        List<Expr> rights = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op = null;
            if (t.type() == TokenType.OP && COMPARE_OPS.contains(t.text())) {
                op = next().text();
            } else if (t.isName("in")) {
                next();
                op = "in";
            } else if (t.isName("not") && peekAt(1).isName("in")) {
                next();
                next();
                op = "not in";
            } else if (t.isName("is")) {
                next();
                op = "is";
                if (peek().isName("not")) {
                    next();
                    op = "is not";
                }
            }
            if (op == null)
                break;
            ops.add(op);
            rights.add(bitOr());
        }
        return ops.isEmpty() ? left : new Compare(left, ops, rights, left.line());
    }

    private Expr bitOr() {
        Expr left = arith();
        while (peek().isOp("|") || peek().isOp("&") || peek().isOp("^")) {
            String op = next().text();
            left = new BinOp(left, op, arith(), left.line());
        }
        return left;
    }

    private Expr arith() {
        Expr left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            String op = next().text();
            left = new BinOp(left, op, term(), left.line());
        }
        return left;
    }

    private Expr term() {
        Expr left = unary();
        while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%")) {
            String op = next().text();
            left = new BinOp(left, op, unary(), left.line());
        }
        return left;
    }

    private Expr unary() {
        Token t = peek();
        if (t.isOp("-") || t.isOp("+") || t.isOp("~")) {
            next();
            return new UnaryOp(t.text(), unary(), t.line());
        }
        return power();
    }

    private Expr power() {
        Expr base = primary();
        if (peek().isOp("**")) {
            next();
            return new BinOp(base, "**", unary(), base.line());
        }
        return base;
    }

    private Expr primary() {
        Expr e = atom();
        while (true) {
            Token t = peek();
            if (t.isOp(".")) {
                next();
                e = new Attribute(e, expect(TokenType.NAME).text(), t.line());
            } else if (t.isOp("(")) {
                e = callTrailer(e);
            } else if (t.isOp("[")) {
                next();
                Expr index = expressionList();
                expectOp("]");
                e = new Subscript(e, index, t.line());
            } else {
                return e;
            }
        }
    }

    private Call callTrailer(Expr func) {
        int line = expectOp("(").line();
        List<Expr> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        while (!peek().isOp(")")) {
            if (peek().isOp("*") || peek().isOp("**"))
                throw err("Starred call arguments are not supported");
            if (peek().type() == TokenType.NAME && peekAt(1).isOp("=")) {
                String name = next().text();
                next();
                for (Keyword k : keywords)
                    if (k.name().equals(name))
                        throw err("Duplicate keyword argument '" + name + "'");
                keywords.add(new Keyword(name, expression()));
            } else {
                if (!keywords.isEmpty())
                    throw err("Positional argument follows keyword argument");
                args.add(expression());
            }
            if (!peek().isOp(")"))
                expectOp(",");
        }
        expectOp(")");
        return new Call(func, args, keywords, line);
    }

    private Expr atom() {
        Token t = next();
        switch (t.type()) {
            case NAME -> {
                return switch (t.text()) {
                    case "True", "False" -> new Constant(ConstKind.BOOL, t.text(), t.line());
                    case "None" -> new Constant(ConstKind.NONE, "None", t.line());
                    default -> {
                        if (Set.of("def", "class", "if", "else", "elif", "for", "while", "return", "in", "is",
                                "and", "or", "not", "pass", "break", "continue", "try", "except", "finally",
                                "import", "from", "as").contains(t.text()) || UNSUPPORTED.contains(t.text()))
                            throw new GraphSyntaxException("Unexpected keyword '" + t.text() + "'", t.line(), t.column());
                        yield new Name(t.text(), t.line());
                    }
                };
            }
            case NUMBER -> {
                String text = t.text();
                boolean isFloat = !text.startsWith("0x") && !text.startsWith("0X")
                        && (text.contains(".") || text.contains("e") || text.contains("E"));
                return new Constant(isFloat ? ConstKind.FLOAT : ConstKind.INT, text, t.line());
            }
            case STRING -> {
                StringBuilder sb = new StringBuilder(t.text());
                while (peek().type() == TokenType.STRING)
                    sb.append(next().text());
                return new Constant(ConstKind.STRING, sb.toString(), t.line());
            }
            case OP -> {
                switch (t.text()) {
                    case "(" -> {
                        if (peek().isOp(")")) {
                            next();
                            return new TupleExpr(List.of(), t.line());
                        }
                        Expr inner = expressionList();
                        expectOp(")");
                        return inner;
                    }
                    case "[" -> {
                        List<Expr> elts = new ArrayList<>();
                        while (!peek().isOp("]")) {
                            elts.add(expression());
                            if (!peek().isOp("]"))
                                expectOp(",");
                        }
                        expectOp("]");
                        return new ListExpr(elts, t.line());
                    }
                    case "{" -> throw new GraphSyntaxException("Dictionary and set literals are not supported",
                            t.line(), t.column());
                    default -> throw new GraphSyntaxException("Unexpected " + t, t.line(), t.column());
                }
            }
            default -> throw new GraphSyntaxException("Unexpected " + t, t.line(), t.column());
        }
    }

    // --- Token helpers ---

    /** {@code match}/{@code case} are keywords only when they open a block. */
    private boolean isSoftKeywordBlock(String word) {
        if (!peek().isName(word))
            return false;
        Token after = peekAt(1);
        if (after.type() == TokenType.NEWLINE || after.type() == TokenType.EOF)
            return false;
        if (after.type() == TokenType.OP && (after.text().equals("=") || after.text().equals(".")
                || after.text().equals(":") || AUG_OPS.contains(after.text())))
            return false;
        int depth = 0;
        for (int i = pos + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.NEWLINE || t.type() == TokenType.EOF)
                return false;
            if (t.isOp("(") || t.isOp("["))
                depth++;
            else if (t.isOp(")") || t.isOp("]"))
                depth--;
            else if (depth == 0 && t.isOp(":"))
                return tokens.get(i + 1).type() == TokenType.NEWLINE;
        }
        return false;
    }

    private static String docstringOf(List<Stmt> body) {
        if (!body.isEmpty() && body.get(0) instanceof ExprStmt es && es.value() instanceof Constant c
                && c.kind() == ConstKind.STRING)
            return c.value();
        return null;
    }

    private void skipNewlines() {
        while (peek().type() == TokenType.NEWLINE)
            pos++;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF)
            pos++;
        return t;
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (t.type() != type)
            throw err("Expected " + type.name().toLowerCase() + " but found " + t);
        return next();
    }

    private Token expectOp(String op) {
        if (!peek().isOp(op))
            throw err("Expected '" + op + "' but found " + peek());
        return next();
    }

    private Token expectName(String kw) {
        if (!peek().isName(kw))
            throw err("Expected '" + kw + "' but found " + peek());
        return next();
    }

    private GraphSyntaxException err(String msg) {
        Token t = peek();
        return new GraphSyntaxException(msg, t.line(), t.column());
    }
}
