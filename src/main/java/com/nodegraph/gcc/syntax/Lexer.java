package com.nodegraph.gcc.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizer for Graph Code.
 *
 * <p>
 * Indentation is significant: leading whitespace of each logical line is
 * turned into {@code INDENT}/{@code DEDENT} tokens. Newlines inside brackets
 * and after a trailing backslash do not end the logical line. Blank and
 * comment-only lines are skipped. Tabs advance to the next multiple of 8.
 */
public final class Lexer {
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", "==", "!=", "<=", ">=", "//", "**", "+=", "-=", "*=", "/=", "%=", ":=", "<<", ">>",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "@", "=", "+", "-", "*", "/", "%",
            "<", ">", "~", "&", "|", "^"
    };

    private final String input;
    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;
    private boolean atLineStart = true;
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final List<Token> tokens = new ArrayList<>();

    private Lexer(String input) {
        this.input = input.replace("\r\n", "\n").replace('\r', '\n');
        indents.push(0);
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).run();
    }

    private List<Token> run() {
        while (pos < input.length()) {
            if (atLineStart && depth == 0) {
                if (handleIndentation())
                    continue;
            }
            char c = input.charAt(pos);
            if (c == '\n') {
                newline();
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }
            if (c == '#') {
                skipComment();
                continue;
            }
            if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
                pos += 2;
                line++;
                lineStart = pos;
                continue;
            }
            if (isStringStart())
                readString();
            else if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1))))
                readNumber();
            else if (c == '_' || Character.isUnicodeIdentifierStart(input.codePointAt(pos)))
                readName();
            else
                readOperator();
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE
                && tokens.get(tokens.size() - 1).type() != TokenType.DEDENT)
            add(TokenType.NEWLINE, "");
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "");
        }
        add(TokenType.EOF, "");
        return tokens;
    }

    /** Measures indentation; returns true when the line was blank and consumed. */
    private boolean handleIndentation() {
        int col = 0;
        int p = pos;
        while (p < input.length()) {
            char c = input.charAt(p);
            if (c == ' ')
                col++;
            else if (c == '\t')
                col = (col / 8 + 1) * 8;
            else if (c == '\f')
                col = 0;
            else
                break;
            p++;
        }
        if (p >= input.length() || input.charAt(p) == '\n' || input.charAt(p) == '#') {
            pos = p;
            if (pos < input.length() && input.charAt(pos) == '#')
                skipComment();
            if (pos < input.length()) {
                pos++;
                line++;
                lineStart = pos;
            }
            return true;
        }
        pos = p;
        atLineStart = false;
        int current = indents.peek();
        if (col > current) {
            indents.push(col);
            add(TokenType.INDENT, "");
        } else if (col < current) {
            while (col < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "");
            }
            if (col != indents.peek())
                throw err("Inconsistent dedent");
        }
        return false;
    }

    private void newline() {
        if (depth == 0 && !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE)
            add(TokenType.NEWLINE, "");
        pos++;
        line++;
        lineStart = pos;
        if (depth == 0)
            atLineStart = true;
    }

    private void skipComment() {
        while (pos < input.length() && input.charAt(pos) != '\n')
            pos++;
    }

    private boolean isStringStart() {
        char c = input.charAt(pos);
        if (c == '"' || c == '\'')
            return true;
        if ((c == 'r' || c == 'R' || c == 'u' || c == 'U') && pos + 1 < input.length()) {
            char n = input.charAt(pos + 1);
            return n == '"' || n == '\'';
        }
        return false;
    }

    private void readString() {
        int startLine = line, startCol = pos - lineStart + 1;
        boolean raw = false;
        char c = input.charAt(pos);
        if (c != '"' && c != '\'') {
            raw = c == 'r' || c == 'R';
            pos++;
        }
        char quote = input.charAt(pos);
        boolean triple = input.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= input.length())
                throw new GraphSyntaxException("Unterminated string", startLine, startCol);
            char ch = input.charAt(pos);
            if (triple) {
                if (input.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            } else if (ch == quote) {
                pos++;
                break;
            } else if (ch == '\n') {
                throw new GraphSyntaxException("Unterminated string", startLine, startCol);
            }
            if (ch == '\\' && pos + 1 < input.length()) {
                char e = input.charAt(pos + 1);
                if (raw) {
                    sb.append(ch).append(e);
                    pos += 2;
                    continue;
                }
                pos += 2;
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    case '\\', '\'', '"' -> sb.append(e);
                    case '\n' -> {
                        line++;
                        lineStart = pos;
                    }
                    case 'u' -> {
                        if (pos + 4 > input.length())
                            throw err("Bad unicode escape");
                        try {
                            sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException ex) {
                            throw err("Bad unicode escape");
                        }
                        pos += 4;
                    }
                    default -> sb.append('\\').append(e);
                }
                continue;
            }
            if (ch == '\n') {
                line++;
                lineStart = pos + 1;
            }
            sb.append(ch);
            pos++;
        }
        tokens.add(new Token(TokenType.STRING, sb.toString(), startLine, startCol));
    }

    private void readNumber() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.')
                pos++;
            else if ((c == '+' || c == '-') && (input.charAt(pos - 1) == 'e' || input.charAt(pos - 1) == 'E')
                    && !input.startsWith("0x", start) && !input.startsWith("0X", start))
                pos++;
            else
                break;
        }
        String text = input.substring(start, pos);
        if (!text.replace("_", "").matches("(0[xX][0-9a-fA-F]+|[0-9]*\\.?[0-9]*([eE][+-]?[0-9]+)?)"))
            throw new GraphSyntaxException("Invalid number literal '" + text + "'", line, start - lineStart + 1);
        tokens.add(new Token(TokenType.NUMBER, text, line, start - lineStart + 1));
    }

    private void readName() {
        int start = pos;
        pos += Character.charCount(input.codePointAt(pos));
        while (pos < input.length()) {
            int cp = input.codePointAt(pos);
            if (cp == '_' || Character.isUnicodeIdentifierPart(cp))
                pos += Character.charCount(cp);
            else
                break;
        }
        tokens.add(new Token(TokenType.NAME, input.substring(start, pos), line, start - lineStart + 1));
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (input.startsWith(op, pos)) {
                switch (op) {
                    case "(", "[", "{" -> depth++;
                    case ")", "]", "}" -> {
                        if (depth == 0)
                            throw err("Unmatched '" + op + "'");
                        depth--;
                    }
                    default -> {
                    }
                }
                tokens.add(new Token(TokenType.OP, op, line, pos - lineStart + 1));
                pos += op.length();
                return;
            }
        }
        throw err("Unexpected character '" + input.charAt(pos) + "'");
    }

    private void add(TokenType type, String text) {
        tokens.add(new Token(type, text, line, pos - lineStart + 1));
    }

    private GraphSyntaxException err(String msg) {
        return new GraphSyntaxException(msg, line, pos - lineStart + 1);
    }
}
