package com.nodegraph.gcc.syntax;

/**
 * Lexical token. For {@link TokenType#STRING} the text is the decoded value.
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return is(TokenType.OP, s);
    }

    public boolean isName(String s) {
        return is(TokenType.NAME, s);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            case STRING -> "string literal";
            default -> "'" + text + "'";
        };
    }
}
