package com.nodegraph.gcc.syntax;

public enum TokenType {
    NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, EOF
}
