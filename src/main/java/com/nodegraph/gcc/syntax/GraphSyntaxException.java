package com.nodegraph.gcc.syntax;

import lombok.Getter;

/** Lexical or grammatical error in Graph Code text. */
@Getter
public class GraphSyntaxException extends RuntimeException {
    private final int line;
    private final int column;

    public GraphSyntaxException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }
}
