package com.nodegraph.gcc.ir;

import lombok.Getter;

/**
 * Fatal forward-parse failure: unknown node title, malformed role annotation,
 * unresolvable argument, or an unsupported construct. No partial graph is
 * ever returned alongside it.
 */
@Getter
public class GraphParseException extends RuntimeException {
    private final String file;
    private final int line;

    public GraphParseException(String message, String file, int line) {
        super((file == null ? "<source>" : file) + ":" + line + ": " + message);
        this.file = file;
        this.line = line;
    }
}
