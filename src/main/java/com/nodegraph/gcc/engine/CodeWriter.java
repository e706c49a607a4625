package com.nodegraph.gcc.engine;

/** Indentation-aware line buffer. */
public final class CodeWriter {
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder(1024);
    private int level;
    private int lines;

    public CodeWriter line(String text) {
        if (text.isEmpty()) {
            sb.append('\n');
        } else {
            sb.append(INDENT.repeat(level)).append(text).append('\n');
        }
        lines++;
        return this;
    }

    public CodeWriter blank() {
        return line("");
    }

    public CodeWriter indent() {
        level++;
        return this;
    }

    public CodeWriter dedent() {
        if (level == 0)
            throw new IllegalStateException("Dedent below column 0");
        level--;
        return this;
    }

    /** Appends another buffer's lines one level deeper than the current indentation. */
    public CodeWriter block(CodeWriter body) {
        if (body.isEmpty())
            return this;
        String prefix = INDENT.repeat(level + 1);
        for (String l : body.sb.toString().split("\n", -1)) {
            if (l.isEmpty())
                continue;
            sb.append(prefix).append(l).append('\n');
            lines++;
        }
        return this;
    }

    public boolean isEmpty() {
        return lines == 0;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
