package com.nodegraph.gcc.util;

import java.util.Set;

/**
 * Identifier rules of the Graph Code language.
 *
 * <p>
 * Used by the emitter to decide between keyword and positional argument
 * forms and to derive legal variable names from port labels.
 */
public final class Identifiers {
    private Identifiers() {
        // Utility class
    }

    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    /** True when {@code name} lexes as a single NAME token. */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty())
            return false;
        int first = name.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first))
            return false;
        for (int i = Character.charCount(first); i < name.length();) {
            int cp = name.codePointAt(i);
            if (cp != '_' && !Character.isUnicodeIdentifierPart(cp))
                return false;
            i += Character.charCount(cp);
        }
        return true;
    }

    /** True when {@code name} can be used as a keyword argument or variable. */
    public static boolean isSafeName(String name) {
        return isIdentifier(name) && !isKeyword(name);
    }

    /**
     * Maps an arbitrary label onto a legal, non-keyword identifier. Illegal
     * characters become underscores; a leading digit gets a {@code v_} prefix.
     */
    public static String sanitize(String label) {
        if (label == null || label.isEmpty())
            return "value";
        StringBuilder sb = new StringBuilder(label.length() + 2);
        label.codePoints().forEach(cp -> {
            if (cp == '_' || Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp))
                sb.appendCodePoint(cp);
            else
                sb.append('_');
        });
        String s = sb.toString();
        int first = s.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first))
            s = "v_" + s;
        if (isKeyword(s))
            s = s + "_";
        return s;
    }
}
