package com.nodegraph.gcc.io;

import com.fasterxml.jackson.annotation.JsonCreator;

/** How a variable-arity node grows ports from positional arguments. */
public enum DynamicPortFamily {
    /** Fixed ports only. */
    NONE,
    /** Positional arguments map to ports {@code "0"}, {@code "1"}, ... */
    VARIADIC,
    /** Positional arguments pair up into {@code key_i} / {@code value_i} ports. */
    KEY_VALUE,
    /** Event whose outputs are read from a keyword context, one lookup per parameter. */
    CONTEXT;

    @JsonCreator
    public static DynamicPortFamily fromString(String s) {
        if (s == null || s.isBlank())
            return NONE;
        return switch (s.trim().toUpperCase().replace('-', '_')) {
            case "NONE" -> NONE;
            case "VARIADIC" -> VARIADIC;
            case "KEY_VALUE", "KEYVALUE" -> KEY_VALUE;
            case "CONTEXT" -> CONTEXT;
            default -> throw new IllegalArgumentException("Unknown dynamic port family: " + s);
        };
    }
}
