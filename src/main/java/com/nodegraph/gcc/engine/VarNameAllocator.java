package com.nodegraph.gcc.engine;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.core.MappedPort;
import com.nodegraph.gcc.util.Identifiers;

/**
 * Variable names of one emission scope (one generated method).
 *
 * <p>
 * A name is derived from the output's custom label, else from the port
 * name in snake case. Collisions get {@code _2}, {@code _3}, ... in
 * allocation order.
 */
public final class VarNameAllocator {
    private final Set<String> used = new HashSet<>();
    private final Map<MappedPort, String> names = new HashMap<>();

    public VarNameAllocator(Set<String> reserved) {
        used.addAll(reserved);
    }

    /** Binds a port to a name chosen elsewhere, such as a method parameter. */
    public void bind(MappedPort port, String name) {
        used.add(name);
        names.put(port, name);
    }

    public String allocate(MappedPort port, String label) {
        String existing = names.get(port);
        if (existing != null)
            return existing;
        String base = Identifiers.sanitize(label != null && !label.isBlank() ? label.strip()
                : snakeCase(port.portName()));
        String name = base;
        for (int i = 2; !used.add(name); i++)
            name = base + "_" + i;
        names.put(port, name);
        return name;
    }

    /** Name bound to {@code port}, or null. */
    public String nameOf(MappedPort port) {
        return names.get(port);
    }

    public boolean isUsed(String name) {
        return used.contains(name);
    }

    static String snakeCase(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && (Character.isLowerCase(s.charAt(i - 1)) || Character.isDigit(s.charAt(i - 1))))
                    sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else if (c == ' ' || c == '-') {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
