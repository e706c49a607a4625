package com.nodegraph.gcc.ir;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.nodegraph.gcc.core.MappedPort;

/**
 * Variable environment of one method: binds source names to the
 * {@code (node, output port)} that produced their value.
 *
 * <p>
 * Aliases ({@code b = a}) are kept as chains so that a name aliasing a
 * not-yet-bound value, such as a composite parameter, still resolves to its
 * root. Scoped to a single method build.
 *
 * <p>
 * Branch arms each work on a {@link #copy()} of the environment. A name the
 * arms leave bound to different values is marked with the line of the
 * construct and must be reassigned before it is read again.
 */
public final class VarEnv {
    private final Map<String, MappedPort> bindings = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final Map<String, Integer> pathDependent = new LinkedHashMap<>();
    private final Deque<String> loops = new ArrayDeque<>();

    public void bind(String name, MappedPort producer) {
        aliases.remove(name);
        pathDependent.remove(name);
        bindings.put(name, producer);
    }

    /** Makes {@code name} refer to whatever {@code target} refers to. */
    public void alias(String name, String target) {
        if (name.equals(target))
            return;
        pathDependent.remove(name);
        MappedPort b = resolve(target);
        if (b != null) {
            bind(name, b);
        } else {
            bindings.remove(name);
            aliases.put(name, target);
        }
    }

    public void unbind(String name) {
        bindings.remove(name);
        aliases.remove(name);
        pathDependent.remove(name);
    }

    /** Forgets {@code name} and records that the construct at {@code line} set it on some paths only. */
    public void markPathDependent(String name, int line) {
        bindings.remove(name);
        aliases.remove(name);
        pathDependent.put(name, line);
    }

    /** Line of the construct that left {@code name} path-dependent, or 0. */
    public int pathDependentLine(String name) {
        Integer line = pathDependent.get(name);
        if (line == null)
            line = pathDependent.get(rootName(name));
        return line == null ? 0 : line;
    }

    /** Every name with a binding, an alias or a path-dependent mark. */
    public Set<String> names() {
        Set<String> out = new LinkedHashSet<>(bindings.keySet());
        out.addAll(aliases.keySet());
        out.addAll(pathDependent.keySet());
        return out;
    }

    /** Snapshot of the bindings; the loop stack is not part of it. */
    public VarEnv copy() {
        VarEnv c = new VarEnv();
        c.bindings.putAll(bindings);
        c.aliases.putAll(aliases);
        c.pathDependent.putAll(pathDependent);
        return c;
    }

    /** Replaces the bindings with those of {@code saved}. */
    public void restore(VarEnv saved) {
        bindings.clear();
        bindings.putAll(saved.bindings);
        aliases.clear();
        aliases.putAll(saved.aliases);
        pathDependent.clear();
        pathDependent.putAll(saved.pathDependent);
    }

    /** Producer of {@code name}, following alias chains; null when unbound. */
    public MappedPort resolve(String name) {
        String root = rootName(name);
        return bindings.get(root);
    }

    /** End of the alias chain starting at {@code name}. */
    public String rootName(String name) {
        String current = name;
        Set<String> seen = new HashSet<>();
        while (aliases.containsKey(current) && seen.add(current))
            current = aliases.get(current);
        return current;
    }

    public boolean isBound(String name) {
        return resolve(name) != null;
    }

    public void pushLoop(String loopNodeId) {
        loops.push(loopNodeId);
    }

    public void popLoop() {
        loops.pop();
    }

    /** Innermost enclosing loop node id, or null outside loops. */
    public String currentLoop() {
        return loops.peek();
    }
}
