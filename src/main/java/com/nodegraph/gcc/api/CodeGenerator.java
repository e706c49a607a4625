package com.nodegraph.gcc.api;

/**
 * Produces Graph Code source text from an in-memory model.
 *
 * @param <T> the model kind, a graph or a composite definition
 */
@FunctionalInterface
public interface CodeGenerator<T> {
    String generate(T source);
}
