package com.nodegraph.gcc.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.core.CompositeNodeConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Owner of the node-definition registry for one workspace root.
 *
 * <p>
 * The registry is loaded lazily from {@code <root>/<nodeDefsDir>/*.json} and
 * cached under a fingerprint of file paths, sizes and modification times.
 * {@link #registry()} reloads when the fingerprint changes; {@link #invalidate()}
 * forces a reload on the next access. Composites registered through the handle
 * survive reloads.
 *
 * <p>
 * Pass the handle into every parse; treat the returned registry as immutable
 * for the duration of that parse.
 */
@Log4j2
public final class RegistryHandle {
    private final Path workspaceRoot;
    private final CompilerConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<NodeDefinition> extraDefinitions = new ArrayList<>();

    private NodeRegistry cached;
    private String fingerprint;

    private RegistryHandle(Path workspaceRoot, CompilerConfig config, NodeRegistry fixed) {
        this.workspaceRoot = workspaceRoot;
        this.config = config;
        this.cached = fixed;
    }

    public static RegistryHandle open(Path workspaceRoot, CompilerConfig config) {
        return new RegistryHandle(workspaceRoot, config, null);
    }

    /** A handle around an in-memory registry; never reloads. */
    public static RegistryHandle of(NodeRegistry registry) {
        return new RegistryHandle(null, CompilerConfig.defaults(), registry);
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public synchronized NodeRegistry registry() {
        if (workspaceRoot == null)
            return cached;
        String fp = computeFingerprint();
        if (cached == null || !fp.equals(fingerprint)) {
            cached = load();
            fingerprint = fp;
        }
        return cached;
    }

    /** Drops the cached registry; the next access reloads from disk. */
    public synchronized void invalidate() {
        if (workspaceRoot == null)
            return;
        cached = null;
        fingerprint = null;
        log.debug("Node registry for {} invalidated", workspaceRoot);
    }

    public synchronized NodeDefinition registerComposite(CompositeNodeConfig composite) {
        NodeDefinition def = NodeRegistry.compositeDefinition(composite);
        extraDefinitions.removeIf(d -> d.getName().equals(def.getName()));
        extraDefinitions.add(def);
        if (cached != null)
            cached.register(def);
        return def;
    }

    private NodeRegistry load() {
        NodeRegistry registry = new NodeRegistry();
        int count = 0;
        for (Path file : definitionFiles()) {
            try {
                NodeLibraryFile lib = mapper.readValue(file.toFile(), NodeLibraryFile.class);
                registry.registerAll(lib.getNodes());
                count += lib.getNodes().size();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read node definitions " + file, e);
            }
        }
        registry.registerAll(extraDefinitions);
        log.info("Loaded {} node definitions from {}", count, definitionsDir());
        return registry;
    }

    private Path definitionsDir() {
        return workspaceRoot.resolve(config.getNodeDefsDir());
    }

    private List<Path> definitionFiles() {
        Path dir = definitionsDir();
        if (!Files.isDirectory(dir))
            return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private String computeFingerprint() {
        StringBuilder sb = new StringBuilder();
        for (Path p : definitionFiles()) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                sb.append(p.getFileName()).append(':').append(attrs.size()).append(':')
                        .append(attrs.lastModifiedTime().toMillis()).append(';');
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to stat " + p, e);
            }
        }
        return sb.toString();
    }
}
