package com.nodegraph.gcc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Compiler settings.
 *
 * <p>
 * Defaults apply unless {@code graph-code-compiler.json} exists in the
 * workspace root; system properties {@code gcc.nodeDefsDir} and
 * {@code gcc.minGeneratedLength} override both.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompilerConfig {
    public static final String FILE_NAME = "graph-code-compiler.json";

    /** Directory, relative to the workspace root, holding node-definition JSON files. */
    private String nodeDefsDir = "node_defs";
    /** Generated text shorter than this (after trimming) fails the generate stage. */
    private int minGeneratedLength = 50;
    private String tempDirPrefix = "graph_code_roundtrip_";
    /** Leading call arguments with these names are runtime context, not data. */
    private List<String> contextHandles = List.of("game");

    public static CompilerConfig defaults() {
        return applySystemProperties(new CompilerConfig());
    }

    public static CompilerConfig load(Path workspaceRoot) {
        Path file = workspaceRoot.resolve(FILE_NAME);
        CompilerConfig config = new CompilerConfig();
        if (Files.isRegularFile(file)) {
            try {
                config = new ObjectMapper().readValue(file.toFile(), CompilerConfig.class);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
        }
        return applySystemProperties(config);
    }

    private static CompilerConfig applySystemProperties(CompilerConfig config) {
        String dir = System.getProperty("gcc.nodeDefsDir");
        if (dir != null)
            config.setNodeDefsDir(dir);
        String min = System.getProperty("gcc.minGeneratedLength");
        if (min != null)
            config.setMinGeneratedLength(Integer.parseInt(min.trim()));
        return config;
    }
}
