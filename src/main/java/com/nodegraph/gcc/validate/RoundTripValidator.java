package com.nodegraph.gcc.validate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.nodegraph.gcc.CompilerConfig;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.GraphModel;
import com.nodegraph.gcc.engine.CompositeCodeEmitter;
import com.nodegraph.gcc.engine.GraphCodeEmitter;
import com.nodegraph.gcc.ir.GraphCodeParser;
import com.nodegraph.gcc.ir.GraphParseException;
import com.nodegraph.gcc.ir.ParsedGraphCode;
import com.nodegraph.gcc.syntax.GraphSyntaxException;
import com.nodegraph.gcc.syntax.Parser;
import com.nodegraph.gcc.util.GraphExplain;
import com.nodegraph.gcc.util.Identifiers;

import lombok.extern.log4j.Log4j2;

/**
 * Regenerate-then-reparse gate.
 *
 * <p>
 * Runs {@code GENERATE -> SYNTAX_CHECK -> EXECUTION -> STRUCTURAL}; the first
 * failing stage ends the run and is reported in the result, never thrown.
 * The reparse writes the generated text into a fresh temporary directory
 * which is removed on every exit path.
 */
@Log4j2
public final class RoundTripValidator {
    private final GraphCodeParser parser;
    private final CompilerConfig config;

    public RoundTripValidator(GraphCodeParser parser, CompilerConfig config) {
        this.parser = parser;
        this.config = config;
    }

    public RoundTripResult validate(GraphModel graph) {
        return run(graph.getGraphId(), graph.nodeCount(),
                () -> new GraphCodeEmitter(config.getContextHandles()).generate(graph));
    }

    public RoundTripResult validate(CompositeNodeConfig composite) {
        return run(composite.getCompositeId(), composite.getSubGraph().nodeCount(),
                () -> new CompositeCodeEmitter(config.getContextHandles()).generate(composite));
    }

    private RoundTripResult run(String name, int originalNodes, Supplier<String> generator) {
        // --- Generate ---
        String code;
        try {
            code = generator.get();
        } catch (RuntimeException e) {
            return fail(name, RoundTripStage.GENERATE, "Code generation failed: " + e.getMessage(), null, 0, null);
        }
        if (code == null)
            return fail(name, RoundTripStage.GENERATE, "Code generation returned no text", null, 0, null);
        if (code.trim().length() < config.getMinGeneratedLength())
            return fail(name, RoundTripStage.GENERATE, "Generated code is implausibly short ("
                    + code.trim().length() + " chars)", code, 0, code);

        // --- Syntax check ---
        try {
            Parser.parse(code);
        } catch (GraphSyntaxException e) {
            return fail(name, RoundTripStage.SYNTAX_CHECK, e.getMessage(), excerpt(code, e.getLine()), e.getLine(),
                    code);
        }

        // --- Reparse ---
        ParsedGraphCode reparsed;
        try {
            reparsed = reparse(name, code);
        } catch (GraphParseException e) {
            return fail(name, RoundTripStage.EXECUTION, e.getMessage(), excerpt(code, e.getLine()), e.getLine(), code);
        } catch (IOException | RuntimeException e) {
            return fail(name, RoundTripStage.EXECUTION, e.getClass().getSimpleName() + ": " + e.getMessage(), null, 0,
                    code);
        }

        // --- Structural check ---
        GraphExplain explain = new GraphExplain(reparsed.graph());
        if (originalNodes > 0 && reparsed.graph().nodeCount() == 0)
            return fail(name, RoundTripStage.STRUCTURAL, "Graph with " + originalNodes
                    + " nodes reparsed to an empty graph", explain.summary(), 0, code);

        log.info("Round-trip of {} passed: {} nodes before, {} after", name, originalNodes,
                reparsed.graph().nodeCount());
        if (log.isDebugEnabled())
            log.debug(explain.dumpTopology());
        return RoundTripResult.passed(code, reparsed, explain.summary());
    }

    private ParsedGraphCode reparse(String name, String code) throws IOException {
        Path dir = Files.createTempDirectory(config.getTempDirPrefix());
        try {
            Path file = dir.resolve(Identifiers.sanitize(name == null ? "graph" : name) + ".py");
            Files.writeString(file, code, StandardCharsets.UTF_8);
            return parser.parseFile(file);
        } finally {
            deleteRecursively(dir);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths)
                Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to remove round-trip scratch directory {}", dir, e);
        }
    }

    private static RoundTripResult fail(String name, RoundTripStage stage, String message, String details,
            int line, String code) {
        log.info("Round-trip of {} failed at {}: {}", name, stage, message);
        return RoundTripResult.failed(stage, message, details, line, code);
    }

    /** The offending line with one line of context either side. */
    static String excerpt(String code, int line) {
        if (line <= 0)
            return null;
        String[] lines = code.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = Math.max(1, line - 1); i <= Math.min(lines.length, line + 1); i++)
            sb.append(i == line ? ">> " : "   ").append(i).append(": ").append(lines[i - 1]).append('\n');
        return sb.toString();
    }
}
