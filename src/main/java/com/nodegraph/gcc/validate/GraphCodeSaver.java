package com.nodegraph.gcc.validate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import com.nodegraph.gcc.api.GraphRule;
import com.nodegraph.gcc.api.RuleIssue;
import com.nodegraph.gcc.core.CompositeNodeConfig;
import com.nodegraph.gcc.core.GraphModel;

import lombok.extern.log4j.Log4j2;

/**
 * Persists a graph only when it survives the round-trip and no rule reports
 * an error. The target file is replaced by an atomic move, so on any failure
 * the previous content stays as it was.
 */
@Log4j2
public final class GraphCodeSaver {

    /** Outcome of a save; {@code saved} is false whenever the file was not touched. */
    public record SaveResult(boolean saved, RoundTripResult roundTrip, List<RuleIssue> issues) {
        public List<RuleIssue> errors() {
            return issues.stream().filter(RuleIssue::isError).toList();
        }
    }

    private final RoundTripValidator validator;
    private final List<GraphRule> rules;

    public GraphCodeSaver(RoundTripValidator validator, List<GraphRule> rules) {
        this.validator = validator;
        this.rules = List.copyOf(rules);
    }

    public SaveResult save(GraphModel graph, Path target) throws IOException {
        return save(validator.validate(graph), graph, target);
    }

    public SaveResult save(CompositeNodeConfig composite, Path target) throws IOException {
        return save(validator.validate(composite), composite.getSubGraph(), target);
    }

    private SaveResult save(RoundTripResult roundTrip, GraphModel graph, Path target) throws IOException {
        if (!roundTrip.success()) {
            log.warn("Not saving {}: {}", target, roundTrip);
            return new SaveResult(false, roundTrip, List.of());
        }
        List<RuleIssue> issues = new ArrayList<>();
        for (GraphRule rule : rules)
            issues.addAll(rule.check(graph));
        for (RuleIssue issue : issues)
            log.debug("{}: {}", target, issue);
        if (issues.stream().anyMatch(RuleIssue::isError)) {
            log.warn("Not saving {}: {} rule errors", target,
                    issues.stream().filter(RuleIssue::isError).count());
            return new SaveResult(false, roundTrip, List.copyOf(issues));
        }
        writeAtomically(target, roundTrip.generatedCode());
        log.info("Saved {} ({} warnings)", target, issues.size());
        return new SaveResult(true, roundTrip, List.copyOf(issues));
    }

    static void writeAtomically(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, replacing in place", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
