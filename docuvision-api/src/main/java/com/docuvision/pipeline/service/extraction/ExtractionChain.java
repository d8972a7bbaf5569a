package com.docuvision.pipeline.service.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ExtractionChain {

    private static final Logger log = LoggerFactory.getLogger(ExtractionChain.class);

    private final String name;
    private final List<ChainStep> steps;

    public ExtractionChain(String name, List<ChainStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Extraction chain " + name + " needs at least one step");
        }
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public String name() {
        return name;
    }

    public ExtractionOutcome extract(Path file) {
        ExtractionOutcome precondition = checkReadable(file);
        if (precondition != null) {
            return precondition;
        }
        List<String> warnings = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            ChainStep step = steps.get(i);
            String strategy = step.strategy().name();
            boolean last = i == steps.size() - 1;
            StrategyResult result = step.strategy().attempt(file);

            if (!result.succeeded()) {
                failures.add(strategy + ": " + result.message());
                if (last || !step.fallbackOnFailure()) {
                    log.error("{} chain failed for {} at {}: {}", name, file, strategy, result.message());
                    return failures.size() > 1
                            ? ExtractionOutcome.failure(FailureKind.COMPOSITE_FAILURE, "All strategies failed: " + String.join("; ", failures))
                            : ExtractionOutcome.failure(result.kind(), result.message());
                }
                log.warn("{} failed for {}: {}, trying next strategy", strategy, file, result.message());
                warnings.add(strategy + " failed: " + result.message());
                continue;
            }

            warnings.addAll(result.warnings());
            if (!last && !step.qualityGate().test(result.text())) {
                log.info("{} produced unusable text ({} characters) for {}, falling back", strategy, result.text().trim().length(), file);
                warnings.add(strategy + " produced " + result.text().trim().length() + " usable characters");
                continue;
            }
            return ExtractionOutcome.success(new ExtractionResult(result.text(), strategy, warnings));
        }
        throw new IllegalStateException("Extraction chain " + name + " ended without an outcome");
    }

    private ExtractionOutcome checkReadable(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return ExtractionOutcome.failure(FailureKind.FILE_NOT_FOUND, "File not found: " + file);
        }
        try {
            long size = Files.size(file);
            log.debug("Extracting {} ({} bytes) with {} chain", file, size, name);
            if (size == 0) {
                return ExtractionOutcome.failure(FailureKind.EMPTY_FILE, "File is empty: " + file);
            }
        } catch (IOException e) {
            return ExtractionOutcome.failure(FailureKind.FILE_NOT_FOUND, "File is not readable: " + file + " (" + e.getMessage() + ")");
        }
        return null;
    }
}
