package com.docuvision.pipeline.service.extraction;

import java.nio.file.Path;

/**
 * One way of turning a local file into text. Implementations report library failures through
 * {@link StrategyResult#failed(FailureKind, String)} instead of throwing, so the chain decides
 * whether a fallback runs.
 */
public interface ExtractionStrategy {

    String name();

    StrategyResult attempt(Path file);
}
