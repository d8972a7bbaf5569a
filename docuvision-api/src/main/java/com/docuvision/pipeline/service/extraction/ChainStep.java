package com.docuvision.pipeline.service.extraction;

import java.util.function.Predicate;

/**
 * A strategy plus the policy that decides when the chain moves on to the next step.
 *
 * @param strategy          strategy to run
 * @param fallbackOnFailure whether a failed attempt hands over to the next step
 * @param qualityGate       accepts the produced text; a rejected text hands over to the next step
 */
public record ChainStep(ExtractionStrategy strategy, boolean fallbackOnFailure, Predicate<String> qualityGate) {

    public static ChainStep of(ExtractionStrategy strategy) {
        return new ChainStep(strategy, true, text -> true);
    }

    public static ChainStep terminalOnFailure(ExtractionStrategy strategy, Predicate<String> qualityGate) {
        return new ChainStep(strategy, false, qualityGate);
    }

    /**
     * Accepts text whose trimmed length is at least {@code minimum}. Surrounding whitespace is not
     * counted, so the line breaks an empty multi-page text layer produces never pass the gate.
     */
    public static Predicate<String> minimumLength(int minimum) {
        return text -> text != null && text.trim().length() >= minimum;
    }
}
