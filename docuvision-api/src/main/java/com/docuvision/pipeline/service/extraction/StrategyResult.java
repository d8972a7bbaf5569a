package com.docuvision.pipeline.service.extraction;

import java.util.List;

public record StrategyResult(boolean succeeded, String text, FailureKind kind, String message, List<String> warnings) {

    public StrategyResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static StrategyResult success(String text) {
        return new StrategyResult(true, text == null ? "" : text, null, null, List.of());
    }

    public static StrategyResult success(String text, List<String> warnings) {
        return new StrategyResult(true, text == null ? "" : text, null, null, warnings);
    }

    public static StrategyResult failed(FailureKind kind, String message) {
        return new StrategyResult(false, null, kind, message, List.of());
    }
}
