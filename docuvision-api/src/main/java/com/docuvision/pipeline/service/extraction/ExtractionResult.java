package com.docuvision.pipeline.service.extraction;

import java.util.List;

public record ExtractionResult(String text, String strategyUsed, List<String> warnings) {

    public ExtractionResult {
        text = text == null ? "" : text;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
