package com.docuvision.pipeline.service.ocr;

import com.docuvision.pipeline.service.extraction.FailureKind;

public class OcrEngineException extends RuntimeException {

    private final FailureKind kind;

    public OcrEngineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
