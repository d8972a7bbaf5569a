package com.docuvision.pipeline.service.fetch;

import com.docuvision.pipeline.service.extraction.FailureKind;

public class FetchException extends RuntimeException {

    private final FailureKind kind;

    public FetchException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
