package com.docuvision.pipeline.service.extraction;

public enum FailureKind {
    FILE_NOT_FOUND,
    EMPTY_FILE,
    ENGINE_MISSING,
    ENGINE_FAILURE,
    COMPOSITE_FAILURE,
    MALFORMED_MANIFEST,
    NETWORK_ERROR,
    TIMEOUT,
    HTTP_ERROR,
    PERSIST_FAILURE
}
