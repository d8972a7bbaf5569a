package com.docuvision.pipeline.service.manifest;

public class ManifestFormatException extends RuntimeException {

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
