package com.docuvision.pipeline.service.host;

public class CkanActionException extends RuntimeException {

    private final int status;

    public CkanActionException(int status, String message) {
        super(message);
        this.status = status;
    }

    public CkanActionException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public boolean notFound() {
        return status == 404;
    }
}
