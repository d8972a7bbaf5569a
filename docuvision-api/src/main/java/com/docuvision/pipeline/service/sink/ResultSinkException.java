package com.docuvision.pipeline.service.sink;

public class ResultSinkException extends RuntimeException {

    public ResultSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
