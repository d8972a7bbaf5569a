package com.docuvision.pipeline.controller;

import com.docuvision.pipeline.model.ActionResponse;
import com.docuvision.pipeline.service.IngestionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ActionResponse> handleIngestionException(IngestionException exception) {
        log.warn("Request failed with {}: {}", exception.status().value(), exception.getMessage());
        return ResponseEntity.status(exception.status())
                .body(new ActionResponse(false, exception.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ActionResponse> handleValidation(WebExchangeBindException exception) {
        String message = exception.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(new ActionResponse(false, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ActionResponse> handleUnreadableBody(ServerWebInputException exception) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ActionResponse(false, "Request body must be a JSON object: " + exception.getReason()));
    }
}
