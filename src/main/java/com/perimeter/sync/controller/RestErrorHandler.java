package com.perimeter.sync.controller;

import com.perimeter.sync.service.StoreException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

/**
 * Maps diagnostics failures to JSON error bodies.
 *
 * - 400: rejected path or query parameters
 * - 503: the cache store could not be read
 */
@RestControllerAdvice
@Slf4j
public class RestErrorHandler {

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorPayload> handleValidation(ConstraintViolationException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorPayload> handleStoreError(StoreException ex, WebRequest request) {
        log.error("Diagnostics request failed on store ({})", ex.getKind(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getKind() + ": " + ex.getMessage(), request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
        return ResponseEntity.status(status).body(body);
    }

    public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
}
