package com.wagerengine.api.controller;

import com.wagerengine.common.exception.EnginePausedException;
import com.wagerengine.common.exception.GameConfigNotFoundException;
import com.wagerengine.common.exception.ReentrantCallException;
import com.wagerengine.common.exception.WagerEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GameConfigNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleGameNotFound(GameConfigNotFoundException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(EnginePausedException.class)
    public ResponseEntity<Map<String, String>> handlePaused(EnginePausedException e) {
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(ReentrantCallException.class)
    public ResponseEntity<Map<String, String>> handleReentrant(ReentrantCallException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(WagerEngineException.class)
    public ResponseEntity<Map<String, String>> handleEngineException(WagerEngineException e) {
        HttpStatus status = switch (e.getCategory()) {
            case PRECONDITION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case SOLVENCY -> HttpStatus.CONFLICT;
            case ARITHMETIC -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return buildErrorResponse(status, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("status", String.valueOf(HttpStatus.UNAUTHORIZED.value()));
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        Map<String, String> error = new HashMap<>();
        error.put("error", "An unexpected error occurred: " + e.getMessage());
        error.put("status", String.valueOf(HttpStatus.INTERNAL_SERVER_ERROR.value()));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, WagerEngineException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("status", String.valueOf(status.value()));
        error.put("category", e.getCategory().name());
        return ResponseEntity.status(status).body(error);
    }
}
