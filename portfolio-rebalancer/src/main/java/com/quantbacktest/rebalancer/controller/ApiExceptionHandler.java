package com.quantbacktest.rebalancer.controller;

import com.quantbacktest.rebalancer.infrastructure.QueueUnavailableException;
import com.quantbacktest.rebalancer.service.SimulationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service exceptions to JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(SimulationNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(SimulationNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null);
    }

    /**
     * Also covers {@code SimulationConfigurationException}.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return error(HttpStatus.BAD_REQUEST, "validation_error", "invalid_request", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "malformed_request", ex.getMostSpecificCause().getMessage(), null);
    }

    @ExceptionHandler(QueueUnavailableException.class)
    public ResponseEntity<Map<String, Object>> queueUnavailable(QueueUnavailableException ex) {
        log.error("Queue unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "queue_unavailable", ex.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message,
                                                             Map<String, String> fields) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", reason);
        body.put("message", message == null ? reason : message);
        if (fields != null) {
            body.put("fields", fields);
        }
        body.put("ts", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
