package com.demo.messenger.controller;

import com.demo.messenger.service.AdmissionConflictException;
import com.demo.messenger.service.MetricsService;
import com.demo.messenger.service.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final MetricsService metricsService;

    public ApiExceptionHandler(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @ExceptionHandler(AdmissionConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(AdmissionConflictException e) {
        log.warn("Admission conflict: username={}", e.getUsername());
        metricsService.recordAdmissionRejected("conflict");
        return error(HttpStatus.CONFLICT, "Conflict", "User already logged in from another device");
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<Map<String, String>> handleUnauthenticated(UnauthenticatedException e) {
        return error(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.debug("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad request", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Bad request", "Invalid request body");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String detail) {
        return ResponseEntity
                .status(status)
                .body(Map.of(
                        "error", error,
                        "detail", detail != null ? detail : status.getReasonPhrase()
                ));
    }
}
