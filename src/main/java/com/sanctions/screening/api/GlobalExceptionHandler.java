package com.sanctions.screening.api;

import com.sanctions.screening.core.ScreeningCacheException;
import com.sanctions.screening.core.WatchlistReloadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the screening API. Returns consistent JSON
 * and status codes per error class.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(MalformedInputException.class)
    public ResponseEntity<Map<String, String>> handleMalformed(MalformedInputException ex) {
        log.warn("Malformed screening input: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "MALFORMED_INPUT", "message", ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(ScreeningCancelledException.class)
    public ResponseEntity<Map<String, String>> handleCancelled(ScreeningCancelledException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "CANCELLED", "message", ex.getMessage()));
    }

    @ExceptionHandler(ScreeningCacheException.class)
    public ResponseEntity<Map<String, String>> handleCache(ScreeningCacheException ex) {
        log.warn("Screening cache unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "CACHE_UNAVAILABLE", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(WatchlistReloadException.class)
    public ResponseEntity<Map<String, String>> handleReload(WatchlistReloadException ex) {
        log.warn("Watchlist reload rejected: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(Map.of("error", "RELOAD_REJECTED", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(ScreeningInternalException.class)
    public ResponseEntity<Map<String, String>> handleInternal(ScreeningInternalException ex) {
        log.error("Screening failed", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
