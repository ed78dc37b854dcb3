package com.fintech.resolution.controller;

import com.fintech.resolution.dto.ErrorResponse;
import com.fintech.resolution.exception.ErrorKind;
import com.fintech.resolution.exception.RateLimitedException;
import com.fintech.resolution.exception.ResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<ErrorResponse> handleResolution(ResolutionException ex) {
        HttpStatus status = statusFor(ex.getKind());
        Map<String, Object> details = new LinkedHashMap<>();
        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof RateLimitedException) {
            long waitMs = ((RateLimitedException) ex).getRequiredWait().toMillis();
            details.put("retryAfterMs", waitMs);
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, (waitMs + 999) / 1000)));
        }
        if (status.is5xxServerError()) {
            log.warn("Request failed [{}]: {}", ex.getKind(), ex.getMessage());
        }
        return build(status, headers, ex.getKind().name(), ex.getMessage(), details);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            details.put(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, new HttpHeaders(), "VALIDATION_ERROR", "Request validation failed", details);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, new HttpHeaders(), ErrorKind.INVALID_QUERY.name(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, new HttpHeaders(), "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INVALID_QUERY -> HttpStatus.BAD_REQUEST;
            case EMPTY_RESULT, NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STALE_REFERENCE, DISPUTE_ALREADY_OPEN -> HttpStatus.CONFLICT;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case CIRCUIT_OPEN, CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case RETRIES_EXHAUSTED, PROVIDER_ERROR -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, HttpHeaders headers, String code,
                                                String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .headers(headers)
                .body(ErrorResponse.builder()
                        .code(code)
                        .message(message)
                        .details(details)
                        .timestamp(Instant.now())
                        .build());
    }
}
