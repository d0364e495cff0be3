package com.flagship.stablecoin_engine.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures to consistent error responses.
 *
 * Typed engine errors keep their {@link ErrorCode} as the "error" field so
 * liquidators and dashboards can branch on the kind.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StablecoinEngineException.class)
    public ResponseEntity<ApiError> handleEngineException(StablecoinEngineException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Engine operation failed: code={}, message={}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("Engine operation rejected: code={}, message={}", e.getErrorCode(), e.getMessage());
        }

        ApiError error = ApiError.builder()
            .error(e.getErrorCode().name())
            .message(e.getMessage())
            .details(e.getDetails().isEmpty() ? null : e.getDetails())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ApiError error = ApiError.builder()
            .error("MISSING_HEADER")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());

        ApiError error = ApiError.builder()
            .error("MISSING_PARAMETER")
            .message("Required parameter '" + e.getParameterName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());

        ApiError error = ApiError.builder()
            .error("INVALID_PARAMETER")
            .message("Parameter '" + e.getName() + "' has an invalid value")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("MALFORMED_REQUEST")
            .message("Request body could not be parsed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_AMOUNT, ASSET_NOT_ALLOWED -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_BALANCE, NOT_LIQUIDATABLE, REENTRANT_CALL -> HttpStatus.CONFLICT;
            case BELOW_MINIMUM_HEALTH_FACTOR, HEALTH_FACTOR_NOT_IMPROVED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSFER_FAILED, MINT_FAILED -> HttpStatus.BAD_GATEWAY;
            case STALE_PRICE -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONFIGURATION_MISMATCH -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
