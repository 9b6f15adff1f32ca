package com.phillippitts.dictation.presentation.exception;

import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.exception.ModelNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.concurrent.CompletionException;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses by error code.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown model id, or model not downloaded yet (HTTP 404).
     */
    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.warn("Model not found: {}", ex.getModelPath());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getErrorCode().name(),
                "Model not available",
                ex.getMessage(),
                Instant.now()
            ));
    }

    @ExceptionHandler(DictationBackendException.class)
    ResponseEntity<ApiError> handleBackendFailure(DictationBackendException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError() && status != HttpStatus.SERVICE_UNAVAILABLE) {
            LOG.error("Backend operation failed: code={}", ex.getErrorCode(), ex);
        } else {
            LOG.warn("Backend operation rejected: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getErrorCode().name(),
                summaryFor(ex),
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Failures of asynchronous endpoints arrive wrapped.
     */
    @ExceptionHandler(CompletionException.class)
    ResponseEntity<ApiError> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ModelNotFoundException notFound) {
            return handleModelNotFound(notFound);
        }
        if (cause instanceof DictationBackendException backend) {
            return handleBackendFailure(backend);
        }
        return handleUnexpected(ex);
    }

    /**
     * Client error - unknown backend or invalid parameter (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BAD_REQUEST",
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    static HttpStatus statusFor(DictationBackendException ex) {
        return switch (ex.getErrorCode()) {
            case CANCELLED -> HttpStatus.CONFLICT;
            case RESOURCE_EXHAUSTED -> HttpStatus.INSUFFICIENT_STORAGE;
            case NOT_READY -> HttpStatus.SERVICE_UNAVAILABLE;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case TRANSIENT, HTTP_STATUS, PROTOCOL -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String summaryFor(DictationBackendException ex) {
        return switch (ex.getErrorCode()) {
            case CANCELLED -> "Operation cancelled";
            case RESOURCE_EXHAUSTED -> "Insufficient resources";
            case NOT_READY -> "Backend not ready, retry shortly";
            case AUTHENTICATION -> "Credential rejected";
            case CORRUPTION -> "Model installation failed";
            case PROCESS_LIFECYCLE -> "Local server failed";
            default -> "Backend operation failed";
        };
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
