package com.phillippitts.voicegate.presentation.exception;

import com.phillippitts.voicegate.exception.InvalidRequestException;
import com.phillippitts.voicegate.exception.OrchestratorNotReadyException;
import com.phillippitts.voicegate.exception.ProviderNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Converts exceptions raised by the operational endpoints to JSON error bodies.
 * Stack traces stay in the server log.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ProviderNotFoundException.class)
    ResponseEntity<ApiError> handleProviderNotFound(ProviderNotFoundException ex) {
        LOG.warn("Unknown provider requested: {}", ex.getProviderName());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Provider not found", ex.getMessage());
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({InvalidRequestException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleInvalidRequest(RuntimeException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    /**
     * Orchestrator not started or already stopped (HTTP 503).
     */
    @ExceptionHandler(OrchestratorNotReadyException.class)
    ResponseEntity<ApiError> handleNotReady(OrchestratorNotReadyException ex) {
        LOG.error("Orchestrator not ready: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(), "Service not ready",
            "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
            "Quote the requestId when reporting this error");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, ThreadContext.get("requestId"), Instant.now()));
    }

    /**
     * Error body of the operational endpoints. {@code requestId} matches the {@code X-Request-ID} response
     * header and the log lines of the failed call.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        String requestId,
        Instant timestamp
    ) {}
}
