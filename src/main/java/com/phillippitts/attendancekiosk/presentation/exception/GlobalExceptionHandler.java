package com.phillippitts.attendancekiosk.presentation.exception;

import com.phillippitts.attendancekiosk.exception.EventStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts exceptions to HTTP responses without exposing internal details to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Local storage failure (HTTP 503). Usually transient: file locked or disk full.
     */
    @ExceptionHandler(EventStoreException.class)
    ResponseEntity<ApiError> handleStoreFailure(EventStoreException ex) {
        LOG.error("Event store unavailable: operation={}", ex.getOperation(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Local event store unavailable",
                "Please retry in a few seconds",
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
