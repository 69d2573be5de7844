package com.phillippitts.echoscribe.presentation.exception;

import com.phillippitts.echoscribe.exception.AiServiceException;
import com.phillippitts.echoscribe.exception.InvalidInputException;
import com.phillippitts.echoscribe.exception.RetryCancelledException;
import com.phillippitts.echoscribe.exception.RetryExhaustedException;
import com.phillippitts.echoscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring. Client responses carry the operation and a truncated root cause,
 * never stack traces.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final int MAX_CAUSE_CHARS = 120;

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidInputException.class)
    ResponseEntity<ApiError> handleInvalidInput(InvalidInputException ex) {
        LOG.warn("Invalid input: reason={}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex, "Invalid input", ex.getReason());
    }

    /**
     * Client error - request body missing or not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", LogSanitizer.truncate(ex.getMessage(), MAX_CAUSE_CHARS));
        return respond(HttpStatus.BAD_REQUEST, ex, "Malformed request body",
                "Request body must be a JSON object with a \"text\" field");
    }

    /**
     * Upstream outage - every attempt failed (HTTP 503). Details name the operation, the
     * attempt count and a truncated root cause.
     */
    @ExceptionHandler(RetryExhaustedException.class)
    ResponseEntity<ApiError> handleRetryExhausted(RetryExhaustedException ex) {
        LOG.error("Operation {} exhausted {} attempts", ex.getOperation(), ex.getAttempts(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex,
                "AI service temporarily unavailable",
                "Operation '" + ex.getOperation() + "' failed after " + ex.getAttempts() + " attempts; last error: "
                        + rootCause(ex.getLastCause()));
    }

    /**
     * Deadline hit or request cancelled mid-retry (HTTP 504).
     */
    @ExceptionHandler(RetryCancelledException.class)
    ResponseEntity<ApiError> handleRetryCancelled(RetryCancelledException ex) {
        LOG.warn("Operation {} cancelled: {}", ex.getOperation(), ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex,
                "AI service did not respond in time",
                "Please retry in a few seconds");
    }

    /**
     * Other AI operation failures (HTTP 502).
     */
    @ExceptionHandler(AiServiceException.class)
    ResponseEntity<ApiError> handleAiServiceFailure(AiServiceException ex) {
        LOG.error("AI operation failed: operation={}", ex.getOperation(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex,
                "AI service error",
                "Operation '" + ex.getOperation() + "' failed");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework exceptions that carry their own
     * status (unsupported method or media type, unknown path) keep it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.warn("Request rejected with status {}: {}", status.value(), ex.getMessage());
            return ResponseEntity
                .status(status)
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    "Request rejected",
                    errorResponse.getBody().getDetail(),
                    Instant.now()
                ));
        }
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

    private static String rootCause(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String msg = cause.getMessage();
        String type = cause.getClass().getSimpleName();
        return msg == null || msg.isBlank() ? type : type + ": " + LogSanitizer.truncate(msg, MAX_CAUSE_CHARS);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
