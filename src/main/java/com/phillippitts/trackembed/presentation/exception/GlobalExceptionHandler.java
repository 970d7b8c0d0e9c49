package com.phillippitts.trackembed.presentation.exception;

import com.phillippitts.trackembed.exception.EmbeddingNotFoundException;
import com.phillippitts.trackembed.exception.InvalidEmbeddingException;
import com.phillippitts.trackembed.exception.PipelineJobNotFoundException;
import com.phillippitts.trackembed.exception.VectorIndexException;
import com.phillippitts.trackembed.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Rejected request: {}", details);
        return badRequest(ex, "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", LogSanitizer.truncate(ex.getMessage(), 200));
        return badRequest(ex, "Invalid request", "Request body is not valid JSON");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadArgument(Exception ex) {
        LOG.warn("Bad request argument: {}", ex.getMessage());
        return badRequest(ex, "Invalid request", ex.getMessage());
    }

    /**
     * Client error - vector has the wrong dimensionality or a non-finite component (HTTP 400).
     */
    @ExceptionHandler(InvalidEmbeddingException.class)
    ResponseEntity<ApiError> handleInvalidEmbedding(InvalidEmbeddingException ex) {
        LOG.warn("Invalid embedding: expected={}, actual={}",
                ex.getExpectedDimension(), ex.getActualDimension());
        return badRequest(ex, "Invalid embedding", ex.getMessage());
    }

    /**
     * Unknown or already-released job token (HTTP 404).
     */
    @ExceptionHandler(PipelineJobNotFoundException.class)
    ResponseEntity<ApiError> handleJobNotFound(PipelineJobNotFoundException ex) {
        LOG.info("Status requested for unknown job: {}", ex.getJobToken());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Job not found",
                "Unknown token, or the job's final status was already returned",
                Instant.now()
            ));
    }

    @ExceptionHandler(EmbeddingNotFoundException.class)
    ResponseEntity<ApiError> handleEmbeddingNotFound(EmbeddingNotFoundException ex) {
        LOG.info("No embedding for track {}", ex.getTrackId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Embedding not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(VectorIndexException.class)
    ResponseEntity<ApiError> handleIndexFailure(VectorIndexException ex) {
        LOG.error("Vector index unavailable: op={}, attempts={}", ex.getOperation(), ex.getAttempts(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Vector index temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Pipeline worker pool saturated (HTTP 503).
     */
    @ExceptionHandler(TaskRejectedException.class)
    ResponseEntity<ApiError> handleRejected(TaskRejectedException ex) {
        LOG.warn("Job rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Pipeline busy",
                "Too many jobs in flight. Please retry later",
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
                "Contact support if problem persists",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(Exception ex, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standard error response format for API clients.
     *
     * @param errorCode Exception class name for programmatic handling
     * @param message User-friendly error message
     * @param details Additional context or remediation steps
     * @param timestamp When the error occurred
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
