package com.phillippitts.clipcast.presentation.exception;

import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.exception.EncoderNotFoundException;
import com.phillippitts.clipcast.exception.EncodingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts domain exceptions to HTTP responses; details stay in the server log.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * No capture backend could start (HTTP 503).
     */
    @ExceptionHandler(CaptureException.class)
    ResponseEntity<ApiError> handleCapture(CaptureException ex) {
        LOG.error("Capture failed: backend={}, kind={}", ex.getBackend(), ex.getKind(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Screen capture unavailable",
                "Check Screen Recording permission or install ffmpeg");
    }

    /**
     * Setup problem, not retryable until ffmpeg is installed (HTTP 503).
     */
    @ExceptionHandler(EncoderNotFoundException.class)
    ResponseEntity<ApiError> handleEncoderNotFound(EncoderNotFoundException ex) {
        LOG.error("ffmpeg not found; searched {}", ex.getSearched());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Encoder unavailable",
                "Install ffmpeg or set encoder.ffmpeg-path");
    }

    @ExceptionHandler(EncodingException.class)
    ResponseEntity<ApiError> handleEncoding(EncodingException ex) {
        LOG.error("Encoding failed: error={}, exitCode={}", ex.getError(), ex.getExitCode(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Encoding failed",
                ex.getError().userHint());
    }

    /**
     * Client error, invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred",
                "Please retry; check the server log with the request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
