package com.phillippitts.ellie.presentation.exception;

import com.phillippitts.ellie.exception.EllieException;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts exceptions to {@link ApiError} bodies with user-safe messages. Internal detail stays in
 * the logs.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Rejected request: {}", details);
        return error(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT, details);
    }

    /**
     * Client error - unreadable body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return error(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT, "Malformed JSON body");
    }

    /**
     * Transient upstream error that escaped the pipeline's fallbacks (HTTP 503).
     */
    @ExceptionHandler(ProviderException.class)
    ResponseEntity<ApiError> handleProvider(ProviderException ex) {
        LOG.error("Provider failure reached the REST boundary: provider={}", ex.getProviderName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.EXTERNAL_API_ERROR, null);
    }

    @ExceptionHandler(EllieException.class)
    ResponseEntity<ApiError> handleDomain(EllieException ex) {
        ErrorCode code = ex.getErrorCode() == null ? ErrorCode.INTERNAL_SERVER_ERROR : ex.getErrorCode();
        HttpStatus status = switch (code) {
            case INVALID_INPUT, INVALID_AUDIO_FORMAT, AUDIO_TOO_LARGE -> HttpStatus.BAD_REQUEST;
            case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case SERVICE_UNAVAILABLE, EXTERNAL_API_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONNECTION_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            LOG.error("Request failed: code={}", code, ex);
        } else {
            LOG.warn("Request rejected: code={}, reason={}", code, ex.getMessage());
        }
        return error(status, code, status.is4xxClientError() ? ex.getMessage() : null);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR,
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, ErrorCode code, String details) {
        return ResponseEntity
                .status(status)
                .body(new ApiError(code.name(), code.userMessage(), details, Instant.now(),
                        ThreadContext.get("requestId")));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
            String errorCode,
            String message,
            String details,
            Instant timestamp,
            String requestId
    ) {}
}
