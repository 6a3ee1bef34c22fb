package com.di.bqsampler.exception;

import com.di.bqsampler.process.SamplingInterruptedException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps errors escaping the controllers to a JSON {@link ErrorResponse}.
 *
 * <p>For the push endpoint the status decides redelivery: 4xx marks a message that will
 * never succeed, 409 a deliberate pause, 5xx a failure worth retrying.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Malformed or unsupported commands and invalid input.
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        log.warn("[HTTP] Rejected request: {}", e.getMessage());
        return buildErrorResponse(e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Sampling lock present.
     */
    @ExceptionHandler(SamplingInterruptedException.class)
    public ResponseEntity<ErrorResponse> handleSamplingInterrupted(SamplingInterruptedException e) {
        log.warn("[HTTP] {}", e.getMessage());
        return buildErrorResponse(e, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("GlobalExceptionHandler caught exception: {}", e.getClass().getSimpleName(), e);
        return buildErrorResponse(e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return ResponseEntity.status(status).body(response);
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
