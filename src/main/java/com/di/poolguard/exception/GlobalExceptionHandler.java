package com.di.poolguard.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps access layer failures to structured {@link ErrorResponse} bodies.
 *
 * <p>Status codes:
 * <ul>
 *   <li>{@link PoolConfigException}, {@link IllegalArgumentException}: 400</li>
 *   <li>{@link CircuitOpenException}: 503 (nothing was attempted)</li>
 *   <li>{@link OperationFailedException}: 502 (the database kept failing)</li>
 *   <li>{@link OperationAbortedException}: 503 (shutting down)</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({PoolConfigException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleConfigException(RuntimeException e) {
        return respond("CONFIG_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ErrorResponse> handleCircuitOpen(CircuitOpenException e) {
        ErrorResponse body = buildErrorResponse(ErrorCategory.CIRCUIT_OPEN, e, HttpStatus.SERVICE_UNAVAILABLE);
        body.addDetail("operation", e.getOperationName());
        log.warn("GlobalExceptionHandler rejected request: {} [{}]", e.getMessage(), ErrorCategory.CIRCUIT_OPEN.getName());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(OperationFailedException.class)
    public ResponseEntity<ErrorResponse> handleOperationFailed(OperationFailedException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("OPERATION_FAILED", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY);
        body.addDetail("operation", e.getOperationName());
        body.addDetail("attempts", e.getAttempts());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(OperationAbortedException.class)
    public ResponseEntity<ErrorResponse> handleOperationAborted(OperationAbortedException e) {
        return respond("OPERATION_ABORTED", e, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Catch-all.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Exception e, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(eventType, category, e);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            log.error("GlobalExceptionHandler caught exception: event={} | type={} | category={} | rootCause={}: {}",
                    eventType, exception.getClass().getSimpleName(), category.getName(),
                    rootCause.getClass().getSimpleName(), rootCause.getMessage(), exception);
        } else {
            log.error("GlobalExceptionHandler caught exception: event={} | type={} | category={}",
                    eventType, exception.getClass().getSimpleName(), category.getName(), exception);
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
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
}
