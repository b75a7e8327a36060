package com.mcr.dispatch.api;

import com.mcr.core.error.BackendTimeoutException;
import com.mcr.core.error.McrException;
import com.mcr.core.error.RefinementExhaustedException;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.refine.RefinementAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps failures to the machine-readable error body:
 * <pre>
 * { "error_code": "VALIDATION_FAILED", "message": "...", "timestamp": "..." }
 * </pre>
 * Validation failures that went through refinement also carry {@code history}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BackendTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleTimeout(BackendTimeoutException ex) {
        log.warn("Backend {} timed out: {}", ex.getBackend(), ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(McrException.class)
    public ResponseEntity<Map<String, Object>> handleMcr(McrException ex) {
        HttpStatus status = switch (ex.getCategory()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case BACKEND -> HttpStatus.BAD_GATEWAY;
        };
        if (status == HttpStatus.BAD_GATEWAY) {
            log.error("Backend failure [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("Request failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        }
        Map<String, Object> body = errorResponse(ex.getErrorCode(), ex.getMessage());
        List<RefinementAttempt> history = historyOf(ex);
        if (!history.isEmpty()) {
            body.put("history", history);
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private static List<RefinementAttempt> historyOf(McrException ex) {
        if (ex instanceof ValidationFailedException v) {
            return v.getHistory();
        }
        if (ex instanceof RefinementExhaustedException r) {
            return r.getHistory();
        }
        return List.of();
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
