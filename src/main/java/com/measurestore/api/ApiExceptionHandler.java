package com.measurestore.api;

import com.measurestore.contract.ConstraintViolationException;
import com.measurestore.contract.DuplicateFactException;
import com.measurestore.contract.InvalidPeriodException;
import com.measurestore.contract.RangeViolationException;
import com.measurestore.contract.ReferentialIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error body for every endpoint:
 * <pre>
 * {
 *   "error_code": "DUPLICATE_FACT",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * </pre>
 *
 * <ul>
 *   <li>400 {@code CONSTRAINT_VIOLATION}: blank name, bad ISO length, unknown type, kind or direction</li>
 *   <li>400 {@code INVALID_PERIOD}: period value missing, doubled, mismatched or unparseable</li>
 *   <li>400 {@code RANGE_ERROR}: non-finite value, confidence outside [0, 1]</li>
 *   <li>400 {@code BAD_REQUEST}: unreadable JSON, including a fractional number for an integer field</li>
 *   <li>400 {@code INVALID_ARGUMENT}: required request field absent, unknown sort order</li>
 *   <li>409 {@code DUPLICATE_FACT}: the (entity, metric, period) triple already has a value</li>
 *   <li>409 {@code REFERENTIAL_INTEGRITY}: dangling reference, restricted or missing-row delete</li>
 * </ul>
 * Anything else is logged and answered with 500 {@code INTERNAL_ERROR}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return errorResponse("CONSTRAINT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(InvalidPeriodException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidPeriod(InvalidPeriodException ex) {
        log.warn("Invalid period: {}", ex.getMessage());
        return errorResponse("INVALID_PERIOD", ex.getMessage());
    }

    @ExceptionHandler(RangeViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleRange(RangeViolationException ex) {
        log.warn("Range violation: {}", ex.getMessage());
        return errorResponse("RANGE_ERROR", ex.getMessage());
    }

    @ExceptionHandler(DuplicateFactException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateFact(DuplicateFactException ex) {
        log.warn("Duplicate fact: {}", ex.getMessage());
        return errorResponse("DUPLICATE_FACT", ex.getMessage());
    }

    @ExceptionHandler(ReferentialIntegrityException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleReferentialIntegrity(ReferentialIntegrityException ex) {
        log.warn("Referential integrity: {}", ex.getMessage());
        return errorResponse("REFERENTIAL_INTEGRITY", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
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

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
