package com.billing.common.error;

import com.billing.common.web.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException ex, HttpServletRequest request) {
        log.warn("{} {} -> {} {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getStatusCode().value(), ex.getCode(), ex.getReason());
        return build(ex.getStatusCode(), ex.getCode(), ex.getReason(), ex.getDetails(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, ErrorCodes.VALIDATION_FAILED, "Validation failed",
                Map.of("fields", fields), request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex,
                                                                   HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorCodes.VALIDATION_FAILED,
                ex.getMessage() == null ? "Validation failed" : ex.getMessage(), Map.of(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorCodes.VALIDATION_FAILED, "Malformed request body",
                Map.of(), request);
    }

    @ExceptionHandler(TypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(TypeMismatchException ex, HttpServletRequest request) {
        String name = ex.getPropertyName() == null ? "parameter" : ex.getPropertyName();
        return build(HttpStatus.BAD_REQUEST, ErrorCodes.VALIDATION_FAILED, "Invalid value for " + name,
                Map.of("fields", Map.of(name, String.valueOf(ex.getValue()))), request);
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ErrorResponse> handleTransient(TransientDataAccessException ex,
                                                         HttpServletRequest request) {
        log.error("Data store still failing after retries on {} {}", request.getMethod(),
                request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "TRANSIENT_FAILURE",
                "Temporary data store failure, retry the request", Map.of(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleOther(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            String message = framework.getBody().getDetail() == null
                    ? ex.getMessage() : framework.getBody().getDetail();
            return build(status, codeFor(status), message, Map.of(), request);
        }
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCodes.INTERNAL_ERROR, "Internal server error",
                Map.of(), request);
    }

    private static String codeFor(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved == null ? "HTTP_" + status.value() : resolved.name();
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatusCode status, String code, String message,
                                                       Map<String, Object> details, HttpServletRequest request) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        ErrorResponse body = new ErrorResponse(
                status.value(),
                resolved == null ? "Error" : resolved.getReasonPhrase(),
                code,
                message,
                request.getRequestURI(),
                RequestIdFilter.currentRequestId(),
                Instant.now(),
                details
        );
        return ResponseEntity.status(status).body(body);
    }
}
