package com.dbbridge.api.exception;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns every failure into a structured {@code success=false} response.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<Map<String, Object>> handleConnectionException(
        ConnectionException ex
    ) {
        if (ex.getErrorType() == ConnectionException.ErrorType.CONNECTION_NOT_FOUND
            || ex.getErrorType() == ConnectionException.ErrorType.QUERY_FAILED) {
            log.warn("{}: {}", ex.getErrorType(), ex.getMessage());
        } else {
            log.error("Connection exception occurred: {}", ex.toString(), ex);
        }

        HttpStatus status = mapErrorTypeToHttpStatus(ex.getErrorType());
        Map<String, Object> response = failure(status, ex.getMessage());
        response.put("errorType", ex.getErrorType().toString());

        if (ex.getBackend() != null) {
            response.put("backend", ex.getBackend());
        }
        if (ex.getConnectionId() != null) {
            response.put("connectionId", ex.getConnectionId());
        }

        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
        MethodArgumentNotValidException ex
    ) {
        log.error("Validation error occurred: {}", ex.getMessage());

        // Collect all field validation errors
        Map<String, String> fieldErrors = ex
            .getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(
                Collectors.toMap(
                    FieldError::getField,
                    fieldError -> String.valueOf(fieldError.getDefaultMessage()),
                    (existing, replacement) -> existing
                )
            );

        Map<String, Object> response = failure(
            HttpStatus.BAD_REQUEST,
            "Request validation failed: " + String.join(", ", fieldErrors.values())
        );
        response.put("errorType", "VALIDATION_ERROR");
        response.put("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(
        HttpMessageNotReadableException ex
    ) {
        log.error("Unreadable request body: {}", ex.getMessage());

        Map<String, Object> response = failure(HttpStatus.BAD_REQUEST, "Malformed request body");
        response.put("errorType", "VALIDATION_ERROR");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
        Exception ex
    ) {
        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);

        Map<String, Object> response = failure(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred while processing your request"
        );
        response.put("errorType", "INTERNAL_ERROR");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            response
        );
    }

    private Map<String, Object> failure(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("timestamp", LocalDateTime.now().toString());
        response.put("error", message);
        response.put("status", status.value());
        return response;
    }

    private HttpStatus mapErrorTypeToHttpStatus(
        ConnectionException.ErrorType errorType
    ) {
        switch (errorType) {
            case UNSUPPORTED_BACKEND:
            case QUERY_FAILED:
                return HttpStatus.BAD_REQUEST;
            case CONNECTION_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONNECT_FAILED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case BACKEND_ERROR:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
