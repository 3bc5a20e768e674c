package com.aim.auth.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler provides centralized exception handling across all
 * controllers, ensuring consistent error responses are returned to the client.
 *
 * Authentication failures are collapsed into one generic 401 so a caller
 * cannot tell which check failed; the specific kind is only logged.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles authentication and authorization failures.
     */
    @ExceptionHandler(AuthException.class)
    public ResponseEntity<Map<String, Object>> handleAuthException(AuthException ex) {
        switch (ex.getKind()) {
            case FORBIDDEN:
                return buildErrorResponse(HttpStatus.FORBIDDEN, "Insufficient permissions.", "FORBIDDEN");
            case ACCOUNT_INACTIVE:
                log.warn("Rejected: account inactive");
                return buildErrorResponse(HttpStatus.FORBIDDEN, "This account is deactivated.", "ACCOUNT_INACTIVE");
            default:
                log.warn("Unauthorized: {} ({})", ex.getKind(), ex.getMessage());
                ResponseEntity<Map<String, Object>> body = buildErrorResponse(
                        HttpStatus.UNAUTHORIZED, "Invalid or expired credentials.", "UNAUTHORIZED");
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                        .body(body.getBody());
        }
    }

    /**
     * Handles rejected registrations: 409 for taken username / email, 400 otherwise.
     */
    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<Map<String, Object>> handleRegistrationException(RegistrationException ex) {
        log.warn("Registration rejected: {} ({})", ex.getKind(), ex.getMessage());
        HttpStatus status = ex.isConflict() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        return buildErrorResponse(status, ex.getMessage(), ex.getKind().name());
    }

    @ExceptionHandler(PolicyViolationException.class)
    public ResponseEntity<Map<String, Object>> handlePolicyViolation(PolicyViolationException ex) {
        log.warn("Password policy violation: {}", ex.getRule());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "WEAK_PASSWORD");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "NOT_FOUND");
    }

    /**
     * Storage retries are exhausted by the time this arrives.
     */
    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Service temporarily unavailable. Please try again later.",
                "STORAGE_UNAVAILABLE"
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation failed: " + errors, "VALIDATION_FAILED");
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String message = ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request body.";
        return buildErrorResponse(HttpStatus.BAD_REQUEST, message, "INVALID_REQUEST");
    }

    /**
     * Catch-all handler for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.",
                "INTERNAL_SERVER_ERROR"
        );
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "errorCode", errorCode,
                "status", status.value(),
                "timestamp", LocalDateTime.now().toString()
        ));
    }
}
