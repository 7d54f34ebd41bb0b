package com.hrplatform.interfaces.api.exception;

import com.hrplatform.application.exceptions.DuplicateResourceException;
import com.hrplatform.application.exceptions.EmployeeNotFoundException;
import com.hrplatform.infrastructure.crypto.EncryptionException;
import com.hrplatform.infrastructure.security.ConfigurationException;
import com.hrplatform.infrastructure.security.TrustedSecurityKernel;
import com.hrplatform.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Provides centralized exception handling with:
 * - Security-aware error responses (no sensitive data leakage)
 * - Standard error format
 * - Proper HTTP status codes
 *
 * Rejected values are never echoed back: they may be plaintext sensitive attributes.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.ValidationError.builder()
                .field(error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName())
                .message(error.getDefaultMessage())
                .build())
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), safePath(request));
        }

        ErrorResponse errorResponse = baseError(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid request parameters", request);
        errorResponse.setValidationErrors(validationErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(
            DuplicateResourceException ex,
            HttpServletRequest request) {

        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(baseError(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request));
    }

    @ExceptionHandler(EmployeeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            EmployeeNotFoundException ex,
            HttpServletRequest request) {

        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(baseError(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request));
    }

    /**
     * Handle permission denials from SecurityKernel.
     */
    @ExceptionHandler(TrustedSecurityKernel.PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(
            TrustedSecurityKernel.PermissionDeniedException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Access denied: {} on {}", ex.getMessage(), safePath(request));
        }

        ErrorResponse errorResponse = baseError(HttpStatus.FORBIDDEN, "Access Denied", ex.getMessage(), request);
        if (!ex.getRejectedFields().isEmpty()) {
            errorResponse.setRejectedFields(ex.getRejectedFields());
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(errorResponse);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument: {} on {}", ex.getMessage(), safePath(request));
        }

        return ResponseEntity.badRequest()
            .body(baseError(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Unreadable request on {}: {}", safePath(request), ex.getClass().getSimpleName());
        }

        return ResponseEntity.badRequest()
            .body(baseError(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request));
    }

    /**
     * Handle unauthenticated access to the application layer.
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ErrorResponse> handleSecurityException(
            SecurityException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Security exception: {} on {}", ex.getMessage(), safePath(request));
        }

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .body(baseError(HttpStatus.UNAUTHORIZED, "Unauthorized", "Authentication required", request));
    }

    /**
     * Crypto and configuration failures never expose detail to the caller.
     */
    @ExceptionHandler({EncryptionException.class, ConfigurationException.class})
    public ResponseEntity<ErrorResponse> handleDataProtectionFailure(
            RuntimeException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Data protection failure on {}: {}", safePath(request), ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(baseError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support.", request));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}", safePath(request), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(baseError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support.", request));
    }

    private static ErrorResponse baseError(HttpStatus status, String error, String message, HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .build();
    }

    private static String safePath(HttpServletRequest request) {
        return Encode.forJava(request.getRequestURI());
    }
}
