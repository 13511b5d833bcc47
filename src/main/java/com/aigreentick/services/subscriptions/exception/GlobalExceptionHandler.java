package com.aigreentick.services.subscriptions.exception;

import com.aigreentick.services.subscriptions.dto.response.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service exceptions to ApiResponse errors.
 *
 *   InvalidRequestException        → 400
 *   SubscriptionNotFound / PlanNotFound → 404
 *   DuplicateSubscriptionException → 409
 *   MpesaGatewayException          → 502 (message is the user-facing sentence)
 *   MpesaAuthException             → 503
 *   MpesaNetworkException          → 503
 *
 * Unexpected errors answer a generic 500, never a stack trace.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // ========================
    // Business Logic Exceptions
    // ========================

    @ExceptionHandler({SubscriptionNotFoundException.class, PlanNotFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleNotFound(
            SubscriptionServiceException ex,
            HttpServletRequest request
    ) {
        log.warn("Not found: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(DuplicateSubscriptionException.class)
    public ResponseEntity<ApiResponse<Void>> handleDuplicateSubscription(
            DuplicateSubscriptionException ex,
            HttpServletRequest request
    ) {
        log.warn("Duplicate subscription: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(
            InvalidRequestException ex,
            HttpServletRequest request
    ) {
        log.warn("Invalid request: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    // ========================
    // M-Pesa Exceptions
    // ========================

    @ExceptionHandler(MpesaGatewayException.class)
    public ResponseEntity<ApiResponse<Void>> handleGatewayError(
            MpesaGatewayException ex,
            HttpServletRequest request
    ) {
        log.error("M-Pesa gateway error: code={}, desc={} - Path: {}",
                ex.getGatewayCode(), ex.getGatewayDescription(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(MpesaAuthException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuthError(
            MpesaAuthException ex,
            HttpServletRequest request
    ) {
        log.error("M-Pesa authentication error: {} - Path: {}", ex.getMessage(), request.getRequestURI(), ex);
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error("Payments are temporarily unavailable. Please try again later.",
                        ex.getErrorCode()));
    }

    @ExceptionHandler(MpesaNetworkException.class)
    public ResponseEntity<ApiResponse<Void>> handleNetworkError(
            MpesaNetworkException ex,
            HttpServletRequest request
    ) {
        log.error("M-Pesa network error (timedOut={}): {} - Path: {}",
                ex.isTimedOut(), ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    // ========================
    // Validation Exceptions
    // ========================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidationErrors(
            MethodArgumentNotValidException ex
    ) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }

        log.warn("Validation failed: {}", fieldErrors);

        ApiResponse<Map<String, String>> response = ApiResponse.<Map<String, String>>builder()
                .success(false)
                .message("Validation failed")
                .data(fieldErrors)
                .error(ApiResponse.ErrorDetails.builder()
                        .code("VALIDATION_ERROR")
                        .message("One or more fields have invalid values")
                        .build())
                .build();

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(
            ConstraintViolationException ex
    ) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), "CONSTRAINT_VIOLATION"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingHeader(
            MissingRequestHeaderException ex
    ) {
        String message = "Required header '" + ex.getHeaderName() + "' is missing";
        log.warn(message);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(message, "MISSING_HEADER"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex
    ) {
        String message = "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'";
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(message, "INVALID_PARAMETER_TYPE"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadable(
            HttpMessageNotReadableException ex
    ) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid request body format", "INVALID_REQUEST_BODY"));
    }

    // ========================
    // Database Exceptions
    // ========================

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataIntegrityViolation(
            DataIntegrityViolationException ex
    ) {
        log.error("Database integrity violation", ex);
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.error("Data conflict: a constraint was violated", "DATA_INTEGRITY_VIOLATION"));
    }

    // ========================
    // Fallback Exception
    // ========================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        log.error("Unexpected error at path {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred. Please try again later.", "INTERNAL_SERVER_ERROR"));
    }
}
