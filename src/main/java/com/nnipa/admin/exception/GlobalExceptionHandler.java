package com.nnipa.admin.exception;

import com.nnipa.admin.dto.response.ApiResponse;
import com.nnipa.admin.enums.PasswordRule;
import com.nnipa.admin.trace.TraceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service failures to {@link ApiResponse} bodies. Every body carries the trace id of
 * the failing request.
 *
 * <p>Audit and commit failures happen after the handler has returned and are answered by
 * {@link com.nnipa.admin.web.AdminRequestFilter}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PasswordRejectedException.class)
    public ResponseEntity<ApiResponse<Object>> handlePasswordRejected(PasswordRejectedException ex) {
        log.info("Password rejected ({}): {}", ex.getReason(), ex.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getReason());
        if (!ex.getUnmetRules().isEmpty()) {
            details.put("unmetRules", ex.getUnmetRules().stream().map(PasswordRule::name).toList());
            details.put("errors", ex.getUnmetRules().stream().map(PasswordRule::getDescription).toList());
        }
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.<Object>builder()
                .status("error")
                .message(ex.getMessage())
                .errorCode(ex.getErrorCode())
                .data(details)
                .build());
    }

    @ExceptionHandler(InvalidCredentialException.class)
    public ResponseEntity<ApiResponse<Object>> handleInvalidCredential(InvalidCredentialException ex) {
        log.warn("Invalid credential: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(AdminUserNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(AdminUserNotFoundException ex) {
        log.info(ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ApiResponse.error(ex.getMessage(), "ADMIN_USER_NOT_FOUND"));
    }

    @ExceptionHandler(DuplicateUsernameException.class)
    public ResponseEntity<ApiResponse<Object>> handleDuplicateUsername(DuplicateUsernameException ex) {
        log.info(ex.getMessage());
        return respond(HttpStatus.CONFLICT, ApiResponse.error(ex.getMessage(), "USERNAME_TAKEN"));
    }

    @ExceptionHandler({CredentialConflictException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ApiResponse<Object>> handleConcurrentChange(RuntimeException ex) {
        log.warn("Concurrent credential change: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT,
                ApiResponse.error("The record was changed concurrently, please retry", "CONCURRENT_MODIFICATION"));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT,
                ApiResponse.error("The change conflicts with existing data", "DATA_CONFLICT"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError
                    ? fieldError.getField()
                    : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        log.info("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.<Object>builder()
                .status("error")
                .message("Validation failed")
                .errorCode("VALIDATION_ERROR")
                .data(errors)
                .build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Object>> handleMalformedRequest(Exception ex) {
        log.info("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error("Malformed request", "MALFORMED_REQUEST"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoResource(NoResourceFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ApiResponse.error(ex.getMessage(), "METHOD_NOT_ALLOWED"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGlobalException(Exception ex) {
        log.error("Unexpected error: ", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                ApiResponse.error("An unexpected error occurred", "INTERNAL_ERROR"));
    }

    private ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, ApiResponse<Object> body) {
        body.setTraceId(TraceContext.currentOrSentinel());
        return ResponseEntity.status(status).body(body);
    }
}
