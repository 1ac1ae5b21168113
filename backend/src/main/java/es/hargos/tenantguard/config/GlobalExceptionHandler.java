package es.hargos.tenantguard.config;

import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.exception.DiscountCodeLimitReachedException;
import es.hargos.tenantguard.exception.TenantAccessException;
import es.hargos.tenantguard.rbac.RbacDeniedException;
import es.hargos.tenantguard.rbac.TenantAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {error, message, timestamp} bodies.
 * Unexpected exceptions never expose their message or stack trace.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RbacDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleRbacDenied(RbacDeniedException ex) {
        Map<String, Object> response = body("RbacDenied", ex.getMessage());
        response.put("deniedActions", ex.getDeniedActions().stream()
                .map(TenantAction::getValue)
                .collect(Collectors.toList()));
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
    }

    @ExceptionHandler(TenantAccessException.class)
    public ResponseEntity<Map<String, Object>> handleTenantAccess(TenantAccessException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("Forbidden", ex.getMessage()));
    }

    @ExceptionHandler(ApiErrorException.class)
    public ResponseEntity<Map<String, Object>> handleApiError(ApiErrorException ex) {
        return ResponseEntity.status(ex.getStatus()).body(body(ex.getError(), ex.getMessage()));
    }

    @ExceptionHandler(DiscountCodeLimitReachedException.class)
    public ResponseEntity<Map<String, Object>> handleDiscountLimit(DiscountCodeLimitReachedException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("DiscountCodeLimitReached", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = body("ValidationError", "Request validation failed");
        response.put("validationErrors", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("ValidationError", "Malformed request body"));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("ValidationError", "Invalid request parameter"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        logger.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("InternalError", "An unexpected error occurred"));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", System.currentTimeMillis());
        return response;
    }
}
