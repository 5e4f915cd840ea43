package com.civicintake.authservice.infrastructure.web;

import com.civicintake.authservice.api.ApiResponse;
import com.civicintake.authservice.config.ServiceProperties;
import com.civicintake.authservice.error.ApiException;
import com.civicintake.authservice.error.AuthorizationException;
import com.civicintake.authservice.error.RateLimitExceededException;
import com.civicintake.authservice.error.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to the response envelope.
 *
 * <pre>
 * {
 *   "success": false,
 *   "message": "User already exists with this email",
 *   "error": "CONFLICT"
 * }
 * </pre>
 *
 * <p>Unexpected exceptions become 500 {@code INTERNAL_ERROR}; their message reaches the client
 * outside production only. Every failure is logged with the correlation ID from the MDC.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String GENERIC_MESSAGE = "An unexpected error occurred";

    private final ServiceProperties service;

    public GlobalExceptionHandler(ServiceProperties service) {
        this.service = service;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse> handleApiException(ApiException ex) {
        if (ex.status() >= 500) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.info("Request refused with {} {}: {}", ex.status(), ex.errorCode(), ex.getMessage());
        }
        String code = ex instanceof AuthorizationException forbidden && forbidden.reason() != null
                ? forbidden.reason().name()
                : null;
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(ex.status());
        if (ex instanceof RateLimitExceededException limited) {
            builder.header(HttpHeaders.RETRY_AFTER,
                    Long.toString(Math.max(1, limited.retryAfter().toSeconds())));
        }
        return builder.body(ApiResponse.failure(ex.getMessage(), ex.errorCode(), code));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> errors.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
        log.info("Validation failed: {}", errors);
        return ResponseEntity.badRequest()
                .body(ApiResponse.invalid("Validation failed", ValidationException.CODE, errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.info("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure("Malformed request body", ValidationException.CODE));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.failure(ex.getMessage(), ValidationException.CODE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        String message = service.isProduction() || ex.getMessage() == null ? GENERIC_MESSAGE : ex.getMessage();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure(message, INTERNAL_ERROR));
    }
}
