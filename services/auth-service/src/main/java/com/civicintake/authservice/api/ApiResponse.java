package com.civicintake.authservice.api;

import com.civicintake.security.guard.GuardRejection;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Envelope of every response body, successful or not. Absent fields are left out of the JSON.
 *
 * <pre>
 * {
 *   "success": false,
 *   "message": "Insufficient permissions. Required role: ADMIN",
 *   "error": "FORBIDDEN",
 *   "code": "ROLE_REQUIRED"
 * }
 * </pre>
 *
 * @param success whether the request succeeded
 * @param message human-readable outcome
 * @param error error code on failure
 * @param code sub-code refining {@code error}
 * @param accessToken access credential, on endpoints that issue one
 * @param user the account the response concerns
 * @param data endpoint-specific payload
 * @param errors field validation messages
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        boolean success,
        String message,
        String error,
        String code,
        String accessToken,
        UserView user,
        Object data,
        Map<String, String> errors) {

    public static ApiResponse ok(String message) {
        return new ApiResponse(true, message, null, null, null, null, null, null);
    }

    public static ApiResponse ok(String message, Object data) {
        return new ApiResponse(true, message, null, null, null, null, data, null);
    }

    public static ApiResponse withUser(String message, UserView user) {
        return new ApiResponse(true, message, null, null, null, user, null, null);
    }

    public static ApiResponse session(String message, String accessToken, UserView user) {
        return new ApiResponse(true, message, null, null, accessToken, user, null, null);
    }

    public static ApiResponse failure(String message, String error) {
        return new ApiResponse(false, message, error, null, null, null, null, null);
    }

    public static ApiResponse failure(String message, String error, String code) {
        return new ApiResponse(false, message, error, code, null, null, null, null);
    }

    public static ApiResponse invalid(String message, String error, Map<String, String> errors) {
        return new ApiResponse(false, message, error, null, null, null, null, errors);
    }

    public static ApiResponse rejected(GuardRejection rejection) {
        return failure(rejection.message(), rejection.error().name(),
                rejection.reason() != null ? rejection.reason().name() : null);
    }
}
