package com.civicintake.security;

/**
 * Error codes surfaced to callers when authentication, authorization or refresh fails.
 * <p>
 * Each code fixes its HTTP status and the default message of the response envelope.
 */
public enum AuthErrorCode {

    MISSING_TOKEN(401, "Authentication required. No token provided."),
    INVALID_TOKEN(401, "Invalid or expired token. Please login again."),
    MISSING_REFRESH_TOKEN(401, "Refresh token not found. Please login again."),
    INVALID_REFRESH_TOKEN(401, "Invalid or expired refresh token. Please login again."),
    USER_NOT_FOUND(404, "User not found. Please login again."),
    FORBIDDEN(403, "Insufficient permissions. Access denied."),
    INVALID_ROLE(403, "Invalid role assigned to user. Access denied.");

    private final int httpStatus;
    private final String defaultMessage;

    AuthErrorCode(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
