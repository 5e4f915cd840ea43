package com.civicintake.authservice.error;

/** The caller could not be authenticated. */
public class AuthenticationException extends ApiException {

    public static final String CODE = "INVALID_CREDENTIALS";

    public AuthenticationException(String message) {
        this(CODE, message);
    }

    public AuthenticationException(String errorCode, String message) {
        super(401, errorCode, message);
    }
}
