package com.civicintake.authservice.error;

/** Request body or parameters are malformed. */
public class ValidationException extends ApiException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        this(CODE, message);
    }

    public ValidationException(String errorCode, String message) {
        super(400, errorCode, message);
    }
}
