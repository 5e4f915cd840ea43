package com.civicintake.authservice.error;

/** The request conflicts with existing state. */
public class ConflictException extends ApiException {

    public static final String CODE = "CONFLICT";

    public ConflictException(String message) {
        this(CODE, message);
    }

    public ConflictException(String errorCode, String message) {
        super(409, errorCode, message);
    }
}
