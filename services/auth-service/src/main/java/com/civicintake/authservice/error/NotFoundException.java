package com.civicintake.authservice.error;

/** The addressed resource does not exist. */
public class NotFoundException extends ApiException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        this(CODE, message);
    }

    public NotFoundException(String errorCode, String message) {
        super(404, errorCode, message);
    }
}
