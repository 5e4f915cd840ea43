package com.civicintake.authservice.error;

/**
 * Base of the failures the service reports to callers. Each subclass fixes the HTTP status;
 * the error code defaults per subclass and may be narrowed by the thrower.
 */
public abstract class ApiException extends RuntimeException {

    private final int status;
    private final String errorCode;

    protected ApiException(int status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public int status() {
        return status;
    }

    public String errorCode() {
        return errorCode;
    }
}
