package com.civicintake.authservice.error;

import com.civicintake.security.ForbiddenReason;

/** The authenticated caller may not perform the operation. */
public class AuthorizationException extends ApiException {

    public static final String CODE = "FORBIDDEN";

    private final ForbiddenReason reason;

    public AuthorizationException(ForbiddenReason reason, String message) {
        super(403, CODE, message);
        this.reason = reason;
    }

    /** Sub-code of the refusal, may be null. */
    public ForbiddenReason reason() {
        return reason;
    }
}
