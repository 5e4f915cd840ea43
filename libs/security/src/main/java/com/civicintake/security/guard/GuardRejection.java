package com.civicintake.security.guard;

import com.civicintake.security.AuthErrorCode;
import com.civicintake.security.ForbiddenReason;

/**
 * Structured refusal produced by the guard.
 *
 * @param status  HTTP status to answer with
 * @param error   error code for the response envelope
 * @param reason  sub-code for plain authorization misses, null otherwise
 * @param message human-readable message
 */
public record GuardRejection(int status, AuthErrorCode error, ForbiddenReason reason, String message) {

    public GuardRejection {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        if (message == null) {
            message = error.defaultMessage();
        }
    }

    public static GuardRejection of(AuthErrorCode error) {
        return new GuardRejection(error.httpStatus(), error, null, error.defaultMessage());
    }

    static GuardRejection from(AccessDecision decision) {
        return new GuardRejection(decision.error().httpStatus(), decision.error(), decision.forbiddenReason(),
                decision.message());
    }
}
