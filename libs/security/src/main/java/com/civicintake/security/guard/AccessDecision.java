package com.civicintake.security.guard;

import com.civicintake.security.AuthErrorCode;
import com.civicintake.security.ForbiddenReason;

/**
 * Outcome of evaluating an {@link AccessRule} against an authenticated principal.
 *
 * @param allowed         whether the rule is satisfied
 * @param error           error code when refused, null when allowed
 * @param forbiddenReason sub-code for a plain miss, null for allow and for an unknown role
 * @param message         reason, used for both the audit trail and the response
 */
public record AccessDecision(boolean allowed, AuthErrorCode error, ForbiddenReason forbiddenReason, String message) {

    public AccessDecision {
        if (!allowed && error == null) {
            throw new IllegalArgumentException("a refusal needs an error code");
        }
    }

    public static AccessDecision allow(String message) {
        return new AccessDecision(true, null, null, message);
    }

    public static AccessDecision forbidden(ForbiddenReason reason, String message) {
        return new AccessDecision(false, AuthErrorCode.FORBIDDEN, reason, message);
    }

    public static AccessDecision invalidRole(String role) {
        return new AccessDecision(false, AuthErrorCode.INVALID_ROLE, null,
                "Role '%s' is not a recognised role. Access denied.".formatted(role));
    }
}
