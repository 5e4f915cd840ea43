package com.civicintake.security.token;

import com.civicintake.security.AuthErrorCode;
import com.civicintake.security.Principal;

/**
 * Result of exchanging a refresh credential.
 *
 * @param state     {@link RefreshState#ROTATED} on success, otherwise
 *                  {@link RefreshState#EXPIRED_OR_REJECTED}
 * @param principal freshly resolved principal, null when rejected
 * @param pair      newly issued credentials, null when rejected
 * @param error     rejection code, null when rotated
 */
public record RefreshOutcome(RefreshState state, Principal principal, CredentialPair pair, AuthErrorCode error) {

    public static RefreshOutcome rotated(Principal principal, CredentialPair pair) {
        return new RefreshOutcome(RefreshState.ROTATED, principal, pair, null);
    }

    public static RefreshOutcome rejected(AuthErrorCode error) {
        return new RefreshOutcome(RefreshState.EXPIRED_OR_REJECTED, null, null, error);
    }

    public boolean isRotated() {
        return state == RefreshState.ROTATED;
    }

    /**
     * Whether the stored refresh credential must be deleted from the caller.
     */
    public boolean clearsStoredCredential() {
        return !isRotated();
    }
}
