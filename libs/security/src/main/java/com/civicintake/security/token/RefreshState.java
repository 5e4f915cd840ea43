package com.civicintake.security.token;

/**
 * States of a refresh credential as seen by {@link CredentialRefresher}.
 */
public enum RefreshState {
    /** Handed to the caller and not yet exchanged. */
    ISSUED,
    /** Exchanged for a new pair; the new refresh credential replaces it in cookie storage. */
    ROTATED,
    /** Expired, invalid, missing, or its account is gone. The caller must log in again. */
    EXPIRED_OR_REJECTED
}
