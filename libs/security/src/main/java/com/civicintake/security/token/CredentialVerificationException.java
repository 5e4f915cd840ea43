package com.civicintake.security.token;

/**
 * A credential failed verification.
 * <p>
 * {@link Failure#EXPIRED} means the credential was ours and the holder should authenticate
 * again; the other failures mean it was never a valid credential for this service.
 */
public class CredentialVerificationException extends RuntimeException {

    public enum Failure {
        /** Signature and claims were fine but the expiry has passed. */
        EXPIRED,
        /** Not a parseable signed token, or the signature does not match our key. */
        MALFORMED,
        /** Correctly signed but for another issuer, audience or credential type. */
        CLAIM_MISMATCH
    }

    private final CredentialType credentialType;
    private final Failure failure;

    public CredentialVerificationException(CredentialType credentialType, Failure failure, String message,
                                           Throwable cause) {
        super(message, cause);
        this.credentialType = credentialType;
        this.failure = failure;
    }

    public CredentialType credentialType() {
        return credentialType;
    }

    public Failure failure() {
        return failure;
    }
}
