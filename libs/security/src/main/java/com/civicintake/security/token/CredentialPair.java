package com.civicintake.security.token;

/**
 * Access and refresh credentials issued together at login, signup and refresh.
 */
public record CredentialPair(String accessCredential, String refreshCredential) {

    public CredentialPair {
        if (accessCredential == null || refreshCredential == null) {
            throw new IllegalArgumentException("both credentials are required");
        }
    }

    @Override
    public String toString() {
        return "CredentialPair[accessCredential=<redacted>, refreshCredential=<redacted>]";
    }
}
