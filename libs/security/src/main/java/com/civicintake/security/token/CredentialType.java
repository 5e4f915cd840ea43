package com.civicintake.security.token;

/**
 * The two kinds of credential, written into the {@code token_type} claim.
 */
public enum CredentialType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    CredentialType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
