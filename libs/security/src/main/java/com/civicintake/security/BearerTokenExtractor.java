package com.civicintake.security;

import java.util.Optional;

/**
 * Extracts the credential from an {@code Authorization} header value.
 * <p>
 * Only the exact form {@code Bearer <token>} is accepted: a case-sensitive scheme, a single
 * space, and a token without further spaces. Anything else is treated as no credential at all.
 */
public final class BearerTokenExtractor {

    /** The only accepted authorization scheme. */
    public static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the raw header value, may be null
     * @return the token, or empty when the header is absent or not a bearer header
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String[] parts = authorizationHeader.split(" ");
        if (parts.length != 2 || !SCHEME.equals(parts[0]) || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parts[1]);
    }
}
