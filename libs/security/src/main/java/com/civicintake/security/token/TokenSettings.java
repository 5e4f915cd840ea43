package com.civicintake.security.token;

import java.time.Duration;

/**
 * Issuer, audience and lifetimes shared by both credential types.
 *
 * @param issuer     value of the {@code iss} claim, required on verification
 * @param audience   value of the {@code aud} claim, required on verification
 * @param accessTtl  access credential lifetime
 * @param refreshTtl refresh credential lifetime, strictly longer than {@code accessTtl}
 */
public record TokenSettings(String issuer, String audience, Duration accessTtl, Duration refreshTtl) {

    public static final String DEFAULT_ISSUER = "civic-intake-api";
    public static final String DEFAULT_AUDIENCE = "civic-intake-client";
    public static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(7);

    public TokenSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be null or blank");
        }
        if (accessTtl == null || accessTtl.isNegative() || accessTtl.isZero()) {
            throw new IllegalArgumentException("accessTtl must be positive");
        }
        if (refreshTtl == null || refreshTtl.compareTo(accessTtl) <= 0) {
            throw new IllegalArgumentException(
                    "refreshTtl (%s) must be longer than accessTtl (%s)".formatted(refreshTtl, accessTtl));
        }
    }

    public static TokenSettings defaults() {
        return new TokenSettings(DEFAULT_ISSUER, DEFAULT_AUDIENCE, DEFAULT_ACCESS_TTL, DEFAULT_REFRESH_TTL);
    }
}
