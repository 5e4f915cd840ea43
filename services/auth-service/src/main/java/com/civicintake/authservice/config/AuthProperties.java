package com.civicintake.authservice.config;

import com.civicintake.security.token.TokenSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credential, rate-limit and bootstrap settings, bound from {@code civic.auth.*}.
 *
 * <p>Secrets are normally supplied through {@code JWT_SECRET} and {@code JWT_REFRESH_SECRET}.
 * Everything else has a default, applied in the compact constructors before validation runs.
 *
 * @param issuer {@code iss} claim of issued credentials
 * @param audience {@code aud} claim of issued credentials
 * @param accessTokenTtl access credential lifetime
 * @param refreshTokenTtl refresh credential lifetime
 * @param accessSecret access signing secret; blank falls back to a development secret
 * @param refreshSecret refresh signing secret; blank falls back to a development secret
 * @param rateLimit limits on the credential-issuing endpoints
 * @param admin administrator account created at startup when an email is configured
 */
@ConfigurationProperties(prefix = "civic.auth")
@Validated
public record AuthProperties(
        @NotBlank String issuer,
        @NotBlank String audience,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        String accessSecret,
        String refreshSecret,
        @Valid RateLimit rateLimit,
        Admin admin) {

    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = TokenSettings.DEFAULT_ISSUER;
        }
        if (audience == null || audience.isBlank()) {
            audience = TokenSettings.DEFAULT_AUDIENCE;
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = TokenSettings.DEFAULT_ACCESS_TTL;
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = TokenSettings.DEFAULT_REFRESH_TTL;
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(0, null, 0);
        }
        if (admin == null) {
            admin = new Admin(null, null, null);
        }
    }

    public TokenSettings tokenSettings() {
        return new TokenSettings(issuer, audience, accessTokenTtl, refreshTokenTtl);
    }

    /**
     * @param maxRequests requests allowed per client address and window
     * @param window window length
     * @param sweepIntervalMs how often expired windows are dropped
     */
    public record RateLimit(@Positive int maxRequests, Duration window, @Positive long sweepIntervalMs) {

        public RateLimit {
            if (maxRequests <= 0) {
                maxRequests = 5;
            }
            if (window == null || window.isZero() || window.isNegative()) {
                window = Duration.ofMinutes(1);
            }
            if (sweepIntervalMs <= 0) {
                sweepIntervalMs = 300_000;
            }
        }
    }

    /**
     * @param email administrator email; no account is seeded when blank
     * @param password initial password
     * @param name display name
     */
    public record Admin(String email, String password, String name) {

        public Admin {
            if (name == null || name.isBlank()) {
                name = "Administrator";
            }
        }

        public boolean isConfigured() {
            return email != null && !email.isBlank() && password != null && !password.isBlank();
        }
    }
}
