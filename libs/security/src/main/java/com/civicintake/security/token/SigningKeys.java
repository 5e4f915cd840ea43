package com.civicintake.security.token;

import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC keys for the two credential types.
 * <p>
 * Secrets come from the environment. When one is missing a built-in development secret is used
 * instead and a warning is logged; {@link #usingFallback()} lets the caller refuse to start in
 * environments where that is unacceptable.
 */
public final class SigningKeys {

    private static final Logger log = LoggerFactory.getLogger(SigningKeys.class);

    /** HS256 needs at least 256 bits of key material. */
    public static final int MIN_SECRET_BYTES = 32;

    static final String FALLBACK_ACCESS_SECRET = "civic-intake-development-access-secret-change-me";
    static final String FALLBACK_REFRESH_SECRET = "civic-intake-development-refresh-secret-change-me";

    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final boolean usingFallback;

    private SigningKeys(SecretKey accessKey, SecretKey refreshKey, boolean usingFallback) {
        this.accessKey = accessKey;
        this.refreshKey = refreshKey;
        this.usingFallback = usingFallback;
    }

    /**
     * Builds keys from configured secrets, substituting development secrets for blank ones.
     *
     * @throws IllegalArgumentException if a configured secret is shorter than
     *                                  {@value #MIN_SECRET_BYTES} bytes
     */
    public static SigningKeys fromSecrets(String accessSecret, String refreshSecret) {
        boolean accessMissing = accessSecret == null || accessSecret.isBlank();
        boolean refreshMissing = refreshSecret == null || refreshSecret.isBlank();
        if (accessMissing || refreshMissing) {
            log.warn("JWT signing secrets are not configured (access missing: {}, refresh missing: {}). "
                    + "Using built-in development secrets, NOT SECURE FOR PRODUCTION", accessMissing, refreshMissing);
        }
        String access = accessMissing ? FALLBACK_ACCESS_SECRET : accessSecret;
        String refresh = refreshMissing ? FALLBACK_REFRESH_SECRET : refreshSecret;
        if (access.equals(refresh)) {
            log.warn("Access and refresh credentials share one signing secret; configure distinct secrets");
        }
        return new SigningKeys(
                toKey("access", access),
                toKey("refresh", refresh),
                accessMissing || refreshMissing);
    }

    public SecretKey keyFor(CredentialType type) {
        return type == CredentialType.ACCESS ? accessKey : refreshKey;
    }

    /**
     * Whether either key was derived from a built-in development secret.
     */
    public boolean usingFallback() {
        return usingFallback;
    }

    private static SecretKey toKey(String name, String secret) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("%s signing secret must be at least %d bytes, got %d"
                    .formatted(name, MIN_SECRET_BYTES, bytes.length));
        }
        return Keys.hmacShaKeyFor(bytes);
    }
}
