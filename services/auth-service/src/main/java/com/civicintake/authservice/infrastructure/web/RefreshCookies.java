package com.civicintake.authservice.infrastructure.web;

import com.civicintake.authservice.config.ServiceProperties;
import java.time.Duration;
import org.springframework.http.ResponseCookie;

/**
 * Builds the cookie that carries the refresh credential.
 *
 * <p>HttpOnly, SameSite=Strict, path {@code /}, Secure in production, and lives exactly as long
 * as the credential inside it.
 */
public class RefreshCookies {

    public static final String COOKIE_NAME = "refreshToken";

    private final boolean secure;
    private final Duration maxAge;

    public RefreshCookies(ServiceProperties service, Duration refreshTtl) {
        this.secure = service.isProduction();
        this.maxAge = refreshTtl;
    }

    public ResponseCookie issue(String refreshCredential) {
        return base(refreshCredential).maxAge(maxAge).build();
    }

    /** A cookie that makes the browser delete the stored refresh credential. */
    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path("/");
    }
}
