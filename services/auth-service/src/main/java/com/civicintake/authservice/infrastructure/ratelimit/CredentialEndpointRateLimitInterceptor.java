package com.civicintake.authservice.infrastructure.ratelimit;

import com.civicintake.authservice.config.AuthProperties;
import com.civicintake.authservice.error.RateLimitExceededException;
import com.civicintake.authservice.infrastructure.metrics.AuthMetrics;
import com.civicintake.security.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the fixed-window limit to the endpoints that issue credentials, keyed by client
 * address. Registered for login, signup and refresh only; the three share one budget per address.
 */
public class CredentialEndpointRateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CredentialEndpointRateLimitInterceptor.class);

    private final RateLimiter rateLimiter;
    private final AuthProperties.RateLimit limits;
    private final AuthMetrics metrics;
    private final Clock clock;

    public CredentialEndpointRateLimitInterceptor(
            RateLimiter rateLimiter, AuthProperties.RateLimit limits, AuthMetrics metrics, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.limits = limits;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String client = request.getRemoteAddr();
        if (rateLimiter.allow(client, limits.maxRequests(), limits.window())) {
            return true;
        }
        metrics.rateLimited();
        log.warn("Rate limited {} on {}", client, request.getRequestURI());
        Duration retryAfter = rateLimiter.resetAt(client)
                .map(reset -> Duration.between(clock.instant(), reset))
                .orElse(limits.window());
        throw new RateLimitExceededException(retryAfter);
    }
}
