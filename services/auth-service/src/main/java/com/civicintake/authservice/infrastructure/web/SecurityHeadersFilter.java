package com.civicintake.authservice.infrastructure.web;

import com.civicintake.authservice.api.ApiResponse;
import com.civicintake.authservice.config.ServiceProperties;
import com.civicintake.authservice.config.WebConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Adds browser security headers to every response and blocks cross-site state-changing requests.
 *
 * <p>A POST, PUT, PATCH or DELETE whose {@code Origin} names a different host than the
 * {@code Host} header is answered with 403 {@code CSRF_PROTECTION}, unless the origin is one of
 * the front ends allowed by CORS. Requests without an {@code Origin} header, such as those from
 * non-browser clients, pass.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class SecurityHeadersFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SecurityHeadersFilter.class);

    public static final String CSRF_ERROR = "CSRF_PROTECTION";

    static final String CONTENT_SECURITY_POLICY = String.join("; ",
            "default-src 'self'",
            "img-src 'self' data: https:",
            "font-src 'self' data:",
            "connect-src 'self'",
            "frame-ancestors 'none'",
            "base-uri 'self'",
            "form-action 'self'");

    private static final Set<String> STATE_CHANGING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final ServiceProperties service;
    private final ObjectMapper objectMapper;

    public SecurityHeadersFilter(ServiceProperties service, ObjectMapper objectMapper) {
        this.service = service;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        response.setHeader("X-XSS-Protection", "1; mode=block");
        response.setHeader("X-Frame-Options", "DENY");
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("Referrer-Policy", "strict-origin-when-cross-origin");
        response.setHeader("Permissions-Policy", "camera=(), microphone=(), geolocation=()");
        response.setHeader("Content-Security-Policy", CONTENT_SECURITY_POLICY);
        if (service.isProduction()) {
            response.setHeader("Strict-Transport-Security", "max-age=31536000; includeSubDomains; preload");
        }

        if (isCrossSiteWrite(request)) {
            log.warn("Cross-site request blocked: Origin {} does not match Host {}",
                    request.getHeader("Origin"), request.getHeader("Host"));
            response.setStatus(HttpServletResponse.SC_FORBIDDEN);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), ApiResponse.failure("Invalid origin", CSRF_ERROR));
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static boolean isCrossSiteWrite(HttpServletRequest request) {
        if (!STATE_CHANGING_METHODS.contains(request.getMethod())) {
            return false;
        }
        String origin = request.getHeader("Origin");
        String host = request.getHeader("Host");
        if (origin == null || origin.isBlank() || host == null || host.isBlank()) {
            return false;
        }
        if (WebConfig.ALLOWED_ORIGINS.contains(origin)) {
            return false;
        }
        return !host.equalsIgnoreCase(authorityOf(origin));
    }

    private static String authorityOf(String origin) {
        try {
            String authority = URI.create(origin.strip()).getRawAuthority();
            return authority != null ? authority : origin;
        } catch (IllegalArgumentException e) {
            return origin;
        }
    }
}
