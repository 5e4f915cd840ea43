package com.civicintake.authservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.civicintake.authservice.config.ServiceProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for {@link SecurityHeadersFilter}: response headers and the cross-site write check.
 */
@DisplayName("SecurityHeadersFilter")
class SecurityHeadersFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SecurityHeadersFilter filter(String environment) {
        return new SecurityHeadersFilter(new ServiceProperties("auth-service", environment, null), objectMapper);
    }

    private static MockHttpServletRequest request(String method, String host, String origin) {
        var request = new MockHttpServletRequest(method, "/api/auth/logout");
        if (host != null) {
            request.addHeader("Host", host);
        }
        if (origin != null) {
            request.addHeader("Origin", origin);
        }
        return request;
    }

    @Nested
    @DisplayName("headers")
    class Headers {

        @Test
        @DisplayName("sets the browser security headers")
        void setsHeaders() throws Exception {
            var response = new MockHttpServletResponse();

            filter("development").doFilter(new MockHttpServletRequest("GET", "/"), response, (req, resp) -> {});

            assertThat(response.getHeader("X-Frame-Options")).isEqualTo("DENY");
            assertThat(response.getHeader("X-Content-Type-Options")).isEqualTo("nosniff");
            assertThat(response.getHeader("X-XSS-Protection")).isEqualTo("1; mode=block");
            assertThat(response.getHeader("Referrer-Policy")).isEqualTo("strict-origin-when-cross-origin");
            assertThat(response.getHeader("Content-Security-Policy")).contains("frame-ancestors 'none'");
            assertThat(response.getHeader("Strict-Transport-Security")).isNull();
        }

        @Test
        @DisplayName("adds HSTS in production")
        void addsHstsInProduction() throws Exception {
            var response = new MockHttpServletResponse();

            filter("production").doFilter(new MockHttpServletRequest("GET", "/"), response, (req, resp) -> {});

            assertThat(response.getHeader("Strict-Transport-Security")).startsWith("max-age=31536000");
        }
    }

    @Nested
    @DisplayName("cross-site writes")
    class CrossSiteWrites {

        @Test
        @DisplayName("blocks a POST whose origin names another host")
        void blocksForeignOrigin() throws Exception {
            var response = new MockHttpServletResponse();
            var reached = new AtomicBoolean();
            FilterChain chain = (req, resp) -> reached.set(true);

            filter("development").doFilter(request("POST", "api.civic.test", "https://evil.example"), response, chain);

            assertThat(reached).isFalse();
            assertThat(response.getStatus()).isEqualTo(403);
            assertThat(response.getContentAsString()).contains("\"error\":\"CSRF_PROTECTION\"");
        }

        @Test
        @DisplayName("passes a POST from the same host, port included")
        void passesSameOrigin() throws Exception {
            var reached = new AtomicBoolean();

            filter("development").doFilter(request("POST", "localhost:8080", "http://localhost:8080"),
                    new MockHttpServletResponse(), (req, resp) -> reached.set(true));

            assertThat(reached).isTrue();
        }

        @Test
        @DisplayName("passes a POST from an allowed front end")
        void passesAllowedFrontEnd() throws Exception {
            var reached = new AtomicBoolean();

            filter("development").doFilter(request("POST", "localhost:8080", "http://localhost:5173"),
                    new MockHttpServletResponse(), (req, resp) -> reached.set(true));

            assertThat(reached).isTrue();
        }

        @Test
        @DisplayName("passes a POST without an Origin header")
        void passesWithoutOrigin() throws Exception {
            var reached = new AtomicBoolean();

            filter("development").doFilter(request("POST", "api.civic.test", null),
                    new MockHttpServletResponse(), (req, resp) -> reached.set(true));

            assertThat(reached).isTrue();
        }

        @Test
        @DisplayName("passes a GET from a foreign origin")
        void passesSafeMethod() throws Exception {
            var reached = new AtomicBoolean();

            filter("development").doFilter(request("GET", "api.civic.test", "https://evil.example"),
                    new MockHttpServletResponse(), (req, resp) -> reached.set(true));

            assertThat(reached).isTrue();
        }
    }
}
