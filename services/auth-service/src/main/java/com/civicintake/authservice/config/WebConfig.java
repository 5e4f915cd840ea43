package com.civicintake.authservice.config;

import com.civicintake.authservice.infrastructure.metrics.AuthMetrics;
import com.civicintake.authservice.infrastructure.ratelimit.CredentialEndpointRateLimitInterceptor;
import com.civicintake.security.ratelimit.RateLimiter;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the front ends and rate limiting of the credential endpoints.
 *
 * <p>Credentials are allowed cross-origin because the refresh credential travels in a cookie.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    /** Front ends allowed to call the API from a browser. */
    public static final List<String> ALLOWED_ORIGINS = List.of("http://localhost:3000", "http://localhost:5173");

    private final RateLimiter rateLimiter;
    private final AuthProperties auth;
    private final AuthMetrics metrics;
    private final Clock clock;

    public WebConfig(RateLimiter rateLimiter, AuthProperties auth, AuthMetrics metrics, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.auth = auth;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(ALLOWED_ORIGINS.toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID", "Retry-After")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new CredentialEndpointRateLimitInterceptor(
                        rateLimiter, auth.rateLimit(), metrics, clock))
                .addPathPatterns("/api/auth/login", "/api/auth/signup", "/api/auth/refresh");
    }
}
