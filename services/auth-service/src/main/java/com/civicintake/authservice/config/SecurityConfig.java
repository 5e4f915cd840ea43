package com.civicintake.authservice.config;

import com.civicintake.authservice.domain.AccountService;
import com.civicintake.authservice.domain.InMemoryUserAccountRepository;
import com.civicintake.authservice.domain.UserAccount;
import com.civicintake.authservice.domain.UserAccountRepository;
import com.civicintake.authservice.infrastructure.audit.MeteredAuditSink;
import com.civicintake.authservice.infrastructure.metrics.AuthMetrics;
import com.civicintake.authservice.infrastructure.web.RefreshCookies;
import com.civicintake.observability.MetricFactory;
import com.civicintake.observability.SensitiveDataRedactor;
import com.civicintake.observability.SpanHelper;
import com.civicintake.security.PrincipalStore;
import com.civicintake.security.audit.AuditRecorder;
import com.civicintake.security.audit.CompositeAuditSink;
import com.civicintake.security.audit.InMemoryAuditSink;
import com.civicintake.security.audit.Slf4jAuditSink;
import com.civicintake.security.guard.AuthorizationGuard;
import com.civicintake.security.ratelimit.RateLimiter;
import com.civicintake.security.token.CredentialRefresher;
import com.civicintake.security.token.SigningKeys;
import com.civicintake.security.token.TokenLifecycleManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Wires the session and authorization core into the application context.
 *
 * <p>The core classes are framework-free; everything they need is handed to them here. Startup
 * fails in production when the signing secrets are not configured.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SigningKeys signingKeys(AuthProperties auth, ServiceProperties service) {
        SigningKeys keys = SigningKeys.fromSecrets(auth.accessSecret(), auth.refreshSecret());
        if (keys.usingFallback() && service.isProduction()) {
            throw new IllegalStateException(
                    "JWT_SECRET and JWT_REFRESH_SECRET must be configured in production");
        }
        return keys;
    }

    @Bean
    public TokenLifecycleManager tokenLifecycleManager(AuthProperties auth, SigningKeys keys, Clock clock) {
        return new TokenLifecycleManager(auth.tokenSettings(), keys, clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public AuthMetrics authMetrics(MetricFactory metricFactory) {
        return new AuthMetrics(metricFactory);
    }

    @Bean
    public InMemoryAuditSink inMemoryAuditSink() {
        return new InMemoryAuditSink();
    }

    @Bean
    public AuditRecorder auditRecorder(InMemoryAuditSink recentEvents, AuthMetrics metrics, Clock clock) {
        var sink = CompositeAuditSink.of(new Slf4jAuditSink(), recentEvents, new MeteredAuditSink(metrics));
        return new AuditRecorder(sink, clock, new SensitiveDataRedactor());
    }

    /**
     * Spans go to whatever OpenTelemetry SDK the deployment installs globally, the java agent for
     * instance; without one they are no-ops.
     */
    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean
    public AuthorizationGuard authorizationGuard(
            TokenLifecycleManager tokens, AuditRecorder auditRecorder, SpanHelper spanHelper) {
        return new AuthorizationGuard(tokens, auditRecorder, spanHelper);
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock) {
        return new RateLimiter(clock);
    }

    @Bean
    public UserAccountRepository userAccountRepository() {
        return new InMemoryUserAccountRepository();
    }

    @Bean
    public PrincipalStore principalStore(UserAccountRepository accounts) {
        return id -> accounts.findById(id).map(UserAccount::toPrincipal);
    }

    @Bean
    public CredentialRefresher credentialRefresher(TokenLifecycleManager tokens, PrincipalStore principals) {
        return new CredentialRefresher(tokens, principals);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public AccountService accountService(
            UserAccountRepository accounts, PasswordEncoder passwordEncoder, Clock clock) {
        return new AccountService(accounts, passwordEncoder, clock);
    }

    @Bean
    public RefreshCookies refreshCookies(ServiceProperties service, AuthProperties auth) {
        return new RefreshCookies(service, auth.refreshTokenTtl());
    }
}
