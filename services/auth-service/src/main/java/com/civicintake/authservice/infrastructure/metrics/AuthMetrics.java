package com.civicintake.authservice.infrastructure.metrics;

import com.civicintake.observability.MetricFactory;
import com.civicintake.security.audit.AuditEvent;

/**
 * Counters for authorization decisions, rate limiting and credential issuance.
 */
public class AuthMetrics {

    public static final String DECISIONS = "civic.auth.decisions";
    public static final String RATE_LIMITED = "civic.auth.rate_limited";
    public static final String CREDENTIALS_ISSUED = "civic.auth.credentials.issued";

    private final MetricFactory metrics;

    public AuthMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    public void decision(AuditEvent event) {
        metrics.counter(DECISIONS, "Authorization decisions by outcome and check",
                        "decision", event.decision().name(),
                        "action", event.action().name())
                .increment();
    }

    public void rateLimited() {
        metrics.counter(RATE_LIMITED, "Requests refused by the credential endpoint rate limiter").increment();
    }

    /**
     * @param trigger what caused the issuance: login, signup or refresh
     */
    public void credentialPairIssued(String trigger) {
        metrics.counter(CREDENTIALS_ISSUED, "Credential pairs issued", "type", trigger).increment();
    }
}
