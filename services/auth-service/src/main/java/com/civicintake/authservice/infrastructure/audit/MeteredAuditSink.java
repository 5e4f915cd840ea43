package com.civicintake.authservice.infrastructure.audit;

import com.civicintake.authservice.infrastructure.metrics.AuthMetrics;
import com.civicintake.security.audit.AuditEvent;
import com.civicintake.security.audit.AuditSink;

/**
 * Counts audit events by decision and action.
 */
public class MeteredAuditSink implements AuditSink {

    private final AuthMetrics metrics;

    public MeteredAuditSink(AuthMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void append(AuditEvent event) {
        metrics.decision(event);
    }
}
