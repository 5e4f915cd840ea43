package com.civicintake.security.audit;

import java.util.Map;

/**
 * Totals over the events held by an {@link InMemoryAuditSink}.
 */
public record AuditStatistics(
        long total,
        long allowed,
        long denied,
        Map<AuditAction, Long> byAction,
        Map<String, Long> byRole
) {

    public AuditStatistics {
        byAction = Map.copyOf(byAction);
        byRole = Map.copyOf(byRole);
    }
}
