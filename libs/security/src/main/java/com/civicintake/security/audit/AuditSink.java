package com.civicintake.security.audit;

/**
 * Destination for audit events: a log, a database table, an external SIEM.
 * <p>
 * Implementations may throw; {@link AuditRecorder} contains the failure.
 */
@FunctionalInterface
public interface AuditSink {

    void append(AuditEvent event);
}
