package com.civicintake.security.audit;

import com.civicintake.observability.CorrelationContextHolder;
import com.civicintake.observability.SensitiveDataRedactor;
import com.civicintake.security.Principal;
import com.civicintake.security.catalog.Permission;
import com.civicintake.security.catalog.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns authorization decisions into {@link AuditEvent}s and hands them to a sink.
 * <p>
 * Recording never fails the caller: an event that cannot be built or appended is logged and dropped. Metadata is redacted
 * before it leaves this class and carries the current correlation id when one is bound.
 */
public final class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    static final String META_CORRELATION_ID = "correlationId";

    private final AuditSink sink;
    private final Clock clock;
    private final SensitiveDataRedactor redactor;

    public AuditRecorder(AuditSink sink, Clock clock) {
        this(sink, clock, new SensitiveDataRedactor());
    }

    public AuditRecorder(AuditSink sink, Clock clock, SensitiveDataRedactor redactor) {
        if (sink == null || clock == null || redactor == null) {
            throw new IllegalArgumentException("sink, clock and redactor are required");
        }
        this.sink = sink;
        this.clock = clock;
        this.redactor = redactor;
    }

    /**
     * Appends an already-built event.
     */
    public void record(AuditEvent event) {
        try {
            sink.append(event);
        } catch (RuntimeException e) {
            log.warn("Failed to record audit event action={} decision={} endpoint={}: {}",
                    event.action(), event.decision(), event.endpoint(), e.toString());
        }
    }

    /**
     * Builds and records an event.
     *
     * @param principal the actor, or null when no credential was verified
     */
    public void recordDecision(AuditAction action, Principal principal, String requirement, boolean allowed,
                               String reason, String endpoint, String method, Map<String, ?> metadata) {
        AuditEvent event;
        try {
            event = new AuditEvent(
                    principal != null ? principal.id() : null,
                    principal != null ? principal.email() : null,
                    principal != null ? principal.role() : null,
                    action,
                    requirement,
                    AuditDecision.of(allowed),
                    reason,
                    endpoint,
                    method,
                    clock.instant(),
                    enrich(metadata));
        } catch (RuntimeException e) {
            log.warn("Dropped audit event action={} requirement={} endpoint={}: {}",
                    action, requirement, endpoint, e.toString());
            return;
        }
        record(event);
    }

    public void recordRoleCheck(Principal principal, String requirement, boolean allowed, String reason,
                                String endpoint, String method) {
        recordDecision(AuditAction.ROLE_CHECK, principal, requirement, allowed, reason, endpoint, method, null);
    }

    public void recordPermissionCheck(Principal principal, String requirement, boolean allowed, String reason,
                                      String endpoint, String method) {
        recordDecision(AuditAction.PERMISSION_CHECK, principal, requirement, allowed, reason, endpoint, method,
                null);
    }

    public void recordApiAccess(Principal principal, String requirement, boolean allowed, String reason,
                                String endpoint, String method, Map<String, ?> metadata) {
        recordDecision(AuditAction.API_ACCESS, principal, requirement, allowed, reason, endpoint, method, metadata);
    }

    /**
     * Records an ownership-aware check on one resource.
     */
    public void recordResourceAccess(Principal principal, ResourceType type, String resourceId,
                                     Permission permission, boolean allowed, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resourceType", type.name());
        metadata.put("resourceId", resourceId);
        recordDecision(AuditAction.RESOURCE_ACCESS, principal, "permission:" + permission.value(), allowed, reason,
                null, null, metadata);
    }

    private Map<String, Object> enrich(Map<String, ?> metadata) {
        Map<String, Object> result = metadata == null || metadata.isEmpty()
                ? new LinkedHashMap<>()
                : redactor.redact(metadata);
        CorrelationContextHolder.currentCorrelationId()
                .ifPresent(id -> result.putIfAbsent(META_CORRELATION_ID, id));
        return result;
    }
}
