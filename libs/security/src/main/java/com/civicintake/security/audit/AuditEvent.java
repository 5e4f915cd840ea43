package com.civicintake.security.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One authorization decision. Immutable; sinks append these and never change them.
 *
 * @param actorId     principal id, null when no credential was verified
 * @param actorEmail  principal email, null when anonymous
 * @param actorRole   principal role string as carried by the credential, null when anonymous
 * @param action      kind of check
 * @param requirement what was required, e.g. {@code role:ADMIN} or {@code permission:delete:user}
 * @param decision    the outcome
 * @param reason      why the outcome was reached
 * @param endpoint    request path, null outside HTTP
 * @param method      request method, null outside HTTP
 * @param timestamp   when the decision was made
 * @param metadata    extra context, already redacted
 */
public record AuditEvent(
        String actorId,
        String actorEmail,
        String actorRole,
        AuditAction action,
        String requirement,
        AuditDecision decision,
        String reason,
        String endpoint,
        String method,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public AuditEvent {
        if (action == null || decision == null || timestamp == null) {
            throw new IllegalArgumentException("action, decision and timestamp are required");
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean allowed() {
        return decision == AuditDecision.ALLOWED;
    }
}
