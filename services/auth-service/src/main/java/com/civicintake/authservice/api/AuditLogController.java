package com.civicintake.authservice.api;

import com.civicintake.authservice.error.ValidationException;
import com.civicintake.authservice.infrastructure.web.GuardRequests;
import com.civicintake.security.audit.AuditDecision;
import com.civicintake.security.audit.AuditEvent;
import com.civicintake.security.audit.InMemoryAuditSink;
import com.civicintake.security.catalog.Permission;
import com.civicintake.security.guard.AuthorizationGuard;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the most recent audit events, for administrators.
 */
@RestController
@RequestMapping("/api/admin/audit-logs")
public class AuditLogController {

    private final InMemoryAuditSink recentEvents;
    private final AuthorizationGuard guard;

    public AuditLogController(InMemoryAuditSink recentEvents, AuthorizationGuard guard) {
        this.recentEvents = recentEvents;
        this.guard = guard;
    }

    /**
     * Newest first, optionally filtered by decision.
     */
    @GetMapping
    public ResponseEntity<ApiResponse> list(
            @RequestParam(required = false) String decision,
            @RequestParam(defaultValue = "100") int limit,
            HttpServletRequest http) {
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>requirePermission(
                        Permission.VIEW_AUDIT_LOGS,
                        (request, principal) -> {
                            List<AuditEvent> events = decision == null || decision.isBlank()
                                    ? recentEvents.events()
                                    : recentEvents.byDecision(parseDecision(decision));
                            List<AuditEvent> newestFirst = new ArrayList<>(events);
                            Collections.reverse(newestFirst);
                            int size = Math.max(0, Math.min(limit, newestFirst.size()));
                            return ResponseEntity.ok(ApiResponse.ok("Audit logs retrieved",
                                    List.copyOf(newestFirst.subList(0, size))));
                        })
                .handle(GuardRequests.from(http)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse> statistics(HttpServletRequest http) {
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>requirePermission(
                        Permission.VIEW_AUDIT_LOGS,
                        (request, principal) ->
                                ResponseEntity.ok(ApiResponse.ok("Audit statistics", recentEvents.statistics())))
                .handle(GuardRequests.from(http)));
    }

    private static AuditDecision parseDecision(String value) {
        try {
            return AuditDecision.valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("decision must be ALLOWED or DENIED");
        }
    }
}
