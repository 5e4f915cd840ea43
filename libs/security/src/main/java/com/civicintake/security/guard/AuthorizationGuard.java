package com.civicintake.security.guard;

import com.civicintake.observability.CorrelationContextHolder;
import com.civicintake.observability.SpanHelper;
import com.civicintake.security.AuthErrorCode;
import com.civicintake.security.BearerTokenExtractor;
import com.civicintake.security.Principal;
import com.civicintake.security.audit.AuditAction;
import com.civicintake.security.audit.AuditRecorder;
import com.civicintake.security.catalog.Permission;
import com.civicintake.security.catalog.Role;
import com.civicintake.security.token.CredentialVerificationException;
import com.civicintake.security.token.TokenLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Wraps operations with bearer authentication and an {@link AccessRule}.
 * <p>
 * A guarded handler runs in three stages: extract and verify the bearer credential, evaluate the
 * rule, invoke the operation. A failure in either of the first two stages yields a
 * {@link GuardOutcome.Rejected} and the operation is not invoked. Each evaluation records exactly
 * one audit event, before the operation runs; an exception thrown by the operation propagates to
 * the caller unchanged.
 */
public final class AuthorizationGuard {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGuard.class);

    static final String OPTIONAL_REQUIREMENT = "optional";
    static final String SPAN_PREFIX = "guard ";
    static final String ATTR_DECISION = "guard.decision";

    private final TokenLifecycleManager tokens;
    private final AuditRecorder audit;
    private final SpanHelper spans;

    public AuthorizationGuard(TokenLifecycleManager tokens, AuditRecorder audit) {
        this(tokens, audit, SpanHelper.noop());
    }

    /**
     * @param spans every evaluation, including the guarded operation, runs in one span named
     *              after the rule's requirement
     */
    public AuthorizationGuard(TokenLifecycleManager tokens, AuditRecorder audit, SpanHelper spans) {
        if (tokens == null || audit == null || spans == null) {
            throw new IllegalArgumentException("tokens, audit and spans are required");
        }
        this.tokens = tokens;
        this.audit = audit;
        this.spans = spans;
    }

    /**
     * General form: authenticate, then apply {@code rule}.
     */
    public <T> GuardHandler<T> protect(AccessRule rule, ProtectedOperation<T> operation) {
        if (rule == null || operation == null) {
            throw new IllegalArgumentException("rule and operation are required");
        }
        return request -> traced(rule.requirement(), request, () -> evaluate(rule, operation, request));
    }

    public <T> GuardHandler<T> requireAuthentication(ProtectedOperation<T> operation) {
        return protect(AccessRules.authenticated(), operation);
    }

    /**
     * Allows principals at or above any one of {@code allowedRoles}.
     */
    public <T> GuardHandler<T> requireRole(Collection<Role> allowedRoles, ProtectedOperation<T> operation) {
        return protect(AccessRules.anyRole(allowedRoles), operation);
    }

    public <T> GuardHandler<T> requirePermission(Permission permission, ProtectedOperation<T> operation) {
        return protect(AccessRules.permission(permission), operation);
    }

    public <T> GuardHandler<T> requireAnyPermission(Collection<Permission> permissions,
                                                    ProtectedOperation<T> operation) {
        return protect(AccessRules.anyPermission(permissions), operation);
    }

    /**
     * Never rejects. The operation receives the principal when a valid credential was presented,
     * null otherwise, including when a presented credential fails verification.
     */
    public <T> GuardHandler<T> optionalAuthentication(ProtectedOperation<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
        return request -> traced(OPTIONAL_REQUIREMENT, request, () -> {
            Principal principal = null;
            String reason = "Anonymous access";
            Optional<String> token = BearerTokenExtractor.extract(request.authorizationHeader());
            if (token.isPresent()) {
                try {
                    principal = tokens.verifyAccessCredential(token.get());
                    reason = "Valid access credential";
                } catch (CredentialVerificationException e) {
                    log.debug("Ignoring unusable credential on optional endpoint {}: {}", request.endpoint(),
                            e.getMessage());
                    reason = "Anonymous access, presented credential ignored";
                }
            }
            audit.recordApiAccess(principal, OPTIONAL_REQUIREMENT, true, reason, request.endpoint(),
                    request.method(), requestMetadata(request));
            if (principal != null) {
                CorrelationContextHolder.bindActor(principal.id(), principal.role());
            }
            return GuardOutcome.allowed(principal, operation.apply(request, principal));
        });
    }

    private <T> GuardOutcome<T> evaluate(AccessRule rule, ProtectedOperation<T> operation, GuardRequest request) {
        Optional<String> token = BearerTokenExtractor.extract(request.authorizationHeader());
        if (token.isEmpty()) {
            return rejectUnauthenticated(request, rule, AuthErrorCode.MISSING_TOKEN, "No bearer credential");
        }

        Principal principal;
        try {
            principal = tokens.verifyAccessCredential(token.get());
        } catch (CredentialVerificationException e) {
            return rejectUnauthenticated(request, rule, AuthErrorCode.INVALID_TOKEN, e.getMessage());
        }

        AccessDecision decision = rule.evaluate(principal);
        audit.recordDecision(rule.auditAction(), principal, rule.requirement(), decision.allowed(),
                decision.message(), request.endpoint(), request.method(), requestMetadata(request));
        if (!decision.allowed()) {
            log.debug("Refused {} {} for user {}: {}", request.method(), request.endpoint(), principal.id(),
                    decision.message());
            return GuardOutcome.rejected(GuardRejection.from(decision));
        }

        CorrelationContextHolder.bindActor(principal.id(), principal.role());
        return GuardOutcome.allowed(principal, operation.apply(request, principal));
    }

    private <T> GuardOutcome<T> traced(String requirement, GuardRequest request, Supplier<GuardOutcome<T>> evaluation) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (request.method() != null) {
            attributes.put("http.method", request.method());
        }
        if (request.endpoint() != null) {
            attributes.put("http.target", request.endpoint());
        }
        return spans.inSpan(SPAN_PREFIX + requirement, attributes, () -> {
            GuardOutcome<T> outcome = evaluation.get();
            SpanHelper.annotate(ATTR_DECISION, outcome.isAllowed() ? "ALLOWED" : "DENIED");
            return outcome;
        });
    }

    private <T> GuardOutcome<T> rejectUnauthenticated(GuardRequest request, AccessRule rule, AuthErrorCode error,
                                                      String reason) {
        audit.recordDecision(AuditAction.API_ACCESS, null, rule.requirement(), false, reason,
                request.endpoint(), request.method(), requestMetadata(request));
        log.debug("Rejected {} {}: {}", request.method(), request.endpoint(), error);
        return GuardOutcome.rejected(GuardRejection.of(error));
    }

    private static Map<String, Object> requestMetadata(GuardRequest request) {
        return request.clientAddress() != null
                ? Map.of("clientAddress", request.clientAddress())
                : Map.of();
    }
}
