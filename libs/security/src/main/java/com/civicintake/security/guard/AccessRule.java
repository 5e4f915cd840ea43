package com.civicintake.security.guard;

import com.civicintake.security.Principal;
import com.civicintake.security.audit.AuditAction;

/**
 * Authorization stage of a guard, evaluated after the bearer credential has been verified.
 *
 * @see AccessRules
 */
public interface AccessRule {

    /**
     * What this rule requires, as it appears in audit events ({@code role:ADMIN},
     * {@code permission:delete:user}).
     */
    String requirement();

    /**
     * Audit action under which this rule's decisions are recorded.
     */
    AuditAction auditAction();

    AccessDecision evaluate(Principal principal);
}
