package com.civicintake.security.audit;

/**
 * Kind of check an audit event records.
 */
public enum AuditAction {
    /** Authentication only: was a valid credential presented. */
    API_ACCESS,
    /** Minimum-role check against the hierarchy. */
    ROLE_CHECK,
    /** Permission check against the role table. */
    PERMISSION_CHECK,
    /** Ownership-aware check on a specific resource. */
    RESOURCE_ACCESS
}
