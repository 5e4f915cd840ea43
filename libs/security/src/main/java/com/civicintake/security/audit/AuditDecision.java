package com.civicintake.security.audit;

public enum AuditDecision {
    ALLOWED,
    DENIED;

    public static AuditDecision of(boolean allowed) {
        return allowed ? ALLOWED : DENIED;
    }
}
