package com.civicintake.security;

/**
 * Sub-code attached to {@link AuthErrorCode#FORBIDDEN}.
 */
public enum ForbiddenReason {
    ROLE_REQUIRED,
    PERMISSION_REQUIRED
}
