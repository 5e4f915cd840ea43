package com.civicintake.security.catalog;

import java.util.Set;

/**
 * Outcome of a permission check together with a human-readable reason.
 *
 * @param allowed            whether the check passed
 * @param reason             explanation suitable for audit records
 * @param role               role that was evaluated, null when the role was not recognised
 * @param missingPermissions requested permissions the role does not hold
 */
public record PermissionCheckResult(
        boolean allowed,
        String reason,
        Role role,
        Set<Permission> missingPermissions
) {

    public PermissionCheckResult {
        missingPermissions = missingPermissions == null ? Set.of() : Set.copyOf(missingPermissions);
    }
}
