package com.civicintake.security.catalog;

import com.civicintake.security.Principal;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure lookups over {@link RolePermissions} and the role hierarchy.
 * <p>
 * Methods taking a {@link Role} assume the role has already been validated. Methods taking a
 * {@link Principal} resolve its role string first and treat an unknown role as holding nothing;
 * callers that must report an unknown role distinctly check {@link #isValidRole(String)} before
 * asking anything else.
 */
public final class PermissionCatalog {

    private PermissionCatalog() {
        // utility class
    }

    public static boolean hasPermission(Role role, Permission permission) {
        return role != null && RolePermissions.of(role).contains(permission);
    }

    /**
     * True if the role holds at least one of the permissions. An empty collection is never
     * satisfied.
     */
    public static boolean hasAnyPermission(Role role, Collection<Permission> permissions) {
        return permissions.stream().anyMatch(permission -> hasPermission(role, permission));
    }

    /**
     * True if the role holds every one of the permissions. An empty collection is always
     * satisfied.
     */
    public static boolean hasAllPermissions(Role role, Collection<Permission> permissions) {
        return permissions.stream().allMatch(permission -> hasPermission(role, permission));
    }

    /**
     * True iff {@code role} sits at or above {@code minimumRole} in the hierarchy.
     */
    public static boolean meetsRoleRequirement(Role role, Role minimumRole) {
        return role != null && role.isAtLeast(minimumRole);
    }

    /**
     * Owners always reach their own resources; everyone else needs {@code permission}.
     */
    public static boolean canAccessResource(Principal principal, String resourceOwnerId, Permission permission) {
        if (Objects.equals(principal.id(), resourceOwnerId)) {
            return true;
        }
        return principal.knownRole()
                .map(role -> hasPermission(role, permission))
                .orElse(false);
    }

    public static boolean isValidRole(String role) {
        return Role.isKnown(role);
    }

    public static Set<Permission> permissionsOf(Role role) {
        return RolePermissions.of(role);
    }

    public static PermissionCheckResult checkPermission(Principal principal, Permission permission) {
        return checkPermissions(principal, Set.of(permission), true);
    }

    /**
     * Checks several permissions at once.
     *
     * @param requireAll true to require every permission, false to accept any one of them
     */
    public static PermissionCheckResult checkPermissions(
            Principal principal, Collection<Permission> permissions, boolean requireAll) {
        Optional<Role> resolved = principal.knownRole();
        if (resolved.isEmpty()) {
            return new PermissionCheckResult(false,
                    "Role '%s' is not a recognised role".formatted(principal.role()),
                    null, Set.copyOf(permissions));
        }
        Role role = resolved.get();
        boolean allowed = requireAll
                ? hasAllPermissions(role, permissions)
                : hasAnyPermission(role, permissions);
        Set<Permission> missing = permissions.stream()
                .filter(permission -> !hasPermission(role, permission))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Permission.class)));

        String reason;
        if (allowed) {
            reason = permissions.size() == 1
                    ? "Role '%s' has permission '%s'".formatted(role, permissions.iterator().next())
                    : "Role '%s' has %s the required permissions"
                            .formatted(role, requireAll ? "all" : "at least one of");
        } else {
            reason = "Role '%s' is missing permissions: %s".formatted(role, join(missing));
        }
        return new PermissionCheckResult(allowed, reason, role, missing);
    }

    static String join(Collection<Permission> permissions) {
        return permissions.stream().map(Permission::value).collect(Collectors.joining(", "));
    }
}
