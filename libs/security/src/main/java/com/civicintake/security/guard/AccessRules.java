package com.civicintake.security.guard;

import com.civicintake.security.ForbiddenReason;
import com.civicintake.security.Principal;
import com.civicintake.security.audit.AuditAction;
import com.civicintake.security.catalog.Permission;
import com.civicintake.security.catalog.PermissionCatalog;
import com.civicintake.security.catalog.PermissionCheckResult;
import com.civicintake.security.catalog.Role;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Factory for the standard {@link AccessRule}s.
 * <p>
 * Every rule except {@link #authenticated()} refuses a principal whose role string is not in the
 * catalog with {@code INVALID_ROLE}, before looking at what the rule requires.
 */
public final class AccessRules {

    private static final AccessRule AUTHENTICATED = new AccessRule() {
        @Override
        public String requirement() {
            return "authenticated";
        }

        @Override
        public AuditAction auditAction() {
            return AuditAction.API_ACCESS;
        }

        @Override
        public AccessDecision evaluate(Principal principal) {
            return AccessDecision.allow("Valid access credential");
        }
    };

    private AccessRules() {
        // utility class
    }

    /**
     * Satisfied by any principal holding a valid access credential.
     */
    public static AccessRule authenticated() {
        return AUTHENTICATED;
    }

    /**
     * Satisfied when the principal's role is at or above one of {@code roles} in the hierarchy.
     */
    public static AccessRule anyRole(Role... roles) {
        return anyRole(Arrays.asList(roles));
    }

    public static AccessRule anyRole(Collection<Role> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("at least one role is required");
        }
        Set<Role> required = EnumSet.copyOf(roles);
        String names = required.stream().map(Role::name).collect(Collectors.joining(", "));
        return new AccessRule() {
            @Override
            public String requirement() {
                return "role:" + names;
            }

            @Override
            public AuditAction auditAction() {
                return AuditAction.ROLE_CHECK;
            }

            @Override
            public AccessDecision evaluate(Principal principal) {
                Optional<Role> role = principal.knownRole();
                if (role.isEmpty()) {
                    return AccessDecision.invalidRole(principal.role());
                }
                for (Role minimum : required) {
                    if (PermissionCatalog.meetsRoleRequirement(role.get(), minimum)) {
                        return AccessDecision.allow("Role '%s' meets required role %s".formatted(role.get(), minimum));
                    }
                }
                return AccessDecision.forbidden(ForbiddenReason.ROLE_REQUIRED,
                        "Insufficient permissions. Required role: " + names);
            }
        };
    }

    /**
     * Satisfied when the principal's role holds {@code permission}.
     */
    public static AccessRule permission(Permission permission) {
        if (permission == null) {
            throw new IllegalArgumentException("permission must not be null");
        }
        return permissions(Set.of(permission), true);
    }

    /**
     * Satisfied when the principal's role holds at least one of {@code permissions}.
     */
    public static AccessRule anyPermission(Permission... permissions) {
        return anyPermission(Arrays.asList(permissions));
    }

    public static AccessRule anyPermission(Collection<Permission> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            throw new IllegalArgumentException("at least one permission is required");
        }
        return permissions(EnumSet.copyOf(permissions), false);
    }

    /**
     * Satisfied when every rule is; evaluation stops at the first refusal, which becomes the
     * combined decision.
     */
    public static AccessRule allOf(AccessRule... rules) {
        if (rules.length == 0) {
            throw new IllegalArgumentException("at least one rule is required");
        }
        List<AccessRule> all = List.of(rules);
        String requirement = all.stream().map(AccessRule::requirement).collect(Collectors.joining(" & "));
        AuditAction action = all.stream().anyMatch(rule -> rule.auditAction() == AuditAction.PERMISSION_CHECK)
                ? AuditAction.PERMISSION_CHECK
                : all.stream().anyMatch(rule -> rule.auditAction() == AuditAction.ROLE_CHECK)
                        ? AuditAction.ROLE_CHECK
                        : AuditAction.API_ACCESS;
        return new AccessRule() {
            @Override
            public String requirement() {
                return requirement;
            }

            @Override
            public AuditAction auditAction() {
                return action;
            }

            @Override
            public AccessDecision evaluate(Principal principal) {
                for (AccessRule rule : all) {
                    AccessDecision decision = rule.evaluate(principal);
                    if (!decision.allowed()) {
                        return decision;
                    }
                }
                return AccessDecision.allow("All of [%s] satisfied".formatted(requirement));
            }
        };
    }

    private static AccessRule permissions(Set<Permission> required, boolean requireAll) {
        String values = required.stream().map(Permission::value).collect(Collectors.joining(requireAll ? ", " : " | "));
        return new AccessRule() {
            @Override
            public String requirement() {
                return "permission:" + values;
            }

            @Override
            public AuditAction auditAction() {
                return AuditAction.PERMISSION_CHECK;
            }

            @Override
            public AccessDecision evaluate(Principal principal) {
                if (principal.knownRole().isEmpty()) {
                    return AccessDecision.invalidRole(principal.role());
                }
                PermissionCheckResult result = PermissionCatalog.checkPermissions(principal, required, requireAll);
                if (result.allowed()) {
                    return AccessDecision.allow(result.reason());
                }
                return AccessDecision.forbidden(ForbiddenReason.PERMISSION_REQUIRED,
                        "Insufficient permissions. Required permission: " + values);
            }
        };
    }
}
