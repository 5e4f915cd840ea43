package com.civicintake.security.catalog;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of platform roles.
 * <p>
 * Each role has a hierarchy level used for "at least this privileged" checks. The level is an
 * ordering only; what a role may actually do is decided by {@link RolePermissions}. CITIZEN and
 * OFFICER are the complaint-domain names for USER and EDITOR and sit on the same levels.
 */
public enum Role {

    ADMIN("Administrator",
            "Full system access with all permissions including user and role management"),
    EDITOR("Editor",
            "Can create and modify content, but cannot delete or manage users"),
    OFFICER("Officer",
            "Department officer handling complaints; same authority as an editor"),
    USER("User",
            "Standard authenticated user with basic permissions"),
    CITIZEN("Citizen",
            "Member of the public filing complaints; same authority as a user"),
    VIEWER("Viewer",
            "Read-only access to all resources");

    /** Role given to accounts that sign up without asking for one. */
    public static final Role DEFAULT = USER;

    private final String displayName;
    private final String description;

    Role(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /**
     * Position in the hierarchy; higher is more privileged.
     */
    public int level() {
        return switch (this) {
            case ADMIN -> 4;
            case EDITOR, OFFICER -> 3;
            case USER, CITIZEN -> 2;
            case VIEWER -> 1;
        };
    }

    /**
     * Whether this role is at least as privileged as {@code minimum}.
     */
    public boolean isAtLeast(Role minimum) {
        return level() >= minimum.level();
    }

    /**
     * Resolves a role from its name, ignoring case and surrounding whitespace.
     *
     * @return the role, or empty for null, blank or unknown values
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the value names a known role.
     */
    public static boolean isKnown(String value) {
        return fromValue(value).isPresent();
    }
}
