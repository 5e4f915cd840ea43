package com.civicintake.security.catalog;

import java.util.Optional;

/**
 * Closed set of fine-grained capabilities, written {@code action:resource}.
 */
public enum Permission {

    CREATE_USER("create:user"),
    READ_USER("read:user"),
    UPDATE_USER("update:user"),
    DELETE_USER("delete:user"),

    CREATE_COMPLAINT("create:complaint"),
    READ_COMPLAINT("read:complaint"),
    UPDATE_COMPLAINT("update:complaint"),
    DELETE_COMPLAINT("delete:complaint"),

    CREATE_DEPARTMENT("create:department"),
    READ_DEPARTMENT("read:department"),
    UPDATE_DEPARTMENT("update:department"),
    DELETE_DEPARTMENT("delete:department"),

    CREATE_FILE("create:file"),
    READ_FILE("read:file"),
    UPDATE_FILE("update:file"),
    DELETE_FILE("delete:file"),

    MANAGE_ROLES("manage:roles"),
    VIEW_AUDIT_LOGS("view:audit_logs"),
    MANAGE_SETTINGS("manage:settings");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    /** The namespaced tag, e.g. {@code read:complaint}. */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

    /**
     * Looks a permission up by its namespaced tag.
     */
    public static Optional<Permission> fromValue(String value) {
        for (Permission permission : values()) {
            if (permission.value.equals(value)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
