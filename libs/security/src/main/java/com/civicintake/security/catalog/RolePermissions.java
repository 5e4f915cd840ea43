package com.civicintake.security.catalog;

import static com.civicintake.security.catalog.Permission.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The static role to permission table.
 * <p>
 * Built once at class initialisation from an exhaustive switch over {@link Role}, so adding a
 * role without deciding its permissions does not compile. Every set handed out is unmodifiable.
 */
public final class RolePermissions {

    private static final Map<Role, Set<Permission>> TABLE;

    static {
        EnumMap<Role, Set<Permission>> table = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            table.put(role, Collections.unmodifiableSet(grantsFor(role)));
        }
        TABLE = Collections.unmodifiableMap(table);
    }

    private RolePermissions() {
        // utility class
    }

    /**
     * Permissions granted to the role; never null.
     */
    public static Set<Permission> of(Role role) {
        return TABLE.get(role);
    }

    /**
     * The whole table, read-only.
     */
    public static Map<Role, Set<Permission>> table() {
        return TABLE;
    }

    private static EnumSet<Permission> grantsFor(Role role) {
        return switch (role) {
            case ADMIN -> EnumSet.allOf(Permission.class);
            case EDITOR, OFFICER -> EnumSet.of(
                    READ_USER, UPDATE_USER,
                    CREATE_COMPLAINT, READ_COMPLAINT, UPDATE_COMPLAINT,
                    READ_DEPARTMENT, UPDATE_DEPARTMENT,
                    CREATE_FILE, READ_FILE, UPDATE_FILE);
            case USER, CITIZEN -> EnumSet.of(
                    READ_USER, UPDATE_USER,
                    CREATE_COMPLAINT, READ_COMPLAINT,
                    READ_DEPARTMENT,
                    CREATE_FILE, READ_FILE);
            case VIEWER -> EnumSet.of(
                    READ_USER, READ_COMPLAINT, READ_DEPARTMENT, READ_FILE);
        };
    }
}
