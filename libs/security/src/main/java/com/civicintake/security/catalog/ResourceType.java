package com.civicintake.security.catalog;

/**
 * Resources subject to ownership checks, each with its read/update/delete permissions.
 */
public enum ResourceType {

    USER(Permission.READ_USER, Permission.UPDATE_USER, Permission.DELETE_USER),
    COMPLAINT(Permission.READ_COMPLAINT, Permission.UPDATE_COMPLAINT, Permission.DELETE_COMPLAINT),
    DEPARTMENT(Permission.READ_DEPARTMENT, Permission.UPDATE_DEPARTMENT, Permission.DELETE_DEPARTMENT),
    FILE(Permission.READ_FILE, Permission.UPDATE_FILE, Permission.DELETE_FILE);

    private final Permission read;
    private final Permission update;
    private final Permission delete;

    ResourceType(Permission read, Permission update, Permission delete) {
        this.read = read;
        this.update = update;
        this.delete = delete;
    }

    public Permission readPermission() {
        return read;
    }

    public Permission updatePermission() {
        return update;
    }

    public Permission deletePermission() {
        return delete;
    }
}
