package com.civicintake.security.catalog;

import com.civicintake.security.Principal;

/**
 * Ownership-aware access checks for one principal.
 */
public final class ResourceAuthorizer {

    private final Principal principal;

    public ResourceAuthorizer(Principal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        this.principal = principal;
    }

    public boolean canRead(String resourceOwnerId, ResourceType type) {
        return PermissionCatalog.canAccessResource(principal, resourceOwnerId, type.readPermission());
    }

    public boolean canUpdate(String resourceOwnerId, ResourceType type) {
        return PermissionCatalog.canAccessResource(principal, resourceOwnerId, type.updatePermission());
    }

    public boolean canDelete(String resourceOwnerId, ResourceType type) {
        return PermissionCatalog.canAccessResource(principal, resourceOwnerId, type.deletePermission());
    }

    public Principal principal() {
        return principal;
    }
}
