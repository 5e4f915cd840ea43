package com.civicintake.security.catalog;

import com.civicintake.security.Principal;
import com.civicintake.security.testing.TestPrincipals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PermissionCatalog} lookups and {@link ResourceAuthorizer}.
 */
@DisplayName("PermissionCatalog")
class PermissionCatalogTest {

    @Nested
    @DisplayName("hasPermission()")
    class HasPermission {

        @Test
        @DisplayName("follows the role table")
        void followsTable() {
            assertThat(PermissionCatalog.hasPermission(Role.OFFICER, Permission.UPDATE_COMPLAINT)).isTrue();
            assertThat(PermissionCatalog.hasPermission(Role.CITIZEN, Permission.UPDATE_COMPLAINT)).isFalse();
            assertThat(PermissionCatalog.hasPermission(Role.ADMIN, Permission.DELETE_USER)).isTrue();
        }

        @Test
        @DisplayName("is false for a null role")
        void nullRole() {
            assertThat(PermissionCatalog.hasPermission(null, Permission.READ_USER)).isFalse();
        }

        @Test
        @DisplayName("any/all combinators")
        void anyAndAll() {
            var perms = List.of(Permission.READ_FILE, Permission.DELETE_FILE);

            assertThat(PermissionCatalog.hasAnyPermission(Role.VIEWER, perms)).isTrue();
            assertThat(PermissionCatalog.hasAllPermissions(Role.VIEWER, perms)).isFalse();
            assertThat(PermissionCatalog.hasAllPermissions(Role.ADMIN, perms)).isTrue();
            assertThat(PermissionCatalog.hasAnyPermission(Role.ADMIN, List.of())).isFalse();
            assertThat(PermissionCatalog.hasAllPermissions(Role.VIEWER, List.of())).isTrue();
        }
    }

    @Nested
    @DisplayName("meetsRoleRequirement()")
    class MeetsRoleRequirement {

        @Test
        @DisplayName("compares hierarchy levels")
        void comparesLevels() {
            assertThat(PermissionCatalog.meetsRoleRequirement(Role.ADMIN, Role.OFFICER)).isTrue();
            assertThat(PermissionCatalog.meetsRoleRequirement(Role.EDITOR, Role.OFFICER)).isTrue();
            assertThat(PermissionCatalog.meetsRoleRequirement(Role.CITIZEN, Role.OFFICER)).isFalse();
            assertThat(PermissionCatalog.meetsRoleRequirement(Role.VIEWER, Role.VIEWER)).isTrue();
        }

        @Test
        @DisplayName("is false for a null role")
        void nullRole() {
            assertThat(PermissionCatalog.meetsRoleRequirement(null, Role.VIEWER)).isFalse();
        }
    }

    @Nested
    @DisplayName("canAccessResource()")
    class CanAccessResource {

        @Test
        @DisplayName("owners reach their own resources regardless of role")
        void ownerBypass() {
            Principal viewer = TestPrincipals.viewer();

            assertThat(PermissionCatalog.canAccessResource(viewer, viewer.id(), Permission.DELETE_COMPLAINT))
                    .isTrue();
        }

        @Test
        @DisplayName("non-owners need the permission")
        void nonOwnerNeedsPermission() {
            Principal citizen = TestPrincipals.citizen();

            assertThat(PermissionCatalog.canAccessResource(citizen, "someone-else", Permission.READ_COMPLAINT))
                    .isTrue();
            assertThat(PermissionCatalog.canAccessResource(citizen, "someone-else", Permission.DELETE_COMPLAINT))
                    .isFalse();
        }

        @Test
        @DisplayName("an unknown role reaches nothing it does not own")
        void unknownRole() {
            Principal ghost = TestPrincipals.withUnknownRole("SUPERUSER");

            assertThat(PermissionCatalog.canAccessResource(ghost, "someone-else", Permission.READ_USER)).isFalse();
            assertThat(PermissionCatalog.canAccessResource(ghost, ghost.id(), Permission.READ_USER)).isTrue();
        }

        @Test
        @DisplayName("ResourceAuthorizer maps resource types to their permissions")
        void resourceAuthorizer() {
            var officer = new ResourceAuthorizer(TestPrincipals.officer());

            assertThat(officer.canRead("other", ResourceType.DEPARTMENT)).isTrue();
            assertThat(officer.canUpdate("other", ResourceType.COMPLAINT)).isTrue();
            assertThat(officer.canDelete("other", ResourceType.COMPLAINT)).isFalse();
            assertThat(officer.canDelete(officer.principal().id(), ResourceType.FILE)).isTrue();
        }
    }

    @Nested
    @DisplayName("checkPermissions()")
    class CheckPermissions {

        @Test
        @DisplayName("reports missing permissions when refused")
        void reportsMissing() {
            var result = PermissionCatalog.checkPermissions(TestPrincipals.citizen(),
                    List.of(Permission.READ_COMPLAINT, Permission.DELETE_COMPLAINT), true);

            assertThat(result.allowed()).isFalse();
            assertThat(result.role()).isEqualTo(Role.CITIZEN);
            assertThat(result.missingPermissions()).containsExactly(Permission.DELETE_COMPLAINT);
            assertThat(result.reason()).contains("delete:complaint");
        }

        @Test
        @DisplayName("any-of mode is satisfied by one permission")
        void anyOf() {
            var result = PermissionCatalog.checkPermissions(TestPrincipals.citizen(),
                    List.of(Permission.READ_COMPLAINT, Permission.DELETE_COMPLAINT), false);

            assertThat(result.allowed()).isTrue();
        }

        @Test
        @DisplayName("an unknown role is refused with every permission missing")
        void unknownRole() {
            var result = PermissionCatalog.checkPermission(TestPrincipals.withUnknownRole("ROOT"),
                    Permission.READ_USER);

            assertThat(result.allowed()).isFalse();
            assertThat(result.role()).isNull();
            assertThat(result.missingPermissions()).containsExactly(Permission.READ_USER);
            assertThat(PermissionCatalog.isValidRole("ROOT")).isFalse();
        }
    }
}
