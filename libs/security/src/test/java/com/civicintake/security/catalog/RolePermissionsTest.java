package com.civicintake.security.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the role to permission table and the role hierarchy.
 */
@DisplayName("RolePermissions")
class RolePermissionsTest {

    @Nested
    @DisplayName("table completeness")
    class Completeness {

        @ParameterizedTest(name = "{0}")
        @EnumSource(Role.class)
        @DisplayName("every role has an entry")
        void everyRoleHasEntry(Role role) {
            assertThat(RolePermissions.table()).containsKey(role);
            assertThat(RolePermissions.of(role)).isNotNull();
        }

        @Test
        @DisplayName("ADMIN holds every permission")
        void adminHoldsEverything() {
            assertThat(RolePermissions.of(Role.ADMIN)).containsExactlyInAnyOrder(Permission.values());
        }

        @Test
        @DisplayName("VIEWER holds read permissions only")
        void viewerReadsOnly() {
            assertThat(RolePermissions.of(Role.VIEWER)).containsExactlyInAnyOrder(
                    Permission.READ_USER, Permission.READ_COMPLAINT, Permission.READ_DEPARTMENT,
                    Permission.READ_FILE);
        }

        @Test
        @DisplayName("domain aliases carry the same grants as their base roles")
        void aliasesMatch() {
            assertThat(RolePermissions.of(Role.OFFICER)).isEqualTo(RolePermissions.of(Role.EDITOR));
            assertThat(RolePermissions.of(Role.CITIZEN)).isEqualTo(RolePermissions.of(Role.USER));
        }

        @Test
        @DisplayName("only ADMIN may delete, manage roles or view audit logs")
        void privilegedPermissionsAreAdminOnly() {
            var adminOnly = EnumSet.of(Permission.DELETE_USER, Permission.DELETE_COMPLAINT,
                    Permission.DELETE_DEPARTMENT, Permission.DELETE_FILE, Permission.MANAGE_ROLES,
                    Permission.VIEW_AUDIT_LOGS, Permission.MANAGE_SETTINGS, Permission.CREATE_USER,
                    Permission.CREATE_DEPARTMENT);
            for (Role role : Role.values()) {
                if (role != Role.ADMIN) {
                    assertThat(RolePermissions.of(role)).as(role.name()).doesNotContainAnyElementsOf(adminOnly);
                }
            }
        }

        @Test
        @DisplayName("handed-out sets are read-only")
        void setsAreReadOnly() {
            assertThatThrownBy(() -> RolePermissions.of(Role.VIEWER).add(Permission.DELETE_USER))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("levels are ADMIN > EDITOR = OFFICER > USER = CITIZEN > VIEWER")
        void levels() {
            assertThat(Role.ADMIN.level()).isEqualTo(4);
            assertThat(Role.EDITOR.level()).isEqualTo(3).isEqualTo(Role.OFFICER.level());
            assertThat(Role.USER.level()).isEqualTo(2).isEqualTo(Role.CITIZEN.level());
            assertThat(Role.VIEWER.level()).isEqualTo(1);
        }

        @Test
        @DisplayName("a higher role holds every permission of a lower role")
        void permissionsAreMonotonic() {
            for (Role higher : Role.values()) {
                for (Role lower : Role.values()) {
                    if (higher.level() > lower.level()) {
                        assertThat(RolePermissions.of(higher))
                                .as("%s should include %s", higher, lower)
                                .containsAll(RolePermissions.of(lower));
                    }
                }
            }
        }

        @Test
        @DisplayName("fromValue ignores case and whitespace and rejects unknown names")
        void fromValue() {
            assertThat(Role.fromValue(" officer ")).contains(Role.OFFICER);
            assertThat(Role.fromValue("SUPERUSER")).isEmpty();
            assertThat(Role.fromValue(null)).isEmpty();
            assertThat(Role.isKnown("Citizen")).isTrue();
        }
    }

    @Test
    @DisplayName("permissions round-trip through their namespaced tag")
    void permissionTags() {
        assertThat(Permission.fromValue("view:audit_logs")).contains(Permission.VIEW_AUDIT_LOGS);
        assertThat(Permission.fromValue("fly:plane")).isEmpty();
        assertThat(Permission.DELETE_USER).hasToString("delete:user");
    }
}
