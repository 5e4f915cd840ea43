package com.civicintake.security.guard;

import com.civicintake.security.AuthErrorCode;
import com.civicintake.security.ForbiddenReason;
import com.civicintake.security.audit.AuditAction;
import com.civicintake.security.catalog.Permission;
import com.civicintake.security.catalog.Role;
import com.civicintake.security.testing.TestPrincipals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessRules")
class AccessRulesTest {

    @Test
    @DisplayName("authenticated() allows any principal, even with an unknown role")
    void authenticated() {
        var rule = AccessRules.authenticated();

        assertThat(rule.evaluate(TestPrincipals.withUnknownRole("ROOT")).allowed()).isTrue();
        assertThat(rule.auditAction()).isEqualTo(AuditAction.API_ACCESS);
    }

    @Test
    @DisplayName("anyRole() is satisfied by any listed role or one above it")
    void anyRole() {
        var rule = AccessRules.anyRole(Role.OFFICER, Role.ADMIN);

        assertThat(rule.requirement()).isEqualTo("role:ADMIN, OFFICER");
        assertThat(rule.evaluate(TestPrincipals.withRole(Role.EDITOR)).allowed()).isTrue();
        AccessDecision refused = rule.evaluate(TestPrincipals.citizen());
        assertThat(refused.allowed()).isFalse();
        assertThat(refused.error()).isEqualTo(AuthErrorCode.FORBIDDEN);
        assertThat(refused.forbiddenReason()).isEqualTo(ForbiddenReason.ROLE_REQUIRED);
    }

    @Test
    @DisplayName("permission() names the permission in requirement and message")
    void permission() {
        var rule = AccessRules.permission(Permission.VIEW_AUDIT_LOGS);

        assertThat(rule.requirement()).isEqualTo("permission:view:audit_logs");
        assertThat(rule.auditAction()).isEqualTo(AuditAction.PERMISSION_CHECK);
        assertThat(rule.evaluate(TestPrincipals.admin()).allowed()).isTrue();
        assertThat(rule.evaluate(TestPrincipals.officer()).message()).contains("view:audit_logs");
    }

    @Test
    @DisplayName("unknown roles are INVALID_ROLE for role and permission rules")
    void invalidRole() {
        var ghost = TestPrincipals.withUnknownRole("SUPERUSER");

        assertThat(AccessRules.anyRole(Role.VIEWER).evaluate(ghost).error()).isEqualTo(AuthErrorCode.INVALID_ROLE);
        assertThat(AccessRules.anyPermission(List.of(Permission.READ_FILE)).evaluate(ghost).error())
                .isEqualTo(AuthErrorCode.INVALID_ROLE);
    }

    @Test
    @DisplayName("allOf() records under the most specific action")
    void allOfAction() {
        var rule = AccessRules.allOf(AccessRules.authenticated(), AccessRules.anyRole(Role.ADMIN),
                AccessRules.permission(Permission.MANAGE_ROLES));

        assertThat(rule.auditAction()).isEqualTo(AuditAction.PERMISSION_CHECK);
        assertThat(rule.requirement()).isEqualTo("authenticated & role:ADMIN & permission:manage:roles");
    }

    @Test
    @DisplayName("empty requirements are rejected when the rule is built")
    void rejectsEmpty() {
        assertThatThrownBy(() -> AccessRules.anyRole(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccessRules.anyPermission(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccessRules.allOf()).isInstanceOf(IllegalArgumentException.class);
    }
}
