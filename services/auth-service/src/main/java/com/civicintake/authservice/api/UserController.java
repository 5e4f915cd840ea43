package com.civicintake.authservice.api;

import com.civicintake.authservice.domain.AccountService;
import com.civicintake.authservice.domain.UserAccount;
import com.civicintake.authservice.error.AuthorizationException;
import com.civicintake.authservice.error.ValidationException;
import com.civicintake.authservice.infrastructure.web.GuardRequests;
import com.civicintake.security.ForbiddenReason;
import com.civicintake.security.audit.AuditRecorder;
import com.civicintake.security.catalog.Permission;
import com.civicintake.security.catalog.ResourceAuthorizer;
import com.civicintake.security.catalog.ResourceType;
import com.civicintake.security.catalog.Role;
import com.civicintake.security.guard.AccessRules;
import com.civicintake.security.guard.AuthorizationGuard;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account administration, each endpoint behind its own guard.
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final AccountService accounts;
    private final AuthorizationGuard guard;
    private final AuditRecorder audit;

    public UserController(AccountService accounts, AuthorizationGuard guard, AuditRecorder audit) {
        this.accounts = accounts;
        this.guard = guard;
        this.audit = audit;
    }

    @GetMapping
    public ResponseEntity<ApiResponse> list(HttpServletRequest http) {
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>requirePermission(
                        Permission.READ_USER,
                        (request, principal) -> {
                            List<UserView> users = accounts.findAll().stream().map(UserView::of).toList();
                            return ResponseEntity.ok(ApiResponse.ok("Users retrieved", users));
                        })
                .handle(GuardRequests.from(http)));
    }

    /**
     * Owners may always read their own account; anyone else needs {@code read:user}.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> get(@PathVariable String id, HttpServletRequest http) {
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>requireAuthentication(
                        (request, principal) -> {
                            var authorizer = new ResourceAuthorizer(principal);
                            boolean allowed = authorizer.canRead(id, ResourceType.USER);
                            audit.recordResourceAccess(principal, ResourceType.USER, id,
                                    ResourceType.USER.readPermission(), allowed,
                                    allowed ? "Owner or holder of read:user" : "Not owner and lacks read:user");
                            if (!allowed) {
                                throw new AuthorizationException(ForbiddenReason.PERMISSION_REQUIRED,
                                        "Insufficient permissions. Required permission: read:user");
                            }
                            return ResponseEntity.ok(
                                    ApiResponse.withUser("User retrieved", UserView.of(accounts.get(id))));
                        })
                .handle(GuardRequests.from(http)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> delete(@PathVariable String id, HttpServletRequest http) {
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>requirePermission(
                        Permission.DELETE_USER,
                        (request, principal) -> {
                            accounts.delete(id);
                            return ResponseEntity.ok(ApiResponse.ok("User deleted"));
                        })
                .handle(GuardRequests.from(http)));
    }

    @PutMapping("/{id}/role")
    public ResponseEntity<ApiResponse> changeRole(
            @PathVariable String id, @Valid @RequestBody RoleChangeRequest body, HttpServletRequest http) {
        var rule = AccessRules.allOf(AccessRules.anyRole(Role.ADMIN), AccessRules.permission(Permission.MANAGE_ROLES));
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>protect(
                        rule,
                        (request, principal) -> {
                            Role role = Role.fromValue(body.role())
                                    .orElseThrow(() -> new ValidationException(
                                            "Unknown role '%s'".formatted(body.role())));
                            UserAccount updated = accounts.changeRole(id, role);
                            return ResponseEntity.ok(ApiResponse.withUser("Role updated", UserView.of(updated)));
                        })
                .handle(GuardRequests.from(http)));
    }
}
