package com.civicintake.authservice.api;

import com.civicintake.authservice.domain.AccountService;
import com.civicintake.authservice.domain.UserAccount;
import com.civicintake.authservice.error.ValidationException;
import com.civicintake.authservice.infrastructure.metrics.AuthMetrics;
import com.civicintake.authservice.infrastructure.web.GuardRequests;
import com.civicintake.authservice.infrastructure.web.RefreshCookies;
import com.civicintake.security.catalog.Role;
import com.civicintake.security.guard.AuthorizationGuard;
import com.civicintake.security.token.CredentialPair;
import com.civicintake.security.token.CredentialRefresher;
import com.civicintake.security.token.RefreshOutcome;
import com.civicintake.security.token.TokenLifecycleManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session endpoints.
 *
 * <p>Login, signup and refresh answer with the access credential in the body and the refresh
 * credential in an HttpOnly cookie. Refresh rotates both; any refresh failure also deletes the
 * cookie so the client stops presenting it.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AccountService accounts;
    private final TokenLifecycleManager tokens;
    private final CredentialRefresher refresher;
    private final AuthorizationGuard guard;
    private final RefreshCookies cookies;
    private final AuthMetrics metrics;

    public AuthController(
            AccountService accounts,
            TokenLifecycleManager tokens,
            CredentialRefresher refresher,
            AuthorizationGuard guard,
            RefreshCookies cookies,
            AuthMetrics metrics) {
        this.accounts = accounts;
        this.tokens = tokens;
        this.refresher = refresher;
        this.guard = guard;
        this.cookies = cookies;
        this.metrics = metrics;
    }

    @PostMapping("/signup")
    public ResponseEntity<ApiResponse> signup(@Valid @RequestBody SignupRequest request) {
        Role role = null;
        if (request.role() != null && !request.role().isBlank()) {
            role = Role.fromValue(request.role())
                    .orElseThrow(() -> new ValidationException("Unknown role '%s'".formatted(request.role())));
        }
        UserAccount account =
                accounts.register(request.name(), request.email(), request.password(), request.phone(), role);
        return session(HttpStatus.CREATED, "Signup successful", account, "signup");
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse> login(@Valid @RequestBody LoginRequest request) {
        UserAccount account = accounts.authenticate(request.email(), request.password());
        return session(HttpStatus.OK, "Login successful", account, "login");
    }

    @PostMapping("/refresh")
    public ResponseEntity<ApiResponse> refresh(
            @CookieValue(name = RefreshCookies.COOKIE_NAME, required = false) String refreshCredential) {
        RefreshOutcome outcome = refresher.refresh(refreshCredential);
        if (!outcome.isRotated()) {
            return ResponseEntity.status(outcome.error().httpStatus())
                    .header(HttpHeaders.SET_COOKIE, cookies.clear().toString())
                    .body(ApiResponse.failure(outcome.error().defaultMessage(), outcome.error().name()));
        }
        metrics.credentialPairIssued("refresh");
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookies.issue(outcome.pair().refreshCredential()).toString())
                .body(ApiResponse.session("Token refreshed successfully",
                        outcome.pair().accessCredential(), UserView.of(outcome.principal())));
    }

    @PostMapping("/logout")
    public ResponseEntity<ApiResponse> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookies.clear().toString())
                .body(ApiResponse.ok("Logout successful"));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse> me(HttpServletRequest http) {
        return GuardRequests.respond(guard.<ResponseEntity<ApiResponse>>requireAuthentication(
                        (request, principal) -> ResponseEntity.ok(
                                ApiResponse.withUser("User authenticated", UserView.of(principal))))
                .handle(GuardRequests.from(http)));
    }

    private ResponseEntity<ApiResponse> session(
            HttpStatus status, String message, UserAccount account, String trigger) {
        CredentialPair pair = tokens.issueCredentialPair(account.toPrincipal());
        metrics.credentialPairIssued(trigger);
        return ResponseEntity.status(status)
                .header(HttpHeaders.SET_COOKIE, cookies.issue(pair.refreshCredential()).toString())
                .body(ApiResponse.session(message, pair.accessCredential(), UserView.of(account)));
    }
}
