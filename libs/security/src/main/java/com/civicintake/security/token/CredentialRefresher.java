package com.civicintake.security.token;

import com.civicintake.security.AuthErrorCode;
import com.civicintake.security.Principal;
import com.civicintake.security.PrincipalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Exchanges a refresh credential for a brand-new credential pair.
 * <p>
 * The principal is looked up again rather than trusted from the presented credential, so role
 * and name changes take effect at the next refresh. Presented credentials are not recorded as
 * spent: a refresh credential stays exchangeable until it expires, and two concurrent exchanges
 * of the same credential both succeed.
 */
public final class CredentialRefresher {

    private static final Logger log = LoggerFactory.getLogger(CredentialRefresher.class);

    private final TokenLifecycleManager tokens;
    private final PrincipalStore principals;

    public CredentialRefresher(TokenLifecycleManager tokens, PrincipalStore principals) {
        if (tokens == null || principals == null) {
            throw new IllegalArgumentException("tokens and principals are required");
        }
        this.tokens = tokens;
        this.principals = principals;
    }

    /**
     * @param presentedCredential the refresh credential read from cookie storage, may be null
     */
    public RefreshOutcome refresh(String presentedCredential) {
        if (presentedCredential == null || presentedCredential.isBlank()) {
            return RefreshOutcome.rejected(AuthErrorCode.MISSING_REFRESH_TOKEN);
        }

        RefreshClaims claims;
        try {
            claims = tokens.verifyRefreshCredential(presentedCredential);
        } catch (CredentialVerificationException e) {
            log.info("Refresh rejected: {} ({})", e.getMessage(), e.failure());
            return RefreshOutcome.rejected(AuthErrorCode.INVALID_REFRESH_TOKEN);
        }

        Optional<Principal> current = principals.findById(claims.id());
        if (current.isEmpty()) {
            log.info("Refresh rejected: account {} no longer exists", claims.id());
            return RefreshOutcome.rejected(AuthErrorCode.USER_NOT_FOUND);
        }

        Principal principal = current.get();
        CredentialPair pair = tokens.issueCredentialPair(principal);
        log.debug("Rotated credentials for account {}", principal.id());
        return RefreshOutcome.rotated(principal, pair);
    }
}
