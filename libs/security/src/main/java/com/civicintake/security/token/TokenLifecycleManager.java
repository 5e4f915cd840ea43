package com.civicintake.security.token;

import com.civicintake.security.Principal;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies the access and refresh credentials.
 * <p>
 * Both are HS256-signed compact JWTs carrying issuer, audience, issue time, expiry, a random
 * {@code jti} and a {@code token_type} claim. The access credential holds the whole principal
 * snapshot; the refresh credential only the id and email. Permissions are never embedded, they
 * are derived from the role whenever a decision is made.
 * <p>
 * Stateless and safe for concurrent use.
 */
public final class TokenLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(TokenLifecycleManager.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private final TokenSettings settings;
    private final SigningKeys keys;
    private final Clock clock;

    public TokenLifecycleManager(TokenSettings settings, SigningKeys keys, Clock clock) {
        if (settings == null || keys == null || clock == null) {
            throw new IllegalArgumentException("settings, keys and clock are required");
        }
        this.settings = settings;
        this.keys = keys;
        this.clock = clock;
    }

    public String issueAccessCredential(Principal principal) {
        Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(principal.id())
                .claim(CLAIM_EMAIL, principal.email())
                .claim(CLAIM_NAME, principal.name())
                .claim(CLAIM_ROLE, principal.role())
                .claim(CLAIM_TOKEN_TYPE, CredentialType.ACCESS.claimValue())
                .issuer(settings.issuer())
                .audience().add(settings.audience()).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(settings.accessTtl())))
                .signWith(keys.keyFor(CredentialType.ACCESS), Jwts.SIG.HS256)
                .compact();
    }

    public String issueRefreshCredential(Principal principal) {
        Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(principal.id())
                .claim(CLAIM_EMAIL, principal.email())
                .claim(CLAIM_TOKEN_TYPE, CredentialType.REFRESH.claimValue())
                .issuer(settings.issuer())
                .audience().add(settings.audience()).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(settings.refreshTtl())))
                .signWith(keys.keyFor(CredentialType.REFRESH), Jwts.SIG.HS256)
                .compact();
    }

    public CredentialPair issueCredentialPair(Principal principal) {
        return new CredentialPair(issueAccessCredential(principal), issueRefreshCredential(principal));
    }

    /**
     * Verifies signature, issuer, audience, credential type and expiry.
     *
     * @return the principal snapshot the credential was issued for
     * @throws CredentialVerificationException if any check fails
     */
    public Principal verifyAccessCredential(String token) {
        Claims claims = verify(CredentialType.ACCESS, token);
        return new Principal(
                claims.getSubject(),
                claims.get(CLAIM_EMAIL, String.class),
                claims.get(CLAIM_NAME, String.class),
                claims.get(CLAIM_ROLE, String.class));
    }

    /**
     * Verifies a refresh credential the same way as an access credential.
     *
     * @throws CredentialVerificationException if any check fails
     */
    public RefreshClaims verifyRefreshCredential(String token) {
        Claims claims = verify(CredentialType.REFRESH, token);
        return new RefreshClaims(claims.getSubject(), claims.get(CLAIM_EMAIL, String.class));
    }

    /**
     * Reads the payload without checking the signature. The result must not be trusted for any
     * authorization decision; it exists for expiry pre-checks.
     *
     * @return the claims, or empty if the token is not a decodable JWT or its payload is not a JSON object
     */
    public Optional<Map<String, Object>> decodeWithoutVerification(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            return Optional.ofNullable(MAPPER.readValue(payload, CLAIMS_TYPE));
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Token payload is not decodable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Expiry as stated by the unverified payload.
     */
    public Optional<Instant> expiryOf(String token) {
        return decodeWithoutVerification(token)
                .map(claims -> claims.get(Claims.EXPIRATION))
                .filter(Number.class::isInstance)
                .map(exp -> Instant.ofEpochSecond(((Number) exp).longValue()));
    }

    /**
     * True when the unverified payload states an expiry in the past, or states none at all.
     */
    public boolean isExpired(String token) {
        return expiryOf(token)
                .map(expiry -> clock.instant().isAfter(expiry))
                .orElse(true);
    }

    public TokenSettings settings() {
        return settings;
    }

    private Claims verify(CredentialType type, String token) {
        if (token == null || token.isBlank()) {
            throw new CredentialVerificationException(type, CredentialVerificationException.Failure.MALFORMED,
                    "%s credential is empty".formatted(type.claimValue()), null);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keys.keyFor(type))
                    .requireIssuer(settings.issuer())
                    .requireAudience(settings.audience())
                    .require(CLAIM_TOKEN_TYPE, type.claimValue())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("{} credential expired at {}", type.claimValue(), e.getClaims().getExpiration());
            throw new CredentialVerificationException(type, CredentialVerificationException.Failure.EXPIRED,
                    "%s credential has expired".formatted(type.claimValue()), e);
        } catch (InvalidClaimException e) {
            log.debug("{} credential claim mismatch: {}", type.claimValue(), e.getMessage());
            throw new CredentialVerificationException(type, CredentialVerificationException.Failure.CLAIM_MISMATCH,
                    "%s credential was not issued for this service".formatted(type.claimValue()), e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("{} credential rejected: {}", type.claimValue(), e.getMessage());
            throw new CredentialVerificationException(type, CredentialVerificationException.Failure.MALFORMED,
                    "%s credential is malformed or has an invalid signature".formatted(type.claimValue()), e);
        }
        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new CredentialVerificationException(type, CredentialVerificationException.Failure.MALFORMED,
                    "%s credential has no subject".formatted(type.claimValue()), null);
        }
        return claims;
    }
}
