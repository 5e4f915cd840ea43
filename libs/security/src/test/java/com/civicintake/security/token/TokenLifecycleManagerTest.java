package com.civicintake.security.token;

import com.civicintake.security.Principal;
import com.civicintake.security.catalog.Role;
import com.civicintake.security.testing.MutableClock;
import com.civicintake.security.testing.TestPrincipals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TokenLifecycleManager}: issuance, verification, expiry and isolation between
 * issuers, audiences and credential types.
 */
@DisplayName("TokenLifecycleManager")
class TokenLifecycleManagerTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    private MutableClock clock;
    private TokenLifecycleManager tokens;
    private Principal citizen;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tokens = TestPrincipals.tokenManager(clock);
        citizen = TestPrincipals.citizen();
    }

    @Nested
    @DisplayName("access credentials")
    class AccessCredentials {

        @Test
        @DisplayName("verify back to the principal they were issued for")
        void roundTrip() {
            String token = tokens.issueAccessCredential(citizen);

            assertThat(tokens.verifyAccessCredential(token)).isEqualTo(citizen);
        }

        @Test
        @DisplayName("carry an unknown role through verification unchanged")
        void unknownRoleSurvives() {
            Principal ghost = TestPrincipals.withUnknownRole("SUPERUSER");

            Principal verified = tokens.verifyAccessCredential(tokens.issueAccessCredential(ghost));

            assertThat(verified.role()).isEqualTo("SUPERUSER");
            assertThat(verified.knownRole()).isEmpty();
        }

        @Test
        @DisplayName("are valid just before the TTL and expired just after")
        void expiry() {
            String token = tokens.issueAccessCredential(citizen);

            clock.advance(TokenSettings.DEFAULT_ACCESS_TTL.minusSeconds(1));
            assertThat(tokens.verifyAccessCredential(token)).isEqualTo(citizen);

            clock.advance(Duration.ofSeconds(2));
            assertThatThrownBy(() -> tokens.verifyAccessCredential(token))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e -> {
                        assertThat(e.failure()).isEqualTo(CredentialVerificationException.Failure.EXPIRED);
                        assertThat(e.credentialType()).isEqualTo(CredentialType.ACCESS);
                    });
        }

        @Test
        @DisplayName("two credentials issued in the same second differ")
        void uniquePerIssue() {
            assertThat(tokens.issueAccessCredential(citizen)).isNotEqualTo(tokens.issueAccessCredential(citizen));
        }

        @Test
        @DisplayName("reject garbage and empty input as malformed")
        void rejectsGarbage() {
            assertThatThrownBy(() -> tokens.verifyAccessCredential("garbage"))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e ->
                            assertThat(e.failure()).isEqualTo(CredentialVerificationException.Failure.MALFORMED));
            assertThatThrownBy(() -> tokens.verifyAccessCredential(""))
                    .isInstanceOf(CredentialVerificationException.class);
        }

        @Test
        @DisplayName("reject a credential signed with another key")
        void rejectsForeignKey() {
            var foreign = new TokenLifecycleManager(TokenSettings.defaults(),
                    SigningKeys.fromSecrets("another-access-secret-0123456789abcdefghij",
                            "another-refresh-secret-0123456789abcdefghi"), clock);

            assertThatThrownBy(() -> tokens.verifyAccessCredential(foreign.issueAccessCredential(citizen)))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e ->
                            assertThat(e.failure()).isEqualTo(CredentialVerificationException.Failure.MALFORMED));
        }
    }

    @Nested
    @DisplayName("isolation")
    class Isolation {

        @Test
        @DisplayName("a credential for another issuer is rejected even with the same key")
        void otherIssuer() {
            var other = new TokenLifecycleManager(
                    new TokenSettings("someone-else", TokenSettings.DEFAULT_AUDIENCE,
                            TokenSettings.DEFAULT_ACCESS_TTL, TokenSettings.DEFAULT_REFRESH_TTL),
                    TestPrincipals.signingKeys(), clock);

            assertThatThrownBy(() -> tokens.verifyAccessCredential(other.issueAccessCredential(citizen)))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e ->
                            assertThat(e.failure())
                                    .isEqualTo(CredentialVerificationException.Failure.CLAIM_MISMATCH));
        }

        @Test
        @DisplayName("a credential for another audience is rejected even with the same key")
        void otherAudience() {
            var other = new TokenLifecycleManager(
                    new TokenSettings(TokenSettings.DEFAULT_ISSUER, "mobile-client",
                            TokenSettings.DEFAULT_ACCESS_TTL, TokenSettings.DEFAULT_REFRESH_TTL),
                    TestPrincipals.signingKeys(), clock);

            assertThatThrownBy(() -> tokens.verifyAccessCredential(other.issueAccessCredential(citizen)))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e ->
                            assertThat(e.failure())
                                    .isEqualTo(CredentialVerificationException.Failure.CLAIM_MISMATCH));
        }

        @Test
        @DisplayName("a refresh credential is never accepted as an access credential")
        void refreshIsNotAccess() {
            String refresh = tokens.issueRefreshCredential(citizen);

            assertThatThrownBy(() -> tokens.verifyAccessCredential(refresh))
                    .isInstanceOf(CredentialVerificationException.class);
        }

        @Test
        @DisplayName("credential types stay apart even when both share one secret")
        void typeClaimSeparatesSharedSecret() {
            String shared = "shared-secret-for-both-credential-types-0123";
            var sameKeys = new TokenLifecycleManager(TokenSettings.defaults(),
                    SigningKeys.fromSecrets(shared, shared), clock);

            String access = sameKeys.issueAccessCredential(citizen);
            String refresh = sameKeys.issueRefreshCredential(citizen);

            assertThatThrownBy(() -> sameKeys.verifyAccessCredential(refresh))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e ->
                            assertThat(e.failure())
                                    .isEqualTo(CredentialVerificationException.Failure.CLAIM_MISMATCH));
            assertThatThrownBy(() -> sameKeys.verifyRefreshCredential(access))
                    .isInstanceOf(CredentialVerificationException.class);
        }
    }

    @Nested
    @DisplayName("refresh credentials")
    class RefreshCredentials {

        @Test
        @DisplayName("carry only id and email")
        void minimalClaims() {
            String refresh = tokens.issueRefreshCredential(citizen);

            assertThat(tokens.verifyRefreshCredential(refresh))
                    .isEqualTo(new RefreshClaims(citizen.id(), citizen.email()));
            assertThat(tokens.decodeWithoutVerification(refresh)).get()
                    .satisfies(claims -> assertThat(claims).doesNotContainKeys("role", "name"));
        }

        @Test
        @DisplayName("outlive the access credential")
        void outliveAccess() {
            CredentialPair pair = tokens.issueCredentialPair(citizen);

            clock.advance(Duration.ofDays(1));

            assertThatThrownBy(() -> tokens.verifyAccessCredential(pair.accessCredential()))
                    .isInstanceOf(CredentialVerificationException.class);
            assertThat(tokens.verifyRefreshCredential(pair.refreshCredential()).id()).isEqualTo(citizen.id());

            clock.advance(Duration.ofDays(6).plusSeconds(1));
            assertThatThrownBy(() -> tokens.verifyRefreshCredential(pair.refreshCredential()))
                    .isInstanceOfSatisfying(CredentialVerificationException.class, e ->
                            assertThat(e.failure()).isEqualTo(CredentialVerificationException.Failure.EXPIRED));
        }

        @Test
        @DisplayName("pair toString never prints the credentials")
        void pairRedacted() {
            CredentialPair pair = tokens.issueCredentialPair(citizen);

            assertThat(pair.toString()).doesNotContain(pair.accessCredential(), pair.refreshCredential());
        }
    }

    @Nested
    @DisplayName("unverified inspection")
    class UnverifiedInspection {

        @Test
        @DisplayName("decodes the payload without the key")
        void decodes() {
            String token = tokens.issueAccessCredential(TestPrincipals.withRole(Role.OFFICER));

            assertThat(tokens.decodeWithoutVerification(token)).get()
                    .satisfies(claims -> {
                        assertThat(claims).containsEntry("role", "OFFICER");
                        assertThat(claims).containsEntry("token_type", "access");
                        assertThat(claims).containsEntry("iss", TokenSettings.DEFAULT_ISSUER);
                    });
        }

        @Test
        @DisplayName("reports expiry from the payload")
        void expiry() {
            String token = tokens.issueAccessCredential(citizen);

            assertThat(tokens.expiryOf(token)).contains(START.plus(TokenSettings.DEFAULT_ACCESS_TTL));
            assertThat(tokens.isExpired(token)).isFalse();

            clock.advance(Duration.ofMinutes(16));
            assertThat(tokens.isExpired(token)).isTrue();
        }

        @Test
        @DisplayName("treats undecodable input as expired")
        void undecodable() {
            assertThat(tokens.decodeWithoutVerification("not-a-jwt")).isEmpty();
            assertThat(tokens.decodeWithoutVerification("a.%%%.c")).isEmpty();
            assertThat(tokens.isExpired(null)).isTrue();
        }

        @Test
        @DisplayName("treats a payload that is not a JSON object as undecodable")
        void nonObjectPayload() {
            String nullPayload = withPayload("null");
            String arrayPayload = withPayload("[1]");

            assertThat(tokens.decodeWithoutVerification(nullPayload)).isEmpty();
            assertThat(tokens.decodeWithoutVerification(arrayPayload)).isEmpty();
            assertThat(tokens.expiryOf(nullPayload)).isEmpty();
            assertThat(tokens.isExpired(nullPayload)).isTrue();
            assertThat(tokens.isExpired(arrayPayload)).isTrue();
        }

        private String withPayload(String json) {
            String payload = Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(json.getBytes(StandardCharsets.UTF_8));
            return "eyJhbGciOiJIUzI1NiJ9." + payload + ".sig";
        }
    }
}
