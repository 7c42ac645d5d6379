package gatekeeper.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.NumericDate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gatekeeper.core.model.auth.SigningKey;
import gatekeeper.core.model.auth.TokenVerificationResult;
import gatekeeper.core.model.auth.TokenVerificationResult.Rejected;
import gatekeeper.core.model.auth.TokenVerificationResult.Verified;
import gatekeeper.core.model.auth.VerificationError;
import gatekeeper.core.port.out.SigningKeyResolver;
import gatekeeper.support.TestConfigs;
import gatekeeper.support.TestTokens;

@DisplayName("TokenVerifier")
class TokenVerifierTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static TestTokens tokens;
    private static TestTokens otherKey;

    @BeforeAll
    static void setUpKeys() {
        tokens = TestTokens.generate("signing-key");
        otherKey = TestTokens.generate("signing-key");
    }

    private static SigningKeyResolver publishing(SigningKey key) {
        return keyId -> Uni.createFrom().item(key.keyId().equals(keyId) ? Optional.of(key) : Optional.empty());
    }

    private static TokenVerifier verifier(TestConfigs.Auth config) {
        return new TokenVerifier(publishing(tokens.signingKey(NOW)), config);
    }

    private static TokenVerificationResult verify(TokenVerifier verifier, String token) {
        return verifier.verify(token, TestConfigs.ISSUER, NOW).await().atMost(TIMEOUT);
    }

    private static TokenVerificationResult verify(String token) {
        return verify(verifier(TestConfigs.auth()), token);
    }

    private static void assertRejected(VerificationError expected, TokenVerificationResult result) {
        var rejected = assertInstanceOf(Rejected.class, result);
        assertEquals(expected, rejected.error());
    }

    @Nested
    @DisplayName("valid tokens")
    class ValidTokens {

        @Test
        @DisplayName("should return claims with username and roles")
        void shouldReturnClaims() {
            var result = verify(tokens.token("alice", NOW, "user", "admin"));

            var claims = assertInstanceOf(Verified.class, result).claims();
            assertEquals(TestConfigs.ISSUER, claims.issuer());
            assertEquals("sub-alice", claims.subject());
            assertEquals("alice", claims.username());
            assertEquals(Set.of("user", "admin"), claims.roles());
            assertEquals(NOW.plusSeconds(3600), claims.expiresAt());
            assertEquals(Optional.of(NOW), claims.issuedAt());
            assertEquals("alice", claims.attributes().get("preferred_username"));
        }

        @Test
        @DisplayName("should accept a key that declares no algorithm")
        void shouldAcceptKeyWithoutAlgorithm() {
            var key = tokens.signingKey(NOW);
            var undeclared = new SigningKey(key.keyId(), Optional.empty(), key.publicKey(), NOW);
            var verifier = new TokenVerifier(publishing(undeclared), TestConfigs.auth());

            assertInstanceOf(Verified.class, verify(verifier, tokens.token("alice", NOW)));
        }

        @Test
        @DisplayName("should accept a token with an accepted audience")
        void shouldAcceptAudience() {
            var claims = TestTokens.claims("alice", NOW);
            claims.setAudience("gateway", "other");
            var verifier = verifier(TestConfigs.auth().withAudiences("gateway"));

            var result = assertInstanceOf(Verified.class, verify(verifier, tokens.sign(claims)));
            assertEquals(Set.of("gateway", "other"), result.claims().audiences());
        }

        @Test
        @DisplayName("should tolerate expiry within the configured clock skew")
        void shouldTolerateSkew() {
            var claims = TestTokens.claims("alice", NOW);
            claims.setExpirationTime(NumericDate.fromSeconds(NOW.getEpochSecond() - 20));
            var verifier = verifier(TestConfigs.auth().withClockSkew(Duration.ofSeconds(30)));

            assertInstanceOf(Verified.class, verify(verifier, tokens.sign(claims)));
        }

        @Test
        @DisplayName("should not let nested claim objects be changed after verification")
        void shouldFreezeNestedClaims() {
            var result = verify(tokens.token("alice", NOW, "user"));

            var claims = assertInstanceOf(Verified.class, result).claims();
            @SuppressWarnings("unchecked")
            var realmAccess = (Map<String, Object>) claims.attributes().get("realm_access");
            @SuppressWarnings("unchecked")
            var roles = (List<Object>) realmAccess.get("roles");

            assertThrows(UnsupportedOperationException.class, () -> realmAccess.put("roles", List.of("admin")));
            assertThrows(UnsupportedOperationException.class, () -> realmAccess.remove("roles"));
            assertThrows(UnsupportedOperationException.class, () -> roles.add("admin"));
            assertEquals(List.of("user"), roles);
        }
    }

    @Nested
    @DisplayName("structural problems")
    class Structure {

        @Test
        @DisplayName("should reject a missing token")
        void shouldRejectMissing() {
            assertRejected(VerificationError.MISSING, verify((String) null));
            assertRejected(VerificationError.MISSING, verify("  "));
        }

        @Test
        @DisplayName("should reject tokens without three non-empty segments")
        void shouldRejectWrongSegmentCount() {
            assertRejected(VerificationError.MALFORMED, verify("abc.def"));
            assertRejected(VerificationError.MALFORMED, verify("abc..ghi"));
            assertRejected(VerificationError.MALFORMED, verify("a.b.c.d"));
        }

        @Test
        @DisplayName("should reject a header that is not JSON")
        void shouldRejectGarbageHeader() {
            assertRejected(VerificationError.MALFORMED, verify("abc.def.ghi"));
        }

        @Test
        @DisplayName("should reject a token without a key id")
        void shouldRejectMissingKeyId() {
            var token = tokens.sign(TestTokens.claims("alice", NOW), AlgorithmIdentifiers.RSA_USING_SHA256, null);

            assertRejected(VerificationError.MALFORMED, verify(token));
        }

        @Test
        @DisplayName("should reject a token without a username claim")
        void shouldRejectMissingUsername() {
            var claims = TestTokens.claims("alice", NOW);
            claims.unsetClaim("preferred_username");

            assertRejected(VerificationError.MALFORMED, verify(tokens.sign(claims)));
        }

        @Test
        @DisplayName("should reject a token without an exp claim")
        void shouldRejectMissingExpiry() {
            var claims = TestTokens.claims("alice", NOW);
            claims.unsetClaim("exp");

            assertRejected(VerificationError.MALFORMED, verify(tokens.sign(claims)));
        }
    }

    @Nested
    @DisplayName("algorithms")
    class Algorithms {

        @Test
        @DisplayName("should reject alg none without consulting the key resolver")
        void shouldRejectNone() {
            var token = TestTokens.forge("{\"alg\":\"none\",\"kid\":\"signing-key\"}", TestTokens.claims("alice", NOW));
            SigningKeyResolver failing = keyId -> Uni.createFrom().failure(new AssertionError("must not resolve"));
            var verifier = new TokenVerifier(failing, TestConfigs.auth());

            assertRejected(VerificationError.UNSUPPORTED_ALGORITHM, verify(verifier, token));
        }

        @Test
        @DisplayName("should reject HMAC tokens")
        void shouldRejectHmac() {
            var token = TestTokens.forge("{\"alg\":\"HS256\",\"kid\":\"signing-key\"}", TestTokens.claims("alice", NOW));

            assertRejected(VerificationError.UNSUPPORTED_ALGORITHM, verify(token));
        }

        @Test
        @DisplayName("should reject an allowed algorithm the key was not published for")
        void shouldRejectAlgorithmKeyMismatch() {
            var token = tokens.sign(
                    TestTokens.claims("alice", NOW), AlgorithmIdentifiers.RSA_USING_SHA384, tokens.keyId());
            var verifier = verifier(TestConfigs.auth().withAlgorithms("RS256", "RS384"));

            assertRejected(VerificationError.SIGNATURE_INVALID, verify(verifier, token));
        }

        @Test
        @DisplayName("should refuse to allow none or HMAC algorithms")
        void shouldRefuseUnsafeConfiguration() {
            assertThrows(IllegalStateException.class, () -> TokenVerifier.checkAlgorithms(List.of("RS256", "none")));
            assertThrows(IllegalStateException.class, () -> TokenVerifier.checkAlgorithms(List.of("HS256")));
            assertThrows(IllegalStateException.class, () -> TokenVerifier.checkAlgorithms(List.of()));
            assertThrows(IllegalStateException.class, () -> TokenVerifier.checkAlgorithms(List.of(" ")));
            assertThrows(IllegalStateException.class, () -> verifier(TestConfigs.auth().withAlgorithms("HS512")));
        }

        @Test
        @DisplayName("should keep a safe allow-list")
        void shouldKeepSafeAllowList() {
            assertEquals(Set.of("RS256", "ES256"), TokenVerifier.checkAlgorithms(List.of("RS256", " ES256 ")));
        }
    }

    @Nested
    @DisplayName("signatures and keys")
    class Signatures {

        @Test
        @DisplayName("should reject a token whose payload was altered")
        void shouldRejectTamperedPayload() {
            var token = tokens.token("bob", NOW);
            var forgedPayload = TestTokens.forge("{}", TestTokens.claims("alice", NOW)).split("\\.")[1];
            var parts = token.split("\\.");

            assertRejected(VerificationError.SIGNATURE_INVALID, verify(parts[0] + "." + forgedPayload + "." + parts[2]));
        }

        @Test
        @DisplayName("should reject a token signed by a different key with the same key id")
        void shouldRejectForeignKey() {
            assertRejected(VerificationError.SIGNATURE_INVALID, verify(otherKey.token("alice", NOW)));
        }

        @Test
        @DisplayName("should reject a token whose key id is not published")
        void shouldRejectUnknownKeyId() {
            var token = tokens.sign(
                    TestTokens.claims("alice", NOW), AlgorithmIdentifiers.RSA_USING_SHA256, "unknown-key");

            assertRejected(VerificationError.KEY_UNAVAILABLE, verify(token));
        }

        @Test
        @DisplayName("should reject when key resolution fails")
        void shouldRejectOnResolverFailure() {
            SigningKeyResolver failing = keyId -> Uni.createFrom().failure(new IllegalStateException("down"));
            var verifier = new TokenVerifier(failing, TestConfigs.auth());

            assertRejected(VerificationError.KEY_UNAVAILABLE, verify(verifier, tokens.token("alice", NOW)));
        }
    }

    @Nested
    @DisplayName("claims")
    class ClaimChecks {

        @Test
        @DisplayName("should reject a token at its expiry instant")
        void shouldRejectExpired() {
            var claims = TestTokens.claims("alice", NOW);
            claims.setExpirationTime(NumericDate.fromSeconds(NOW.getEpochSecond()));

            assertRejected(VerificationError.EXPIRED, verify(tokens.sign(claims)));
        }

        @Test
        @DisplayName("should reject a token used before nbf")
        void shouldRejectNotYetValid() {
            var claims = TestTokens.claims("alice", NOW);
            claims.setNotBefore(NumericDate.fromSeconds(NOW.getEpochSecond() + 60));

            assertRejected(VerificationError.NOT_YET_VALID, verify(tokens.sign(claims)));
            assertInstanceOf(
                    Verified.class,
                    verify(verifier(TestConfigs.auth().withClockSkew(Duration.ofSeconds(60))), tokens.sign(claims)));
        }

        @Test
        @DisplayName("should reject a token from another issuer")
        void shouldRejectIssuer() {
            var claims = TestTokens.claims("alice", NOW);
            claims.setIssuer("https://evil.example.com");

            assertRejected(VerificationError.ISSUER_MISMATCH, verify(tokens.sign(claims)));
        }

        @Test
        @DisplayName("should reject a token whose audience is not accepted")
        void shouldRejectAudience() {
            var verifier = verifier(TestConfigs.auth().withAudiences("gateway"));
            var claims = TestTokens.claims("alice", NOW);

            assertRejected(VerificationError.AUDIENCE_MISMATCH, verify(verifier, tokens.sign(claims)));

            claims.setAudience("someone-else");
            assertRejected(VerificationError.AUDIENCE_MISMATCH, verify(verifier, tokens.sign(claims)));
        }

        @Test
        @DisplayName("should reject time claims beyond the representable range as malformed")
        void shouldRejectOutOfRangeTimes() {
            var hugeExpiry = TestTokens.claims("alice", NOW);
            hugeExpiry.setExpirationTime(NumericDate.fromSeconds(Long.MAX_VALUE));
            var hugeIssuedAt = TestTokens.claims("alice", NOW);
            hugeIssuedAt.setIssuedAt(NumericDate.fromSeconds(Long.MAX_VALUE));
            var hugeNotBefore = TestTokens.claims("alice", NOW);
            hugeNotBefore.setNotBefore(NumericDate.fromSeconds(Long.MIN_VALUE));

            assertRejected(VerificationError.MALFORMED, verify(tokens.sign(hugeExpiry)));
            assertRejected(VerificationError.MALFORMED, verify(tokens.sign(hugeIssuedAt)));
            assertRejected(VerificationError.MALFORMED, verify(tokens.sign(hugeNotBefore)));
        }

        @Test
        @DisplayName("should read roles from arrays and delimited strings")
        void shouldExtractRoles() {
            var verifier = verifier(TestConfigs.auth());

            assertEquals(
                    Set.of("a", "b", "c"),
                    verifier.extractRoles(Map.of("realm_access", Map.of("roles", "a, b c"))));
            assertEquals(Set.of("x"), verifier.extractRoles(Map.of("realm_access", Map.of("roles", List.of("x", "")))));
            assertTrue(verifier.extractRoles(Map.of("realm_access", "not-an-object")).isEmpty());
            assertTrue(verifier.extractRoles(Map.of()).isEmpty());
        }
    }
}
