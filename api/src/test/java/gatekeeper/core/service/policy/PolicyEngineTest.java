package gatekeeper.core.service.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gatekeeper.core.model.auth.Claims;
import gatekeeper.core.model.policy.Decision;
import gatekeeper.core.model.policy.Effect;
import gatekeeper.core.model.policy.PathPredicate;
import gatekeeper.core.model.policy.PrincipalPredicate;
import gatekeeper.core.model.policy.Rule;
import gatekeeper.core.model.policy.RuleSet;

@DisplayName("PolicyEngine")
class PolicyEngineTest {

    private PolicyEngine engine;

    private static Claims claims(String username, String... roles) {
        return new Claims(
                "https://idp",
                "sub-" + username,
                username,
                Set.of(roles),
                Instant.parse("2030-01-01T00:00:00Z"),
                Optional.empty(),
                Optional.empty(),
                Set.of(),
                Map.of());
    }

    private static Rule allow(String id, String prefix, PrincipalPredicate principal) {
        return new Rule(id, new PathPredicate.Prefix(prefix), Set.of(), principal, Effect.ALLOW);
    }

    @BeforeEach
    void setUp() {
        engine = new PolicyEngine();
        engine.reload(new RuleSet(
                "v1",
                List.of(
                        allow("public", "/public", new PrincipalPredicate.AnyAuthenticated()),
                        allow("alice-own", "/alice", new PrincipalPredicate.UsernameEquals("alice")),
                        allow("bob-own", "/bob", new PrincipalPredicate.UsernameEquals("bob")),
                        allow("internal-admin", "/internal", new PrincipalPredicate.RoleContains("admin")))));
    }

    @Nested
    @DisplayName("identity-scoped rules")
    class IdentityScoped {

        @Test
        @DisplayName("should allow the named user on their own prefix")
        void shouldAllowOwner() {
            var decision = engine.decide("GET", "/alice/data", Optional.of(claims("alice")));

            assertEquals(new Decision.Allow("alice-own"), decision);
        }

        @Test
        @DisplayName("should deny another user even with every role")
        void shouldDenyOtherUserWhateverTheirRoles() {
            var decision = engine.decide("GET", "/alice/data", Optional.of(claims("bob", "admin", "user", "superuser")));

            assertEquals(Decision.Deny.byDefault(), decision);
        }

        @Test
        @DisplayName("should compare usernames case-sensitively")
        void shouldBeCaseSensitive() {
            var decision = engine.decide("GET", "/alice", Optional.of(claims("Alice")));

            assertInstanceOf(Decision.Deny.class, decision);
        }

        @Test
        @DisplayName("should not be bypassed by dot segments")
        void shouldNormalizeBeforeMatching() {
            var decision = engine.decide("GET", "/public/../alice/data", Optional.of(claims("bob")));

            assertEquals(Decision.Deny.byDefault(), decision);
        }

        @Test
        @DisplayName("should not treat a longer sibling path as the same prefix")
        void shouldMatchOnSegments() {
            var decision = engine.decide("GET", "/alicex", Optional.of(claims("alice")));

            assertEquals(Decision.Deny.byDefault(), decision);
        }
    }

    @Nested
    @DisplayName("role and authenticated rules")
    class RoleRules {

        @Test
        @DisplayName("should allow any verified user on the public prefix")
        void shouldAllowAnyAuthenticated() {
            assertEquals(new Decision.Allow("public"), engine.decide("POST", "/public/x", Optional.of(claims("carol"))));
        }

        @Test
        @DisplayName("should allow admins on the internal prefix and deny others")
        void shouldRequireRole() {
            assertEquals(
                    new Decision.Allow("internal-admin"),
                    engine.decide("GET", "/internal", Optional.of(claims("bob", "admin"))));
            assertEquals(Decision.Deny.byDefault(), engine.decide("GET", "/internal", Optional.of(claims("alice"))));
        }
    }

    @Nested
    @DisplayName("fail-closed behavior")
    class FailClosed {

        @Test
        @DisplayName("should deny when claims are absent, even on a public rule")
        void shouldDenyWithoutClaims() {
            assertEquals(Decision.Deny.byDefault(), engine.decide("GET", "/public", Optional.empty()));
        }

        @Test
        @DisplayName("should deny paths no rule covers")
        void shouldDenyUncoveredPath() {
            assertEquals(Decision.Deny.byDefault(), engine.decide("GET", "/other", Optional.of(claims("alice"))));
        }

        @Test
        @DisplayName("should deny everything before any rules are installed")
        void shouldDenyWithEmptyRules() {
            var fresh = new PolicyEngine();

            assertEquals(Decision.Deny.byDefault(), fresh.decide("GET", "/public", Optional.of(claims("alice"))));
        }

        @Test
        @DisplayName("should refuse to install an empty rule set")
        void shouldRefuseEmptyRuleSet() {
            var before = engine.currentRules();

            assertThrows(IllegalArgumentException.class, () -> engine.reload(new RuleSet("empty-v2", List.of())));
            assertSame(before, engine.currentRules());
        }
    }

    @Nested
    @DisplayName("rule order")
    class Ordering {

        @Test
        @DisplayName("first matching rule wins, including deny rules")
        void firstMatchWins() {
            engine.reload(new RuleSet(
                    "v2",
                    List.of(
                            new Rule(
                                    "no-deletes",
                                    new PathPredicate.Prefix("/public"),
                                    Set.of("delete"),
                                    new PrincipalPredicate.AnyAuthenticated(),
                                    Effect.DENY),
                            allow("public", "/public", new PrincipalPredicate.AnyAuthenticated()))));

            assertEquals(Decision.Deny.byRule("no-deletes"), engine.decide("DELETE", "/public/x", Optional.of(claims("a"))));
            assertEquals(new Decision.Allow("public"), engine.decide("GET", "/public/x", Optional.of(claims("a"))));
        }

        @Test
        @DisplayName("should skip rules whose principal does not match and keep scanning")
        void shouldContinuePastPrincipalMismatch() {
            engine.reload(new RuleSet(
                    "v3",
                    List.of(
                            allow("admins", "/shared", new PrincipalPredicate.RoleContains("admin")),
                            allow("alice", "/shared", new PrincipalPredicate.UsernameEquals("alice")))));

            assertEquals(new Decision.Allow("alice"), engine.decide("GET", "/shared", Optional.of(claims("alice"))));
        }

        @Test
        @DisplayName("should match exact paths only exactly")
        void shouldMatchExactPath() {
            engine.reload(new RuleSet(
                    "v4",
                    List.of(new Rule(
                            "health",
                            new PathPredicate.Exact("/health"),
                            Set.of("GET"),
                            new PrincipalPredicate.AnyAuthenticated(),
                            Effect.ALLOW))));

            assertEquals(new Decision.Allow("health"), engine.decide("get", "/health", Optional.of(claims("a"))));
            assertEquals(Decision.Deny.byDefault(), engine.decide("GET", "/health/x", Optional.of(claims("a"))));
            assertEquals(Decision.Deny.byDefault(), engine.decide("POST", "/health", Optional.of(claims("a"))));
        }
    }
}
