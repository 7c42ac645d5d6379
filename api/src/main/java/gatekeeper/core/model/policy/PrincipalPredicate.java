package gatekeeper.core.model.policy;

import java.util.Optional;

import gatekeeper.core.model.auth.Claims;

/**
 * Identity predicate of an authorization rule.
 *
 * <p>Identity and role predicates are orthogonal. {@link UsernameEquals} looks only at the
 * username claim, so no role, however privileged, can stand in for a required identity.
 * No predicate matches a request without verified claims.
 */
public sealed interface PrincipalPredicate {

    boolean matches(Optional<Claims> claims);

    /**
     * Any verified identity.
     */
    record AnyAuthenticated() implements PrincipalPredicate {
        @Override
        public boolean matches(Optional<Claims> claims) {
            return claims.isPresent();
        }
    }

    /**
     * Exactly one identity. Case-sensitive, no normalization, roles ignored.
     */
    record UsernameEquals(String username) implements PrincipalPredicate {
        public UsernameEquals {
            if (username == null || username.isBlank()) {
                throw new IllegalArgumentException("Username cannot be null or blank");
            }
        }

        @Override
        public boolean matches(Optional<Claims> claims) {
            return claims.map(c -> username.equals(c.username())).orElse(false);
        }
    }

    /**
     * Any identity carrying the given role.
     */
    record RoleContains(String role) implements PrincipalPredicate {
        public RoleContains {
            if (role == null || role.isBlank()) {
                throw new IllegalArgumentException("Role cannot be null or blank");
            }
        }

        @Override
        public boolean matches(Optional<Claims> claims) {
            return claims.map(c -> c.hasRole(role)).orElse(false);
        }
    }
}
