package gatekeeper.core.model.policy;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import gatekeeper.core.model.auth.Claims;

/**
 * An ordered authorization rule.
 *
 * @param id        identifier reported in decisions and audit records
 * @param path      path predicate
 * @param methods   upper-case HTTP methods this rule applies to; empty means any method
 * @param principal identity predicate
 * @param effect    decision when the rule fully matches
 */
public record Rule(String id, PathPredicate path, Set<String> methods, PrincipalPredicate principal, Effect effect) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule ID cannot be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("Rule path cannot be null");
        }
        if (principal == null) {
            throw new IllegalArgumentException("Rule principal cannot be null");
        }
        methods = methods == null
                ? Set.of()
                : methods.stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        if (effect == null) {
            effect = Effect.ALLOW;
        }
    }

    /**
     * Test the path and method part of the rule.
     */
    public boolean matchesRequest(String method, String normalizedPath) {
        if (!methods.isEmpty() && (method == null || !methods.contains(method.toUpperCase(Locale.ROOT)))) {
            return false;
        }
        return path.matches(normalizedPath);
    }

    /**
     * Test the identity part of the rule.
     */
    public boolean matchesPrincipal(Optional<Claims> claims) {
        return principal.matches(claims);
    }
}
