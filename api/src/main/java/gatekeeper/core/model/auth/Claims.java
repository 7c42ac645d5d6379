package gatekeeper.core.model.auth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Verified claims extracted from a bearer token.
 *
 * <p>Instances are request-scoped and immutable. They are created by the token
 * verifier only after the token signature has been verified, and are passed by
 * value through the rest of the pipeline.
 *
 * @param issuer     the token issuer (iss claim)
 * @param subject    opaque unique identity (sub claim)
 * @param username   human-readable identity used for policy matching
 * @param roles      advisory role names; never grant identity-scoped access on their own
 * @param expiresAt  when the token expires (exp claim)
 * @param notBefore  optional start of validity (nbf claim)
 * @param issuedAt   optional issue time (iat claim)
 * @param audiences  audiences the token was issued for (aud claim)
 * @param attributes every claim of the verified payload, for forwarding to backends
 */
public record Claims(
        String issuer,
        String subject,
        String username,
        Set<String> roles,
        Instant expiresAt,
        Optional<Instant> notBefore,
        Optional<Instant> issuedAt,
        Set<String> audiences,
        Map<String, Object> attributes) {

    public Claims {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiration cannot be null");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        notBefore = notBefore == null ? Optional.empty() : notBefore;
        issuedAt = issuedAt == null ? Optional.empty() : issuedAt;
        audiences = audiences == null ? Set.of() : Set.copyOf(audiences);
        attributes = attributes == null ? Map.of() : immutableMap(attributes);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /**
     * Copy a parsed JSON object so that no nested object or array stays writable.
     */
    private static Map<String, Object> immutableMap(Map<?, ?> source) {
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((name, value) -> copy.put(String.valueOf(name), immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof Collection<?> values) {
            var copy = new ArrayList<Object>(values.size());
            values.forEach(element -> copy.add(immutableValue(element)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
