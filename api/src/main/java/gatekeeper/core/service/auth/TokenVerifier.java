package gatekeeper.core.service.auth;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.lang.JoseException;

import gatekeeper.core.config.AuthConfig;
import gatekeeper.core.model.auth.Claims;
import gatekeeper.core.model.auth.SigningKey;
import gatekeeper.core.model.auth.TokenVerificationResult;
import gatekeeper.core.model.auth.TokenVerificationResult.Rejected;
import gatekeeper.core.model.auth.TokenVerificationResult.Verified;
import gatekeeper.core.model.auth.VerificationError;
import gatekeeper.core.port.out.SigningKeyResolver;

/**
 * Verifies compact-serialized JWS bearer tokens against the identity provider's keys.
 *
 * <p>Checks, in order:
 * <ul>
 *   <li>three non-empty segments and a parseable header</li>
 *   <li>header algorithm is on the allow-list and a key id is present</li>
 *   <li>the key id resolves to a published key whose algorithm agrees with the header</li>
 *   <li>the signature verifies</li>
 *   <li>iss, exp, nbf and (if configured) aud</li>
 *   <li>sub and the username claim are present</li>
 * </ul>
 *
 * <p>Claims are only read after the signature has verified. Rejections never
 * carry token material.
 */
@ApplicationScoped
public class TokenVerifier {

    private static final Logger LOG = Logger.getLogger(TokenVerifier.class);

    private final SigningKeyResolver keyResolver;
    private final Set<String> allowedAlgorithms;
    private final AlgorithmConstraints algorithmConstraints;
    private final Duration clockSkew;
    private final Set<String> audiences;
    private final String usernameClaim;
    private final List<List<String>> rolesClaimPaths;

    @Inject
    public TokenVerifier(SigningKeyResolver keyResolver, AuthConfig config) {
        this.keyResolver = keyResolver;
        this.allowedAlgorithms = checkAlgorithms(config.allowedAlgorithms());
        this.algorithmConstraints =
                new AlgorithmConstraints(ConstraintType.PERMIT, allowedAlgorithms.toArray(new String[0]));
        this.clockSkew = config.clockSkew();
        this.audiences = config.audiences().map(Set::copyOf).orElse(Set.of());
        this.usernameClaim = config.usernameClaim();
        this.rolesClaimPaths = config.rolesClaims().stream()
                .map(String::trim)
                .filter(path -> !path.isEmpty())
                .map(path -> List.of(path.split("\\.")))
                .toList();
    }

    /**
     * Refuse configurations that would accept unsigned or shared-secret tokens.
     *
     * @throws IllegalStateException if the allow-list is empty or names none or an HMAC algorithm
     */
    static Set<String> checkAlgorithms(Collection<String> configured) {
        var algorithms = new LinkedHashSet<String>();
        for (var algorithm : configured) {
            var trimmed = algorithm.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equalsIgnoreCase("none") || trimmed.toUpperCase(Locale.ROOT).startsWith("HS")) {
                throw new IllegalStateException("Algorithm '" + trimmed
                        + "' cannot be allowed: only asymmetric signature algorithms are accepted");
            }
            algorithms.add(trimmed);
        }
        if (algorithms.isEmpty()) {
            throw new IllegalStateException("At least one signature algorithm must be allowed");
        }
        return Set.copyOf(algorithms);
    }

    public Set<String> allowedAlgorithms() {
        return allowedAlgorithms;
    }

    /**
     * Verify a raw bearer token.
     *
     * @param rawToken       the token without the "Bearer " prefix, or null when the request had none
     * @param expectedIssuer the issuer tokens must carry
     * @param now            the verification time
     * @return the verified claims, or the reason for rejection. Never fails.
     */
    public Uni<TokenVerificationResult> verify(String rawToken, String expectedIssuer, Instant now) {
        if (rawToken == null || rawToken.isBlank()) {
            return reject(VerificationError.MISSING, "No bearer token presented");
        }

        var segments = rawToken.split("\\.", -1);
        if (segments.length != 3 || Arrays.stream(segments).anyMatch(String::isEmpty)) {
            return reject(VerificationError.MALFORMED, "Token must have three non-empty segments");
        }

        var jws = new JsonWebSignature();
        try {
            jws.setCompactSerialization(rawToken);
        } catch (JoseException e) {
            return reject(VerificationError.MALFORMED, "Token header cannot be parsed");
        }

        var algorithm = jws.getAlgorithmHeaderValue();
        if (algorithm == null || !allowedAlgorithms.contains(algorithm)) {
            return reject(VerificationError.UNSUPPORTED_ALGORITHM, "Algorithm not allowed: " + algorithm);
        }

        var keyId = jws.getKeyIdHeaderValue();
        if (keyId == null || keyId.isBlank()) {
            return reject(VerificationError.MALFORMED, "Token header has no key id");
        }

        return keyResolver.resolve(keyId).onItemOrFailure().transform((key, error) -> {
            if (error != null) {
                LOG.warnv("Signing key resolution failed: {0}", error.getMessage());
                return new Rejected(VerificationError.KEY_UNAVAILABLE);
            }
            if (key.isEmpty()) {
                LOG.debugv("No signing key available for key id {0}", keyId);
                return new Rejected(VerificationError.KEY_UNAVAILABLE);
            }
            return verifyWithKey(jws, algorithm, key.get(), expectedIssuer, now);
        });
    }

    private TokenVerificationResult verifyWithKey(
            JsonWebSignature jws, String algorithm, SigningKey key, String expectedIssuer, Instant now) {
        if (key.algorithm().isPresent() && !key.algorithm().get().equals(algorithm)) {
            return rejected(VerificationError.SIGNATURE_INVALID, "Token algorithm does not match signing key");
        }

        final JwtClaims claims;
        try {
            jws.setAlgorithmConstraints(algorithmConstraints);
            jws.setKey(key.publicKey());
            if (!jws.verifySignature()) {
                return rejected(VerificationError.SIGNATURE_INVALID, "Signature does not verify");
            }
            claims = JwtClaims.parse(jws.getPayload());
        } catch (JoseException e) {
            return rejected(VerificationError.SIGNATURE_INVALID, "Signature cannot be verified with key " + key.keyId());
        } catch (InvalidJwtException e) {
            return rejected(VerificationError.MALFORMED, "Token payload is not a JSON claims set");
        }

        try {
            return checkClaims(claims, expectedIssuer, now);
        } catch (MalformedClaimException e) {
            return rejected(VerificationError.MALFORMED, "Malformed claim: " + e.getMessage());
        } catch (DateTimeException | ArithmeticException e) {
            return rejected(VerificationError.MALFORMED, "Time claim out of range: " + e.getMessage());
        }
    }

    private TokenVerificationResult checkClaims(JwtClaims claims, String expectedIssuer, Instant now)
            throws MalformedClaimException {
        var issuer = claims.getIssuer();
        if (issuer == null || !issuer.equals(expectedIssuer)) {
            return rejected(VerificationError.ISSUER_MISMATCH, "Unexpected issuer: " + issuer);
        }

        var expiration = toInstant(claims.getExpirationTime());
        if (expiration.isEmpty()) {
            return rejected(VerificationError.MALFORMED, "Token has no exp claim");
        }
        if (!now.isBefore(expiration.get().plus(clockSkew))) {
            return rejected(VerificationError.EXPIRED, "Token expired at " + expiration.get());
        }

        var notBefore = toInstant(claims.getNotBefore());
        if (notBefore.isPresent() && now.isBefore(notBefore.get().minus(clockSkew))) {
            return rejected(VerificationError.NOT_YET_VALID, "Token not valid before " + notBefore.get());
        }

        var tokenAudiences = claims.hasAudience() ? Set.copyOf(claims.getAudience()) : Set.<String>of();
        if (!audiences.isEmpty() && tokenAudiences.stream().noneMatch(audiences::contains)) {
            return rejected(VerificationError.AUDIENCE_MISMATCH, "Token audience not accepted");
        }

        var subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return rejected(VerificationError.MALFORMED, "Token has no sub claim");
        }

        var username = claims.getStringClaimValue(usernameClaim);
        if (username == null || username.isBlank()) {
            return rejected(VerificationError.MALFORMED, "Token has no " + usernameClaim + " claim");
        }

        var attributes = new LinkedHashMap<String, Object>();
        claims.getClaimsMap().forEach((name, value) -> {
            if (value != null) {
                attributes.put(name, value);
            }
        });

        return new Verified(new Claims(
                issuer,
                subject,
                username,
                extractRoles(claims.getClaimsMap()),
                expiration.get(),
                notBefore,
                toInstant(claims.getIssuedAt()),
                tokenAudiences,
                attributes));
    }

    /**
     * Collect role names from every configured claim path.
     *
     * <p>A path such as {@code realm_access.roles} walks nested objects. The value at
     * the end may be an array of strings or a comma or space separated string.
     */
    Set<String> extractRoles(Map<String, Object> claims) {
        var roles = new LinkedHashSet<String>();
        for (var path : rolesClaimPaths) {
            Object current = claims;
            for (var segment : path) {
                current = current instanceof Map<?, ?> map ? map.get(segment) : null;
            }
            if (current instanceof Collection<?> values) {
                values.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .filter(role -> !role.isBlank())
                        .forEach(roles::add);
            } else if (current instanceof String value) {
                Arrays.stream(value.split("[,\\s]+"))
                        .filter(role -> !role.isBlank())
                        .forEach(roles::add);
            }
        }
        return roles;
    }

    private static Optional<Instant> toInstant(NumericDate date) {
        return date == null ? Optional.empty() : Optional.of(Instant.ofEpochSecond(date.getValue()));
    }

    private static Uni<TokenVerificationResult> reject(VerificationError error, String detail) {
        return Uni.createFrom().item(rejected(error, detail));
    }

    private static TokenVerificationResult rejected(VerificationError error, String detail) {
        LOG.debugv("Token rejected: {0} ({1})", error, detail);
        return new Rejected(error, detail);
    }
}
