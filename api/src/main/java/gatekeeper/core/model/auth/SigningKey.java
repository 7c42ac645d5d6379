package gatekeeper.core.model.auth;

import java.security.PublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A public signing key published by the identity provider.
 *
 * @param keyId     the key identifier (kid) tokens refer to
 * @param algorithm the algorithm the provider declared for this key, if any
 * @param publicKey the verification key material
 * @param fetchedAt when the key was fetched, used for cache expiry
 */
public record SigningKey(String keyId, Optional<String> algorithm, PublicKey publicKey, Instant fetchedAt) {

    public SigningKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("Public key cannot be null");
        }
        if (algorithm == null) {
            algorithm = Optional.empty();
        }
        if (fetchedAt == null) {
            throw new IllegalArgumentException("Fetch timestamp cannot be null");
        }
    }

    /**
     * Check whether this key has outlived the cache TTL.
     *
     * @param now the current time
     * @param ttl how long a fetched key stays fresh
     * @return true if the key must be refetched before use
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(fetchedAt.plus(ttl));
    }

    public SigningKey withFetchedAt(Instant fetchedAt) {
        return new SigningKey(keyId, algorithm, publicKey, fetchedAt);
    }
}
