package gatekeeper.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gatekeeper.core.model.auth.SigningKey;

/**
 * Resolves a key id from a token header to a verification key.
 */
public interface SigningKeyResolver {

    /**
     * Resolve a signing key by id.
     *
     * @param keyId the kid header value
     * @return the key, or empty if the provider does not publish it or could not be reached. Never fails.
     */
    Uni<Optional<SigningKey>> resolve(String keyId);
}
