package gatekeeper.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import gatekeeper.core.model.auth.SigningKey;

/**
 * Fetches the identity provider's published signing keys.
 */
public interface JwksClient {

    /**
     * Fetch the current key set.
     *
     * <p>Keys that cannot be used for signature verification are left out.
     *
     * @return the published keys; fails if the endpoint is unreachable or returns an unusable document
     */
    Uni<List<SigningKey>> fetchKeys();
}
