package gatekeeper.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for bearer token verification.
 *
 * <p>Configuration prefix: {@code gatekeeper.auth}
 *
 * <h2>Example</h2>
 * <pre>
 * gatekeeper.auth.issuer=https://idp.example.com/realms/demo
 * gatekeeper.auth.jwks-uri=https://idp.example.com/realms/demo/protocol/openid-connect/certs
 * gatekeeper.auth.allowed-algorithms=RS256,ES256
 * gatekeeper.auth.clock-skew=PT30S
 * </pre>
 */
@ConfigMapping(prefix = "gatekeeper.auth")
public interface AuthConfig {

    /**
     * Expected value of the iss claim. Compared exactly.
     */
    String issuer();

    /**
     * URL of the identity provider's JSON Web Key Set.
     */
    String jwksUri();

    /**
     * Signature algorithms accepted in the token header.
     *
     * <p>{@code none} and HMAC algorithms are refused at startup.
     *
     * @return allowed algorithms (default: RS256)
     */
    @WithDefault("RS256")
    Set<String> allowedAlgorithms();

    /**
     * Tolerance applied to exp and nbf checks.
     *
     * @return clock skew (default: none)
     */
    @WithDefault("PT0S")
    Duration clockSkew();

    /**
     * Audiences accepted in the aud claim. When empty, aud is not checked.
     */
    Optional<Set<String>> audiences();

    /**
     * Claim holding the human-readable username used by identity rules.
     *
     * @return claim name (default: preferred_username)
     */
    @WithDefault("preferred_username")
    String usernameClaim();

    /**
     * Dotted claim paths holding role names. All listed paths are merged.
     *
     * @return role claim paths (default: realm_access.roles)
     */
    @WithName("roles-claim")
    @WithDefault("realm_access.roles")
    List<String> rolesClaims();

    /**
     * Signing key cache configuration.
     */
    JwksConfig jwks();

    /**
     * Signing key cache settings.
     */
    interface JwksConfig {

        /**
         * How long fetched keys are trusted before being refetched on next use.
         *
         * @return cache TTL (default: 5 minutes)
         */
        @WithDefault("PT300S")
        Duration cacheTtl();

        /**
         * Maximum time to wait for the key set endpoint.
         *
         * @return fetch timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration fetchTimeout();

        /**
         * Minimum time between fetches triggered by unknown key ids.
         *
         * <p>Stops tokens with made-up key ids from turning into a stream of fetches.
         *
         * @return minimum refresh interval (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration minRefreshInterval();
    }
}
