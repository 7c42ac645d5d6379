package gatekeeper.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the identity headers sent to backends.
 *
 * <p>Configuration prefix: {@code gatekeeper.forwarding}
 */
@ConfigMapping(prefix = "gatekeeper.forwarding")
public interface ForwardingConfig {

    @WithDefault("X-Forwarded-User")
    String userHeader();

    @WithDefault("X-Forwarded-Roles")
    String rolesHeader();

    /**
     * Header carrying the verified claims as base64url-encoded JSON.
     */
    @WithDefault("X-Jwt-Payload")
    String claimsHeader();

    /**
     * Whether the caller's Authorization header is passed on to the backend.
     *
     * @return true to forward the bearer token (default: false)
     */
    @WithDefault("false")
    boolean forwardToken();
}
