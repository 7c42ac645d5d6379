package gatekeeper.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for backend calls.
 *
 * <p>Configuration prefix: {@code gatekeeper.upstream}
 */
@ConfigMapping(prefix = "gatekeeper.upstream")
public interface UpstreamConfig {

    /**
     * Maximum time to wait for a backend response.
     *
     * <p>If exceeded, returns 504 Gateway Timeout.
     *
     * @return request timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration requestTimeout();

    /**
     * Maximum time to establish a TCP connection to a backend.
     *
     * @return connect timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration connectTimeout();

    /**
     * Maximum pooled connections per backend host.
     *
     * @return max connections per host (default: 50)
     */
    @WithDefault("50")
    int maxConnectionsPerHost();

    /**
     * Additional attempts for idempotent requests that failed without a backend response.
     *
     * @return max retries (default: 1)
     */
    @WithDefault("1")
    int maxRetries();
}
