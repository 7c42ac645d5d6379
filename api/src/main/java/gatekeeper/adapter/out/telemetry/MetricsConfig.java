package gatekeeper.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for gateway metrics.
 *
 * <p>Configuration prefix: {@code gatekeeper.metrics}
 *
 * <h2>Example</h2>
 * <pre>
 * gatekeeper.metrics.enabled=false
 * </pre>
 */
@ConfigMapping(prefix = "gatekeeper.metrics")
public interface MetricsConfig {

    /**
     * Whether gateway metrics are recorded.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
