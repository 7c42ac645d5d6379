package gatekeeper.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the policy document.
 *
 * <p>Configuration prefix: {@code gatekeeper.policy}
 */
@ConfigMapping(prefix = "gatekeeper.policy")
public interface PolicyConfig {

    /**
     * Where to load rules and routes from. Either {@code classpath:<resource>} or a file path.
     *
     * @return policy location (default: classpath:gateway-policy.json)
     */
    @WithDefault("classpath:gateway-policy.json")
    String location();

    /**
     * How often the policy document is reloaded. {@code off} disables reloading.
     *
     * @return reload interval (default: 30s)
     */
    @WithDefault("30s")
    String reloadInterval();
}
