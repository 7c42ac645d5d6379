package gatekeeper.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import gatekeeper.core.port.out.PolicyRepository.PolicyLoadException;
import gatekeeper.core.service.auth.TokenVerifier;
import gatekeeper.core.service.policy.PolicyService;

/**
 * Validates token settings and installs the policy on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If the allowed algorithms include none or an HMAC algorithm: startup FAILS</li>
 *   <li>If the policy document is missing, unparseable or has no rules or routes: startup FAILS</li>
 * </ul>
 *
 * <p>The gateway never serves traffic without a policy: an empty rule set would deny
 * everything, and an empty routing table would answer 404 for everything.
 */
@ApplicationScoped
public class GatewayInitializer {

    private static final Logger LOG = Logger.getLogger(GatewayInitializer.class);

    private final TokenVerifier tokenVerifier;
    private final PolicyService policyService;

    @Inject
    public GatewayInitializer(TokenVerifier tokenVerifier, PolicyService policyService) {
        this.tokenVerifier = tokenVerifier;
        this.policyService = policyService;
    }

    void onStart(@Observes StartupEvent event) {
        try {
            LOG.infov("Accepting token algorithms {0}", tokenVerifier.allowedAlgorithms());
        } catch (RuntimeException e) {
            // The verifier is created lazily, so a rejected configuration may arrive wrapped
            var cause = e;
            while (!(cause instanceof IllegalStateException) && cause.getCause() instanceof RuntimeException next) {
                cause = next;
            }
            LOG.error("========================================");
            LOG.errorf("STARTUP FAILED: %s", cause.getMessage());
            LOG.error("========================================");
            throw e;
        }

        try {
            var policy = policyService.initialize();
            LOG.infof(
                    "Gateway ready: policy %s with %d rules and %d routes",
                    policy.version(), policy.rules().size(), policy.routes().size());
        } catch (PolicyLoadException e) {
            LOG.error("========================================");
            LOG.errorf("STARTUP FAILED: %s", e.getMessage());
            LOG.error("========================================");
            throw e;
        }
    }
}
