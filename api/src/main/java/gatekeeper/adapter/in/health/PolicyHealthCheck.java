package gatekeeper.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import gatekeeper.core.service.auth.KeyResolverService;
import gatekeeper.core.service.policy.PolicyEngine;
import gatekeeper.core.service.policy.PolicyService;
import gatekeeper.core.service.routing.Router;

/**
 * Readiness check for the installed policy.
 *
 * <p>DOWN until a policy has been installed. Signing keys are reported but do not
 * affect readiness: they are fetched on the first request that needs them.
 */
@Readiness
@ApplicationScoped
public class PolicyHealthCheck implements HealthCheck {

    private final PolicyService policyService;
    private final PolicyEngine policyEngine;
    private final Router router;
    private final KeyResolverService keyResolver;

    @Inject
    public PolicyHealthCheck(
            PolicyService policyService, PolicyEngine policyEngine, Router router, KeyResolverService keyResolver) {
        this.policyService = policyService;
        this.policyEngine = policyEngine;
        this.router = router;
        this.keyResolver = keyResolver;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("policy");
        var version = policyService.installedVersion();
        if (version == null) {
            return builder.down().withData("reason", "No policy installed").build();
        }
        builder.withData("policy.version", version);
        builder.withData("policy.rules", policyEngine.currentRules().size());
        builder.withData("policy.routes", router.currentRoutes().size());
        builder.withData("signing.keys.cached", keyResolver.cachedKeyIds().size());
        return builder.up().build();
    }
}
