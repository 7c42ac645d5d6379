package gatekeeper.core.service.policy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import gatekeeper.core.model.policy.GatewayPolicy;
import gatekeeper.core.port.out.Metrics;
import gatekeeper.core.port.out.PolicyRepository;
import gatekeeper.core.port.out.PolicyRepository.PolicyLoadException;
import gatekeeper.core.service.routing.Router;

/**
 * Loads the policy document and installs its rules and routes.
 */
@ApplicationScoped
public class PolicyService {

    private static final Logger LOG = Logger.getLogger(PolicyService.class);

    private final PolicyRepository repository;
    private final PolicyEngine policyEngine;
    private final Router router;
    private final Metrics metrics;

    private volatile String installedVersion;

    @Inject
    public PolicyService(PolicyRepository repository, PolicyEngine policyEngine, Router router, Metrics metrics) {
        this.repository = repository;
        this.policyEngine = policyEngine;
        this.router = router;
        this.metrics = metrics;
    }

    /**
     * Load the policy for the first time.
     *
     * @throws PolicyLoadException if the policy is missing or invalid; the gateway must not serve traffic
     */
    public GatewayPolicy initialize() {
        LOG.infov("Loading policy from {0}", repository.location());
        try {
            var policy = repository.load();
            install(policy);
            metrics.recordPolicyReload(true);
            return policy;
        } catch (RuntimeException e) {
            metrics.recordPolicyReload(false);
            throw e instanceof PolicyLoadException ple
                    ? ple
                    : new PolicyLoadException("Invalid policy at " + repository.location() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reload the policy if it changed. A document that fails to load leaves the current policy in place.
     *
     * @return true if a new policy was installed
     */
    public boolean reload() {
        final GatewayPolicy policy;
        try {
            policy = repository.load();
        } catch (RuntimeException e) {
            LOG.errorv("Policy reload from {0} failed, keeping version {1}: {2}",
                    repository.location(), installedVersion, e.getMessage());
            metrics.recordPolicyReload(false);
            return false;
        }
        if (policy.version().equals(installedVersion)) {
            LOG.debugv("Policy version {0} unchanged", installedVersion);
            return false;
        }
        install(policy);
        metrics.recordPolicyReload(true);
        return true;
    }

    public String installedVersion() {
        return installedVersion;
    }

    private void install(GatewayPolicy policy) {
        policyEngine.reload(policy.rules());
        router.reload(policy.routes());
        installedVersion = policy.version();
        LOG.infov("Policy version {0} installed: {1} rules, {2} routes",
                policy.version(), policy.rules().size(), policy.routes().size());
    }
}
