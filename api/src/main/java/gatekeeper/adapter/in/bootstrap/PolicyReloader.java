package gatekeeper.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;

import gatekeeper.core.service.policy.PolicyService;

/**
 * Periodically reloads the policy document.
 *
 * <p>Set {@code gatekeeper.policy.reload-interval=off} to disable.
 */
@ApplicationScoped
public class PolicyReloader {

    private final PolicyService policyService;

    @Inject
    public PolicyReloader(PolicyService policyService) {
        this.policyService = policyService;
    }

    @Scheduled(
            every = "${gatekeeper.policy.reload-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void reload() {
        policyService.reload();
    }
}
