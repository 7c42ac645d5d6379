package gatekeeper.core.service.policy;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import gatekeeper.core.model.auth.Claims;
import gatekeeper.core.model.policy.Decision;
import gatekeeper.core.model.policy.Effect;
import gatekeeper.core.model.policy.RuleSet;
import gatekeeper.core.util.RequestPaths;

/**
 * Decides whether a request may proceed.
 *
 * <p>Rules are evaluated in order and the first rule whose path, method and
 * principal all match decides. When no rule matches the request is denied.
 * Requests without verified claims match no rule.
 */
@ApplicationScoped
public class PolicyEngine {

    private static final Logger LOG = Logger.getLogger(PolicyEngine.class);

    private final AtomicReference<RuleSet> ruleSet = new AtomicReference<>(RuleSet.EMPTY);

    public Decision decide(String method, String path, Optional<Claims> claims) {
        var normalized = RequestPaths.normalize(path);
        for (var rule : ruleSet.get().rules()) {
            if (rule.matchesRequest(method, normalized) && rule.matchesPrincipal(claims)) {
                LOG.debugv("Rule {0} matched {1} {2}", rule.id(), method, normalized);
                return rule.effect() == Effect.ALLOW ? new Decision.Allow(rule.id()) : Decision.Deny.byRule(rule.id());
            }
        }
        LOG.debugv("No rule matched {0} {1}, denying", method, normalized);
        return Decision.Deny.byDefault();
    }

    /**
     * Atomically replace the rule set. In-flight decisions finish against the set they started with.
     *
     * @throws IllegalArgumentException if the rule set is empty
     */
    public void reload(RuleSet rules) {
        if (rules == null || rules.size() == 0) {
            throw new IllegalArgumentException("Refusing to install an empty rule set");
        }
        var previous = ruleSet.getAndSet(rules);
        LOG.infov("Installed {0} rules (version {1}, previously {2})", rules.size(), rules.version(), previous.version());
    }

    public RuleSet currentRules() {
        return ruleSet.get();
    }
}
