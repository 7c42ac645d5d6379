package gatekeeper.core.model.policy;

import gatekeeper.core.model.routing.RouteTable;

/**
 * A loaded policy document: authorization rules and the routing table that ship together.
 */
public record GatewayPolicy(RuleSet rules, RouteTable routes) {

    public GatewayPolicy {
        if (rules == null || rules.size() == 0) {
            throw new IllegalArgumentException("Policy must contain at least one rule");
        }
        if (routes == null || routes.size() == 0) {
            throw new IllegalArgumentException("Policy must contain at least one route");
        }
    }

    public String version() {
        return rules.version();
    }
}
