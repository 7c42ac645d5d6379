package gatekeeper.core.model.policy;

import java.util.HashSet;
import java.util.List;

/**
 * Immutable, ordered snapshot of the authorization rules.
 *
 * @param version identifies the policy document the rules came from
 * @param rules   rules in evaluation order
 */
public record RuleSet(String version, List<Rule> rules) {

    public static final RuleSet EMPTY = new RuleSet("empty", List.of());

    public RuleSet {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Version cannot be null or blank");
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        var ids = new HashSet<String>();
        for (var rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
    }

    public int size() {
        return rules.size();
    }
}
