package gatekeeper.core.model.policy;

import java.util.Optional;

/**
 * Outcome of evaluating the rule set for one request.
 */
public sealed interface Decision {

    /**
     * Identifier of the rule that decided, if any rule matched.
     */
    Optional<String> ruleId();

    record Allow(String matchedRuleId) implements Decision {
        public Allow {
            if (matchedRuleId == null) {
                throw new IllegalArgumentException("An allow decision always names its rule");
            }
        }

        @Override
        public Optional<String> ruleId() {
            return Optional.of(matchedRuleId);
        }
    }

    /**
     * Denied by a matching deny rule, or by default when nothing matched.
     */
    record Deny(Optional<String> ruleId) implements Decision {
        public Deny {
            if (ruleId == null) {
                ruleId = Optional.empty();
            }
        }

        public static Deny byDefault() {
            return new Deny(Optional.empty());
        }

        public static Deny byRule(String ruleId) {
            return new Deny(Optional.of(ruleId));
        }
    }
}
