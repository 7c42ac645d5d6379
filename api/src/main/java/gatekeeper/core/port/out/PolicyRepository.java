package gatekeeper.core.port.out;

import gatekeeper.core.model.policy.GatewayPolicy;

/**
 * Source of the policy document holding rules and routes.
 */
public interface PolicyRepository {

    /**
     * Load and validate the current policy document.
     *
     * @return the parsed policy
     * @throws PolicyLoadException if the document is missing or invalid
     */
    GatewayPolicy load();

    /**
     * Where the policy is loaded from, for log messages.
     */
    String location();

    /**
     * Raised when a policy document cannot be read or fails validation.
     */
    class PolicyLoadException extends RuntimeException {

        public PolicyLoadException(String message) {
            super(message);
        }

        public PolicyLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
