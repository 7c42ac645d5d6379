package gatekeeper.core.model.gateway;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import gatekeeper.core.model.auth.VerificationError;

/**
 * Terminal outcome of the gateway pipeline for one request.
 */
public sealed interface GatewayResult {

    /**
     * HTTP status returned to the caller.
     */
    int statusCode();

    /**
     * Backend was called and answered.
     */
    record Success(int statusCode, Map<String, List<String>> headers, byte[] body) implements GatewayResult {
        public Success {
            if (headers == null) {
                headers = Map.of();
            }
            if (body == null) {
                body = new byte[0];
            }
        }
    }

    /**
     * Token missing or failed verification. Synthesized locally.
     */
    record Unauthenticated(VerificationError error) implements GatewayResult {
        public Unauthenticated {
            if (error == null) {
                throw new IllegalArgumentException("Error cannot be null");
            }
        }

        public String reason() {
            return error.description();
        }

        @Override
        public int statusCode() {
            return 401;
        }
    }

    /**
     * Verified identity denied by policy. Synthesized locally.
     */
    record Forbidden(Optional<String> ruleId) implements GatewayResult {
        public Forbidden {
            if (ruleId == null) {
                ruleId = Optional.empty();
            }
        }

        public String reason() {
            return ruleId.map(id -> "Access denied by rule '%s'".formatted(id))
                    .orElse("Access denied: no rule grants access");
        }

        @Override
        public int statusCode() {
            return 403;
        }
    }

    /**
     * Allowed, but no backend serves the path. A configuration defect.
     */
    record RouteNotFound(String path) implements GatewayResult {
        @Override
        public int statusCode() {
            return 404;
        }
    }

    /**
     * Backend unreachable, failed, or did not answer in time.
     */
    record UpstreamError(String message, boolean timedOut) implements GatewayResult {
        @Override
        public int statusCode() {
            return timedOut ? 504 : 502;
        }
    }
}
