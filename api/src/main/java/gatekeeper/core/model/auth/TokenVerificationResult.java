package gatekeeper.core.model.auth;

/**
 * Result of verifying an incoming bearer token.
 */
public sealed interface TokenVerificationResult {

    /**
     * Token signature and claims were verified.
     *
     * @param claims the verified claims
     */
    record Verified(Claims claims) implements TokenVerificationResult {
        public Verified {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }
    }

    /**
     * Token was rejected. No claims are exposed.
     *
     * @param error  the verification failure
     * @param detail short diagnostic message, never containing token material
     */
    record Rejected(VerificationError error, String detail) implements TokenVerificationResult {
        public Rejected {
            if (error == null) {
                throw new IllegalArgumentException("Error cannot be null");
            }
            if (detail == null || detail.isBlank()) {
                detail = error.description();
            }
        }

        public Rejected(VerificationError error) {
            this(error, error.description());
        }
    }
}
