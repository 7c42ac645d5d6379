package gatekeeper.core.model.auth;

/**
 * Reasons a bearer token can fail verification.
 *
 * <p>Every value maps to an unauthenticated (401) outcome.
 */
public enum VerificationError {
    MISSING("Authentication required"),
    MALFORMED("Malformed token"),
    UNSUPPORTED_ALGORITHM("Unsupported token algorithm"),
    SIGNATURE_INVALID("Invalid token signature"),
    EXPIRED("Token has expired"),
    NOT_YET_VALID("Token is not yet valid"),
    ISSUER_MISMATCH("Invalid token issuer"),
    AUDIENCE_MISMATCH("Invalid token audience"),
    KEY_UNAVAILABLE("Signing key unavailable");

    private final String description;

    VerificationError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
