package gatekeeper.core.model.gateway;

import gatekeeper.core.model.audit.AuditDecision;

/**
 * States a request passes through in the gateway pipeline.
 *
 * <pre>
 * RECEIVED -> VERIFYING -> (UNAUTHENTICATED | VERIFIED) -> AUTHORIZING -> (DENIED | ROUTED | NO_ROUTE)
 *          -> FORWARDING -> (UPSTREAM_ERROR | COMPLETED | ABORTED)
 * </pre>
 */
public enum PipelineState {
    RECEIVED(false),
    VERIFYING(false),
    UNAUTHENTICATED(true),
    VERIFIED(false),
    AUTHORIZING(false),
    DENIED(true),
    ROUTED(false),
    NO_ROUTE(true),
    FORWARDING(false),
    UPSTREAM_ERROR(true),
    COMPLETED(true),
    ABORTED(true);

    private final boolean terminal;

    PipelineState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Audit decision recorded for a request that ended in this state.
     *
     * <p>Requests that got past policy evaluation were allowed, whatever happened afterwards.
     */
    public AuditDecision decision() {
        return switch (this) {
            case UNAUTHENTICATED, RECEIVED, VERIFYING -> AuditDecision.UNAUTHENTICATED;
            case DENIED, VERIFIED, AUTHORIZING -> AuditDecision.DENY;
            case ROUTED, NO_ROUTE, FORWARDING, UPSTREAM_ERROR, COMPLETED, ABORTED -> AuditDecision.ALLOW;
        };
    }
}
