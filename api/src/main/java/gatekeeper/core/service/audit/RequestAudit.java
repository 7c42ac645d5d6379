package gatekeeper.core.service.audit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import gatekeeper.core.model.audit.AccessRecord;
import gatekeeper.core.model.audit.AuditDecision;
import gatekeeper.core.model.auth.Claims;
import gatekeeper.core.model.gateway.GatewayResult;
import gatekeeper.core.model.gateway.PipelineState;
import gatekeeper.core.model.policy.Decision;
import gatekeeper.core.model.routing.RouteMatch;

/**
 * Accumulates what happened to one request and emits its access record once.
 *
 * <p>The first of {@link #complete}, {@link #abort} or {@link #fail} writes the
 * record; later calls are ignored.
 */
public final class RequestAudit {

    private static final Logger LOG = Logger.getLogger(RequestAudit.class);

    /** Non-standard status for requests the client abandoned. */
    public static final int CLIENT_CLOSED_REQUEST = 499;

    private final AuditLogger logger;
    private final Clock clock;
    private final String method;
    private final String path;
    private final String requestId;
    private final Instant receivedAt;
    private final AtomicBoolean emitted = new AtomicBoolean();

    private volatile PipelineState state = PipelineState.RECEIVED;
    private volatile Claims claims;
    private volatile Decision decision;
    private volatile RouteMatch route;

    RequestAudit(AuditLogger logger, Clock clock, String method, String path, String requestId) {
        this.logger = logger;
        this.clock = clock;
        this.method = method;
        this.path = path;
        this.requestId = requestId;
        this.receivedAt = clock.instant();
    }

    public String requestId() {
        return requestId;
    }

    public PipelineState state() {
        return state;
    }

    public void verifying() {
        transition(PipelineState.VERIFYING);
    }

    public void verified(Claims claims) {
        this.claims = claims;
        transition(PipelineState.VERIFIED);
    }

    public void authorizing() {
        transition(PipelineState.AUTHORIZING);
    }

    public void decided(Decision decision) {
        this.decision = decision;
    }

    public void routed(RouteMatch route) {
        this.route = route;
        transition(PipelineState.ROUTED);
    }

    public void forwarding() {
        transition(PipelineState.FORWARDING);
    }

    /**
     * Record the terminal result.
     */
    public void complete(GatewayResult result) {
        if (result instanceof GatewayResult.Success) {
            emit(PipelineState.COMPLETED, result.statusCode(), null);
        } else if (result instanceof GatewayResult.Unauthenticated unauthenticated) {
            emit(PipelineState.UNAUTHENTICATED, result.statusCode(), unauthenticated.reason());
        } else if (result instanceof GatewayResult.Forbidden forbidden) {
            emit(PipelineState.DENIED, result.statusCode(), forbidden.reason());
        } else if (result instanceof GatewayResult.RouteNotFound) {
            emit(PipelineState.NO_ROUTE, result.statusCode(), "No route for path");
        } else if (result instanceof GatewayResult.UpstreamError upstreamError) {
            emit(PipelineState.UPSTREAM_ERROR, result.statusCode(), upstreamError.message());
        }
    }

    /**
     * Record that the client went away before a result was produced.
     */
    public void abort() {
        emit(PipelineState.ABORTED, CLIENT_CLOSED_REQUEST, "Client closed request");
    }

    /**
     * Record an unexpected failure, attributing it to the last stage the request reached.
     */
    public void fail(Throwable error) {
        var terminal =
                switch (decisionSoFar()) {
                    case UNAUTHENTICATED -> PipelineState.UNAUTHENTICATED;
                    case DENY -> PipelineState.DENIED;
                    case ALLOW -> PipelineState.UPSTREAM_ERROR;
                };
        emit(terminal, 500, "Internal error: " + error.getClass().getSimpleName());
    }

    /**
     * Decision implied by how far the request got. Anything short of an allow rule counts against it.
     */
    private AuditDecision decisionSoFar() {
        if (claims == null) {
            return AuditDecision.UNAUTHENTICATED;
        }
        return decision instanceof Decision.Allow ? AuditDecision.ALLOW : AuditDecision.DENY;
    }

    private void transition(PipelineState next) {
        LOG.tracev("Request {0}: {1} -> {2}", requestId, state, next);
        state = next;
    }

    private void emit(PipelineState terminal, int status, String reason) {
        if (!emitted.compareAndSet(false, true)) {
            LOG.debugv("Access record for request {0} already written, ignoring {1}", requestId, terminal);
            return;
        }
        transition(terminal);
        var verified = claims;
        var ruleId = decision == null ? null : decision.ruleId().orElse(null);
        var auditDecision = terminal == PipelineState.ABORTED ? decisionSoFar() : terminal.decision();
        var backend = route == null || auditDecision != AuditDecision.ALLOW ? null : route.route().id();
        logger.record(new AccessRecord(
                receivedAt,
                requestId,
                method,
                path,
                status,
                auditDecision,
                ruleId,
                verified == null ? null : verified.subject(),
                verified == null ? null : verified.username(),
                verified == null ? Set.of() : verified.roles(),
                reason,
                terminal,
                backend,
                Duration.between(receivedAt, clock.instant()).toMillis()));
    }
}
