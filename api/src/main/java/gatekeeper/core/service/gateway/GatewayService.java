package gatekeeper.core.service.gateway;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatekeeper.core.config.AuthConfig;
import gatekeeper.core.config.UpstreamConfig;
import gatekeeper.core.model.auth.Claims;
import gatekeeper.core.model.auth.TokenVerificationResult;
import gatekeeper.core.model.gateway.GatewayRequest;
import gatekeeper.core.model.gateway.GatewayResult;
import gatekeeper.core.model.policy.Decision;
import gatekeeper.core.model.routing.RouteMatch;
import gatekeeper.core.port.in.GatewayUseCase;
import gatekeeper.core.port.out.Metrics;
import gatekeeper.core.port.out.ProxyClient;
import gatekeeper.core.service.audit.AuditLogger;
import gatekeeper.core.service.audit.RequestAudit;
import gatekeeper.core.service.auth.TokenVerifier;
import gatekeeper.core.service.policy.PolicyEngine;
import gatekeeper.core.service.routing.Router;

/**
 * Authenticate, authorize, route and forward requests.
 *
 * <p>Each request moves through verification, policy evaluation and routing
 * before anything is sent to a backend:
 * <ul>
 *   <li>no verified token: 401, the policy engine is never consulted</li>
 *   <li>denied by policy: 403, no backend is contacted</li>
 *   <li>allowed but unrouted: 404</li>
 *   <li>backend unreachable or too slow: 502 or 504</li>
 * </ul>
 *
 * <p>Every request produces exactly one access record, including requests
 * that are cancelled or fail unexpectedly.
 *
 * <p>All operations are fully reactive and never block.
 */
@ApplicationScoped
public class GatewayService implements GatewayUseCase {

    private static final Logger LOG = Logger.getLogger(GatewayService.class);

    private static final Set<String> IDEMPOTENT_METHODS = Set.of("GET", "HEAD", "OPTIONS", "PUT", "DELETE", "TRACE");
    private static final String BEARER_PREFIX = "bearer ";

    private final TokenVerifier tokenVerifier;
    private final PolicyEngine policyEngine;
    private final Router router;
    private final ProxyRequestPreparer requestPreparer;
    private final ProxyClient proxyClient;
    private final AuditLogger auditLogger;
    private final Metrics metrics;
    private final AuthConfig authConfig;
    private final UpstreamConfig upstreamConfig;
    private final Clock clock;

    @Inject
    public GatewayService(
            TokenVerifier tokenVerifier,
            PolicyEngine policyEngine,
            Router router,
            ProxyRequestPreparer requestPreparer,
            ProxyClient proxyClient,
            AuditLogger auditLogger,
            Metrics metrics,
            AuthConfig authConfig,
            UpstreamConfig upstreamConfig,
            Clock clock) {
        this.tokenVerifier = tokenVerifier;
        this.policyEngine = policyEngine;
        this.router = router;
        this.requestPreparer = requestPreparer;
        this.proxyClient = proxyClient;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.authConfig = authConfig;
        this.upstreamConfig = upstreamConfig;
        this.clock = clock;
    }

    @Override
    public Uni<GatewayResult> forward(GatewayRequest request) {
        var audit = auditLogger.begin(request, requestId(request));

        return Uni.createFrom()
                .deferred(() -> {
                    audit.verifying();
                    return tokenVerifier.verify(bearerToken(request), authConfig.issuer(), clock.instant());
                })
                .flatMap(verification -> {
                    if (verification instanceof TokenVerificationResult.Verified verified) {
                        return authorize(request, verified.claims(), audit);
                    }
                    var rejected = (TokenVerificationResult.Rejected) verification;
                    LOG.debugv("Request {0} unauthenticated: {1}", audit.requestId(), rejected.detail());
                    return Uni.createFrom().item((GatewayResult) new GatewayResult.Unauthenticated(rejected.error()));
                })
                .onItem()
                .invoke(audit::complete)
                .onFailure()
                .invoke(error -> {
                    LOG.errorv(error, "Request {0} failed in state {1}", audit.requestId(), audit.state());
                    audit.fail(error);
                })
                .onCancellation()
                .invoke(() -> {
                    LOG.debugv("Request {0} cancelled in state {1}", audit.requestId(), audit.state());
                    audit.abort();
                });
    }

    private Uni<GatewayResult> authorize(GatewayRequest request, Claims claims, RequestAudit audit) {
        audit.verified(claims);
        audit.authorizing();

        var decision = policyEngine.decide(request.method(), request.path(), Optional.of(claims));
        audit.decided(decision);
        if (decision instanceof Decision.Deny deny) {
            LOG.debugv("Request {0} by {1} denied", audit.requestId(), claims.username());
            return Uni.createFrom().item(new GatewayResult.Forbidden(deny.ruleId()));
        }

        var match = router.route(request.path());
        if (match.isEmpty()) {
            LOG.warnv("Request {0} allowed but no route serves {1}", audit.requestId(), request.path());
            return Uni.createFrom().item(new GatewayResult.RouteNotFound(request.path()));
        }

        audit.routed(match.get());
        return forwardToBackend(request, match.get(), claims, audit);
    }

    private Uni<GatewayResult> forwardToBackend(
            GatewayRequest request, RouteMatch match, Claims claims, RequestAudit audit) {
        var prepared = requestPreparer.prepare(request, match, claims, audit.requestId());
        var timeout = upstreamConfig.requestTimeout();
        var routeId = match.route().id();

        var attempt = Uni.createFrom()
                .deferred(() -> {
                    audit.forwarding();
                    var started = System.nanoTime();
                    return proxyClient
                            .forward(prepared)
                            .ifNoItem()
                            .after(timeout)
                            .failWith(() -> new UpstreamTimeoutException(routeId, timeout.toMillis()))
                            .onItemOrFailure()
                            .invoke((response, error) -> metrics.recordUpstreamLatency(
                                    routeId,
                                    request.method(),
                                    response == null ? 0 : response.statusCode(),
                                    (System.nanoTime() - started) / 1_000_000));
                });

        if (isRetryable(request.method())) {
            attempt = attempt.onFailure()
                    .invoke(error -> LOG.warnv(
                            "Request {0} to {1} failed, may retry: {2}", audit.requestId(), routeId, error.getMessage()))
                    .onFailure()
                    .retry()
                    .atMost(upstreamConfig.maxRetries());
        }

        return attempt.map(response -> (GatewayResult) new GatewayResult.Success(
                        response.statusCode(),
                        requestPreparer.filterResponseHeaders(response.headers()),
                        response.body()))
                .onFailure()
                .recoverWithItem(error -> {
                    var timedOut = error instanceof UpstreamTimeoutException;
                    LOG.warnv("Request {0} to {1} failed: {2}", audit.requestId(), routeId, error.getMessage());
                    return new GatewayResult.UpstreamError(
                            timedOut ? "Upstream timed out" : "Upstream unavailable", timedOut);
                });
    }

    private boolean isRetryable(String method) {
        return upstreamConfig.maxRetries() > 0 && IDEMPOTENT_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Extract the bearer token from the Authorization header.
     *
     * @return the token, or null when there is no bearer credential
     */
    static String bearerToken(GatewayRequest request) {
        var authorization = request.getHeaderString("Authorization");
        if (authorization == null || !authorization.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return null;
        }
        var token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static String requestId(GatewayRequest request) {
        var supplied = request.getHeaderString(ProxyRequestPreparer.REQUEST_ID_HEADER);
        if (supplied != null && !supplied.isBlank() && supplied.length() <= 128) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }

    /**
     * Raised when a backend does not answer within the configured request timeout.
     */
    public static class UpstreamTimeoutException extends RuntimeException {
        public UpstreamTimeoutException(String routeId, long timeoutMs) {
            super("No response from " + routeId + " within " + timeoutMs + "ms");
        }
    }
}
