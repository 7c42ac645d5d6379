package gatekeeper.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import gatekeeper.core.model.audit.AccessRecord;
import gatekeeper.core.port.out.Metrics;

/**
 * Central service for recording gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code gatekeeper.requests.total} - Request count by decision, state and status</li>
 *   <li>{@code gatekeeper.upstream.latency} - Backend response latency by route</li>
 *   <li>{@code gatekeeper.jwks.fetch.total} - Signing key fetches by outcome</li>
 *   <li>{@code gatekeeper.policy.reloads.total} - Policy loads by result</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public GatewayMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Request Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRequest(AccessRecord record) {
        if (!enabled) {
            return;
        }

        Counter.builder("gatekeeper.requests.total")
                .description("Total number of requests processed")
                .tag("decision", record.decision().value())
                .tag("state", record.state().name().toLowerCase(Locale.ROOT))
                .tag("status", String.valueOf(record.status()))
                .tag("status_class", statusClass(record.status()))
                .register(registry)
                .increment();
    }

    /**
     * Record backend latency.
     *
     * @param routeId the route the request went through
     * @param method the HTTP method
     * @param statusCode the backend status, 0 when no response arrived
     * @param latencyMs latency in milliseconds
     */
    @Override
    public void recordUpstreamLatency(String routeId, String method, int statusCode, long latencyMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("gatekeeper.upstream.latency")
                .description("Time to receive response from backend")
                .tag("backend", nullSafe(routeId))
                .tag("method", method)
                .tag("status_class", statusClass(statusCode))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    // -------------------------------------------------------------------------
    // Control Plane Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordKeyFetch(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("gatekeeper.jwks.fetch.total")
                .description("Signing key set fetches")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordPolicyReload(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("gatekeeper.policy.reloads.total")
                .description("Policy document loads")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    private static String statusClass(int statusCode) {
        if (statusCode <= 0) {
            return "none";
        }
        return (statusCode / 100) + "xx";
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
