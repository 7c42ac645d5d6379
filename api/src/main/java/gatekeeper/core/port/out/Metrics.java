package gatekeeper.core.port.out;

import gatekeeper.core.model.audit.AccessRecord;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a finished request from its access record.
     *
     * @param record the access record written for the request
     */
    void recordRequest(AccessRecord record);

    /**
     * Record backend latency for one forwarding attempt.
     *
     * @param routeId the route the request was sent through
     * @param method the HTTP method
     * @param statusCode the backend status code, or 0 when no response arrived
     * @param latencyMs latency in milliseconds
     */
    void recordUpstreamLatency(String routeId, String method, int statusCode, long latencyMs);

    /**
     * Record a signing key set fetch.
     *
     * @param outcome success, failure or timeout
     */
    void recordKeyFetch(String outcome);

    /**
     * Record a policy load attempt.
     *
     * @param success whether the new policy was installed
     */
    void recordPolicyReload(boolean success);
}
