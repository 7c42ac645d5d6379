package gatekeeper.core.service.audit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import gatekeeper.core.model.audit.AccessRecord;
import gatekeeper.core.model.gateway.GatewayRequest;
import gatekeeper.core.port.out.AuditSink;
import gatekeeper.core.port.out.Metrics;

/**
 * Writes one access record per request.
 *
 * <p>Sink failures are logged and never affect the response sent to the caller.
 */
@ApplicationScoped
public class AuditLogger {

    private static final Logger LOG = Logger.getLogger(AuditLogger.class);

    private final AuditSink sink;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public AuditLogger(AuditSink sink, Metrics metrics, Clock clock) {
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Start tracking a request. The returned handle emits its record exactly once.
     */
    public RequestAudit begin(GatewayRequest request, String requestId) {
        return new RequestAudit(this, clock, request.method(), request.path(), requestId);
    }

    void record(AccessRecord record) {
        try {
            sink.write(record);
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to write access record for request {0}", record.requestId());
        }
        if (metrics.isEnabled()) {
            metrics.recordRequest(record);
        }
    }
}
