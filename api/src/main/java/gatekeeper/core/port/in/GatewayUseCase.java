package gatekeeper.core.port.in;

import io.smallrye.mutiny.Uni;

import gatekeeper.core.model.gateway.GatewayRequest;
import gatekeeper.core.model.gateway.GatewayResult;

/**
 * Authenticate, authorize and forward a request to its backend.
 */
public interface GatewayUseCase {

    /**
     * Run one request through the pipeline.
     *
     * <p>Exactly one access record is written for every request, including
     * requests that fail or are cancelled before completing.
     *
     * @param request the inbound request
     * @return the terminal result to send to the caller
     */
    Uni<GatewayResult> forward(GatewayRequest request);
}
