package gatekeeper.core.port.out;

import io.smallrye.mutiny.Uni;

import gatekeeper.core.model.gateway.PreparedProxyRequest;
import gatekeeper.core.model.gateway.ProxyResponse;

/**
 * Sends a prepared request to a backend.
 */
public interface ProxyClient {

    /**
     * Forward the request.
     *
     * <p>The returned Uni is lazy and sends a new request on every subscription.
     * Cancelling the subscription aborts the in-flight backend request.
     *
     * @param request the request to send
     * @return the backend response; fails when the backend cannot be reached
     */
    Uni<ProxyResponse> forward(PreparedProxyRequest request);
}
