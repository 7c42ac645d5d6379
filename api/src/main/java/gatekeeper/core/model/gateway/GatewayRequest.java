package gatekeeper.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * An inbound request as seen by the pipeline.
 *
 * @param method     HTTP method
 * @param path       decoded request path
 * @param query      raw query string without leading '?', or null
 * @param headers    request headers
 * @param requestUri full request URI as received
 * @param body       request body, empty when absent
 */
public record GatewayRequest(
        String method, String path, String query, Map<String, List<String>> headers, URI requestUri, byte[] body) {

    public GatewayRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    /**
     * Return the first value of a header, matching the name case-insensitively.
     */
    public String getHeaderString(String name) {
        var values = headers.get(name);
        if (values == null) {
            for (var entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    values = entry.getValue();
                    break;
                }
            }
        }
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }
}
