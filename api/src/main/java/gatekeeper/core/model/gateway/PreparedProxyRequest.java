package gatekeeper.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

public record PreparedProxyRequest(String method, URI targetUri, Map<String, List<String>> headers, byte[] body) {
    public PreparedProxyRequest {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }
}
