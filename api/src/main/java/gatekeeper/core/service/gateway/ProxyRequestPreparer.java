package gatekeeper.core.service.gateway;

import java.net.URI;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import gatekeeper.core.config.ForwardingConfig;
import gatekeeper.core.model.auth.Claims;
import gatekeeper.core.model.gateway.GatewayRequest;
import gatekeeper.core.model.gateway.PreparedProxyRequest;
import gatekeeper.core.model.routing.RouteMatch;

/**
 * Prepares backend requests from verified gateway requests.
 * This encapsulates the business logic for:
 * - Filtering hop-by-hop headers (RFC 2616 Section 13.5.1)
 * - Stripping client-supplied identity headers and, unless configured otherwise, the bearer token
 * - Adding the verified identity headers
 * - Setting the Host header for the target
 * - Propagating the request id
 */
@ApplicationScoped
public class ProxyRequestPreparer {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    /**
     * HTTP hop-by-hop headers that must not be forwarded to the upstream server.
     * These are connection-specific headers per RFC 2616 Section 13.5.1.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    private final ForwardingConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public ProxyRequestPreparer(ForwardingConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Build the request to send to the matched backend on behalf of a verified caller.
     *
     * @param request   the inbound request
     * @param route     the matched route
     * @param claims    the caller's verified claims
     * @param requestId the request correlation id
     * @return prepared proxy request
     */
    public PreparedProxyRequest prepare(GatewayRequest request, RouteMatch route, Claims claims, String requestId) {
        var targetUri = route.targetUri(request.query());
        var headers = new LinkedHashMap<String, List<String>>();

        copyFilteredHeaders(request, headers);
        setHostHeader(headers, targetUri);
        addForwardedHeaders(request, headers);
        addIdentityHeaders(claims, headers);
        headers.put(REQUEST_ID_HEADER, List.of(requestId));

        return new PreparedProxyRequest(request.method(), targetUri, headers, request.body());
    }

    private void copyFilteredHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        for (var entry : request.headers().entrySet()) {
            var headerName = entry.getKey();
            if (shouldSkipHeader(headerName.toLowerCase(Locale.ROOT))) {
                continue;
            }
            headers.put(headerName, new ArrayList<>(entry.getValue()));
        }
    }

    private boolean shouldSkipHeader(String lowerName) {
        if (HOP_BY_HOP_HEADERS.contains(lowerName)) {
            return true;
        }
        // Set for the target below
        if ("host".equals(lowerName) || lowerName.equals(REQUEST_ID_HEADER.toLowerCase(Locale.ROOT))) {
            return true;
        }
        // Set by the HTTP client
        if ("content-length".equals(lowerName)) {
            return true;
        }
        // Only the gateway may assert identity
        if (lowerName.equals(config.userHeader().toLowerCase(Locale.ROOT))
                || lowerName.equals(config.rolesHeader().toLowerCase(Locale.ROOT))
                || lowerName.equals(config.claimsHeader().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return "authorization".equals(lowerName) && !config.forwardToken();
    }

    private void setHostHeader(Map<String, List<String>> headers, URI targetUri) {
        var port = targetUri.getPort();
        var host = targetUri.getHost();
        if (port != -1 && port != 80 && port != 443) {
            host += ":" + port;
        }
        headers.put("Host", List.of(host));
    }

    private void addForwardedHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        var requestUri = request.requestUri();
        var host = request.getHeaderString("Host");
        if (host == null && requestUri != null) {
            host = requestUri.getAuthority();
        }
        if (host != null) {
            headers.put("X-Forwarded-Host", List.of(host));
        }
        if (requestUri != null && requestUri.getScheme() != null) {
            headers.put("X-Forwarded-Proto", List.of(requestUri.getScheme()));
        }
    }

    private void addIdentityHeaders(Claims claims, Map<String, List<String>> headers) {
        headers.put(config.userHeader(), List.of(claims.username()));
        if (!claims.roles().isEmpty()) {
            headers.put(config.rolesHeader(), List.of(String.join(",", new TreeSet<>(claims.roles()))));
        }
        headers.put(config.claimsHeader(), List.of(encodeClaims(claims)));
    }

    /**
     * Encode the verified payload as unpadded base64url JSON.
     */
    String encodeClaims(Claims claims) {
        try {
            var json = objectMapper.writeValueAsBytes(claims.attributes());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Verified claims cannot be serialized", e);
        }
    }

    /**
     * Filters hop-by-hop headers from a response.
     * Call this when processing upstream responses before returning to the client.
     */
    public Map<String, List<String>> filterResponseHeaders(Map<String, List<String>> responseHeaders) {
        Map<String, List<String>> filtered = new LinkedHashMap<>();
        for (var entry : responseHeaders.entrySet()) {
            var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP_HEADERS.contains(lowerName) && !"content-length".equals(lowerName)) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }
}
