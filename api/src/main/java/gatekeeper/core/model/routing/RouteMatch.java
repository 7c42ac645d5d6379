package gatekeeper.core.model.routing;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * A request path resolved to a backend.
 *
 * @param route         the matched route
 * @param rewrittenPath path to request on the backend
 */
public record RouteMatch(Route route, String rewrittenPath) {

    public RouteMatch {
        if (route == null) {
            throw new IllegalArgumentException("Route cannot be null");
        }
        if (rewrittenPath == null || rewrittenPath.isEmpty()) {
            rewrittenPath = "/";
        }
    }

    public URI targetUri() {
        return targetUri(null);
    }

    /**
     * Return the full backend URI with an optional query string.
     *
     * <p>The rewritten path is a decoded path and is percent-encoded here; the query
     * is passed through as received.
     *
     * @param query the raw query string without leading '?', or null
     */
    public URI targetUri(String query) {
        var base = route.backend().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        var target = base + encodePath(rewrittenPath);
        if (query != null && !query.isEmpty()) {
            target += "?" + query;
        }
        return URI.create(target);
    }

    private static String encodePath(String path) {
        try {
            return new URI(null, null, path, null).getRawPath();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot encode path: " + path, e);
        }
    }
}
