package gatekeeper.core.model.routing;

import java.net.URI;

import gatekeeper.core.util.RequestPaths;

/**
 * A static path-prefix to backend mapping.
 *
 * @param id      route identifier used in logs and audit records
 * @param prefix  path prefix this route serves
 * @param backend base URI of the backend service
 * @param rewrite replacement for the matched prefix (default {@code /})
 */
public record Route(String id, String prefix, URI backend, String rewrite) {

    public Route {
        if (prefix == null || !prefix.startsWith("/")) {
            throw new IllegalArgumentException("Route prefix must start with '/': " + prefix);
        }
        if (backend == null || backend.getHost() == null) {
            throw new IllegalArgumentException("Route backend must be an absolute URI with a host: " + backend);
        }
        var scheme = backend.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Route backend must use http or https: " + backend);
        }
        if (rewrite == null || rewrite.isBlank()) {
            rewrite = "/";
        }
        if (!rewrite.startsWith("/")) {
            throw new IllegalArgumentException("Route rewrite must start with '/': " + rewrite);
        }
        if (id == null || id.isBlank()) {
            id = prefix;
        }
    }

    public boolean matches(String normalizedPath) {
        return RequestPaths.hasSegmentPrefix(normalizedPath, prefix);
    }

    /**
     * Replace the matched prefix with the rewrite prefix.
     *
     * <p>{@code /alice/x} under prefix {@code /alice} with rewrite {@code /} becomes {@code /x};
     * {@code /alice} itself becomes {@code /}.
     */
    public String rewritePath(String normalizedPath) {
        var remainder = normalizedPath.substring(prefix.length());
        if (remainder.startsWith("/")) {
            remainder = remainder.substring(1);
        }
        if (remainder.isEmpty()) {
            return rewrite;
        }
        return rewrite.endsWith("/") ? rewrite + remainder : rewrite + "/" + remainder;
    }
}
