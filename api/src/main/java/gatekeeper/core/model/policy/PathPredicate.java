package gatekeeper.core.model.policy;

import gatekeeper.core.util.RequestPaths;

/**
 * Request path predicate of an authorization rule.
 */
public sealed interface PathPredicate {

    boolean matches(String normalizedPath);

    /**
     * Matches one path exactly.
     */
    record Exact(String path) implements PathPredicate {
        public Exact {
            requireAbsolute(path);
        }

        @Override
        public boolean matches(String normalizedPath) {
            return path.equals(normalizedPath);
        }
    }

    /**
     * Matches a path and everything below it, on segment boundaries.
     */
    record Prefix(String prefix) implements PathPredicate {
        public Prefix {
            requireAbsolute(prefix);
        }

        @Override
        public boolean matches(String normalizedPath) {
            return RequestPaths.hasSegmentPrefix(normalizedPath, prefix);
        }
    }

    private static void requireAbsolute(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Path must start with '/': " + path);
        }
    }
}
