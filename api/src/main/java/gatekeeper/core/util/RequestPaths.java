package gatekeeper.core.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Path helpers shared by policy evaluation and routing.
 */
public final class RequestPaths {

    private RequestPaths() {}

    /**
     * Normalize a request path before it is matched against rules or routes.
     *
     * <p>Collapses repeated slashes and resolves {@code .} and {@code ..} segments.
     * A {@code ..} at the root is dropped, so the result never climbs above {@code /}.
     * A trailing slash on a non-root path is preserved.
     *
     * @param path the raw request path (may be null or empty)
     * @return an absolute, normalized path
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
                continue;
            }
            segments.addLast(segment);
        }

        var normalized = new StringBuilder();
        for (String segment : segments) {
            normalized.append('/').append(segment);
        }
        if (normalized.length() == 0) {
            return "/";
        }
        if (path.endsWith("/") || path.endsWith("/.") || path.endsWith("/..")) {
            normalized.append('/');
        }
        return normalized.toString();
    }

    /**
     * Segment-aware prefix test.
     *
     * <p>{@code /alice} matches {@code /alice} and {@code /alice/x} but not {@code /alicex}.
     * A prefix ending in {@code /} matches anything below it, so {@code /} matches every path.
     *
     * @param path   a normalized request path
     * @param prefix the configured prefix
     * @return true if {@code path} lies under {@code prefix}
     */
    public static boolean hasSegmentPrefix(String path, String prefix) {
        if (!path.startsWith(prefix)) {
            return false;
        }
        if (prefix.endsWith("/") || path.length() == prefix.length()) {
            return true;
        }
        return path.charAt(prefix.length()) == '/';
    }
}
