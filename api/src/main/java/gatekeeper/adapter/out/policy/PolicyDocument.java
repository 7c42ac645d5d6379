package gatekeeper.adapter.out.policy;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON schema of the policy document.
 *
 * <pre>
 * {
 *   "version": "optional label",
 *   "rules": [
 *     {"id": "alice-own", "path": {"prefix": "/alice"}, "methods": ["GET"],
 *      "principal": {"username": "alice"}, "effect": "allow"}
 *   ],
 *   "routes": [
 *     {"id": "alice", "prefix": "/alice", "backend": "http://alice:8080", "rewrite": "/"}
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyDocument(String version, List<RuleDocument> rules, List<RouteDocument> routes) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleDocument(
            String id, PathDocument path, List<String> methods, PrincipalDocument principal, String effect) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PathDocument(String prefix, String exact) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PrincipalDocument(String username, String role, Boolean authenticated) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RouteDocument(String id, String prefix, String backend, String rewrite) {}
}
