package gatekeeper.adapter.out.policy;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import gatekeeper.adapter.out.policy.PolicyDocument.PathDocument;
import gatekeeper.adapter.out.policy.PolicyDocument.PrincipalDocument;
import gatekeeper.adapter.out.policy.PolicyDocument.RouteDocument;
import gatekeeper.adapter.out.policy.PolicyDocument.RuleDocument;
import gatekeeper.core.config.PolicyConfig;
import gatekeeper.core.model.policy.Effect;
import gatekeeper.core.model.policy.GatewayPolicy;
import gatekeeper.core.model.policy.PathPredicate;
import gatekeeper.core.model.policy.PrincipalPredicate;
import gatekeeper.core.model.policy.Rule;
import gatekeeper.core.model.policy.RuleSet;
import gatekeeper.core.model.routing.Route;
import gatekeeper.core.model.routing.RouteTable;
import gatekeeper.core.port.out.PolicyRepository;

/**
 * Loads the policy document from the classpath or the file system.
 *
 * <p>Locations starting with {@code classpath:} are read as resources; anything
 * else is a file path. The policy version is the declared {@code version} if
 * present, suffixed with a digest of the document so any edit yields a new version.
 */
@ApplicationScoped
public class PolicyDocumentLoader implements PolicyRepository {

    private static final Logger LOG = Logger.getLogger(PolicyDocumentLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final String location;
    private final ObjectMapper objectMapper;

    @Inject
    public PolicyDocumentLoader(PolicyConfig config, ObjectMapper objectMapper) {
        this.location = config.location();
        this.objectMapper = objectMapper;
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public GatewayPolicy load() {
        var content = read();
        final PolicyDocument document;
        try {
            document = objectMapper.readValue(content, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyLoadException("Policy at " + location + " is not valid JSON: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new PolicyLoadException("Policy at " + location + " is empty");
        }

        var version = version(document.version(), content);
        try {
            var policy = new GatewayPolicy(
                    new RuleSet(version, toRules(document.rules())), new RouteTable(toRoutes(document.routes())));
            LOG.debugv("Parsed policy {0} from {1}", version, location);
            return policy;
        } catch (IllegalArgumentException e) {
            throw new PolicyLoadException("Invalid policy at " + location + ": " + e.getMessage(), e);
        }
    }

    private byte[] read() {
        try {
            if (location.startsWith(CLASSPATH_PREFIX)) {
                var resource = location.substring(CLASSPATH_PREFIX.length());
                if (resource.startsWith("/")) {
                    resource = resource.substring(1);
                }
                try (InputStream in =
                        Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
                    if (in == null) {
                        throw new PolicyLoadException("Policy resource not found: " + location);
                    }
                    return in.readAllBytes();
                }
            }
            return Files.readAllBytes(Path.of(location));
        } catch (NoSuchFileException e) {
            throw new PolicyLoadException("Policy file not found: " + location, e);
        } catch (IOException e) {
            throw new PolicyLoadException("Cannot read policy from " + location, e);
        }
    }

    private List<Rule> toRules(List<RuleDocument> documents) {
        if (documents == null) {
            return List.of();
        }
        var rules = new ArrayList<Rule>();
        for (var document : documents) {
            if (document == null) {
                throw new IllegalArgumentException("Rule entries cannot be null");
            }
            var methods = new LinkedHashSet<String>();
            if (document.methods() != null) {
                methods.addAll(document.methods());
            }
            rules.add(new Rule(
                    document.id(),
                    toPath(document.id(), document.path()),
                    methods,
                    toPrincipal(document.id(), document.principal()),
                    toEffect(document.id(), document.effect())));
        }
        return rules;
    }

    private PathPredicate toPath(String ruleId, PathDocument path) {
        if (path == null || (path.prefix() == null) == (path.exact() == null)) {
            throw new IllegalArgumentException("Rule " + ruleId + " must set exactly one of path.prefix or path.exact");
        }
        return path.prefix() != null ? new PathPredicate.Prefix(path.prefix()) : new PathPredicate.Exact(path.exact());
    }

    private PrincipalPredicate toPrincipal(String ruleId, PrincipalDocument principal) {
        if (principal == null) {
            throw new IllegalArgumentException("Rule " + ruleId + " has no principal");
        }
        var set = 0;
        set += principal.username() != null ? 1 : 0;
        set += principal.role() != null ? 1 : 0;
        set += Boolean.TRUE.equals(principal.authenticated()) ? 1 : 0;
        if (set != 1) {
            throw new IllegalArgumentException(
                    "Rule " + ruleId + " must set exactly one of principal.username, principal.role"
                            + " or principal.authenticated");
        }
        if (principal.username() != null) {
            return new PrincipalPredicate.UsernameEquals(principal.username());
        }
        if (principal.role() != null) {
            return new PrincipalPredicate.RoleContains(principal.role());
        }
        return new PrincipalPredicate.AnyAuthenticated();
    }

    private Effect toEffect(String ruleId, String effect) {
        if (effect == null || effect.isBlank()) {
            return Effect.ALLOW;
        }
        try {
            return Effect.valueOf(effect.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Rule " + ruleId + " has unknown effect: " + effect, e);
        }
    }

    private List<Route> toRoutes(List<RouteDocument> documents) {
        if (documents == null) {
            return List.of();
        }
        var routes = new ArrayList<Route>();
        for (var document : documents) {
            if (document == null) {
                throw new IllegalArgumentException("Route entries cannot be null");
            }
            if (document.backend() == null || document.backend().isBlank()) {
                throw new IllegalArgumentException("Route " + document.prefix() + " has no backend");
            }
            routes.add(new Route(document.id(), document.prefix(), URI.create(document.backend()), document.rewrite()));
        }
        return routes;
    }

    private static String version(String declared, byte[] content) {
        var digest = digest(content);
        return declared == null || declared.isBlank() ? digest : declared + "@" + digest;
    }

    private static String digest(byte[] content) {
        try {
            var hash = MessageDigest.getInstance("SHA-256").digest(content);
            return HexFormat.of().formatHex(hash, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
