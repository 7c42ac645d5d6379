package gatekeeper;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathMatching;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;

import gatekeeper.support.TestConfigs;
import gatekeeper.support.TestTokens;

/**
 * Starts a WireMock server that plays both the identity provider's key set endpoint
 * and the backends, and points the gateway at it.
 *
 * <p>Rules and routes mirror the bundled demo policy, with every backend on the
 * WireMock server under its own path. Access records go to a temporary file.
 */
public class GatewayTestResource implements QuarkusTestResourceLifecycleManager {

    static final String JWKS_PATH = "/realms/demo/certs";
    static final int SLOW_BACKEND_DELAY_MS = 3000;

    /**
     * Marks test fields that receive the WireMock server, the signing keys or the access record file.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Fixture {}

    private WireMockServer server;
    private TestTokens tokens;
    private Path workDir;
    private Path accessLog;

    @Override
    public Map<String, String> start() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        tokens = TestTokens.generate("gateway-test-key");

        server.stubFor(get(urlEqualTo(JWKS_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(tokens.jwksJson())));
        for (var backend : new String[] {"public", "alice", "bob", "internal"}) {
            server.stubFor(get(urlPathMatching("/" + backend + "-svc(/.*)?"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "text/plain")
                            .withBody(backend + "-ok")));
        }
        server.stubFor(get(urlEqualTo("/alice-svc/slow"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(SLOW_BACKEND_DELAY_MS)
                        .withBody("too late")));

        try {
            workDir = Files.createTempDirectory("gatekeeper-test");
            accessLog = workDir.resolve("access.log");
            var policy = workDir.resolve("policy.json");
            Files.writeString(policy, policyJson(server.baseUrl()), StandardCharsets.UTF_8);

            return Map.ofEntries(
                    Map.entry("gatekeeper.auth.issuer", TestConfigs.ISSUER),
                    Map.entry("gatekeeper.auth.jwks-uri", server.baseUrl() + JWKS_PATH),
                    Map.entry("gatekeeper.policy.location", policy.toString()),
                    Map.entry("gatekeeper.policy.reload-interval", "off"),
                    Map.entry("gatekeeper.upstream.max-retries", "0"),
                    Map.entry("gatekeeper.audit.handler", "ACCESS_FILE"),
                    Map.entry("gatekeeper.audit.file", accessLog.toString()),
                    Map.entry("quarkus.log.handler.file.\"ACCESS_FILE\".path", accessLog.toString()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String policyJson(String backend) {
        return """
                {
                  "version": "integration",
                  "rules": [
                    { "id": "public-any-user", "path": { "prefix": "/public" },
                      "principal": { "authenticated": true }, "effect": "allow" },
                    { "id": "alice-own-backend", "path": { "prefix": "/alice" },
                      "principal": { "username": "alice" }, "effect": "allow" },
                    { "id": "bob-own-backend", "path": { "prefix": "/bob" },
                      "principal": { "username": "bob" }, "effect": "allow" },
                    { "id": "internal-admins", "path": { "prefix": "/internal" },
                      "principal": { "role": "admin" }, "effect": "allow" }
                  ],
                  "routes": [
                    { "id": "public", "prefix": "/public", "backend": "%1$s", "rewrite": "/public-svc" },
                    { "id": "alice", "prefix": "/alice", "backend": "%1$s", "rewrite": "/alice-svc" },
                    { "id": "bob", "prefix": "/bob", "backend": "%1$s", "rewrite": "/bob-svc" },
                    { "id": "internal", "prefix": "/internal", "backend": "%1$s", "rewrite": "/internal-svc" }
                  ]
                }
                """.formatted(backend);
    }

    @Override
    public void inject(TestInjector testInjector) {
        testInjector.injectIntoFields(server, new TestInjector.AnnotatedAndMatchesType(Fixture.class, WireMockServer.class));
        testInjector.injectIntoFields(tokens, new TestInjector.AnnotatedAndMatchesType(Fixture.class, TestTokens.class));
        testInjector.injectIntoFields(accessLog, new TestInjector.AnnotatedAndMatchesType(Fixture.class, Path.class));
    }

    @Override
    public void stop() {
        if (server != null) {
            server.stop();
        }
    }
}
