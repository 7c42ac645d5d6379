package gatekeeper.adapter.out.auth;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.EllipticCurveJsonWebKey;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.lang.JoseException;

import gatekeeper.core.config.AuthConfig;
import gatekeeper.core.model.auth.SigningKey;
import gatekeeper.core.port.out.JwksClient;

/**
 * Fetches the identity provider's JSON Web Key Set over HTTP.
 *
 * <p>Only RSA and EC public keys intended for signatures are returned. Symmetric
 * keys and keys published for encryption are skipped.
 */
@ApplicationScoped
public class VertxJwksClient implements JwksClient {

    private static final Logger LOG = Logger.getLogger(VertxJwksClient.class);

    private final Vertx vertx;
    private final URI jwksUri;
    private WebClient webClient;

    @Inject
    public VertxJwksClient(Vertx vertx, AuthConfig authConfig) {
        this.vertx = vertx;
        this.jwksUri = URI.create(authConfig.jwksUri());
    }

    @PostConstruct
    void init() {
        this.webClient = WebClient.create(vertx);
    }

    @Override
    public Uni<List<SigningKey>> fetchKeys() {
        LOG.debugv("Fetching JWKS from {0}", jwksUri);

        return webClient
                .getAbs(jwksUri.toString())
                .ssl("https".equals(jwksUri.getScheme()))
                .putHeader("Accept", "application/json")
                .send()
                .map(this::parseResponse);
    }

    private List<SigningKey> parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new JwksFetchException("JWKS endpoint returned status " + response.statusCode());
        }

        final JsonWebKeySet keySet;
        try {
            keySet = new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new JwksFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }

        var fetchedAt = Instant.now();
        var keys = new ArrayList<SigningKey>();
        for (var jwk : keySet.getJsonWebKeys()) {
            toSigningKey(jwk, fetchedAt).ifPresent(keys::add);
        }
        return keys;
    }

    private Optional<SigningKey> toSigningKey(JsonWebKey jwk, Instant fetchedAt) {
        if (jwk.getKeyId() == null || jwk.getKeyId().isBlank()) {
            LOG.debug("Skipping JWK without a key id");
            return Optional.empty();
        }
        if (!(jwk instanceof RsaJsonWebKey) && !(jwk instanceof EllipticCurveJsonWebKey)) {
            LOG.debugv("Skipping JWK {0} of type {1}", jwk.getKeyId(), jwk.getKeyType());
            return Optional.empty();
        }
        if (jwk.getUse() != null && !Use.SIGNATURE.equals(jwk.getUse())) {
            LOG.debugv("Skipping JWK {0} with use {1}", jwk.getKeyId(), jwk.getUse());
            return Optional.empty();
        }
        var publicKey = ((PublicJsonWebKey) jwk).getPublicKey();
        return Optional.of(new SigningKey(
                jwk.getKeyId(), Optional.ofNullable(jwk.getAlgorithm()), publicKey, fetchedAt));
    }

    /**
     * Exception thrown when the JWKS endpoint cannot be read.
     */
    public static class JwksFetchException extends RuntimeException {
        public JwksFetchException(String message) {
            super(message);
        }

        public JwksFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
