package gatekeeper.support;

import java.nio.charset.StandardCharsets;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import gatekeeper.core.model.auth.SigningKey;

/**
 * RSA key material and token minting for tests.
 */
public final class TestTokens {

    private final RsaJsonWebKey jwk;

    private TestTokens(RsaJsonWebKey jwk) {
        this.jwk = jwk;
    }

    public static TestTokens generate(String keyId) {
        try {
            var keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(2048);
            var keyPair = keyGen.generateKeyPair();
            var jwk = new RsaJsonWebKey((RSAPublicKey) keyPair.getPublic());
            jwk.setPrivateKey((RSAPrivateKey) keyPair.getPrivate());
            jwk.setKeyId(keyId);
            jwk.setAlgorithm(AlgorithmIdentifiers.RSA_USING_SHA256);
            jwk.setUse("sig");
            return new TestTokens(jwk);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public String keyId() {
        return jwk.getKeyId();
    }

    public RsaJsonWebKey jwk() {
        return jwk;
    }

    public SigningKey signingKey(Instant fetchedAt) {
        return new SigningKey(
                jwk.getKeyId(), Optional.of(AlgorithmIdentifiers.RSA_USING_SHA256), jwk.getPublicKey(), fetchedAt);
    }

    /**
     * JWKS document publishing this key's public half.
     */
    public String jwksJson() {
        return "{\"keys\":[" + jwk.toJson() + "]}";
    }

    /**
     * Claims for a user valid for an hour around {@code now}.
     */
    public static JwtClaims claims(String username, Instant now, String... roles) {
        var claims = new JwtClaims();
        claims.setIssuer(TestConfigs.ISSUER);
        claims.setSubject("sub-" + username);
        claims.setExpirationTime(NumericDate.fromSeconds(now.getEpochSecond() + 3600));
        claims.setIssuedAt(NumericDate.fromSeconds(now.getEpochSecond()));
        claims.setClaim("preferred_username", username);
        claims.setClaim("realm_access", Map.of("roles", List.of(roles)));
        return claims;
    }

    public String sign(JwtClaims claims) {
        return sign(claims, AlgorithmIdentifiers.RSA_USING_SHA256, jwk.getKeyId());
    }

    public String sign(JwtClaims claims, String algorithm, String keyId) {
        try {
            var jws = new JsonWebSignature();
            jws.setPayload(claims.toJson());
            jws.setKey(jwk.getPrivateKey());
            jws.setAlgorithmHeaderValue(algorithm);
            if (keyId != null) {
                jws.setKeyIdHeaderValue(keyId);
            }
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException(e);
        }
    }

    public String token(String username, Instant now, String... roles) {
        return sign(claims(username, now, roles));
    }

    /**
     * Build a token with an arbitrary header and a signature segment that is not a real signature.
     */
    public static String forge(String headerJson, JwtClaims claims) {
        var encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString(headerJson.getBytes(StandardCharsets.UTF_8))
                + "."
                + encoder.encodeToString(claims.toJson().getBytes(StandardCharsets.UTF_8))
                + "."
                + encoder.encodeToString("not-a-signature".getBytes(StandardCharsets.UTF_8));
    }
}
