package tech.authcore.platform.authentication.jwt;

import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Map;

/**
 * RS256 signer. Signing goes through SmallRye JWT, verification and JWK
 * handling through jose4j.
 */
public class RsaTokenSigner implements TokenSigner {

    public static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    private final RsaJsonWebKey jwk;
    private final PrivateKey privateKey;
    private final JwtConsumer consumer;

    private RsaTokenSigner(RsaJsonWebKey jwk) {
        this.jwk = jwk;
        this.privateKey = jwk.getPrivateKey();
        this.consumer = new JwtConsumerBuilder()
            .setSkipAllDefaultValidators()
            .setVerificationKey(jwk.getPublicKey())
            .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, ALGORITHM)
            .build();
    }

    /**
     * Generate a fresh 2048-bit key pair.
     */
    public static RsaTokenSigner generate(String keyId) {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(KEY_SIZE, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();

            RsaJsonWebKey jwk = new RsaJsonWebKey((RSAPublicKey) keyPair.getPublic());
            jwk.setPrivateKey((RSAPrivateKey) keyPair.getPrivate());
            jwk.setKeyId(keyId);
            return new RsaTokenSigner(withSigningMetadata(jwk));
        } catch (NoSuchAlgorithmException e) {
            throw new SigningKeyException("RSA key generation not available", e);
        }
    }

    /**
     * Load a signer from a full RSA JWK.
     *
     * @param fallbackKeyId used when the JWK carries no kid
     * @throws SigningKeyException if the JWK is not an RSA private key
     */
    public static RsaTokenSigner fromJwk(String jwkJson, String fallbackKeyId) {
        JsonWebKey parsed;
        try {
            parsed = JsonWebKey.Factory.newJwk(jwkJson);
        } catch (JoseException e) {
            throw new SigningKeyException("Configured RSA signing key is not a valid JWK", e);
        }
        if (!(parsed instanceof RsaJsonWebKey)) {
            throw new SigningKeyException("Configured signing key is not an RSA JWK: kty=" + parsed.getKeyType());
        }
        RsaJsonWebKey rsa = (RsaJsonWebKey) parsed;
        if (rsa.getPrivateKey() == null) {
            throw new SigningKeyException("Configured RSA signing key has no private part (d)");
        }
        if (rsa.getKeyId() == null || rsa.getKeyId().isBlank()) {
            rsa.setKeyId(fallbackKeyId);
        }
        return new RsaTokenSigner(withSigningMetadata(rsa));
    }

    private static RsaJsonWebKey withSigningMetadata(RsaJsonWebKey jwk) {
        jwk.setAlgorithm(ALGORITHM);
        jwk.setUse("sig");
        return jwk;
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public String keyId() {
        return jwk.getKeyId();
    }

    @Override
    public String sign(JwtClaims claims) {
        return Jwt.claims(claims.getClaimsMap())
            .jws()
            .algorithm(SignatureAlgorithm.RS256)
            .keyId(keyId())
            .sign(privateKey);
    }

    @Override
    public JwtClaims verify(String token) throws TokenVerificationException {
        try {
            return consumer.processToClaims(token);
        } catch (InvalidJwtException e) {
            throw new TokenVerificationException("RS256 token verification failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> exportPublicJwk() {
        return jwk.toParams(JsonWebKey.OutputControlLevel.PUBLIC_ONLY);
    }

    @Override
    public Map<String, Object> exportFullJwk() {
        return jwk.toParams(JsonWebKey.OutputControlLevel.INCLUDE_PRIVATE);
    }
}
