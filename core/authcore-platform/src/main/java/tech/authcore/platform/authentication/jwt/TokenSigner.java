package tech.authcore.platform.authentication.jwt;

import org.jose4j.jwt.JwtClaims;

import java.util.Map;

/**
 * Signs and verifies compact JWS tokens with one process-wide key pair.
 *
 * Implementations hold immutable key material created once at startup.
 */
public interface TokenSigner {

    /**
     * JWS "alg" value, e.g. RS256 or ML-DSA-65.
     */
    String algorithm();

    /**
     * JWS "kid" value.
     */
    String keyId();

    /**
     * Sign the claims and return the compact serialization.
     */
    String sign(JwtClaims claims);

    /**
     * Verify the signature and header of a token and return its claims.
     * No claim (exp, iss, aud) is validated here.
     *
     * @throws TokenVerificationException if the token is malformed or the signature does not verify
     */
    JwtClaims verify(String token) throws TokenVerificationException;

    /**
     * Public half of the key as JWK members.
     */
    Map<String, Object> exportPublicJwk();

    /**
     * Full key, private members included. Never publish.
     */
    Map<String, Object> exportFullJwk();
}
