package tech.authcore.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PKCE (Proof Key for Code Exchange) implementation.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Server stores code_challenge with the authorization code
 * 4. Client sends code_verifier in the token request
 * 5. Server recomputes the challenge and compares it to the stored one
 *
 * Only "S256" and "plain" are accepted. A challenge stored without a method
 * is treated as "plain", the RFC 7636 default.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";
    public static final String METHOD_PLAIN = "plain";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Generate a cryptographically random code verifier.
     *
     * 48 random bytes encode to 64 base64url characters, inside the
     * 43-128 character range RFC 7636 requires.
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Derive the S256 challenge for a verifier.
     *
     * @param codeVerifier The code verifier to hash
     * @return base64url (no padding) of SHA-256 over the ASCII verifier
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Whether the method is one this server accepts. Null and blank count as plain.
     */
    public boolean isSupportedMethod(String method) {
        return method == null || method.isBlank()
            || METHOD_S256.equals(method) || METHOD_PLAIN.equals(method);
    }

    /**
     * Verify that a code verifier matches the stored code challenge.
     *
     * @param codeVerifier  The verifier provided in the token request
     * @param codeChallenge The challenge stored with the authorization code
     * @param method        "S256" or "plain"; null or blank means plain
     * @return true if the verifier matches; false for any unknown method
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeVerifier.isEmpty() || codeChallenge == null) {
            return false;
        }

        if (method == null || method.isBlank() || METHOD_PLAIN.equals(method)) {
            return constantTimeEquals(codeVerifier, codeChallenge);
        }

        if (METHOD_S256.equals(method)) {
            return constantTimeEquals(generateCodeChallenge(codeVerifier), codeChallenge);
        }

        return false;
    }

    private boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(
            a.getBytes(StandardCharsets.UTF_8),
            b.getBytes(StandardCharsets.UTF_8));
    }
}
