package tech.authcore.platform.authentication.oauth;

import java.time.Instant;

/**
 * Authorization code issued during the OAuth2 authorization code flow.
 *
 * Authorization codes are:
 * - Short-lived (default: 10 minutes)
 * - Single-use (marked as used exactly once on redemption)
 * - Bound to client, redirect URI, and optional PKCE challenge
 * - Stored sealed: only a lookup hash and a ciphertext are persisted
 */
public class AuthorizationCode {

    public String id;

    /**
     * Plaintext code. Only populated on the instance returned from issuance
     * and on a successful redemption; never persisted.
     */
    public String code;

    /**
     * SHA-256 of the code, lowercase hex. Unique lookup key.
     */
    public String codeHash;

    /**
     * Code encrypted under the "AuthorizationCode" purpose.
     */
    public String encryptedCode;

    public String userId;

    public String tenantId;

    public String clientId;

    /**
     * Redirect URI used in the authorization request.
     * Must match exactly during token exchange.
     */
    public String redirectUri;

    public String scope;

    /**
     * Client-provided state for CSRF protection.
     */
    public String state;

    /**
     * PKCE code challenge.
     */
    public String codeChallenge;

    /**
     * PKCE challenge method (S256 or plain). Blank means plain.
     */
    public String codeChallengeMethod;

    public String issuedFromIpAddress;

    public String issuedFromUserAgent;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean used = false;

    public Instant usedAt;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }

    public boolean hasCodeChallenge() {
        return codeChallenge != null && !codeChallenge.isBlank();
    }

    public boolean isValid() {
        return !used && !isExpired();
    }
}
