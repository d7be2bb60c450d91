package tech.authcore.platform.authentication.oauth;

import java.time.Instant;

/**
 * Refresh token for obtaining new access tokens.
 *
 * Refresh tokens are long-lived bearer credentials. They stay usable across
 * any number of refreshes until they expire or are revoked; revocation is
 * permanent.
 */
public class RefreshToken {

    public String id;

    public String userId;

    public String tenantId;

    /**
     * Plaintext token encrypted under the "RefreshToken" purpose.
     */
    public String encryptedToken;

    /**
     * SHA-256 hash of the plaintext, lowercase hex. Unique lookup key.
     */
    public String tokenHash;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean revoked = false;

    public Instant revokedAt;

    /**
     * Last successful validation, for audit only.
     */
    public Instant usedAt;

    public String issuedFromIpAddress;

    public String issuedFromUserAgent;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }

    public boolean isValid() {
        return !revoked && !isExpired();
    }
}
