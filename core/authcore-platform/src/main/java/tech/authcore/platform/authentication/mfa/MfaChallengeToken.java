package tech.authcore.platform.authentication.mfa;

import java.time.Instant;

/**
 * Short-lived, single-use ticket issued after primary authentication
 * succeeds and a second factor is still required.
 */
public class MfaChallengeToken {

    public String id;

    public String userId;

    public String tenantId;

    /**
     * Plaintext encrypted under the "MfaChallengeToken" purpose.
     */
    public String encryptedToken;

    /**
     * SHA-256 hash of the plaintext, lowercase hex. Unique lookup key.
     */
    public String tokenHash;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean used = false;

    public Instant usedAt;

    public String issuedFromIpAddress;

    public String issuedFromUserAgent;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }

    public boolean isValid() {
        return !used && !isExpired();
    }
}
