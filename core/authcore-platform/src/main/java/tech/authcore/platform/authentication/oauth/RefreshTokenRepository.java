package tech.authcore.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for RefreshToken entities.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findByTokenHash(String tokenHash);
    Optional<RefreshToken> findByTokenHashAndUserId(String tokenHash, String userId);

    // Write operations
    void persist(RefreshToken token);
    void touchUsedAt(String id, Instant usedAt);

    /**
     * Revoke a single token if it is not revoked yet.
     */
    void revoke(String id, Instant revokedAt);

    /**
     * Revoke every non-revoked token of a user within a tenant.
     *
     * @return number of tokens revoked by this call
     */
    long revokeAllForUser(String userId, String tenantId, Instant revokedAt);

    /**
     * Delete tokens that expired before the cutoff.
     */
    long deleteExpired(Instant before);
}
