package tech.authcore.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuthorizationCode entities.
 */
public interface AuthorizationCodeRepository {

    // Read operations
    Optional<AuthorizationCode> findByCodeHash(String codeHash);

    // Write operations
    void persist(AuthorizationCode code);

    /**
     * Flip the used flag only if it is still unset.
     *
     * @return true if this call consumed the code, false if it was already used
     */
    boolean markAsUsed(String id, Instant usedAt);

    /**
     * Delete codes that expired, or were used, before the cutoff.
     *
     * @return number of rows deleted
     */
    long deleteExpiredOrUsed(Instant before);
}
