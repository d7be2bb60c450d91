package tech.authcore.platform.authentication.mfa;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for MfaChallengeToken entities.
 */
public interface MfaChallengeTokenRepository {

    Optional<MfaChallengeToken> findByTokenHash(String tokenHash);

    void persist(MfaChallengeToken token);

    /**
     * Flip the used flag only if it is still unset.
     *
     * @return true if this call consumed the challenge
     */
    boolean markAsUsed(String id, Instant usedAt);

    long deleteExpiredOrUsed(Instant before);
}
