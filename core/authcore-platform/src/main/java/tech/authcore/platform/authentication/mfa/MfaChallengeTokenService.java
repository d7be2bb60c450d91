package tech.authcore.platform.authentication.mfa;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.AuthConfig;
import tech.authcore.platform.security.encryption.AuthenticatedEncryptionProvider;
import tech.authcore.platform.security.encryption.SealedTokens;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and redeems MFA challenge tokens.
 *
 * A challenge is handed to the client after password verification and
 * exchanged, together with the second factor, exactly once.
 */
@ApplicationScoped
public class MfaChallengeTokenService {

    private static final Logger LOG = Logger.getLogger(MfaChallengeTokenService.class);

    static final String PURPOSE = "MfaChallengeToken";
    static final Duration MIN_EXPIRY = Duration.ofMinutes(1);
    private static final int TOKEN_BYTES = 64;

    @Inject
    MfaChallengeTokenRepository challengeRepo;

    @Inject
    AuthenticatedEncryptionProvider encryption;

    @Inject
    AuthConfig config;

    /**
     * Generate a random challenge value (64 bytes, base64url without padding).
     */
    public static String generateChallengeToken() {
        return SealedTokens.randomToken(TOKEN_BYTES);
    }

    /**
     * Store a challenge with the configured default lifetime.
     */
    @Transactional
    public MfaChallengeToken issue(String userId, String tenantId, String plainToken,
                                   String ipAddress, String userAgent) {
        return issue(userId, tenantId, plainToken, ipAddress, userAgent, config.mfa().challengeExpiry());
    }

    /**
     * Store a challenge with a caller-chosen lifetime.
     *
     * @param lifetime between one minute and authcore.auth.mfa.max-challenge-expiry
     * @throws IllegalArgumentException if an input is blank or the lifetime is out of range
     */
    @Transactional
    public MfaChallengeToken issue(String userId, String tenantId, String plainToken,
                                   String ipAddress, String userAgent, Duration lifetime) {
        if (userId == null || userId.isBlank() || tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("userId and tenantId are required");
        }
        if (plainToken == null || plainToken.isBlank()) {
            throw new IllegalArgumentException("Challenge token cannot be null or blank");
        }
        Duration max = config.mfa().maxChallengeExpiry();
        if (lifetime == null || lifetime.compareTo(MIN_EXPIRY) < 0 || lifetime.compareTo(max) > 0) {
            throw new IllegalArgumentException(
                "Challenge lifetime must be between " + MIN_EXPIRY + " and " + max + ", got " + lifetime);
        }

        Instant now = Instant.now();
        MfaChallengeToken challenge = new MfaChallengeToken();
        challenge.userId = userId;
        challenge.tenantId = tenantId;
        challenge.encryptedToken = encryption.protect(PURPOSE, plainToken);
        challenge.tokenHash = SealedTokens.hash(plainToken);
        challenge.createdAt = now;
        challenge.expiresAt = now.plus(lifetime);
        challenge.issuedFromIpAddress = ipAddress;
        challenge.issuedFromUserAgent = userAgent;

        challengeRepo.persist(challenge);

        LOG.debugf("Created MFA challenge %s for user %s in tenant %s (expires %s)",
            challenge.id, userId, tenantId, challenge.expiresAt);
        return challenge;
    }

    /**
     * Validate a challenge and mark it used in the same step.
     *
     * @return the consumed challenge, or empty if unknown, used, expired or tampered with
     */
    @Transactional
    public Optional<MfaChallengeToken> validateAndConsume(String plainToken) {
        if (plainToken == null || plainToken.isBlank()) {
            return Optional.empty();
        }

        Optional<MfaChallengeToken> found = challengeRepo.findByTokenHash(SealedTokens.hash(plainToken));
        if (found.isEmpty()) {
            LOG.warn("MFA challenge not found by hash");
            return Optional.empty();
        }

        MfaChallengeToken challenge = found.get();
        if (!challenge.isValid()) {
            if (challenge.used) {
                LOG.warnf("MFA challenge %s already used at %s", challenge.id, challenge.usedAt);
            } else {
                LOG.warnf("MFA challenge %s expired at %s", challenge.id, challenge.expiresAt);
            }
            return Optional.empty();
        }
        if (!SealedTokens.matches(encryption, PURPOSE, challenge.encryptedToken, plainToken, challenge.id)) {
            return Optional.empty();
        }

        Instant now = Instant.now();
        if (!challengeRepo.markAsUsed(challenge.id, now)) {
            LOG.warnf("MFA challenge %s consumed by a concurrent request", challenge.id);
            return Optional.empty();
        }

        challenge.used = true;
        challenge.usedAt = now;
        LOG.debugf("MFA challenge %s consumed for user %s", challenge.id, challenge.userId);
        return Optional.of(challenge);
    }

    @Transactional
    public long cleanupExpiredChallenges(Instant before) {
        long deleted = challengeRepo.deleteExpiredOrUsed(before);
        if (deleted > 0) {
            LOG.infof("Deleted %d expired or used MFA challenges", deleted);
        }
        return deleted;
    }
}
