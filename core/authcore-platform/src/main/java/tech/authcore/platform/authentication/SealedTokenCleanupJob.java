package tech.authcore.platform.authentication;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.mfa.MfaChallengeTokenService;
import tech.authcore.platform.authentication.oauth.AuthorizationCodeService;
import tech.authcore.platform.authentication.oauth.RefreshTokenService;

import java.time.Instant;

/**
 * Deletes expired and consumed sealed tokens.
 *
 * Rows are kept for authcore.auth.cleanup.retention after they stop being
 * usable, so audit queries can still see recent activity. Correctness never
 * depends on this job; every redemption checks expiry itself.
 */
@ApplicationScoped
public class SealedTokenCleanupJob {

    private static final Logger LOG = Logger.getLogger(SealedTokenCleanupJob.class);

    @Inject
    AuthConfig config;

    @Inject
    AuthorizationCodeService authorizationCodeService;

    @Inject
    RefreshTokenService refreshTokenService;

    @Inject
    MfaChallengeTokenService mfaChallengeTokenService;

    @Scheduled(
        every = "${authcore.auth.cleanup.interval:1h}",
        identity = "sealed-token-cleanup",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP
    )
    void scheduledCleanup() {
        if (!config.cleanup().enabled()) {
            return;
        }
        sweep();
    }

    /**
     * Run one sweep.
     *
     * @return total rows deleted
     */
    public long sweep() {
        Instant cutoff = Instant.now().minus(config.cleanup().retention());
        long codes = authorizationCodeService.cleanupExpiredCodes(cutoff);
        long challenges = mfaChallengeTokenService.cleanupExpiredChallenges(cutoff);
        long refreshTokens = refreshTokenService.cleanupExpiredTokens(cutoff);

        long total = codes + challenges + refreshTokens;
        if (total > 0) {
            LOG.infof("Sealed token cleanup removed %d rows (codes: %d, MFA challenges: %d, refresh tokens: %d)",
                total, codes, challenges, refreshTokens);
        }
        return total;
    }
}
