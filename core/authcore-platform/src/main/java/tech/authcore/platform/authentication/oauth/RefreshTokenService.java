package tech.authcore.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.AuthConfig;
import tech.authcore.platform.security.encryption.AuthenticatedEncryptionProvider;
import tech.authcore.platform.security.encryption.SealedTokens;
import tech.authcore.platform.tenant.TenantSettingsProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues, validates and revokes refresh tokens.
 *
 * Tokens are reusable until they expire or are revoked; validation only
 * records the last use. Lifetime comes from the tenant setting
 * {@value TenantSettingsProvider#REFRESH_TOKEN_EXPIRATION_DAYS} (1-365 days),
 * falling back to authcore.auth.refresh-token.default-expiration-days.
 */
@ApplicationScoped
public class RefreshTokenService {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);

    static final String PURPOSE = "RefreshToken";
    static final int MIN_EXPIRATION_DAYS = 1;
    static final int MAX_EXPIRATION_DAYS = 365;
    private static final int TOKEN_BYTES = 64;

    @Inject
    RefreshTokenRepository tokenRepo;

    @Inject
    AuthenticatedEncryptionProvider encryption;

    @Inject
    TenantSettingsProvider tenantSettings;

    @Inject
    AuthConfig config;

    /**
     * Generate a new random refresh token value (64 bytes, base64url without padding).
     */
    public static String generateRefreshToken() {
        return SealedTokens.randomToken(TOKEN_BYTES);
    }

    /**
     * Store a refresh token for a user.
     *
     * @param plainToken plaintext token, encrypted before storage
     * @param ipAddress  issuing IP address (optional)
     * @param userAgent  issuing user agent (optional)
     * @return the stored token
     * @throws IllegalArgumentException if any identifier or the token is blank
     */
    @Transactional
    public RefreshToken issue(String userId, String tenantId, String plainToken,
                              String ipAddress, String userAgent) {
        if (userId == null || userId.isBlank() || tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("userId and tenantId are required");
        }
        if (plainToken == null || plainToken.isBlank()) {
            throw new IllegalArgumentException("Refresh token cannot be null or blank");
        }

        int expirationDays = resolveExpirationDays(tenantId);
        Instant now = Instant.now();

        RefreshToken token = new RefreshToken();
        token.userId = userId;
        token.tenantId = tenantId;
        token.encryptedToken = encryption.protect(PURPOSE, plainToken);
        token.tokenHash = SealedTokens.hash(plainToken);
        token.createdAt = now;
        token.expiresAt = now.plus(Duration.ofDays(expirationDays));
        token.issuedFromIpAddress = ipAddress;
        token.issuedFromUserAgent = userAgent;

        tokenRepo.persist(token);

        LOG.debugf("Created refresh token %s for user %s in tenant %s (expires %s)",
            token.id, userId, tenantId, token.expiresAt);
        return token;
    }

    /**
     * Validate a refresh token. A valid token stays usable.
     *
     * @return the token, or empty if unknown, revoked, expired or tampered with
     */
    @Transactional
    public Optional<RefreshToken> validate(String plainToken) {
        if (plainToken == null || plainToken.isBlank()) {
            return Optional.empty();
        }

        Optional<RefreshToken> found = tokenRepo.findByTokenHash(SealedTokens.hash(plainToken));
        if (found.isEmpty()) {
            LOG.warn("Refresh token not found by hash");
            return Optional.empty();
        }

        RefreshToken token = found.get();
        if (!token.isValid()) {
            if (token.revoked) {
                LOG.warnf("Refresh token %s has been revoked (at %s)", token.id, token.revokedAt);
            } else {
                LOG.warnf("Refresh token %s has expired (at %s)", token.id, token.expiresAt);
            }
            return Optional.empty();
        }
        if (!SealedTokens.matches(encryption, PURPOSE, token.encryptedToken, plainToken, token.id)) {
            return Optional.empty();
        }

        Instant now = Instant.now();
        tokenRepo.touchUsedAt(token.id, now);
        token.usedAt = now;

        LOG.debugf("Refresh token %s validated for user %s", token.id, token.userId);
        return Optional.of(token);
    }

    /**
     * Revoke one token owned by the user. Revoking an already revoked token succeeds.
     *
     * @return true if the token exists for this user and is now revoked
     */
    @Transactional
    public boolean revoke(String plainToken, String userId) {
        if (plainToken == null || plainToken.isBlank() || userId == null) {
            return false;
        }

        Optional<RefreshToken> found = tokenRepo.findByTokenHashAndUserId(SealedTokens.hash(plainToken), userId);
        if (found.isEmpty()) {
            return false;
        }

        RefreshToken token = found.get();
        if (token.revoked) {
            return true;
        }

        tokenRepo.revoke(token.id, Instant.now());
        LOG.debugf("Refresh token %s revoked for user %s", token.id, userId);
        return true;
    }

    /**
     * Revoke every active token of a user in a tenant, e.g. on password change.
     *
     * @return number of tokens revoked; already revoked tokens are not counted
     */
    @Transactional
    public long revokeAll(String userId, String tenantId) {
        long count = tokenRepo.revokeAllForUser(userId, tenantId, Instant.now());
        LOG.infof("Revoked %d refresh tokens for user %s in tenant %s", count, userId, tenantId);
        return count;
    }

    /**
     * Delete tokens that expired before the cutoff.
     */
    @Transactional
    public long cleanupExpiredTokens(Instant before) {
        long deleted = tokenRepo.deleteExpired(before);
        if (deleted > 0) {
            LOG.infof("Deleted %d expired refresh tokens", deleted);
        }
        return deleted;
    }

    /**
     * Resolve the tenant's refresh token lifetime in days.
     * Missing, unparsable, out-of-range or unreadable settings give the default.
     */
    int resolveExpirationDays(String tenantId) {
        int defaultDays = config.refreshToken().defaultExpirationDays();
        Optional<String> setting;
        try {
            setting = tenantSettings.findValue(tenantId, TenantSettingsProvider.REFRESH_TOKEN_EXPIRATION_DAYS);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to read refresh token lifetime for tenant %s, using default %d days",
                tenantId, defaultDays);
            return defaultDays;
        }

        if (setting.isEmpty() || setting.get().isBlank()) {
            return defaultDays;
        }

        Integer days = parseDays(setting.get());
        if (days != null && days >= MIN_EXPIRATION_DAYS && days <= MAX_EXPIRATION_DAYS) {
            return days;
        }

        LOG.warnf("Invalid %s value '%s' for tenant %s, using default %d days",
            TenantSettingsProvider.REFRESH_TOKEN_EXPIRATION_DAYS, setting.get(), tenantId, defaultDays);
        return defaultDays;
    }

    private static Integer parseDays(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
