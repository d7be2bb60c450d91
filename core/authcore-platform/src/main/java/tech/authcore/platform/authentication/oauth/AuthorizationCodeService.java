package tech.authcore.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.AuthConfig;
import tech.authcore.platform.security.encryption.AuthenticatedEncryptionProvider;
import tech.authcore.platform.security.encryption.SealedTokens;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues and redeems OAuth2 authorization codes.
 *
 * Codes are 32 random bytes (base64url, 43 characters) stored as a SHA-256
 * lookup hash plus a ciphertext. Redemption fails with an empty result for
 * every reason (unknown, used, expired, client or redirect mismatch, PKCE
 * failure). The specific reason is only logged.
 */
@ApplicationScoped
public class AuthorizationCodeService {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeService.class);

    static final String PURPOSE = "AuthorizationCode";
    private static final int CODE_BYTES = 32;

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    AuthenticatedEncryptionProvider encryption;

    @Inject
    PkceService pkceService;

    @Inject
    AuthConfig config;

    /**
     * Issue a new authorization code.
     *
     * @return the stored code with the plaintext {@code code} populated
     * @throws IllegalArgumentException if a required field is missing or the PKCE method is unknown
     */
    @Transactional
    public AuthorizationCode issue(AuthorizationCodeRequest request) {
        Objects.requireNonNull(request, "request");
        requireText(request.userId(), "userId");
        requireText(request.tenantId(), "tenantId");
        requireText(request.clientId(), "clientId");
        requireText(request.redirectUri(), "redirectUri");
        if (!pkceService.isSupportedMethod(request.codeChallengeMethod())) {
            throw new IllegalArgumentException(
                "Unsupported code_challenge_method: " + request.codeChallengeMethod());
        }

        String plainCode = SealedTokens.randomToken(CODE_BYTES);
        Instant now = Instant.now();

        AuthorizationCode authCode = new AuthorizationCode();
        authCode.codeHash = SealedTokens.hash(plainCode);
        authCode.encryptedCode = encryption.protect(PURPOSE, plainCode);
        authCode.userId = request.userId();
        authCode.tenantId = request.tenantId();
        authCode.clientId = request.clientId();
        authCode.redirectUri = request.redirectUri();
        authCode.scope = request.scope();
        authCode.state = request.state();
        authCode.codeChallenge = blankToNull(request.codeChallenge());
        authCode.codeChallengeMethod = authCode.codeChallenge != null
            ? blankToNull(request.codeChallengeMethod())
            : null;
        authCode.issuedFromIpAddress = request.ipAddress();
        authCode.issuedFromUserAgent = request.userAgent();
        authCode.createdAt = now;
        authCode.expiresAt = now.plus(config.authorizationCode().expiry());

        codeRepo.persist(authCode);
        authCode.code = plainCode;

        LOG.debugf("Issued authorization code %s for user %s, client %s (expires %s)",
            authCode.id, authCode.userId, authCode.clientId, authCode.expiresAt);
        return authCode;
    }

    /**
     * Validate an authorization code and consume it.
     *
     * @param code         plaintext code from the token request
     * @param clientId     client presenting the code
     * @param redirectUri  redirect URI from the token request, must match exactly
     * @param codeVerifier PKCE verifier, required when a challenge was recorded
     * @return the consumed code, or empty on any failure
     */
    @Transactional
    public Optional<AuthorizationCode> validateAndConsume(String code, String clientId,
                                                          String redirectUri, String codeVerifier) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }

        Optional<AuthorizationCode> found = codeRepo.findByCodeHash(SealedTokens.hash(code));
        if (found.isEmpty()) {
            LOG.warnf("Authorization code redemption failed: code not found (client %s)", clientId);
            return Optional.empty();
        }

        AuthorizationCode authCode = found.get();
        if (!authCode.isValid()) {
            if (authCode.used) {
                LOG.warnf("Authorization code %s redemption failed: already used at %s", authCode.id, authCode.usedAt);
            } else {
                LOG.warnf("Authorization code %s redemption failed: expired at %s", authCode.id, authCode.expiresAt);
            }
            return Optional.empty();
        }
        if (!authCode.clientId.equals(clientId)) {
            LOG.warnf("Authorization code %s redemption failed: client mismatch (expected %s, got %s)",
                authCode.id, authCode.clientId, clientId);
            return Optional.empty();
        }
        if (!authCode.redirectUri.equals(redirectUri)) {
            LOG.warnf("Authorization code %s redemption failed: redirect URI mismatch", authCode.id);
            return Optional.empty();
        }
        if (!SealedTokens.matches(encryption, PURPOSE, authCode.encryptedCode, code, authCode.id)) {
            return Optional.empty();
        }
        if (authCode.hasCodeChallenge()) {
            if (codeVerifier == null || codeVerifier.isEmpty()) {
                LOG.warnf("Authorization code %s redemption failed: code_verifier required", authCode.id);
                return Optional.empty();
            }
            if (!pkceService.verifyCodeChallenge(codeVerifier, authCode.codeChallenge, authCode.codeChallengeMethod)) {
                LOG.warnf("Authorization code %s redemption failed: PKCE verification failed (method %s)",
                    authCode.id, authCode.codeChallengeMethod);
                return Optional.empty();
            }
        }

        Instant now = Instant.now();
        if (!codeRepo.markAsUsed(authCode.id, now)) {
            LOG.warnf("Authorization code %s redemption failed: consumed by a concurrent request", authCode.id);
            return Optional.empty();
        }

        authCode.used = true;
        authCode.usedAt = now;
        authCode.code = code;
        LOG.infof("Authorization code %s redeemed by client %s for user %s", authCode.id, clientId, authCode.userId);
        return Optional.of(authCode);
    }

    /**
     * Delete codes that are past expiry or were used before the cutoff.
     *
     * @return number of codes deleted
     */
    @Transactional
    public long cleanupExpiredCodes(Instant before) {
        long deleted = codeRepo.deleteExpiredOrUsed(before);
        if (deleted > 0) {
            LOG.infof("Deleted %d expired or used authorization codes", deleted);
        }
        return deleted;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
