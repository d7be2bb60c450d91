package tech.authcore.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.jwt.AccessTokenService;
import tech.authcore.platform.authentication.jwt.TokenSubject;
import tech.authcore.platform.authentication.mfa.MfaChallengeToken;
import tech.authcore.platform.authentication.mfa.MfaChallengeTokenService;
import tech.authcore.platform.authentication.oauth.AuthorizationCode;
import tech.authcore.platform.authentication.oauth.AuthorizationCodeService;
import tech.authcore.platform.authentication.oauth.OAuthClient;
import tech.authcore.platform.authentication.oauth.OAuthClientService;
import tech.authcore.platform.authentication.oauth.RefreshToken;
import tech.authcore.platform.authentication.oauth.RefreshTokenService;
import tech.authcore.platform.principal.UserDirectory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Composes client authentication, code redemption, MFA challenges and token
 * minting into the grants a token endpoint exposes.
 *
 * Every grant returns empty on failure; the reason is logged by the
 * component that rejected it.
 */
@ApplicationScoped
public class TokenGrantService {

    private static final Logger LOG = Logger.getLogger(TokenGrantService.class);

    @Inject
    OAuthClientService clientService;

    @Inject
    AuthorizationCodeService authorizationCodeService;

    @Inject
    RefreshTokenService refreshTokenService;

    @Inject
    MfaChallengeTokenService mfaChallengeTokenService;

    @Inject
    AccessTokenService accessTokenService;

    @Inject
    UserDirectory userDirectory;

    /**
     * authorization_code grant.
     */
    @Transactional
    public Optional<TokenResponse> exchangeAuthorizationCode(String clientId, String clientSecret, String code,
                                                             String redirectUri, String codeVerifier,
                                                             String ipAddress, String userAgent) {
        Optional<OAuthClient> client = clientService.authenticateClient(clientId, clientSecret);
        if (client.isEmpty()) {
            return Optional.empty();
        }

        Optional<AuthorizationCode> redeemed =
            authorizationCodeService.validateAndConsume(code, clientId, redirectUri, codeVerifier);
        if (redeemed.isEmpty()) {
            return Optional.empty();
        }

        AuthorizationCode authCode = redeemed.get();
        return issueTokens(authCode.userId, authCode.tenantId, authCode.scope, ipAddress, userAgent);
    }

    /**
     * refresh_token grant. The presented refresh token stays valid and is returned unchanged.
     */
    @Transactional
    public Optional<TokenResponse> refresh(String refreshToken) {
        Optional<RefreshToken> validated = refreshTokenService.validate(refreshToken);
        if (validated.isEmpty()) {
            return Optional.empty();
        }

        RefreshToken token = validated.get();
        Optional<String> accessToken = mintAccessToken(token.userId, token.tenantId, null);
        return accessToken.map(value -> new TokenResponse(
            value, TokenResponse.BEARER, expiresInSeconds(), refreshToken, null));
    }

    /**
     * Start step-up authentication for a user whose password was verified.
     *
     * @return the plaintext challenge to hand to the client
     */
    @Transactional
    public String beginMfaChallenge(String userId, String tenantId, String ipAddress, String userAgent) {
        String challenge = MfaChallengeTokenService.generateChallengeToken();
        mfaChallengeTokenService.issue(userId, tenantId, challenge, ipAddress, userAgent);
        return challenge;
    }

    /**
     * Finish step-up authentication. The caller verifies the second factor
     * before calling this; the challenge is consumed either way.
     */
    @Transactional
    public Optional<TokenResponse> completeMfaChallenge(String challengeToken, String ipAddress, String userAgent) {
        Optional<MfaChallengeToken> consumed = mfaChallengeTokenService.validateAndConsume(challengeToken);
        if (consumed.isEmpty()) {
            return Optional.empty();
        }
        MfaChallengeToken challenge = consumed.get();
        return issueTokens(challenge.userId, challenge.tenantId, null, ipAddress, userAgent);
    }

    /**
     * Mint an access token and a new refresh token for an authenticated user.
     *
     * @return empty if the user does not exist or is inactive in the tenant
     */
    @Transactional
    public Optional<TokenResponse> issueTokens(String userId, String tenantId, String scope,
                                               String ipAddress, String userAgent) {
        Optional<String> accessToken = mintAccessToken(userId, tenantId, scope);
        if (accessToken.isEmpty()) {
            return Optional.empty();
        }

        String refreshToken = RefreshTokenService.generateRefreshToken();
        refreshTokenService.issue(userId, tenantId, refreshToken, ipAddress, userAgent);

        LOG.debugf("Issued tokens for user %s in tenant %s", userId, tenantId);
        return Optional.of(new TokenResponse(
            accessToken.get(), TokenResponse.BEARER, expiresInSeconds(), refreshToken, scope));
    }

    private Optional<String> mintAccessToken(String userId, String tenantId, String scope) {
        Optional<TokenSubject> subject = userDirectory.findUser(userId, tenantId);
        if (subject.isEmpty()) {
            LOG.warnf("Token issuance refused: user %s not found or inactive in tenant %s", userId, tenantId);
            return Optional.empty();
        }

        List<String> roles = userDirectory.findRoleNames(userId, tenantId);
        List<String> scopes = scope == null || scope.isBlank() ? null : Arrays.asList(scope.trim().split("\\s+"));
        return Optional.of(accessTokenService.generateToken(subject.get(), roles, null, null, scopes));
    }

    private long expiresInSeconds() {
        return accessTokenService.getExpirationMinutes() * 60L;
    }
}
