package tech.authcore.platform.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TokenGrantService.
 * Every collaborator is mocked; the grant flow order is what is under test.
 */
@ExtendWith(MockitoExtension.class)
class TokenGrantServiceTest {

    private static final String CLIENT_ID = "spa";
    private static final String REDIRECT_URI = "https://app.example.com/cb";

    @Mock
    OAuthClientService clientService;

    @Mock
    AuthorizationCodeService authorizationCodeService;

    @Mock
    RefreshTokenService refreshTokenService;

    @Mock
    MfaChallengeTokenService mfaChallengeTokenService;

    @Mock
    AccessTokenService accessTokenService;

    @Mock
    UserDirectory userDirectory;

    @InjectMocks
    TokenGrantService service;

    private static final TokenSubject ALICE = TokenSubject.builder()
        .userId("usr_1")
        .tenantId("ten_1")
        .email("alice@example.com")
        .build();

    private static AuthorizationCode redeemedCode() {
        AuthorizationCode code = new AuthorizationCode();
        code.id = "acd_1";
        code.userId = "usr_1";
        code.tenantId = "ten_1";
        code.clientId = CLIENT_ID;
        code.scope = "openid profile";
        code.used = true;
        return code;
    }

    private void userExists() {
        when(userDirectory.findUser("usr_1", "ten_1")).thenReturn(Optional.of(ALICE));
        when(userDirectory.findRoleNames("usr_1", "ten_1")).thenReturn(List.of("Admin"));
    }

    // ========================================
    // AUTHORIZATION CODE GRANT
    // ========================================

    @Test
    @DisplayName("exchangeAuthorizationCode should return access and refresh tokens for a valid code")
    void exchangeAuthorizationCode_shouldIssueTokens_whenCodeValid() {
        // Arrange
        when(clientService.authenticateClient(CLIENT_ID, null)).thenReturn(Optional.of(new OAuthClient()));
        when(authorizationCodeService.validateAndConsume("code-1", CLIENT_ID, REDIRECT_URI, "verifier"))
            .thenReturn(Optional.of(redeemedCode()));
        userExists();
        when(accessTokenService.generateToken(ALICE, List.of("Admin"), null, null, List.of("openid", "profile")))
            .thenReturn("access-jwt");
        when(accessTokenService.getExpirationMinutes()).thenReturn(15);

        // Act
        Optional<TokenResponse> response = service.exchangeAuthorizationCode(
            CLIENT_ID, null, "code-1", REDIRECT_URI, "verifier", "10.0.0.1", "JUnit");

        // Assert
        assertThat(response).isPresent();
        assertThat(response.get().accessToken()).isEqualTo("access-jwt");
        assertThat(response.get().tokenType()).isEqualTo("Bearer");
        assertThat(response.get().expiresIn()).isEqualTo(900);
        assertThat(response.get().scope()).isEqualTo("openid profile");
        assertThat(response.get().refreshToken()).hasSize(86);
        verify(refreshTokenService).issue(eq("usr_1"), eq("ten_1"), eq(response.get().refreshToken()),
            eq("10.0.0.1"), eq("JUnit"));
    }

    @Test
    @DisplayName("exchangeAuthorizationCode should not touch the code when client authentication fails")
    void exchangeAuthorizationCode_shouldFail_whenClientNotAuthenticated() {
        when(clientService.authenticateClient("backend", "wrong")).thenReturn(Optional.empty());

        Optional<TokenResponse> response = service.exchangeAuthorizationCode(
            "backend", "wrong", "code-1", REDIRECT_URI, null, null, null);

        assertThat(response).isEmpty();
        verifyNoInteractions(authorizationCodeService, refreshTokenService, accessTokenService);
    }

    @Test
    @DisplayName("exchangeAuthorizationCode should fail without minting when the code is rejected")
    void exchangeAuthorizationCode_shouldFail_whenCodeRejected() {
        when(clientService.authenticateClient(CLIENT_ID, null)).thenReturn(Optional.of(new OAuthClient()));
        when(authorizationCodeService.validateAndConsume(anyString(), anyString(), anyString(), any()))
            .thenReturn(Optional.empty());

        assertThat(service.exchangeAuthorizationCode(CLIENT_ID, null, "used-code", REDIRECT_URI, null, null, null))
            .isEmpty();
        verifyNoInteractions(refreshTokenService, accessTokenService, userDirectory);
    }

    @Test
    @DisplayName("exchangeAuthorizationCode should fail when the user no longer exists")
    void exchangeAuthorizationCode_shouldFail_whenUserMissing() {
        when(clientService.authenticateClient(CLIENT_ID, null)).thenReturn(Optional.of(new OAuthClient()));
        when(authorizationCodeService.validateAndConsume("code-1", CLIENT_ID, REDIRECT_URI, null))
            .thenReturn(Optional.of(redeemedCode()));
        when(userDirectory.findUser("usr_1", "ten_1")).thenReturn(Optional.empty());

        assertThat(service.exchangeAuthorizationCode(CLIENT_ID, null, "code-1", REDIRECT_URI, null, null, null))
            .isEmpty();
        verifyNoInteractions(refreshTokenService, accessTokenService);
    }

    // ========================================
    // REFRESH GRANT
    // ========================================

    @Test
    @DisplayName("refresh should mint a new access token and return the same refresh token")
    void refresh_shouldKeepRefreshToken() {
        RefreshToken stored = new RefreshToken();
        stored.id = "rtk_1";
        stored.userId = "usr_1";
        stored.tenantId = "ten_1";
        when(refreshTokenService.validate("refresh-1")).thenReturn(Optional.of(stored));
        userExists();
        when(accessTokenService.generateToken(eq(ALICE), eq(List.of("Admin")), isNull(), isNull(), isNull()))
            .thenReturn("access-jwt");
        when(accessTokenService.getExpirationMinutes()).thenReturn(15);

        Optional<TokenResponse> response = service.refresh("refresh-1");

        assertThat(response).isPresent();
        assertThat(response.get().refreshToken()).isEqualTo("refresh-1");
        assertThat(response.get().accessToken()).isEqualTo("access-jwt");
        verify(refreshTokenService, never()).issue(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("refresh should fail for a revoked or unknown token")
    void refresh_shouldFail_whenTokenInvalid() {
        when(refreshTokenService.validate("revoked")).thenReturn(Optional.empty());

        assertThat(service.refresh("revoked")).isEmpty();
        verifyNoInteractions(accessTokenService);
    }

    // ========================================
    // MFA
    // ========================================

    @Test
    @DisplayName("beginMfaChallenge should store and return a fresh challenge")
    void beginMfaChallenge_shouldIssueChallenge() {
        String challenge = service.beginMfaChallenge("usr_1", "ten_1", "10.0.0.1", "JUnit");

        assertThat(challenge).hasSize(86);
        verify(mfaChallengeTokenService).issue("usr_1", "ten_1", challenge, "10.0.0.1", "JUnit");
    }

    @Test
    @DisplayName("completeMfaChallenge should issue tokens for the challenged user")
    void completeMfaChallenge_shouldIssueTokens_whenChallengeValid() {
        MfaChallengeToken challenge = new MfaChallengeToken();
        challenge.userId = "usr_1";
        challenge.tenantId = "ten_1";
        when(mfaChallengeTokenService.validateAndConsume("challenge-1")).thenReturn(Optional.of(challenge));
        userExists();
        when(accessTokenService.generateToken(eq(ALICE), eq(List.of("Admin")), isNull(), isNull(), isNull()))
            .thenReturn("access-jwt");

        Optional<TokenResponse> response = service.completeMfaChallenge("challenge-1", null, null);

        assertThat(response).isPresent();
        assertThat(response.get().scope()).isNull();
        verify(refreshTokenService).issue(eq("usr_1"), eq("ten_1"), anyString(), isNull(), isNull());
    }

    @Test
    @DisplayName("completeMfaChallenge should fail for a consumed challenge")
    void completeMfaChallenge_shouldFail_whenChallengeConsumed() {
        when(mfaChallengeTokenService.validateAndConsume("challenge-1")).thenReturn(Optional.empty());

        assertThat(service.completeMfaChallenge("challenge-1", null, null)).isEmpty();
        verifyNoInteractions(accessTokenService, refreshTokenService);
    }
}
