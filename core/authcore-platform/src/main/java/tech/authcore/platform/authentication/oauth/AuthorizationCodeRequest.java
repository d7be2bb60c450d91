package tech.authcore.platform.authentication.oauth;

import lombok.Builder;

/**
 * Inputs for issuing an authorization code.
 */
@Builder
public record AuthorizationCodeRequest(
    String userId,
    String tenantId,
    String clientId,
    String redirectUri,

    /** Requested scopes, space-delimited (optional) */
    String scope,

    /** Client state echoed back on redirect (optional) */
    String state,

    /** PKCE challenge (optional) */
    String codeChallenge,

    /** PKCE method, S256 or plain (optional, blank means plain) */
    String codeChallengeMethod,

    String ipAddress,
    String userAgent
) {
}
