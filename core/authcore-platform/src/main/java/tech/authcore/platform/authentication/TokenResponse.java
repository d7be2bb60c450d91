package tech.authcore.platform.authentication;

/**
 * Tokens handed to a client after a successful grant.
 *
 * @param expiresIn access token lifetime in seconds
 * @param scope     granted scopes, space-delimited, may be null
 */
public record TokenResponse(
    String accessToken,
    String tokenType,
    long expiresIn,
    String refreshToken,
    String scope
) {
    public static final String BEARER = "Bearer";
}
