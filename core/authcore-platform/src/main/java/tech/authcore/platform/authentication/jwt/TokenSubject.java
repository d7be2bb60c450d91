package tech.authcore.platform.authentication.jwt;

import lombok.Builder;

/**
 * Identity an access token is minted for.
 */
@Builder
public record TokenSubject(
    String userId,
    String tenantId,

    /** Emitted as an empty string when null */
    String email,

    /** Emitted as unique_name, empty string when null */
    String userName,

    /** given_name, omitted when empty */
    String firstName,

    /** family_name, omitted when empty */
    String lastName
) {
}
