package tech.authcore.platform.authentication.oauth;

import lombok.Builder;

import java.util.List;

/**
 * Registration data for a new OAuth client.
 */
@Builder
public record CreateOAuthClientRequest(
    String clientId,

    /** Required for confidential clients, must be absent for public ones */
    String clientSecret,

    String name,
    String description,
    List<String> redirectUris,
    boolean confidential,

    /** Null registers a global client */
    String tenantId
) {
}
