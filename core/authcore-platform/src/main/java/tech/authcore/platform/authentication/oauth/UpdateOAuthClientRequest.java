package tech.authcore.platform.authentication.oauth;

import lombok.Builder;

import java.util.List;

/**
 * Partial update of an OAuth client. Null fields are left unchanged;
 * an empty description clears it.
 */
@Builder
public record UpdateOAuthClientRequest(
    String name,
    String description,
    List<String> redirectUris,
    Boolean active,

    /** Replaces the secret of a confidential client */
    String newClientSecret
) {
}
