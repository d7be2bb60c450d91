package tech.authcore.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Registered OAuth client.
 *
 * Confidential clients always carry a secret hash; public clients never do.
 */
public class OAuthClient {

    public String id;

    /**
     * Caller-chosen client identifier, unique across the registry.
     */
    public String clientId;

    public String name;

    public String description;

    public ClientType clientType = ClientType.PUBLIC;

    /**
     * Argon2id hash of the client secret. Null for public clients.
     */
    public String clientSecretHash;

    /**
     * Exact-match redirect URIs.
     */
    public List<String> redirectUris = new ArrayList<>();

    public boolean active = true;

    /**
     * Owning tenant, null for a global client.
     */
    public String tenantId;

    public Instant createdAt = Instant.now();

    public Instant updatedAt;

    public OAuthClient() {
    }

    public boolean isRedirectUriAllowed(String uri) {
        if (redirectUris == null || uri == null) {
            return false;
        }
        return redirectUris.contains(uri);
    }

    public boolean isPublic() {
        return clientType == ClientType.PUBLIC;
    }

    public boolean isConfidential() {
        return clientType == ClientType.CONFIDENTIAL;
    }

    public enum ClientType {
        /**
         * Cannot keep a secret (SPA, mobile, CLI). Relies on PKCE.
         */
        PUBLIC,

        /**
         * Authenticates with a client secret.
         */
        CONFIDENTIAL
    }
}
