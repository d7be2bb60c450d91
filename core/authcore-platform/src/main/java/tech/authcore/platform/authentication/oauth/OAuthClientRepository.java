package tech.authcore.platform.authentication.oauth;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for OAuthClient entities.
 */
public interface OAuthClientRepository {

    // Read operations
    Optional<OAuthClient> findByClientId(String clientId);
    boolean existsByClientId(String clientId);

    /**
     * @param tenantId        restrict to this tenant, or null for every client
     * @param includeInactive include deactivated clients
     */
    List<OAuthClient> list(String tenantId, boolean includeInactive);

    // Write operations
    void persist(OAuthClient client);
    void update(OAuthClient client);
    boolean deleteByClientId(String clientId);
}
