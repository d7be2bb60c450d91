package tech.authcore.platform.tenant;

import java.util.Optional;

/**
 * Read access to per-tenant key/value settings owned by tenant management.
 */
public interface TenantSettingsProvider {

    /**
     * Setting key holding a tenant's refresh token lifetime in days.
     */
    String REFRESH_TOKEN_EXPIRATION_DAYS = "RefreshToken.ExpirationDays";

    Optional<String> findValue(String tenantId, String key);
}
