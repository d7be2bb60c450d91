package tech.authcore.platform.tenant;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import java.util.Optional;

/**
 * Panache-based implementation of TenantSettingsProvider.
 *
 * Lookups run in their own transaction so a failed read never marks the
 * caller's transaction rollback-only; callers may fall back to defaults.
 */
@ApplicationScoped
public class PanacheTenantSettingsProvider
    implements TenantSettingsProvider, PanacheRepositoryBase<TenantSettingEntity, String> {

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<String> findValue(String tenantId, String key) {
        return find("tenantId = ?1 and settingKey = ?2", tenantId, key)
            .firstResultOptional()
            .map(setting -> setting.settingValue);
    }
}
