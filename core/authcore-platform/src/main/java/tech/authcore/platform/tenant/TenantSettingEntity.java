package tech.authcore.platform.tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for tenant_settings table. Read-only from this module.
 */
@Entity
@Table(name = "tenant_settings", uniqueConstraints = {
    @UniqueConstraint(name = "uk_tenant_settings_tenant_key", columnNames = {"tenant_id", "setting_key"})
})
public class TenantSettingEntity {

    @Id
    @Column(name = "id", length = 64)
    public String id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    public String tenantId;

    @Column(name = "setting_key", nullable = false, length = 200)
    public String settingKey;

    @Column(name = "setting_value", length = 2000)
    public String settingValue;

    @Column(name = "updated_at")
    public Instant updatedAt;

    public TenantSettingEntity() {
    }
}
