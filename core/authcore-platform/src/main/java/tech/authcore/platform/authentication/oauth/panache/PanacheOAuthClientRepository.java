package tech.authcore.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authcore.platform.authentication.oauth.OAuthClient;
import tech.authcore.platform.authentication.oauth.OAuthClientRepository;
import tech.authcore.platform.authentication.oauth.entity.OAuthClientEntity;
import tech.authcore.platform.authentication.oauth.mapper.OAuthClientMapper;
import tech.authcore.platform.shared.EntityType;
import tech.authcore.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of OAuthClientRepository.
 */
@ApplicationScoped
public class PanacheOAuthClientRepository
    implements OAuthClientRepository, PanacheRepositoryBase<OAuthClientEntity, String> {

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        return find("clientId", clientId)
            .firstResultOptional()
            .map(OAuthClientMapper::toDomain);
    }

    @Override
    public boolean existsByClientId(String clientId) {
        return count("clientId", clientId) > 0;
    }

    @Override
    public List<OAuthClient> list(String tenantId, boolean includeInactive) {
        List<String> conditions = new ArrayList<>();
        Parameters params = new Parameters();
        if (tenantId != null) {
            conditions.add("tenantId = :tenantId");
            params.and("tenantId", tenantId);
        }
        if (!includeInactive) {
            conditions.add("active = true");
        }

        String query = conditions.isEmpty() ? "order by clientId" : String.join(" and ", conditions) + " order by clientId";
        return find(query, params).stream()
            .map(OAuthClientMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(OAuthClient client) {
        if (client.id == null) {
            client.id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        }
        if (client.createdAt == null) {
            client.createdAt = Instant.now();
        }
        persist(OAuthClientMapper.toEntity(client));
    }

    @Override
    public void update(OAuthClient client) {
        OAuthClientEntity entity = findById(client.id);
        if (entity != null) {
            client.updatedAt = Instant.now();
            OAuthClientMapper.updateEntity(entity, client);
        }
    }

    @Override
    public boolean deleteByClientId(String clientId) {
        // Entity delete so the redirect URI collection goes with it
        Optional<OAuthClientEntity> entity = find("clientId", clientId).firstResultOptional();
        entity.ifPresent(this::delete);
        return entity.isPresent();
    }
}
