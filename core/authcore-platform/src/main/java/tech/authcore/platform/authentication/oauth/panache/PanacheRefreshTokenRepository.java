package tech.authcore.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authcore.platform.authentication.oauth.RefreshToken;
import tech.authcore.platform.authentication.oauth.RefreshTokenRepository;
import tech.authcore.platform.authentication.oauth.entity.RefreshTokenEntity;
import tech.authcore.platform.authentication.oauth.mapper.RefreshTokenMapper;
import tech.authcore.platform.shared.EntityType;
import tech.authcore.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public Optional<RefreshToken> findByTokenHashAndUserId(String tokenHash, String userId) {
        return find("tokenHash = ?1 and userId = ?2", tokenHash, userId)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public void persist(RefreshToken token) {
        if (token.id == null) {
            token.id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);
        }
        if (token.createdAt == null) {
            token.createdAt = Instant.now();
        }
        RefreshTokenEntity entity = RefreshTokenMapper.toEntity(token);
        persist(entity);
    }

    @Override
    public void touchUsedAt(String id, Instant usedAt) {
        update("usedAt = ?1 where id = ?2", usedAt, id);
    }

    @Override
    public void revoke(String id, Instant revokedAt) {
        update("revoked = true, revokedAt = ?1 where id = ?2 and revoked = false", revokedAt, id);
    }

    @Override
    public long revokeAllForUser(String userId, String tenantId, Instant revokedAt) {
        return update("revoked = true, revokedAt = ?1 where userId = ?2 and tenantId = ?3 and revoked = false",
            revokedAt, userId, tenantId);
    }

    @Override
    public long deleteExpired(Instant before) {
        return delete("expiresAt < ?1", before);
    }
}
