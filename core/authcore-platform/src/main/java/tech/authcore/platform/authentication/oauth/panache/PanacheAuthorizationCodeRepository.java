package tech.authcore.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authcore.platform.authentication.oauth.AuthorizationCode;
import tech.authcore.platform.authentication.oauth.AuthorizationCodeRepository;
import tech.authcore.platform.authentication.oauth.entity.AuthorizationCodeEntity;
import tech.authcore.platform.authentication.oauth.mapper.AuthorizationCodeMapper;
import tech.authcore.platform.shared.EntityType;
import tech.authcore.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 */
@ApplicationScoped
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findByCodeHash(String codeHash) {
        return find("codeHash", codeHash)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    public void persist(AuthorizationCode authCode) {
        if (authCode.id == null) {
            authCode.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        }
        if (authCode.createdAt == null) {
            authCode.createdAt = Instant.now();
        }
        AuthorizationCodeEntity entity = AuthorizationCodeMapper.toEntity(authCode);
        persist(entity);
    }

    @Override
    public boolean markAsUsed(String id, Instant usedAt) {
        return update("used = true, usedAt = ?1 where id = ?2 and used = false", usedAt, id) == 1;
    }

    @Override
    public long deleteExpiredOrUsed(Instant before) {
        return delete("expiresAt < ?1 or (used = true and usedAt < ?1)", before);
    }
}
