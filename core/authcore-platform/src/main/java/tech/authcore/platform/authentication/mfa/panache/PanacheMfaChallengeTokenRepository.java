package tech.authcore.platform.authentication.mfa.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authcore.platform.authentication.mfa.MfaChallengeToken;
import tech.authcore.platform.authentication.mfa.MfaChallengeTokenRepository;
import tech.authcore.platform.authentication.mfa.entity.MfaChallengeTokenEntity;
import tech.authcore.platform.authentication.mfa.mapper.MfaChallengeTokenMapper;
import tech.authcore.platform.shared.EntityType;
import tech.authcore.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of MfaChallengeTokenRepository.
 */
@ApplicationScoped
public class PanacheMfaChallengeTokenRepository
    implements MfaChallengeTokenRepository, PanacheRepositoryBase<MfaChallengeTokenEntity, String> {

    @Override
    public Optional<MfaChallengeToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(MfaChallengeTokenMapper::toDomain);
    }

    @Override
    public void persist(MfaChallengeToken token) {
        if (token.id == null) {
            token.id = TsidGenerator.generate(EntityType.MFA_CHALLENGE);
        }
        if (token.createdAt == null) {
            token.createdAt = Instant.now();
        }
        persist(MfaChallengeTokenMapper.toEntity(token));
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
