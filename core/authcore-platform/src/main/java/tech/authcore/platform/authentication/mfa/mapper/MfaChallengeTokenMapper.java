package tech.authcore.platform.authentication.mfa.mapper;

import tech.authcore.platform.authentication.mfa.MfaChallengeToken;
import tech.authcore.platform.authentication.mfa.entity.MfaChallengeTokenEntity;

import java.time.Instant;

/**
 * Mapper for converting between MfaChallengeToken domain model and JPA entity.
 */
public final class MfaChallengeTokenMapper {

    private MfaChallengeTokenMapper() {
    }

    public static MfaChallengeToken toDomain(MfaChallengeTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        MfaChallengeToken domain = new MfaChallengeToken();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.tenantId = entity.tenantId;
        domain.encryptedToken = entity.encryptedToken;
        domain.tokenHash = entity.tokenHash;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.used = entity.used;
        domain.usedAt = entity.usedAt;
        domain.issuedFromIpAddress = entity.issuedFromIpAddress;
        domain.issuedFromUserAgent = entity.issuedFromUserAgent;
        return domain;
    }

    public static MfaChallengeTokenEntity toEntity(MfaChallengeToken domain) {
        if (domain == null) {
            return null;
        }

        MfaChallengeTokenEntity entity = new MfaChallengeTokenEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.tenantId = domain.tenantId;
        entity.encryptedToken = domain.encryptedToken;
        entity.tokenHash = domain.tokenHash;
        entity.createdAt = domain.createdAt != null ? domain.createdAt : Instant.now();
        entity.expiresAt = domain.expiresAt;
        entity.used = domain.used;
        entity.usedAt = domain.usedAt;
        entity.issuedFromIpAddress = domain.issuedFromIpAddress;
        entity.issuedFromUserAgent = domain.issuedFromUserAgent;
        return entity;
    }
}
