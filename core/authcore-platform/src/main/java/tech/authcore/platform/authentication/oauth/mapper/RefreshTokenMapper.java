package tech.authcore.platform.authentication.oauth.mapper;

import tech.authcore.platform.authentication.oauth.RefreshToken;
import tech.authcore.platform.authentication.oauth.entity.RefreshTokenEntity;

import java.time.Instant;

/**
 * Mapper for converting between RefreshToken domain model and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken domain = new RefreshToken();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.tenantId = entity.tenantId;
        domain.encryptedToken = entity.encryptedToken;
        domain.tokenHash = entity.tokenHash;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.revoked = entity.revoked;
        domain.revokedAt = entity.revokedAt;
        domain.usedAt = entity.usedAt;
        domain.issuedFromIpAddress = entity.issuedFromIpAddress;
        domain.issuedFromUserAgent = entity.issuedFromUserAgent;
        return domain;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.tenantId = domain.tenantId;
        entity.encryptedToken = domain.encryptedToken;
        entity.tokenHash = domain.tokenHash;
        entity.createdAt = domain.createdAt != null ? domain.createdAt : Instant.now();
        entity.expiresAt = domain.expiresAt;
        entity.revoked = domain.revoked;
        entity.revokedAt = domain.revokedAt;
        entity.usedAt = domain.usedAt;
        entity.issuedFromIpAddress = domain.issuedFromIpAddress;
        entity.issuedFromUserAgent = domain.issuedFromUserAgent;
        return entity;
    }
}
