package tech.authcore.platform.authentication.oauth.mapper;

import tech.authcore.platform.authentication.oauth.OAuthClient;
import tech.authcore.platform.authentication.oauth.entity.OAuthClientEntity;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Mapper for converting between OAuthClient domain model and JPA entity.
 */
public final class OAuthClientMapper {

    private OAuthClientMapper() {
    }

    public static OAuthClient toDomain(OAuthClientEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthClient domain = new OAuthClient();
        domain.id = entity.id;
        domain.clientId = entity.clientId;
        domain.name = entity.name;
        domain.description = entity.description;
        domain.clientType = entity.clientType;
        domain.clientSecretHash = entity.clientSecretHash;
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.active = entity.active;
        domain.tenantId = entity.tenantId;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static OAuthClientEntity toEntity(OAuthClient domain) {
        if (domain == null) {
            return null;
        }

        OAuthClientEntity entity = new OAuthClientEntity();
        entity.id = domain.id;
        entity.clientId = domain.clientId;
        entity.createdAt = domain.createdAt != null ? domain.createdAt : Instant.now();
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(OAuthClientEntity entity, OAuthClient domain) {
        entity.name = domain.name;
        entity.description = domain.description;
        entity.clientType = domain.clientType;
        entity.clientSecretHash = domain.clientSecretHash;
        entity.redirectUris = domain.redirectUris != null ? new ArrayList<>(domain.redirectUris) : new ArrayList<>();
        entity.active = domain.active;
        entity.tenantId = domain.tenantId;
        entity.updatedAt = domain.updatedAt;
    }
}
