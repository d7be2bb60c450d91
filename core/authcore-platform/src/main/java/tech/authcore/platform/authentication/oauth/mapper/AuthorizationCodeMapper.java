package tech.authcore.platform.authentication.oauth.mapper;

import tech.authcore.platform.authentication.oauth.AuthorizationCode;
import tech.authcore.platform.authentication.oauth.entity.AuthorizationCodeEntity;

import java.time.Instant;

/**
 * Mapper for converting between AuthorizationCode domain model and JPA entity.
 * The plaintext code never crosses into the entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.id = entity.id;
        domain.codeHash = entity.codeHash;
        domain.encryptedCode = entity.encryptedCode;
        domain.userId = entity.userId;
        domain.tenantId = entity.tenantId;
        domain.clientId = entity.clientId;
        domain.redirectUri = entity.redirectUri;
        domain.scope = entity.scope;
        domain.state = entity.state;
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.issuedFromIpAddress = entity.issuedFromIpAddress;
        domain.issuedFromUserAgent = entity.issuedFromUserAgent;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.used = entity.used;
        domain.usedAt = entity.usedAt;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.id = domain.id;
        entity.codeHash = domain.codeHash;
        entity.encryptedCode = domain.encryptedCode;
        entity.userId = domain.userId;
        entity.tenantId = domain.tenantId;
        entity.clientId = domain.clientId;
        entity.redirectUri = domain.redirectUri;
        entity.scope = domain.scope;
        entity.state = domain.state;
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.issuedFromIpAddress = domain.issuedFromIpAddress;
        entity.issuedFromUserAgent = domain.issuedFromUserAgent;
        entity.createdAt = domain.createdAt != null ? domain.createdAt : Instant.now();
        entity.expiresAt = domain.expiresAt;
        entity.used = domain.used;
        entity.usedAt = domain.usedAt;
        return entity;
    }
}
