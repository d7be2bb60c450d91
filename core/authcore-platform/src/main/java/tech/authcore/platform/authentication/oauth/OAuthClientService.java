package tech.authcore.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authcore.platform.common.Result;
import tech.authcore.platform.common.errors.UseCaseError;
import tech.authcore.platform.security.hashing.SecretHasher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OAuth client registry.
 *
 * Secrets are hashed with the {@link SecretHasher}; the plaintext is never stored.
 */
@ApplicationScoped
public class OAuthClientService {

    private static final Logger LOG = Logger.getLogger(OAuthClientService.class);

    @Inject
    OAuthClientRepository clientRepo;

    @Inject
    SecretHasher secretHasher;

    /**
     * Hash a client secret.
     *
     * @throws IllegalArgumentException if the secret is null or blank
     */
    public String hashClientSecret(String clientSecret) {
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("Client secret cannot be null or blank");
        }
        return secretHasher.hash(clientSecret);
    }

    /**
     * Verify a presented secret. Fails closed and never throws: public clients,
     * clients without a stored hash and blank secrets never verify.
     */
    public boolean verifyClientSecret(OAuthClient client, String clientSecret) {
        if (client == null || clientSecret == null || clientSecret.isBlank()) {
            return false;
        }
        if (client.isPublic() || client.clientSecretHash == null || client.clientSecretHash.isBlank()) {
            return false;
        }
        return secretHasher.verify(client.clientSecretHash, clientSecret);
    }

    @Transactional
    public Result<OAuthClient> createClient(CreateOAuthClientRequest request) {
        if (request.clientId() == null || request.clientId().isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                "CLIENT_ID_REQUIRED", "Client ID is required", Map.of()));
        }
        if (request.name() == null || request.name().isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                "NAME_REQUIRED", "Client name is required", Map.of("clientId", request.clientId())));
        }
        if (request.redirectUris() == null || request.redirectUris().isEmpty()) {
            return Result.failure(new UseCaseError.ValidationError(
                "REDIRECT_URIS_REQUIRED", "At least one redirect URI is required", Map.of("clientId", request.clientId())));
        }

        boolean hasSecret = request.clientSecret() != null && !request.clientSecret().isBlank();
        if (request.confidential() && !hasSecret) {
            LOG.warnf("OAuth client creation failed: confidential client '%s' requires a client secret", request.clientId());
            return Result.failure(new UseCaseError.ValidationError(
                "CLIENT_SECRET_REQUIRED", "Confidential clients require a client secret", Map.of("clientId", request.clientId())));
        }
        if (!request.confidential() && hasSecret) {
            LOG.warnf("OAuth client creation failed: public client '%s' cannot have a client secret", request.clientId());
            return Result.failure(new UseCaseError.BusinessRuleViolation(
                "SECRET_NOT_ALLOWED", "Public clients cannot have a client secret", Map.of("clientId", request.clientId())));
        }
        if (clientRepo.existsByClientId(request.clientId())) {
            LOG.warnf("OAuth client creation failed: client ID '%s' already exists", request.clientId());
            return Result.failure(new UseCaseError.BusinessRuleViolation(
                "CLIENT_ID_EXISTS", "Client ID already exists", Map.of("clientId", request.clientId())));
        }

        OAuthClient client = new OAuthClient();
        client.clientId = request.clientId();
        client.name = request.name();
        client.description = request.description();
        client.redirectUris = new ArrayList<>(request.redirectUris());
        client.clientType = request.confidential() ? OAuthClient.ClientType.CONFIDENTIAL : OAuthClient.ClientType.PUBLIC;
        client.tenantId = request.tenantId();
        client.active = true;

        if (request.confidential()) {
            client.clientSecretHash = hashClientSecret(request.clientSecret());
            // The stored hash must round-trip before the client is persisted
            if (!secretHasher.verify(client.clientSecretHash, request.clientSecret())) {
                throw new IllegalStateException("Client secret hash failed re-verification for " + request.clientId());
            }
        }

        clientRepo.persist(client);

        LOG.infof("OAuth client created: %s (confidential: %s)", client.clientId, client.isConfidential());
        return Result.success(client);
    }

    @Transactional
    public Result<OAuthClient> updateClient(String clientId, UpdateOAuthClientRequest request) {
        Optional<OAuthClient> found = clientRepo.findByClientId(clientId);
        if (found.isEmpty()) {
            LOG.warnf("OAuth client update failed: client ID '%s' not found", clientId);
            return Result.failure(new UseCaseError.NotFoundError(
                "CLIENT_NOT_FOUND", "OAuth client not found", Map.of("clientId", String.valueOf(clientId))));
        }

        OAuthClient client = found.get();
        boolean newSecret = request.newClientSecret() != null && !request.newClientSecret().isBlank();
        if (newSecret && !client.isConfidential()) {
            LOG.warnf("OAuth client update failed: cannot set secret for public client '%s'", clientId);
            return Result.failure(new UseCaseError.BusinessRuleViolation(
                "SECRET_NOT_ALLOWED", "Public clients cannot have a client secret", Map.of("clientId", clientId)));
        }

        if (request.name() != null && !request.name().isBlank()) {
            client.name = request.name();
        }
        if (request.description() != null) {
            client.description = request.description().isEmpty() ? null : request.description();
        }
        if (request.redirectUris() != null && !request.redirectUris().isEmpty()) {
            client.redirectUris = new ArrayList<>(request.redirectUris());
        }
        if (request.active() != null) {
            client.active = request.active();
        }
        if (newSecret) {
            client.clientSecretHash = hashClientSecret(request.newClientSecret());
        }

        clientRepo.update(client);

        LOG.infof("OAuth client updated: %s", clientId);
        return Result.success(client);
    }

    /**
     * @return true if the client existed and was deleted
     */
    @Transactional
    public boolean deleteClient(String clientId) {
        boolean deleted = clientRepo.deleteByClientId(clientId);
        if (deleted) {
            LOG.infof("OAuth client deleted: %s", clientId);
        } else {
            LOG.warnf("OAuth client deletion failed: client ID '%s' not found", clientId);
        }
        return deleted;
    }

    public Optional<OAuthClient> getClient(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        return clientRepo.findByClientId(clientId);
    }

    public List<OAuthClient> listClients(String tenantId, boolean includeInactive) {
        return clientRepo.list(tenantId, includeInactive);
    }

    /**
     * Authenticate a client at the token endpoint. The client must be active;
     * confidential clients must present their secret, public clients present none.
     *
     * @return the client, or empty if authentication fails
     */
    public Optional<OAuthClient> authenticateClient(String clientId, String clientSecret) {
        Optional<OAuthClient> found = getClient(clientId);
        if (found.isEmpty()) {
            LOG.warnf("Client authentication failed: unknown client '%s'", clientId);
            return Optional.empty();
        }

        OAuthClient client = found.get();
        if (!client.active) {
            LOG.warnf("Client authentication failed: client '%s' is inactive", clientId);
            return Optional.empty();
        }
        if (client.isConfidential() && !verifyClientSecret(client, clientSecret)) {
            LOG.warnf("Client authentication failed: invalid secret for client '%s'", clientId);
            return Optional.empty();
        }
        return Optional.of(client);
    }
}
