package tech.authcore.platform.principal;

import tech.authcore.platform.authentication.jwt.TokenSubject;

import java.util.List;
import java.util.Optional;

/**
 * Read access to users and their role names, owned by user management.
 */
public interface UserDirectory {

    /**
     * Find an active user within a tenant.
     */
    Optional<TokenSubject> findUser(String userId, String tenantId);

    List<String> findRoleNames(String userId, String tenantId);
}
