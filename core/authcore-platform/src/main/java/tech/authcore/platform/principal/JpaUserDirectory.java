package tech.authcore.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.authcore.platform.authentication.jwt.TokenSubject;

import java.util.List;
import java.util.Optional;

/**
 * UserDirectory over the users, user_roles and roles tables.
 * Uses native SQL since those tables are not mapped by this module.
 */
@ApplicationScoped
public class JpaUserDirectory implements UserDirectory {

    @Inject
    EntityManager em;

    @Override
    public Optional<TokenSubject> findUser(String userId, String tenantId) {
        @SuppressWarnings("unchecked")
        List<Object[]> rows = em.createNativeQuery(
                "SELECT u.id, u.tenant_id, u.email, u.user_name, u.first_name, u.last_name " +
                "FROM users u WHERE u.id = :userId AND u.tenant_id = :tenantId AND u.is_active = true")
            .setParameter("userId", userId)
            .setParameter("tenantId", tenantId)
            .getResultList();
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        Object[] row = rows.get(0);
        return Optional.of(TokenSubject.builder()
            .userId(asString(row[0]))
            .tenantId(asString(row[1]))
            .email(asString(row[2]))
            .userName(asString(row[3]))
            .firstName(asString(row[4]))
            .lastName(asString(row[5]))
            .build());
    }

    @Override
    public List<String> findRoleNames(String userId, String tenantId) {
        @SuppressWarnings("unchecked")
        List<Object> names = em.createNativeQuery(
                "SELECT r.name FROM roles r " +
                "JOIN user_roles ur ON ur.role_id = r.id " +
                "WHERE ur.user_id = :userId AND r.tenant_id = :tenantId " +
                "ORDER BY r.name")
            .setParameter("userId", userId)
            .setParameter("tenantId", tenantId)
            .getResultList();
        return names.stream().map(JpaUserDirectory::asString).toList();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
