package tech.authcore.platform.authentication.jwt;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Claims of a decoded access token with typed accessors.
 * Accessors return null (or an empty list) when a claim is absent or has an unexpected type.
 */
public class DecodedAccessToken {

    private final JwtClaims claims;

    public DecodedAccessToken(JwtClaims claims) {
        this.claims = claims;
    }

    public JwtClaims claims() {
        return claims;
    }

    public String subject() {
        return stringClaim(AccessTokenClaims.SUBJECT);
    }

    public String jwtId() {
        return stringClaim(AccessTokenClaims.JWT_ID);
    }

    public String issuer() {
        return stringClaim("iss");
    }

    public List<String> audience() {
        try {
            return claims.getAudience();
        } catch (MalformedClaimException e) {
            return List.of();
        }
    }

    public String email() {
        return stringClaim(AccessTokenClaims.EMAIL);
    }

    public String userName() {
        return stringClaim(AccessTokenClaims.UNIQUE_NAME);
    }

    public String tenantId() {
        return stringClaim(AccessTokenClaims.TENANT_ID);
    }

    public String userId() {
        return stringClaim(AccessTokenClaims.USER_ID);
    }

    public String firstName() {
        return stringClaim(AccessTokenClaims.GIVEN_NAME);
    }

    public String lastName() {
        return stringClaim(AccessTokenClaims.FAMILY_NAME);
    }

    /**
     * Individual role claim entries.
     */
    public List<String> roleClaims() {
        return stringList(AccessTokenClaims.ROLE);
    }

    /**
     * The aggregate roles array.
     */
    public List<String> roles() {
        return stringList(AccessTokenClaims.ROLES);
    }

    public List<String> scopes() {
        String scope = stringClaim(AccessTokenClaims.SCOPE);
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return Arrays.asList(scope.trim().split("\\s+"));
    }

    public Instant issuedAt() {
        return instantClaim("iat");
    }

    public Instant expiresAt() {
        return instantClaim("exp");
    }

    /**
     * A token without exp never counts as expired.
     */
    public boolean isExpired() {
        Instant exp = expiresAt();
        return exp != null && !Instant.now().isBefore(exp);
    }

    private String stringClaim(String name) {
        Object value = claims.getClaimValue(name);
        return value instanceof String ? (String) value : null;
    }

    private List<String> stringList(String name) {
        Object value = claims.getClaimValue(name);
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (value instanceof Collection<?>) {
            return ((Collection<?>) value).stream()
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .toList();
        }
        return List.of();
    }

    private Instant instantClaim(String name) {
        try {
            NumericDate date = claims.getNumericDateClaimValue(name);
            return date != null ? Instant.ofEpochSecond(date.getValue()) : null;
        } catch (MalformedClaimException e) {
            return null;
        }
    }
}
