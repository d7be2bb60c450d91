package tech.authcore.platform.authentication.jwt;

/**
 * Claim names of issued access tokens. Downstream verifiers depend on these.
 */
public final class AccessTokenClaims {

    public static final String SUBJECT = "sub";
    public static final String JWT_ID = "jti";
    public static final String EMAIL = "email";
    public static final String UNIQUE_NAME = "unique_name";
    public static final String TENANT_ID = "tenant_id";
    public static final String TENANT_ID_COMPAT = "http://schemas.microsoft.com/identity/claims/tenantid";
    public static final String USER_ID = "user_id";
    public static final String ROLE = "role";
    public static final String ROLES = "roles";
    public static final String GIVEN_NAME = "given_name";
    public static final String FAMILY_NAME = "family_name";
    public static final String SCOPE = "scope";

    private AccessTokenClaims() {
    }
}
