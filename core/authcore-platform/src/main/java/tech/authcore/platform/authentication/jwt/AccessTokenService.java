package tech.authcore.platform.authentication.jwt;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import tech.authcore.platform.authentication.AuthConfig;
import tech.authcore.platform.shared.EntityType;
import tech.authcore.platform.shared.TsidGenerator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mints and validates access tokens.
 *
 * Claim construction is algorithm-agnostic; signing is delegated to the
 * {@link TokenSigner} held by {@link SigningKeyService}.
 */
@ApplicationScoped
public class AccessTokenService {

    private static final Logger LOG = Logger.getLogger(AccessTokenService.class);

    @Inject
    SigningKeyService signingKeyService;

    @Inject
    AuthConfig config;

    /**
     * Generate an access token for the platform's own issuer and audience.
     */
    public String generateToken(TokenSubject subject, Collection<String> roles) {
        return generateToken(subject, roles, null, null, null);
    }

    /**
     * Generate an access token with an issuer/audience override, e.g. for a
     * federated console that verifies against the same key.
     *
     * @param issuerOverride   iss claim, null for the configured issuer
     * @param audienceOverride aud claim, null for the configured audience
     * @param scopes           emitted as a space-delimited scope claim when not empty
     */
    public String generateToken(TokenSubject subject, Collection<String> roles,
                                String issuerOverride, String audienceOverride,
                                Collection<String> scopes) {
        Objects.requireNonNull(subject, "subject");
        if (subject.userId() == null || subject.userId().isBlank()) {
            throw new IllegalArgumentException("Token subject must have a userId");
        }
        if (subject.tenantId() == null || subject.tenantId().isBlank()) {
            throw new IllegalArgumentException("Token subject must have a tenantId");
        }

        AuthConfig.JwtConfig jwt = config.jwt();
        Instant now = Instant.now();
        Instant expiresAt = now.plusSeconds(jwt.expirationMinutes() * 60L);

        JwtClaims claims = new JwtClaims();
        claims.setIssuer(issuerOverride != null ? issuerOverride : jwt.issuer());
        claims.setAudience(audienceOverride != null ? audienceOverride : jwt.audience());
        claims.setSubject(subject.userId());
        claims.setJwtId(TsidGenerator.generate(EntityType.ACCESS_TOKEN));
        claims.setIssuedAt(NumericDate.fromSeconds(now.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));

        claims.setClaim(AccessTokenClaims.EMAIL, subject.email() != null ? subject.email() : "");
        claims.setClaim(AccessTokenClaims.UNIQUE_NAME, subject.userName() != null ? subject.userName() : "");
        claims.setClaim(AccessTokenClaims.TENANT_ID, subject.tenantId());
        claims.setClaim(AccessTokenClaims.TENANT_ID_COMPAT, subject.tenantId());
        claims.setClaim(AccessTokenClaims.USER_ID, subject.userId());

        List<String> roleNames = roles == null ? List.of() : roles.stream()
            .filter(role -> role != null && !role.isBlank())
            .toList();
        if (!roleNames.isEmpty()) {
            claims.setStringListClaim(AccessTokenClaims.ROLE, roleNames);
            claims.setStringListClaim(AccessTokenClaims.ROLES, roleNames);
        }

        if (subject.firstName() != null && !subject.firstName().isEmpty()) {
            claims.setClaim(AccessTokenClaims.GIVEN_NAME, subject.firstName());
        }
        if (subject.lastName() != null && !subject.lastName().isEmpty()) {
            claims.setClaim(AccessTokenClaims.FAMILY_NAME, subject.lastName());
        }

        if (scopes != null) {
            String scope = String.join(" ", scopes.stream().filter(s -> s != null && !s.isBlank()).toList());
            if (!scope.isEmpty()) {
                claims.setClaim(AccessTokenClaims.SCOPE, scope);
            }
        }

        return signingKeyService.signer().sign(claims);
    }

    /**
     * Decode a token, optionally verifying it.
     *
     * With {@code validateSignature} the signature, issuer and audience are checked
     * against the configured values; expiry is not. Without it the payload is only
     * parsed, for callers that authenticated the bearer some other way.
     *
     * @return decoded claims, or empty on any structural, signature, issuer or audience failure
     */
    public Optional<DecodedAccessToken> validateAndDecode(String token, boolean validateSignature) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        if (!validateSignature) {
            return decodeWithoutVerification(token);
        }

        JwtClaims claims;
        try {
            claims = signingKeyService.signer().verify(token);
        } catch (TokenVerificationException e) {
            LOG.debugf("Access token rejected: %s", e.getMessage());
            return Optional.empty();
        }

        DecodedAccessToken decoded = new DecodedAccessToken(claims);
        AuthConfig.JwtConfig jwt = config.jwt();
        if (!jwt.issuer().equals(decoded.issuer())) {
            LOG.debugf("Access token rejected: issuer %s does not match", decoded.issuer());
            return Optional.empty();
        }
        if (!decoded.audience().contains(jwt.audience())) {
            LOG.debugf("Access token rejected: audience %s does not match", decoded.audience());
            return Optional.empty();
        }
        return Optional.of(decoded);
    }

    /**
     * Fully validate a token, distinguishing an expired but otherwise valid token.
     */
    public TokenValidationResult validateToken(String token) {
        Optional<DecodedAccessToken> decoded = validateAndDecode(token, true);
        if (decoded.isEmpty()) {
            return TokenValidationResult.invalid();
        }
        if (decoded.get().expiresAt() == null) {
            LOG.debug("Access token rejected: no exp claim");
            return TokenValidationResult.invalid();
        }
        if (decoded.get().isExpired()) {
            return new TokenValidationResult(TokenValidationResult.Status.EXPIRED, decoded.get());
        }
        return new TokenValidationResult(TokenValidationResult.Status.VALID, decoded.get());
    }

    /**
     * Public verification key as a JWK.
     */
    public Map<String, Object> exportPublicJwk() {
        return signingKeyService.signer().exportPublicJwk();
    }

    /**
     * Full key including private material, for operational backup only.
     * Callers must not expose this on an unauthenticated surface.
     */
    public Map<String, Object> exportFullJwk() {
        return signingKeyService.signer().exportFullJwk();
    }

    /**
     * JWKS document: {"keys":[publicJwk]}.
     */
    public Map<String, Object> getJwks() {
        return Map.of("keys", List.of(exportPublicJwk()));
    }

    public int getExpirationMinutes() {
        return config.jwt().expirationMinutes();
    }

    private Optional<DecodedAccessToken> decodeWithoutVerification(String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            LOG.debug("Access token rejected: expected 3 parts");
            return Optional.empty();
        }
        try {
            String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            return Optional.of(new DecodedAccessToken(JwtClaims.parse(payload)));
        } catch (InvalidJwtException | IllegalArgumentException e) {
            LOG.debugf("Access token payload could not be decoded: %s", e.getMessage());
            return Optional.empty();
        }
    }
}
