package tech.authcore.platform.authentication.jwt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.authcore.platform.test.TestAuthConfig;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AccessTokenService, run against both signing algorithms.
 */
class AccessTokenServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TestAuthConfig config = new TestAuthConfig();

    private AccessTokenService serviceWith(TokenSigner signer) {
        AccessTokenService service = new AccessTokenService();
        service.signingKeyService = new SigningKeyService(signer);
        service.config = config;
        return service;
    }

    private static TokenSubject alice() {
        return TokenSubject.builder()
            .userId("usr_1")
            .tenantId("ten_1")
            .email("alice@example.com")
            .userName("alice")
            .firstName("Alice")
            .lastName("")
            .build();
    }

    private static JsonNode decodePart(String token, int index) throws Exception {
        return MAPPER.readTree(Base64.getUrlDecoder().decode(token.split("\\.")[index]));
    }

    // ========================================
    // GENERATION
    // ========================================

    @Test
    @DisplayName("an RS256 token should carry identity, tenant and role claims and validate")
    void generateToken_shouldValidate_whenSignedWithRsa() throws Exception {
        AccessTokenService service = serviceWith(RsaTokenSigner.generate("rsa-1"));

        String token = service.generateToken(alice(), List.of("Admin", "User"));
        TokenValidationResult result = service.validateToken(token);

        assertThat(result.status()).isEqualTo(TokenValidationResult.Status.VALID);
        DecodedAccessToken decoded = result.token();
        assertThat(decoded.subject()).isEqualTo("usr_1");
        assertThat(decoded.tenantId()).isEqualTo("ten_1");
        assertThat(decoded.userId()).isEqualTo("usr_1");
        assertThat(decoded.email()).isEqualTo("alice@example.com");
        assertThat(decoded.userName()).isEqualTo("alice");
        assertThat(decoded.firstName()).isEqualTo("Alice");
        assertThat(decoded.lastName()).isNull();
        assertThat(decoded.roles()).containsExactly("Admin", "User");
        assertThat(decoded.roleClaims()).containsExactly("Admin", "User");
        assertThat(decoded.jwtId()).hasSize(13).doesNotContain("_");
        assertThat(Duration.between(decoded.issuedAt(), decoded.expiresAt())).isEqualTo(Duration.ofMinutes(15));

        JsonNode header = decodePart(token, 0);
        assertThat(header.path("alg").asText()).isEqualTo("RS256");
        assertThat(header.path("kid").asText()).isEqualTo("rsa-1");
    }

    @Test
    @DisplayName("an ML-DSA-65 token should validate and name its algorithm and key id")
    void generateToken_shouldValidate_whenSignedWithMlDsa() throws Exception {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));

        String token = service.generateToken(alice(), List.of("Admin", "User"));
        TokenValidationResult result = service.validateToken(token);

        assertThat(result.isValid()).isTrue();
        assertThat(result.token().roles()).containsExactly("Admin", "User");
        assertThat(result.token().issuer()).isEqualTo("authcore");
        assertThat(result.token().audience()).containsExactly("authcore-api");

        JsonNode header = decodePart(token, 0);
        assertThat(header.path("alg").asText()).isEqualTo("ML-DSA-65");
        assertThat(header.path("typ").asText()).isEqualTo("JWT");
        assertThat(header.path("kid").asText()).isEqualTo("pq-1");

        JsonNode payload = decodePart(token, 1);
        assertThat(payload.path("roles").isArray()).isTrue();
        assertThat(payload.path("http://schemas.microsoft.com/identity/claims/tenantid").asText()).isEqualTo("ten_1");
    }

    @Test
    @DisplayName("generateToken should drop blank roles and omit role claims when none remain")
    void generateToken_shouldOmitRoles_whenAllBlank() throws Exception {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));

        String token = service.generateToken(alice(), java.util.Arrays.asList(" ", null, ""));
        JsonNode payload = decodePart(token, 1);

        assertThat(payload.has("role")).isFalse();
        assertThat(payload.has("roles")).isFalse();
        assertThat(payload.path("email").asText()).isEqualTo("alice@example.com");
    }

    @Test
    @DisplayName("generateToken should emit empty strings for a missing email and user name")
    void generateToken_shouldEmitEmptyStrings_whenEmailMissing() throws Exception {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));
        TokenSubject subject = TokenSubject.builder().userId("usr_2").tenantId("ten_1").build();

        JsonNode payload = decodePart(service.generateToken(subject, List.of()), 1);

        assertThat(payload.path("email").asText()).isEmpty();
        assertThat(payload.path("unique_name").asText()).isEmpty();
        assertThat(payload.has("given_name")).isFalse();
    }

    @Test
    @DisplayName("generateToken should write scopes as one space-delimited claim")
    void generateToken_shouldJoinScopes() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));

        String token = service.generateToken(alice(), List.of(), null, null, List.of("openid", "profile"));

        assertThat(service.validateAndDecode(token, true).orElseThrow().scopes())
            .containsExactly("openid", "profile");
    }

    @Test
    @DisplayName("generateToken should require a tenant")
    void generateToken_shouldThrow_whenTenantMissing() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));
        TokenSubject subject = TokenSubject.builder().userId("usr_1").build();

        assertThatThrownBy(() -> service.generateToken(subject, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tenantId");
    }

    // ========================================
    // VALIDATION
    // ========================================

    @Test
    @DisplayName("validateToken should report an expired but well-signed token as EXPIRED")
    void validateToken_shouldReturnExpired_whenPastExpiry() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));
        config.expirationMinutes = -1;

        TokenValidationResult result = service.validateToken(service.generateToken(alice(), List.of()));

        assertThat(result.status()).isEqualTo(TokenValidationResult.Status.EXPIRED);
        assertThat(result.token().subject()).isEqualTo("usr_1");
    }

    @Test
    @DisplayName("validateToken should reject a modified payload")
    void validateToken_shouldReturnInvalid_whenPayloadTampered() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));
        String[] parts = service.generateToken(alice(), List.of("User")).split("\\.");
        String forged = Base64.getUrlEncoder().withoutPadding().encodeToString(
            "{\"sub\":\"usr_1\",\"iss\":\"authcore\",\"aud\":\"authcore-api\",\"roles\":[\"Admin\"],\"exp\":9999999999}"
                .getBytes(StandardCharsets.UTF_8));

        TokenValidationResult result = service.validateToken(parts[0] + "." + forged + "." + parts[2]);

        assertThat(result.status()).isEqualTo(TokenValidationResult.Status.INVALID);
        assertThat(result.token()).isNull();
    }

    @Test
    @DisplayName("validateAndDecode should reject tokens for another issuer or audience")
    void validateAndDecode_shouldReject_whenIssuerOrAudienceDiffers() {
        AccessTokenService service = serviceWith(RsaTokenSigner.generate("rsa-1"));

        String otherIssuer = service.generateToken(alice(), List.of(), "https://elsewhere", null, null);
        String otherAudience = service.generateToken(alice(), List.of(), null, "other-api", null);

        assertThat(service.validateAndDecode(otherIssuer, true)).isEmpty();
        assertThat(service.validateAndDecode(otherAudience, true)).isEmpty();
        assertThat(service.validateToken(otherIssuer).status()).isEqualTo(TokenValidationResult.Status.INVALID);
    }

    @Test
    @DisplayName("validateAndDecode without signature check should decode a token from another key")
    void validateAndDecode_shouldDecode_whenSignatureCheckSkipped() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));
        AccessTokenService foreign = serviceWith(MlDsaTokenSigner.generate("pq-2"));
        String token = foreign.generateToken(alice(), List.of("User"));

        assertThat(service.validateAndDecode(token, true)).isEmpty();
        Optional<DecodedAccessToken> decoded = service.validateAndDecode(token, false);
        assertThat(decoded).isPresent();
        assertThat(decoded.get().roles()).containsExactly("User");
    }

    @Test
    @DisplayName("validateToken should reject garbage")
    void validateToken_shouldReturnInvalid_whenMalformed() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));

        assertThat(service.validateToken("not.a.jwt").status()).isEqualTo(TokenValidationResult.Status.INVALID);
        assertThat(service.validateToken("").status()).isEqualTo(TokenValidationResult.Status.INVALID);
        assertThat(service.validateAndDecode("abc", false)).isEmpty();
    }

    // ========================================
    // KEY EXPORT
    // ========================================

    @Test
    @DisplayName("getJwks should publish only the public ML-DSA key")
    @SuppressWarnings("unchecked")
    void getJwks_shouldExposePublicKeyOnly_whenMlDsa() {
        AccessTokenService service = serviceWith(MlDsaTokenSigner.generate("pq-1"));

        List<Map<String, Object>> keys = (List<Map<String, Object>>) service.getJwks().get("keys");

        assertThat(keys).hasSize(1);
        assertThat(keys.get(0))
            .containsEntry("kty", "AKP")
            .containsEntry("alg", "ML-DSA-65")
            .containsEntry("use", "sig")
            .containsEntry("kid", "pq-1")
            .containsKey("x")
            .doesNotContainKey("d");
        assertThat(service.exportFullJwk()).containsKey("d");
    }

    @Test
    @DisplayName("exportPublicJwk should omit private RSA parameters")
    void exportPublicJwk_shouldOmitPrivateParts_whenRsa() {
        AccessTokenService service = serviceWith(RsaTokenSigner.generate("rsa-1"));

        assertThat(service.exportPublicJwk())
            .containsEntry("kty", "RSA")
            .containsEntry("kid", "rsa-1")
            .containsEntry("alg", "RS256")
            .containsKeys("n", "e")
            .doesNotContainKeys("d", "p", "q");
        assertThat(service.exportFullJwk()).containsKey("d");
    }
}
