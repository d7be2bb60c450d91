package tech.authcore.platform.authentication.jwt;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jose4j.jwt.JwtClaims;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for signing key loading and generation.
 */
class SigningKeyServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JwtClaims sampleClaims() {
        JwtClaims claims = new JwtClaims();
        claims.setSubject("usr_1");
        claims.setIssuer("authcore");
        return claims;
    }

    // ========================================
    // GENERATED KEYS
    // ========================================

    @Test
    @DisplayName("createSigner should generate an ML-DSA-65 key when none is configured")
    void createSigner_shouldGenerateMlDsa_whenNoKeyConfigured() {
        TokenSigner signer = SigningKeyService.createSigner(null, "ML-DSA-65", "auth-key-1");

        assertThat(signer).isInstanceOf(MlDsaTokenSigner.class);
        assertThat(signer.algorithm()).isEqualTo("ML-DSA-65");
        assertThat(signer.keyId()).isEqualTo("auth-key-1");
    }

    @Test
    @DisplayName("createSigner should generate an RSA key when RS256 is selected")
    void createSigner_shouldGenerateRsa_whenRs256Selected() {
        TokenSigner signer = SigningKeyService.createSigner("", "RS256", "rsa-1");

        assertThat(signer).isInstanceOf(RsaTokenSigner.class);
        assertThat(signer.keyId()).isEqualTo("rsa-1");
    }

    @Test
    @DisplayName("createSigner should reject an unknown algorithm")
    void createSigner_shouldThrow_whenAlgorithmUnknown() {
        assertThatThrownBy(() -> SigningKeyService.createSigner(null, "HS256", "k"))
            .isInstanceOf(SigningKeyException.class)
            .hasMessageContaining("HS256");
    }

    // ========================================
    // CONFIGURED KEYS
    // ========================================

    @Test
    @DisplayName("an exported ML-DSA JWK should load back and verify tokens of the original key")
    void createSigner_shouldLoadMlDsaJwk_whenExportedFromGeneratedKey() throws Exception {
        MlDsaTokenSigner original = MlDsaTokenSigner.generate("pq-1");
        String json = MAPPER.writeValueAsString(original.exportFullJwk());

        TokenSigner loaded = SigningKeyService.createSigner(json, "RS256", "fallback");
        String token = original.sign(sampleClaims());

        assertThat(loaded).isInstanceOf(MlDsaTokenSigner.class);
        assertThat(loaded.keyId()).isEqualTo("pq-1");
        assertThat(loaded.verify(token).getSubject()).isEqualTo("usr_1");
        assertThat(loaded.exportPublicJwk()).isEqualTo(original.exportPublicJwk());
    }

    @Test
    @DisplayName("a Base64-encoded RSA JWK should load and keep its key id")
    void createSigner_shouldLoadBase64RsaJwk() throws Exception {
        RsaTokenSigner original = RsaTokenSigner.generate("rsa-7");
        String json = MAPPER.writeValueAsString(original.exportFullJwk());
        String encoded = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));

        TokenSigner loaded = SigningKeyService.createSigner(encoded, "ML-DSA-65", "fallback");

        assertThat(loaded).isInstanceOf(RsaTokenSigner.class);
        assertThat(loaded.keyId()).isEqualTo("rsa-7");
        assertThat(loaded.verify(original.sign(sampleClaims())).getSubject()).isEqualTo("usr_1");
    }

    @Test
    @DisplayName("createSigner should reject a key whose public and private parts do not match")
    void createSigner_shouldThrow_whenMlDsaPartsMismatch() throws Exception {
        Map<String, Object> a = MlDsaTokenSigner.generate("a").exportFullJwk();
        Map<String, Object> b = MlDsaTokenSigner.generate("b").exportFullJwk();
        a.put("d", b.get("d"));

        String json = MAPPER.writeValueAsString(a);

        assertThatThrownBy(() -> SigningKeyService.createSigner(json, "ML-DSA-65", "k"))
            .isInstanceOf(SigningKeyException.class);
    }

    @Test
    @DisplayName("createSigner should reject public-only keys, unknown key types and garbage")
    void createSigner_shouldThrow_whenKeyUnusable() throws Exception {
        String publicOnly = MAPPER.writeValueAsString(RsaTokenSigner.generate("r").exportPublicJwk());
        String mlDsaPublicOnly = MAPPER.writeValueAsString(MlDsaTokenSigner.generate("m").exportPublicJwk());

        assertThatThrownBy(() -> SigningKeyService.createSigner(publicOnly, "RS256", "k"))
            .isInstanceOf(SigningKeyException.class);
        assertThatThrownBy(() -> SigningKeyService.createSigner(mlDsaPublicOnly, "ML-DSA-65", "k"))
            .isInstanceOf(SigningKeyException.class);
        assertThatThrownBy(() -> SigningKeyService.createSigner("{\"kty\":\"EC\"}", "RS256", "k"))
            .isInstanceOf(SigningKeyException.class)
            .hasMessageContaining("kty=EC");
        assertThatThrownBy(() -> SigningKeyService.createSigner("not a key", "RS256", "k"))
            .isInstanceOf(SigningKeyException.class);
    }

    // ========================================
    // VERIFICATION
    // ========================================

    @Test
    @DisplayName("verify should reject a token signed by another key")
    void verify_shouldThrow_whenSignedByOtherKey() {
        MlDsaTokenSigner signer = MlDsaTokenSigner.generate("a");
        MlDsaTokenSigner other = MlDsaTokenSigner.generate("b");
        String token = other.sign(sampleClaims());

        assertThatThrownBy(() -> signer.verify(token)).isInstanceOf(TokenVerificationException.class);
    }

    @Test
    @DisplayName("verify should reject a token whose header names another algorithm")
    void verify_shouldThrow_whenAlgorithmDiffers() {
        MlDsaTokenSigner mlDsa = MlDsaTokenSigner.generate("a");
        RsaTokenSigner rsa = RsaTokenSigner.generate("b");
        String rsaToken = rsa.sign(sampleClaims());

        assertThatThrownBy(() -> mlDsa.verify(rsaToken))
            .isInstanceOf(TokenVerificationException.class)
            .hasMessageContaining("RS256");
        assertThatThrownBy(() -> rsa.verify(mlDsa.sign(sampleClaims())))
            .isInstanceOf(TokenVerificationException.class);
    }
}
