package tech.authcore.platform.security.encryption;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AesGcmEncryptionProvider.
 * Covers purpose separation, tamper detection and key parsing.
 */
class AesGcmEncryptionProviderTest {

    private static final String MASTER_KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private final AesGcmEncryptionProvider provider = new AesGcmEncryptionProvider(MASTER_KEY);

    // ========================================
    // ROUND TRIP
    // ========================================

    @Test
    @DisplayName("unprotect should return the plaintext under the same purpose")
    void unprotect_shouldReturnPlaintext_whenPurposeMatches() {
        String sealed = provider.protect("RefreshToken", "token-value");

        assertThat(provider.unprotect("RefreshToken", sealed)).isEqualTo("token-value");
    }

    @Test
    @DisplayName("protect should produce different ciphertexts for the same plaintext")
    void protect_shouldUseFreshIv_whenCalledTwice() {
        String first = provider.protect("RefreshToken", "token-value");
        String second = provider.protect("RefreshToken", "token-value");

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("a provider with the same master key should open tokens sealed by another instance")
    void unprotect_shouldSucceed_whenSealedByAnotherInstanceWithSameKey() {
        String sealed = provider.protect("AuthorizationCode", "abc");

        AesGcmEncryptionProvider other = new AesGcmEncryptionProvider(MASTER_KEY);

        assertThat(other.unprotect("AuthorizationCode", sealed)).isEqualTo("abc");
    }

    // ========================================
    // FAILURES
    // ========================================

    @Test
    @DisplayName("unprotect should fail when the purpose differs")
    void unprotect_shouldFail_whenPurposeDiffers() {
        String sealed = provider.protect("RefreshToken", "token-value");

        assertThatThrownBy(() -> provider.unprotect("MfaChallengeToken", sealed))
            .isInstanceOf(EncryptionException.class);
    }

    @Test
    @DisplayName("unprotect should fail when a ciphertext byte is flipped")
    void unprotect_shouldFail_whenCiphertextTampered() {
        byte[] bytes = Base64.getDecoder().decode(provider.protect("RefreshToken", "token-value"));
        bytes[bytes.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(bytes);

        assertThatThrownBy(() -> provider.unprotect("RefreshToken", tampered))
            .isInstanceOf(EncryptionException.class);
    }

    @Test
    @DisplayName("unprotect should fail on input that is not Base64 or too short")
    void unprotect_shouldFail_whenInputMalformed() {
        assertThatThrownBy(() -> provider.unprotect("RefreshToken", "***"))
            .isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> provider.unprotect("RefreshToken", "AAAA"))
            .isInstanceOf(EncryptionException.class)
            .hasMessageContaining("too short");
    }

    @Test
    @DisplayName("a provider with another master key should not open the ciphertext")
    void unprotect_shouldFail_whenMasterKeyDiffers() {
        byte[] otherKey = new byte[32];
        otherKey[0] = 1;
        AesGcmEncryptionProvider other = new AesGcmEncryptionProvider(Base64.getEncoder().encodeToString(otherKey));

        String sealed = provider.protect("RefreshToken", "token-value");

        assertThatThrownBy(() -> other.unprotect("RefreshToken", sealed))
            .isInstanceOf(EncryptionException.class);
    }

    @Test
    @DisplayName("constructor should reject a master key that is not 32 bytes")
    void constructor_shouldReject_whenKeyWrongLength() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> new AesGcmEncryptionProvider(shortKey))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("32 bytes");
    }

    // ========================================
    // SEALED TOKEN HELPERS
    // ========================================

    @Test
    @DisplayName("matches should be false for a mismatched plaintext or a broken ciphertext")
    void matches_shouldFailClosed() {
        String sealed = provider.protect("RefreshToken", "token-value");

        assertThat(SealedTokens.matches(provider, "RefreshToken", sealed, "token-value", "rtk_1")).isTrue();
        assertThat(SealedTokens.matches(provider, "RefreshToken", sealed, "other-value", "rtk_1")).isFalse();
        assertThat(SealedTokens.matches(provider, "RefreshToken", "garbage", "token-value", "rtk_1")).isFalse();
    }

    @Test
    @DisplayName("hash should be lowercase hex SHA-256")
    void hash_shouldBeLowercaseHexSha256() {
        assertThat(SealedTokens.hash("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("randomToken should be base64url without padding")
    void randomToken_shouldBeUrlSafe() {
        String token = SealedTokens.randomToken(32);

        assertThat(token).hasSize(43).matches("[A-Za-z0-9_-]+");
    }
}
