package tech.authcore.platform.security.encryption;

import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Helpers shared by the sealed token stores.
 *
 * A sealed token is stored as a SHA-256 lookup hash plus a ciphertext of
 * the plaintext. The plaintext itself is never persisted.
 */
public final class SealedTokens {

    private static final Logger LOG = Logger.getLogger(SealedTokens.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * SHA-256 of the plaintext as lowercase hex.
     */
    public static String hash(String plaintext) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(plaintext.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Random bytes encoded as base64url without padding.
     */
    public static String randomToken(int byteLength) {
        byte[] bytes = new byte[byteLength];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Decrypt the stored ciphertext and compare it to the presented plaintext
     * in constant time. Decryption failures count as a mismatch.
     *
     * @param rowId id of the row being checked, for logging only
     */
    public static boolean matches(AuthenticatedEncryptionProvider encryption, String purpose,
                                  String encryptedValue, String plaintext, String rowId) {
        try {
            String decrypted = encryption.unprotect(purpose, encryptedValue);
            boolean equal = MessageDigest.isEqual(
                decrypted.getBytes(StandardCharsets.UTF_8),
                plaintext.getBytes(StandardCharsets.UTF_8));
            if (!equal) {
                LOG.warnf("%s %s: decrypted value does not match presented token, possible tampering",
                    purpose, rowId);
            }
            return equal;
        } catch (EncryptionException e) {
            LOG.warnf("%s %s: stored ciphertext failed authentication, possible tampering: %s",
                purpose, rowId, e.getMessage());
            return false;
        }
    }

    private SealedTokens() {
        // Utility class
    }
}
