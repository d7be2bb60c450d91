package tech.authcore.platform.security.encryption;

/**
 * Purpose-scoped authenticated encryption for secrets stored at rest.
 *
 * A ciphertext produced for one purpose can only be opened with the same
 * purpose string. Purposes in use: "AuthorizationCode", "RefreshToken",
 * "MfaChallengeToken".
 */
public interface AuthenticatedEncryptionProvider {

    /**
     * Encrypt plaintext under the key derived for the given purpose.
     *
     * @param purpose   key derivation purpose
     * @param plaintext value to encrypt
     * @return Base64-encoded ciphertext
     * @throws EncryptionException if encryption fails
     */
    String protect(String purpose, String plaintext);

    /**
     * Decrypt and authenticate a ciphertext produced by {@link #protect}.
     *
     * @param purpose    key derivation purpose used when protecting
     * @param ciphertext Base64-encoded ciphertext
     * @return the plaintext
     * @throws EncryptionException if the ciphertext is malformed, tampered with,
     *                             or was produced for another purpose
     */
    String unprotect(String purpose, String ciphertext);
}
