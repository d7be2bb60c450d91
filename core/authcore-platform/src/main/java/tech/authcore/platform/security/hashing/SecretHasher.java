package tech.authcore.platform.security.hashing;

/**
 * One-way salted hashing of client secrets.
 */
public interface SecretHasher {

    /**
     * Hash a secret with a fresh random salt.
     *
     * @param plainSecret the secret, must not be blank
     * @return encoded hash including algorithm parameters and salt
     * @throws IllegalArgumentException if the secret is null or blank
     */
    String hash(String plainSecret);

    /**
     * Verify a secret against a stored hash. Never throws.
     *
     * @return true only if the secret matches the hash
     */
    boolean verify(String hash, String plainSecret);
}
