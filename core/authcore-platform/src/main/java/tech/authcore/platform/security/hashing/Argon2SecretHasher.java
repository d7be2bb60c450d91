package tech.authcore.platform.security.hashing;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Argon2id implementation of {@link SecretHasher}.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Salt: 16 bytes, Hash: 32 bytes
 *
 * Hashes are PHC strings: $argon2id$v=19$m=65536,t=3,p=4$salt$hash
 */
@ApplicationScoped
public class Argon2SecretHasher implements SecretHasher {

    private static final Logger LOG = Logger.getLogger(Argon2SecretHasher.class);

    private static final int MEMORY_COST = 65536;
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;

    public Argon2SecretHasher() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    @Override
    public String hash(String plainSecret) {
        if (plainSecret == null || plainSecret.isBlank()) {
            throw new IllegalArgumentException("Secret cannot be null or blank");
        }
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, plainSecret.toCharArray());
    }

    @Override
    public boolean verify(String hash, String plainSecret) {
        if (hash == null || hash.isBlank() || plainSecret == null || plainSecret.isEmpty()) {
            return false;
        }
        try {
            return argon2.verify(hash, plainSecret.toCharArray());
        } catch (RuntimeException e) {
            LOG.debugf("Secret verification failed on malformed hash: %s", e.getMessage());
            return false;
        }
    }
}
