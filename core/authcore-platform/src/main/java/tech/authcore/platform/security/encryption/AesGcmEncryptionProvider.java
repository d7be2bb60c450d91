package tech.authcore.platform.security.encryption;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.AuthConfig;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AES-256-GCM implementation of {@link AuthenticatedEncryptionProvider}.
 *
 * Each purpose gets its own key, derived from the master key with
 * HKDF-SHA256 (RFC 5869) using the purpose string as the info parameter.
 *
 * The ciphertext format: IV (12 bytes) + encrypted data + auth tag (16 bytes),
 * Base64-encoded.
 *
 * Configuration:
 * - authcore.auth.encryption.master-key: Base64-encoded 256-bit (32 byte) key.
 *   Generate with: openssl rand -base64 32
 *
 * Without a master key an ephemeral one is generated. Tokens sealed with it
 * cannot be opened after a restart.
 */
@ApplicationScoped
public class AesGcmEncryptionProvider implements AuthenticatedEncryptionProvider {

    private static final Logger LOG = Logger.getLogger(AesGcmEncryptionProvider.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String HMAC = "HmacSHA256";
    private static final int KEY_LENGTH = 32;
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final byte[] HKDF_SALT = "authcore-sealed-token-v1".getBytes(StandardCharsets.UTF_8);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @Inject
    AuthConfig config;

    private byte[] masterKey;
    private final Map<String, SecretKey> purposeKeys = new ConcurrentHashMap<>();

    public AesGcmEncryptionProvider() {
    }

    /**
     * Create a provider with an explicit master key, bypassing configuration.
     *
     * @param base64MasterKey Base64-encoded 256-bit key
     */
    public AesGcmEncryptionProvider(String base64MasterKey) {
        this.masterKey = parseKey(base64MasterKey);
    }

    @PostConstruct
    void init() {
        if (masterKey != null) {
            return;
        }
        var configured = config.encryption().masterKey();
        if (configured.isPresent() && !configured.get().isBlank()) {
            masterKey = parseKey(configured.get());
            LOG.info("Sealed token encryption initialized with configured master key");
        } else {
            masterKey = new byte[KEY_LENGTH];
            SECURE_RANDOM.nextBytes(masterKey);
            LOG.warn("No authcore.auth.encryption.master-key configured. Using an ephemeral key - " +
                "NOT SAFE FOR PRODUCTION. Sealed tokens will not survive a restart. " +
                "Generate with: openssl rand -base64 32");
        }
    }

    @Override
    public String protect(String purpose, String plaintext) {
        if (plaintext == null) {
            throw new EncryptionException("Plaintext cannot be null");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, keyFor(purpose), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt value for purpose " + purpose, e);
        }
    }

    @Override
    public String unprotect(String purpose, String ciphertext) {
        if (ciphertext == null) {
            throw new EncryptionException("Ciphertext cannot be null");
        }
        byte[] cipherBytes;
        try {
            cipherBytes = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Ciphertext is not valid Base64", e);
        }
        if (cipherBytes.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new EncryptionException("Ciphertext too short");
        }

        try {
            ByteBuffer buffer = ByteBuffer.wrap(cipherBytes);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, keyFor(purpose), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to decrypt value for purpose " + purpose, e);
        }
    }

    private SecretKey keyFor(String purpose) {
        if (purpose == null || purpose.isBlank()) {
            throw new EncryptionException("Purpose cannot be null or blank");
        }
        if (masterKey == null) {
            throw new EncryptionException("Encryption provider not initialized");
        }
        return purposeKeys.computeIfAbsent(purpose, this::deriveKey);
    }

    /**
     * HKDF-SHA256 with a single expand block, enough for a 32 byte key.
     */
    private SecretKey deriveKey(String purpose) {
        try {
            Mac extract = Mac.getInstance(HMAC);
            extract.init(new SecretKeySpec(HKDF_SALT, HMAC));
            byte[] prk = extract.doFinal(masterKey);

            Mac expand = Mac.getInstance(HMAC);
            expand.init(new SecretKeySpec(prk, HMAC));
            expand.update(purpose.getBytes(StandardCharsets.UTF_8));
            expand.update((byte) 0x01);
            byte[] okm = expand.doFinal();

            return new SecretKeySpec(Arrays.copyOf(okm, KEY_LENGTH), "AES");
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to derive key for purpose " + purpose, e);
        }
    }

    private static byte[] parseKey(String base64Key) {
        try {
            byte[] keyBytes = Base64.getDecoder().decode(base64Key.trim());
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalStateException(
                    "authcore.auth.encryption.master-key must be 256 bits (32 bytes) Base64-encoded. Got: " +
                    keyBytes.length + " bytes. Generate with: openssl rand -base64 32");
            }
            return keyBytes;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                "authcore.auth.encryption.master-key must be valid Base64. Generate with: openssl rand -base64 32", e);
        }
    }
}
