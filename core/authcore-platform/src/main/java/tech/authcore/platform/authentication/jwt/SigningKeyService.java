package tech.authcore.platform.authentication.jwt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.authcore.platform.authentication.AuthConfig;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Owns the process-wide signing key.
 *
 * Supports two modes:
 * 1. Configured key (production) - authcore.auth.jwt.signing-key holds a full JWK,
 *    either as JSON or Base64-encoded JSON. The JWK's kty picks the algorithm.
 * 2. Generated key (development) - a fresh key pair of authcore.auth.jwt.algorithm,
 *    valid for the lifetime of the process only.
 *
 * The signer is created once in {@link #init()} and never replaced.
 */
@ApplicationScoped
public class SigningKeyService {

    private static final Logger LOG = Logger.getLogger(SigningKeyService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    AuthConfig config;

    private TokenSigner signer;

    public SigningKeyService() {
    }

    /**
     * Wrap an existing signer, bypassing configuration.
     */
    public SigningKeyService(TokenSigner signer) {
        this.signer = signer;
    }

    @PostConstruct
    void init() {
        if (signer != null) {
            return;
        }
        AuthConfig.JwtConfig jwt = config.jwt();
        signer = createSigner(jwt.signingKey().orElse(null), jwt.algorithm(), jwt.keyId());
        LOG.infof("Signing key initialized: algorithm %s, key ID %s", signer.algorithm(), signer.keyId());
    }

    public TokenSigner signer() {
        if (signer == null) {
            throw new IllegalStateException("Signing key not initialized");
        }
        return signer;
    }

    /**
     * Build a signer from configured key material, or generate one.
     *
     * @param signingKey JWK JSON, Base64 of JWK JSON, or null/blank to generate
     * @param algorithm  algorithm to generate when no key is configured
     * @param keyId      kid to use when the JWK carries none, or for a generated key
     * @throws SigningKeyException if the configured key is malformed or the algorithm unknown
     */
    static TokenSigner createSigner(String signingKey, String algorithm, String keyId) {
        if (signingKey == null || signingKey.isBlank()) {
            LOG.warnf("No authcore.auth.jwt.signing-key configured. Generating an ephemeral %s key - " +
                "NOT SAFE FOR PRODUCTION. Tokens will not verify after a restart.", algorithm);
            return generate(algorithm, keyId);
        }

        String json = decodeKeyMaterial(signingKey.trim());
        JsonNode jwk;
        try {
            jwk = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SigningKeyException("authcore.auth.jwt.signing-key is not valid JWK JSON", e);
        }
        if (jwk == null || !jwk.isObject()) {
            throw new SigningKeyException("authcore.auth.jwt.signing-key must be a JWK object");
        }

        String kty = jwk.path("kty").asText("");
        if (MlDsaTokenSigner.KEY_TYPE.equals(kty)) {
            return MlDsaTokenSigner.fromJwk(jwk, keyId);
        }
        if ("RSA".equals(kty)) {
            return RsaTokenSigner.fromJwk(json, keyId);
        }
        throw new SigningKeyException("Unsupported signing key type: kty=" + kty + " (expected AKP or RSA)");
    }

    private static TokenSigner generate(String algorithm, String keyId) {
        if (MlDsaTokenSigner.ALGORITHM.equalsIgnoreCase(algorithm)) {
            return MlDsaTokenSigner.generate(keyId);
        }
        if (RsaTokenSigner.ALGORITHM.equalsIgnoreCase(algorithm)) {
            return RsaTokenSigner.generate(keyId);
        }
        throw new SigningKeyException("Unsupported authcore.auth.jwt.algorithm: " + algorithm +
            " (expected " + MlDsaTokenSigner.ALGORITHM + " or " + RsaTokenSigner.ALGORITHM + ")");
    }

    /**
     * JSON is used as is; anything else must be Base64 of JSON.
     */
    private static String decodeKeyMaterial(String value) {
        if (value.startsWith("{")) {
            return value;
        }
        try {
            String decoded = new String(Base64.getMimeDecoder().decode(value), StandardCharsets.UTF_8).trim();
            if (!decoded.startsWith("{")) {
                throw new SigningKeyException("authcore.auth.jwt.signing-key is neither JWK JSON nor Base64-encoded JWK JSON");
            }
            return decoded;
        } catch (IllegalArgumentException e) {
            throw new SigningKeyException("authcore.auth.jwt.signing-key is neither JWK JSON nor valid Base64", e);
        }
    }
}
