package tech.authcore.platform.authentication.jwt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.asn1.nist.NISTObjectIdentifiers;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.jcajce.spec.MLDSAParameterSpec;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.InvalidJwtException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ML-DSA-65 (FIPS 204) signer using the BouncyCastle provider.
 *
 * The JWS is assembled by hand since no JOSE library in use knows the
 * algorithm yet. JWK layout:
 * <pre>
 * {"kty":"AKP","alg":"ML-DSA-65","use":"sig","kid":"...",
 *  "x":"base64url(raw public key)","d":"base64url(PKCS#8 private key)"}
 * </pre>
 */
public class MlDsaTokenSigner implements TokenSigner {

    public static final String ALGORITHM = "ML-DSA-65";
    public static final String KEY_TYPE = "AKP";

    private static final String SIGNATURE_ALGORITHM = "ML-DSA";
    private static final Provider BC = new BouncyCastleProvider();
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder B64URL_DECODER = Base64.getUrlDecoder();

    private final String keyId;
    private final PublicKey publicKey;
    private final PrivateKey privateKey;
    private final String encodedHeader;

    private MlDsaTokenSigner(String keyId, PublicKey publicKey, PrivateKey privateKey) {
        this.keyId = keyId;
        this.publicKey = publicKey;
        this.privateKey = privateKey;
        this.encodedHeader = encodeHeader(keyId);
    }

    /**
     * Generate a fresh ML-DSA-65 key pair.
     */
    public static MlDsaTokenSigner generate(String keyId) {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance(SIGNATURE_ALGORITHM, BC);
            keyGen.initialize(MLDSAParameterSpec.ml_dsa_65, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            return new MlDsaTokenSigner(keyId, keyPair.getPublic(), keyPair.getPrivate());
        } catch (GeneralSecurityException e) {
            throw new SigningKeyException("ML-DSA-65 key generation not available", e);
        }
    }

    /**
     * Load a signer from a full AKP JWK.
     *
     * @param fallbackKeyId used when the JWK carries no kid
     * @throws SigningKeyException if required members are missing or the key pair does not match
     */
    public static MlDsaTokenSigner fromJwk(JsonNode jwk, String fallbackKeyId) {
        if (!KEY_TYPE.equals(jwk.path("kty").asText())) {
            throw new SigningKeyException("ML-DSA signing key must have kty=" + KEY_TYPE);
        }
        String alg = jwk.path("alg").asText(ALGORITHM);
        if (!ALGORITHM.equals(alg)) {
            throw new SigningKeyException("Unsupported AKP algorithm: " + alg + " (only " + ALGORITHM + ")");
        }
        String x = jwk.path("x").asText(null);
        String d = jwk.path("d").asText(null);
        if (x == null || x.isBlank()) {
            throw new SigningKeyException("ML-DSA signing key is missing the public part (x)");
        }
        if (d == null || d.isBlank()) {
            throw new SigningKeyException("ML-DSA signing key is missing the private part (d)");
        }
        String kid = jwk.path("kid").asText(fallbackKeyId);
        if (kid.isBlank()) {
            kid = fallbackKeyId;
        }

        try {
            KeyFactory keyFactory = KeyFactory.getInstance(SIGNATURE_ALGORITHM, BC);
            PublicKey publicKey = keyFactory.generatePublic(new X509EncodedKeySpec(toSubjectPublicKeyInfo(B64URL_DECODER.decode(x))));
            PrivateKey privateKey = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(B64URL_DECODER.decode(d)));
            MlDsaTokenSigner signer = new MlDsaTokenSigner(kid, publicKey, privateKey);
            signer.checkKeyPair();
            return signer;
        } catch (GeneralSecurityException | IOException | IllegalArgumentException e) {
            throw new SigningKeyException("Configured ML-DSA signing key is malformed", e);
        }
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public String keyId() {
        return keyId;
    }

    @Override
    public String sign(JwtClaims claims) {
        String payload = B64URL.encodeToString(claims.toJson().getBytes(StandardCharsets.UTF_8));
        String signingInput = encodedHeader + "." + payload;
        try {
            return signingInput + "." + B64URL.encodeToString(signBytes(signingInput.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ML-DSA signing failed", e);
        }
    }

    @Override
    public JwtClaims verify(String token) throws TokenVerificationException {
        if (token == null) {
            throw new TokenVerificationException("Token is null");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenVerificationException("Invalid JWT format - expected 3 parts");
        }

        try {
            JsonNode header = MAPPER.readTree(B64URL_DECODER.decode(parts[0]));
            String alg = header.path("alg").asText(null);
            if (!ALGORITHM.equals(alg)) {
                throw new TokenVerificationException("Unsupported JWT algorithm: " + alg + " (only " + ALGORITHM + " allowed)");
            }

            Signature sig = Signature.getInstance(SIGNATURE_ALGORITHM, BC);
            sig.initVerify(publicKey);
            sig.update((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII));
            if (!sig.verify(B64URL_DECODER.decode(parts[2]))) {
                throw new TokenVerificationException("ML-DSA signature does not verify");
            }

            return JwtClaims.parse(new String(B64URL_DECODER.decode(parts[1]), StandardCharsets.UTF_8));
        } catch (InvalidJwtException | IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new TokenVerificationException("Failed to verify ML-DSA token: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> exportPublicJwk() {
        Map<String, Object> jwk = new LinkedHashMap<>();
        jwk.put("kty", KEY_TYPE);
        jwk.put("alg", ALGORITHM);
        jwk.put("use", "sig");
        jwk.put("kid", keyId);
        jwk.put("x", B64URL.encodeToString(rawPublicKey()));
        return jwk;
    }

    @Override
    public Map<String, Object> exportFullJwk() {
        Map<String, Object> jwk = exportPublicJwk();
        jwk.put("d", B64URL.encodeToString(privateKey.getEncoded()));
        return jwk;
    }

    private byte[] signBytes(byte[] input) throws GeneralSecurityException {
        Signature sig = Signature.getInstance(SIGNATURE_ALGORITHM, BC);
        sig.initSign(privateKey);
        sig.update(input);
        return sig.sign();
    }

    /**
     * Sign and verify a sample message so a mismatched x/d pair fails at startup.
     */
    private void checkKeyPair() throws GeneralSecurityException {
        byte[] sample = "authcore-key-check".getBytes(StandardCharsets.US_ASCII);
        Signature sig = Signature.getInstance(SIGNATURE_ALGORITHM, BC);
        sig.initVerify(publicKey);
        sig.update(sample);
        if (!sig.verify(signBytes(sample))) {
            throw new SigningKeyException("ML-DSA signing key: public part (x) does not match private part (d)");
        }
    }

    private byte[] rawPublicKey() {
        return SubjectPublicKeyInfo.getInstance(publicKey.getEncoded()).getPublicKeyData().getBytes();
    }

    private static byte[] toSubjectPublicKeyInfo(byte[] rawPublicKey) throws IOException {
        return new SubjectPublicKeyInfo(new AlgorithmIdentifier(NISTObjectIdentifiers.id_ml_dsa_65), rawPublicKey)
            .getEncoded();
    }

    private static String encodeHeader(String keyId) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", ALGORITHM);
        header.put("typ", "JWT");
        header.put("kid", keyId);
        try {
            return B64URL.encodeToString(MAPPER.writeValueAsBytes(header));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode JWS header", e);
        }
    }
}
