package tech.authcore.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the token issuance core.
 *
 * Example configuration:
 * <pre>
 * authcore.auth.jwt.issuer=https://auth.example.com
 * authcore.auth.jwt.audience=authcore-api
 * authcore.auth.jwt.signing-key=${AUTHCORE_JWT_SIGNING_KEY}
 * authcore.auth.encryption.master-key=${AUTHCORE_MASTER_KEY}
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "authcore.auth")
public interface AuthConfig {

    /**
     * Access token signing and validation.
     */
    JwtConfig jwt();

    /**
     * Authorization code grant.
     */
    @WithName("authorization-code")
    AuthorizationCodeConfig authorizationCode();

    /**
     * Refresh token lifetime defaults.
     */
    @WithName("refresh-token")
    RefreshTokenConfig refreshToken();

    /**
     * MFA challenge tickets.
     */
    MfaConfig mfa();

    /**
     * At-rest encryption of sealed tokens.
     */
    EncryptionConfig encryption();

    /**
     * Periodic removal of expired and consumed rows.
     */
    CleanupConfig cleanup();

    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         */
        @WithDefault("authcore")
        String issuer();

        /**
         * Token audience (aud claim).
         */
        @WithDefault("authcore-api")
        String audience();

        /**
         * Access token lifetime in minutes.
         * Default: 15
         */
        @WithName("expiration-minutes")
        @WithDefault("15")
        int expirationMinutes();

        /**
         * Key id placed in the JWS header and the exported JWK.
         */
        @WithName("key-id")
        @WithDefault("auth-key-1")
        String keyId();

        /**
         * Algorithm used when no signing key is configured and one has to be generated.
         * Supported: ML-DSA-65, RS256.
         */
        @WithDefault("ML-DSA-65")
        String algorithm();

        /**
         * Signing key as a JWK JSON document, or the same document Base64-encoded.
         * The JWK's kty selects the algorithm (AKP for ML-DSA, RSA for RS256).
         */
        @WithName("signing-key")
        Optional<String> signingKey();
    }

    interface AuthorizationCodeConfig {
        /**
         * Authorization code lifetime.
         * Default: 10 minutes
         */
        @WithDefault("PT10M")
        Duration expiry();
    }

    interface RefreshTokenConfig {
        /**
         * Lifetime used when a tenant has no valid RefreshToken.ExpirationDays setting.
         */
        @WithName("default-expiration-days")
        @WithDefault("30")
        int defaultExpirationDays();
    }

    interface MfaConfig {
        /**
         * Default challenge lifetime.
         */
        @WithName("challenge-expiry")
        @WithDefault("PT10M")
        Duration challengeExpiry();

        /**
         * Upper bound for caller-supplied challenge lifetimes.
         */
        @WithName("max-challenge-expiry")
        @WithDefault("PT30M")
        Duration maxChallengeExpiry();
    }

    interface EncryptionConfig {
        /**
         * Base64-encoded 256-bit master key.
         * Generate with: openssl rand -base64 32
         */
        @WithName("master-key")
        Optional<String> masterKey();
    }

    interface CleanupConfig {
        @WithDefault("true")
        boolean enabled();

        /**
         * Sweep interval, read by the scheduler expression.
         */
        @WithDefault("1h")
        String interval();

        /**
         * How long expired or consumed rows are kept before the sweep deletes them.
         */
        @WithDefault("P1D")
        Duration retention();
    }
}
