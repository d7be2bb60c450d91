package tech.authcore.platform.authentication.jwt;

/**
 * Signing key material is missing, malformed or unusable.
 * Thrown during startup, where it aborts initialization.
 */
public class SigningKeyException extends RuntimeException {

    public SigningKeyException(String message) {
        super(message);
    }

    public SigningKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
