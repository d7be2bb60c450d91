package tech.authcore.platform.authentication.jwt;

/**
 * Thrown when a token cannot be parsed or its signature does not verify.
 */
public class TokenVerificationException extends Exception {

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
