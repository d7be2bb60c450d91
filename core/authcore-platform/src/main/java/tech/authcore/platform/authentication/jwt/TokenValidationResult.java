package tech.authcore.platform.authentication.jwt;

/**
 * Outcome of validating an access token, including expiry.
 *
 * @param status outcome
 * @param token  decoded claims, null when INVALID
 */
public record TokenValidationResult(Status status, DecodedAccessToken token) {

    public enum Status {
        VALID,
        /** Signature, issuer and audience are fine but exp has passed */
        EXPIRED,
        INVALID
    }

    public static TokenValidationResult invalid() {
        return new TokenValidationResult(Status.INVALID, null);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
