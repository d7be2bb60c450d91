package tech.authcore.platform.common;

import tech.authcore.platform.common.errors.UseCaseError;

/**
 * Result type for registry operations that can fail on business rules.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>{@code
 * Result<OAuthClient> result = clientService.createClient(request);
 * if (result instanceof Result.Failure<OAuthClient> f) {
 *     return badRequest(f.error());
 * }
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
