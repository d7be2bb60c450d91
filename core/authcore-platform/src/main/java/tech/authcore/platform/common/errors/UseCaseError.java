package tech.authcore.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for registry failures.
 *
 * Errors are categorized by type so callers can map them to a response
 * status without inspecting messages.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (missing required fields, invalid format, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Business rule violation (duplicate client id, secret on a public client, etc.)
     * Maps to HTTP 409 Conflict.
     */
    record BusinessRuleViolation(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Entity not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
