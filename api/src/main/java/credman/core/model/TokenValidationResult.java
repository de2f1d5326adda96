package credman.core.model;

import java.util.Set;

/**
 * Result of checking issued tokens against the slot they were requested for.
 */
public sealed interface TokenValidationResult {

    /**
     * Tokens are well formed, unexpired and belong to the expected tenant.
     *
     * @param record the record to store
     */
    record Valid(TokenRecord record) implements TokenValidationResult {
        public Valid {
            if (record == null) {
                throw new IllegalArgumentException("Record cannot be null");
            }
        }
    }

    /**
     * The access token could not be decoded or lacks a required claim.
     *
     * @param reason description safe to show to callers
     */
    record Malformed(String reason) implements TokenValidationResult {}

    /**
     * The token was issued for a different tenant than requested.
     *
     * @param expectedTenantId tenant requested for the slot
     * @param actualTenantId   tenant found in the token
     */
    record TenantMismatch(String expectedTenantId, String actualTenantId) implements TokenValidationResult {}

    /**
     * The access token has already expired.
     */
    record Expired() implements TokenValidationResult {}

    /**
     * The token was not granted every required scope.
     *
     * @param missing scopes that were required but not granted
     */
    record InsufficientScope(Set<String> missing) implements TokenValidationResult {}
}
