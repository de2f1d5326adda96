package credman.adapter.in.dto;

import credman.core.model.TokenRecord;

/**
 * Access token for a slot. Never includes the refresh token.
 */
public record TokenResponse(String token, String expiresAt, String user, String tenantId) {

    public static TokenResponse fromModel(TokenRecord record) {
        return new TokenResponse(
                record.accessToken(), record.expiresAt().toString(), record.user(), record.tenantId());
    }
}
