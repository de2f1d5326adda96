package credman.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Credentials held for one tenant slot.
 *
 * <p>Instances are decrypted on demand and never cached. {@link #toString()}
 * omits both tokens so a record can never leak through logging.
 *
 * @param accessToken  bearer token presented to the resource tenant
 * @param refreshToken token used to obtain a new access token
 * @param expiresAt    absolute expiry of the access token
 * @param tenantId     provider-issued tenant identifier taken from the token
 * @param user         subject display name (UPN or username)
 */
public record TokenRecord(String accessToken, String refreshToken, Instant expiresAt, String tenantId, String user) {

    public TokenRecord {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (refreshToken == null) {
            refreshToken = "";
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry is required");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID is required");
        }
        if (user == null) {
            user = "";
        }
    }

    /**
     * Check whether the access token has expired.
     */
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * Check whether the access token expires within the given window.
     *
     * @param window lookahead window
     * @param now    current time
     * @return true if {@code expiresAt} is at or before {@code now + window}
     */
    public boolean expiresWithin(Duration window, Instant now) {
        return !expiresAt.isAfter(now.plus(window));
    }

    public boolean hasRefreshToken() {
        return !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "TokenRecord[tenantId=" + tenantId + ", user=" + user + ", expiresAt=" + expiresAt + "]";
    }
}
