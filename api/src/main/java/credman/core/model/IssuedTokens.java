package credman.core.model;

import java.util.Optional;

/**
 * Raw token response from the identity provider's token endpoint.
 *
 * <p>Nothing in this record has been validated. It must pass through the
 * token validator before any of it reaches storage or a caller.
 *
 * @param accessToken      the access token (JWT)
 * @param refreshToken     the rotated refresh token, if the provider issued one
 * @param idToken          the ID token, if {@code openid} was granted
 * @param expiresInSeconds lifetime reported by the provider
 * @param scope            granted scopes (space-separated)
 */
public record IssuedTokens(
        String accessToken,
        Optional<String> refreshToken,
        Optional<String> idToken,
        long expiresInSeconds,
        Optional<String> scope) {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    public IssuedTokens {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (refreshToken == null) {
            refreshToken = Optional.empty();
        }
        if (idToken == null) {
            idToken = Optional.empty();
        }
        if (expiresInSeconds <= 0) {
            expiresInSeconds = DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (scope == null) {
            scope = Optional.empty();
        }
    }

    /**
     * Keep the given refresh token when the provider did not rotate it.
     *
     * @param previous the refresh token currently stored
     * @return tokens carrying a refresh token
     */
    public IssuedTokens withFallbackRefreshToken(String previous) {
        if (refreshToken.filter(t -> !t.isBlank()).isPresent() || previous == null || previous.isBlank()) {
            return this;
        }
        return new IssuedTokens(accessToken, Optional.of(previous), idToken, expiresInSeconds, scope);
    }

    @Override
    public String toString() {
        return "IssuedTokens[expiresInSeconds=" + expiresInSeconds + ", scope=" + scope.orElse("") + "]";
    }
}
