package credman.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import credman.core.model.IssuedTokens;
import credman.core.model.TokenValidationResult;
import credman.mock.MutableClock;
import credman.mock.TestConfigs;
import credman.mock.TestTokens;

@DisplayName("TokenValidator")
class TokenValidatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TENANT_A = "aaaaaaaa-0000-0000-0000-000000000001";
    private static final String TENANT_B = "bbbbbbbb-0000-0000-0000-000000000002";

    private MutableClock clock;
    private TokenValidator validator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        validator = new TokenValidator(TestConfigs.provider(), clock);
    }

    private static IssuedTokens tokens(String accessToken) {
        return new IssuedTokens(accessToken, Optional.of("refresh-1"), Optional.empty(), 3600, Optional.empty());
    }

    @Nested
    @DisplayName("Valid tokens")
    class ValidTokens {

        @Test
        @DisplayName("should produce a record with tenant, user, expiry and refresh token")
        void shouldProduceRecord() {
            final var expiresAt = NOW.plus(Duration.ofHours(1));
            final var result = validator.validate(
                    tokens(TestTokens.accessToken(TENANT_A, "alice@contoso.com", expiresAt)), Optional.of(TENANT_A));

            final var valid = assertInstanceOf(TokenValidationResult.Valid.class, result);
            assertEquals(TENANT_A, valid.record().tenantId());
            assertEquals("alice@contoso.com", valid.record().user());
            assertEquals(expiresAt, valid.record().expiresAt());
            assertEquals("refresh-1", valid.record().refreshToken());
        }

        @Test
        @DisplayName("should accept any tenant when none is expected")
        void shouldAcceptAnyTenantWhenNoneExpected() {
            final var result = validator.validate(
                    tokens(TestTokens.accessToken(TENANT_B, "bob", NOW.plusSeconds(600))), Optional.empty());

            final var valid = assertInstanceOf(TokenValidationResult.Valid.class, result);
            assertEquals(TENANT_B, valid.record().tenantId());
        }

        @Test
        @DisplayName("should fall back to expires_in when the token has no exp claim")
        void shouldFallBackToExpiresIn() {
            final var token = TestTokens.accessToken(Map.of("tid", TENANT_A, "upn", "carol@contoso.com"));
            final var result = validator.validate(tokens(token), Optional.of(TENANT_A));

            final var valid = assertInstanceOf(TokenValidationResult.Valid.class, result);
            assertEquals(NOW.plusSeconds(3600), valid.record().expiresAt());
            assertEquals("carol@contoso.com", valid.record().user());
        }
    }

    @Nested
    @DisplayName("Rejected tokens")
    class RejectedTokens {

        @Test
        @DisplayName("should reject a token issued for another tenant")
        void shouldRejectTenantMismatch() {
            final var result = validator.validate(
                    tokens(TestTokens.accessToken(TENANT_B, "mallory", NOW.plusSeconds(600))), Optional.of(TENANT_A));

            final var mismatch = assertInstanceOf(TokenValidationResult.TenantMismatch.class, result);
            assertEquals(TENANT_A, mismatch.expectedTenantId());
            assertEquals(TENANT_B, mismatch.actualTenantId());
        }

        @Test
        @DisplayName("should compare tenants exactly")
        void shouldCompareTenantsExactly() {
            final var result = validator.validate(
                    tokens(TestTokens.accessToken(TENANT_A.toUpperCase(), "alice", NOW.plusSeconds(600))),
                    Optional.of(TENANT_A));

            assertInstanceOf(TokenValidationResult.TenantMismatch.class, result);
        }

        @Test
        @DisplayName("should reject an access token that is not a JWT")
        void shouldRejectOpaqueToken() {
            final var result = validator.validate(tokens("not-a-jwt"), Optional.empty());

            assertInstanceOf(TokenValidationResult.Malformed.class, result);
        }

        @Test
        @DisplayName("should reject a token without a tenant claim")
        void shouldRejectMissingTenantClaim() {
            final var token = TestTokens.accessToken(Map.of("preferred_username", "alice"));
            final var result = validator.validate(tokens(token), Optional.empty());

            assertInstanceOf(TokenValidationResult.Malformed.class, result);
        }

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpiredToken() {
            final var result = validator.validate(
                    tokens(TestTokens.accessToken(TENANT_A, "alice", NOW.minusSeconds(1))), Optional.of(TENANT_A));

            assertInstanceOf(TokenValidationResult.Expired.class, result);
        }

        @Test
        @DisplayName("should report missing required scopes")
        void shouldReportMissingScopes() {
            final var scoped = new TokenValidator(
                    TestConfigs.provider("http://localhost", List.of("user_impersonation", "Directory.Read")), clock);

            final var result = scoped.validate(
                    tokens(TestTokens.accessToken(TENANT_A, "alice", NOW.plusSeconds(600))), Optional.of(TENANT_A));

            final var insufficient = assertInstanceOf(TokenValidationResult.InsufficientScope.class, result);
            assertEquals(Set.of("Directory.Read"), insufficient.missing());
        }
    }
}
