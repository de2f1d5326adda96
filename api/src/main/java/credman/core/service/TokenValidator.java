package credman.core.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import credman.core.config.ProviderConfig;
import credman.core.model.IssuedTokens;
import credman.core.model.TokenRecord;
import credman.core.model.TokenValidationResult;

/**
 * Checks tokens issued for a slot before they are stored or returned.
 *
 * <p>The access token's claims are decoded locally. The signature is not
 * verified: the token came straight from the provider's token endpoint over
 * TLS and is only ever forwarded to the resource tenant, which verifies it.
 * What this validator enforces is the binding between a slot and a tenant.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>the access token is a decodable JWT</li>
 *   <li>the tenant claim is present</li>
 *   <li>the token has not expired</li>
 *   <li>the tenant equals the expected tenant (exact match)</li>
 *   <li>every required scope was granted</li>
 * </ol>
 */
@ApplicationScoped
public class TokenValidator {

    private static final Logger LOG = Logger.getLogger(TokenValidator.class);

    private static final List<String> USER_CLAIMS =
            List.of("preferred_username", "upn", "unique_name", "email", "name", "sub");

    private final ProviderConfig config;
    private final Clock clock;
    private final JwtConsumer consumer;

    @Inject
    public TokenValidator(ProviderConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.consumer = new JwtConsumerBuilder()
                .setSkipAllValidators()
                .setDisableRequireSignature()
                .setSkipSignatureVerification()
                .setJwsAlgorithmConstraints(AlgorithmConstraints.NO_CONSTRAINTS)
                .build();
    }

    /**
     * Validate tokens issued for a slot.
     *
     * @param tokens           raw tokens from the provider
     * @param expectedTenantId tenant the slot is bound to; when empty the
     *                         observed tenant is accepted
     * @return the validation result; {@link TokenValidationResult.Valid} carries the record to store
     */
    public TokenValidationResult validate(IssuedTokens tokens, Optional<String> expectedTenantId) {
        final JwtClaims claims;
        try {
            claims = consumer.processToClaims(tokens.accessToken());
        } catch (InvalidJwtException e) {
            LOG.debug("Access token could not be decoded");
            return new TokenValidationResult.Malformed("Access token is not a decodable JWT");
        }

        final var tenantId = stringClaim(claims, config.tenantClaim());
        if (tenantId.isEmpty()) {
            return new TokenValidationResult.Malformed("Access token has no " + config.tenantClaim() + " claim");
        }

        final var now = clock.instant();
        final Instant expiresAt;
        try {
            final NumericDate exp = claims.getExpirationTime();
            expiresAt = exp != null
                    ? Instant.ofEpochSecond(exp.getValue())
                    : now.plusSeconds(tokens.expiresInSeconds());
        } catch (MalformedClaimException e) {
            return new TokenValidationResult.Malformed("Access token has a malformed exp claim");
        }
        if (!expiresAt.isAfter(now)) {
            return new TokenValidationResult.Expired();
        }

        final var expected = expectedTenantId.filter(t -> !t.isBlank());
        if (expected.isPresent() && !expected.get().equals(tenantId.get())) {
            return new TokenValidationResult.TenantMismatch(expected.get(), tenantId.get());
        }

        final var missing = missingScopes(claims);
        if (!missing.isEmpty()) {
            return new TokenValidationResult.InsufficientScope(missing);
        }

        final var user = USER_CLAIMS.stream()
                .map(name -> stringClaim(claims, name))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse("");

        return new TokenValidationResult.Valid(new TokenRecord(
                tokens.accessToken(), tokens.refreshToken().orElse(""), expiresAt, tenantId.get(), user));
    }

    private Set<String> missingScopes(JwtClaims claims) {
        final var required = config.requiredScopes().orElse(List.of());
        if (required.isEmpty()) {
            return Set.of();
        }
        final var granted = new LinkedHashSet<String>();
        stringClaim(claims, "scp").ifPresent(s -> granted.addAll(Arrays.asList(s.split("\\s+"))));
        stringClaim(claims, "scope").ifPresent(s -> granted.addAll(Arrays.asList(s.split("\\s+"))));

        final var missing = new LinkedHashSet<String>();
        for (var scope : required) {
            if (!granted.contains(scope)) {
                missing.add(scope);
            }
        }
        return missing;
    }

    private static Optional<String> stringClaim(JwtClaims claims, String name) {
        final var value = claims.getClaimValue(name);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }
}
