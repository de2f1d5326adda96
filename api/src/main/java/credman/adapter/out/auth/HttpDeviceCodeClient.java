package credman.adapter.out.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import credman.core.config.ProviderConfig;
import credman.core.model.CredentialException;
import credman.core.model.DeviceCodeSession;
import credman.core.model.IssuedTokens;
import credman.core.model.PollOutcome;
import credman.core.model.TenantSlot;
import credman.core.port.out.DeviceCodeClient;

/**
 * Device authorization grant (RFC 8628) and refresh-token grant over HTTP.
 *
 * <p>Requests are form posts to the provider's endpoints, resolved against the
 * tenant being authenticated. Transport failures become PROVIDER_UNREACHABLE,
 * unexpected responses PROVIDER_REJECTED. Only status codes and OAuth error
 * codes are logged; response bodies never are.
 */
@ApplicationScoped
public class HttpDeviceCodeClient implements DeviceCodeClient {

    private static final Logger LOG = Logger.getLogger(HttpDeviceCodeClient.class);

    static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";
    static final String REFRESH_TOKEN_GRANT = "refresh_token";

    private final WebClient webClient;
    private final ProviderConfig config;
    private final Clock clock;

    @Inject
    public HttpDeviceCodeClient(Vertx vertx, ProviderConfig config, Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<DeviceCodeSession> start(TenantSlot slot, Optional<String> tenantId) {
        final var authority = tenantId.orElse(config.defaultTenant());
        final var endpoint = ProviderConfig.resolve(config.deviceAuthorizationEndpoint(), authority);
        LOG.debugf("Requesting device code for slot %s from %s", slot, endpoint);

        final var params = new LinkedHashMap<String, String>();
        params.put("client_id", config.clientId());
        params.put("scope", String.join(" ", config.scopes()));

        return post(endpoint, params, slot).flatMap(response -> {
            if (response.statusCode() != 200) {
                LOG.warnf(
                        "Device authorization for slot %s failed with status %d (%s)",
                        slot, response.statusCode(), errorCode(response));
                return Uni.createFrom().failure(CredentialException.providerRejected(slot));
            }
            final var json = jsonBody(response);
            if (json == null) {
                return Uni.createFrom().failure(CredentialException.providerRejected(slot));
            }
            return Uni.createFrom().item(toSession(slot, tenantId, authority, json));
        });
    }

    @Override
    public Uni<PollOutcome> poll(DeviceCodeSession session) {
        final var slot = session.slot();
        final var endpoint = ProviderConfig.resolve(config.tokenEndpoint(), session.authorityTenant());

        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", DEVICE_CODE_GRANT);
        params.put("client_id", config.clientId());
        params.put("device_code", session.deviceCode());

        return post(endpoint, params, slot).flatMap(response -> {
            if (response.statusCode() == 200) {
                return parseTokens(response, slot).map(PollOutcome.TokenIssued::new);
            }
            final var error = errorCode(response);
            switch (error) {
                case "authorization_pending":
                    return Uni.createFrom().item(new PollOutcome.Pending());
                case "slow_down":
                    return Uni.createFrom().item(new PollOutcome.SlowDown());
                case "expired_token":
                case "code_expired":
                    return Uni.createFrom().item(new PollOutcome.Expired());
                case "access_denied":
                case "authorization_declined":
                    return Uni.createFrom().item(new PollOutcome.Denied());
                default:
                    LOG.warnf(
                            "Device code poll for slot %s failed with status %d (%s)",
                            slot, response.statusCode(), error);
                    return Uni.createFrom().failure(CredentialException.providerRejected(slot));
            }
        });
    }

    @Override
    public Uni<IssuedTokens> refresh(String refreshToken, TenantSlot slot, String tenantId) {
        final var endpoint = ProviderConfig.resolve(config.tokenEndpoint(), tenantId);

        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", REFRESH_TOKEN_GRANT);
        params.put("client_id", config.clientId());
        params.put("refresh_token", refreshToken);
        params.put("scope", String.join(" ", config.scopes()));

        return post(endpoint, params, slot).flatMap(response -> {
            if (response.statusCode() == 200) {
                return parseTokens(response, slot);
            }
            LOG.warnf(
                    "Token refresh for slot %s failed with status %d (%s)",
                    slot, response.statusCode(), errorCode(response));
            if (response.statusCode() == 400 || response.statusCode() == 401) {
                return Uni.createFrom().failure(CredentialException.refreshFailed(slot));
            }
            return Uni.createFrom().failure(CredentialException.providerRejected(slot));
        });
    }

    private Uni<HttpResponse<Buffer>> post(String endpoint, Map<String, String> params, TenantSlot slot) {
        return webClient
                .postAbs(endpoint)
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(formBody(params)))
                .onFailure()
                .transform(error -> {
                    LOG.warnf("Identity provider request for slot %s failed: %s", slot, error.getClass().getSimpleName());
                    return CredentialException.providerUnreachable(slot, error);
                });
    }

    private DeviceCodeSession toSession(
            TenantSlot slot, Optional<String> tenantId, String authority, JsonObject json) {
        final var deviceCode = json.getString("device_code");
        final var userCode = json.getString("user_code");
        if (deviceCode == null || deviceCode.isBlank() || userCode == null || userCode.isBlank()) {
            LOG.warnf("Device authorization response for slot %s is missing codes", slot);
            throw CredentialException.providerRejected(slot);
        }
        final var verificationUri = json.getString("verification_uri", json.getString("verification_url", ""));
        final long expiresIn = longValue(json, "expires_in", config.defaultDeviceCodeTtl().toSeconds());
        final long interval = longValue(json, "interval", config.defaultPollInterval().toSeconds());
        final var message = json.getString(
                "message", "To sign in, open " + verificationUri + " and enter the code " + userCode);

        return new DeviceCodeSession(
                UUID.randomUUID().toString(),
                slot,
                deviceCode,
                userCode,
                verificationUri,
                message,
                clock.instant().plusSeconds(expiresIn),
                (int) Math.max(1, interval),
                tenantId,
                authority);
    }

    private Uni<IssuedTokens> parseTokens(HttpResponse<Buffer> response, TenantSlot slot) {
        final var json = jsonBody(response);
        if (json == null) {
            return Uni.createFrom().failure(CredentialException.providerRejected(slot));
        }
        final var accessToken = json.getString("access_token");
        if (accessToken == null || accessToken.isBlank()) {
            LOG.warnf("Token response for slot %s is missing access_token", slot);
            return Uni.createFrom().failure(CredentialException.providerRejected(slot));
        }
        return Uni.createFrom()
                .item(new IssuedTokens(
                        accessToken,
                        Optional.ofNullable(json.getString("refresh_token")),
                        Optional.ofNullable(json.getString("id_token")),
                        longValue(json, "expires_in", 0L),
                        Optional.ofNullable(json.getString("scope"))));
    }

    private static JsonObject jsonBody(HttpResponse<Buffer> response) {
        try {
            return response.bodyAsJsonObject();
        } catch (RuntimeException e) {
            LOG.debugf("Provider response is not a JSON object: %s", e.getClass().getSimpleName());
            return null;
        }
    }

    private static String errorCode(HttpResponse<Buffer> response) {
        final var json = jsonBody(response);
        if (json == null) {
            return "";
        }
        final var value = json.getValue("error");
        return value instanceof String s ? s : "";
    }

    // expires_in and interval arrive as numbers or numeric strings depending on the provider
    private static long longValue(JsonObject json, String field, long defaultValue) {
        final var value = json.getValue(field);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static String formBody(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .reduce((a, b) -> a + "&" + b)
                .orElse("");
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
