package credman.adapter.out.auth;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import credman.core.model.CredentialErrorKind;
import credman.core.model.CredentialException;
import credman.core.model.DeviceCodeSession;
import credman.core.model.PollOutcome;
import credman.core.model.TenantSlot;
import credman.mock.MutableClock;
import credman.mock.TestConfigs;

@DisplayName("HttpDeviceCodeClient")
class HttpDeviceCodeClientTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TENANT = "contoso.onmicrosoft.com";
    private static final String DEVICE_CODE_PATH = "/" + TENANT + "/oauth2/v2.0/devicecode";
    private static final String TOKEN_PATH = "/" + TENANT + "/oauth2/v2.0/token";

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private HttpDeviceCodeClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        client = new HttpDeviceCodeClient(
                vertx, TestConfigs.provider("http://localhost:" + wireMockServer.port(), List.of()), new MutableClock(NOW));
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private static <T> T await(Uni<T> uni) {
        return uni.await().atMost(Duration.ofSeconds(10));
    }

    private static CredentialErrorKind failureKind(Uni<?> uni) {
        return assertThrows(CredentialException.class, () -> await(uni)).kind();
    }

    private void stubToken(int status, String body) {
        wireMockServer.stubFor(post(urlEqualTo(TOKEN_PATH))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    private static DeviceCodeSession session() {
        return new DeviceCodeSession(
                "session-1",
                TenantSlot.SOURCE,
                "dc-123",
                "ABCD-EFGH",
                "https://microsoft.com/devicelogin",
                "",
                NOW.plusSeconds(900),
                5,
                Optional.of(TENANT),
                TENANT);
    }

    @Nested
    @DisplayName("Device authorization")
    class StartTests {

        @Test
        @DisplayName("should request a device code for the tenant and build a session")
        void shouldStartSession() {
            wireMockServer.stubFor(post(urlEqualTo(DEVICE_CODE_PATH))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody(
                                    """
                                    {
                                      "device_code": "dc-123",
                                      "user_code": "ABCD-EFGH",
                                      "verification_uri": "https://microsoft.com/devicelogin",
                                      "expires_in": "900",
                                      "interval": 7,
                                      "message": "To sign in, use a web browser"
                                    }
                                    """)));

            final var session = await(client.start(TenantSlot.SOURCE, Optional.of(TENANT)));

            assertEquals("ABCD-EFGH", session.userCode());
            assertEquals("https://microsoft.com/devicelogin", session.verificationUri());
            assertEquals("To sign in, use a web browser", session.message());
            assertEquals(NOW.plusSeconds(900), session.expiresAt());
            assertEquals(7, session.pollIntervalSeconds());
            assertEquals(Optional.of(TENANT), session.expectedTenantId());
            wireMockServer.verify(postRequestedFor(urlEqualTo(DEVICE_CODE_PATH))
                    .withRequestBody(containing("client_id=test-client"))
                    .withRequestBody(containing("offline_access")));
        }

        @Test
        @DisplayName("should use the default tenant and defaults for missing fields")
        void shouldApplyDefaults() {
            wireMockServer.stubFor(post(urlEqualTo("/organizations/oauth2/v2.0/devicecode"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody(
                                    """
                                    {"device_code": "dc-1", "user_code": "WXYZ", "verification_url": "https://aka.ms/devicelogin"}
                                    """)));

            final var session = await(client.start(TenantSlot.TARGET, Optional.empty()));

            assertEquals("https://aka.ms/devicelogin", session.verificationUri());
            assertEquals(5, session.pollIntervalSeconds());
            assertEquals(NOW.plus(Duration.ofMinutes(15)), session.expiresAt());
            assertEquals("organizations", session.authorityTenant());
        }

        @Test
        @DisplayName("should report a provider error as rejected")
        void shouldReportRejection() {
            wireMockServer.stubFor(post(urlEqualTo(DEVICE_CODE_PATH))
                    .willReturn(aResponse().withStatus(400).withBody("{\"error\":\"invalid_client\"}")));

            assertEquals(
                    CredentialErrorKind.PROVIDER_REJECTED,
                    failureKind(client.start(TenantSlot.SOURCE, Optional.of(TENANT))));
        }

        @Test
        @DisplayName("should report a connection failure as unreachable")
        void shouldReportUnreachable() {
            wireMockServer.stop();

            assertEquals(
                    CredentialErrorKind.PROVIDER_UNREACHABLE,
                    failureKind(client.start(TenantSlot.SOURCE, Optional.of(TENANT))));
        }
    }

    @Nested
    @DisplayName("Polling")
    class PollTests {

        @Test
        @DisplayName("should map authorization_pending to pending")
        void shouldMapPending() {
            stubToken(400, "{\"error\":\"authorization_pending\"}");

            assertInstanceOf(PollOutcome.Pending.class, await(client.poll(session())));
            wireMockServer.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                    .withRequestBody(containing("device_code=dc-123"))
                    .withRequestBody(containing("grant_type=urn%3Aietf%3Aparams%3Aoauth%3Agrant-type%3Adevice_code")));
        }

        @Test
        @DisplayName("should map slow_down")
        void shouldMapSlowDown() {
            stubToken(400, "{\"error\":\"slow_down\"}");

            assertInstanceOf(PollOutcome.SlowDown.class, await(client.poll(session())));
        }

        @Test
        @DisplayName("should map expired_token to expired")
        void shouldMapExpired() {
            stubToken(400, "{\"error\":\"expired_token\"}");

            assertInstanceOf(PollOutcome.Expired.class, await(client.poll(session())));
        }

        @Test
        @DisplayName("should map authorization_declined to denied")
        void shouldMapDenied() {
            stubToken(400, "{\"error\":\"authorization_declined\"}");

            assertInstanceOf(PollOutcome.Denied.class, await(client.poll(session())));
        }

        @Test
        @DisplayName("should return issued tokens")
        void shouldReturnTokens() {
            stubToken(
                    200,
                    "{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"expires_in\":3599,\"scope\":\"offline_access\"}");

            final var outcome = assertInstanceOf(PollOutcome.TokenIssued.class, await(client.poll(session())));

            assertEquals("at", outcome.tokens().accessToken());
            assertEquals(Optional.of("rt"), outcome.tokens().refreshToken());
            assertEquals(3599, outcome.tokens().expiresInSeconds());
        }

        @Test
        @DisplayName("should reject an unknown error code")
        void shouldRejectUnknownError() {
            stubToken(400, "{\"error\":\"invalid_grant\"}");

            assertEquals(CredentialErrorKind.PROVIDER_REJECTED, failureKind(client.poll(session())));
        }
    }

    @Nested
    @DisplayName("Refresh")
    class RefreshTests {

        @Test
        @DisplayName("should exchange the refresh token at the tenant's endpoint")
        void shouldRefresh() {
            stubToken(200, "{\"access_token\":\"at-2\",\"refresh_token\":\"rt-2\",\"expires_in\":3600}");

            final var tokens = await(client.refresh("rt-1", TenantSlot.TARGET, TENANT));

            assertEquals("at-2", tokens.accessToken());
            assertEquals(Optional.of("rt-2"), tokens.refreshToken());
            wireMockServer.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                    .withRequestBody(containing("grant_type=refresh_token"))
                    .withRequestBody(containing("refresh_token=rt-1")));
        }

        @Test
        @DisplayName("should report an invalid grant as a failed refresh")
        void shouldReportInvalidGrant() {
            stubToken(400, "{\"error\":\"invalid_grant\"}");

            assertEquals(
                    CredentialErrorKind.REFRESH_FAILED, failureKind(client.refresh("rt-1", TenantSlot.TARGET, TENANT)));
        }

        @Test
        @DisplayName("should report a server error as rejected")
        void shouldReportServerError() {
            stubToken(503, "{}");

            assertEquals(
                    CredentialErrorKind.PROVIDER_REJECTED,
                    failureKind(client.refresh("rt-1", TenantSlot.TARGET, TENANT)));
        }
    }
}
