package credman.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the OAuth identity provider used for both slots.
 *
 * <p>Endpoint templates may contain a {@code {tenant}} placeholder which is
 * replaced with the tenant requested at sign-in, or the default tenant.
 *
 * <p>Example configuration:
 * <pre>{@code
 * credman.provider.client-id=04b07795-8ddb-461a-bbee-02f9e1bf7b46
 * credman.provider.device-authorization-endpoint=https://login.microsoftonline.com/{tenant}/oauth2/v2.0/devicecode
 * credman.provider.token-endpoint=https://login.microsoftonline.com/{tenant}/oauth2/v2.0/token
 * credman.provider.scopes=https://management.azure.com/.default,offline_access
 * }</pre>
 */
@ConfigMapping(prefix = "credman.provider")
public interface ProviderConfig {

    /**
     * Placeholder replaced with the authority tenant in endpoint templates.
     */
    String TENANT_PLACEHOLDER = "{tenant}";

    /**
     * Public client identifier registered with the provider.
     */
    @WithName("client-id")
    String clientId();

    /**
     * Device authorization endpoint template.
     */
    @WithName("device-authorization-endpoint")
    @WithDefault("https://login.microsoftonline.com/{tenant}/oauth2/v2.0/devicecode")
    String deviceAuthorizationEndpoint();

    /**
     * Token endpoint template, used for both the device code and refresh grants.
     */
    @WithName("token-endpoint")
    @WithDefault("https://login.microsoftonline.com/{tenant}/oauth2/v2.0/token")
    String tokenEndpoint();

    /**
     * Tenant used on provider endpoints when sign-in names none.
     *
     * @return default tenant (default: organizations)
     */
    @WithName("default-tenant")
    @WithDefault("organizations")
    String defaultTenant();

    /**
     * Scopes requested during sign-in and refresh.
     */
    @WithDefault("https://management.azure.com/.default,offline_access")
    List<String> scopes();

    /**
     * Timeout for each request to the provider.
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * Access token claim holding the tenant identifier.
     */
    @WithName("tenant-claim")
    @WithDefault("tid")
    String tenantClaim();

    /**
     * Scopes that must appear in the access token's {@code scp} or {@code scope} claim.
     *
     * <p>Empty by default, meaning no scope check.
     */
    @WithName("required-scopes")
    Optional<List<String>> requiredScopes();

    /**
     * Poll interval used when the provider does not return one.
     */
    @WithName("default-poll-interval")
    @WithDefault("PT5S")
    Duration defaultPollInterval();

    /**
     * Device code lifetime used when the provider does not return one.
     */
    @WithName("default-device-code-ttl")
    @WithDefault("PT15M")
    Duration defaultDeviceCodeTtl();

    /**
     * Resolve an endpoint template against an authority tenant.
     */
    static String resolve(String template, String tenant) {
        return template.replace(TENANT_PLACEHOLDER, tenant);
    }
}
