package credman.adapter.in.rest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import credman.core.config.AntiForgeryConfig;

/**
 * Holds the anti-forgery token required on state-changing endpoints.
 *
 * <p>The token is either configured or generated once per process.
 */
@ApplicationScoped
public class AntiForgeryTokens {

    private static final Logger LOG = Logger.getLogger(AntiForgeryTokens.class);
    private static final int TOKEN_BYTES = 32;

    private final AntiForgeryConfig config;
    private final String token;

    @Inject
    public AntiForgeryTokens(AntiForgeryConfig config) {
        this.config = config;
        this.token = config.token().filter(t -> !t.isBlank()).orElseGet(AntiForgeryTokens::generate);
        if (config.token().isEmpty() && config.enabled()) {
            LOG.info("No anti-forgery token configured, generated one for this process");
        }
    }

    public boolean enabled() {
        return config.enabled();
    }

    public String headerName() {
        return config.headerName();
    }

    public String token() {
        return token;
    }

    /**
     * Constant-time comparison of a presented token.
     */
    public boolean matches(String presented) {
        if (presented == null || presented.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private static String generate() {
        final var bytes = new byte[TOKEN_BYTES];
        new SecureRandom().nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
