package credman.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Anti-forgery protection for state-changing endpoints.
 */
@ConfigMapping(prefix = "credman.http.anti-forgery")
public interface AntiForgeryConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Header clients echo the token in.
     */
    @WithName("header-name")
    @WithDefault("X-CSRF-Token")
    String headerName();

    /**
     * Fixed token. When absent a random token is generated at startup.
     */
    Optional<String> token();
}
