package credman.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Token refresh configuration.
 *
 * <p>The sweep interval must be shorter than the lookahead so a token is always
 * visited at least once inside its refresh window.
 */
@ConfigMapping(prefix = "credman.refresh")
public interface RefreshConfig {

    /**
     * Whether the background sweep runs. Reads still refresh on demand.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Tokens expiring within this window are refreshed before being returned.
     *
     * @return lookahead (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration lookahead();

    /**
     * Interval between background sweeps. Read by the scheduler expression.
     *
     * @return sweep interval (default: 3 minutes)
     */
    @WithName("sweep-interval")
    @WithDefault("PT3M")
    Duration sweepInterval();
}
