package credman.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Credential storage configuration.
 *
 * <p>Configuration prefix: {@code credman.storage}
 */
@ConfigMapping(prefix = "credman.storage")
public interface StorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: file, memory, or a custom SPI name. When empty,
     * the available provider with the highest priority is used.
     */
    Optional<String> provider();

    /**
     * Prefix applied to every storage key.
     *
     * @return key prefix (default: credman:)
     */
    @WithName("key-prefix")
    @WithDefault("credman:")
    String keyPrefix();

    FileConfig file();

    /**
     * File storage configuration.
     */
    interface FileConfig {

        /**
         * Directory holding one encrypted file per key. Created if missing.
         */
        @WithDefault("${user.home}/.credman/credentials")
        String directory();
    }
}
