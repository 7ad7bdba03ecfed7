package gatehouse.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for PKCE login sessions.
 *
 * <p>Configuration prefix: {@code gatehouse.auth.pkce}
 */
@ConfigMapping(prefix = "gatehouse.auth.pkce")
public interface PkceConfig {

    /**
     * How long a stored verifier remains usable after login-initiate.
     *
     * @return Session TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration ttl();

    /**
     * Interval between sweeps of expired in-memory entries.
     *
     * @return Sweep interval (default: 1 minute)
     */
    @WithName("sweep-interval")
    @WithDefault("PT1M")
    Duration sweepInterval();

    /**
     * Storage configuration for PKCE sessions.
     */
    StorageConfig storage();

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        /**
         * Redis storage configuration.
         */
        interface RedisConfig {

            /**
             * Key prefix for PKCE sessions in Redis.
             *
             * @return Key prefix (default: gatehouse:pkce:)
             */
            @WithName("key-prefix")
            @WithDefault("gatehouse:pkce:")
            String keyPrefix();
        }
    }
}
