package gatehouse.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for profile storage.
 *
 * <p>Configuration prefix: {@code gatehouse.profile.storage}
 */
@ConfigMapping(prefix = "gatehouse.profile.storage")
public interface ProfileStorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: cassandra, memory, or custom SPI name.
     *
     * @return Provider name (default: cassandra)
     */
    @WithDefault("cassandra")
    String provider();

    /**
     * Cassandra connection settings.
     */
    CassandraConfig cassandra();

    interface CassandraConfig {

        /**
         * Enable the Cassandra provider. When false it reports itself unavailable.
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Comma-separated host:port pairs.
         */
        @WithName("contact-points")
        @WithDefault("localhost:9042")
        String contactPoints();

        @WithDefault("datacenter1")
        String datacenter();

        @WithDefault("gatehouse")
        String keyspace();

        /**
         * Apply CQL migrations from {@code db/cassandra/} on first use.
         */
        @WithName("run-migrations")
        @WithDefault("false")
        boolean runMigrations();

        Optional<String> username();

        Optional<String> password();
    }
}
