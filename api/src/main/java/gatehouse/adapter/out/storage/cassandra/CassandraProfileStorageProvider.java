package gatehouse.adapter.out.storage.cassandra;

import java.net.InetSocketAddress;
import java.util.Optional;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import gatehouse.core.config.ProfileStorageConfig;
import gatehouse.core.port.out.ProfileRepository;
import gatehouse.spi.ProfileStorageProvider;
import gatehouse.spi.StorageProviderException;

/**
 * Cassandra storage provider for profiles.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>gatehouse.profile.storage.cassandra.enabled - Turn the provider on (default: false)</li>
 *   <li>gatehouse.profile.storage.cassandra.contact-points - Comma-separated host:port pairs</li>
 *   <li>gatehouse.profile.storage.cassandra.datacenter - Local datacenter name</li>
 *   <li>gatehouse.profile.storage.cassandra.keyspace - Keyspace name</li>
 *   <li>gatehouse.profile.storage.cassandra.username / password - Optional credentials</li>
 * </ul>
 */
@ApplicationScoped
public class CassandraProfileStorageProvider implements ProfileStorageProvider {

    private static final Logger LOG = Logger.getLogger(CassandraProfileStorageProvider.class);

    private final ProfileStorageConfig config;
    private volatile CqlSession session;
    private volatile CassandraProfileRepository repository;

    @Inject
    public CassandraProfileStorageProvider(ProfileStorageConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "cassandra";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean isAvailable() {
        return config.cassandra().enabled();
    }

    @Override
    public synchronized ProfileRepository createRepository() {
        if (repository == null) {
            final var cassandra = config.cassandra();
            if (cassandra.runMigrations()) {
                try (CqlSession bootstrap = builder(cassandra).build()) {
                    new CassandraMigrationRunner(bootstrap, cassandra.keyspace()).runKeyspaceMigration();
                } catch (RuntimeException e) {
                    throw new StorageProviderException("Failed to create Cassandra keyspace", e);
                }
            }
            try {
                session = builder(cassandra).withKeyspace(cassandra.keyspace()).build();
            } catch (RuntimeException e) {
                throw new StorageProviderException("Failed to connect to Cassandra for profile storage", e);
            }
            if (cassandra.runMigrations()) {
                try {
                    new CassandraMigrationRunner(session, cassandra.keyspace()).runMigrations();
                } catch (RuntimeException e) {
                    session.close();
                    session = null;
                    throw new StorageProviderException("Failed to apply Cassandra migrations", e);
                }
            }
            repository = new CassandraProfileRepository(session);
            LOG.infof("Created Cassandra profile repository in keyspace %s", cassandra.keyspace());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var current = session;
        if (current == null || current.isClosed()) {
            return Optional.of(HealthCheckResponse.named("profile-storage-cassandra")
                    .down()
                    .withData("type", "cassandra")
                    .withData("error", "Session not initialized or closed")
                    .build());
        }
        try {
            final long start = System.currentTimeMillis();
            current.execute("SELECT release_version FROM system.local");
            return Optional.of(HealthCheckResponse.named("profile-storage-cassandra")
                    .up()
                    .withData("type", "cassandra")
                    .withData("latencyMs", System.currentTimeMillis() - start)
                    .build());
        } catch (RuntimeException e) {
            return Optional.of(HealthCheckResponse.named("profile-storage-cassandra")
                    .down()
                    .withData("type", "cassandra")
                    .withData("error", String.valueOf(e.getMessage()))
                    .build());
        }
    }

    @PreDestroy
    void close() {
        if (session != null) {
            session.close();
        }
    }

    private static CqlSessionBuilder builder(ProfileStorageConfig.CassandraConfig cassandra) {
        final CqlSessionBuilder builder = CqlSession.builder().withLocalDatacenter(cassandra.datacenter());
        for (String contactPoint : cassandra.contactPoints().split(",")) {
            final String[] parts = contactPoint.trim().split(":");
            final int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(parts[0], port));
        }
        cassandra.username().ifPresent(username -> {
            final String password = cassandra.password()
                    .orElseThrow(() ->
                            new StorageProviderException("Cassandra password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });
        return builder;
    }
}
