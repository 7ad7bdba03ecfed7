package gatehouse.adapter.out.storage.memory;

import java.util.Optional;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import gatehouse.core.config.PkceConfig;
import gatehouse.core.port.out.AuthSessionRepository;
import gatehouse.spi.AuthSessionStorageProvider;

/**
 * Process-local PKCE session storage.
 *
 * <p>Always available, so it is what selection falls back to when Redis is
 * not. A verifier stored here is only found again by the same instance: a
 * callback routed to another replica ends in {@code session_expired}.
 */
@ApplicationScoped
public class InMemoryAuthSessionStorageProvider implements AuthSessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthSessionStorageProvider.class);

    private final PkceConfig config;
    private InMemoryAuthSessionRepository repository;

    @Inject
    public InMemoryAuthSessionStorageProvider(PkceConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized AuthSessionRepository createRepository() {
        if (repository == null) {
            LOG.warnf(
                    "PKCE sessions kept in process memory (TTL %s, swept every %s); "
                            + "run one instance or use sticky sessions",
                    config.ttl(),
                    config.sweepInterval());
            repository = new InMemoryAuthSessionRepository(config.sweepInterval());
        }
        return repository;
    }

    @Override
    public synchronized Optional<HealthCheckResponse> healthCheck() {
        final var pending = repository == null ? 0 : repository.getSessionCount();
        return Optional.of(HealthCheckResponse.named("pkce-storage-memory")
                .up()
                .withData("pendingLogins", pending)
                .build());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (repository != null) {
            repository.shutdown();
        }
    }
}
