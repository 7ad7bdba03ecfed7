package gatehouse.adapter.out.storage.memory;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import gatehouse.core.port.out.ProfileRepository;
import gatehouse.spi.ProfileStorageProvider;

/**
 * In-memory profile storage provider (development only).
 */
@ApplicationScoped
public class InMemoryProfileStorageProvider implements ProfileStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryProfileStorageProvider.class);

    private volatile InMemoryProfileRepository repository;

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
    public synchronized ProfileRepository createRepository() {
        if (repository == null) {
            LOG.warn("Profile storage is in-memory only; profiles will be lost on restart");
            repository = new InMemoryProfileRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("profile-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("profiles", repository != null ? repository.count() : 0)
                .build());
    }
}
