package gatehouse.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import gatehouse.core.config.PkceConfig;
import gatehouse.core.port.out.AuthSessionRepository;
import gatehouse.core.service.storage.StorageSelection;
import gatehouse.spi.AuthSessionStorageProvider;

/**
 * CDI producer for the PKCE session repository.
 *
 * <p>Platform teams can provide custom implementations by implementing
 * {@link AuthSessionStorageProvider} and registering it via CDI.
 */
@ApplicationScoped
public class AuthSessionRepositoryProducer {

    @Produces
    @Singleton
    public StorageSelection<AuthSessionRepository> authSessionStorage(
            Instance<AuthSessionStorageProvider> providers, PkceConfig config) {
        return new StorageSelection<>(
                "PKCE session", () -> config.storage().provider(), providers::stream);
    }

    @Produces
    @ApplicationScoped
    public AuthSessionRepository authSessionRepository(StorageSelection<AuthSessionRepository> selection) {
        return selection.repository();
    }
}
