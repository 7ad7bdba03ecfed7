package gatehouse.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import gatehouse.core.config.ProfileStorageConfig;
import gatehouse.core.port.out.ProfileRepository;
import gatehouse.core.service.storage.StorageSelection;
import gatehouse.spi.ProfileStorageProvider;

/**
 * CDI producer for the profile repository.
 *
 * @see ProfileStorageProvider
 */
@ApplicationScoped
public class ProfileRepositoryProducer {

    @Produces
    @Singleton
    public StorageSelection<ProfileRepository> profileStorage(
            Instance<ProfileStorageProvider> providers, ProfileStorageConfig config) {
        return new StorageSelection<>("profile", config::provider, providers::stream);
    }

    @Produces
    @ApplicationScoped
    public ProfileRepository profileRepository(StorageSelection<ProfileRepository> selection) {
        return selection.repository();
    }
}
