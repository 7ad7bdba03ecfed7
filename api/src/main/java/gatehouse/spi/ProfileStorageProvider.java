package gatehouse.spi;

import gatehouse.core.port.out.ProfileRepository;

/**
 * Storage for user profiles.
 *
 * <p>Built-in providers are {@code cassandra} (priority 100, lightweight
 * transactions) and {@code memory} (priority 0, development only). Select one
 * with {@code gatehouse.profile.storage.provider}.
 *
 * <p>Implementations must give {@link ProfileRepository#insert} a real
 * uniqueness guarantee on subject identifier; the resolver relies on it
 * instead of taking a lock.
 */
public interface ProfileStorageProvider extends StorageProvider<ProfileRepository> {}
