package gatehouse.spi;

import gatehouse.core.port.out.AuthSessionRepository;

/**
 * Storage for in-flight PKCE verifiers, keyed by the opaque session handle.
 *
 * <p>Built-in providers are {@code redis} (priority 100) and {@code memory}
 * (priority 0, single instance only). Select one with
 * {@code gatehouse.auth.pkce.storage.provider}.
 *
 * <p>Repositories must expire entries after their TTL and must make
 * {@link AuthSessionRepository#consume} an atomic retrieve-and-delete, so
 * that a verifier is handed out at most once.
 */
public interface AuthSessionStorageProvider extends StorageProvider<AuthSessionRepository> {}
