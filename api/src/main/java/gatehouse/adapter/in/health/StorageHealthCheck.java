package gatehouse.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import gatehouse.core.port.out.AuthSessionRepository;
import gatehouse.core.port.out.ProfileRepository;
import gatehouse.core.service.storage.StorageSelection;
import gatehouse.spi.StorageProviderException;

/**
 * Readiness check for the selected PKCE session and profile stores.
 *
 * <p>DOWN while a store's configured provider is still checking its
 * availability, when a store cannot connect, or when its provider reports
 * DOWN. Providers without a health check of their own count as UP.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(StorageHealthCheck.class);

    private final StorageSelection<AuthSessionRepository> sessionStorage;
    private final StorageSelection<ProfileRepository> profileStorage;

    @Inject
    public StorageHealthCheck(
            StorageSelection<AuthSessionRepository> sessionStorage, StorageSelection<ProfileRepository> profileStorage) {
        this.sessionStorage = sessionStorage;
        this.profileStorage = profileStorage;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("storage");
        final var sessionUp = report(sessionStorage, "pkce-session", builder);
        final var profileUp = report(profileStorage, "profile", builder);
        return (sessionUp && profileUp ? builder.up() : builder.down()).build();
    }

    private static boolean report(StorageSelection<?> storage, String key, HealthCheckResponseBuilder builder) {
        if (storage.isPending()) {
            builder.withData(key + ".provider", "pending");
            builder.withData(key + ".up", false);
            return false;
        }
        final var provider = storage.provider();
        final var up = connect(storage)
                && provider.healthCheck()
                        .map(r -> r.getStatus() == HealthCheckResponse.Status.UP)
                        .orElse(true);
        builder.withData(key + ".provider", provider.name());
        builder.withData(key + ".up", up);
        return up;
    }

    /**
     * Providers connect lazily; a readiness probe forces the connection.
     */
    private static boolean connect(StorageSelection<?> storage) {
        try {
            storage.repository();
            return true;
        } catch (StorageProviderException e) {
            LOG.warnf(e, "Could not connect to %s store", storage.store());
            return false;
        }
    }
}
