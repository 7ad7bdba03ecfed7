package gatehouse.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

/**
 * Common contract of the pluggable stores.
 *
 * <p>A provider is discovered through CDI and chosen by
 * {@code gatehouse.core.service.storage.StorageSelection}: the provider named in
 * configuration if it is available, otherwise the available provider with the
 * highest priority.
 *
 * @param <R> repository port the provider creates
 */
public interface StorageProvider<R> {

    /**
     * @return name used to select the provider in configuration
     */
    String name();

    /**
     * @return priority for automatic selection (higher wins)
     */
    int priority();

    /**
     * Must return quickly; it is called on every selection attempt.
     *
     * @return true if the provider can be used now
     */
    boolean isAvailable();

    /**
     * A provider that learns its availability asynchronously reports true
     * until it knows. Selection waits for it when it is the configured one.
     *
     * @return true while an availability check is in flight
     */
    default boolean isCheckingAvailability() {
        return false;
    }

    /**
     * Create the repository. Called at most once per selection.
     *
     * @return repository instance
     * @throws StorageProviderException if the backend cannot be reached
     */
    R createRepository();

    /**
     * @return health of the backend, or empty if the provider has no check
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
