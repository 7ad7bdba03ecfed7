package gatehouse.core.service.storage;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import gatehouse.spi.StorageProvider;
import gatehouse.spi.StorageProviderException;

/**
 * Picks one {@link StorageProvider} for a store and holds the repository it creates.
 *
 * <p>The configured provider wins when it is available. When it is still
 * checking its availability the choice is deferred, see {@link #isPending()}.
 * Otherwise the available provider with the highest priority is used.
 *
 * <p>A choice, once made, is final for the life of the application, so a
 * repository handed to callers never changes under them.
 *
 * @param <R> repository port of the store
 */
public final class StorageSelection<R> {

    private static final Logger LOG = Logger.getLogger(StorageSelection.class);

    private final String store;
    private final Supplier<String> configuredName;
    private final Supplier<? extends Stream<? extends StorageProvider<R>>> providers;

    private StorageProvider<R> selected;
    private R repository;

    /**
     * @param store          store label used in logs and errors
     * @param configuredName supplies the configured provider name
     * @param providers      supplies every registered provider of the store
     */
    public StorageSelection(
            String store,
            Supplier<String> configuredName,
            Supplier<? extends Stream<? extends StorageProvider<R>>> providers) {
        this.store = store;
        this.configuredName = configuredName;
        this.providers = providers;
    }

    public String store() {
        return store;
    }

    /**
     * Repository of the selected provider, created on first call.
     *
     * @throws StorageProviderException if the provider cannot create it; the next call retries
     */
    public synchronized R repository() {
        if (repository == null) {
            repository = provider().createRepository();
        }
        return repository;
    }

    /**
     * @throws IllegalStateException if no provider is available
     */
    public synchronized StorageProvider<R> provider() {
        if (selected == null) {
            selected = choose();
        }
        return selected;
    }

    /**
     * True while nothing is selected yet and the configured provider has not
     * finished checking its availability. Selecting now would pin a fallback.
     */
    public synchronized boolean isPending() {
        if (selected != null) {
            return false;
        }
        final var name = configuredName.get();
        return providers.get().anyMatch(p -> p.name().equals(name) && p.isCheckingAvailability());
    }

    public List<StorageProvider<R>> availableProviders() {
        return providers.get().filter(StorageProvider::isAvailable).<StorageProvider<R>>map(p -> p).toList();
    }

    private StorageProvider<R> choose() {
        final var name = configuredName.get();
        StorageProvider<R> configured = null;
        StorageProvider<R> best = null;
        for (StorageProvider<R> candidate : availableProviders()) {
            if (candidate.name().equals(name)) {
                configured = candidate;
            }
            if (best == null || candidate.priority() > best.priority()) {
                best = candidate;
            }
        }

        if (configured != null) {
            LOG.infof("Using configured %s storage provider: %s", store, name);
            return configured;
        }
        if (best == null) {
            throw new IllegalStateException("No " + store + " storage provider is available");
        }
        LOG.warnf(
                "Configured %s storage provider '%s' is not available; using %s (priority %d)",
                store,
                name,
                best.name(),
                best.priority());
        return best;
    }
}
