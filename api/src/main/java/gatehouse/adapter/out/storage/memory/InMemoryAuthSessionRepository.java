package gatehouse.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.port.out.AuthSessionRepository;

/**
 * In-memory implementation of PKCE session storage.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances.
 *
 * <p>{@link #consume} uses {@link ConcurrentMap#remove(Object)}, so of two
 * concurrent calls for one handle only one can see the entry.
 */
public class InMemoryAuthSessionRepository implements AuthSessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthSessionRepository.class);

    private final ConcurrentMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryAuthSessionRepository(Duration sweepInterval) {
        this(Clock.systemUTC(), sweepInterval);
    }

    /**
     * @param clock         time source for expiry checks
     * @param sweepInterval interval between expiry sweeps, or null to disable the sweeper
     */
    public InMemoryAuthSessionRepository(Clock clock, Duration sweepInterval) {
        this.clock = clock;
        if (sweepInterval == null) {
            this.cleanupExecutor = null;
        } else {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, "pkce-session-cleanup");
                t.setDaemon(true);
                return t;
            });
            final var millis = sweepInterval.toMillis();
            cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, millis, millis, TimeUnit.MILLISECONDS);
        }
        LOG.info("Initialized in-memory PKCE session repository");
    }

    @Override
    public Uni<Void> store(String handle, String verifier, Duration ttl) {
        return Uni.createFrom().item(() -> {
            sessions.put(handle, new SessionEntry(verifier, clock.instant().plus(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Optional<String>> consume(String handle) {
        return Uni.createFrom().item(() -> {
            final var entry = sessions.remove(handle);
            if (entry == null) {
                return Optional.<String>empty();
            }
            if (!clock.instant().isBefore(entry.expiresAt())) {
                LOG.debug("PKCE session expired before use");
                return Optional.<String>empty();
            }
            return Optional.of(entry.verifier());
        });
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        final var now = clock.instant();
        final var before = sessions.size();

        sessions.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt()));

        final var removed = before - sessions.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired PKCE session entries", removed);
        }
        return removed;
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Current number of stored sessions, expired or not.
     */
    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        sessions.clear();
    }

    private record SessionEntry(String verifier, Instant expiresAt) {}
}
