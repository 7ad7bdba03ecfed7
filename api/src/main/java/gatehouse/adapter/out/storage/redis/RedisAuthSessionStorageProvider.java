package gatehouse.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.runtime.Startup;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import gatehouse.core.config.PkceConfig;
import gatehouse.core.port.out.AuthSessionRepository;
import gatehouse.spi.AuthSessionStorageProvider;

/**
 * Redis-backed PKCE session storage, the production default.
 *
 * <p>Redis is pinged once at startup, and only when it is the configured
 * provider. Until the ping answers the provider reports itself as checking,
 * which keeps readiness DOWN instead of letting the in-memory fallback win.
 * A failed or timed-out ping leaves the provider unavailable for the life of
 * the process.
 */
@ApplicationScoped
@Startup // ping at boot, not when the first login happens to look the provider up
public class RedisAuthSessionStorageProvider implements AuthSessionStorageProvider {

    static final String NAME = "redis";
    static final Duration PING_TIMEOUT = Duration.ofSeconds(5);

    private static final Logger LOG = Logger.getLogger(RedisAuthSessionStorageProvider.class);

    enum Reachability {
        NOT_CONFIGURED,
        PINGING,
        REACHABLE,
        UNREACHABLE
    }

    private final ReactiveRedisDataSource redis;
    private final PkceConfig config;

    private volatile Reachability reachability = Reachability.PINGING;
    private volatile String unreachableReason;
    private volatile Instant answeredAt;
    private RedisAuthSessionRepository repository;

    @Inject
    public RedisAuthSessionStorageProvider(ReactiveRedisDataSource redis, PkceConfig config) {
        this.redis = redis;
        this.config = config;
    }

    @PostConstruct
    void ping() {
        if (!NAME.equals(config.storage().provider())) {
            reachability = Reachability.NOT_CONFIGURED;
            LOG.debugf("Redis PKCE session storage not configured; skipping ping");
            return;
        }
        redis.execute("PING")
                .ifNoItem()
                .after(PING_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        pong -> {
                            answeredAt = Instant.now();
                            reachability = Reachability.REACHABLE;
                            LOG.infof("Redis answered PING; PKCE sessions stored under %s", keyPrefix());
                        },
                        failure -> {
                            answeredAt = Instant.now();
                            unreachableReason = String.valueOf(failure.getMessage());
                            reachability = Reachability.UNREACHABLE;
                            LOG.warnf("Redis did not answer PING, PKCE session storage unavailable: %s",
                                    unreachableReason);
                        });
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean isAvailable() {
        return reachability == Reachability.REACHABLE;
    }

    @Override
    public boolean isCheckingAvailability() {
        return reachability == Reachability.PINGING;
    }

    @Override
    public synchronized AuthSessionRepository createRepository() {
        if (repository == null) {
            repository = new RedisAuthSessionRepository(redis, keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = reachability;
        final var builder = HealthCheckResponse.named("pkce-storage-redis")
                .withData("reachability", state.name().toLowerCase(Locale.ROOT))
                .withData("keyPrefix", keyPrefix());
        if (answeredAt != null) {
            builder.withData("checkedAt", answeredAt.toString());
        }
        if (state == Reachability.UNREACHABLE) {
            builder.withData("error", unreachableReason);
        }
        return Optional.of(builder.status(state == Reachability.REACHABLE).build());
    }

    /**
     * Configured prefix, with a trailing {@code :} added when missing so that
     * session keys never run into the prefix.
     */
    String keyPrefix() {
        final var prefix = config.storage().redis().keyPrefix();
        return prefix.isEmpty() || prefix.endsWith(":") ? prefix : prefix + ":";
    }
}
