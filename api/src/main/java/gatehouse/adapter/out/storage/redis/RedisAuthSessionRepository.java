package gatehouse.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.port.out.AuthSessionRepository;

/**
 * Redis implementation of PKCE session storage.
 *
 * <p>Verifiers are stored as plain string values with SETEX so Redis expires
 * them. {@link #consume} uses GETDEL (Redis 6.2+) for an atomic
 * retrieve-and-delete.
 */
public class RedisAuthSessionRepository implements AuthSessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisAuthSessionRepository.class);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final String keyPrefix;

    public RedisAuthSessionRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Uni<Void> store(String handle, String verifier, Duration ttl) {
        return valueCommands
                .setex(keyPrefix + handle, Math.max(1, ttl.toSeconds()), verifier)
                .invoke(() -> LOG.debugf("Stored PKCE session with TTL: %s", ttl))
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<String>> consume(String handle) {
        return valueCommands.getdel(keyPrefix + handle).map(Optional::ofNullable);
    }
}
