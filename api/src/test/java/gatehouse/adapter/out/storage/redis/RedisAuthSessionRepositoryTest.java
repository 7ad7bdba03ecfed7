package gatehouse.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("RedisAuthSessionRepository")
@ExtendWith(MockitoExtension.class)
class RedisAuthSessionRepositoryTest {

    private static final String PREFIX = "gatehouse:pkce:";

    @Mock
    private ReactiveRedisDataSource dataSource;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    private RedisAuthSessionRepository repository;

    @BeforeEach
    void setUp() {
        when(dataSource.value(String.class, String.class)).thenReturn(valueCommands);
        repository = new RedisAuthSessionRepository(dataSource, PREFIX);
    }

    @Test
    @DisplayName("should store the verifier with SETEX under the prefixed key")
    void shouldStoreWithExpiry() {
        when(valueCommands.setex(PREFIX + "handle-1", 600L, "verifier-1")).thenReturn(Uni.createFrom().voidItem());

        repository.store("handle-1", "verifier-1", Duration.ofMinutes(10)).await().indefinitely();

        verify(valueCommands).setex(PREFIX + "handle-1", 600L, "verifier-1");
    }

    @Test
    @DisplayName("should never store with a zero TTL")
    void shouldClampTtl() {
        when(valueCommands.setex(PREFIX + "handle-1", 1L, "verifier-1")).thenReturn(Uni.createFrom().voidItem());

        repository.store("handle-1", "verifier-1", Duration.ofMillis(10)).await().indefinitely();

        verify(valueCommands).setex(PREFIX + "handle-1", 1L, "verifier-1");
    }

    @Test
    @DisplayName("should consume with GETDEL")
    void shouldConsumeAtomically() {
        when(valueCommands.getdel(PREFIX + "handle-1")).thenReturn(Uni.createFrom().item("verifier-1"));

        assertEquals(Optional.of("verifier-1"), repository.consume("handle-1").await().indefinitely());
    }

    @Test
    @DisplayName("should return empty when the key is gone")
    void shouldReturnEmptyForMissingKey() {
        when(valueCommands.getdel(PREFIX + "handle-2")).thenReturn(Uni.createFrom().nullItem());

        assertTrue(repository.consume("handle-2").await().indefinitely().isEmpty());
    }
}
