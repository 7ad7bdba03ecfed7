package gatehouse.core.service.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gatehouse.core.port.out.AuthSessionRepository;
import gatehouse.spi.AuthSessionStorageProvider;
import gatehouse.spi.StorageProviderException;

@DisplayName("StorageSelection")
class StorageSelectionTest {

    private static AuthSessionStorageProvider provider(String name, int priority, boolean available) {
        final var provider = mock(AuthSessionStorageProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.priority()).thenReturn(priority);
        when(provider.isAvailable()).thenReturn(available);
        when(provider.createRepository()).thenReturn(mock(AuthSessionRepository.class));
        return provider;
    }

    private static StorageSelection<AuthSessionRepository> selection(
            String configured, AuthSessionStorageProvider... all) {
        return new StorageSelection<>("PKCE session", () -> configured, () -> Stream.of(all));
    }

    @Nested
    @DisplayName("Choosing a provider")
    class Choosing {

        @Test
        @DisplayName("should use the configured provider even when another has higher priority")
        void shouldPreferConfigured() {
            final var memory = provider("memory", 0, true);
            final var redis = provider("redis", 100, true);

            assertSame(memory, selection("memory", memory, redis).provider());
        }

        @Test
        @DisplayName("should fall back to the highest priority available provider")
        void shouldFallBackByPriority() {
            final var memory = provider("memory", 0, true);
            final var redis = provider("redis", 100, false);
            final var custom = provider("custom", 50, true);

            final var selection = selection("redis", memory, redis, custom);

            assertSame(custom, selection.provider());
            assertEquals(List.of(memory, custom), selection.availableProviders());
        }

        @Test
        @DisplayName("should fail when no provider is available")
        void shouldFailWithoutProviders() {
            final var selection = selection("redis", provider("redis", 100, false));

            assertThrows(IllegalStateException.class, selection::provider);
        }

        @Test
        @DisplayName("should keep its first choice after availability changes")
        void shouldKeepFirstChoice() {
            final var memory = provider("memory", 0, true);
            final var redis = provider("redis", 100, false);
            final var selection = selection("redis", memory, redis);

            assertSame(memory, selection.provider());
            when(redis.isAvailable()).thenReturn(true);

            assertSame(memory, selection.provider());
        }
    }

    @Nested
    @DisplayName("Pending selection")
    class Pending {

        @Test
        @DisplayName("should be pending while the configured provider is checking")
        void shouldWaitForConfiguredProvider() {
            final var memory = provider("memory", 0, true);
            final var redis = provider("redis", 100, false);
            when(redis.isCheckingAvailability()).thenReturn(true);

            final var selection = selection("redis", memory, redis);

            assertTrue(selection.isPending());

            when(redis.isCheckingAvailability()).thenReturn(false);
            when(redis.isAvailable()).thenReturn(true);

            assertFalse(selection.isPending());
            assertSame(redis, selection.provider());
        }

        @Test
        @DisplayName("should not wait for a provider that is not configured")
        void shouldIgnoreUnconfiguredCheckingProvider() {
            final var memory = provider("memory", 0, true);
            final var redis = provider("redis", 100, false);
            when(redis.isCheckingAvailability()).thenReturn(true);

            assertFalse(selection("memory", memory, redis).isPending());
        }
    }

    @Nested
    @DisplayName("Repository")
    class Repository {

        @Test
        @DisplayName("should create the repository only once")
        void shouldCacheRepository() {
            final var memory = provider("memory", 0, true);
            final var selection = selection("memory", memory);

            final var first = selection.repository();
            final var second = selection.repository();

            assertSame(first, second);
            verify(memory, times(1)).createRepository();
        }

        @Test
        @DisplayName("should retry creation after the provider failed to connect")
        void shouldRetryAfterConnectFailure() {
            final var redis = provider("redis", 100, true);
            final var repository = mock(AuthSessionRepository.class);
            when(redis.createRepository())
                    .thenThrow(new StorageProviderException("connection refused"))
                    .thenReturn(repository);
            final var selection = selection("redis", redis);

            assertThrows(StorageProviderException.class, selection::repository);
            assertSame(repository, selection.repository());
        }
    }
}
