package gatehouse.core.service.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import gatehouse.adapter.out.storage.memory.InMemoryProfileRepository;
import gatehouse.core.config.OnboardingConfig;
import gatehouse.core.model.profile.Profile;

@DisplayName("OnboardingService")
class OnboardingServiceTest {

    private InMemoryProfileRepository repository;
    private OnboardingService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryProfileRepository();
        final var config = mock(OnboardingConfig.class);
        when(config.roles()).thenReturn(Set.of("buyer", "seller"));
        service = new OnboardingService(repository, config);
    }

    private void existing(String subjectId) {
        repository.insert(Profile.newProfile(subjectId, "a@b.com", Instant.now())).await().indefinitely();
    }

    @Nested
    @DisplayName("completeOnboarding()")
    class CompleteTests {

        @Test
        @DisplayName("should mark the profile onboarded with trimmed name and normalized role")
        void shouldCompleteOnboarding() {
            existing("sub-1");

            final var profile = service.completeOnboarding("sub-1", "  Ada Lovelace ", " Seller")
                    .await()
                    .indefinitely()
                    .orElseThrow();

            assertTrue(profile.onboarded());
            assertEquals("Ada Lovelace", profile.displayName());
            assertEquals("seller", profile.role());
            assertEquals("a@b.com", profile.email());
        }

        @Test
        @DisplayName("should return empty when the subject has no profile")
        void shouldReturnEmptyWithoutProfile() {
            final var result = service.completeOnboarding("missing", "Ada", "buyer").await().indefinitely();

            assertTrue(result.isEmpty());
            assertEquals(0, repository.count());
        }

        @Test
        @DisplayName("should leave an already onboarded profile unchanged")
        void shouldNotOverwriteCompletedOnboarding() {
            existing("sub-2");
            service.completeOnboarding("sub-2", "First", "buyer").await().indefinitely();

            final var profile = service.completeOnboarding("sub-2", "Second", "seller")
                    .await()
                    .indefinitely()
                    .orElseThrow();

            assertTrue(profile.onboarded());
            assertEquals("First", profile.displayName());
            assertEquals("buyer", profile.role());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   "})
        @DisplayName("should reject a blank name")
        void shouldRejectBlankName(String name) {
            assertThrows(IllegalArgumentException.class, () -> service.completeOnboarding("sub-1", name, "buyer"));
        }

        @Test
        @DisplayName("should reject a name longer than 200 characters")
        void shouldRejectLongName() {
            final var name = "x".repeat(201);

            assertThrows(IllegalArgumentException.class, () -> service.completeOnboarding("sub-1", name, "buyer"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"admin", "buyers"})
        @DisplayName("should reject a role outside the configured set")
        void shouldRejectUnknownRole(String role) {
            existing("sub-3");

            assertThrows(IllegalArgumentException.class, () -> service.completeOnboarding("sub-3", "Ada", role));
            assertFalse(repository.findById("sub-3").await().indefinitely().orElseThrow().onboarded());
        }
    }
}
