package gatehouse.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import gatehouse.core.model.profile.Profile;
import gatehouse.core.model.profile.ProfileWriteConflictException;
import gatehouse.core.port.out.ProfileRepository;

/**
 * In-memory implementation of ProfileRepository.
 *
 * <p>Profiles are lost on restart. {@code putIfAbsent} provides the
 * per-subject uniqueness constraint.
 */
public class InMemoryProfileRepository implements ProfileRepository {

    private final ConcurrentMap<String, Profile> profiles = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<Profile>> findById(String subjectId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(profiles.get(subjectId)));
    }

    @Override
    public Uni<Profile> insert(Profile profile) {
        return Uni.createFrom().item(() -> {
            if (profiles.putIfAbsent(profile.subjectId(), profile) != null) {
                throw new ProfileWriteConflictException(profile.subjectId());
            }
            return profile;
        });
    }

    @Override
    public Uni<Optional<Profile>> completeOnboarding(String subjectId, String displayName, String role, Instant at) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(profiles.computeIfPresent(
                        subjectId,
                        (id, current) ->
                                current.onboarded() ? current : current.withOnboardingCompleted(displayName, role, at))));
    }

    /**
     * Number of stored profiles (for testing).
     */
    public int count() {
        return profiles.size();
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        profiles.clear();
    }
}
