package gatehouse.core.service.profile;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.model.profile.Profile;
import gatehouse.core.model.profile.ProfileResolution;
import gatehouse.core.model.profile.ProfileWriteConflictException;
import gatehouse.core.port.out.LoginMetrics;
import gatehouse.core.port.out.ProfileRepository;

/**
 * Get-or-create of the profile for an authenticated subject.
 *
 * <p>Concurrent first logins for one subject race on the store's uniqueness
 * constraint. The loser sees {@link ProfileWriteConflictException} and
 * returns the winner's row, so exactly one row exists per subject.
 */
@ApplicationScoped
public class ProfileResolver {

    private static final Logger LOG = Logger.getLogger(ProfileResolver.class);

    private final ProfileRepository repository;
    private final LoginMetrics metrics;

    @Inject
    public ProfileResolver(ProfileRepository repository, LoginMetrics metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * Find the subject's profile, creating it with {@code onboarded=false} if absent.
     *
     * @param subjectId provider subject identifier
     * @param email     email reported by the provider
     * @return Uni with the profile and whether this call created it
     */
    public Uni<ProfileResolution> resolveOrCreate(String subjectId, String email) {
        return repository.findById(subjectId).flatMap(existing -> {
            if (existing.isPresent()) {
                return Uni.createFrom().item(new ProfileResolution(existing.get(), false));
            }
            return create(subjectId, email);
        });
    }

    private Uni<ProfileResolution> create(String subjectId, String email) {
        return repository
                .insert(Profile.newProfile(subjectId, email, Instant.now()))
                .map(profile -> {
                    LOG.infof("Created profile for subject %s", subjectId);
                    metrics.recordProfileCreated();
                    return new ProfileResolution(profile, true);
                })
                .onFailure(ProfileWriteConflictException.class)
                .recoverWithUni(conflict -> {
                    LOG.debugf("Concurrent profile insert for subject %s, re-reading", subjectId);
                    metrics.recordProfileConflict();
                    return repository
                            .findCommitted(subjectId)
                            .map(reread -> reread.map(p -> new ProfileResolution(p, false))
                                    .orElseThrow(() -> new IllegalStateException(
                                            "Profile for " + subjectId + " vanished after insert conflict")));
                });
    }
}
