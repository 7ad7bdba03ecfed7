package gatehouse.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gatehouse.core.model.profile.Profile;
import gatehouse.core.model.profile.ProfileWriteConflictException;

/**
 * Port for profile storage.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #insert} MUST enforce uniqueness on subject identifier and fail
 *       with {@link ProfileWriteConflictException} when a row already exists</li>
 *   <li>{@link #completeOnboarding} MUST only touch display name, role,
 *       onboarded and updated-at, and MUST never set onboarded to false</li>
 *   <li>Profiles are never deleted through this port</li>
 * </ul>
 */
public interface ProfileRepository {

    /**
     * Keyed read.
     *
     * @param subjectId subject identifier
     * @return Uni with the profile, or empty if none exists
     */
    Uni<Optional<Profile>> findById(String subjectId);

    /**
     * Keyed read that sees every insert that has already won its uniqueness
     * check, even on a replicated store where the winning row has not reached
     * every replica.
     *
     * <p>Used after {@link #insert} fails with {@link ProfileWriteConflictException}.
     * Stores whose plain reads already give this guarantee can rely on the default.
     *
     * @param subjectId subject identifier
     * @return Uni with the profile, or empty if none exists
     */
    default Uni<Optional<Profile>> findCommitted(String subjectId) {
        return findById(subjectId);
    }

    /**
     * Conflict-safe insert.
     *
     * @param profile profile to create
     * @return Uni with the stored profile, failing with
     *         {@link ProfileWriteConflictException} if the subject already has one
     */
    Uni<Profile> insert(Profile profile);

    /**
     * Field-restricted update that marks onboarding complete.
     *
     * <p>If the profile is already onboarded it is returned unchanged.
     *
     * @param subjectId   subject identifier
     * @param displayName name captured during onboarding
     * @param role        chosen role
     * @param at          update timestamp
     * @return Uni with the resulting profile, or empty if no profile exists
     */
    Uni<Optional<Profile>> completeOnboarding(String subjectId, String displayName, String role, Instant at);
}
