package gatehouse.core.model.profile;

import java.time.Instant;

/**
 * This system's own record about an authenticated subject.
 *
 * <p>Keyed 1:1 by the identity provider's subject identifier. The
 * {@code onboarded} flag only ever moves from false to true.
 *
 * @param subjectId   primary key, the provider's subject identifier
 * @param email       email at the time the profile was created
 * @param onboarded   whether onboarding has been completed
 * @param displayName name captured during onboarding (null until then)
 * @param role        role chosen during onboarding (null until then)
 * @param createdAt   creation timestamp
 * @param updatedAt   last modification timestamp
 */
public record Profile(
        String subjectId,
        String email,
        boolean onboarded,
        String displayName,
        String role,
        Instant createdAt,
        Instant updatedAt) {

    public Profile {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * A freshly created profile that has not been through onboarding.
     */
    public static Profile newProfile(String subjectId, String email, Instant now) {
        return new Profile(subjectId, email, false, null, null, now, now);
    }

    /**
     * Copy with onboarding completed. Never produces {@code onboarded=false}.
     */
    public Profile withOnboardingCompleted(String displayName, String role, Instant at) {
        return new Profile(subjectId, email, true, displayName, role, createdAt, at);
    }
}
