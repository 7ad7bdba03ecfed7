package gatehouse.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gatehouse.core.model.profile.Profile;

/**
 * Port interface for finishing onboarding.
 */
public interface OnboardingManagement {

    /**
     * Mark the subject's profile as onboarded.
     *
     * @param subjectId   authenticated subject
     * @param displayName name entered by the user
     * @param role        chosen role
     * @return Uni with the updated profile, or empty if the subject has no profile
     * @throws IllegalArgumentException if the name is blank or the role is not allowed
     */
    Uni<Optional<Profile>> completeOnboarding(String subjectId, String displayName, String role);
}
