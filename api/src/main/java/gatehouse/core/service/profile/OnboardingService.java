package gatehouse.core.service.profile;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.config.OnboardingConfig;
import gatehouse.core.model.profile.Profile;
import gatehouse.core.port.in.OnboardingManagement;
import gatehouse.core.port.out.ProfileRepository;

/**
 * Records the one-way transition of a profile to onboarded.
 */
@ApplicationScoped
public class OnboardingService implements OnboardingManagement {

    private static final Logger LOG = Logger.getLogger(OnboardingService.class);
    private static final int MAX_NAME_LENGTH = 200;

    private final ProfileRepository repository;
    private final OnboardingConfig config;

    @Inject
    public OnboardingService(ProfileRepository repository, OnboardingConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @Override
    public Uni<Optional<Profile>> completeOnboarding(String subjectId, String displayName, String role) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Full name is required");
        }
        final var name = displayName.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Full name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        final var normalizedRole = role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
        if (!config.roles().contains(normalizedRole)) {
            throw new IllegalArgumentException("Role must be one of " + config.roles());
        }

        return repository
                .completeOnboarding(subjectId, name, normalizedRole, Instant.now())
                .invoke(result -> {
                    if (result.isPresent()) {
                        LOG.infof("Onboarding complete for subject %s (role: %s)", subjectId, normalizedRole);
                    } else {
                        LOG.debugf("No profile to onboard for subject %s", subjectId);
                    }
                });
    }
}
