package gatehouse.core.config;

import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for onboarding completion.
 *
 * <p>Configuration prefix: {@code gatehouse.onboarding}
 */
@ConfigMapping(prefix = "gatehouse.onboarding")
public interface OnboardingConfig {

    /**
     * Roles a user may pick when finishing onboarding.
     *
     * @return Allowed roles (default: buyer, seller)
     */
    @WithDefault("buyer,seller")
    Set<String> roles();
}
