package gatehouse.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for login navigation and credential rules.
 *
 * <p>Configuration prefix: {@code gatehouse.auth.login}
 */
@ConfigMapping(prefix = "gatehouse.auth.login")
public interface LoginConfig {

    /**
     * Login page; failures on the OAuth leg redirect here.
     */
    @WithName("login-path")
    @WithDefault("/login")
    String loginPath();

    /**
     * Destination for states A and B.
     */
    @WithName("onboarding-path")
    @WithDefault("/onboarding")
    String onboardingPath();

    /**
     * Destination for state C.
     */
    @WithName("dashboard-path")
    @WithDefault("/dashboard")
    String dashboardPath();

    /**
     * Minimum password length checked before any provider call.
     */
    @WithName("min-password-length")
    @WithDefault("6")
    int minPasswordLength();
}
