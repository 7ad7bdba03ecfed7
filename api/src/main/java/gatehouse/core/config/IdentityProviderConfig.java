package gatehouse.core.config;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the upstream identity provider.
 *
 * <p>Configuration prefix: {@code gatehouse.auth.provider}
 *
 * <p>Paths follow the GoTrue-style auth API: a browser-facing authorize
 * endpoint, a token endpoint multiplexed by {@code grant_type}, a signup
 * endpoint and a user-info endpoint.
 */
@ConfigMapping(prefix = "gatehouse.auth.provider")
public interface IdentityProviderConfig {

    /**
     * Base URL of the identity provider, e.g. {@code https://project.example.co}.
     *
     * @return Base URL
     */
    @WithName("base-url")
    Optional<String> baseUrl();

    /**
     * Public API key sent as the {@code apikey} header on every call.
     *
     * @return API key
     */
    @WithName("api-key")
    Optional<String> apiKey();

    /**
     * Authorize endpoint path (browser redirect target).
     *
     * @return Path (default: /auth/v1/authorize)
     */
    @WithName("authorize-path")
    @WithDefault("/auth/v1/authorize")
    String authorizePath();

    /**
     * Token endpoint path for code exchange, password grant and refresh.
     *
     * @return Path (default: /auth/v1/token)
     */
    @WithName("token-path")
    @WithDefault("/auth/v1/token")
    String tokenPath();

    /**
     * Signup endpoint path.
     *
     * @return Path (default: /auth/v1/signup)
     */
    @WithName("signup-path")
    @WithDefault("/auth/v1/signup")
    String signupPath();

    /**
     * User-info endpoint path used for access token verification.
     *
     * @return Path (default: /auth/v1/user)
     */
    @WithName("user-path")
    @WithDefault("/auth/v1/user")
    String userPath();

    /**
     * Absolute URL of this service's OAuth callback, passed as {@code redirect_to}.
     *
     * @return Callback URL
     */
    @WithName("redirect-uri")
    @WithDefault("http://localhost:8080/auth/callback")
    String redirectUri();

    /**
     * Social providers that may be named on login-initiate.
     *
     * @return Allowed provider names (default: google, github)
     */
    @WithName("allowed-providers")
    @WithDefault("google,github")
    Set<String> allowedProviders();

    /**
     * Fixed timeout applied to every provider call. No retries are made.
     *
     * @return Timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration timeout();
}
