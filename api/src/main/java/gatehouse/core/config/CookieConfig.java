package gatehouse.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for authentication cookies.
 *
 * <p>Configuration prefix: {@code gatehouse.auth.cookie}
 *
 * <p>All three cookies share the same path, domain and security attributes;
 * only names and lifetimes differ.
 */
@ConfigMapping(prefix = "gatehouse.auth.cookie")
public interface CookieConfig {

    @WithName("access-name")
    @WithDefault("access-token")
    String accessName();

    @WithName("refresh-name")
    @WithDefault("refresh-token")
    String refreshName();

    @WithName("pkce-name")
    @WithDefault("pkce-session")
    String pkceName();

    @WithDefault("/")
    String path();

    /**
     * Cookie domain. If not set, defaults to the request domain.
     */
    Optional<String> domain();

    /**
     * Mark cookies as secure (HTTPS only).
     *
     * @return true if secure (default: true)
     */
    @WithDefault("true")
    boolean secure();

    /**
     * Mark cookies as HttpOnly (not accessible via JavaScript).
     *
     * @return true if HttpOnly (default: true)
     */
    @WithName("http-only")
    @WithDefault("true")
    boolean httpOnly();

    /**
     * SameSite attribute.
     *
     * @return SameSite value: Strict, Lax, or None (default: Lax)
     */
    @WithName("same-site")
    @WithDefault("Lax")
    String sameSite();

    /**
     * Lifetime of the access cookie.
     *
     * @return Max age (default: 1 hour)
     */
    @WithName("access-max-age")
    @WithDefault("PT1H")
    Duration accessMaxAge();

    /**
     * Lifetime of the refresh cookie.
     *
     * @return Max age (default: 30 days)
     */
    @WithName("refresh-max-age")
    @WithDefault("P30D")
    Duration refreshMaxAge();
}
