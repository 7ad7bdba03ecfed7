package gatehouse.adapter.in.auth;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;

import gatehouse.core.config.CookieConfig;
import gatehouse.core.config.PkceConfig;
import gatehouse.core.model.auth.TokenSet;

/**
 * Builds the access, refresh and PKCE session cookies.
 *
 * <p>All cookies share the configured path, domain, secure, HttpOnly and
 * SameSite attributes. Clearing a cookie re-issues its name with an empty
 * value and max-age 0.
 */
@ApplicationScoped
public class AuthCookieIssuer {

    private final CookieConfig config;
    private final PkceConfig pkceConfig;

    @Inject
    public AuthCookieIssuer(CookieConfig config, PkceConfig pkceConfig) {
        this.config = config;
        this.pkceConfig = pkceConfig;
    }

    /**
     * Access and refresh cookies for a token set.
     *
     * <p>The access cookie lives as long as the provider says the token does,
     * falling back to the configured lifetime.
     */
    public AuthCookieSet issue(TokenSet tokens) {
        return build(authCookies(tokens));
    }

    /**
     * Access and refresh cookies at the end of the OAuth leg, clearing the PKCE session cookie.
     */
    public AuthCookieSet issueAfterOAuth(TokenSet tokens) {
        final var cookies = authCookies(tokens);
        cookies.add(expired(config.pkceName()));
        return build(cookies);
    }

    /**
     * PKCE session cookie carrying the handle, living as long as the stored verifier.
     */
    public AuthCookieSet pkceSession(String handle) {
        return build(List.of(cookie(config.pkceName(), handle, pkceConfig.ttl())));
    }

    /**
     * Clears only the PKCE session cookie; used on every failed callback.
     */
    public AuthCookieSet clearPkceSession() {
        return build(List.of(expired(config.pkceName())));
    }

    /**
     * Clears access and refresh cookies.
     */
    public AuthCookieSet clearAuth() {
        return build(List.of(expired(config.accessName()), expired(config.refreshName())));
    }

    /**
     * Clears all three cookies.
     */
    public AuthCookieSet logout() {
        return build(List.of(
                expired(config.accessName()), expired(config.refreshName()), expired(config.pkceName())));
    }

    /**
     * An empty set, for responses that must not touch cookies.
     */
    public AuthCookieSet none() {
        return build(List.of());
    }

    public Optional<String> accessToken(HttpHeaders headers) {
        return read(headers, config.accessName());
    }

    public Optional<String> refreshToken(HttpHeaders headers) {
        return read(headers, config.refreshName());
    }

    public Optional<String> pkceHandle(HttpHeaders headers) {
        return read(headers, config.pkceName());
    }

    private List<NewCookie> authCookies(TokenSet tokens) {
        final var accessTtl =
                tokens.expiresIn() > 0 ? Duration.ofSeconds(tokens.expiresIn()) : config.accessMaxAge();
        final List<NewCookie> cookies = new ArrayList<>();
        cookies.add(cookie(config.accessName(), tokens.accessToken(), accessTtl));
        cookies.add(cookie(config.refreshName(), tokens.refreshToken(), config.refreshMaxAge()));
        return cookies;
    }

    private AuthCookieSet build(List<NewCookie> cookies) {
        return new AuthCookieSet(cookies, config.accessName(), config.refreshName());
    }

    private NewCookie cookie(String name, String value, Duration maxAge) {
        return builder(name).value(value).maxAge((int) maxAge.toSeconds()).build();
    }

    private NewCookie expired(String name) {
        return builder(name).value("").maxAge(0).build();
    }

    private NewCookie.Builder builder(String name) {
        final var builder = new NewCookie.Builder(name)
                .path(config.path())
                .secure(config.secure())
                .httpOnly(config.httpOnly())
                .sameSite(parseSameSite(config.sameSite()));
        config.domain().ifPresent(builder::domain);
        return builder;
    }

    private static Optional<String> read(HttpHeaders headers, String name) {
        final Cookie cookie = headers.getCookies().get(name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private static NewCookie.SameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
