package gatehouse.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import gatehouse.core.config.CookieConfig;
import gatehouse.core.config.PkceConfig;
import gatehouse.core.model.auth.TokenSet;

@DisplayName("AuthCookieIssuer")
@ExtendWith(MockitoExtension.class)
class AuthCookieIssuerTest {

    @Mock
    private CookieConfig config;

    @Mock
    private PkceConfig pkceConfig;

    @Mock
    private HttpHeaders headers;

    private AuthCookieIssuer issuer;

    @BeforeEach
    void setUp() {
        lenient().when(config.accessName()).thenReturn("access-token");
        lenient().when(config.refreshName()).thenReturn("refresh-token");
        lenient().when(config.pkceName()).thenReturn("pkce-session");
        lenient().when(config.path()).thenReturn("/");
        lenient().when(config.domain()).thenReturn(Optional.empty());
        lenient().when(config.secure()).thenReturn(true);
        lenient().when(config.httpOnly()).thenReturn(true);
        lenient().when(config.sameSite()).thenReturn("Lax");
        lenient().when(config.accessMaxAge()).thenReturn(Duration.ofHours(1));
        lenient().when(config.refreshMaxAge()).thenReturn(Duration.ofDays(30));
        lenient().when(pkceConfig.ttl()).thenReturn(Duration.ofMinutes(10));

        issuer = new AuthCookieIssuer(config, pkceConfig);
    }

    private static TokenSet tokens(long expiresIn) {
        return new TokenSet("access-1", "refresh-1", "sub-1", "a@b.com", "google", Instant.now(), expiresIn);
    }

    @Nested
    @DisplayName("issue()")
    class IssueTests {

        @Test
        @DisplayName("should set both cookies with shared security attributes")
        void shouldIssueBothCookies() {
            final var set = issuer.issue(tokens(1800));

            final var access = set.find("access-token").orElseThrow();
            final var refresh = set.find("refresh-token").orElseThrow();
            assertEquals("access-1", access.getValue());
            assertEquals("refresh-1", refresh.getValue());
            for (NewCookie cookie : set.cookies()) {
                assertTrue(cookie.isHttpOnly());
                assertTrue(cookie.isSecure());
                assertEquals("/", cookie.getPath());
                assertEquals(NewCookie.SameSite.LAX, cookie.getSameSite());
            }
        }

        @Test
        @DisplayName("should use the token lifetime for the access cookie")
        void shouldUseTokenLifetime() {
            final var set = issuer.issue(tokens(1800));

            assertEquals(1800, set.find("access-token").orElseThrow().getMaxAge());
            assertEquals(Duration.ofDays(30).toSeconds(), set.find("refresh-token").orElseThrow().getMaxAge());
        }

        @Test
        @DisplayName("should fall back to the configured lifetime when the provider gives none")
        void shouldFallBackToConfiguredLifetime() {
            final var set = issuer.issue(tokens(0));

            assertEquals(3600, set.find("access-token").orElseThrow().getMaxAge());
        }

        @Test
        @DisplayName("should clear the PKCE session cookie after the OAuth leg")
        void shouldClearPkceAfterOAuth() {
            final var set = issuer.issueAfterOAuth(tokens(1800));

            final var pkce = set.find("pkce-session").orElseThrow();
            assertEquals(0, pkce.getMaxAge());
            assertEquals("", pkce.getValue());
            assertEquals(3, set.cookies().size());
        }

        @Test
        @DisplayName("should honor the configured domain and SameSite")
        void shouldApplyDomainAndSameSite() {
            lenient().when(config.domain()).thenReturn(Optional.of("example.com"));
            lenient().when(config.sameSite()).thenReturn("strict");

            final var access = issuer.issue(tokens(60)).find("access-token").orElseThrow();

            assertEquals("example.com", access.getDomain());
            assertEquals(NewCookie.SameSite.STRICT, access.getSameSite());
        }
    }

    @Nested
    @DisplayName("clearing")
    class ClearTests {

        @Test
        @DisplayName("should expire all three cookies on logout")
        void shouldExpireAllOnLogout() {
            final var set = issuer.logout();

            assertEquals(3, set.cookies().size());
            set.cookies().forEach(c -> assertEquals(0, c.getMaxAge()));
        }

        @Test
        @DisplayName("should expire access and refresh together")
        void shouldClearAuthTogether() {
            final var set = issuer.clearAuth();

            assertEquals(0, set.find("access-token").orElseThrow().getMaxAge());
            assertEquals(0, set.find("refresh-token").orElseThrow().getMaxAge());
            assertFalse(set.find("pkce-session").isPresent());
        }

        @Test
        @DisplayName("should scope the PKCE cookie to the verifier TTL")
        void shouldScopePkceCookie() {
            final var pkce = issuer.pkceSession("handle-1").find("pkce-session").orElseThrow();

            assertEquals("handle-1", pkce.getValue());
            assertEquals(600, pkce.getMaxAge());
        }
    }

    @Test
    @DisplayName("should refuse a set carrying only one of access and refresh")
    void shouldRejectHalfSet() {
        final var onlyAccess = new NewCookie.Builder("access-token").value("a").maxAge(60).build();

        assertThrows(
                IllegalStateException.class,
                () -> new AuthCookieSet(List.of(onlyAccess), "access-token", "refresh-token"));
    }

    @Test
    @DisplayName("should read non-blank cookie values")
    void shouldReadCookies() {
        lenient().when(headers.getCookies())
                .thenReturn(Map.of(
                        "access-token", new Cookie.Builder("access-token").value("a").build(),
                        "refresh-token", new Cookie.Builder("refresh-token").value("").build()));

        assertEquals(Optional.of("a"), issuer.accessToken(headers));
        assertTrue(issuer.refreshToken(headers).isEmpty());
        assertTrue(issuer.pkceHandle(headers).isEmpty());
    }
}
