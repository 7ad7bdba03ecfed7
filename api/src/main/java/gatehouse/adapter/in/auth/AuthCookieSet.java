package gatehouse.adapter.in.auth;

import java.util.List;
import java.util.Optional;

import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;

/**
 * The cookies attached to one response.
 *
 * <p>Only {@link AuthCookieIssuer} creates instances, and every instance
 * either sets both the access and refresh cookie or sets neither; a set
 * carrying only one of them cannot be built.
 */
public final class AuthCookieSet {

    private final List<NewCookie> cookies;

    AuthCookieSet(List<NewCookie> cookies, String accessName, String refreshName) {
        final var access = setsValue(cookies, accessName);
        final var refresh = setsValue(cookies, refreshName);
        if (access != refresh) {
            throw new IllegalStateException("Access and refresh cookies must be issued together");
        }
        this.cookies = List.copyOf(cookies);
    }

    public List<NewCookie> cookies() {
        return cookies;
    }

    public Optional<NewCookie> find(String name) {
        return cookies.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    /**
     * Attach every cookie in this set to a response.
     */
    public Response.ResponseBuilder applyTo(Response.ResponseBuilder builder) {
        return builder.cookie(cookies.toArray(new NewCookie[0]));
    }

    private static boolean setsValue(List<NewCookie> cookies, String name) {
        return cookies.stream()
                .anyMatch(c -> c.getName().equals(name) && c.getMaxAge() != 0 && !c.getValue().isEmpty());
    }
}
