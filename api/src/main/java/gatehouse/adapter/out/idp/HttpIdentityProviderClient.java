package gatehouse.adapter.out.idp;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.netty.channel.ConnectTimeoutException;
import io.smallrye.mutiny.Uni;
import io.vertx.core.impl.NoStackTraceTimeoutException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import gatehouse.core.config.IdentityProviderConfig;
import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.auth.TokenSet;
import gatehouse.core.port.out.IdentityProviderClient;
import gatehouse.core.service.auth.PkceService;

/**
 * Identity provider client for a GoTrue-style auth API.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code GET authorize?provider=..&redirect_to=..&code_challenge=..} - browser redirect target</li>
 *   <li>{@code POST token?grant_type=pkce|password|refresh_token} - JSON body, returns a session</li>
 *   <li>{@code POST signup} - JSON body, returns the user</li>
 *   <li>{@code GET user} - bearer access token, returns the user</li>
 * </ul>
 *
 * <p>Every call sends the {@code apikey} header and carries the configured
 * timeout. Transport errors, timeouts, non-2xx statuses and unparseable
 * bodies all come back as {@link ProviderResult.Failure}.
 */
@ApplicationScoped
public class HttpIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(HttpIdentityProviderClient.class);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;
    private static final Set<String> INVALID_GRANT_CODES = Set.of(
            "invalid_grant", "bad_code_verifier", "flow_state_not_found", "flow_state_expired", "bad_oauth_state");
    private static final Set<String> DUPLICATE_CODES = Set.of("user_already_exists", "email_exists");

    private final WebClient webClient;
    private final IdentityProviderConfig config;

    @Inject
    public HttpIdentityProviderClient(Vertx vertx, IdentityProviderConfig config) {
        this(WebClient.create(vertx), config);
    }

    HttpIdentityProviderClient(WebClient webClient, IdentityProviderConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public URI authorizeUri(String provider, String challenge) {
        if (config.baseUrl().isEmpty()) {
            throw new IllegalStateException("gatehouse.auth.provider.base-url is not set");
        }
        return URI.create(baseUrl() + config.authorizePath()
                + "?provider=" + urlEncode(provider)
                + "&redirect_to=" + urlEncode(config.redirectUri())
                + "&code_challenge=" + urlEncode(challenge)
                + "&code_challenge_method=" + PkceService.CHALLENGE_METHOD);
    }

    @Override
    public Uni<ProviderResult<TokenSet>> exchangeCode(String code, String verifier) {
        final var body = new JsonObject().put("auth_code", code).put("code_verifier", verifier);
        return send("code exchange", () -> tokenRequest("pkce"), body, response -> {
            if (isSuccess(response)) {
                return parseSession(response);
            }
            final var error = describe(response);
            final var kind = INVALID_GRANT_CODES.stream().anyMatch(error::contains)
                    ? AuthErrorKind.INVALID_GRANT
                    : AuthErrorKind.PROVIDER_ERROR;
            return ProviderResult.failure(kind, "HTTP " + response.statusCode() + ": " + error);
        });
    }

    @Override
    public Uni<ProviderResult<TokenSet>> passwordGrant(String email, String password) {
        final var body = new JsonObject().put("email", email).put("password", password);
        return send("password grant", () -> tokenRequest("password"), body, response -> {
            if (isSuccess(response)) {
                return parseSession(response);
            }
            return ProviderResult.failure(
                    isClientError(response) ? AuthErrorKind.INVALID_CREDENTIALS : AuthErrorKind.PROVIDER_ERROR,
                    "HTTP " + response.statusCode() + ": " + describe(response));
        });
    }

    @Override
    public Uni<ProviderResult<SubjectRef>> passwordSignup(String email, String password) {
        final var body = new JsonObject().put("email", email).put("password", password);
        return send("signup", () -> webClient.postAbs(baseUrl() + config.signupPath()), body, response -> {
            if (isSuccess(response)) {
                return parseUser(response);
            }
            final var error = describe(response);
            if (DUPLICATE_CODES.stream().anyMatch(error::contains) || error.contains("already registered")) {
                return ProviderResult.failure(AuthErrorKind.DUPLICATE_ACCOUNT, error);
            }
            return ProviderResult.failure(
                    isClientError(response) ? AuthErrorKind.VALIDATION_ERROR : AuthErrorKind.PROVIDER_ERROR,
                    "HTTP " + response.statusCode() + ": " + error);
        });
    }

    @Override
    public Uni<ProviderResult<SubjectRef>> verify(String accessToken) {
        final Supplier<HttpRequest<Buffer>> request = () -> webClient
                .getAbs(baseUrl() + config.userPath())
                .putHeader("Authorization", "Bearer " + accessToken);
        return send("token verification", request, null, response -> {
            if (isSuccess(response)) {
                return parseUser(response);
            }
            if (response.statusCode() == 401 || response.statusCode() == 403) {
                final var error = describe(response);
                return ProviderResult.failure(
                        error.contains("expired") ? AuthErrorKind.TOKEN_EXPIRED : AuthErrorKind.TOKEN_INVALID, error);
            }
            return ProviderResult.failure(
                    AuthErrorKind.PROVIDER_ERROR, "HTTP " + response.statusCode() + ": " + describe(response));
        });
    }

    @Override
    public Uni<ProviderResult<TokenSet>> refresh(String refreshToken) {
        final var body = new JsonObject().put("refresh_token", refreshToken);
        return send("token refresh", () -> tokenRequest("refresh_token"), body, response -> {
            if (isSuccess(response)) {
                return parseSession(response);
            }
            return ProviderResult.failure(
                    isClientError(response) ? AuthErrorKind.TOKEN_INVALID : AuthErrorKind.PROVIDER_ERROR,
                    "HTTP " + response.statusCode() + ": " + describe(response));
        });
    }

    private HttpRequest<Buffer> tokenRequest(String grantType) {
        return webClient.postAbs(baseUrl() + config.tokenPath()).addQueryParam("grant_type", grantType);
    }

    private <T> Uni<ProviderResult<T>> send(
            String operation,
            Supplier<HttpRequest<Buffer>> requestFactory,
            JsonObject body,
            Function<HttpResponse<Buffer>, ProviderResult<T>> handler) {
        if (config.baseUrl().isEmpty()) {
            return Uni.createFrom()
                    .item(ProviderResult.failure(AuthErrorKind.PROVIDER_ERROR, "Identity provider base URL not set"));
        }
        final var timeout = config.timeout();
        final var request = requestFactory.get();
        request.timeout(timeout.toMillis()).putHeader("Accept", "application/json");
        config.apiKey().ifPresent(key -> request.putHeader("apikey", key));

        LOG.debugf("Calling identity provider: %s", operation);
        final Uni<HttpResponse<Buffer>> call = body == null ? request.send() : request.sendJsonObject(body);
        return call.ifNoItem()
                .after(timeout)
                .fail()
                .map(response -> {
                    try {
                        return handler.apply(response);
                    } catch (RuntimeException e) {
                        LOG.warnf("Malformed %s response from identity provider: %s", operation, e.getMessage());
                        return ProviderResult.<T>failure(AuthErrorKind.PROVIDER_ERROR, "Malformed response");
                    }
                })
                .onFailure()
                .recoverWithItem(error -> {
                    if (isTimeout(error)) {
                        LOG.warnf("Identity provider %s timed out after %s", operation, timeout);
                        return ProviderResult.failure(AuthErrorKind.NETWORK_TIMEOUT, "Timed out after " + timeout);
                    }
                    LOG.warnf("Identity provider %s failed: %s", operation, error.getMessage());
                    return ProviderResult.failure(AuthErrorKind.PROVIDER_ERROR, String.valueOf(error.getMessage()));
                });
    }

    private ProviderResult<TokenSet> parseSession(HttpResponse<Buffer> response) {
        final var json = response.bodyAsJsonObject();
        final var user = json.getJsonObject("user");
        if (json.getString("access_token") == null || json.getString("refresh_token") == null || user == null) {
            return ProviderResult.failure(AuthErrorKind.PROVIDER_ERROR, "Session response missing tokens or user");
        }
        return ProviderResult.success(new TokenSet(
                json.getString("access_token"),
                json.getString("refresh_token"),
                user.getString("id"),
                user.getString("email"),
                providerOf(user),
                Instant.now(),
                json.getLong("expires_in", DEFAULT_EXPIRES_IN_SECONDS)));
    }

    private ProviderResult<SubjectRef> parseUser(HttpResponse<Buffer> response) {
        final var json = response.bodyAsJsonObject();
        // signup may wrap the user when auto-confirm returns a session
        final var user = json.containsKey("user") ? json.getJsonObject("user") : json;
        final var id = user == null ? null : user.getString("id");
        if (id == null || id.isBlank()) {
            return ProviderResult.failure(AuthErrorKind.PROVIDER_ERROR, "User response missing id");
        }
        return ProviderResult.success(new SubjectRef(id, user.getString("email"), providerOf(user)));
    }

    private static String providerOf(JsonObject user) {
        final var metadata = user.getJsonObject("app_metadata");
        return metadata == null ? null : metadata.getString("provider");
    }

    /**
     * Lower-cased concatenation of the provider's error fields, for classification and logs.
     */
    private static String describe(HttpResponse<Buffer> response) {
        final var raw = response.bodyAsString();
        if (raw == null || raw.isBlank()) {
            return "";
        }
        try {
            final var json = new JsonObject(raw);
            final var parts = new StringBuilder();
            for (String field : new String[] {"error", "error_code", "code", "error_description", "msg", "message"}) {
                final var value = json.getValue(field);
                if (value != null) {
                    parts.append(value).append(' ');
                }
            }
            return parts.toString().trim().toLowerCase(Locale.ROOT);
        } catch (RuntimeException e) {
            return raw.length() > 200 ? raw.substring(0, 200) : raw;
        }
    }

    private static boolean isSuccess(HttpResponse<Buffer> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    private static boolean isClientError(HttpResponse<Buffer> response) {
        return response.statusCode() >= 400 && response.statusCode() < 500;
    }

    /**
     * True for the Mutiny deadline, the Vert.x request timeout and the Netty
     * connect timeout, anywhere in the cause chain.
     */
    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof io.smallrye.mutiny.TimeoutException
                    || t instanceof NoStackTraceTimeoutException
                    || t instanceof ConnectTimeoutException
                    || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private String baseUrl() {
        final var base = config.baseUrl().orElse("");
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
