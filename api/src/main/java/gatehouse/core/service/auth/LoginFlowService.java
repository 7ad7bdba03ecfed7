package gatehouse.core.service.auth;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.config.IdentityProviderConfig;
import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.auth.LoginInitiation;
import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.auth.TokenSet;
import gatehouse.core.model.flow.LoginFlow;
import gatehouse.core.model.flow.LoginFlowException;
import gatehouse.core.model.flow.LoginFlowState;
import gatehouse.core.model.flow.LoginOutcome;
import gatehouse.core.model.flow.SignupOutcome;
import gatehouse.core.port.in.LoginManagement;
import gatehouse.core.port.out.IdentityProviderClient;
import gatehouse.core.port.out.LoginMetrics;
import gatehouse.core.service.profile.ProfileResolver;
import gatehouse.core.service.routing.RoutingDecisionEngine;

/**
 * Drives OAuth and password logins through {@link LoginFlowState}.
 *
 * <p>The OAuth callback always consumes the PKCE session first, before
 * looking at the provider's parameters, so no callback leaves a usable
 * handle behind. A consumed handle is never restored: a timed-out or
 * rejected exchange sends the user back to login-initiate.
 */
@ApplicationScoped
public class LoginFlowService implements LoginManagement {

    private static final Logger LOG = Logger.getLogger(LoginFlowService.class);
    private static final String OAUTH = "oauth";
    private static final String PASSWORD = "password";

    private final PkceService pkceService;
    private final AuthSessionService sessions;
    private final IdentityProviderClient provider;
    private final ProfileResolver profileResolver;
    private final RoutingDecisionEngine routing;
    private final CredentialValidator validator;
    private final IdentityProviderConfig providerConfig;
    private final LoginMetrics metrics;

    @Inject
    public LoginFlowService(
            PkceService pkceService,
            AuthSessionService sessions,
            IdentityProviderClient provider,
            ProfileResolver profileResolver,
            RoutingDecisionEngine routing,
            CredentialValidator validator,
            IdentityProviderConfig providerConfig,
            LoginMetrics metrics) {
        this.pkceService = pkceService;
        this.sessions = sessions;
        this.provider = provider;
        this.profileResolver = profileResolver;
        this.routing = routing;
        this.validator = validator;
        this.providerConfig = providerConfig;
        this.metrics = metrics;
    }

    @Override
    public Uni<LoginInitiation> initiate(String providerName) {
        final var name = providerName == null ? "" : providerName.trim().toLowerCase(Locale.ROOT);
        if (!providerConfig.allowedProviders().contains(name)) {
            LOG.debugf("Rejected login for unsupported provider: %s", providerName);
            return Uni.createFrom()
                    .failure(new LoginFlowException(
                            AuthErrorKind.UNSUPPORTED_PROVIDER, "Unsupported provider: " + providerName));
        }

        metrics.recordAttempt(OAUTH);
        final var pair = pkceService.generatePair();
        return sessions.put(pair.verifier())
                .map(handle -> {
                    LOG.debugf("Initiated %s login, session %s", name, prefix(handle));
                    return new LoginInitiation(handle, provider.authorizeUri(name, pair.challenge()));
                })
                .onFailure(error -> !(error instanceof LoginFlowException))
                .transform(error -> {
                    LOG.warnf(error, "Could not store PKCE session for %s login", name);
                    metrics.recordOutcome(OAUTH, AuthErrorKind.SERVER_ERROR.code());
                    return new LoginFlowException(
                            AuthErrorKind.SERVER_ERROR, "PKCE session storage unavailable", error);
                });
    }

    @Override
    public Uni<LoginOutcome> completeCallback(String sessionHandle, String code, String providerError) {
        final var flow = LoginFlow.resumeFromProvider();
        return sessions.take(sessionHandle).onItemOrFailure().transformToUni((verifier, error) -> {
            if (error != null) {
                // same classification as a store failure on initiate
                LOG.warnf(error, "PKCE session lookup failed for %s", prefix(sessionHandle));
                return failed(flow, OAUTH, AuthErrorKind.SERVER_ERROR);
            }
            if (providerError != null && !providerError.isBlank()) {
                LOG.debugf("Provider returned error on callback: %s", providerError);
                return failed(flow, OAUTH, AuthErrorKind.PROVIDER_DENIED);
            }
            if (code == null || code.isBlank()) {
                return failed(flow, OAUTH, AuthErrorKind.MISSING_CODE);
            }
            if (verifier.isEmpty()) {
                LOG.debugf("PKCE session %s missing or expired", prefix(sessionHandle));
                return failed(flow, OAUTH, AuthErrorKind.SESSION_EXPIRED);
            }
            flow.advance(LoginFlowState.CODE_RECEIVED).advance(LoginFlowState.EXCHANGING);
            return exchange(flow, OAUTH, provider.exchangeCode(code, verifier.get()));
        });
    }

    @Override
    public Uni<LoginOutcome> passwordLogin(String email, String password) {
        final var flow = LoginFlow.start();
        metrics.recordAttempt(PASSWORD);
        final var normalized = validator.normalizeEmail(email).orElse(null);
        if (!validator.isValidEmail(normalized) || !validator.isValidPassword(password)) {
            return failed(flow, PASSWORD, AuthErrorKind.VALIDATION_ERROR);
        }
        flow.advance(LoginFlowState.EXCHANGING);
        return exchange(flow, PASSWORD, provider.passwordGrant(normalized, password));
    }

    @Override
    public Uni<SignupOutcome> passwordSignup(String email, String password) {
        final var normalized = validator.normalizeEmail(email).orElse(null);
        if (!validator.isValidEmail(normalized) || !validator.isValidPassword(password)) {
            return Uni.createFrom().item((SignupOutcome) new SignupOutcome.Rejected(AuthErrorKind.VALIDATION_ERROR));
        }
        return guard(provider.passwordSignup(normalized, password)).map(result -> {
            if (result instanceof ProviderResult.Success<SubjectRef> success) {
                LOG.infof("Registered account for subject %s", success.value().subjectId());
                return new SignupOutcome.Registered(success.value());
            }
            final var failure = (ProviderResult.Failure<SubjectRef>) result;
            logProviderFailure("signup", failure);
            return (SignupOutcome) new SignupOutcome.Rejected(failure.kind());
        });
    }

    private Uni<LoginOutcome> exchange(LoginFlow flow, String method, Uni<ProviderResult<TokenSet>> call) {
        return guard(call).flatMap(result -> {
            if (result instanceof ProviderResult.Failure<TokenSet> failure) {
                logProviderFailure(method, failure);
                return failed(flow, method, failure.kind());
            }
            final var tokens = ((ProviderResult.Success<TokenSet>) result).value();
            return resolveAndRoute(flow, method, tokens);
        });
    }

    private Uni<LoginOutcome> resolveAndRoute(LoginFlow flow, String method, TokenSet tokens) {
        return profileResolver
                .resolveOrCreate(tokens.subjectId(), tokens.email())
                .map(resolution -> {
                    flow.advance(LoginFlowState.PROFILE_RESOLVED);
                    final var decision =
                            routing.decide(resolution.existedBefore(), resolution.profile().onboarded());
                    flow.advance(LoginFlowState.ROUTED);
                    LOG.infof(
                            "Login via %s for subject %s routed to %s (%s)",
                            method, tokens.subjectId(), decision.destination(), decision.state());
                    metrics.recordOutcome(method, decision.state().name().toLowerCase(Locale.ROOT));
                    return LoginOutcome.routed(tokens, decision, flow);
                })
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.warnf(error, "Profile resolution failed for subject %s", tokens.subjectId());
                    return failed(flow, method, AuthErrorKind.SERVER_ERROR);
                });
    }

    private Uni<LoginOutcome> failed(LoginFlow flow, String method, AuthErrorKind kind) {
        flow.fail(kind);
        metrics.recordOutcome(method, kind.code());
        return Uni.createFrom().item(LoginOutcome.failed(flow));
    }

    /**
     * Adapters report failures as results; anything thrown anyway becomes a provider error.
     */
    private static <T> Uni<ProviderResult<T>> guard(Uni<ProviderResult<T>> call) {
        return call.onFailure().recoverWithItem(error -> {
            LOG.warnf(error, "Identity provider call failed unexpectedly");
            return ProviderResult.<T>failure(AuthErrorKind.PROVIDER_ERROR, error.getMessage());
        });
    }

    private static void logProviderFailure(String operation, ProviderResult.Failure<?> failure) {
        if (failure.kind().isUpstreamFailure()) {
            LOG.warnf("Identity provider %s failed: %s (%s)", operation, failure.kind(), failure.detail());
        } else {
            LOG.debugf("Identity provider %s rejected: %s (%s)", operation, failure.kind(), failure.detail());
        }
    }

    static String prefix(String value) {
        if (value == null) {
            return "<none>";
        }
        return value.length() <= 8 ? value : value.substring(0, 8) + "...";
    }
}
