package gatehouse.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.auth.TokenSet;
import gatehouse.core.port.in.SessionManagement;
import gatehouse.core.port.out.IdentityProviderClient;

/**
 * Verifies and refreshes tokens held in the auth cookies.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final IdentityProviderClient provider;

    @Inject
    public SessionService(IdentityProviderClient provider) {
        this.provider = provider;
    }

    @Override
    public Uni<ProviderResult<SubjectRef>> currentSubject(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return Uni.createFrom().item(ProviderResult.<SubjectRef>failure(AuthErrorKind.TOKEN_INVALID, "no access token"));
        }
        return provider.verify(accessToken).onFailure().recoverWithItem(error -> {
            LOG.warnf(error, "Token verification failed unexpectedly");
            return ProviderResult.<SubjectRef>failure(AuthErrorKind.PROVIDER_ERROR, error.getMessage());
        });
    }

    @Override
    public Uni<ProviderResult<TokenSet>> refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Uni.createFrom().item(ProviderResult.<TokenSet>failure(AuthErrorKind.TOKEN_INVALID, "no refresh token"));
        }
        return provider.refresh(refreshToken)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Token refresh failed unexpectedly");
                    return ProviderResult.<TokenSet>failure(AuthErrorKind.PROVIDER_ERROR, error.getMessage());
                })
                .invoke(result -> {
                    if (result instanceof ProviderResult.Failure<TokenSet> failure) {
                        LOG.debugf("Token refresh rejected: %s", failure.kind());
                    }
                });
    }
}
