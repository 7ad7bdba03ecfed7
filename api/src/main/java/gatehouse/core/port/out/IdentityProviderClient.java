package gatehouse.core.port.out;

import java.net.URI;

import io.smallrye.mutiny.Uni;

import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.auth.TokenSet;

/**
 * Port for the identity provider's HTTP API.
 *
 * <p>Every network operation is stateless, carries a fixed timeout, performs
 * no retries, and reports failure as a {@link ProviderResult.Failure} rather
 * than a failed {@link Uni}. Input validation is the caller's job; these
 * methods assume well-formed arguments.
 */
public interface IdentityProviderClient {

    /**
     * Build the browser redirect that starts a social login.
     *
     * @param provider  social provider name (e.g. google)
     * @param challenge PKCE S256 challenge
     * @return absolute authorize URL
     */
    URI authorizeUri(String provider, String challenge);

    /**
     * Exchange an authorization code plus its PKCE verifier for tokens.
     *
     * <p>Failure kinds: INVALID_GRANT, NETWORK_TIMEOUT, PROVIDER_ERROR.
     */
    Uni<ProviderResult<TokenSet>> exchangeCode(String code, String verifier);

    /**
     * Resource-owner password grant.
     *
     * <p>Failure kinds: INVALID_CREDENTIALS, NETWORK_TIMEOUT, PROVIDER_ERROR.
     */
    Uni<ProviderResult<TokenSet>> passwordGrant(String email, String password);

    /**
     * Register a new email/password account.
     *
     * <p>Failure kinds: DUPLICATE_ACCOUNT, VALIDATION_ERROR, NETWORK_TIMEOUT, PROVIDER_ERROR.
     */
    Uni<ProviderResult<SubjectRef>> passwordSignup(String email, String password);

    /**
     * Resolve the subject an access token belongs to.
     *
     * <p>Failure kinds: TOKEN_INVALID, TOKEN_EXPIRED, NETWORK_TIMEOUT, PROVIDER_ERROR.
     */
    Uni<ProviderResult<SubjectRef>> verify(String accessToken);

    /**
     * Trade a refresh token for a new token set.
     *
     * <p>Failure kinds: TOKEN_INVALID, NETWORK_TIMEOUT, PROVIDER_ERROR.
     */
    Uni<ProviderResult<TokenSet>> refresh(String refreshToken);
}
