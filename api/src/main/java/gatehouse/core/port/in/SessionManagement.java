package gatehouse.core.port.in;

import io.smallrye.mutiny.Uni;

import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.auth.TokenSet;

/**
 * Port interface for operations on an established cookie session.
 */
public interface SessionManagement {

    /**
     * Resolve who the access token belongs to.
     *
     * @param accessToken token from the access cookie, may be null
     */
    Uni<ProviderResult<SubjectRef>> currentSubject(String accessToken);

    /**
     * Obtain a new token set from a refresh token.
     *
     * @param refreshToken token from the refresh cookie, may be null
     */
    Uni<ProviderResult<TokenSet>> refresh(String refreshToken);
}
