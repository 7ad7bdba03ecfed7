package gatehouse.core.port.in;

import io.smallrye.mutiny.Uni;

import gatehouse.core.model.auth.LoginInitiation;
import gatehouse.core.model.flow.LoginOutcome;
import gatehouse.core.model.flow.SignupOutcome;

/**
 * Port interface for the login flows.
 */
public interface LoginManagement {

    /**
     * Start an OAuth login: create a PKCE pair, store the verifier and build the provider redirect.
     *
     * @param provider social provider name
     * @return the stored handle and authorize URL, or a failure carrying an
     *         {@link gatehouse.core.model.flow.LoginFlowException}
     */
    Uni<LoginInitiation> initiate(String provider);

    /**
     * Finish an OAuth login from the provider's callback.
     *
     * @param sessionHandle handle from the PKCE session cookie, may be null
     * @param code          authorization code, may be null
     * @param providerError error reported by the provider instead of a code, may be null
     * @return routed or failed outcome; never a failed Uni for expected errors
     */
    Uni<LoginOutcome> completeCallback(String sessionHandle, String code, String providerError);

    /**
     * Email/password login.
     */
    Uni<LoginOutcome> passwordLogin(String email, String password);

    /**
     * Email/password registration.
     */
    Uni<SignupOutcome> passwordSignup(String email, String password);
}
