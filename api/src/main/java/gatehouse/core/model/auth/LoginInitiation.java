package gatehouse.core.model.auth;

import java.net.URI;

/**
 * Result of starting an OAuth login.
 *
 * @param sessionHandle opaque handle under which the verifier is stored
 * @param authorizeUri  provider URL the browser is redirected to
 */
public record LoginInitiation(String sessionHandle, URI authorizeUri) {}
