package gatehouse.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for ephemeral PKCE login session storage.
 *
 * <p>Holds the PKCE verifier, and only the verifier, under an opaque handle
 * for the lifetime of one in-flight OAuth login.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Entries MUST expire automatically after their TTL</li>
 *   <li>{@link #consume} MUST be atomic per handle: of two concurrent calls
 *       for the same handle at most one returns the verifier</li>
 *   <li>{@link #consume} MUST remove the entry whether or not the caller's
 *       subsequent exchange succeeds</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 */
public interface AuthSessionRepository {

    /**
     * Store a verifier under a handle.
     *
     * @param handle   opaque handle (used as key)
     * @param verifier PKCE code verifier
     * @param ttl      how long the entry stays usable
     * @return Uni completing when stored
     */
    Uni<Void> store(String handle, String verifier, Duration ttl);

    /**
     * Retrieve and delete a verifier (single use).
     *
     * @param handle opaque handle
     * @return Uni with the verifier, or empty if absent, consumed or expired
     */
    Uni<Optional<String>> consume(String handle);
}
